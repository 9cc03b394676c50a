// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.cpmodel.expressions;

import java.util.ArrayList;
import java.util.List;

/** All arguments take the same value. */
public final class AllEqual extends GlobalConstraint {
  public AllEqual(List<? extends Expression> exprs) {
    super("allequal", exprs);
  }

  @Override
  public Decomposition decompose() {
    List<Expression> constraints = new ArrayList<>();
    List<Expression> args = args();
    for (int i = 1; i < args.size(); ++i) {
      constraints.add(args.get(0).eq(args.get(i)));
    }
    return Decomposition.of(constraints);
  }

  @Override
  public Long value() {
    long[] vals = valuesOf(args());
    if (vals == null) {
      return null;
    }
    for (long v : vals) {
      if (v != vals[0]) {
        return 0L;
      }
    }
    return 1L;
  }

  @Override
  public AllEqual withArgs(List<Expression> newArgs) {
    return new AllEqual(newArgs);
  }
}
