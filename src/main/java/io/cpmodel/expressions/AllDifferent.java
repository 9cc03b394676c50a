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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** All arguments take pairwise different values. */
public final class AllDifferent extends GlobalConstraint {
  public AllDifferent(List<? extends Expression> exprs) {
    super("alldifferent", exprs);
  }

  @Override
  public Decomposition decompose() {
    List<Expression> constraints = new ArrayList<>();
    List<Expression> args = args();
    for (int i = 0; i < args.size(); ++i) {
      for (int j = i + 1; j < args.size(); ++j) {
        constraints.add(args.get(i).ne(args.get(j)));
      }
    }
    return Decomposition.of(constraints);
  }

  @Override
  public Long value() {
    long[] vals = valuesOf(args());
    if (vals == null) {
      return null;
    }
    Set<Long> seen = new HashSet<>();
    for (long v : vals) {
      if (!seen.add(v)) {
        return 0L;
      }
    }
    return 1L;
  }

  @Override
  public AllDifferent withArgs(List<Expression> newArgs) {
    return new AllDifferent(newArgs);
  }
}
