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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** The number of array entries equal to a value. */
public final class Count extends GlobalFunction {
  public Count(List<? extends Expression> array, Expression value) {
    super("count", ImmutableList.<Expression>builder().addAll(array).add(value).build());
  }

  public List<Expression> array() {
    return args().subList(0, args().size() - 1);
  }

  public Expression counted() {
    return args().get(args().size() - 1);
  }

  @Override
  public long[] bounds() {
    return new long[] {0, array().size()};
  }

  @Override
  public FunctionDecomposition decompose() {
    List<Expression> matches = new ArrayList<>();
    for (Expression e : array()) {
      matches.add(e.eq(counted()));
    }
    return new FunctionDecomposition(Expressions.sum(matches), ImmutableList.of());
  }

  @Override
  public Long value() {
    long[] vals = GlobalConstraint.valuesOf(args());
    if (vals == null) {
      return null;
    }
    long target = vals[vals.length - 1];
    long count = 0;
    for (int i = 0; i < vals.length - 1; ++i) {
      if (vals[i] == target) {
        ++count;
      }
    }
    return count;
  }

  @Override
  public Count withArgs(List<Expression> newArgs) {
    return new Count(newArgs.subList(0, newArgs.size() - 1), newArgs.get(newArgs.size() - 1));
  }
}
