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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;

/** The smallest of its arguments. */
public final class Minimum extends GlobalFunction {
  public Minimum(List<? extends Expression> exprs) {
    super("min", exprs);
    checkArgument(!exprs.isEmpty(), "min needs at least one argument");
  }

  @Override
  public long[] bounds() {
    long lb = Long.MAX_VALUE;
    long ub = Long.MAX_VALUE;
    for (Expression arg : args()) {
      lb = Math.min(lb, arg.lb());
      ub = Math.min(ub, arg.ub());
    }
    return new long[] {lb, ub};
  }

  @Override
  public FunctionDecomposition decompose() {
    long[] bounds = bounds();
    IntVar min = new IntVar(bounds[0], bounds[1]);
    List<Expression> defining = new ArrayList<>();
    List<Expression> reached = new ArrayList<>();
    for (Expression arg : args()) {
      defining.add(min.le(arg));
      reached.add(min.eq(arg));
    }
    defining.add(Expressions.or(reached));
    return new FunctionDecomposition(min, defining);
  }

  @Override
  public Long value() {
    long[] vals = GlobalConstraint.valuesOf(args());
    if (vals == null) {
      return null;
    }
    long min = vals[0];
    for (long v : vals) {
      min = Math.min(min, v);
    }
    return min;
  }

  @Override
  public Minimum withArgs(List<Expression> newArgs) {
    return new Minimum(newArgs);
  }
}
