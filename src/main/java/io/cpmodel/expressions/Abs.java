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
import java.util.List;

/** The absolute value of its argument. */
public final class Abs extends GlobalFunction {
  public Abs(Expression expr) {
    super("abs", ImmutableList.of(expr));
  }

  @Override
  public long[] bounds() {
    long lb = args().get(0).lb();
    long ub = args().get(0).ub();
    if (lb >= 0) {
      return new long[] {lb, ub};
    }
    if (ub <= 0) {
      return new long[] {-ub, -lb};
    }
    return new long[] {0, Math.max(-lb, ub)};
  }

  @Override
  public FunctionDecomposition decompose() {
    Expression arg = args().get(0);
    if (arg.lb() >= 0) {
      return new FunctionDecomposition(arg, ImmutableList.of());
    }
    if (arg.ub() <= 0) {
      return new FunctionDecomposition(arg.negate(), ImmutableList.of());
    }
    long[] bounds = bounds();
    IntVar abs = new IntVar(bounds[0], bounds[1]);
    Expression positive = arg.ge(0);
    return new FunctionDecomposition(
        abs,
        ImmutableList.of(
            Expressions.implies(positive, arg.eq(abs)),
            Expressions.implies(Expressions.not(positive), arg.negate().eq(abs))));
  }

  @Override
  public Long value() {
    Long v = args().get(0).value();
    return v == null ? null : Math.abs(v);
  }

  @Override
  public Abs withArgs(List<Expression> newArgs) {
    return new Abs(newArgs.get(0));
  }
}
