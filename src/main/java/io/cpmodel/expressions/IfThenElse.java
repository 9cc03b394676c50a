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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** If {@code condition} holds then {@code then} must hold, otherwise {@code other}. */
public final class IfThenElse extends GlobalConstraint {
  public IfThenElse(Expression condition, Expression then, Expression other) {
    super("ite", ImmutableList.of(condition, then, other));
    checkArgument(
        condition.isBool() && then.isBool() && other.isBool(),
        "ite expects Boolean arguments");
  }

  @Override
  public Decomposition decompose() {
    Expression condition = args().get(0);
    return Decomposition.of(
        ImmutableList.of(
            Expressions.implies(condition, args().get(1)),
            Expressions.implies(Expressions.not(condition), args().get(2))));
  }

  @Override
  public Long value() {
    Long c = args().get(0).value();
    if (c == null) {
      return null;
    }
    return c != 0 ? args().get(1).value() : args().get(2).value();
  }

  @Override
  public IfThenElse withArgs(List<Expression> newArgs) {
    return new IfThenElse(newArgs.get(0), newArgs.get(1), newArgs.get(2));
  }
}
