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
import com.google.ortools.sat.Constraint;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.LinearArgument;
import java.util.List;
import java.util.function.Function;

/**
 * A constraint posted by a callback on the native OR-Tools model, passed through the
 * transformations untouched. The callback receives the model and the mapping from expressions
 * to their native handles.
 *
 * <p>For example:
 *
 * <pre>{@code
 * new DirectConstraint(
 *     "addAllDifferent",
 *     (model, handles) -> model.addAllDifferent(new LinearArgument[] {handles.apply(x), ...}),
 *     ImmutableList.of(x, ...));
 * }</pre>
 */
public final class DirectConstraint extends Expression {
  /** Posts the constraint on the native model. */
  @FunctionalInterface
  public interface NativePoster {
    Constraint post(CpModel model, Function<Expression, LinearArgument> handles);
  }

  /**
   * @param name shown when printing the constraint
   * @param poster the native call
   * @param args the expressions the poster refers to
   */
  public DirectConstraint(String name, NativePoster poster, List<? extends Expression> args) {
    this.name = name;
    this.poster = poster;
    this.args = ImmutableList.copyOf(args);
  }

  public Constraint post(CpModel model, Function<Expression, LinearArgument> handles) {
    return poster.post(model, handles);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public ImmutableList<Expression> args() {
    return args;
  }

  @Override
  public boolean isBool() {
    return true;
  }

  @Override
  public long[] bounds() {
    return new long[] {0, 1};
  }

  /** Native constraints cannot be evaluated. */
  @Override
  public Long value() {
    return null;
  }

  @Override
  public Expression withArgs(List<Expression> newArgs) {
    return this;
  }

  @Override
  public String toString() {
    return name + args;
  }

  private final String name;
  private final NativePoster poster;
  private final ImmutableList<Expression> args;
}
