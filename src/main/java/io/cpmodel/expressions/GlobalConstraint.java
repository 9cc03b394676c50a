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

/**
 * A Boolean global constraint. Backends that do not support it natively use its decomposition
 * into simpler constraints.
 */
public abstract class GlobalConstraint extends Expression {
  protected GlobalConstraint(String name, List<? extends Expression> args) {
    this.name = name;
    this.args = ImmutableList.copyOf(args);
  }

  /** Returns an equivalent set of simpler constraints. */
  public abstract Decomposition decompose();

  /** Returns an equivalent compact form of the negation, or null if there is none. */
  public Expression negate() {
    return null;
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

  @Override
  public boolean equals(Object o) {
    return o != null && o.getClass() == getClass() && ((GlobalConstraint) o).args.equals(args);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + args.hashCode();
  }

  @Override
  public String toString() {
    return name + args;
  }

  /** Returns the values of {@code exprs}, or null if one is unknown. */
  static long[] valuesOf(List<Expression> exprs) {
    long[] result = new long[exprs.size()];
    for (int i = 0; i < result.length; ++i) {
      Long v = exprs.get(i).value();
      if (v == null) {
        return null;
      }
      result[i] = v;
    }
    return result;
  }

  static Long fromBoolean(boolean b) {
    return b ? 1L : 0L;
  }

  private final String name;
  private final ImmutableList<Expression> args;
}
