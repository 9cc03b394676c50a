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
 * A numeric global function, such as min or element. Backends that do not support it natively
 * replace it by the value expression of its decomposition.
 */
public abstract class GlobalFunction extends Expression {
  protected GlobalFunction(String name, List<? extends Expression> args) {
    this.name = name;
    this.args = ImmutableList.copyOf(args);
  }

  /** Returns an expression equal to this function and the constraints defining it. */
  public abstract FunctionDecomposition decompose();

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
    return false;
  }

  @Override
  public boolean equals(Object o) {
    return o != null && o.getClass() == getClass() && ((GlobalFunction) o).args.equals(args);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + args.hashCode();
  }

  @Override
  public String toString() {
    return name + args;
  }

  private final String name;
  private final ImmutableList<Expression> args;
}
