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
 * A decision variable. Variables compare by identity and carry the value found by the last
 * successful solve.
 */
public abstract class Variable extends Expression {
  Variable(String name, long lb, long ub) {
    this.name = name;
    this.lb = lb;
    this.ub = ub;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public ImmutableList<Expression> args() {
    return ImmutableList.of();
  }

  @Override
  public long[] bounds() {
    return new long[] {lb, ub};
  }

  @Override
  public long lb() {
    return lb;
  }

  @Override
  public long ub() {
    return ub;
  }

  @Override
  public Long value() {
    return value;
  }

  /** Sets the solution value. Called by solvers; null clears it. */
  public void setValue(Long value) {
    this.value = value;
  }

  public void clearValue() {
    this.value = null;
  }

  @Override
  public Expression withArgs(List<Expression> newArgs) {
    return this;
  }

  @Override
  public String toString() {
    return name;
  }

  static String nextName(String prefix) {
    return prefix + "#" + counter++;
  }

  private static long counter = 0;

  private final String name;
  private final long lb;
  private final long ub;
  private Long value;
}
