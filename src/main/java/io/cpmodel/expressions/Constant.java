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

/** An integer constant. */
public final class Constant extends Expression {
  public static Constant of(long value) {
    return new Constant(value);
  }

  private Constant(long value) {
    this.value = value;
  }

  public long get() {
    return value;
  }

  @Override
  public String name() {
    return Long.toString(value);
  }

  @Override
  public ImmutableList<Expression> args() {
    return ImmutableList.of();
  }

  @Override
  public boolean isBool() {
    return false;
  }

  @Override
  public long[] bounds() {
    return new long[] {value, value};
  }

  @Override
  public Long value() {
    return value;
  }

  @Override
  public Expression withArgs(List<Expression> newArgs) {
    return this;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Constant && ((Constant) o).value == value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return name();
  }

  private final long value;
}
