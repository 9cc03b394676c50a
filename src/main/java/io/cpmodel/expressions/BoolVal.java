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

/** The Boolean constants. */
public final class BoolVal extends Expression {
  public static final BoolVal TRUE = new BoolVal(true);
  public static final BoolVal FALSE = new BoolVal(false);

  public static BoolVal of(boolean value) {
    return value ? TRUE : FALSE;
  }

  private BoolVal(boolean value) {
    this.value = value;
  }

  public boolean get() {
    return value;
  }

  @Override
  public String name() {
    return value ? "true" : "false";
  }

  @Override
  public ImmutableList<Expression> args() {
    return ImmutableList.of();
  }

  @Override
  public boolean isBool() {
    return true;
  }

  @Override
  public long[] bounds() {
    long v = value ? 1 : 0;
    return new long[] {v, v};
  }

  @Override
  public Long value() {
    return value ? 1L : 0L;
  }

  @Override
  public BoolVal not() {
    return of(!value);
  }

  @Override
  public Expression withArgs(List<Expression> newArgs) {
    return this;
  }

  @Override
  public String toString() {
    return name();
  }

  private final boolean value;
}
