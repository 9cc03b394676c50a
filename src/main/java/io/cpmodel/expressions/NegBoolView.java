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

/**
 * The complement of a Boolean variable. It holds no value of its own: values and solver handles
 * derive from the underlying variable.
 */
public final class NegBoolView extends BoolVar {
  NegBoolView(BoolVar variable) {
    super("~" + variable.name());
    this.variable = variable;
  }

  /** Returns the negated variable. */
  public BoolVar variable() {
    return variable;
  }

  @Override
  public Long value() {
    Long v = variable.value();
    return v == null ? null : 1 - v;
  }

  @Override
  public void setValue(Long value) {
    variable.setValue(value == null ? null : 1 - value);
  }

  @Override
  public void clearValue() {
    variable.clearValue();
  }

  @Override
  public BoolVar not() {
    return variable;
  }

  private final BoolVar variable;
}
