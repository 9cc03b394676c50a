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

/** A Boolean variable. Its negation is a cached {@link NegBoolView}. */
public class BoolVar extends Variable {
  public BoolVar() {
    this(nextName("BV"));
  }

  public BoolVar(String name) {
    super(name, 0, 1);
  }

  @Override
  public boolean isBool() {
    return true;
  }

  /** Sets the solution value from a Boolean. Null clears it. */
  public void setBooleanValue(Boolean value) {
    setValue(value == null ? null : (value ? 1L : 0L));
  }

  /** Returns the negated view of this variable. Always the same object. */
  @Override
  public BoolVar not() {
    if (negation == null) {
      negation = new NegBoolView(this);
    }
    return negation;
  }

  private NegBoolView negation;
}
