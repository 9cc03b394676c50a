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

package io.cpmodel.exceptions;

/**
 * An expression kind that a transformation or the backend dispatch does not handle. Carries the
 * offending expression.
 */
public class UnsupportedExpressionException extends CpmException {
  public UnsupportedExpressionException(String methodName, String msg, Object expression) {
    super(methodName, msg + ": " + expression);
    this.expression = expression;
  }

  public Object getExpression() {
    return expression;
  }

  private final Object expression;
}
