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

package io.cpmodel.transformations;

import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Variable;
import java.util.HashMap;
import java.util.Map;

/**
 * Common sub-expression map: from an expression, compared structurally, to the auxiliary variable
 * standing for it. Entries are never removed, so each distinct sub-expression gets at most one
 * auxiliary variable.
 */
public final class CseMap {
  /** Returns the variable for {@code expr}, or null. */
  public Variable get(Expression expr) {
    return map.get(expr);
  }

  public void put(Expression expr, Variable var) {
    map.put(expr, var);
  }

  public boolean contains(Expression expr) {
    return map.containsKey(expr);
  }

  public int size() {
    return map.size();
  }

  private final Map<Expression, Variable> map = new HashMap<>();
}
