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

package io.cpmodel.solvers;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.cpmodel.expressions.BoolVar;
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Variable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An incremental solver backend. Constraints are transformed and posted when added, and the
 * values of the last solve are written back into the variables.
 */
public interface SolverInterface {
  /** Returns the name of the backend. */
  String name();

  /** Posts {@code constraints}. */
  SolverInterface add(Iterable<? extends Expression> constraints);

  SolverInterface add(Expression... constraints);

  /** Sets the objective, replacing any earlier one. */
  void objective(Expression expr, boolean minimize);

  default void minimize(Expression expr) {
    objective(expr, true);
  }

  default void maximize(Expression expr) {
    objective(expr, false);
  }

  boolean hasObjective();

  /**
   * Solves the model.
   *
   * @param timeLimit time limit in seconds, or null for none
   * @param assumptions Boolean variables assumed true for this solve only, or null
   * @param params native solver parameters, by name
   * @return true if a solution was found
   */
  boolean solve(Double timeLimit, List<? extends BoolVar> assumptions, Map<String, ?> params);

  default boolean solve() {
    return solve(null, null, ImmutableMap.of());
  }

  default boolean solve(double timeLimit) {
    return solve(timeLimit, null, ImmutableMap.of());
  }

  /**
   * Enumerates solutions and returns their number.
   *
   * @param display run once per solution, after the variable values are set, or null
   * @param solutionLimit stops after this many solutions, or null for all
   */
  int solveAll(
      Runnable display, Double timeLimit, Integer solutionLimit, Map<String, ?> params);

  default int solveAll() {
    return solveAll((Runnable) null, null, null, ImmutableMap.of());
  }

  default int solveAll(Integer solutionLimit) {
    return solveAll((Runnable) null, null, solutionLimit, ImmutableMap.of());
  }

  /** Enumerates solutions, printing the values of {@code display} for each one. */
  default int solveAll(
      List<? extends Expression> display,
      Double timeLimit,
      Integer solutionLimit,
      Map<String, ?> params) {
    return solveAll(
        () -> {
          List<Long> values = new ArrayList<>();
          for (Expression e : display) {
            values.add(e.value());
          }
          System.out.println(values);
        },
        timeLimit,
        solutionLimit,
        params);
  }

  /** Replaces the solution hint by {@code vars[i] = vals[i]}. */
  void solutionHint(List<? extends Variable> vars, List<? extends Number> vals);

  /** Returns assumption variables that together make the model unsatisfiable. */
  ImmutableList<BoolVar> getCore();

  SolverStatus status();

  /** Returns the objective value of the last solve: a Long when integral, else a Double. */
  Number objectiveValue();

  /** Returns the constraints as they are posted to the backend. */
  List<Expression> transform(Iterable<? extends Expression> constraints);

  /** Returns the variables of the added constraints and objective. */
  ImmutableSet<Variable> userVariables();
}
