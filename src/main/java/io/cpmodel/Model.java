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

package io.cpmodel;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.cpmodel.expressions.Expression;
import io.cpmodel.solvers.SolverInterface;
import io.cpmodel.solvers.SolverLookup;
import io.cpmodel.solvers.SolverStatus;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A solver-independent list of constraints with an optional objective.
 *
 * <p>Each solve creates a fresh solver adapter, so the model can be changed and solved again.
 * The values found are written into the variables of the model.
 */
public final class Model {
  public Model() {}

  public Model(Expression... constraints) {
    add(constraints);
  }

  public Model add(Iterable<? extends Expression> newConstraints) {
    for (Expression c : newConstraints) {
      constraints.add(c);
    }
    return this;
  }

  public Model add(Expression... newConstraints) {
    return add(Arrays.asList(newConstraints));
  }

  public void minimize(Expression expr) {
    objective = expr;
    minimize = true;
  }

  public void maximize(Expression expr) {
    objective = expr;
    minimize = false;
  }

  public ImmutableList<Expression> constraints() {
    return ImmutableList.copyOf(constraints);
  }

  /** Returns the objective expression, or null for a satisfaction problem. */
  public Expression objective() {
    return objective;
  }

  public boolean isMinimize() {
    return minimize;
  }

  /** Solves with the default solver. */
  public boolean solve() {
    return solve(null, null);
  }

  /**
   * Solves the model.
   *
   * @param solverName a name known to {@link SolverLookup}, or null for the default
   * @param timeLimit in seconds, or null for none
   * @return true if a solution was found
   */
  public boolean solve(String solverName, Double timeLimit) {
    SolverInterface solver = SolverLookup.get(solverName, this);
    boolean found = solver.solve(timeLimit, null, ImmutableMap.of());
    status = solver.status();
    objectiveValue = solver.objectiveValue();
    return found;
  }

  /**
   * Enumerates the solutions of the model and returns their number.
   *
   * @param display run once per solution, or null
   * @param solutionLimit maximum number of solutions, or null for all
   */
  public int solveAll(String solverName, Runnable display, Integer solutionLimit) {
    SolverInterface solver = SolverLookup.get(solverName, this);
    int count = solver.solveAll(display, null, solutionLimit, ImmutableMap.of());
    status = solver.status();
    objectiveValue = null;
    return count;
  }

  public SolverStatus status() {
    return status;
  }

  public Number objectiveValue() {
    return objectiveValue;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Constraints:\n");
    for (Expression c : constraints) {
      sb.append("    ").append(c).append('\n');
    }
    if (objective != null) {
      sb.append(minimize ? "Minimizing:\n    " : "Maximizing:\n    ")
          .append(objective)
          .append('\n');
    }
    return sb.toString();
  }

  private final List<Expression> constraints = new ArrayList<>();
  private Expression objective;
  private boolean minimize = true;
  private SolverStatus status = SolverStatus.notRun("model");
  private Number objectiveValue;
}
