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
import com.google.ortools.sat.CpSolverSolutionCallback;
import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.Literal;
import io.cpmodel.expressions.BoolVar;
import io.cpmodel.expressions.Variable;
import java.util.Map;

/**
 * Writes each solution found during enumeration into the variables, runs the display hook and
 * stops the search at the solution limit.
 */
final class OrToolsSolutionPrinter extends CpSolverSolutionCallback {
  OrToolsSolutionPrinter(
      Map<Variable, LinearArgument> handles,
      Iterable<Variable> variables,
      Runnable display,
      Integer solutionLimit) {
    this.handles = handles;
    this.variables = ImmutableList.copyOf(variables);
    this.display = display;
    this.solutionLimit = solutionLimit;
  }

  @Override
  public void onSolutionCallback() {
    for (Variable v : variables) {
      LinearArgument handle = handles.get(v);
      if (v instanceof BoolVar) {
        ((BoolVar) v).setBooleanValue(booleanValue((Literal) handle));
      } else {
        v.setValue(value(handle.build()));
      }
    }
    solutionCount++;
    if (display != null) {
      display.run();
    }
    if (solutionLimit != null && solutionCount >= solutionLimit) {
      stopSearch();
    }
  }

  public int getSolutionCount() {
    return solutionCount;
  }

  private int solutionCount;
  private final Map<Variable, LinearArgument> handles;
  private final ImmutableList<Variable> variables;
  private final Runnable display;
  private final Integer solutionLimit;
}
