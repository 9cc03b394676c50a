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

/** Status of the last solve: the solver that ran it, the exit status and the wall time. */
public final class SolverStatus {
  /** Returns the status before any solve. */
  public static SolverStatus notRun(String solverName) {
    return new SolverStatus(solverName, ExitStatus.NOT_RUN, 0.0);
  }

  public SolverStatus(String solverName, ExitStatus exitStatus, double runtime) {
    this.solverName = solverName;
    this.exitStatus = exitStatus;
    this.runtime = runtime;
  }

  public String solverName() {
    return solverName;
  }

  public ExitStatus exitStatus() {
    return exitStatus;
  }

  /** Wall time of the solve, in seconds. */
  public double runtime() {
    return runtime;
  }

  /** Returns true if a solution is available. */
  public boolean hasSolution() {
    return exitStatus == ExitStatus.FEASIBLE || exitStatus == ExitStatus.OPTIMAL;
  }

  @Override
  public String toString() {
    return String.format("SolverStatus(%s): %s (%.3f seconds)", solverName, exitStatus, runtime);
  }

  private final String solverName;
  private final ExitStatus exitStatus;
  private final double runtime;
}
