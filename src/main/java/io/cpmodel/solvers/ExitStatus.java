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

/** Outcome of a solve call. */
public enum ExitStatus {
  /** No solve has been run yet. */
  NOT_RUN,
  /** A solution was found, not proven optimal or no objective. */
  FEASIBLE,
  /** An optimal solution was found, or all solutions were enumerated. */
  OPTIMAL,
  /** The model was proven to have no solution. */
  UNSATISFIABLE,
  /** The search stopped without finding a solution or proving there is none. */
  UNKNOWN,
}
