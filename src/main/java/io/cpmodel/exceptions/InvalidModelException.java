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

/** The backend rejected the model it was given. */
public class InvalidModelException extends CpmException {
  public InvalidModelException(String methodName, String diagnostic) {
    super(methodName, diagnostic);
    this.diagnostic = diagnostic;
  }

  /** Returns the message reported by the backend validator. */
  public String getDiagnostic() {
    return diagnostic;
  }

  private final String diagnostic;
}
