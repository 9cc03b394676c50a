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
 * Base class of the errors raised while building, transforming or solving a model. Messages
 * take the form {@code "<method>: <message>"}.
 */
public class CpmException extends RuntimeException {
  public CpmException(String methodName, String msg) {
    // We don't just call super() because it makes the error message less readable.
    super(methodName + ": " + msg);
  }

  public CpmException(String methodName, String msg, Throwable cause) {
    super(methodName + ": " + msg, cause);
  }
}
