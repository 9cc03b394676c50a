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

import static com.google.common.base.Preconditions.checkArgument;

/** An integer variable with domain [lb, ub]. */
public class IntVar extends Variable {
  public IntVar(long lb, long ub) {
    this(lb, ub, nextName("IV"));
  }

  public IntVar(long lb, long ub, String name) {
    super(name, lb, ub);
    checkArgument(lb <= ub, "empty domain [%s, %s] for %s", lb, ub, name);
  }

  @Override
  public boolean isBool() {
    return false;
  }
}
