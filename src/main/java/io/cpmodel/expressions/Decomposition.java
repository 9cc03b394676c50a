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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The decomposition of a global constraint: the constraints replacing it, and defining
 * constraints over auxiliary variables that must hold at toplevel.
 */
public final class Decomposition {
  public Decomposition(
      List<? extends Expression> constraints, List<? extends Expression> defining) {
    this.constraints = ImmutableList.copyOf(constraints);
    this.defining = ImmutableList.copyOf(defining);
  }

  public static Decomposition of(List<? extends Expression> constraints) {
    return new Decomposition(constraints, ImmutableList.of());
  }

  public ImmutableList<Expression> constraints() {
    return constraints;
  }

  public ImmutableList<Expression> defining() {
    return defining;
  }

  private final ImmutableList<Expression> constraints;
  private final ImmutableList<Expression> defining;
}
