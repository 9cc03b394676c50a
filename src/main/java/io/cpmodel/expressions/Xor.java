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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** An odd number of the Boolean arguments is true. */
public final class Xor extends GlobalConstraint {
  public Xor(List<? extends Expression> exprs) {
    super("xor", exprs);
    checkArgument(!exprs.isEmpty(), "xor needs at least one argument");
    for (Expression e : exprs) {
      checkArgument(e.isBool(), "xor expects Boolean arguments, got %s", e);
    }
  }

  @Override
  public Decomposition decompose() {
    Expression parity = args().get(0);
    for (int i = 1; i < args().size(); ++i) {
      parity = parity.ne(args().get(i));
    }
    return Decomposition.of(ImmutableList.of(parity));
  }

  @Override
  public Long value() {
    long[] vals = valuesOf(args());
    if (vals == null) {
      return null;
    }
    int trueCount = 0;
    for (long v : vals) {
      if (v != 0) {
        ++trueCount;
      }
    }
    return fromBoolean(trueCount % 2 == 1);
  }

  @Override
  public Xor withArgs(List<Expression> newArgs) {
    return new Xor(newArgs);
  }
}
