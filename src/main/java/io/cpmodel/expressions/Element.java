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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code array[index]}. Undefined when the index falls outside {@code [0, array.size() - 1]}.
 */
public final class Element extends GlobalFunction {
  public Element(List<? extends Expression> array, Expression index) {
    super("element", ImmutableList.<Expression>builder().addAll(array).add(index).build());
    checkArgument(!array.isEmpty(), "element needs a non-empty array");
  }

  public List<Expression> array() {
    return args().subList(0, args().size() - 1);
  }

  public Expression index() {
    return args().get(args().size() - 1);
  }

  @Override
  public long[] bounds() {
    long lb = Long.MAX_VALUE;
    long ub = Long.MIN_VALUE;
    for (Expression e : array()) {
      lb = Math.min(lb, e.lb());
      ub = Math.max(ub, e.ub());
    }
    return new long[] {lb, ub};
  }

  /** Decomposes a safe element, whose index range lies within the array, into implications. */
  @Override
  public FunctionDecomposition decompose() {
    List<Expression> array = array();
    Expression index = index();
    checkState(
        index.lb() >= 0 && index.ub() < array.size(),
        "element index %s may fall outside the array of size %s",
        index,
        array.size());
    long[] bounds = bounds();
    IntVar value = new IntVar(bounds[0], bounds[1]);
    List<Expression> defining = new ArrayList<>();
    for (long i = index.lb(); i <= index.ub(); ++i) {
      defining.add(Expressions.implies(index.eq(i), value.eq(array.get((int) i))));
    }
    return new FunctionDecomposition(value, defining);
  }

  @Override
  public Long value() {
    Long i = index().value();
    if (i == null || i < 0 || i >= array().size()) {
      return null;
    }
    return array().get(i.intValue()).value();
  }

  @Override
  public Element withArgs(List<Expression> newArgs) {
    return new Element(newArgs.subList(0, newArgs.size() - 1), newArgs.get(newArgs.size() - 1));
  }

  @Override
  public String toString() {
    return "element(" + array() + ", " + index() + ")";
  }
}
