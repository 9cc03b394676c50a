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

import java.util.ArrayList;
import java.util.List;

/**
 * The successor variables {@code succ} form a single cycle over all nodes: node {@code i} is
 * followed by node {@code succ[i]}.
 */
public final class Circuit extends GlobalConstraint {
  public Circuit(List<? extends Expression> successors) {
    super("circuit", successors);
    checkArgument(successors.size() >= 2, "a circuit needs at least two nodes");
  }

  /**
   * Decomposes through order variables: {@code order[i]} is the node visited after {@code i + 1}
   * steps from node 0, and the walk must come back to node 0 after exactly n steps.
   *
   * <p>The order variables are defined at toplevel as a function of {@code succ}. When some
   * successor may fall outside {@code [0, n - 1]}, the walk is only defined under a guard that
   * holds when every successor is in range, and all order variables are 0 otherwise.
   */
  @Override
  public Decomposition decompose() {
    List<Expression> succ = args();
    int n = succ.size();
    List<Expression> order = new ArrayList<>();
    for (int i = 0; i < n; ++i) {
      order.add(new IntVar(0, n - 1));
    }
    List<Expression> walk = new ArrayList<>();
    walk.add(order.get(0).eq(succ.get(0)));
    for (int i = 1; i < n; ++i) {
      walk.add(order.get(i).eq(new Element(succ, order.get(i - 1))));
    }

    List<Expression> defining = new ArrayList<>();
    List<Expression> inRange = new ArrayList<>();
    for (Expression s : succ) {
      if (s.lb() < 0) {
        inRange.add(s.ge(0));
      }
      if (s.ub() > n - 1) {
        inRange.add(s.le(n - 1));
      }
    }
    if (inRange.isEmpty()) {
      defining.addAll(walk);
    } else {
      BoolVar guard = new BoolVar();
      defining.add(guard.eq(Expressions.and(inRange)));
      for (Expression w : walk) {
        defining.add(Expressions.implies(guard, w));
      }
      for (Expression o : order) {
        defining.add(Expressions.implies(guard.not(), o.eq(0)));
      }
    }

    List<Expression> constraints = new ArrayList<>();
    constraints.add(new AllDifferent(succ));
    constraints.add(new AllDifferent(order));
    constraints.add(order.get(n - 1).eq(0));
    return new Decomposition(constraints, defining);
  }

  @Override
  public Long value() {
    long[] succ = valuesOf(args());
    if (succ == null) {
      return null;
    }
    int n = succ.length;
    boolean[] visited = new boolean[n];
    int node = 0;
    for (int step = 0; step < n; ++step) {
      if (visited[node]) {
        return 0L;
      }
      visited[node] = true;
      long next = succ[node];
      if (next < 0 || next >= n) {
        return 0L;
      }
      node = (int) next;
    }
    return fromBoolean(node == 0);
  }

  @Override
  public Circuit withArgs(List<Expression> newArgs) {
    return new Circuit(newArgs);
  }
}
