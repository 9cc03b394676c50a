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
import java.util.ArrayList;
import java.util.List;

/**
 * Tasks {@code [start[i], end[i])} with {@code end[i] == start[i] + duration[i]} never use more
 * than {@code capacity} resource units at any point in time.
 */
public final class Cumulative extends GlobalConstraint {
  public Cumulative(
      List<? extends Expression> start,
      List<? extends Expression> duration,
      List<? extends Expression> end,
      List<? extends Expression> demand,
      Expression capacity) {
    super(
        "cumulative",
        ImmutableList.<Expression>builder()
            .addAll(start)
            .addAll(duration)
            .addAll(end)
            .addAll(demand)
            .add(capacity)
            .build());
    int n = start.size();
    checkArgument(
        duration.size() == n && end.size() == n && demand.size() == n,
        "cumulative task arrays differ in size");
  }

  public int numTasks() {
    return (args().size() - 1) / 4;
  }

  public List<Expression> start() {
    return slice(0);
  }

  public List<Expression> duration() {
    return slice(1);
  }

  public List<Expression> end() {
    return slice(2);
  }

  public List<Expression> demand() {
    return slice(3);
  }

  public Expression capacity() {
    return args().get(args().size() - 1);
  }

  /** Time decomposition: the demand of the running tasks is checked at every time point. */
  @Override
  public Decomposition decompose() {
    int n = numTasks();
    List<Expression> start = start();
    List<Expression> duration = duration();
    List<Expression> end = end();
    List<Expression> demand = demand();
    List<Expression> constraints = new ArrayList<>();
    long horizonStart = Long.MAX_VALUE;
    long horizonEnd = Long.MIN_VALUE;
    for (int i = 0; i < n; ++i) {
      constraints.add(duration.get(i).ge(0));
      constraints.add(demand.get(i).ge(0));
      constraints.add(start.get(i).plus(duration.get(i)).eq(end.get(i)));
      horizonStart = Math.min(horizonStart, start.get(i).lb());
      horizonEnd = Math.max(horizonEnd, end.get(i).ub());
    }
    for (long t = horizonStart; t < horizonEnd; ++t) {
      List<Expression> used = new ArrayList<>();
      for (int i = 0; i < n; ++i) {
        Expression running = Expressions.and(start.get(i).le(t), end.get(i).gt(t));
        used.add(demand.get(i).times(running));
      }
      constraints.add(Expressions.sum(used).le(capacity()));
    }
    return Decomposition.of(constraints);
  }

  @Override
  public Long value() {
    long[] vals = valuesOf(args());
    if (vals == null) {
      return null;
    }
    int n = numTasks();
    for (int i = 0; i < n; ++i) {
      if (vals[n + i] < 0 || vals[3 * n + i] < 0 || vals[i] + vals[n + i] != vals[2 * n + i]) {
        return 0L;
      }
    }
    long capacity = vals[4 * n];
    // The load only increases at task starts.
    for (int i = 0; i < n; ++i) {
      long t = vals[i];
      long load = 0;
      for (int j = 0; j < n; ++j) {
        if (vals[j] <= t && t < vals[2 * n + j]) {
          load += vals[3 * n + j];
        }
      }
      if (load > capacity) {
        return 0L;
      }
    }
    return 1L;
  }

  @Override
  public Cumulative withArgs(List<Expression> newArgs) {
    int n = (newArgs.size() - 1) / 4;
    return new Cumulative(
        newArgs.subList(0, n),
        newArgs.subList(n, 2 * n),
        newArgs.subList(2 * n, 3 * n),
        newArgs.subList(3 * n, 4 * n),
        newArgs.get(4 * n));
  }

  private List<Expression> slice(int part) {
    int n = numTasks();
    return args().subList(part * n, (part + 1) * n);
  }
}
