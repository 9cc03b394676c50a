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
 * Tasks {@code [start[i], end[i])} with {@code end[i] == start[i] + duration[i]} pairwise do not
 * overlap.
 */
public final class NoOverlap extends GlobalConstraint {
  public NoOverlap(
      List<? extends Expression> start,
      List<? extends Expression> duration,
      List<? extends Expression> end) {
    super(
        "no_overlap",
        ImmutableList.<Expression>builder().addAll(start).addAll(duration).addAll(end).build());
    checkArgument(
        duration.size() == start.size() && end.size() == start.size(),
        "no_overlap task arrays differ in size");
  }

  public int numTasks() {
    return args().size() / 3;
  }

  public List<Expression> start() {
    return args().subList(0, numTasks());
  }

  public List<Expression> duration() {
    return args().subList(numTasks(), 2 * numTasks());
  }

  public List<Expression> end() {
    return args().subList(2 * numTasks(), 3 * numTasks());
  }

  @Override
  public Decomposition decompose() {
    int n = numTasks();
    List<Expression> start = start();
    List<Expression> duration = duration();
    List<Expression> end = end();
    List<Expression> constraints = new ArrayList<>();
    for (int i = 0; i < n; ++i) {
      constraints.add(duration.get(i).ge(0));
      constraints.add(start.get(i).plus(duration.get(i)).eq(end.get(i)));
    }
    for (int i = 0; i < n; ++i) {
      for (int j = i + 1; j < n; ++j) {
        constraints.add(
            Expressions.or(end.get(i).le(start.get(j)), end.get(j).le(start.get(i))));
      }
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
      if (vals[n + i] < 0 || vals[i] + vals[n + i] != vals[2 * n + i]) {
        return 0L;
      }
    }
    for (int i = 0; i < n; ++i) {
      for (int j = i + 1; j < n; ++j) {
        if (vals[2 * n + i] > vals[j] && vals[2 * n + j] > vals[i]) {
          return 0L;
        }
      }
    }
    return 1L;
  }

  @Override
  public NoOverlap withArgs(List<Expression> newArgs) {
    int n = newArgs.size() / 3;
    return new NoOverlap(
        newArgs.subList(0, n), newArgs.subList(n, 2 * n), newArgs.subList(2 * n, 3 * n));
  }
}
