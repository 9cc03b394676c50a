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
import java.util.Arrays;
import java.util.List;

/**
 * The sequence of arguments is accepted by a deterministic finite automaton. Transitions are
 * {@code {source, label, destination}} triples over integer states.
 */
public final class Regular extends GlobalConstraint {
  public Regular(
      List<? extends Expression> exprs, long[][] transitions, long start, long[] accepting) {
    super("regular", exprs);
    for (long[] t : transitions) {
      checkArgument(t.length == 3, "a transition is {source, label, destination}");
    }
    this.transitions = Table.copyRows(3, transitions);
    this.start = start;
    this.accepting = accepting.clone();
  }

  public long[][] transitions() {
    return Table.copyRows(3, transitions);
  }

  public long start() {
    return start;
  }

  public long[] accepting() {
    return accepting.clone();
  }

  /**
   * Decomposes into state variables defined at toplevel. {@code states[i + 1]} is the target of
   * the transition taken from {@code states[i]} on the i-th argument, or a sink state outside
   * the automaton when there is none. Only acceptance of the last state is constrained.
   */
  @Override
  public Decomposition decompose() {
    long lo = start;
    long hi = start;
    for (long[] t : transitions) {
      lo = Math.min(lo, Math.min(t[0], t[2]));
      hi = Math.max(hi, Math.max(t[0], t[2]));
    }
    for (long a : accepting) {
      lo = Math.min(lo, a);
      hi = Math.max(hi, a);
    }
    long sink = hi + 1;
    List<long[]> deterministic = firstTransitions();

    List<Expression> exprs = args();
    List<Expression> states = new ArrayList<>();
    for (int i = 0; i <= exprs.size(); ++i) {
      states.add(new IntVar(lo, sink));
    }
    List<Expression> defining = new ArrayList<>();
    defining.add(states.get(0).eq(start));
    for (int i = 0; i < exprs.size(); ++i) {
      Expression from = states.get(i);
      Expression label = exprs.get(i);
      Expression to = states.get(i + 1);
      List<Expression> noneTaken = new ArrayList<>();
      for (long[] t : deterministic) {
        defining.add(Expressions.or(from.ne(t[0]), label.ne(t[1]), to.eq(t[2])));
        noneTaken.add(Expressions.and(from.eq(t[0]), label.eq(t[1])));
      }
      noneTaken.add(to.eq(sink));
      defining.add(Expressions.or(noneTaken));
    }

    List<Expression> accepted = new ArrayList<>();
    for (long a : accepting) {
      accepted.add(states.get(exprs.size()).eq(a));
    }
    return new Decomposition(ImmutableList.of(Expressions.or(accepted)), defining);
  }

  /** The transitions, keeping only the first one for each source and label. */
  private List<long[]> firstTransitions() {
    List<long[]> result = new ArrayList<>();
    for (long[] t : transitions) {
      boolean seen = false;
      for (long[] r : result) {
        seen |= r[0] == t[0] && r[1] == t[1];
      }
      if (!seen) {
        result.add(t);
      }
    }
    return result;
  }

  @Override
  public Long value() {
    long[] vals = valuesOf(args());
    if (vals == null) {
      return null;
    }
    long state = start;
    for (long v : vals) {
      long[] next = null;
      for (long[] t : transitions) {
        if (t[0] == state && t[1] == v) {
          next = t;
          break;
        }
      }
      if (next == null) {
        return 0L;
      }
      state = next[2];
    }
    for (long a : accepting) {
      if (a == state) {
        return 1L;
      }
    }
    return 0L;
  }

  @Override
  public Regular withArgs(List<Expression> newArgs) {
    return new Regular(newArgs, transitions, start, accepting);
  }

  @Override
  public boolean equals(Object o) {
    if (!super.equals(o)) {
      return false;
    }
    Regular other = (Regular) o;
    return start == other.start
        && Arrays.deepEquals(transitions, other.transitions)
        && Arrays.equals(accepting, other.accepting);
  }

  @Override
  public int hashCode() {
    return super.hashCode() * 31 + Arrays.deepHashCode(transitions);
  }

  private final long[][] transitions;
  private final long start;
  private final long[] accepting;
}
