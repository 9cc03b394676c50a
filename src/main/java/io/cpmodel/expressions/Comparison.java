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
import java.util.Objects;

/** A binary comparison between two expressions. */
public final class Comparison extends Expression {
  /** The comparison operators. */
  public enum Op {
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    Op(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    /** Returns the operator such that {@code a op b} iff {@code b flip(op) a}. */
    public Op flip() {
      switch (this) {
        case LT:
          return GT;
        case LE:
          return GE;
        case GT:
          return LT;
        case GE:
          return LE;
        default:
          return this;
      }
    }

    /** Returns the operator such that {@code a negate(op) b} iff not {@code a op b}. */
    public Op negate() {
      switch (this) {
        case EQ:
          return NE;
        case NE:
          return EQ;
        case LT:
          return GE;
        case LE:
          return GT;
        case GT:
          return LE;
        case GE:
          return LT;
      }
      throw new IllegalStateException("unknown operator " + this);
    }

    public boolean test(long a, long b) {
      switch (this) {
        case EQ:
          return a == b;
        case NE:
          return a != b;
        case LT:
          return a < b;
        case LE:
          return a <= b;
        case GT:
          return a > b;
        case GE:
          return a >= b;
      }
      throw new IllegalStateException("unknown operator " + this);
    }

    private final String symbol;
  }

  public Comparison(Op op, Expression lhs, Expression rhs) {
    this.op = op;
    this.lhs = lhs;
    this.rhs = rhs;
  }

  public Op op() {
    return op;
  }

  public Expression lhs() {
    return lhs;
  }

  public Expression rhs() {
    return rhs;
  }

  /** Returns true if both sides are Boolean, which makes this a (non-)equivalence. */
  public boolean isBoolComparison() {
    return lhs.isBool() && rhs.isBool();
  }

  @Override
  public String name() {
    return op.symbol();
  }

  @Override
  public ImmutableList<Expression> args() {
    return ImmutableList.of(lhs, rhs);
  }

  @Override
  public boolean isBool() {
    return true;
  }

  @Override
  public long[] bounds() {
    return new long[] {0, 1};
  }

  @Override
  public Long value() {
    Long a = lhs.value();
    Long b = rhs.value();
    if (a == null || b == null) {
      return null;
    }
    return op.test(a, b) ? 1L : 0L;
  }

  @Override
  public Comparison withArgs(List<Expression> newArgs) {
    checkArgument(newArgs.size() == 2, "a comparison takes two arguments");
    return new Comparison(op, newArgs.get(0), newArgs.get(1));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Comparison)) {
      return false;
    }
    Comparison other = (Comparison) o;
    return op == other.op && lhs.equals(other.lhs) && rhs.equals(other.rhs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, lhs, rhs);
  }

  @Override
  public String toString() {
    return "(" + lhs + ") " + op.symbol() + " (" + rhs + ")";
  }

  private final Op op;
  private final Expression lhs;
  private final Expression rhs;
}
