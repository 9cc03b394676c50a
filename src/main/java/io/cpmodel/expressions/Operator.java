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
import com.google.common.math.LongMath;
import com.google.common.primitives.Ints;
import java.util.List;
import java.util.Objects;

/**
 * A logical or arithmetic operator node.
 *
 * <p>Integer division truncates towards zero and modulo takes the sign of the dividend, so that
 * {@code x == (x / y) * y + x % y}. Both are undefined for a zero divisor.
 */
public final class Operator extends Expression {
  /** Operator kinds, with their arity (-1 for n-ary) and whether they are Boolean. */
  public enum Kind {
    AND("and", -1, true),
    OR("or", -1, true),
    IMPLIES("->", 2, true),
    NOT("not", 1, true),
    SUM("sum", -1, false),
    WSUM("wsum", -1, false),
    SUB("sub", 2, false),
    MUL("mul", 2, false),
    DIV("div", 2, false),
    MOD("mod", 2, false),
    POW("pow", 2, false),
    NEG("-", 1, false);

    Kind(String name, int arity, boolean bool) {
      this.name = name;
      this.arity = arity;
      this.bool = bool;
    }

    /** Returns the kind named {@code name}, or null. */
    public static Kind fromName(String name) {
      for (Kind kind : values()) {
        if (kind.name.equals(name)) {
          return kind;
        }
      }
      return null;
    }

    public String opName() {
      return name;
    }

    public boolean isBool() {
      return bool;
    }

    private final String name;
    private final int arity;
    private final boolean bool;
  }

  public Operator(Kind kind, List<? extends Expression> args) {
    this(kind, args, ImmutableList.of());
  }

  public Operator(Kind kind, List<? extends Expression> args, List<Long> weights) {
    this.kind = kind;
    this.args = ImmutableList.copyOf(args);
    this.weights = ImmutableList.copyOf(weights);
    if (kind.arity >= 0) {
      checkArgument(
          this.args.size() == kind.arity,
          "%s takes %s arguments, got %s",
          kind.name,
          kind.arity,
          this.args.size());
    } else {
      checkArgument(!this.args.isEmpty(), "%s needs at least one argument", kind.name);
    }
    if (kind == Kind.WSUM) {
      checkArgument(
          this.weights.size() == this.args.size(),
          "wsum has %s weights for %s arguments",
          this.weights.size(),
          this.args.size());
    } else {
      checkArgument(this.weights.isEmpty(), "only wsum takes weights");
    }
    if (kind.bool) {
      for (Expression arg : this.args) {
        checkArgument(arg.isBool(), "%s expects Boolean arguments, got %s", kind.name, arg);
      }
    }
    if (kind == Kind.POW) {
      Expression exponent = this.args.get(1);
      checkArgument(exponent.lb() >= 0, "pow needs a non-negative exponent, got %s", exponent);
    }
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the weights of a wsum, empty for other kinds. */
  public ImmutableList<Long> weights() {
    return weights;
  }

  @Override
  public String name() {
    return kind.name;
  }

  @Override
  public ImmutableList<Expression> args() {
    return args;
  }

  @Override
  public boolean isBool() {
    return kind.bool;
  }

  @Override
  public long[] bounds() {
    if (kind.bool) {
      return new long[] {0, 1};
    }
    switch (kind) {
      case SUM:
        {
          long lb = 0;
          long ub = 0;
          for (Expression arg : args) {
            lb = LongMath.saturatedAdd(lb, arg.lb());
            ub = LongMath.saturatedAdd(ub, arg.ub());
          }
          return new long[] {lb, ub};
        }
      case WSUM:
        {
          long lb = 0;
          long ub = 0;
          for (int i = 0; i < args.size(); ++i) {
            long w = weights.get(i);
            long a = LongMath.saturatedMultiply(w, args.get(i).lb());
            long b = LongMath.saturatedMultiply(w, args.get(i).ub());
            lb = LongMath.saturatedAdd(lb, Math.min(a, b));
            ub = LongMath.saturatedAdd(ub, Math.max(a, b));
          }
          return new long[] {lb, ub};
        }
      case SUB:
        return new long[] {
          LongMath.saturatedSubtract(args.get(0).lb(), args.get(1).ub()),
          LongMath.saturatedSubtract(args.get(0).ub(), args.get(1).lb())
        };
      case NEG:
        return new long[] {
          LongMath.saturatedMultiply(-1, args.get(0).ub()),
          LongMath.saturatedMultiply(-1, args.get(0).lb())
        };
      case MUL:
        {
          long[] x = args.get(0).bounds();
          long[] y = args.get(1).bounds();
          long[] candidates = {
            LongMath.saturatedMultiply(x[0], y[0]),
            LongMath.saturatedMultiply(x[0], y[1]),
            LongMath.saturatedMultiply(x[1], y[0]),
            LongMath.saturatedMultiply(x[1], y[1])
          };
          return minMax(candidates);
        }
      case DIV:
        return divBounds(args.get(0).bounds(), args.get(1).bounds());
      case MOD:
        return modBounds(args.get(0).bounds(), args.get(1).bounds());
      case POW:
        return powBounds(args.get(0).bounds(), args.get(1).bounds());
      default:
        throw new IllegalStateException("no bounds for " + kind);
    }
  }

  @Override
  public Long value() {
    long[] vals = new long[args.size()];
    for (int i = 0; i < vals.length; ++i) {
      Long v = args.get(i).value();
      if (v == null) {
        return null;
      }
      vals[i] = v;
    }
    switch (kind) {
      case AND:
        for (long v : vals) {
          if (v == 0) {
            return 0L;
          }
        }
        return 1L;
      case OR:
        for (long v : vals) {
          if (v != 0) {
            return 1L;
          }
        }
        return 0L;
      case IMPLIES:
        return (vals[0] == 0 || vals[1] != 0) ? 1L : 0L;
      case NOT:
        return vals[0] == 0 ? 1L : 0L;
      case SUM:
        {
          long sum = 0;
          for (long v : vals) {
            sum += v;
          }
          return sum;
        }
      case WSUM:
        {
          long sum = 0;
          for (int i = 0; i < vals.length; ++i) {
            sum += weights.get(i) * vals[i];
          }
          return sum;
        }
      case SUB:
        return vals[0] - vals[1];
      case MUL:
        return vals[0] * vals[1];
      case DIV:
        return vals[1] == 0 ? null : vals[0] / vals[1];
      case MOD:
        return vals[1] == 0 ? null : vals[0] % vals[1];
      case POW:
        return vals[1] < 0 ? null : LongMath.pow(vals[0], Ints.saturatedCast(vals[1]));
      case NEG:
        return -vals[0];
    }
    throw new IllegalStateException("unknown operator " + kind);
  }

  @Override
  public Operator withArgs(List<Expression> newArgs) {
    return new Operator(kind, newArgs, weights);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Operator)) {
      return false;
    }
    Operator other = (Operator) o;
    return kind == other.kind && args.equals(other.args) && weights.equals(other.weights);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, args, weights);
  }

  @Override
  public String toString() {
    switch (kind) {
      case IMPLIES:
        return "(" + args.get(0) + ") -> (" + args.get(1) + ")";
      case SUB:
        return "(" + args.get(0) + ") - (" + args.get(1) + ")";
      case MUL:
        return "(" + args.get(0) + ") * (" + args.get(1) + ")";
      case DIV:
        return "(" + args.get(0) + ") div (" + args.get(1) + ")";
      case MOD:
        return "(" + args.get(0) + ") mod (" + args.get(1) + ")";
      case POW:
        return "(" + args.get(0) + ") ** (" + args.get(1) + ")";
      case NEG:
        return "-(" + args.get(0) + ")";
      case WSUM:
        return "wsum(" + weights + ", " + args + ")";
      default:
        return kind.name + args;
    }
  }

  private static long[] minMax(long[] candidates) {
    long lb = Long.MAX_VALUE;
    long ub = Long.MIN_VALUE;
    for (long c : candidates) {
      lb = Math.min(lb, c);
      ub = Math.max(ub, c);
    }
    return new long[] {lb, ub};
  }

  private static long[] divBounds(long[] x, long[] y) {
    long[] divisors = new long[4];
    int n = 0;
    if (y[0] != 0) {
      divisors[n++] = y[0];
    }
    if (y[1] != 0) {
      divisors[n++] = y[1];
    }
    if (y[0] <= -1 && -1 <= y[1]) {
      divisors[n++] = -1;
    }
    if (y[0] <= 1 && 1 <= y[1]) {
      divisors[n++] = 1;
    }
    if (n == 0) {
      return new long[] {0, 0};
    }
    long[] candidates = new long[2 * n];
    for (int i = 0; i < n; ++i) {
      candidates[2 * i] = x[0] / divisors[i];
      candidates[2 * i + 1] = x[1] / divisors[i];
    }
    return minMax(candidates);
  }

  private static long[] modBounds(long[] x, long[] y) {
    long m = Math.max(Math.abs(y[0]), Math.abs(y[1])) - 1;
    if (m < 0) {
      m = 0;
    }
    long lb = x[0] >= 0 ? 0 : Math.max(x[0], -m);
    long ub = x[1] <= 0 ? 0 : Math.min(x[1], m);
    return new long[] {lb, ub};
  }

  private static long[] powBounds(long[] base, long[] exponent) {
    long elb = Math.max(exponent[0], 0);
    long eub = Math.max(exponent[1], elb);
    long[] bases = {base[0], base[1], 0, 0};
    int nb = 2;
    if (base[0] <= -1 && -1 <= base[1]) {
      bases[nb++] = -1;
    }
    if (base[0] <= 1 && 1 <= base[1]) {
      bases[nb++] = 1;
    }
    long[] exponents = {elb, Math.min(elb + 1, eub), eub, Math.max(eub - 1, elb)};
    long[] candidates = new long[nb * exponents.length];
    int n = 0;
    for (int i = 0; i < nb; ++i) {
      for (long k : exponents) {
        candidates[n++] = LongMath.saturatedPow(bases[i], Ints.saturatedCast(k));
      }
    }
    long[] result = minMax(candidates);
    if (base[0] <= 0 && 0 <= base[1]) {
      result[0] = Math.min(result[0], 0);
      result[1] = Math.max(result[1], 0);
    }
    return result;
  }

  private final Kind kind;
  private final ImmutableList<Expression> args;
  private final ImmutableList<Long> weights;
}
