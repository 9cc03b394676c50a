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
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Longs;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Factories for variables, operators and globals, and utilities over expression trees. */
public final class Expressions {
  // Variables and constants.

  public static IntVar intVar(long lb, long ub) {
    return new IntVar(lb, ub);
  }

  public static IntVar intVar(long lb, long ub, String name) {
    return new IntVar(lb, ub, name);
  }

  /** Creates {@code n} integer variables named {@code prefix[i]}. */
  public static ImmutableList<IntVar> intVars(int n, long lb, long ub, String prefix) {
    ImmutableList.Builder<IntVar> vars = ImmutableList.builder();
    for (int i = 0; i < n; ++i) {
      vars.add(new IntVar(lb, ub, prefix + "[" + i + "]"));
    }
    return vars.build();
  }

  public static BoolVar boolVar() {
    return new BoolVar();
  }

  public static BoolVar boolVar(String name) {
    return new BoolVar(name);
  }

  /** Creates {@code n} Boolean variables named {@code prefix[i]}. */
  public static ImmutableList<BoolVar> boolVars(int n, String prefix) {
    ImmutableList.Builder<BoolVar> vars = ImmutableList.builder();
    for (int i = 0; i < n; ++i) {
      vars.add(new BoolVar(prefix + "[" + i + "]"));
    }
    return vars.build();
  }

  public static Constant constant(long value) {
    return Constant.of(value);
  }

  public static BoolVal boolVal(boolean value) {
    return BoolVal.of(value);
  }

  // Arithmetic.

  public static Expression sum(Expression... exprs) {
    return sum(Arrays.asList(exprs));
  }

  /** Returns the sum of {@code exprs}: 0 when empty, the expression itself for a singleton. */
  public static Expression sum(List<? extends Expression> exprs) {
    if (exprs.isEmpty()) {
      return Constant.of(0);
    }
    if (exprs.size() == 1) {
      return exprs.get(0);
    }
    return new Operator(Operator.Kind.SUM, exprs);
  }

  public static Expression weightedSum(long[] weights, List<? extends Expression> exprs) {
    checkArgument(weights.length == exprs.size(), "weights and expressions differ in size");
    if (exprs.isEmpty()) {
      return Constant.of(0);
    }
    return new Operator(Operator.Kind.WSUM, exprs, Longs.asList(weights));
  }

  // Logic.

  public static Expression and(Expression... exprs) {
    return and(Arrays.asList(exprs));
  }

  /** Returns the conjunction of {@code exprs}: true when empty, the expression for a singleton. */
  public static Expression and(List<? extends Expression> exprs) {
    if (exprs.isEmpty()) {
      return BoolVal.TRUE;
    }
    if (exprs.size() == 1) {
      return exprs.get(0);
    }
    return new Operator(Operator.Kind.AND, exprs);
  }

  public static Expression or(Expression... exprs) {
    return or(Arrays.asList(exprs));
  }

  /** Returns the disjunction of {@code exprs}: false when empty, the expression for a singleton. */
  public static Expression or(List<? extends Expression> exprs) {
    if (exprs.isEmpty()) {
      return BoolVal.FALSE;
    }
    if (exprs.size() == 1) {
      return exprs.get(0);
    }
    return new Operator(Operator.Kind.OR, exprs);
  }

  public static Expression implies(Expression lhs, Expression rhs) {
    return new Operator(Operator.Kind.IMPLIES, ImmutableList.of(lhs, rhs));
  }

  /**
   * Returns the negation of a Boolean expression, pushed down through double negation,
   * and/or, implication, comparisons and globals with a compact negation. Other globals are
   * wrapped in a {@code not} operator.
   */
  public static Expression not(Expression expr) {
    checkArgument(expr.isBool(), "not expects a Boolean expression, got %s", expr);
    if (expr instanceof BoolVar) {
      return ((BoolVar) expr).not();
    }
    if (expr instanceof BoolVal) {
      return ((BoolVal) expr).not();
    }
    if (expr instanceof Comparison) {
      Comparison c = (Comparison) expr;
      return new Comparison(c.op().negate(), c.lhs(), c.rhs());
    }
    if (expr instanceof Operator) {
      Operator op = (Operator) expr;
      switch (op.kind()) {
        case AND:
          return or(negateAll(op.args()));
        case OR:
          return and(negateAll(op.args()));
        case IMPLIES:
          return and(op.args().get(0), not(op.args().get(1)));
        case NOT:
          return op.args().get(0);
        default:
          break;
      }
    }
    if (expr instanceof GlobalConstraint) {
      Expression negated = ((GlobalConstraint) expr).negate();
      if (negated != null) {
        return negated;
      }
    }
    return new Operator(Operator.Kind.NOT, ImmutableList.of(expr));
  }

  private static List<Expression> negateAll(List<Expression> exprs) {
    List<Expression> result = new ArrayList<>();
    for (Expression e : exprs) {
      result.add(not(e));
    }
    return result;
  }

  // Global functions.

  public static Expression min(List<? extends Expression> exprs) {
    return new Minimum(exprs);
  }

  public static Expression max(List<? extends Expression> exprs) {
    return new Maximum(exprs);
  }

  public static Expression abs(Expression expr) {
    return new Abs(expr);
  }

  public static Expression element(List<? extends Expression> array, Expression index) {
    return new Element(array, index);
  }

  public static Expression count(List<? extends Expression> array, Expression value) {
    return new Count(array, value);
  }

  // Global constraints.

  public static Expression allDifferent(List<? extends Expression> exprs) {
    return new AllDifferent(exprs);
  }

  public static Expression allEqual(List<? extends Expression> exprs) {
    return new AllEqual(exprs);
  }

  public static Expression table(List<? extends Expression> exprs, long[][] rows) {
    return new Table(exprs, rows);
  }

  public static Expression negativeTable(List<? extends Expression> exprs, long[][] rows) {
    return new NegativeTable(exprs, rows);
  }

  public static Expression xor(List<? extends Expression> exprs) {
    return new Xor(exprs);
  }

  public static Expression ifThenElse(Expression condition, Expression then, Expression other) {
    return new IfThenElse(condition, then, other);
  }

  // Tree utilities.

  /**
   * Returns the variables occurring in {@code exprs}, in order of first occurrence. Negated views
   * contribute their underlying variable.
   */
  public static ImmutableSet<Variable> getVariables(Iterable<? extends Expression> exprs) {
    Set<Variable> collected = new LinkedHashSet<>();
    for (Expression e : exprs) {
      collectVariables(e, collected);
    }
    return ImmutableSet.copyOf(collected);
  }

  public static ImmutableSet<Variable> getVariables(Expression expr) {
    return getVariables(ImmutableList.of(expr));
  }

  private static void collectVariables(Expression expr, Set<Variable> collected) {
    if (expr instanceof NegBoolView) {
      collected.add(((NegBoolView) expr).variable());
    } else if (expr instanceof Variable) {
      collected.add((Variable) expr);
    } else {
      for (Expression arg : expr.args()) {
        collectVariables(arg, collected);
      }
    }
  }

  /** Returns true for variables and constants, the leaves of a flat expression. */
  public static boolean isLeaf(Expression expr) {
    return expr instanceof Variable || expr instanceof Constant || expr instanceof BoolVal;
  }

  /** Returns true if every argument of {@code expr} is a leaf. */
  public static boolean hasLeafArgs(Expression expr) {
    for (Expression arg : expr.args()) {
      if (!isLeaf(arg)) {
        return false;
      }
    }
    return true;
  }

  private Expressions() {}
}
