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

package io.cpmodel.transformations;

import io.cpmodel.exceptions.UnsupportedExpressionException;
import io.cpmodel.expressions.BoolVal;
import io.cpmodel.expressions.BoolVar;
import io.cpmodel.expressions.Comparison;
import io.cpmodel.expressions.Constant;
import io.cpmodel.expressions.DirectConstraint;
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Expressions;
import io.cpmodel.expressions.GlobalConstraint;
import io.cpmodel.expressions.GlobalFunction;
import io.cpmodel.expressions.IntVar;
import io.cpmodel.expressions.Operator;
import io.cpmodel.expressions.Variable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattening: rewrites constraints so that every operator, comparison and global only has
 * variables and constants as arguments. Nested sub-expressions are replaced by auxiliary
 * variables, shared through a {@link CseMap}, and defined by extra toplevel constraints.
 *
 * <p>The flat forms are:
 *
 * <ul>
 *   <li>Boolean variables and constants;
 *   <li>{@code and([BV])}, {@code or([BV])}, {@code BV -> BV};
 *   <li>{@code NumExpr op Var|Const}, where NumExpr is a variable, a sum, wsum, sub, mul, div,
 *       mod or pow, or a global function, over variables and constants;
 *   <li>{@code BoolExpr == BV}, {@code BV -> BoolExpr} and {@code BoolExpr -> BV};
 *   <li>global constraints over variables and constants.
 * </ul>
 */
public final class Flatten {
  /** Returns the flat form of {@code constraints}, including the defining constraints. */
  public static List<Expression> flattenConstraint(List<Expression> constraints, CseMap cse) {
    List<Expression> out = new ArrayList<>();
    for (Expression c : constraints) {
      flattenToplevel(c, out, cse);
    }
    return out;
  }

  /**
   * Returns a flat objective: a variable, a constant or an operator in {@code supported} over
   * variables. Defining constraints of the auxiliary variables are appended to {@code defining}.
   */
  public static Expression flattenObjective(
      Expression expr, Set<String> supported, List<Expression> defining, CseMap cse) {
    if (Expressions.isLeaf(expr)) {
      return expr;
    }
    if (expr.isBool()) {
      return getOrMakeVar(expr, defining, cse);
    }
    Expression flat = normalizedNumexpr(expr, defining, cse);
    if (Expressions.isLeaf(flat) || supported.contains(flat.name())) {
      return flat;
    }
    return getOrMakeVar(flat, defining, cse);
  }

  /**
   * Returns a variable or constant equal to {@code expr}. A new auxiliary variable is created,
   * and its definition appended to {@code defining}, unless the CSE map already has one.
   */
  public static Expression getOrMakeVar(
      Expression expr, List<Expression> defining, CseMap cse) {
    if (Expressions.isLeaf(expr)) {
      return expr;
    }
    Variable cached = cse.get(expr);
    if (cached != null) {
      return cached;
    }
    Expression flat =
        expr.isBool()
            ? normalizedBoolexpr(expr, defining, cse)
            : normalizedNumexpr(expr, defining, cse);
    if (Expressions.isLeaf(flat)) {
      if (flat instanceof Variable) {
        cse.put(expr, (Variable) flat);
      }
      return flat;
    }
    cached = cse.get(flat);
    if (cached != null) {
      cse.put(expr, cached);
      return cached;
    }
    Variable aux;
    if (expr.isBool()) {
      aux = new BoolVar();
    } else {
      long[] bounds = flat.bounds();
      aux = new IntVar(bounds[0], bounds[1]);
    }
    cse.put(expr, aux);
    cse.put(flat, aux);
    defining.add(new Comparison(Comparison.Op.EQ, flat, aux));
    return aux;
  }

  private static void flattenToplevel(Expression expr, List<Expression> out, CseMap cse) {
    if (expr instanceof BoolVal) {
      if (!((BoolVal) expr).get()) {
        out.add(expr);
      }
      return;
    }
    if (expr instanceof Variable || expr instanceof DirectConstraint) {
      out.add(expr);
      return;
    }
    if (!expr.isBool()) {
      throw new UnsupportedExpressionException(
          "flattenConstraint", "not a Boolean constraint", expr);
    }
    if (expr instanceof Operator) {
      Operator op = (Operator) expr;
      switch (op.kind()) {
        case AND:
          for (Expression arg : op.args()) {
            flattenToplevel(arg, out, cse);
          }
          return;
        case IMPLIES:
          flattenImplication(op.args().get(0), op.args().get(1), out, cse);
          return;
        case NOT:
          Expression negated = Expressions.not(op.args().get(0));
          if (!isNot(negated)) {
            flattenToplevel(negated, out, cse);
            return;
          }
          break;
        default:
          break;
      }
    }
    if (expr instanceof Comparison && isEquivalence((Comparison) expr)) {
      Comparison c = (Comparison) expr;
      flattenEquivalence(c.lhs(), equivalenceRhs(c), out, cse);
      return;
    }
    Expression flat = normalizedBoolexpr(expr, out, cse);
    if (flat instanceof BoolVal) {
      flattenToplevel(flat, out, cse);
    } else {
      out.add(flat);
    }
  }

  private static void flattenImplication(
      Expression lhs, Expression rhs, List<Expression> out, CseMap cse) {
    if (lhs instanceof BoolVal) {
      if (((BoolVal) lhs).get()) {
        flattenToplevel(rhs, out, cse);
      }
      return;
    }
    if (rhs instanceof BoolVal) {
      if (!((BoolVal) rhs).get()) {
        flattenToplevel(Expressions.not(lhs), out, cse);
      }
      return;
    }
    if (isKind(rhs, Operator.Kind.AND)) {
      for (Expression arg : rhs.args()) {
        flattenImplication(lhs, arg, out, cse);
      }
      return;
    }
    if (isKind(rhs, Operator.Kind.IMPLIES)) {
      flattenImplication(Expressions.and(lhs, rhs.args().get(0)), rhs.args().get(1), out, cse);
      return;
    }
    if (!(lhs instanceof Variable) && rhs instanceof Variable) {
      // Half reification BE -> BV.
      Expression flatLhs = normalizedBoolexpr(lhs, out, cse);
      if (flatLhs instanceof BoolVal) {
        flattenImplication(flatLhs, rhs, out, cse);
      } else {
        out.add(Expressions.implies(flatLhs, rhs));
      }
      return;
    }
    Expression condition = getOrMakeVar(lhs, out, cse);
    if (condition instanceof BoolVal) {
      flattenImplication(condition, rhs, out, cse);
      return;
    }
    Expression flatRhs = normalizedBoolexpr(rhs, out, cse);
    if (flatRhs instanceof BoolVal) {
      flattenImplication(condition, flatRhs, out, cse);
      return;
    }
    out.add(Expressions.implies(condition, flatRhs));
  }

  /** Flattens {@code lhs == rhs} over Booleans. */
  private static void flattenEquivalence(
      Expression lhs, Expression rhs, List<Expression> out, CseMap cse) {
    if (rhs instanceof BoolVal) {
      flattenToplevel(((BoolVal) rhs).get() ? lhs : Expressions.not(lhs), out, cse);
      return;
    }
    if (lhs instanceof BoolVal) {
      flattenToplevel(((BoolVal) lhs).get() ? rhs : Expressions.not(rhs), out, cse);
      return;
    }
    if (lhs instanceof Variable && !(rhs instanceof Variable)) {
      Expression tmp = lhs;
      lhs = rhs;
      rhs = tmp;
    }
    Expression var = getOrMakeVar(rhs, out, cse);
    if (var instanceof BoolVal) {
      flattenEquivalence(lhs, var, out, cse);
      return;
    }
    Expression flat = lhs instanceof Variable ? lhs : normalizedBoolexpr(lhs, out, cse);
    if (flat instanceof BoolVal) {
      flattenEquivalence(flat, var, out, cse);
      return;
    }
    out.add(new Comparison(Comparison.Op.EQ, flat, var));
  }

  /**
   * Returns a flat Boolean expression equivalent to {@code expr}, possibly a variable or a
   * constant.
   */
  static Expression normalizedBoolexpr(Expression expr, List<Expression> out, CseMap cse) {
    if (Expressions.isLeaf(expr) || expr instanceof DirectConstraint) {
      return expr;
    }
    if (expr instanceof Operator) {
      Operator op = (Operator) expr;
      switch (op.kind()) {
        case AND:
        case OR:
          return normalizedJunction(op, out, cse);
        case IMPLIES:
          {
            Expression lhs = op.args().get(0);
            Expression rhs = op.args().get(1);
            if (lhs instanceof BoolVal) {
              return ((BoolVal) lhs).get() ? normalizedBoolexpr(rhs, out, cse) : BoolVal.TRUE;
            }
            if (rhs instanceof BoolVal) {
              return ((BoolVal) rhs).get()
                  ? BoolVal.TRUE
                  : normalizedBoolexpr(Expressions.not(lhs), out, cse);
            }
            Expression condition = getOrMakeVar(lhs, out, cse);
            Expression conclusion = getOrMakeVar(rhs, out, cse);
            if (condition instanceof BoolVal || conclusion instanceof BoolVal) {
              return normalizedBoolexpr(Expressions.implies(condition, conclusion), out, cse);
            }
            return Expressions.implies(condition, conclusion);
          }
        case NOT:
          {
            Expression negated = Expressions.not(op.args().get(0));
            if (!isNot(negated)) {
              return normalizedBoolexpr(negated, out, cse);
            }
            return Expressions.not(getOrMakeVar(op.args().get(0), out, cse));
          }
        default:
          break;
      }
    }
    if (expr instanceof Comparison) {
      Comparison c = (Comparison) expr;
      if (isEquivalence(c)) {
        Expression lhs = c.lhs();
        Expression rhs = equivalenceRhs(c);
        if (rhs instanceof BoolVal) {
          return normalizedBoolexpr(
              ((BoolVal) rhs).get() ? lhs : Expressions.not(lhs), out, cse);
        }
        if (lhs instanceof BoolVal) {
          return normalizedBoolexpr(
              ((BoolVal) lhs).get() ? rhs : Expressions.not(rhs), out, cse);
        }
        Expression a = getOrMakeVar(lhs, out, cse);
        Expression b = getOrMakeVar(rhs, out, cse);
        if (a instanceof BoolVal || b instanceof BoolVal) {
          return normalizedBoolexpr(new Comparison(Comparison.Op.EQ, a, b), out, cse);
        }
        return new Comparison(Comparison.Op.EQ, a, b);
      }
      return normalizedComparison(c, out, cse);
    }
    if (expr instanceof GlobalConstraint) {
      return expr.withArgs(varsOf(expr.args(), out, cse));
    }
    throw new UnsupportedExpressionException(
        "normalizedBoolexpr", "cannot flatten Boolean expression", expr);
  }

  private static Expression normalizedJunction(Operator op, List<Expression> out, CseMap cse) {
    boolean isAnd = op.kind() == Operator.Kind.AND;
    List<Expression> operands = new ArrayList<>();
    collectJunction(op.kind(), op, operands);
    List<Expression> vars = new ArrayList<>();
    for (Expression operand : operands) {
      Expression var = getOrMakeVar(operand, out, cse);
      if (var instanceof BoolVal) {
        if (((BoolVal) var).get() != isAnd) {
          // A false conjunct or a true disjunct decides the whole expression.
          return BoolVal.of(!isAnd);
        }
        continue;
      }
      if (!vars.contains(var)) {
        vars.add(var);
      }
    }
    if (vars.isEmpty()) {
      return BoolVal.of(isAnd);
    }
    if (vars.size() == 1) {
      return vars.get(0);
    }
    return new Operator(op.kind(), vars);
  }

  /** Collects the operands of nested junctions of the same kind; implications count as "or". */
  private static void collectJunction(
      Operator.Kind kind, Expression expr, List<Expression> operands) {
    if (isKind(expr, kind)) {
      for (Expression arg : expr.args()) {
        collectJunction(kind, arg, operands);
      }
    } else if (kind == Operator.Kind.OR && isKind(expr, Operator.Kind.IMPLIES)) {
      collectJunction(kind, Expressions.not(expr.args().get(0)), operands);
      collectJunction(kind, expr.args().get(1), operands);
    } else {
      operands.add(expr);
    }
  }

  /** Returns a flat comparison {@code NumExpr op Var|Const}, or a constant. */
  private static Expression normalizedComparison(
      Comparison c, List<Expression> out, CseMap cse) {
    Comparison.Op op = c.op();
    Expression lhs = c.lhs();
    Expression rhs = c.rhs();
    if (isConstant(lhs) && isConstant(rhs)) {
      return BoolVal.of(op.test(lhs.value(), rhs.value()));
    }
    if (isLinear(lhs) && isLinear(rhs) && !(Expressions.isLeaf(lhs) && Expressions.isLeaf(rhs))) {
      // Move all terms to the left and the constant to the right.
      LinearCollector collector = new LinearCollector();
      collector.add(lhs, 1);
      collector.add(rhs, -1);
      Expression terms = collector.build(false, out, cse);
      long constant = -collector.offset;
      if (terms instanceof Constant) {
        return BoolVal.of(op.test(((Constant) terms).get(), constant));
      }
      return new Comparison(op, terms, Constant.of(constant));
    }
    if (Expressions.isLeaf(lhs) && !Expressions.isLeaf(rhs)) {
      Expression tmp = lhs;
      lhs = rhs;
      rhs = tmp;
      op = op.flip();
    }
    Expression flatLhs = normalizedNumexpr(lhs, out, cse);
    Expression flatRhs = getOrMakeVar(rhs, out, cse);
    if (isConstant(flatLhs) && isConstant(flatRhs)) {
      return BoolVal.of(op.test(flatLhs.value(), flatRhs.value()));
    }
    if (isConstant(flatLhs)) {
      return new Comparison(op.flip(), flatRhs, flatLhs);
    }
    return new Comparison(op, flatLhs, flatRhs);
  }

  /**
   * Returns a flat numeric expression equal to {@code expr}: a leaf, or an operator or global
   * function over leaves.
   */
  static Expression normalizedNumexpr(Expression expr, List<Expression> out, CseMap cse) {
    if (Expressions.isLeaf(expr)) {
      return expr;
    }
    if (expr.isBool()) {
      return getOrMakeVar(expr, out, cse);
    }
    if (expr instanceof Operator) {
      Operator op = (Operator) expr;
      switch (op.kind()) {
        case SUM:
        case WSUM:
        case NEG:
          return linear(op, out, cse);
        case SUB:
          if (Expressions.hasLeafArgs(op)) {
            return op;
          }
          return linear(op, out, cse);
        case MUL:
          {
            if (isConstant(op.args().get(0)) || isConstant(op.args().get(1))) {
              return linear(op, out, cse);
            }
            List<Expression> vars = varsOf(op.args(), out, cse);
            if (isConstant(vars.get(0)) || isConstant(vars.get(1))) {
              return linear(op.withArgs(vars), out, cse);
            }
            return op.withArgs(vars);
          }
        case DIV:
        case MOD:
        case POW:
          {
            Operator flat = op.withArgs(varsOf(op.args(), out, cse));
            if (isConstant(flat.args().get(0)) && isConstant(flat.args().get(1))) {
              Long value = flat.value();
              if (value != null) {
                return Constant.of(value);
              }
            }
            return flat;
          }
        default:
          break;
      }
    }
    if (expr instanceof GlobalFunction) {
      Expression flat = expr.withArgs(varsOf(expr.args(), out, cse));
      boolean allConstant = true;
      for (Expression arg : flat.args()) {
        allConstant &= isConstant(arg);
      }
      Long value = allConstant ? flat.value() : null;
      return value != null ? Constant.of(value) : flat;
    }
    throw new UnsupportedExpressionException(
        "normalizedNumexpr", "cannot flatten numeric expression", expr);
  }

  private static Expression linear(Expression expr, List<Expression> out, CseMap cse) {
    LinearCollector collector = new LinearCollector();
    collector.add(expr, 1);
    return collector.build(true, out, cse);
  }

  private static List<Expression> varsOf(
      List<Expression> exprs, List<Expression> out, CseMap cse) {
    List<Expression> vars = new ArrayList<>();
    for (Expression e : exprs) {
      vars.add(getOrMakeVar(e, out, cse));
    }
    return vars;
  }

  private static boolean isConstant(Expression expr) {
    return expr instanceof Constant || expr instanceof BoolVal;
  }

  private static boolean isKind(Expression expr, Operator.Kind kind) {
    return expr instanceof Operator && ((Operator) expr).kind() == kind;
  }

  static boolean isNot(Expression expr) {
    return isKind(expr, Operator.Kind.NOT);
  }

  private static boolean isEquivalence(Comparison c) {
    return c.isBoolComparison() && (c.op() == Comparison.Op.EQ || c.op() == Comparison.Op.NE);
  }

  /** Returns the right side of an equivalence, negated for {@code !=}. */
  private static Expression equivalenceRhs(Comparison c) {
    return c.op() == Comparison.Op.EQ ? c.rhs() : Expressions.not(c.rhs());
  }

  /** Returns true for expressions whose top node is linear in its arguments. */
  private static boolean isLinear(Expression expr) {
    if (Expressions.isLeaf(expr)) {
      return true;
    }
    if (!(expr instanceof Operator)) {
      return false;
    }
    Operator op = (Operator) expr;
    switch (op.kind()) {
      case SUM:
      case WSUM:
      case SUB:
      case NEG:
        return true;
      case MUL:
        return isConstant(op.args().get(0)) || isConstant(op.args().get(1));
      default:
        return false;
    }
  }

  /** Accumulates the weighted terms and the constant offset of nested linear expressions. */
  private static final class LinearCollector {
    void add(Expression expr, long coef) {
      if (isConstant(expr)) {
        offset += coef * expr.value();
        return;
      }
      if (expr instanceof Operator) {
        Operator op = (Operator) expr;
        List<Expression> args = op.args();
        switch (op.kind()) {
          case SUM:
            for (Expression arg : args) {
              add(arg, coef);
            }
            return;
          case WSUM:
            for (int i = 0; i < args.size(); ++i) {
              add(args.get(i), coef * op.weights().get(i));
            }
            return;
          case SUB:
            add(args.get(0), coef);
            add(args.get(1), -coef);
            return;
          case NEG:
            add(args.get(0), -coef);
            return;
          case MUL:
            if (isConstant(args.get(0))) {
              add(args.get(1), coef * args.get(0).value());
              return;
            }
            if (isConstant(args.get(1))) {
              add(args.get(0), coef * args.get(1).value());
              return;
            }
            break;
          default:
            break;
        }
      }
      terms.merge(expr, coef, Long::sum);
    }

    /** Returns the sum of the terms, with the offset as an extra constant if requested. */
    Expression build(boolean withOffset, List<Expression> out, CseMap cse) {
      Map<Expression, Long> merged = new LinkedHashMap<>();
      for (Map.Entry<Expression, Long> term : terms.entrySet()) {
        if (term.getValue() == 0) {
          continue;
        }
        Expression var = getOrMakeVar(term.getKey(), out, cse);
        if (isConstant(var)) {
          offset += term.getValue() * var.value();
        } else {
          merged.merge(var, term.getValue(), Long::sum);
        }
      }
      List<Expression> vars = new ArrayList<>();
      List<Long> weights = new ArrayList<>();
      boolean unit = true;
      for (Map.Entry<Expression, Long> term : merged.entrySet()) {
        if (term.getValue() != 0) {
          vars.add(term.getKey());
          weights.add(term.getValue());
          unit &= term.getValue() == 1;
        }
      }
      if (withOffset && offset != 0) {
        if (vars.isEmpty()) {
          return Constant.of(offset);
        }
        vars.add(Constant.of(offset));
        weights.add(1L);
      } else if (vars.isEmpty()) {
        return Constant.of(0);
      }
      if (unit) {
        return vars.size() == 1 ? vars.get(0) : new Operator(Operator.Kind.SUM, vars);
      }
      return new Operator(Operator.Kind.WSUM, vars, weights);
    }

    private final Map<Expression, Long> terms = new LinkedHashMap<>();
    private long offset = 0;
  }

  private Flatten() {}
}
