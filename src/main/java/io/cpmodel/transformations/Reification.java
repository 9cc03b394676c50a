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

import com.google.common.collect.ImmutableList;
import io.cpmodel.exceptions.UnsupportedExpressionException;
import io.cpmodel.expressions.BoolVar;
import io.cpmodel.expressions.Comparison;
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Expressions;
import io.cpmodel.expressions.GlobalConstraint;
import io.cpmodel.expressions.Operator;
import io.cpmodel.expressions.Variable;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Passes over reified constraints: {@code BE == BV}, {@code BV -> BE} and {@code BE -> BV},
 * where BE is a flat Boolean expression and BV a Boolean variable.
 */
public final class Reification {
  /**
   * Makes every reified Boolean expression one the backend can reify. In a reified comparison,
   * a left side that is neither a variable nor in {@code supported} is replaced by an auxiliary
   * variable. A reified global constraint outside {@code supported} cannot be rewritten.
   */
  public static List<Expression> reifyRewrite(
      List<Expression> constraints, Set<String> supported, CseMap cse) {
    List<Expression> result = new ArrayList<>();
    for (Expression expr : constraints) {
      int index = reifiedIndex(expr);
      if (index < 0) {
        result.add(expr);
        continue;
      }
      Expression reified = expr.args().get(index);
      if (reified instanceof GlobalConstraint) {
        if (!supported.contains(reified.name())) {
          throw new UnsupportedExpressionException(
              "reifyRewrite", "global constraint cannot be reified", reified);
        }
        result.add(expr);
        continue;
      }
      if (!(reified instanceof Comparison) || ((Comparison) reified).isBoolComparison()) {
        result.add(expr);
        continue;
      }
      Comparison c = (Comparison) reified;
      Expression lhs = c.lhs();
      if (Expressions.isLeaf(lhs) || supported.contains(lhs.name())) {
        result.add(expr);
        continue;
      }
      List<Expression> defining = new ArrayList<>();
      Expression var = Flatten.getOrMakeVar(lhs, defining, cse);
      List<Expression> newArgs = new ArrayList<>(expr.args());
      newArgs.set(index, c.withArgs(ImmutableList.of(var, c.rhs())));
      result.add(expr.withArgs(newArgs));
      result.addAll(defining);
    }
    return result;
  }

  /**
   * Puts the variable first: {@code BE -> BV} becomes {@code ~BV -> ~BE}, with the negation
   * flattened again, and {@code BE == BV} becomes {@code BV == BE}.
   */
  public static List<Expression> onlyBvReifies(List<Expression> constraints, CseMap cse) {
    List<Expression> result = new ArrayList<>();
    for (Expression expr : constraints) {
      if (!isImplication(expr) && !isEquivalence(expr)) {
        result.add(expr);
        continue;
      }
      Expression a0 = expr.args().get(0);
      Expression a1 = expr.args().get(1);
      if (a0 instanceof Variable || !(a1 instanceof Variable)) {
        result.add(expr);
        continue;
      }
      if (isImplication(expr)) {
        Expression contrapositive =
            Expressions.implies(((BoolVar) a1).not(), Expressions.not(a0));
        List<Expression> flat = Flatten.flattenConstraint(ImmutableList.of(contrapositive), cse);
        result.addAll(onlyBvReifies(flat, cse));
      } else {
        result.add(new Comparison(Comparison.Op.EQ, a1, a0));
      }
    }
    return result;
  }

  /**
   * Replaces equivalences by implications: {@code BV == BE} becomes {@code BV -> BE} and {@code
   * ~BV -> ~BE}, two variables become two implications. Nested implications {@code BV -> (a ->
   * b)} become {@code BV -> or(~a, b)}.
   */
  public static List<Expression> onlyImplies(List<Expression> constraints, CseMap cse) {
    List<Expression> result = new ArrayList<>();
    for (Expression expr : constraints) {
      if (isImplication(expr) && isImplication(expr.args().get(1))) {
        Expression inner = expr.args().get(1);
        result.add(
            Expressions.implies(
                expr.args().get(0),
                Expressions.or(Expressions.not(inner.args().get(0)), inner.args().get(1))));
        continue;
      }
      if (!isEquivalence(expr)) {
        result.add(expr);
        continue;
      }
      Expression a0 = expr.args().get(0);
      Expression a1 = expr.args().get(1);
      if (!(a0 instanceof Variable)) {
        Expression tmp = a0;
        a0 = a1;
        a1 = tmp;
      }
      if (!(a0 instanceof Variable)) {
        result.add(expr);
        continue;
      }
      BoolVar bv = (BoolVar) a0;
      result.addAll(onlyImplies(ImmutableList.of(Expressions.implies(bv, a1)), cse));
      if (a1 instanceof Variable) {
        result.add(Expressions.implies(bv.not(), ((BoolVar) a1).not()));
      } else {
        Expression negation = Expressions.implies(bv.not(), Expressions.not(a1));
        List<Expression> flat = Flatten.flattenConstraint(ImmutableList.of(negation), cse);
        result.addAll(onlyImplies(flat, cse));
      }
    }
    return result;
  }

  /** Returns the index of the reified expression in a reification, or -1. */
  private static int reifiedIndex(Expression expr) {
    if (isImplication(expr)) {
      if (expr.args().get(0) instanceof Variable) {
        return expr.args().get(1) instanceof Variable ? -1 : 1;
      }
      return expr.args().get(1) instanceof Variable ? 0 : -1;
    }
    if (isEquivalence(expr)) {
      Expression a0 = expr.args().get(0);
      Expression a1 = expr.args().get(1);
      if (!(a0 instanceof Variable) && a1 instanceof Variable) {
        return 0;
      }
      if (a0 instanceof Variable && !(a1 instanceof Variable)) {
        return 1;
      }
    }
    return -1;
  }

  static boolean isImplication(Expression expr) {
    return expr instanceof Operator && ((Operator) expr).kind() == Operator.Kind.IMPLIES;
  }

  /** Returns true for {@code ==} between two Boolean expressions. */
  static boolean isEquivalence(Expression expr) {
    return expr instanceof Comparison
        && ((Comparison) expr).op() == Comparison.Op.EQ
        && ((Comparison) expr).isBoolComparison();
  }

  private Reification() {}
}
