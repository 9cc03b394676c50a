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
import io.cpmodel.expressions.BoolVal;
import io.cpmodel.expressions.Constant;
import io.cpmodel.expressions.DirectConstraint;
import io.cpmodel.expressions.Element;
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Expressions;
import io.cpmodel.expressions.IntVar;
import io.cpmodel.expressions.Operator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Rewrites partial functions into total ones under relational semantics: a Boolean expression
 * containing an undefined sub-expression is false.
 *
 * <p>A partial function {@code f(x)} whose argument range contains undefined values is replaced
 * by {@code f(s)}, where the fresh variable {@code s} ranges over the defined values only. The
 * constraint {@code defined -> s == x} is posted at toplevel and the nearest enclosing Boolean
 * expression {@code B} becomes {@code defined and B}.
 */
public final class Safening {
  private static final Logger logger = Logger.getLogger(Safening.class.getName());

  /**
   * Safens every partial function in {@code constraints}.
   *
   * @param safenToplevel names of the partial functions to safen even when their nearest Boolean
   *     context is a toplevel constraint, for backends that cannot post them unsafe
   */
  public static List<Expression> noPartialFunctions(
      List<Expression> constraints, Set<String> safenToplevel) {
    List<Expression> result = new ArrayList<>();
    List<Expression> defining = new ArrayList<>();
    for (Expression c : constraints) {
      result.add(safenBool(c, true, safenToplevel, defining));
    }
    result.addAll(defining);
    return ToplevelList.toplevelList(result);
  }

  /** Returns true if {@code expr} is undefined for some values of its arguments. */
  public static boolean isPartial(Expression expr) {
    if (expr instanceof Operator) {
      Operator op = (Operator) expr;
      if (op.kind() == Operator.Kind.DIV || op.kind() == Operator.Kind.MOD) {
        Expression divisor = op.args().get(1);
        return divisor.lb() <= 0 && divisor.ub() >= 0;
      }
      return false;
    }
    if (expr instanceof Element) {
      Element element = (Element) expr;
      Expression index = element.index();
      return index.lb() < 0 || index.ub() >= element.array().size();
    }
    return false;
  }

  private static Expression safenBool(
      Expression expr, boolean toplevel, Set<String> safenToplevel, List<Expression> defining) {
    if (expr.args().isEmpty() || expr instanceof DirectConstraint) {
      return expr;
    }
    List<Expression> guards = new ArrayList<>();
    List<Expression> newArgs = new ArrayList<>();
    boolean changed = false;
    for (Expression arg : expr.args()) {
      Expression newArg =
          arg.isBool()
              ? safenBool(arg, false, safenToplevel, defining)
              : safenNumeric(arg, toplevel, safenToplevel, guards, defining);
      changed |= newArg != arg;
      newArgs.add(newArg);
    }
    Expression rebuilt = changed ? expr.withArgs(newArgs) : expr;
    if (guards.isEmpty()) {
      return rebuilt;
    }
    guards.add(rebuilt);
    return Expressions.and(guards);
  }

  private static Expression safenNumeric(
      Expression expr,
      boolean toplevel,
      Set<String> safenToplevel,
      List<Expression> guards,
      List<Expression> defining) {
    if (expr.args().isEmpty()) {
      return expr;
    }
    List<Expression> newArgs = new ArrayList<>();
    boolean changed = false;
    for (Expression arg : expr.args()) {
      Expression newArg =
          arg.isBool()
              ? safenBool(arg, false, safenToplevel, defining)
              : safenNumeric(arg, toplevel, safenToplevel, guards, defining);
      changed |= newArg != arg;
      newArgs.add(newArg);
    }
    Expression rebuilt = changed ? expr.withArgs(newArgs) : expr;
    if (isPartial(rebuilt) && (!toplevel || safenToplevel.contains(rebuilt.name()))) {
      logger.fine("safening " + rebuilt);
      if (rebuilt instanceof Element) {
        return safenElement((Element) rebuilt, guards, defining);
      }
      return safenDivision((Operator) rebuilt, guards, defining);
    }
    return rebuilt;
  }

  private static Expression safenDivision(
      Operator op, List<Expression> guards, List<Expression> defining) {
    Expression divisor = op.args().get(1);
    long lb = divisor.lb();
    long ub = divisor.ub();
    if (lb == 0 && ub == 0) {
      guards.add(BoolVal.FALSE);
      return Constant.of(0);
    }
    IntVar safe = new IntVar(lb == 0 ? 1 : lb, ub == 0 ? -1 : ub);
    if (safe.lb() < 0 && safe.ub() > 0) {
      defining.add(safe.ne(0));
    }
    Expression defined = divisor.ne(0);
    defining.add(Expressions.implies(defined, safe.eq(divisor)));
    guards.add(defined);
    return op.withArgs(ImmutableList.of(op.args().get(0), safe));
  }

  private static Expression safenElement(
      Element element, List<Expression> guards, List<Expression> defining) {
    Expression index = element.index();
    int n = element.array().size();
    if (index.ub() < 0 || index.lb() >= n) {
      guards.add(BoolVal.FALSE);
      return Constant.of(0);
    }
    IntVar safe = new IntVar(Math.max(index.lb(), 0), Math.min(index.ub(), n - 1));
    List<Expression> inRange = new ArrayList<>();
    if (index.lb() < 0) {
      inRange.add(index.ge(0));
    }
    if (index.ub() >= n) {
      inRange.add(index.le(n - 1));
    }
    Expression defined = Expressions.and(inRange);
    defining.add(Expressions.implies(defined, safe.eq(index)));
    guards.add(defined);
    return new Element(element.array(), safe);
  }

  private Safening() {}
}
