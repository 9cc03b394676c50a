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

import io.cpmodel.expressions.Decomposition;
import io.cpmodel.expressions.DirectConstraint;
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Expressions;
import io.cpmodel.expressions.FunctionDecomposition;
import io.cpmodel.expressions.GlobalConstraint;
import io.cpmodel.expressions.GlobalFunction;
import io.cpmodel.expressions.Operator;
import io.cpmodel.expressions.Variable;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/** Replaces the globals a backend does not support by their decomposition. */
public final class DecomposeGlobal {
  private static final Logger logger = Logger.getLogger(DecomposeGlobal.class.getName());

  /**
   * Decomposes unsupported globals anywhere in the expression trees.
   *
   * <p>A toplevel global constraint outside {@code supported}, or a nested one outside {@code
   * supportedReified}, is replaced by its decomposition: spliced into the list at toplevel, or as
   * a conjunction when nested. A global function outside {@code supported} is replaced by its
   * value expression, and its defining constraints are added at toplevel. Newly introduced
   * constraints are decomposed in turn.
   */
  public static List<Expression> decomposeInTree(
      List<Expression> constraints,
      Set<String> supported,
      Set<String> supportedReified,
      CseMap cse) {
    List<Expression> result = new ArrayList<>();
    List<Expression> todo = constraints;
    while (!todo.isEmpty()) {
      List<Expression> toplevel = new ArrayList<>();
      for (Expression c : todo) {
        result.add(decompose(c, false, supported, supportedReified, cse, toplevel));
      }
      todo = ToplevelList.toplevelList(toplevel);
    }
    return ToplevelList.toplevelList(result);
  }

  private static Expression decompose(
      Expression expr,
      boolean nested,
      Set<String> supported,
      Set<String> supportedReified,
      CseMap cse,
      List<Expression> toplevel) {
    if (expr.args().isEmpty() || expr instanceof DirectConstraint) {
      return expr;
    }
    // The arguments of a conjunction at toplevel are toplevel constraints too.
    boolean argsNested =
        nested
            || !(expr instanceof Operator && ((Operator) expr).kind() == Operator.Kind.AND);
    List<Expression> newArgs = new ArrayList<>();
    boolean changed = false;
    for (Expression arg : expr.args()) {
      Expression newArg = decompose(arg, argsNested, supported, supportedReified, cse, toplevel);
      changed |= newArg != arg;
      newArgs.add(newArg);
    }
    Expression rebuilt = changed ? expr.withArgs(newArgs) : expr;

    if (rebuilt instanceof GlobalConstraint) {
      boolean keep =
          nested
              ? supportedReified.contains(rebuilt.name())
              : supported.contains(rebuilt.name());
      if (keep) {
        return rebuilt;
      }
      logger.fine("decomposing " + rebuilt);
      Decomposition d = ((GlobalConstraint) rebuilt).decompose();
      toplevel.addAll(d.defining());
      return decompose(
          Expressions.and(d.constraints()), nested, supported, supportedReified, cse, toplevel);
    }
    if (rebuilt instanceof GlobalFunction) {
      if (supported.contains(rebuilt.name())) {
        return rebuilt;
      }
      Variable cached = cse.get(rebuilt);
      if (cached != null) {
        return cached;
      }
      logger.fine("decomposing " + rebuilt);
      FunctionDecomposition d = ((GlobalFunction) rebuilt).decompose();
      toplevel.addAll(d.defining());
      if (d.value() instanceof Variable && !d.defining().isEmpty()) {
        cse.put(rebuilt, (Variable) d.value());
      }
      return decompose(d.value(), true, supported, supportedReified, cse, toplevel);
    }
    return rebuilt;
  }

  private DecomposeGlobal() {}
}
