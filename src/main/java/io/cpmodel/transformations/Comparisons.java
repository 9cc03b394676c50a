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
import io.cpmodel.expressions.Comparison;
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Expressions;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Passes over numeric comparisons. */
public final class Comparisons {
  /**
   * Keeps non-equality comparisons over supported left sides only: in {@code NumExpr op Var}
   * with {@code op} other than {@code ==}, a left side that is neither a variable nor in {@code
   * supported} is replaced by an auxiliary variable. Applies to toplevel and reified
   * comparisons.
   */
  public static List<Expression> onlyNumexprEquality(
      List<Expression> constraints, Set<String> supported, CseMap cse) {
    List<Expression> result = new ArrayList<>();
    for (Expression expr : constraints) {
      List<Expression> defining = new ArrayList<>();
      if (Reification.isImplication(expr) || Reification.isEquivalence(expr)) {
        List<Expression> newArgs = new ArrayList<>();
        boolean changed = false;
        for (Expression arg : expr.args()) {
          Expression newArg = arg instanceof Comparison
              ? rewrite((Comparison) arg, supported, defining, cse)
              : arg;
          changed |= newArg != arg;
          newArgs.add(newArg);
        }
        result.add(changed ? expr.withArgs(newArgs) : expr);
      } else if (expr instanceof Comparison) {
        result.add(rewrite((Comparison) expr, supported, defining, cse));
      } else {
        result.add(expr);
      }
      result.addAll(defining);
    }
    return result;
  }

  private static Comparison rewrite(
      Comparison c, Set<String> supported, List<Expression> defining, CseMap cse) {
    Expression lhs = c.lhs();
    if (c.op() == Comparison.Op.EQ
        || c.isBoolComparison()
        || Expressions.isLeaf(lhs)
        || supported.contains(lhs.name())) {
      return c;
    }
    Expression var = Flatten.getOrMakeVar(lhs, defining, cse);
    return c.withArgs(ImmutableList.of(var, c.rhs()));
  }

  private Comparisons() {}
}
