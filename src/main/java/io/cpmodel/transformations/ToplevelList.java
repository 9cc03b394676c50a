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
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Expressions;
import io.cpmodel.expressions.Operator;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/** Turns a collection of constraints into a flat list of toplevel Boolean constraints. */
public final class ToplevelList {
  public static List<Expression> toplevelList(Iterable<? extends Expression> constraints) {
    return toplevelList(constraints, false);
  }

  /**
   * Splits conjunctions, drops {@code true}, keeps {@code false}, pushes negations down and
   * rejects numeric expressions.
   *
   * @param removeDuplicates whether to keep only the first of structurally equal constraints
   */
  public static List<Expression> toplevelList(
      Iterable<? extends Expression> constraints, boolean removeDuplicates) {
    List<Expression> result = new ArrayList<>();
    for (Expression c : constraints) {
      add(c, result);
    }
    if (removeDuplicates) {
      return new ArrayList<>(new LinkedHashSet<>(result));
    }
    return result;
  }

  private static void add(Expression expr, List<Expression> result) {
    if (!expr.isBool()) {
      throw new UnsupportedExpressionException(
          "toplevelList", "only Boolean expressions can be constraints", expr);
    }
    if (expr instanceof BoolVal) {
      if (!((BoolVal) expr).get()) {
        result.add(expr);
      }
      return;
    }
    if (expr instanceof Operator) {
      Operator op = (Operator) expr;
      if (op.kind() == Operator.Kind.AND) {
        for (Expression arg : op.args()) {
          add(arg, result);
        }
        return;
      }
      if (op.kind() == Operator.Kind.NOT) {
        Expression negated = Expressions.not(op.args().get(0));
        if (!isUnpushedNot(negated)) {
          add(negated, result);
          return;
        }
      }
    }
    result.add(expr);
  }

  private static boolean isUnpushedNot(Expression expr) {
    return expr instanceof Operator && ((Operator) expr).kind() == Operator.Kind.NOT;
  }

  private ToplevelList() {}
}
