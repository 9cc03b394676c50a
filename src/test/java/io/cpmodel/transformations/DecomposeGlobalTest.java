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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.cpmodel.expressions.BoolVar;
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Expressions;
import io.cpmodel.expressions.GlobalConstraint;
import io.cpmodel.expressions.GlobalFunction;
import io.cpmodel.expressions.IntVar;
import io.cpmodel.expressions.Operator;
import io.cpmodel.expressions.Variable;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Tests {@link DecomposeGlobal}. */
public final class DecomposeGlobalTest {
  private static boolean containsGlobal(Expression expr) {
    if (expr instanceof GlobalConstraint || expr instanceof GlobalFunction) {
      return true;
    }
    for (Expression arg : expr.args()) {
      if (containsGlobal(arg)) {
        return true;
      }
    }
    return false;
  }

  @Test
  public void testDecomposeInTree_unsupportedToplevelConstraint() {
    final ImmutableList<IntVar> xs = Expressions.intVars(3, 0, 2, "x");
    final List<Expression> result =
        DecomposeGlobal.decomposeInTree(
            ImmutableList.of(Expressions.allDifferent(xs)),
            ImmutableSet.of(),
            ImmutableSet.of(),
            new CseMap());
    assertThat(result)
        .containsExactly(
            xs.get(0).ne(xs.get(1)), xs.get(0).ne(xs.get(2)), xs.get(1).ne(xs.get(2)))
        .inOrder();
  }

  @Test
  public void testDecomposeInTree_supportedKept() {
    final ImmutableList<IntVar> xs = Expressions.intVars(3, 0, 2, "x");
    final Expression allDifferent = Expressions.allDifferent(xs);
    final List<Expression> result =
        DecomposeGlobal.decomposeInTree(
            ImmutableList.of(allDifferent),
            ImmutableSet.of("alldifferent"),
            ImmutableSet.of(),
            new CseMap());
    assertThat(result).containsExactly(allDifferent);
  }

  @Test
  public void testDecomposeInTree_nestedNeedsReifiedSupport() {
    final BoolVar b = new BoolVar("b");
    final ImmutableList<IntVar> xs = Expressions.intVars(2, 0, 2, "x");
    final List<Expression> result =
        DecomposeGlobal.decomposeInTree(
            ImmutableList.of(Expressions.implies(b, Expressions.allDifferent(xs))),
            ImmutableSet.of("alldifferent"),
            ImmutableSet.of(),
            new CseMap());
    assertThat(result).containsExactly(Expressions.implies(b, xs.get(0).ne(xs.get(1))));
  }

  @Test
  public void testDecomposeInTree_functionPreservesSolutions() {
    final IntVar x = new IntVar(0, 3, "x");
    final IntVar y = new IntVar(0, 3, "y");
    final Expression c = Expressions.min(ImmutableList.of(x, y)).ge(2);
    final List<Expression> result =
        DecomposeGlobal.decomposeInTree(
            ImmutableList.of(c), ImmutableSet.of(), ImmutableSet.of(), new CseMap());
    for (Expression r : result) {
      assertThat(containsGlobal(r)).isFalse();
    }
    final Set<List<Long>> expected = new HashSet<>();
    for (long a = 2; a <= 3; ++a) {
      for (long b = 2; b <= 3; ++b) {
        expected.add(ImmutableList.of(a, b));
      }
    }
    assertThat(BruteForce.solutions(result, ImmutableList.of(x, y)))
        .containsExactlyElementsIn(expected);
  }

  @Test
  public void testDecomposeInTree_sharesFunctionDecomposition() {
    final IntVar x = new IntVar(0, 3, "x");
    final IntVar y = new IntVar(0, 3, "y");
    final Expression max = Expressions.max(ImmutableList.of(x, y));
    final CseMap cse = new CseMap();
    final List<Expression> result =
        DecomposeGlobal.decomposeInTree(
            ImmutableList.of(max.ge(1), max.le(2)), ImmutableSet.of(), ImmutableSet.of(), cse);
    final Set<Variable> vars = Expressions.getVariables(result);
    assertThat(vars).hasSize(3);
    assertThat(cse.size()).isEqualTo(1);
  }

  @Test
  public void testDecomposeInTree_globalInsideDecompositionIsDecomposed() {
    final ImmutableList<IntVar> succ = Expressions.intVars(3, 0, 2, "s");
    final List<Expression> result =
        DecomposeGlobal.decomposeInTree(
            ImmutableList.of(new io.cpmodel.expressions.Circuit(succ)),
            ImmutableSet.of(),
            ImmutableSet.of(),
            new CseMap());
    for (Expression r : result) {
      assertThat(containsGlobal(r)).isFalse();
      assertThat(r instanceof Operator && ((Operator) r).kind() == Operator.Kind.AND).isFalse();
    }
  }
}
