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
import io.cpmodel.expressions.Comparison;
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Expressions;
import io.cpmodel.expressions.IntVar;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests {@link Comparisons}. */
public final class ComparisonsTest {
  private static final ImmutableSet<String> LINEAR = ImmutableSet.of("sum", "wsum", "sub");

  @Test
  public void testOnlyNumexprEquality_inequalityOverProduct() {
    final IntVar x = new IntVar(0, 3, "x");
    final IntVar y = new IntVar(0, 3, "y");
    final List<Expression> result =
        Comparisons.onlyNumexprEquality(
            ImmutableList.of(x.times(y).le(3)), LINEAR, new CseMap());
    assertThat(result).hasSize(2);
    final Comparison c = (Comparison) result.get(0);
    assertThat(c.op()).isEqualTo(Comparison.Op.LE);
    assertThat(c.lhs()).isInstanceOf(IntVar.class);
    assertThat(result.get(1)).isEqualTo(x.times(y).eq(c.lhs()));
    assertThat(BruteForce.solutions(result, ImmutableList.of(x, y)))
        .containsExactlyElementsIn(
            BruteForce.solutions(ImmutableList.of(x.times(y).le(3)), ImmutableList.of(x, y)));
  }

  @Test
  public void testOnlyNumexprEquality_equalityAndLinearKept() {
    final IntVar x = new IntVar(0, 3, "x");
    final IntVar y = new IntVar(0, 3, "y");
    final List<Expression> constraints =
        ImmutableList.of(x.times(y).eq(3), x.plus(y).ne(2), x.lt(y));
    assertThat(Comparisons.onlyNumexprEquality(constraints, LINEAR, new CseMap()))
        .containsExactlyElementsIn(constraints)
        .inOrder();
  }

  @Test
  public void testOnlyNumexprEquality_reifiedComparison() {
    final BoolVar a = new BoolVar("a");
    final IntVar x = new IntVar(0, 3, "x");
    final IntVar y = new IntVar(0, 3, "y");
    final CseMap cse = new CseMap();
    final List<Expression> result =
        Comparisons.onlyNumexprEquality(
            ImmutableList.of(Expressions.implies(a, x.times(y).ne(2))), LINEAR, cse);
    assertThat(result).hasSize(2);
    final Comparison reified = (Comparison) result.get(0).args().get(1);
    assertThat(reified.lhs()).isInstanceOf(IntVar.class);
    assertThat(cse.get(x.times(y))).isSameInstanceAs(reified.lhs());
  }
}
