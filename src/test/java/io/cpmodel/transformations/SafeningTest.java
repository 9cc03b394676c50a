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
import io.cpmodel.expressions.Constant;
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Expressions;
import io.cpmodel.expressions.IntVar;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Tests {@link Safening}. */
public final class SafeningTest {
  @Test
  public void testIsPartial() {
    final IntVar x = new IntVar(0, 4, "x");
    assertThat(Safening.isPartial(x.div(new IntVar(-2, 2)))).isTrue();
    assertThat(Safening.isPartial(x.div(new IntVar(1, 3)))).isFalse();
    assertThat(Safening.isPartial(x.mod(new IntVar(0, 3)))).isTrue();
    final ImmutableList<Constant> arr = ImmutableList.of(Constant.of(5), Constant.of(6));
    assertThat(Safening.isPartial(Expressions.element(arr, new IntVar(0, 2)))).isTrue();
    assertThat(Safening.isPartial(Expressions.element(arr, new IntVar(0, 1)))).isFalse();
    assertThat(Safening.isPartial(x.plus(1))).isFalse();
  }

  @Test
  public void testNoPartialFunctions_toplevelKeptUnlessRequested() {
    final IntVar x = new IntVar(0, 4, "x");
    final IntVar y = new IntVar(0, 2, "y");
    final List<Expression> constraints = ImmutableList.of(x.div(y).eq(2));
    assertThat(Safening.noPartialFunctions(constraints, ImmutableSet.of()))
        .containsExactlyElementsIn(constraints);
  }

  @Test
  public void testNoPartialFunctions_toplevelDivision() {
    final IntVar x = new IntVar(0, 4, "x");
    final IntVar y = new IntVar(0, 2, "y");
    final List<Expression> safe =
        Safening.noPartialFunctions(ImmutableList.of(x.div(y).eq(2)), ImmutableSet.of("div"));
    final Set<List<Long>> expected = new HashSet<>();
    for (long a = 0; a <= 4; ++a) {
      for (long b = 1; b <= 2; ++b) {
        if (a / b == 2) {
          expected.add(ImmutableList.of(a, b));
        }
      }
    }
    assertThat(BruteForce.solutions(safe, ImmutableList.of(x, y)))
        .containsExactlyElementsIn(expected);
  }

  @Test
  public void testNoPartialFunctions_nestedDivisionIsFalseWhenUndefined() {
    final BoolVar b = new BoolVar("b");
    final IntVar x = new IntVar(0, 4, "x");
    final IntVar y = new IntVar(-1, 1, "y");
    final Expression c = Expressions.implies(b, x.div(y).eq(2));
    final List<Expression> safe =
        Safening.noPartialFunctions(ImmutableList.of(c), ImmutableSet.of());

    final Set<List<Long>> expected = new HashSet<>();
    for (long bv = 0; bv <= 1; ++bv) {
      for (long a = 0; a <= 4; ++a) {
        for (long d = -1; d <= 1; ++d) {
          if (bv == 0 || (d != 0 && a / d == 2)) {
            expected.add(ImmutableList.of(bv, a, d));
          }
        }
      }
    }
    assertThat(BruteForce.solutions(safe, ImmutableList.of(b, x, y)))
        .containsExactlyElementsIn(expected);
  }

  @Test
  public void testNoPartialFunctions_disjunction() {
    final IntVar x = new IntVar(0, 3, "x");
    final IntVar y = new IntVar(0, 1, "y");
    final Expression c = x.mod(y).eq(1).or(x.eq(0));
    final List<Expression> safe =
        Safening.noPartialFunctions(ImmutableList.of(c), ImmutableSet.of());
    assertThat(BruteForce.solutions(safe, ImmutableList.of(x, y)))
        .containsExactly(ImmutableList.of(0L, 0L), ImmutableList.of(0L, 1L));
  }

  @Test
  public void testNoPartialFunctions_elementOutOfRange() {
    final BoolVar b = new BoolVar("b");
    final IntVar i = new IntVar(-1, 3, "i");
    final ImmutableList<Constant> arr =
        ImmutableList.of(Constant.of(5), Constant.of(6), Constant.of(7));
    final Expression c = Expressions.implies(b, Expressions.element(arr, i).eq(6));
    final List<Expression> safe =
        Safening.noPartialFunctions(ImmutableList.of(c), ImmutableSet.of());

    final Set<List<Long>> expected = new HashSet<>();
    for (long i0 = -1; i0 <= 3; ++i0) {
      expected.add(ImmutableList.of(0L, i0));
    }
    expected.add(ImmutableList.of(1L, 1L));
    assertThat(BruteForce.solutions(safe, ImmutableList.of(b, i)))
        .containsExactlyElementsIn(expected);
  }
}
