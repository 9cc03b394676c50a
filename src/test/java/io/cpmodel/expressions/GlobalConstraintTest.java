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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests the evaluation and decomposition of global constraints and functions. */
public final class GlobalConstraintTest {
  private static void assign(List<? extends Variable> vars, long... values) {
    for (int i = 0; i < values.length; ++i) {
      vars.get(i).setValue(values[i]);
    }
  }

  /** Evaluates a decomposition that introduces no auxiliary variables. */
  private static Boolean holds(Decomposition decomposition) {
    return Expressions.and(decomposition.constraints()).booleanValue();
  }

  @Test
  public void testAllDifferent_decomposesPairwise() {
    final ImmutableList<IntVar> xs = Expressions.intVars(3, 1, 3, "x");
    final AllDifferent allDifferent = new AllDifferent(xs);
    final Decomposition decomposition = allDifferent.decompose();
    assertThat(decomposition.constraints()).hasSize(3);
    assertThat(decomposition.defining()).isEmpty();

    assign(xs, 1, 2, 3);
    assertThat(allDifferent.booleanValue()).isTrue();
    assertThat(holds(decomposition)).isTrue();
    assign(xs, 1, 2, 1);
    assertThat(allDifferent.booleanValue()).isFalse();
    assertThat(holds(decomposition)).isFalse();
  }

  @Test
  public void testAllDifferentExcept0_allowsRepeatedZero() {
    final ImmutableList<IntVar> xs = Expressions.intVars(3, 0, 3, "x");
    final AllDifferentExcept0 constraint = new AllDifferentExcept0(xs);
    assign(xs, 0, 2, 0);
    assertThat(constraint.booleanValue()).isTrue();
    assertThat(holds(constraint.decompose())).isTrue();
    assign(xs, 2, 2, 0);
    assertThat(constraint.booleanValue()).isFalse();
    assertThat(holds(constraint.decompose())).isFalse();
  }

  @Test
  public void testTable_decompositionAgreesWithValue() {
    final ImmutableList<IntVar> xs = Expressions.intVars(2, 0, 2, "x");
    final Table table = new Table(xs, new long[][] {{0, 1}, {1, 2}, {2, 0}});
    for (long a = 0; a <= 2; ++a) {
      for (long b = 0; b <= 2; ++b) {
        assign(xs, a, b);
        assertThat(holds(table.decompose())).isEqualTo(table.booleanValue());
        final Expression negated = table.negate();
        assertThat(negated.booleanValue()).isEqualTo(!table.booleanValue());
        assertThat(holds(((NegativeTable) negated).decompose()))
            .isEqualTo(!table.booleanValue());
      }
    }
  }

  @Test
  public void testTable_rejectsRowOfWrongArity() {
    final ImmutableList<IntVar> xs = Expressions.intVars(2, 0, 2, "x");
    assertThrows(IllegalArgumentException.class, () -> new Table(xs, new long[][] {{0}}));
  }

  @Test
  public void testXor_oddNumberOfTrue() {
    final ImmutableList<BoolVar> bs = Expressions.boolVars(3, "b");
    final Xor xor = new Xor(bs);
    assign(bs, 1, 1, 1);
    assertThat(xor.booleanValue()).isTrue();
    assertThat(holds(xor.decompose())).isTrue();
    assign(bs, 1, 0, 1);
    assertThat(xor.booleanValue()).isFalse();
    assertThat(holds(xor.decompose())).isFalse();
  }

  @Test
  public void testIfThenElse_decomposition() {
    final BoolVar c = new BoolVar("c");
    final IntVar x = new IntVar(0, 5, "x");
    final IfThenElse ite = new IfThenElse(c, x.ge(3), x.le(1));
    c.setBooleanValue(false);
    x.setValue(4L);
    assertThat(ite.booleanValue()).isFalse();
    assertThat(holds(ite.decompose())).isFalse();
    x.setValue(0L);
    assertThat(ite.booleanValue()).isTrue();
    assertThat(holds(ite.decompose())).isTrue();
  }

  @Test
  public void testCircuit_value() {
    final ImmutableList<IntVar> succ = Expressions.intVars(4, 0, 3, "s");
    final Circuit circuit = new Circuit(succ);
    assign(succ, 2, 0, 3, 1);
    assertThat(circuit.booleanValue()).isTrue();
    assign(succ, 1, 0, 3, 2);
    assertThat(circuit.booleanValue()).isFalse();
  }

  @Test
  public void testCircuit_decompositionDefinesOrder() {
    final ImmutableList<IntVar> succ = Expressions.intVars(3, 0, 2, "s");
    final Decomposition decomposition = new Circuit(succ).decompose();
    assertThat(decomposition.constraints()).isNotEmpty();
    assertThat(Expressions.getVariables(decomposition.constraints()))
        .containsAtLeastElementsIn(succ);
  }

  @Test
  public void testCircuit_auxiliariesDefinedAtToplevel() {
    final ImmutableList<IntVar> succ = Expressions.intVars(3, -1, 3, "s");
    final Decomposition decomposition = new Circuit(succ).decompose();
    assertThat(decomposition.constraints()).hasSize(3);
    // Guard definition, three guarded walk steps, three guarded defaults.
    assertThat(decomposition.defining()).hasSize(7);
  }

  @Test
  public void testRegular_onlyAcceptanceIsConstrained() {
    final ImmutableList<IntVar> word = Expressions.intVars(2, 0, 1, "w");
    final long[][] transitions = {{1, 0, 1}, {1, 1, 2}, {1, 1, 1}};
    final Decomposition decomposition =
        new Regular(word, transitions, 1, new long[] {2}).decompose();
    assertThat(decomposition.constraints()).hasSize(1);
    // Start state, then per position two transitions and the sink.
    assertThat(decomposition.defining()).hasSize(7);
  }

  @Test
  public void testInverse_value() {
    final ImmutableList<IntVar> fwd = Expressions.intVars(3, 0, 2, "f");
    final ImmutableList<IntVar> rev = Expressions.intVars(3, 0, 2, "r");
    final Inverse inverse = new Inverse(fwd, rev);
    assign(fwd, 1, 2, 0);
    assign(rev, 2, 0, 1);
    assertThat(inverse.booleanValue()).isTrue();
    assertThat(holds(inverse.decompose())).isTrue();
    assign(rev, 0, 2, 1);
    assertThat(inverse.booleanValue()).isFalse();
    assertThat(holds(inverse.decompose())).isFalse();
  }

  @Test
  public void testMinimum_boundsAndValue() {
    final IntVar x = new IntVar(2, 7);
    final IntVar y = new IntVar(-1, 4);
    final Minimum min = new Minimum(ImmutableList.of(x, y));
    assertThat(min.bounds()).isEqualTo(new long[] {-1, 4});
    x.setValue(3L);
    y.setValue(4L);
    assertThat(min.value()).isEqualTo(3L);
  }

  @Test
  public void testAbs_decomposesToArgumentWhenNonNegative() {
    final IntVar x = new IntVar(2, 7);
    final FunctionDecomposition decomposition = new Abs(x).decompose();
    assertThat(decomposition.value()).isSameInstanceAs(x);
    assertThat(decomposition.defining()).isEmpty();
  }

  @Test
  public void testElement_valueAndBounds() {
    final ImmutableList<IntVar> arr = Expressions.intVars(3, 0, 9, "a");
    final IntVar index = new IntVar(0, 2, "i");
    final Element element = new Element(arr, index);
    assign(arr, 4, 5, 6);
    index.setValue(1L);
    assertThat(element.value()).isEqualTo(5L);
    assertThat(element.bounds()).isEqualTo(new long[] {0, 9});
  }

  @Test
  public void testCount_value() {
    final ImmutableList<IntVar> xs = Expressions.intVars(4, 0, 3, "x");
    final Count count = new Count(xs, Constant.of(2));
    assign(xs, 2, 1, 2, 2);
    assertThat(count.value()).isEqualTo(3L);
    assertThat(count.bounds()).isEqualTo(new long[] {0, 4});
  }

  @Test
  public void testNoOverlap_value() {
    final ImmutableList<IntVar> start = Expressions.intVars(2, 0, 10, "s");
    final ImmutableList<IntVar> end = Expressions.intVars(2, 0, 10, "e");
    final ImmutableList<Constant> duration = ImmutableList.of(Constant.of(3), Constant.of(2));
    final NoOverlap noOverlap = new NoOverlap(start, duration, end);
    assign(start, 0, 3);
    assign(end, 3, 5);
    assertThat(noOverlap.booleanValue()).isTrue();
    assertThat(holds(noOverlap.decompose())).isTrue();
    assign(start, 0, 2);
    assign(end, 3, 4);
    assertThat(noOverlap.booleanValue()).isFalse();
    assertThat(holds(noOverlap.decompose())).isFalse();
  }
}
