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

package io.cpmodel.solvers;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.ortools.Loader;
import com.google.ortools.sat.LinearArgument;
import io.cpmodel.exceptions.ConfigurationException;
import io.cpmodel.exceptions.InvalidModelException;
import io.cpmodel.exceptions.NotSupportedException;
import io.cpmodel.exceptions.PreconditionException;
import io.cpmodel.expressions.BoolVar;
import io.cpmodel.expressions.Circuit;
import io.cpmodel.expressions.Constant;
import io.cpmodel.expressions.Cumulative;
import io.cpmodel.expressions.DirectConstraint;
import io.cpmodel.expressions.Expression;
import io.cpmodel.expressions.Expressions;
import io.cpmodel.expressions.IntVar;
import io.cpmodel.expressions.Inverse;
import io.cpmodel.expressions.NoOverlap;
import io.cpmodel.expressions.Regular;
import io.cpmodel.expressions.Variable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests the OR-Tools backend on small models. */
public final class OrToolsSolverTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  @Test
  public void testOrToolsSolver_booleans() {
    final BoolVar x = new BoolVar("x");
    final BoolVar y = new BoolVar("y");
    final BoolVar z = new BoolVar("z");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(Expressions.or(x, y, z), x.implies(y));

    assertThat(solver.solve()).isTrue();
    assertThat(solver.status().exitStatus()).isEqualTo(ExitStatus.FEASIBLE);
    assertThat(x.booleanValue() || y.booleanValue() || z.booleanValue()).isTrue();
    assertThat(!x.booleanValue() || y.booleanValue()).isTrue();
  }

  @Test
  public void testOrToolsSolver_minimize() {
    final IntVar a = new IntVar(0, 10, "a");
    final IntVar b = new IntVar(0, 10, "b");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(a.plus(b).eq(10));
    solver.minimize(a);

    assertThat(solver.solve()).isTrue();
    assertThat(solver.status().exitStatus()).isEqualTo(ExitStatus.OPTIMAL);
    assertThat(a.value()).isEqualTo(0L);
    assertThat(b.value()).isEqualTo(10L);
    assertThat(solver.objectiveValue()).isEqualTo(0L);
  }

  @Test
  public void testOrToolsSolver_maximizeNonLinearObjective() {
    final IntVar a = new IntVar(0, 4, "a");
    final IntVar b = new IntVar(0, 4, "b");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(a.plus(b).le(5));
    solver.maximize(a.times(b));

    assertThat(solver.solve()).isTrue();
    assertThat(solver.objectiveValue()).isEqualTo(6L);
    assertThat(a.value() * b.value()).isEqualTo(6L);
  }

  @Test
  public void testOrToolsSolver_solveAllCountsPermutations() {
    final ImmutableList<IntVar> xs = Expressions.intVars(3, 1, 3, "x");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(Expressions.allDifferent(xs));

    final Set<List<Long>> seen = new HashSet<>();
    final int count =
        solver.solveAll(
            () -> {
              final List<Long> values = new ArrayList<>();
              for (IntVar x : xs) {
                values.add(x.value());
              }
              seen.add(values);
            },
            null,
            null,
            ImmutableMap.of());
    assertThat(count).isEqualTo(6);
    assertThat(seen).hasSize(6);
    assertThat(solver.status().exitStatus()).isEqualTo(ExitStatus.OPTIMAL);
  }

  @Test
  public void testOrToolsSolver_solveAllStopsAtLimit() {
    final ImmutableList<IntVar> xs = Expressions.intVars(3, 1, 3, "x");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(Expressions.allDifferent(xs));
    assertThat(solver.solveAll(2)).isEqualTo(2);
  }

  @Test
  public void testOrToolsSolver_solveAllRejectsObjective() {
    final IntVar a = new IntVar(0, 3, "a");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(a.ge(1));
    solver.minimize(a);
    assertThrows(NotSupportedException.class, () -> solver.solveAll());
  }

  @Test
  public void testOrToolsSolver_rejectsNonPositiveTimeLimit() {
    final IntVar a = new IntVar(0, 3, "a");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(a.ge(1));
    final ConfigurationException e =
        assertThrows(ConfigurationException.class, () -> solver.solve(-1));
    assertThat(e).hasMessageThat().startsWith("solve: ");
    assertThat(solver.status().exitStatus()).isEqualTo(ExitStatus.NOT_RUN);
    assertThrows(ConfigurationException.class, () -> solver.solve(0));
  }

  @Test
  public void testOrToolsSolver_unsatisfiableClearsValues() {
    final IntVar a = new IntVar(0, 3, "a");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(a.ge(2));
    assertThat(solver.solve()).isTrue();
    assertThat(a.value()).isNotNull();

    solver.add(a.lt(2));
    assertThat(solver.solve()).isFalse();
    assertThat(solver.status().exitStatus()).isEqualTo(ExitStatus.UNSATISFIABLE);
    assertThat(a.value()).isNull();
    assertThat(solver.objectiveValue()).isNull();
  }

  @Test
  public void testOrToolsSolver_roundTripSatisfiesConstraints() {
    final BoolVar p = new BoolVar("p");
    final IntVar x = new IntVar(-3, 5, "x");
    final IntVar y = new IntVar(-3, 5, "y");
    final IntVar z = new IntVar(0, 20, "z");
    final ImmutableList<Expression> constraints =
        ImmutableList.of(
            p.eq(x.gt(y)),
            z.eq(Expressions.abs(x.minus(y))),
            Expressions.max(ImmutableList.of(x, y)).ge(3),
            x.times(y).le(-2),
            Expressions.implies(p.not(), x.plus(y).ge(1)));
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(constraints);

    assertThat(solver.solve()).isTrue();
    for (Expression c : constraints) {
      assertThat(c.booleanValue()).isTrue();
    }
  }

  @Test
  public void testOrToolsSolver_partialFunctions() {
    final IntVar x = new IntVar(-6, 6, "x");
    final IntVar y = new IntVar(-2, 2, "y");
    final IntVar q = new IntVar(-10, 10, "q");
    final IntVar r = new IntVar(-10, 10, "r");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(x.div(y).eq(q), x.mod(y).eq(r), y.lt(0), x.eq(-5));

    assertThat(solver.solve()).isTrue();
    assertThat(q.value()).isEqualTo(x.value() / y.value());
    assertThat(r.value()).isEqualTo(x.value() % y.value());
  }

  @Test
  public void testOrToolsSolver_power() {
    final IntVar x = new IntVar(0, 5, "x");
    final IntVar y = new IntVar(0, 200, "y");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(x.pow(3).eq(y), y.ge(60));
    solver.minimize(y);

    assertThat(solver.solve()).isTrue();
    assertThat(x.value()).isEqualTo(4L);
    assertThat(y.value()).isEqualTo(64L);
  }

  @Test
  public void testOrToolsSolver_elementAndTable() {
    final ImmutableList<IntVar> arr = Expressions.intVars(3, 0, 9, "a");
    final IntVar i = new IntVar(0, 2, "i");
    final IntVar x = new IntVar(0, 9, "x");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(
        Expressions.element(arr, i).eq(x),
        Expressions.table(ImmutableList.of(i, x), new long[][] {{0, 4}, {2, 7}}),
        Expressions.negativeTable(ImmutableList.of(i), new long[][] {{0}}),
        arr.get(2).eq(7));

    assertThat(solver.solve()).isTrue();
    assertThat(i.value()).isEqualTo(2L);
    assertThat(x.value()).isEqualTo(7L);
  }

  @Test
  public void testOrToolsSolver_circuit() {
    final ImmutableList<IntVar> succ = Expressions.intVars(4, 0, 3, "s");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(new Circuit(succ), succ.get(0).eq(2));
    assertThat(solver.solveAll()).isEqualTo(2);

    assertThat(solver.solve()).isTrue();
    final Set<Long> visited = new HashSet<>();
    long node = 0;
    for (int step = 0; step < 4; ++step) {
      visited.add(node);
      node = succ.get((int) node).value();
    }
    assertThat(node).isEqualTo(0L);
    assertThat(visited).hasSize(4);
  }

  @Test
  public void testOrToolsSolver_inverseAndRegular() {
    final ImmutableList<IntVar> fwd = Expressions.intVars(3, 0, 2, "f");
    final ImmutableList<IntVar> rev = Expressions.intVars(3, 0, 2, "r");
    final ImmutableList<IntVar> word = Expressions.intVars(3, 0, 1, "w");
    // Words over {0, 1} without two consecutive ones, ending in state 1 or 2.
    final long[][] transitions = {{1, 0, 1}, {1, 1, 2}, {2, 0, 1}};
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(
        new Inverse(fwd, rev),
        fwd.get(0).eq(2),
        fwd.get(1).eq(0),
        new Regular(word, transitions, 1, new long[] {1, 2}),
        word.get(0).eq(1));

    assertThat(solver.solve()).isTrue();
    assertThat(rev.get(2).value()).isEqualTo(0L);
    assertThat(rev.get(0).value()).isEqualTo(1L);
    assertThat(word.get(1).value()).isEqualTo(0L);
  }

  @Test
  public void testOrToolsSolver_scheduling() {
    final ImmutableList<IntVar> start = Expressions.intVars(3, 0, 10, "s");
    final ImmutableList<IntVar> end = Expressions.intVars(3, 0, 10, "e");
    final ImmutableList<Constant> duration =
        ImmutableList.of(Constant.of(3), Constant.of(2), Constant.of(4));
    final ImmutableList<Constant> demand =
        ImmutableList.of(Constant.of(1), Constant.of(1), Constant.of(2));
    final IntVar makespan = new IntVar(0, 10, "makespan");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(
        new Cumulative(start, duration, end, demand, Constant.of(2)),
        new NoOverlap(start.subList(0, 2), duration.subList(0, 2), end.subList(0, 2)),
        Expressions.max(end).eq(makespan));
    solver.minimize(makespan);

    assertThat(solver.solve()).isTrue();
    assertThat(makespan.value()).isEqualTo(9L);
  }

  @Test
  public void testOrToolsSolver_assumptionCore() {
    final IntVar x = new IntVar(0, 10, "x");
    final BoolVar a = new BoolVar("a");
    final BoolVar b = new BoolVar("b");
    final BoolVar c = new BoolVar("c");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(a.implies(x.ge(5)), b.implies(x.le(3)), c.implies(x.le(8)));

    assertThat(solver.solve(null, ImmutableList.of(a, b, c), ImmutableMap.of())).isFalse();
    assertThat(solver.status().exitStatus()).isEqualTo(ExitStatus.UNSATISFIABLE);
    final ImmutableList<BoolVar> core = solver.getCore();
    assertThat(core).containsAtLeast(a, b);

    // The core alone is unsatisfiable.
    final OrToolsSolver check = new OrToolsSolver();
    check.add(a.implies(x.ge(5)), b.implies(x.le(3)), c.implies(x.le(8)));
    check.add(core.toArray(new Expression[0]));
    assertThat(check.solve()).isFalse();

    // Without assumptions the model is satisfiable again.
    assertThat(solver.solve()).isTrue();
    assertThrows(PreconditionException.class, solver::getCore);
  }

  @Test
  public void testOrToolsSolver_coreNeedsAssumptions() {
    final IntVar x = new IntVar(0, 3, "x");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(x.gt(5));
    assertThat(solver.solve()).isFalse();
    assertThrows(PreconditionException.class, solver::getCore);
  }

  @Test
  public void testOrToolsSolver_solutionHint() {
    final IntVar x = new IntVar(0, 10, "x");
    final BoolVar b = new BoolVar("b");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(x.ge(2), b.implies(x.le(7)));
    solver.solutionHint(ImmutableList.<Variable>of(x, b), ImmutableList.of(4, 1));
    assertThat(solver.solve(null, null, ImmutableMap.of("num_workers", 1))).isTrue();
    assertThrows(
        ConfigurationException.class,
        () -> solver.solutionHint(ImmutableList.of(x), ImmutableList.of(1, 2)));
  }

  @Test
  public void testOrToolsSolver_parameters() {
    final IntVar x = new IntVar(0, 10, "x");
    final OrToolsSolver solver =
        new OrToolsSolver(null, null, ImmutableMap.of("num_workers", 2, "random_seed", 7));
    assertThat(solver.parameters().getNumWorkers()).isEqualTo(2);
    assertThat(solver.parameters().getRandomSeed()).isEqualTo(7);
    solver.add(x.ge(3));
    assertThat(solver.solve(5.0, null, ImmutableMap.of("cp_model_presolve", false))).isTrue();
    assertThat(solver.parameters().getCpModelPresolve()).isFalse();

    assertThrows(
        ConfigurationException.class,
        () -> solver.solve(null, null, ImmutableMap.of("no_such_parameter", 1)));
    assertThrows(
        ConfigurationException.class,
        () -> new OrToolsSolver(null, "sub", ImmutableMap.of()));
  }

  @Test
  public void testOrToolsSolver_directConstraint() {
    final ImmutableList<IntVar> xs = Expressions.intVars(3, 0, 2, "x");
    final OrToolsSolver solver = new OrToolsSolver();
    final DirectConstraint allDifferent =
        new DirectConstraint(
            "addAllDifferent",
            (model, handles) -> {
              final LinearArgument[] args = new LinearArgument[xs.size()];
              for (int i = 0; i < args.length; ++i) {
                args[i] = handles.apply(xs.get(i));
              }
              return model.addAllDifferent(args);
            },
            xs);
    solver.add(allDifferent, xs.get(0).eq(2), xs.get(1).eq(1));
    assertThat(solver.userVariables()).containsExactlyElementsIn(xs);
    assertThat(solver.solve()).isTrue();
    assertThat(xs.get(2).value()).isEqualTo(0L);
  }

  @Test
  public void testOrToolsSolver_invalidModelClearsValues() {
    final IntVar x = new IntVar(0, 5, "x");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(x.eq(3));
    assertThat(solver.solve()).isTrue();
    assertThat(x.value()).isEqualTo(3L);

    // A native domain reaching the int64 bounds is rejected by the model validator.
    solver.add(
        new DirectConstraint(
            "hugeDomain",
            (model, handles) ->
                model.addEquality(
                    model.newIntVar(Long.MIN_VALUE, Long.MAX_VALUE, "huge"),
                    handles.apply(x)),
            ImmutableList.of(x)));
    assertThrows(InvalidModelException.class, solver::solve);
    assertThat(x.value()).isNull();
    assertThat(solver.objectiveValue()).isNull();
  }

  @Test
  public void testOrToolsSolver_reifiedCircuitAgreesWithValue() {
    final ImmutableList<IntVar> succ = Expressions.intVars(3, -1, 3, "s");
    final Circuit circuit = new Circuit(succ);
    final BoolVar b = new BoolVar("b");
    final List<Variable> vars = new ArrayList<>(succ);
    vars.add(b);
    assertThat(disagreements(b.eq(circuit), vars)).isEmpty();
  }

  @Test
  public void testOrToolsSolver_negatedCircuitAgreesWithValue() {
    final ImmutableList<IntVar> succ = Expressions.intVars(3, -1, 3, "s");
    assertThat(disagreements(Expressions.not(new Circuit(succ)), succ)).isEmpty();
  }

  @Test
  public void testOrToolsSolver_reifiedRegularAgreesWithValue() {
    final ImmutableList<IntVar> word = Expressions.intVars(3, 0, 2, "w");
    // Label 2 is only read in state 2, label 0 only in state 1.
    final long[][] transitions = {{1, 0, 1}, {1, 1, 2}, {2, 1, 2}, {2, 2, 1}};
    final Regular regular = new Regular(word, transitions, 1, new long[] {2});
    final BoolVar b = new BoolVar("b");
    final List<Variable> vars = new ArrayList<>(word);
    vars.add(b);
    assertThat(disagreements(b.eq(regular), vars)).isEmpty();
  }

  /**
   * Posts {@code constraint} with all {@code vars} fixed, for every assignment of their domains,
   * and returns the assignments where the solver and {@link Expression#value} disagree.
   */
  private static List<List<Long>> disagreements(
      Expression constraint, List<? extends Variable> vars) {
    final List<List<Long>> result = new ArrayList<>();
    final long[] values = new long[vars.size()];
    for (int i = 0; i < values.length; ++i) {
      values[i] = vars.get(i).lb();
    }
    while (true) {
      final List<Long> assignment = new ArrayList<>();
      final List<Expression> fixed = new ArrayList<>();
      for (int i = 0; i < values.length; ++i) {
        vars.get(i).setValue(values[i]);
        assignment.add(values[i]);
        fixed.add(vars.get(i).eq(values[i]));
      }
      final boolean expected = Long.valueOf(1).equals(constraint.value());
      final OrToolsSolver solver = new OrToolsSolver();
      solver.add(constraint);
      solver.add(fixed);
      if (solver.solve() != expected) {
        result.add(assignment);
      }
      int i = 0;
      while (i < values.length && values[i] == vars.get(i).ub()) {
        values[i] = vars.get(i).lb();
        ++i;
      }
      if (i == values.length) {
        return result;
      }
      ++values[i];
    }
  }

  @Test
  public void testOrToolsSolver_incrementalObjectiveReplaced() {
    final IntVar x = new IntVar(0, 10, "x");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(x.ge(2), x.le(8));
    solver.minimize(x);
    assertThat(solver.solve()).isTrue();
    assertThat(x.value()).isEqualTo(2L);
    solver.maximize(x);
    assertThat(solver.solve()).isTrue();
    assertThat(x.value()).isEqualTo(8L);
    assertThat(solver.hasObjective()).isTrue();
  }

  @Test
  public void testOrToolsSolver_userVariables() {
    final IntVar x = new IntVar(0, 10, "x");
    final IntVar y = new IntVar(0, 10, "y");
    final OrToolsSolver solver = new OrToolsSolver();
    solver.add(x.times(y).le(20));
    assertThat(solver.userVariables()).containsExactly(x, y);
    assertThat(solver.nativeModel().model().getVariablesCount()).isAtLeast(3);
  }
}
