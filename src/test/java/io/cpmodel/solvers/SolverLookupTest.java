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

import com.google.common.collect.ImmutableMap;
import com.google.ortools.Loader;
import io.cpmodel.Model;
import io.cpmodel.exceptions.ConfigurationException;
import io.cpmodel.expressions.IntVar;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests {@link SolverLookup}. */
public final class SolverLookupTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  @Test
  public void testSolverLookup_defaultIsOrTools() {
    assertThat(SolverLookup.solverNames()).containsExactly("ortools");
    assertThat(SolverLookup.get()).isInstanceOf(OrToolsSolver.class);
    assertThat(SolverLookup.get("ortools").name()).isEqualTo("ortools");
    assertThat(SolverLookup.supported()).contains("ortools");
  }

  @Test
  public void testSolverLookup_unknownName() {
    final ConfigurationException e =
        assertThrows(ConfigurationException.class, () -> SolverLookup.get("gurobi"));
    assertThat(e).hasMessageThat().contains("gurobi");
  }

  @Test
  public void testSolverLookup_subsolverIsForwarded() {
    assertThat(SolverLookup.lookup("ortools:sat")).isSameInstanceAs(SolverLookup.lookup(null));
    assertThrows(ConfigurationException.class, () -> SolverLookup.get("ortools:sat"));
  }

  @Test
  public void testSolverLookup_modelAndOptions() {
    final IntVar x = new IntVar(0, 5, "x");
    final Model model = new Model(x.ge(2));
    model.maximize(x);
    final SolverInterface solver =
        SolverLookup.get("ortools", model, ImmutableMap.of("num_workers", 1));
    assertThat(((OrToolsSolver) solver).parameters().getNumWorkers()).isEqualTo(1);
    assertThat(solver.hasObjective()).isTrue();
    assertThat(solver.solve()).isTrue();
    assertThat(x.value()).isEqualTo(5L);
  }

  @Test
  public void testSolverLookup_logStatus() {
    final List<String> messages = new ArrayList<>();
    final Handler handler =
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            messages.add(record.getMessage());
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };
    final Logger logger = Logger.getLogger(SolverLookup.class.getName());
    logger.addHandler(handler);
    try {
      SolverLookup.logStatus();
    } finally {
      logger.removeHandler(handler);
    }
    assertThat(messages).containsExactly("ortools: available");
  }
}
