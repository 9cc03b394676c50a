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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.cpmodel.Model;
import io.cpmodel.exceptions.ConfigurationException;
import java.util.Map;
import java.util.logging.Logger;

/** Registry of the solver backends, by name. The first registered backend is the default. */
public final class SolverLookup {
  private static final Logger logger = Logger.getLogger(SolverLookup.class.getName());

  /** Creates the adapters of one backend. */
  public interface SolverFactory {
    /** Returns true if the native dependency of the backend can be loaded. */
    boolean supported();

    /**
     * Creates an adapter.
     *
     * @param model constraints and objective to post, or null
     * @param subsolver the part after {@code ':'} in the solver name, or null
     * @param options native parameters, by name
     */
    SolverInterface create(Model model, String subsolver, Map<String, ?> options);
  }

  private static final ImmutableMap<String, SolverFactory> SOLVERS =
      ImmutableMap.of(
          OrToolsSolver.NAME,
          new SolverFactory() {
            @Override
            public boolean supported() {
              return OrToolsSolver.supported();
            }

            @Override
            public SolverInterface create(
                Model model, String subsolver, Map<String, ?> options) {
              return new OrToolsSolver(model, subsolver, options);
            }
          });

  /** Returns the factory for {@code name}, either {@code "base"} or {@code "base:sub"}. */
  public static SolverFactory lookup(String name) {
    if (name == null) {
      return SOLVERS.values().iterator().next();
    }
    SolverFactory factory = SOLVERS.get(baseName(name));
    if (factory == null) {
      throw new ConfigurationException(
          "lookup", "unknown solver " + name + ", available: " + solverNames());
    }
    return factory;
  }

  public static SolverInterface get() {
    return get(null, null, ImmutableMap.of());
  }

  public static SolverInterface get(String name) {
    return get(name, null, ImmutableMap.of());
  }

  public static SolverInterface get(String name, Model model) {
    return get(name, model, ImmutableMap.of());
  }

  /**
   * Creates an adapter for the solver {@code name}, or the default one if null.
   *
   * @param model constraints and objective to post, or null for an empty adapter
   * @param options native parameters, by name
   */
  public static SolverInterface get(String name, Model model, Map<String, ?> options) {
    SolverFactory factory = lookup(name);
    return factory.create(model, subsolverName(name), options);
  }

  /** Returns the names of the backends whose native dependency is available. */
  public static ImmutableList<String> supported() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Map.Entry<String, SolverFactory> entry : SOLVERS.entrySet()) {
      if (entry.getValue().supported()) {
        names.add(entry.getKey());
      }
    }
    return names.build();
  }

  /** Returns the names of all registered backends, the default first. */
  public static ImmutableList<String> solverNames() {
    return SOLVERS.keySet().asList();
  }

  /** Logs which backends can be used on this machine. */
  public static void logStatus() {
    for (Map.Entry<String, SolverFactory> entry : SOLVERS.entrySet()) {
      logger.info(
          entry.getKey() + ": " + (entry.getValue().supported() ? "available" : "not available"));
    }
  }

  private static String baseName(String name) {
    int colon = name.indexOf(':');
    return colon < 0 ? name : name.substring(0, colon);
  }

  private static String subsolverName(String name) {
    if (name == null) {
      return null;
    }
    int colon = name.indexOf(':');
    return colon < 0 ? null : name.substring(colon + 1);
  }

  private SolverLookup() {}
}
