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

import com.google.common.collect.ImmutableSet;

/**
 * What a backend accepts natively, which decides the shape of the transformed constraints. Built
 * through {@link #newBuilder()}.
 */
public final class SolverCapabilities {
  /** Builder of {@link SolverCapabilities}. All sets are empty by default. */
  public static final class Builder {
    public Builder setSupportedGlobals(String... names) {
      supportedGlobals = ImmutableSet.copyOf(names);
      return this;
    }

    public Builder setSupportedReifiedGlobals(String... names) {
      supportedReifiedGlobals = ImmutableSet.copyOf(names);
      return this;
    }

    public Builder setReifiable(String... names) {
      reifiable = ImmutableSet.copyOf(names);
      return this;
    }

    public Builder setNumexprComparable(String... names) {
      numexprComparable = ImmutableSet.copyOf(names);
      return this;
    }

    public Builder setSafenToplevel(String... names) {
      safenToplevel = ImmutableSet.copyOf(names);
      return this;
    }

    public SolverCapabilities build() {
      ImmutableSet<String> safen = safenToplevel;
      // The decomposition of element assumes a safe index.
      if (!supportedGlobals.contains("element")) {
        safen = ImmutableSet.<String>builder().addAll(safen).add("element").build();
      }
      return new SolverCapabilities(
          supportedGlobals, supportedReifiedGlobals, reifiable, numexprComparable, safen);
    }

    private Builder() {}

    private ImmutableSet<String> supportedGlobals = ImmutableSet.of();
    private ImmutableSet<String> supportedReifiedGlobals = ImmutableSet.of();
    private ImmutableSet<String> reifiable = ImmutableSet.of();
    private ImmutableSet<String> numexprComparable = ImmutableSet.of();
    private ImmutableSet<String> safenToplevel = ImmutableSet.of();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private SolverCapabilities(
      ImmutableSet<String> supportedGlobals,
      ImmutableSet<String> supportedReifiedGlobals,
      ImmutableSet<String> reifiable,
      ImmutableSet<String> numexprComparable,
      ImmutableSet<String> safenToplevel) {
    this.supportedGlobals = supportedGlobals;
    this.supportedReifiedGlobals = supportedReifiedGlobals;
    this.reifiable = reifiable;
    this.numexprComparable = numexprComparable;
    this.safenToplevel = safenToplevel;
  }

  /** Global constraints and functions supported at toplevel. */
  public ImmutableSet<String> supportedGlobals() {
    return supportedGlobals;
  }

  /** Global constraints supported in a nested (reified) position. */
  public ImmutableSet<String> supportedReifiedGlobals() {
    return supportedReifiedGlobals;
  }

  /** Left sides of a comparison, and global constraints, that can be reified. */
  public ImmutableSet<String> reifiable() {
    return reifiable;
  }

  /** Left sides allowed in comparisons other than equality. */
  public ImmutableSet<String> numexprComparable() {
    return numexprComparable;
  }

  /** Partial functions to safen even directly under a toplevel constraint. */
  public ImmutableSet<String> safenToplevel() {
    return safenToplevel;
  }

  private final ImmutableSet<String> supportedGlobals;
  private final ImmutableSet<String> supportedReifiedGlobals;
  private final ImmutableSet<String> reifiable;
  private final ImmutableSet<String> numexprComparable;
  private final ImmutableSet<String> safenToplevel;
}
