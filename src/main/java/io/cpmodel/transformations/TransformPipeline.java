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

import io.cpmodel.expressions.Expression;
import java.util.List;
import java.util.logging.Logger;

/** Chains the transformations that bring constraints into the normal form of a backend. */
public final class TransformPipeline {
  private static final Logger logger = Logger.getLogger(TransformPipeline.class.getName());

  /**
   * Returns constraints equivalent to {@code constraints} that only use constructs the backend
   * described by {@code capabilities} posts natively. Auxiliary variables are shared through
   * {@code cse}.
   */
  public static List<Expression> transform(
      Iterable<? extends Expression> constraints, SolverCapabilities capabilities, CseMap cse) {
    List<Expression> result = ToplevelList.toplevelList(constraints);
    int inputSize = result.size();
    result = Safening.noPartialFunctions(result, capabilities.safenToplevel());
    result =
        DecomposeGlobal.decomposeInTree(
            result,
            capabilities.supportedGlobals(),
            capabilities.supportedReifiedGlobals(),
            cse);
    result = Flatten.flattenConstraint(result, cse);
    result = Reification.reifyRewrite(result, capabilities.reifiable(), cse);
    result = Comparisons.onlyNumexprEquality(result, capabilities.numexprComparable(), cse);
    result = Reification.onlyBvReifies(result, cse);
    result = Reification.onlyImplies(result, cse);
    logger.fine(
        String.format(
            "transformed %d constraints into %d, %d shared sub-expressions",
            inputSize, result.size(), cse.size()));
    return result;
  }

  private TransformPipeline() {}
}
