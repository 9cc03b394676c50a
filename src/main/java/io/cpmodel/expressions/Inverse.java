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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code fwd} and {@code rev} are inverse permutations: {@code fwd[i] == j} iff {@code rev[j] ==
 * i}.
 */
public final class Inverse extends GlobalConstraint {
  public Inverse(List<? extends Expression> fwd, List<? extends Expression> rev) {
    super("inverse", ImmutableList.<Expression>builder().addAll(fwd).addAll(rev).build());
    checkArgument(fwd.size() == rev.size(), "inverse arrays differ in size");
  }

  public List<Expression> fwd() {
    return args().subList(0, args().size() / 2);
  }

  public List<Expression> rev() {
    return args().subList(args().size() / 2, args().size());
  }

  @Override
  public Decomposition decompose() {
    List<Expression> fwd = fwd();
    List<Expression> rev = rev();
    int n = fwd.size();
    List<Expression> constraints = new ArrayList<>();
    for (int i = 0; i < n; ++i) {
      constraints.add(fwd.get(i).ge(0));
      constraints.add(fwd.get(i).le(n - 1));
      constraints.add(rev.get(i).ge(0));
      constraints.add(rev.get(i).le(n - 1));
    }
    for (int i = 0; i < n; ++i) {
      for (int j = 0; j < n; ++j) {
        constraints.add(fwd.get(i).eq(j).eq(rev.get(j).eq(i)));
      }
    }
    return Decomposition.of(constraints);
  }

  @Override
  public Long value() {
    long[] fwd = valuesOf(fwd());
    long[] rev = valuesOf(rev());
    if (fwd == null || rev == null) {
      return null;
    }
    int n = fwd.length;
    for (int i = 0; i < n; ++i) {
      if (fwd[i] < 0 || fwd[i] >= n || rev[(int) fwd[i]] != i) {
        return 0L;
      }
    }
    return 1L;
  }

  @Override
  public Inverse withArgs(List<Expression> newArgs) {
    int n = newArgs.size() / 2;
    return new Inverse(newArgs.subList(0, n), newArgs.subList(n, newArgs.size()));
  }
}
