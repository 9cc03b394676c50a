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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** The arguments take no forbidden row. */
public final class NegativeTable extends GlobalConstraint {
  public NegativeTable(List<? extends Expression> exprs, long[][] rows) {
    super("negative_table", exprs);
    this.rows = Table.copyRows(exprs.size(), rows);
  }

  public long[][] rows() {
    return Table.copyRows(args().size(), rows);
  }

  @Override
  public Decomposition decompose() {
    List<Expression> constraints = new ArrayList<>();
    for (long[] row : rows) {
      List<Expression> differs = new ArrayList<>();
      for (int k = 0; k < row.length; ++k) {
        differs.add(args().get(k).ne(row[k]));
      }
      constraints.add(Expressions.or(differs));
    }
    return Decomposition.of(constraints);
  }

  @Override
  public Expression negate() {
    return new Table(args(), rows);
  }

  @Override
  public Long value() {
    long[] vals = valuesOf(args());
    if (vals == null) {
      return null;
    }
    for (long[] row : rows) {
      if (Arrays.equals(row, vals)) {
        return 0L;
      }
    }
    return 1L;
  }

  @Override
  public NegativeTable withArgs(List<Expression> newArgs) {
    return new NegativeTable(newArgs, rows);
  }

  @Override
  public boolean equals(Object o) {
    return super.equals(o) && Arrays.deepEquals(rows, ((NegativeTable) o).rows);
  }

  @Override
  public int hashCode() {
    return super.hashCode() * 31 + Arrays.deepHashCode(rows);
  }

  private final long[][] rows;
}
