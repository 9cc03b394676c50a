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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** The arguments take the values of one of the allowed rows. */
public final class Table extends GlobalConstraint {
  public Table(List<? extends Expression> exprs, long[][] rows) {
    super("table", exprs);
    this.rows = copyRows(exprs.size(), rows);
  }

  public long[][] rows() {
    return copyRows(args().size(), rows);
  }

  @Override
  public Decomposition decompose() {
    List<Expression> options = new ArrayList<>();
    for (long[] row : rows) {
      List<Expression> matches = new ArrayList<>();
      for (int k = 0; k < row.length; ++k) {
        matches.add(args().get(k).eq(row[k]));
      }
      options.add(Expressions.and(matches));
    }
    return Decomposition.of(Arrays.asList(Expressions.or(options)));
  }

  @Override
  public Expression negate() {
    return new NegativeTable(args(), rows);
  }

  @Override
  public Long value() {
    long[] vals = valuesOf(args());
    if (vals == null) {
      return null;
    }
    for (long[] row : rows) {
      if (Arrays.equals(row, vals)) {
        return 1L;
      }
    }
    return 0L;
  }

  @Override
  public Table withArgs(List<Expression> newArgs) {
    return new Table(newArgs, rows);
  }

  @Override
  public boolean equals(Object o) {
    return super.equals(o) && Arrays.deepEquals(rows, ((Table) o).rows);
  }

  @Override
  public int hashCode() {
    return super.hashCode() * 31 + Arrays.deepHashCode(rows);
  }

  static long[][] copyRows(int arity, long[][] rows) {
    long[][] copy = new long[rows.length][];
    for (int i = 0; i < rows.length; ++i) {
      checkArgument(
          rows[i].length == arity, "row %s has %s values, expected %s", i, rows[i].length, arity);
      copy[i] = rows[i].clone();
    }
    return copy;
  }

  private final long[][] rows;
}
