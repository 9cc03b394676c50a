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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A node of a constraint model: a variable, a constant, an operator, a comparison, a global
 * constraint or a global function.
 *
 * <p>Nodes are immutable. Two nodes are equal when they have the same kind and equal arguments;
 * variables compare by identity.
 */
public abstract class Expression {
  /** Returns the operator, comparison or global name, or the variable name for leaves. */
  public abstract String name();

  /** Returns the direct sub-expressions. Leaves return an empty list. */
  public abstract ImmutableList<Expression> args();

  /** Returns true if this expression takes a Boolean value. */
  public abstract boolean isBool();

  /** Returns {lb, ub}, an interval containing every value this expression can take. */
  public abstract long[] bounds();

  /**
   * Returns the value under the current variable values, or null if one of them is unknown or
   * the expression is undefined there. Booleans evaluate to 0 or 1.
   */
  public abstract Long value();

  /**
   * Returns a node of the same kind over the given arguments. Any extra data of the node, such
   * as weights or table rows, is kept.
   */
  public abstract Expression withArgs(List<Expression> newArgs);

  /** Returns the value as a Boolean, or null if unknown. */
  public Boolean booleanValue() {
    Long v = value();
    return v == null ? null : v != 0;
  }

  public long lb() {
    return bounds()[0];
  }

  public long ub() {
    return bounds()[1];
  }

  // Comparisons.

  public Comparison eq(Expression other) {
    return new Comparison(Comparison.Op.EQ, this, other);
  }

  public Comparison eq(long other) {
    return eq(Constant.of(other));
  }

  public Comparison ne(Expression other) {
    return new Comparison(Comparison.Op.NE, this, other);
  }

  public Comparison ne(long other) {
    return ne(Constant.of(other));
  }

  public Comparison lt(Expression other) {
    return new Comparison(Comparison.Op.LT, this, other);
  }

  public Comparison lt(long other) {
    return lt(Constant.of(other));
  }

  public Comparison le(Expression other) {
    return new Comparison(Comparison.Op.LE, this, other);
  }

  public Comparison le(long other) {
    return le(Constant.of(other));
  }

  public Comparison gt(Expression other) {
    return new Comparison(Comparison.Op.GT, this, other);
  }

  public Comparison gt(long other) {
    return gt(Constant.of(other));
  }

  public Comparison ge(Expression other) {
    return new Comparison(Comparison.Op.GE, this, other);
  }

  public Comparison ge(long other) {
    return ge(Constant.of(other));
  }

  // Arithmetic.

  public Expression plus(Expression other) {
    return Expressions.sum(this, other);
  }

  public Expression plus(long other) {
    return plus(Constant.of(other));
  }

  public Expression minus(Expression other) {
    return new Operator(Operator.Kind.SUB, ImmutableList.of(this, other));
  }

  public Expression minus(long other) {
    return minus(Constant.of(other));
  }

  public Expression times(Expression other) {
    return new Operator(Operator.Kind.MUL, ImmutableList.of(this, other));
  }

  public Expression times(long other) {
    return times(Constant.of(other));
  }

  public Expression div(Expression other) {
    return new Operator(Operator.Kind.DIV, ImmutableList.of(this, other));
  }

  public Expression div(long other) {
    return div(Constant.of(other));
  }

  public Expression mod(Expression other) {
    return new Operator(Operator.Kind.MOD, ImmutableList.of(this, other));
  }

  public Expression mod(long other) {
    return mod(Constant.of(other));
  }

  public Expression pow(long exponent) {
    return new Operator(Operator.Kind.POW, ImmutableList.of(this, Constant.of(exponent)));
  }

  public Expression negate() {
    return new Operator(Operator.Kind.NEG, ImmutableList.of(this));
  }

  // Logic.

  public Expression and(Expression other) {
    return Expressions.and(this, other);
  }

  public Expression or(Expression other) {
    return Expressions.or(this, other);
  }

  public Expression implies(Expression other) {
    return Expressions.implies(this, other);
  }

  /** Returns the negation of this Boolean expression, pushed down where possible. */
  public Expression not() {
    return Expressions.not(this);
  }
}
