/*
 * Copyright 2026 The Membership Narrowing Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.narrowing.types;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An instance of a nominal class, optionally specialized with type arguments, e.g. {@code str},
 * {@code list[int]} or {@code dict[str, str]}.
 *
 * <p>Fixed-length tuples keep one argument per position, so the empty tuple {@code tuple[()]} has
 * none. A tuple of unknown length, {@code tuple[T, ...]}, has a single argument. A bare {@code
 * tuple} is unspecialized.
 */
public class InstanceType extends Type {
  static final String TUPLE = "tuple";

  /** How the type arguments of a tuple describe its positions. */
  enum TupleForm {
    NONE,
    FIXED,
    HOMOGENEOUS,
  }

  private final String className;
  private final ImmutableList<Type> typeArguments;
  private final TupleForm tupleForm;

  InstanceType(String className, ImmutableList<Type> typeArguments, TupleForm tupleForm) {
    this.className = checkNotNull(className);
    this.typeArguments = checkNotNull(typeArguments);
    this.tupleForm = checkNotNull(tupleForm);
    checkArgument(
        tupleForm == TupleForm.NONE || className.equals(TUPLE),
        "Only tuples have a tuple form: %s",
        className);
    checkArgument(
        tupleForm != TupleForm.HOMOGENEOUS || typeArguments.size() == 1,
        "tuple[T, ...] takes exactly one argument");
  }

  public String getClassName() {
    return className;
  }

  public ImmutableList<Type> getTypeArguments() {
    return typeArguments;
  }

  public boolean isSpecialized() {
    return tupleForm != TupleForm.NONE || !typeArguments.isEmpty();
  }

  public boolean isTuple() {
    return className.equals(TUPLE);
  }

  /** Whether this is a fixed-length tuple, with one type argument per position. */
  public boolean isFixedTuple() {
    return tupleForm == TupleForm.FIXED;
  }

  public boolean isHomogeneousTuple() {
    return tupleForm == TupleForm.HOMOGENEOUS;
  }

  @Override
  public boolean isInstance() {
    return true;
  }

  @Override
  public InstanceType toMaybeInstance() {
    return this;
  }

  @Override
  public <T> T visit(Visitor<T> visitor) {
    return visitor.caseInstanceType(this);
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (other == null || other.getClass() != InstanceType.class) {
      return false;
    }
    InstanceType that = (InstanceType) other;
    return className.equals(that.className)
        && tupleForm == that.tupleForm
        && typeArguments.equals(that.typeArguments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(className, typeArguments, tupleForm);
  }

  @Override
  public String toString() {
    if (tupleForm == TupleForm.HOMOGENEOUS) {
      return className + "[" + typeArguments.get(0) + ", ...]";
    }
    if (typeArguments.isEmpty()) {
      if (tupleForm == TupleForm.FIXED) {
        return className + "[()]";
      }
      return className;
    }
    return className + "[" + Joiner.on(", ").join(typeArguments) + "]";
  }
}
