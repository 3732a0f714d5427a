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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * Represents a static type. Types are immutable values created by a {@link TypeRegistry}.
 *
 * <p>The set of kinds is closed: a type is a {@link LiteralType}, an {@link InstanceType}, a
 * {@link UnionType}, the bottom type {@code Never} or an unknown type. Code that needs to handle
 * every kind should use a {@link Visitor} rather than a chain of {@code instanceof} tests.
 */
public abstract class Type {

  Type() {}

  /** Whether this is a literal type such as {@code Literal[1]} or {@code None}. */
  public boolean isLiteral() {
    return false;
  }

  /** Whether this is a class instance, including TypedDict instances. */
  public boolean isInstance() {
    return false;
  }

  public boolean isUnion() {
    return false;
  }

  /** Whether this is the bottom type, which has no values. */
  public boolean isNever() {
    return false;
  }

  /** Whether this is {@code Unknown} or {@code Any}. */
  public boolean isUnknown() {
    return false;
  }

  public @Nullable LiteralType toMaybeLiteral() {
    return null;
  }

  public @Nullable InstanceType toMaybeInstance() {
    return null;
  }

  public @Nullable TypedDictType toMaybeTypedDict() {
    return null;
  }

  public @Nullable UnionType toMaybeUnion() {
    return null;
  }

  /**
   * Returns the disjuncts of this type. A union returns its members, {@code Never} returns the
   * empty list and every other type returns a singleton list of itself.
   */
  public ImmutableList<Type> getAlternates() {
    return ImmutableList.of(this);
  }

  /** Visit this type with the given visitor. */
  public abstract <T> T visit(Visitor<T> visitor);

  @Override
  public abstract boolean equals(@Nullable Object other);

  @Override
  public abstract int hashCode();

  /** Returns the type as it is printed in diagnostics, e.g. {@code int | Literal['a']}. */
  @Override
  public abstract String toString();
}
