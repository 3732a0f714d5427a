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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A union of two or more distinct types. Unions are built by {@link TypeRegistry#createUnionType},
 * so a union never contains another union or {@code Never}.
 *
 * <p>The alternates keep their insertion order so that diagnostics are stable, but two unions with
 * the same members in a different order are equal.
 */
public final class UnionType extends Type {
  private final ImmutableList<Type> alternates;
  private final ImmutableSet<Type> alternateSet;

  UnionType(ImmutableList<Type> alternates) {
    checkArgument(alternates.size() >= 2, "A union needs at least two members: %s", alternates);
    this.alternates = alternates;
    this.alternateSet = ImmutableSet.copyOf(alternates);
    checkArgument(alternateSet.size() == alternates.size(), "Duplicate members: %s", alternates);
  }

  @Override
  public ImmutableList<Type> getAlternates() {
    return alternates;
  }

  public boolean contains(Type type) {
    return alternateSet.contains(type);
  }

  @Override
  public boolean isUnion() {
    return true;
  }

  @Override
  public UnionType toMaybeUnion() {
    return this;
  }

  @Override
  public <T> T visit(Visitor<T> visitor) {
    return visitor.caseUnionType(this);
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof UnionType && alternateSet.equals(((UnionType) other).alternateSet);
  }

  @Override
  public int hashCode() {
    return alternateSet.hashCode();
  }

  /**
   * Literal members other than {@code None} are printed together, at the position of the first
   * one, as in {@code int | Literal[1, 'a'] | None}.
   */
  @Override
  public String toString() {
    List<String> literalValues = new ArrayList<>();
    for (Type alternate : alternates) {
      LiteralType literal = alternate.toMaybeLiteral();
      if (literal != null && !literal.isNone()) {
        literalValues.add(literal.getValueText());
      }
    }
    List<String> parts = new ArrayList<>();
    boolean literalsPrinted = false;
    for (Type alternate : alternates) {
      LiteralType literal = alternate.toMaybeLiteral();
      if (literal != null && !literal.isNone()) {
        if (!literalsPrinted) {
          parts.add("Literal[" + Joiner.on(", ").join(literalValues) + "]");
          literalsPrinted = true;
        }
      } else {
        parts.add(alternate.toString());
      }
    }
    return Joiner.on(" | ").join(parts);
  }
}
