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

package com.google.narrowing;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.narrowing.types.Type;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** The types of the tested value on the branch where a condition holds and where it fails. */
public final class NarrowingResult {
  private final Type trueType;
  private final Type falseType;

  public NarrowingResult(Type trueType, Type falseType) {
    this.trueType = checkNotNull(trueType);
    this.falseType = checkNotNull(falseType);
  }

  /** A result that narrows nothing. */
  static NarrowingResult unchanged(Type type) {
    return new NarrowingResult(type, type);
  }

  public Type getTrueType() {
    return trueType;
  }

  public Type getFalseType() {
    return falseType;
  }

  /** Returns the type on the branch for the given outcome of the condition. */
  public Type getType(boolean outcome) {
    return outcome ? trueType : falseType;
  }

  /** Returns the result of the negated condition. */
  public NarrowingResult swap() {
    return new NarrowingResult(falseType, trueType);
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof NarrowingResult)) {
      return false;
    }
    NarrowingResult that = (NarrowingResult) other;
    return trueType.equals(that.trueType) && falseType.equals(that.falseType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(trueType, falseType);
  }

  @Override
  public String toString() {
    return "(" + trueType + ", " + falseType + ")";
  }
}
