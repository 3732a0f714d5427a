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

import org.jspecify.annotations.Nullable;

/**
 * The gradual type. There are two instances: {@code Any}, written by the user, and {@code
 * Unknown}, produced when inference has nothing to go on. Both are compatible with every type in
 * either direction.
 */
public final class UnknownType extends Type {
  static final UnknownType UNKNOWN = new UnknownType("Unknown");
  static final UnknownType ANY = new UnknownType("Any");

  private final String name;

  private UnknownType(String name) {
    this.name = name;
  }

  /** Whether this is the explicit {@code Any} rather than an inferred unknown. */
  public boolean isExplicitAny() {
    return this == ANY;
  }

  @Override
  public boolean isUnknown() {
    return true;
  }

  @Override
  public <T> T visit(Visitor<T> visitor) {
    return visitor.caseUnknownType(this);
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other == this;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
