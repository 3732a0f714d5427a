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

/** The base kind of a {@link LiteralType}. */
public enum LiteralKind {
  STR("str"),
  BYTES("bytes"),
  INT("int"),
  BOOL("bool"),
  /** An enum member. The base class is the enum class, stored on the literal. */
  ENUM(null),
  NONE("None");

  private final @Nullable String className;

  LiteralKind(@Nullable String className) {
    this.className = className;
  }

  /** Returns the builtin class of literals of this kind, or null for enum members. */
  @Nullable String getClassName() {
    return className;
  }
}
