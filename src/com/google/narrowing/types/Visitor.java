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

/**
 * A type visitor. There is one case per kind of {@link Type}.
 *
 * @param <T> the return type of the visit
 */
public interface Visitor<T> {
  /** Literal type's case. */
  T caseLiteralType(LiteralType type);

  /** Instance type's case. TypedDict instances are visited here as well. */
  T caseInstanceType(InstanceType type);

  /** Union type's case. */
  T caseUnionType(UnionType type);

  /** Bottom type's case. */
  T caseNeverType();

  /** Unknown and Any type's case. */
  T caseUnknownType(UnknownType type);
}
