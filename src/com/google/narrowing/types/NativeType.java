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

/** Constants corresponding to types that are built into the registry. */
public enum NativeType {
  OBJECT_TYPE,
  INT_TYPE,
  FLOAT_TYPE,
  COMPLEX_TYPE,
  BOOL_TYPE,
  STR_TYPE,
  BYTES_TYPE,
  /** The type of {@code None}, which is its only value. */
  NONE_TYPE,
  TYPE_TYPE,
  NEVER_TYPE,
  UNKNOWN_TYPE,
  ANY_TYPE,
}
