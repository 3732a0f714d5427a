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

/** The bottom type. No value has this type; it is the empty union. */
public final class NeverType extends Type {
  static final NeverType INSTANCE = new NeverType();

  private NeverType() {}

  @Override
  public boolean isNever() {
    return true;
  }

  @Override
  public ImmutableList<Type> getAlternates() {
    return ImmutableList.of();
  }

  @Override
  public <T> T visit(Visitor<T> visitor) {
    return visitor.caseNeverType();
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other == this;
  }

  @Override
  public int hashCode() {
    return NeverType.class.hashCode();
  }

  @Override
  public String toString() {
    return "Never";
  }
}
