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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** A compile-time constant naming one member of an enum class, e.g. {@code Color.RED}. */
public final class EnumMember {
  private final String enumClassName;
  private final String memberName;

  public EnumMember(String enumClassName, String memberName) {
    this.enumClassName = checkNotNull(enumClassName);
    this.memberName = checkNotNull(memberName);
  }

  public String getEnumClassName() {
    return enumClassName;
  }

  public String getMemberName() {
    return memberName;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof EnumMember)) {
      return false;
    }
    EnumMember that = (EnumMember) other;
    return enumClassName.equals(that.enumClassName) && memberName.equals(that.memberName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(enumClassName, memberName);
  }

  @Override
  public String toString() {
    return enumClassName + "." + memberName;
  }
}
