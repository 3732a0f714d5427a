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

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A type inhabited by exactly one compile-time value: {@code Literal[1]}, {@code Literal['a']},
 * {@code Literal[True]}, {@code Literal[Color.RED]} or {@code None}.
 *
 * <p>Two literals are equal only if their kinds and values are equal. In particular {@code
 * Literal[1]} and {@code Literal[True]} are different types even though {@code 1 == True} holds
 * at runtime.
 */
public final class LiteralType extends Type {
  private final LiteralKind kind;
  private final String className;

  /**
   * A {@link String} for STR, an {@code ImmutableList<Byte>} for BYTES, a {@link Long} for INT, a
   * {@link Boolean} for BOOL, an {@link EnumMember} for ENUM and null for NONE.
   */
  private final @Nullable Object value;

  LiteralType(LiteralKind kind, @Nullable Object value) {
    this.kind = checkNotNull(kind);
    this.value = value;
    switch (kind) {
      case STR:
        checkArgument(value instanceof String, value);
        break;
      case BYTES:
        checkArgument(value instanceof ImmutableList, value);
        break;
      case INT:
        checkArgument(value instanceof Long, value);
        break;
      case BOOL:
        checkArgument(value instanceof Boolean, value);
        break;
      case ENUM:
        checkArgument(value instanceof EnumMember, value);
        break;
      case NONE:
        checkArgument(value == null, value);
        break;
    }
    this.className =
        kind == LiteralKind.ENUM ? ((EnumMember) value).getEnumClassName() : kind.getClassName();
  }

  public LiteralKind getKind() {
    return kind;
  }

  public @Nullable Object getValue() {
    return value;
  }

  /** Returns the class the literal widens to, e.g. {@code int} for {@code Literal[1]}. */
  public String getClassName() {
    return className;
  }

  public boolean isNone() {
    return kind == LiteralKind.NONE;
  }

  @Override
  public boolean isLiteral() {
    return true;
  }

  @Override
  public LiteralType toMaybeLiteral() {
    return this;
  }

  @Override
  public <T> T visit(Visitor<T> visitor) {
    return visitor.caseLiteralType(this);
  }

  /** Returns the value as it appears inside {@code Literal[...]}. */
  String getValueText() {
    switch (kind) {
      case STR:
        return quote((String) value);
      case BYTES:
        StringBuilder sb = new StringBuilder("b'");
        @SuppressWarnings("unchecked")
        ImmutableList<Byte> bytes = (ImmutableList<Byte>) value;
        for (byte b : bytes) {
          if (b >= 0x20 && b < 0x7f && b != '\'' && b != '\\') {
            sb.append((char) b);
          } else {
            sb.append(String.format("\\x%02x", b & 0xff));
          }
        }
        return sb.append('\'').toString();
      case BOOL:
        return ((Boolean) value) ? "True" : "False";
      case NONE:
        return "None";
      default:
        return String.valueOf(value);
    }
  }

  private static String quote(String s) {
    return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof LiteralType)) {
      return false;
    }
    LiteralType that = (LiteralType) other;
    return kind == that.kind && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public String toString() {
    return isNone() ? "None" : "Literal[" + getValueText() + "]";
  }
}
