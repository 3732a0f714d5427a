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

import com.google.common.collect.ImmutableList;
import com.google.narrowing.types.Type;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The syntactic form of a literal container display such as {@code (1, b, "a")} or {@code {"k":
 * v}}. For a dict display only the keys are listed, since membership tests keys.
 *
 * <p>An identifier bound to a display, as in {@code x = (1, 2); if a in x: ...}, may be described
 * by the display it is bound to.
 */
public final class ContainerDisplay {

  /** The kind of display. */
  public enum Kind {
    TUPLE,
    LIST,
    SET,
    FROZENSET,
    DICT,
  }

  private final Kind kind;
  private final ImmutableList<Element> elements;

  private ContainerDisplay(Kind kind, ImmutableList<Element> elements) {
    this.kind = checkNotNull(kind);
    this.elements = checkNotNull(elements);
  }

  public static ContainerDisplay of(Kind kind, Element... elements) {
    return new ContainerDisplay(kind, ImmutableList.copyOf(elements));
  }

  public static ContainerDisplay of(Kind kind, List<Element> elements) {
    return new ContainerDisplay(kind, ImmutableList.copyOf(elements));
  }

  public Kind getKind() {
    return kind;
  }

  public ImmutableList<Element> getElements() {
    return elements;
  }

  /**
   * One element (or dict key) sub-expression of a display: its static type as computed by the
   * expression evaluator and, if it is a compile-time constant, its value.
   */
  public static final class Element {
    private final Type type;
    private final boolean isConstant;
    private final @Nullable Object constantValue;

    private Element(Type type, boolean isConstant, @Nullable Object constantValue) {
      this.type = checkNotNull(type);
      this.isConstant = isConstant;
      this.constantValue = constantValue;
    }

    /**
     * A constant element such as {@code 1}, {@code "a"}, {@code True} or {@code None}. Java
     * {@code null} stands for {@code None}.
     */
    public static Element constant(@Nullable Object value, Type type) {
      return new Element(type, true, value);
    }

    /** An element whose value is not known statically, such as a name or a call. */
    public static Element expression(Type type) {
      return new Element(type, false, null);
    }

    public Type getType() {
      return type;
    }

    public boolean isConstant() {
      return isConstant;
    }

    public @Nullable Object getConstantValue() {
      return constantValue;
    }

    @Override
    public String toString() {
      return isConstant ? "const " + constantValue : "expr " + type;
    }
  }
}
