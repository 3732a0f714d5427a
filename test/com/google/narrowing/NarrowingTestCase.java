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

import com.google.narrowing.types.NativeType;
import com.google.narrowing.types.Type;
import com.google.narrowing.types.TypeRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.junit.Before;

/** Base class for tests that need a type registry and shorthands for common types. */
abstract class NarrowingTestCase {
  protected TypeRegistry registry;
  protected NarrowingOptions options;

  @Before
  public void setUp() throws Exception {
    registry = new TypeRegistry();
    options = new NarrowingOptions();
  }

  protected Type getNativeType(NativeType typeId) {
    return registry.getNativeType(typeId);
  }

  protected Type getNativeObjectType() {
    return getNativeType(NativeType.OBJECT_TYPE);
  }

  protected Type getNativeIntType() {
    return getNativeType(NativeType.INT_TYPE);
  }

  protected Type getNativeFloatType() {
    return getNativeType(NativeType.FLOAT_TYPE);
  }

  protected Type getNativeBoolType() {
    return getNativeType(NativeType.BOOL_TYPE);
  }

  protected Type getNativeStrType() {
    return getNativeType(NativeType.STR_TYPE);
  }

  protected Type getNativeBytesType() {
    return getNativeType(NativeType.BYTES_TYPE);
  }

  protected Type getNativeNoneType() {
    return getNativeType(NativeType.NONE_TYPE);
  }

  protected Type getNativeTypeType() {
    return getNativeType(NativeType.TYPE_TYPE);
  }

  protected Type getNativeNeverType() {
    return getNativeType(NativeType.NEVER_TYPE);
  }

  protected Type getNativeUnknownType() {
    return getNativeType(NativeType.UNKNOWN_TYPE);
  }

  protected Type getNativeAnyType() {
    return getNativeType(NativeType.ANY_TYPE);
  }

  protected Type createUnionType(Type... types) {
    return registry.createUnionType(types);
  }

  /** Returns {@code type | None}. */
  protected Type createOptionalType(Type type) {
    return registry.createUnionType(type, getNativeNoneType());
  }

  protected Type createInstanceType(String className, Type... typeArguments) {
    return registry.createInstanceType(className, typeArguments);
  }

  /**
   * Returns the union of the literal types of the given constants, e.g. {@code literal(1, 2, "a")}
   * is {@code Literal[1, 2, 'a']}. Java {@code null} stands for {@code None}.
   */
  protected Type literal(@Nullable Object... values) {
    List<Type> types = new ArrayList<>();
    for (Object value : values) {
      types.add(registry.literalDescriptionOf(value).get());
    }
    return registry.createUnionType(types);
  }

  /** A constant display element whose static type is its literal type. */
  protected ContainerDisplay.Element constant(@Nullable Object value) {
    return ContainerDisplay.Element.constant(value, registry.literalDescriptionOf(value).get());
  }

  protected ContainerDisplay.Element expression(Type type) {
    return ContainerDisplay.Element.expression(type);
  }

  protected ContainerDisplay tupleDisplay(ContainerDisplay.Element... elements) {
    return ContainerDisplay.of(ContainerDisplay.Kind.TUPLE, elements);
  }

  protected ContainerDisplay listDisplay(ContainerDisplay.Element... elements) {
    return ContainerDisplay.of(ContainerDisplay.Kind.LIST, elements);
  }

  /** The static type of a display, as the expression evaluator infers it. */
  protected Type typeOf(ContainerDisplay display) {
    List<Type> elementTypes = new ArrayList<>();
    for (ContainerDisplay.Element element : display.getElements()) {
      elementTypes.add(element.getType());
    }
    switch (display.getKind()) {
      case TUPLE:
        return registry.createTupleType(elementTypes.toArray(new Type[0]));
      case DICT:
        return createInstanceType(
            "dict", registry.createUnionType(elementTypes), getNativeUnknownType());
      default:
        String className = display.getKind().name().toLowerCase(Locale.ROOT);
        return createInstanceType(className, registry.createUnionType(elementTypes));
    }
  }
}
