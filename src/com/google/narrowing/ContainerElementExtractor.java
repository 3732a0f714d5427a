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
import com.google.narrowing.types.InstanceType;
import com.google.narrowing.types.NativeType;
import com.google.narrowing.types.Type;
import com.google.narrowing.types.TypeRegistry;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Computes the {@link ElementSet} of the container side of an {@code in} test.
 *
 * <p>A literal display yields one member per syntactic element, and constant elements are literal
 * facts. Any other container is described by its declared type: the positions of a fixed tuple,
 * the element type of a sequence or set, or the key type of a mapping. Declared types never yield
 * literal facts, since the elements behind them are opaque expressions.
 */
public final class ContainerElementExtractor {
  private static final Logger logger =
      Logger.getLogger(ContainerElementExtractor.class.getName());

  private final TypeRegistry registry;
  private final NarrowingOptions options;

  public ContainerElementExtractor(TypeRegistry registry, NarrowingOptions options) {
    this.registry = checkNotNull(registry);
    this.options = checkNotNull(options);
  }

  /**
   * @param containerType the static type of the container expression
   * @param display the container's literal display, or null if it is not one
   */
  public ElementSet extract(Type containerType, @Nullable ContainerDisplay display) {
    ElementSet elements =
        display != null ? extractFromDisplay(display) : extractFromDeclaredType(containerType);
    if (elements.isOpaque() && logger.isLoggable(Level.FINE)) {
      logger.fine("No element facts for container of type " + containerType);
    }
    return elements;
  }

  ElementSet extractFromDisplay(ContainerDisplay display) {
    ElementSet.Builder builder = ElementSet.builder();
    for (ContainerDisplay.Element element : display.getElements()) {
      if (element.isConstant()) {
        Optional<Type> literal = registry.literalDescriptionOf(element.getConstantValue());
        if (literal.isPresent()) {
          builder.addLiteralFact(literal.get());
          continue;
        }
      }
      if (!addElementType(builder, element.getType())) {
        return ElementSet.opaque();
      }
    }
    return builder.build();
  }

  ElementSet extractFromDeclaredType(Type containerType) {
    ElementSet.Builder builder = ElementSet.builder();
    for (Type container : containerType.getAlternates()) {
      List<Type> elementTypes = getDeclaredElementTypes(container);
      if (elementTypes == null) {
        return ElementSet.opaque();
      }
      for (Type elementType : elementTypes) {
        if (!addElementType(builder, elementType)) {
          return ElementSet.opaque();
        }
      }
    }
    return builder.build();
  }

  /**
   * Returns the types a declared container yields on a membership test, or null if the container
   * is not one whose elements can be described.
   */
  private @Nullable List<Type> getDeclaredElementTypes(Type containerType) {
    InstanceType container = containerType.toMaybeInstance();
    if (container == null) {
      return null;
    }
    if (container.toMaybeTypedDict() != null) {
      return ImmutableList.of(registry.getNativeType(NativeType.STR_TYPE));
    }
    if (!container.isSpecialized()) {
      return null;
    }
    if (container.isFixedTuple()) {
      return container.getTypeArguments();
    }
    String className = container.getClassName();
    if (options.getSequenceContainers().contains(className)
        || options.getMappingContainers().contains(className)) {
      return ImmutableList.of(container.getTypeArguments().get(0));
    }
    return null;
  }

  /** Adds the disjuncts of {@code type}. Returns false if one of them is unknown. */
  private static boolean addElementType(ElementSet.Builder builder, Type type) {
    for (Type alternate : type.getAlternates()) {
      if (alternate.isUnknown()) {
        return false;
      }
      builder.addType(alternate);
    }
    return true;
  }
}
