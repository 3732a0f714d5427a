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

import com.google.narrowing.types.InstanceType;
import com.google.narrowing.types.LiteralType;
import com.google.narrowing.types.Type;
import com.google.narrowing.types.TypeRegistry;
import com.google.narrowing.types.UnionType;
import com.google.narrowing.types.UnknownType;
import com.google.narrowing.types.Visitor;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the types of a tested value on both branches of {@code x in container} or {@code x not
 * in container}.
 *
 * <p>Each disjunct of the tested type is classified against the container's elements:
 *
 * <ul>
 *   <li>a literal equal to a literal fact is certainly in the container, so it only survives on
 *       the true branch;
 *   <li>a disjunct that overlaps some element may or may not be in the container, so it survives
 *       on both branches. On the true branch an instance disjunct that is wider than every
 *       element it overlaps is narrowed to those elements;
 *   <li>a disjunct that overlaps no element is never in the container, so it only survives on the
 *       false branch.
 * </ul>
 *
 * A non-literal disjunct such as {@code str} is never narrowed down to a literal: nothing says
 * which value a general {@code str} has when the test holds.
 *
 * <p>The engine never fails. When it has no evidence it returns the tested type on both branches.
 */
public final class NarrowingEngine {
  private static final Logger logger = Logger.getLogger(NarrowingEngine.class.getName());

  private final TypeRegistry registry;
  private final NarrowingOptions options;

  public NarrowingEngine(TypeRegistry registry, NarrowingOptions options) {
    this.registry = checkNotNull(registry);
    this.options = checkNotNull(options);
  }

  /**
   * @param testedType the type of the value on the left of {@code in}
   * @param elements the elements of the container on the right
   * @param negated whether the operator is {@code not in}
   */
  public NarrowingResult narrow(Type testedType, ElementSet elements, boolean negated) {
    NarrowingResult result = narrowForIn(checkNotNull(testedType), checkNotNull(elements));
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(
          (negated ? "not in " : "in ") + elements + ": " + testedType + " -> " + result);
    }
    return negated ? result.swap() : result;
  }

  private NarrowingResult narrowForIn(Type testedType, ElementSet elements) {
    if (elements.isOpaque()) {
      return NarrowingResult.unchanged(testedType);
    }
    for (Type alternate : testedType.getAlternates()) {
      if (isUnnarrowable(alternate)) {
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Not narrowing " + testedType + " because of " + alternate);
        }
        return NarrowingResult.unchanged(testedType);
      }
    }

    MembershipVisitor visitor = new MembershipVisitor(elements);
    List<Type> trueTypes = new ArrayList<>();
    List<Type> falseTypes = new ArrayList<>();
    for (Type alternate : testedType.getAlternates()) {
      switch (alternate.visit(visitor)) {
        case DEFINITELY_IN:
          trueTypes.add(alternate);
          break;
        case MAYBE_IN:
          trueTypes.add(alternate.isInstance() ? narrowToElements(alternate, elements) : alternate);
          falseTypes.add(alternate);
          break;
        case NEVER_IN:
          falseTypes.add(alternate);
          break;
      }
    }

    Type trueType = registry.createUnionType(trueTypes);
    Type falseType =
        options.shouldNarrowFalseBranch() ? registry.createUnionType(falseTypes) : testedType;
    return new NarrowingResult(trueType, falseType);
  }

  /**
   * Returns the part of an instance disjunct that may be in the container. That is the disjunct
   * itself when it fits an element, or when a literal element could equal it. Otherwise it is the
   * union of the elements narrower than the disjunct, e.g. {@code bool} for {@code int} tested
   * against {@code dict[bool, str]}.
   */
  private Type narrowToElements(Type disjunct, ElementSet elements) {
    List<Type> narrower = new ArrayList<>();
    boolean keepDisjunct = false;
    for (Type element : elements.getTypes()) {
      if (registry.isAssignable(disjunct, element)) {
        return disjunct;
      }
      if (registry.isAssignable(element, disjunct)) {
        if (element.isLiteral()) {
          keepDisjunct = true;
        } else {
          narrower.add(element);
        }
      }
    }
    return keepDisjunct ? disjunct : registry.createUnionType(narrower);
  }

  /**
   * Whether the disjunct blocks narrowing of the whole type: gradual types, and instances of
   * classes like {@code object} that every element overlaps.
   */
  private boolean isUnnarrowable(Type alternate) {
    return alternate.isUnknown()
        || registry.isInstanceOfAny(alternate, options.getUnnarrowableClasses());
  }

  private enum Membership {
    DEFINITELY_IN,
    MAYBE_IN,
    NEVER_IN,
  }

  /** Classifies one disjunct of the tested type. */
  private class MembershipVisitor implements Visitor<Membership> {
    private final ElementSet elements;

    MembershipVisitor(ElementSet elements) {
      this.elements = elements;
    }

    @Override
    public Membership caseLiteralType(LiteralType type) {
      if (elements.containsLiteralFact(type)) {
        return Membership.DEFINITELY_IN;
      }
      for (ElementSet.Member member : elements.getMembers()) {
        Type element = member.getType();
        if (element.isLiteral()) {
          // Literal identity: Literal[1] and Literal[True] do not match.
          if (element.equals(type)) {
            return Membership.MAYBE_IN;
          }
        } else if (registry.isAssignable(type, element)) {
          return Membership.MAYBE_IN;
        }
      }
      return Membership.NEVER_IN;
    }

    @Override
    public Membership caseInstanceType(InstanceType type) {
      for (Type element : elements.getTypes()) {
        if (registry.isAssignable(element, type) || registry.isAssignable(type, element)) {
          return Membership.MAYBE_IN;
        }
      }
      return Membership.NEVER_IN;
    }

    @Override
    public Membership caseUnionType(UnionType type) {
      throw new IllegalStateException("Unions are classified per alternate: " + type);
    }

    @Override
    public Membership caseNeverType() {
      throw new IllegalStateException("Never has no alternates");
    }

    @Override
    public Membership caseUnknownType(UnknownType type) {
      return Membership.MAYBE_IN;
    }
  }
}
