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

import com.google.narrowing.types.LiteralKind;
import com.google.narrowing.types.LiteralType;
import com.google.narrowing.types.Type;
import com.google.narrowing.types.TypeRegistry;
import com.google.narrowing.types.TypedDictType;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A reverse abstract interpreter for {@code "key" in d}, where {@code d} is a name whose type
 * contains TypedDicts and the key is a str constant or has a str literal type. The container side
 * is narrowed:
 *
 * <ul>
 *   <li>when the key is present, a final TypedDict without that entry is ruled out, and a
 *       not-required entry becomes provided;
 *   <li>when the key is absent, a TypedDict whose entry is required or provided is ruled out.
 * </ul>
 */
public final class TypedDictKeyReverseAbstractInterpreter
    extends ChainableReverseAbstractInterpreter {
  private static final Logger logger =
      Logger.getLogger(TypedDictKeyReverseAbstractInterpreter.class.getName());

  public TypedDictKeyReverseAbstractInterpreter(TypeRegistry typeRegistry) {
    super(typeRegistry);
  }

  @Override
  public FlowScope getPreciserScopeKnowingConditionOutcome(
      MembershipTest condition, FlowScope blindScope, boolean outcome) {
    MembershipTest.Operand left = condition.getLeft();
    MembershipTest.Operand right = condition.getRight();
    String key = getKey(left);
    if (key != null) {
      Type containerType = getTypeIfRefinable(right, blindScope);
      if (containerType != null) {
        boolean keyPresent = outcome != condition.isNegated();
        Type restricted = getRestrictedByKey(containerType, key, keyPresent);
        if (logger.isLoggable(Level.FINE)) {
          logger.fine(
              "Knowing (" + condition + ") is " + outcome + ": " + right + " is " + restricted);
        }
        FlowScope narrowedScope = declareNameInScope(blindScope, right, restricted);
        return nextPreciserScopeKnowingConditionOutcome(condition, narrowedScope, outcome);
      }
    }
    return nextPreciserScopeKnowingConditionOutcome(condition, blindScope, outcome);
  }

  /**
   * Returns the key tested by {@code operand}: a str constant, or any operand whose type is a
   * single str literal. Returns null otherwise.
   */
  private static @Nullable String getKey(MembershipTest.Operand operand) {
    if (operand.isConstant() && operand.getConstantValue() instanceof String) {
      return (String) operand.getConstantValue();
    }
    LiteralType literal = operand.getType().toMaybeLiteral();
    if (literal != null && literal.getKind() == LiteralKind.STR) {
      return (String) literal.getValue();
    }
    return null;
  }

  /**
   * Restricts the TypedDict members of {@code type} knowing whether {@code key} is present.
   * Members that are not TypedDicts are kept.
   */
  Type getRestrictedByKey(Type type, String key, boolean keyPresent) {
    List<Type> restricted = new ArrayList<>();
    for (Type alternate : type.getAlternates()) {
      TypedDictType typedDict = alternate.toMaybeTypedDict();
      if (typedDict == null) {
        restricted.add(alternate);
        continue;
      }
      TypedDictType.Entry entry = typedDict.getEntry(key);
      boolean known = entry != null && (entry.isRequired() || entry.isProvided());
      if (keyPresent) {
        if (entry == null) {
          // A subclass of a non-final TypedDict may add the entry.
          if (!typedDict.isFinal()) {
            restricted.add(typedDict);
          }
        } else {
          restricted.add(known ? typedDict : typedDict.withEntryProvided(key));
        }
      } else if (!known) {
        restricted.add(typedDict);
      }
    }
    return typeRegistry.createUnionType(restricted);
  }
}
