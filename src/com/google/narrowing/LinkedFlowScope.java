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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import com.google.narrowing.types.Type;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A flow scope that stores one inferred slot per link and delegates everything else to its
 * parent. Chains are flattened once they get long, so lookups stay cheap.
 *
 * <p>Joining two scopes keeps the slots both branches agree on. A slot the branches disagree on
 * reverts to its type in the closest scope both branches grew from, i.e. its type before the
 * branching condition narrowed it.
 */
public final class LinkedFlowScope implements FlowScope {
  // Flatten chains longer than this.
  static final int MAX_DEPTH = 250;

  private final ImmutableMap<String, Type> declaredTypes;
  private final @Nullable LinkedFlowScope parent;
  private final int depth;

  // Slots inferred by this link. A single entry unless this link is flattened.
  private final ImmutableMap<String, Type> slots;

  private LinkedFlowScope(
      ImmutableMap<String, Type> declaredTypes,
      @Nullable LinkedFlowScope parent,
      ImmutableMap<String, Type> slots) {
    this.declaredTypes = declaredTypes;
    this.parent = parent;
    this.depth = parent == null ? 0 : parent.depth + 1;
    this.slots = slots;
  }

  /** Creates the scope at the entry of a flow, in which every symbol has its declared type. */
  public static LinkedFlowScope createEntryLattice(Map<String, Type> declaredTypes) {
    return new LinkedFlowScope(ImmutableMap.copyOf(declaredTypes), null, ImmutableMap.of());
  }

  @Override
  public @Nullable Type getSlotType(String name) {
    for (LinkedFlowScope scope = this; scope != null; scope = scope.parent) {
      Type type = scope.slots.get(name);
      if (type != null) {
        return type;
      }
    }
    return declaredTypes.get(name);
  }

  @Override
  public @Nullable Type getDeclaredType(String name) {
    return declaredTypes.get(name);
  }

  @Override
  public LinkedFlowScope inferSlotType(String name, Type type) {
    checkArgument(declaredTypes.containsKey(name), "Undeclared symbol %s", name);
    checkNotNull(type);
    if (type.equals(getSlotType(name))) {
      return this;
    }
    if (depth >= MAX_DEPTH) {
      Map<String, Type> flattened = new LinkedHashMap<>(getInferredSlots());
      flattened.put(name, type);
      return new LinkedFlowScope(declaredTypes, null, ImmutableMap.copyOf(flattened));
    }
    return new LinkedFlowScope(declaredTypes, this, ImmutableMap.of(name, type));
  }

  /** Returns the latest inferred type of every slot inferred in this flow. */
  ImmutableMap<String, Type> getInferredSlots() {
    Map<String, Type> result = new LinkedHashMap<>();
    for (LinkedFlowScope scope = this; scope != null; scope = scope.parent) {
      for (Map.Entry<String, Type> slot : scope.slots.entrySet()) {
        result.putIfAbsent(slot.getKey(), slot.getValue());
      }
    }
    return ImmutableMap.copyOf(result);
  }

  /**
   * Joins the scopes at the end of two branches. A symbol keeps its type if both branches agree on
   * it; otherwise it reverts to its type in the common ancestor of the two scopes. If flattening
   * has cut the branches apart, the declared type stands in for the ancestor's.
   */
  public static LinkedFlowScope join(LinkedFlowScope a, LinkedFlowScope b) {
    checkArgument(
        a.declaredTypes.equals(b.declaredTypes), "Cannot join scopes of different flows");
    FlowScope common = findCommonAncestor(a, b);
    if (common == null) {
      common = createEntryLattice(a.declaredTypes);
    }
    Set<String> names = new LinkedHashSet<>(a.getInferredSlots().keySet());
    names.addAll(b.getInferredSlots().keySet());
    Map<String, Type> joined = new LinkedHashMap<>();
    for (String name : names) {
      Type typeA = a.getSlotType(name);
      Type joinedType = typeA.equals(b.getSlotType(name)) ? typeA : common.getSlotType(name);
      if (!joinedType.equals(a.declaredTypes.get(name))) {
        joined.put(name, joinedType);
      }
    }
    return new LinkedFlowScope(a.declaredTypes, null, ImmutableMap.copyOf(joined));
  }

  private static @Nullable LinkedFlowScope findCommonAncestor(
      LinkedFlowScope a, LinkedFlowScope b) {
    Set<LinkedFlowScope> ancestors = Sets.newIdentityHashSet();
    for (LinkedFlowScope scope = a; scope != null; scope = scope.parent) {
      ancestors.add(scope);
    }
    for (LinkedFlowScope scope = b; scope != null; scope = scope.parent) {
      if (ancestors.contains(scope)) {
        return scope;
      }
    }
    return null;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof LinkedFlowScope)) {
      return false;
    }
    LinkedFlowScope that = (LinkedFlowScope) other;
    return declaredTypes.equals(that.declaredTypes)
        && getInferredSlots().equals(that.getInferredSlots());
  }

  @Override
  public int hashCode() {
    return Objects.hash(declaredTypes, getInferredSlots());
  }

  @Override
  public String toString() {
    return getInferredSlots().toString();
  }
}
