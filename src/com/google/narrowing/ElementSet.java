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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.narrowing.types.Type;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Everything a container may yield on a membership test, in encounter order and without
 * duplicates. Each member is a type, and a member that comes from a compile-time constant in a
 * literal display is a <em>literal fact</em>: that exact value is certainly in the container.
 *
 * <p>An opaque element set means nothing is known about the container's elements.
 */
public final class ElementSet {
  private static final ElementSet OPAQUE = new ElementSet(ImmutableList.of(), true);

  private final ImmutableList<Member> members;
  private final boolean opaque;

  private ElementSet(ImmutableList<Member> members, boolean opaque) {
    this.members = members;
    this.opaque = opaque;
  }

  public static ElementSet opaque() {
    return OPAQUE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isOpaque() {
    return opaque;
  }

  public ImmutableList<Member> getMembers() {
    return members;
  }

  public ImmutableList<Type> getTypes() {
    ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (Member member : members) {
      types.add(member.getType());
    }
    return types.build();
  }

  /** Whether {@code type} is one of the literal facts of this set. */
  public boolean containsLiteralFact(Type type) {
    for (Member member : members) {
      if (member.isLiteralFact() && member.getType().equals(type)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof ElementSet)) {
      return false;
    }
    ElementSet that = (ElementSet) other;
    return opaque == that.opaque && members.equals(that.members);
  }

  @Override
  public int hashCode() {
    return Objects.hash(members, opaque);
  }

  @Override
  public String toString() {
    return opaque ? "<opaque>" : "{" + Joiner.on(", ").join(members) + "}";
  }

  /** One type a container may yield. */
  public static final class Member {
    private final Type type;
    private final boolean literalFact;

    Member(Type type, boolean literalFact) {
      this.type = checkNotNull(type);
      this.literalFact = literalFact;
    }

    public Type getType() {
      return type;
    }

    public boolean isLiteralFact() {
      return literalFact;
    }

    @Override
    public boolean equals(@Nullable Object other) {
      if (!(other instanceof Member)) {
        return false;
      }
      Member that = (Member) other;
      return literalFact == that.literalFact && type.equals(that.type);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, literalFact);
    }

    @Override
    public String toString() {
      return literalFact ? type + "!" : type.toString();
    }
  }

  /**
   * Collects members. A type added more than once keeps its first position; it is a literal fact
   * if any of the additions was.
   */
  public static final class Builder {
    private final Map<Type, Boolean> members = new LinkedHashMap<>();
    private boolean built = false;

    private Builder() {}

    public Builder addLiteralFact(Type type) {
      return add(type, true);
    }

    public Builder addType(Type type) {
      return add(type, false);
    }

    private Builder add(Type type, boolean literalFact) {
      checkState(!built, "Builder already used");
      members.merge(checkNotNull(type), literalFact, Boolean::logicalOr);
      return this;
    }

    public ElementSet build() {
      checkState(!built, "Builder already used");
      built = true;
      ImmutableList.Builder<Member> list = ImmutableList.builder();
      for (Map.Entry<Type, Boolean> entry : members.entrySet()) {
        list.add(new Member(entry.getKey(), entry.getValue()));
      }
      return new ElementSet(list.build(), false);
    }
  }
}
