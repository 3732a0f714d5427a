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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An instance of a TypedDict class. Besides the class name, the type records which of its entries
 * are required and which of the optional ones are known to be present in the current flow.
 */
public final class TypedDictType extends InstanceType {
  private final ImmutableMap<String, Entry> entries;
  private final boolean isFinal;

  TypedDictType(String className, ImmutableMap<String, Entry> entries, boolean isFinal) {
    super(className, ImmutableList.of(), TupleForm.NONE);
    this.entries = checkNotNull(entries);
    this.isFinal = isFinal;
  }

  public ImmutableMap<String, Entry> getEntries() {
    return entries;
  }

  public @Nullable Entry getEntry(String key) {
    return entries.get(key);
  }

  /** A final TypedDict cannot be extended with more entries by a subclass. */
  public boolean isFinal() {
    return isFinal;
  }

  /** Returns a copy of this type in which the named optional entry is known to be present. */
  public TypedDictType withEntryProvided(String key) {
    Entry entry = entries.get(key);
    checkArgument(entry != null, "No entry %s in %s", key, getClassName());
    if (entry.isRequired() || entry.isProvided()) {
      return this;
    }
    Map<String, Entry> newEntries = new LinkedHashMap<>(entries);
    newEntries.put(key, new Entry(entry.getValueType(), false, true));
    return new TypedDictType(getClassName(), ImmutableMap.copyOf(newEntries), isFinal);
  }

  @Override
  public TypedDictType toMaybeTypedDict() {
    return this;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof TypedDictType)) {
      return false;
    }
    TypedDictType that = (TypedDictType) other;
    return getClassName().equals(that.getClassName())
        && isFinal == that.isFinal
        && entries.equals(that.entries);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClassName(), entries, isFinal);
  }

  /** Prints the class name followed by the optional entries known to be present, if any. */
  @Override
  public String toString() {
    List<String> provided = new ArrayList<>();
    for (Map.Entry<String, Entry> entry : entries.entrySet()) {
      if (entry.getValue().isProvided()) {
        provided.add(entry.getKey());
      }
    }
    if (provided.isEmpty()) {
      return getClassName();
    }
    return getClassName() + "[" + Joiner.on(", ").join(provided) + "]";
  }

  /** One declared entry of a TypedDict. */
  public static final class Entry {
    private final Type valueType;
    private final boolean required;
    private final boolean provided;

    public Entry(Type valueType, boolean required, boolean provided) {
      this.valueType = checkNotNull(valueType);
      this.required = required;
      this.provided = provided;
    }

    public Type getValueType() {
      return valueType;
    }

    public boolean isRequired() {
      return required;
    }

    /** Whether a not-required entry has been shown to be present, e.g. by {@code "k" in td}. */
    public boolean isProvided() {
      return provided;
    }

    @Override
    public boolean equals(@Nullable Object other) {
      if (!(other instanceof Entry)) {
        return false;
      }
      Entry that = (Entry) other;
      return required == that.required
          && provided == that.provided
          && valueType.equals(that.valueType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(valueType, required, provided);
    }
  }
}
