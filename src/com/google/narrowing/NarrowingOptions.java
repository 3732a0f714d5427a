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

import com.google.common.collect.ImmutableSet;
import java.io.Serializable;
import java.util.Collection;

/** Options for membership narrowing. The defaults match the checker's builtin behavior. */
public class NarrowingOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Containers whose single type argument is the element type. */
  static final ImmutableSet<String> DEFAULT_SEQUENCE_CONTAINERS =
      ImmutableSet.of(
          "list",
          "set",
          "frozenset",
          "deque",
          "tuple",
          "Sequence",
          "MutableSequence",
          "Collection",
          "Container",
          "AbstractSet",
          "MutableSet");

  /** Containers tested by key. The first type argument is the element type. */
  static final ImmutableSet<String> DEFAULT_MAPPING_CONTAINERS =
      ImmutableSet.of("dict", "defaultdict", "OrderedDict", "Mapping", "MutableMapping");

  /**
   * Classes whose instances are never narrowed. {@code object} accepts every element, and the
   * class objects in {@code x in (str, int)} carry no literal identity.
   */
  static final ImmutableSet<String> DEFAULT_UNNARROWABLE_CLASSES =
      ImmutableSet.of("object", "type");

  private ImmutableSet<String> sequenceContainers = DEFAULT_SEQUENCE_CONTAINERS;
  private ImmutableSet<String> mappingContainers = DEFAULT_MAPPING_CONTAINERS;
  private ImmutableSet<String> unnarrowableClasses = DEFAULT_UNNARROWABLE_CLASSES;
  private boolean narrowFalseBranch = true;

  public ImmutableSet<String> getSequenceContainers() {
    return sequenceContainers;
  }

  public void setSequenceContainers(Collection<String> sequenceContainers) {
    this.sequenceContainers = ImmutableSet.copyOf(sequenceContainers);
  }

  public ImmutableSet<String> getMappingContainers() {
    return mappingContainers;
  }

  public void setMappingContainers(Collection<String> mappingContainers) {
    this.mappingContainers = ImmutableSet.copyOf(mappingContainers);
  }

  public ImmutableSet<String> getUnnarrowableClasses() {
    return unnarrowableClasses;
  }

  public void setUnnarrowableClasses(Collection<String> unnarrowableClasses) {
    this.unnarrowableClasses = ImmutableSet.copyOf(unnarrowableClasses);
  }

  public boolean shouldNarrowFalseBranch() {
    return narrowFalseBranch;
  }

  /**
   * Whether literals that are certainly in the container are removed from the branch where the
   * {@code in} test fails. When off only the branch where it holds is narrowed.
   */
  public void setNarrowFalseBranch(boolean narrowFalseBranch) {
    this.narrowFalseBranch = narrowFalseBranch;
  }
}
