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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Bytes;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The type registry creates types and answers questions about them: union construction,
 * assignability and the literal description of compile-time constants.
 *
 * <p>The registry knows the builtin classes and the {@code typing} protocols used for containers.
 * More classes, such as user enums, can be added with {@link #declareClass} before the registry is
 * shared. After that the registry is read only.
 */
public final class TypeRegistry {

  /** Implicit numeric promotions: an {@code int} is accepted where a {@code float} is expected. */
  private static final ImmutableMap<String, String> PROMOTIONS =
      ImmutableMap.of("int", "float", "float", "complex");

  private static final String TYPED_DICT_BASE = "Mapping";

  private final Map<String, ClassInfo> classes = new LinkedHashMap<>();
  private final Map<NativeType, Type> nativeTypes = new EnumMap<>(NativeType.class);

  public TypeRegistry() {
    initializeBuiltinClasses();
    initializeNativeTypes();
  }

  private void initializeBuiltinClasses() {
    ImmutableList<Variance> none = ImmutableList.of();
    ImmutableList<Variance> cov = ImmutableList.of(Variance.COVARIANT);
    ImmutableList<Variance> inv = ImmutableList.of(Variance.INVARIANT);
    ImmutableList<Variance> invInv = ImmutableList.of(Variance.INVARIANT, Variance.INVARIANT);

    declareClass("object", none);
    declareClass("int", none, "object");
    declareClass("float", none, "object");
    declareClass("complex", none, "object");
    declareClass("bool", none, "int");
    declareClass("str", none, "object");
    declareClass("bytes", none, "object");
    declareClass("None", none, "object");
    declareClass("type", none, "object");
    declareClass("Enum", none, "object");

    declareClass("Container", cov, "object");
    declareClass("Iterable", cov, "object");
    declareClass("Collection", cov, "Container", "Iterable");
    declareClass("Sequence", cov, "Collection");
    declareClass("MutableSequence", inv, "Sequence");
    declareClass("list", inv, "MutableSequence");
    declareClass("deque", inv, "MutableSequence");
    declareClass("tuple", cov, "Sequence");
    declareClass("AbstractSet", cov, "Collection");
    declareClass("MutableSet", inv, "AbstractSet");
    declareClass("set", inv, "MutableSet");
    declareClass("frozenset", cov, "AbstractSet");
    declareClass(
        "Mapping", ImmutableList.of(Variance.INVARIANT, Variance.COVARIANT), "Collection");
    declareClass("MutableMapping", invInv, "Mapping");
    declareClass("dict", invInv, "MutableMapping");
    declareClass("defaultdict", invInv, "dict");
    declareClass("OrderedDict", invInv, "dict");
  }

  private void initializeNativeTypes() {
    nativeTypes.put(NativeType.OBJECT_TYPE, createInstanceType("object"));
    nativeTypes.put(NativeType.INT_TYPE, createInstanceType("int"));
    nativeTypes.put(NativeType.FLOAT_TYPE, createInstanceType("float"));
    nativeTypes.put(NativeType.COMPLEX_TYPE, createInstanceType("complex"));
    nativeTypes.put(NativeType.BOOL_TYPE, createInstanceType("bool"));
    nativeTypes.put(NativeType.STR_TYPE, createInstanceType("str"));
    nativeTypes.put(NativeType.BYTES_TYPE, createInstanceType("bytes"));
    nativeTypes.put(NativeType.NONE_TYPE, new LiteralType(LiteralKind.NONE, null));
    nativeTypes.put(NativeType.TYPE_TYPE, createInstanceType("type"));
    nativeTypes.put(NativeType.NEVER_TYPE, NeverType.INSTANCE);
    nativeTypes.put(NativeType.UNKNOWN_TYPE, UnknownType.UNKNOWN);
    nativeTypes.put(NativeType.ANY_TYPE, UnknownType.ANY);
  }

  public Type getNativeType(NativeType typeId) {
    return nativeTypes.get(typeId);
  }

  /**
   * Declares a nominal class.
   *
   * @param name the class name, unique in this registry
   * @param typeParameters the variance of each type parameter, empty for non-generic classes
   * @param superclasses the direct superclasses, all of which must already be declared
   */
  public ClassInfo declareClass(
      String name, List<Variance> typeParameters, String... superclasses) {
    checkNotNull(name);
    checkState(!classes.containsKey(name), "Class %s is already declared", name);
    for (String superclass : superclasses) {
      checkArgument(
          classes.containsKey(superclass), "Unknown superclass %s of %s", superclass, name);
    }
    ClassInfo info =
        new ClassInfo(
            name, ImmutableList.copyOf(typeParameters), ImmutableList.copyOf(superclasses));
    classes.put(name, info);
    return info;
  }

  /** Declares a user enum class. Its members are created with {@link #createEnumLiteral}. */
  public ClassInfo declareEnum(String name) {
    return declareClass(name, ImmutableList.of(), "Enum");
  }

  public @Nullable ClassInfo getClassInfo(String name) {
    return classes.get(name);
  }

  /** Whether {@code subclass} is {@code superclass} or inherits from it, directly or not. */
  public boolean isSubclass(String subclass, String superclass) {
    if (subclass.equals(superclass)) {
      return true;
    }
    Set<String> seen = new HashSet<>();
    Deque<String> worklist = new ArrayDeque<>();
    worklist.add(subclass);
    while (!worklist.isEmpty()) {
      ClassInfo info = classes.get(worklist.remove());
      if (info == null) {
        continue;
      }
      for (String parent : info.getSuperclasses()) {
        if (parent.equals(superclass)) {
          return true;
        }
        if (seen.add(parent)) {
          worklist.add(parent);
        }
      }
    }
    return false;
  }

  /** Subclassing plus the implicit numeric promotions {@code int -> float -> complex}. */
  private boolean isClassAssignable(String source, String target) {
    for (String current = source; current != null; current = PROMOTIONS.get(current)) {
      if (isSubclass(current, target)) {
        return true;
      }
    }
    return false;
  }

  public InstanceType createInstanceType(String className, Type... typeArguments) {
    return createInstanceType(className, ImmutableList.copyOf(typeArguments));
  }

  public InstanceType createInstanceType(String className, List<Type> typeArguments) {
    checkArgument(classes.containsKey(className), "Unknown class %s", className);
    InstanceType.TupleForm tupleForm =
        className.equals(InstanceType.TUPLE) && !typeArguments.isEmpty()
            ? InstanceType.TupleForm.FIXED
            : InstanceType.TupleForm.NONE;
    return new InstanceType(className, ImmutableList.copyOf(typeArguments), tupleForm);
  }

  /**
   * Creates a fixed-length tuple type, {@code tuple[T1, T2, ...]}. With no element types this is
   * the empty tuple, {@code tuple[()]}.
   */
  public InstanceType createTupleType(Type... elementTypes) {
    return new InstanceType(
        InstanceType.TUPLE, ImmutableList.copyOf(elementTypes), InstanceType.TupleForm.FIXED);
  }

  /** Creates a tuple of unknown length, {@code tuple[T, ...]}. */
  public InstanceType createHomogeneousTupleType(Type elementType) {
    return new InstanceType(
        InstanceType.TUPLE, ImmutableList.of(elementType), InstanceType.TupleForm.HOMOGENEOUS);
  }

  /**
   * Creates a TypedDict instance type, declaring its class on first use.
   *
   * @param entries the declared entries, in declaration order
   * @param isFinal whether the TypedDict class is decorated with {@code @final}
   */
  public TypedDictType createTypedDictType(
      String className, Map<String, TypedDictType.Entry> entries, boolean isFinal) {
    if (!classes.containsKey(className)) {
      declareClass(className, ImmutableList.of(), TYPED_DICT_BASE);
    }
    return new TypedDictType(className, ImmutableMap.copyOf(entries), isFinal);
  }

  public LiteralType createStringLiteral(String value) {
    return new LiteralType(LiteralKind.STR, checkNotNull(value));
  }

  public LiteralType createIntLiteral(long value) {
    return new LiteralType(LiteralKind.INT, value);
  }

  public LiteralType createBoolLiteral(boolean value) {
    return new LiteralType(LiteralKind.BOOL, value);
  }

  public LiteralType createBytesLiteral(byte[] value) {
    return new LiteralType(LiteralKind.BYTES, ImmutableList.copyOf(Bytes.asList(value)));
  }

  public LiteralType createEnumLiteral(String enumClassName, String memberName) {
    return new LiteralType(LiteralKind.ENUM, new EnumMember(enumClassName, memberName));
  }

  /**
   * Returns the literal type describing a compile-time constant, or empty if the value has no
   * literal type. Java {@code null} stands for {@code None}. Floating point values and arbitrary
   * objects have no literal type.
   */
  public Optional<Type> literalDescriptionOf(@Nullable Object value) {
    if (value == null) {
      return Optional.of(getNativeType(NativeType.NONE_TYPE));
    } else if (value instanceof String) {
      return Optional.of(createStringLiteral((String) value));
    } else if (value instanceof Boolean) {
      return Optional.of(createBoolLiteral((Boolean) value));
    } else if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte) {
      return Optional.of(createIntLiteral(((Number) value).longValue()));
    } else if (value instanceof byte[]) {
      return Optional.of(createBytesLiteral((byte[]) value));
    } else if (value instanceof EnumMember) {
      return Optional.of(new LiteralType(LiteralKind.ENUM, value));
    }
    return Optional.empty();
  }

  /** Creates the union of the given types. See {@link #createUnionType(Iterable)}. */
  public Type createUnionType(Type... types) {
    return createUnionType(Arrays.asList(types));
  }

  /**
   * Creates the union of the given types. Nested unions are flattened, {@code Never} members are
   * dropped and duplicates are removed, keeping the first occurrence. Returns {@code Never} if no
   * member remains and the member itself if exactly one remains.
   */
  public Type createUnionType(Iterable<? extends Type> types) {
    Set<Type> members = new LinkedHashSet<>();
    for (Type type : types) {
      members.addAll(checkNotNull(type).getAlternates());
    }
    if (members.isEmpty()) {
      return NeverType.INSTANCE;
    } else if (members.size() == 1) {
      return members.iterator().next();
    }
    return new UnionType(ImmutableList.copyOf(members));
  }

  public Type union(Type a, Type b) {
    return createUnionType(a, b);
  }

  /** Whether {@code type} is an instance of exactly one of the named classes. */
  public boolean isInstanceOfAny(Type type, Iterable<String> classNames) {
    InstanceType instance = type.toMaybeInstance();
    if (instance == null) {
      return false;
    }
    for (String className : classNames) {
      if (instance.getClassName().equals(className)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether a value of type {@code source} may be used where {@code target} is expected.
   *
   * <p>{@code Never} is assignable to everything and the unknown types are compatible in both
   * directions. A literal is assignable to its own class and that class's superclasses, but a
   * class instance is never assignable to a literal.
   */
  public boolean isAssignable(Type source, Type target) {
    if (source.equals(target) || source.isNever()) {
      return true;
    }
    if (target.isNever()) {
      return false;
    }
    if (source.isUnknown() || target.isUnknown()) {
      return true;
    }
    if (source.isUnion()) {
      for (Type alternate : source.getAlternates()) {
        if (!isAssignable(alternate, target)) {
          return false;
        }
      }
      return true;
    }
    if (target.isUnion()) {
      for (Type alternate : target.getAlternates()) {
        if (isAssignable(source, alternate)) {
          return true;
        }
      }
      return false;
    }
    InstanceType targetInstance = target.toMaybeInstance();
    if (targetInstance == null) {
      // Distinct literals.
      return false;
    }
    LiteralType sourceLiteral = source.toMaybeLiteral();
    if (sourceLiteral != null) {
      return !targetInstance.isSpecialized()
          && isClassAssignable(sourceLiteral.getClassName(), targetInstance.getClassName());
    }
    return isInstanceAssignable(source.toMaybeInstance(), targetInstance);
  }

  private boolean isInstanceAssignable(InstanceType source, InstanceType target) {
    if (!isClassAssignable(source.getClassName(), target.getClassName())) {
      return false;
    }
    if (!target.isSpecialized() || !source.isSpecialized()) {
      return true;
    }
    if (source.isTuple() && target.isTuple()) {
      return isTupleAssignable(source, target);
    }
    List<Type> sourceArguments = source.getTypeArguments();
    if (source.isFixedTuple()) {
      sourceArguments = ImmutableList.of(createUnionType(sourceArguments));
    }
    ClassInfo targetInfo = classes.get(target.getClassName());
    List<Type> targetArguments = target.getTypeArguments();
    int count = Math.min(sourceArguments.size(), targetArguments.size());
    for (int i = 0; i < count; i++) {
      Type sourceArgument = sourceArguments.get(i);
      Type targetArgument = targetArguments.get(i);
      boolean covariant = isAssignable(sourceArgument, targetArgument);
      if (!covariant) {
        return false;
      }
      if (targetInfo.getVariance(i) == Variance.INVARIANT
          && !isAssignable(targetArgument, sourceArgument)) {
        return false;
      }
    }
    return true;
  }

  private boolean isTupleAssignable(InstanceType source, InstanceType target) {
    List<Type> sourceArguments = source.getTypeArguments();
    List<Type> targetArguments = target.getTypeArguments();
    if (target.isHomogeneousTuple()) {
      Type targetElement = targetArguments.get(0);
      for (Type sourceArgument : sourceArguments) {
        if (!isAssignable(sourceArgument, targetElement)) {
          return false;
        }
      }
      return true;
    }
    if (source.isHomogeneousTuple() || sourceArguments.size() != targetArguments.size()) {
      return false;
    }
    for (int i = 0; i < sourceArguments.size(); i++) {
      if (!isAssignable(sourceArguments.get(i), targetArguments.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Whether each type is assignable to the other. */
  public boolean isEquivalent(Type a, Type b) {
    return isAssignable(a, b) && isAssignable(b, a);
  }
}
