/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cam.type;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.cam.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Unifies types, accumulating a substitution from type variables to types.
 *
 * <p>The substitution is built incrementally: each successful call to
 * {@link #unify(Type, Type)} may add entries, and no entry is ever replaced.
 * Entries may refer to other type variables, so a type must be read via
 * {@link #resolve(Type)} or {@link #substitute(Type)}.
 */
public class TypeUnifier {
  private final TypeSystem typeSystem;
  private final boolean occursCheck;
  private final Map<Integer, Type> variables = new HashMap<>();

  /** Creates a TypeUnifier. */
  public TypeUnifier(TypeSystem typeSystem, boolean occursCheck) {
    this.typeSystem = requireNonNull(typeSystem);
    this.occursCheck = occursCheck;
  }

  /** Unifies two types, returning the substitution, or null if they cannot
   * be unified. */
  public static @Nullable Map<Integer, Type> tryUnify(TypeSystem typeSystem,
      Type type1, Type type2) {
    final TypeUnifier unifier = new TypeUnifier(typeSystem, true);
    try {
      unifier.unify(type1, type2);
      return unifier.substitution();
    } catch (MismatchException e) {
      return null;
    }
  }

  /** Returns a copy of the current substitution. */
  public Map<Integer, Type> substitution() {
    return ImmutableMap.copyOf(variables);
  }

  /** Follows the substitution from a type variable until it reaches a type
   * that is not a bound type variable. Component types are not
   * substituted. */
  public Type resolve(Type type) {
    while (type instanceof TypeVar) {
      final Type type2 = variables.get(((TypeVar) type).ordinal);
      if (type2 == null) {
        break;
      }
      type = type2;
    }
    return type;
  }

  /** Applies the substitution to a type and all of its components. */
  public Type substitute(Type type) {
    return substitute(type, new HashSet<>());
  }

  private Type substitute(Type type, Set<Integer> active) {
    final Type type2 = resolve(type);
    switch (type2.op()) {
      case FUNCTION_TYPE:
        final FnType fnType = (FnType) type2;
        // The type variables being expanded; if the occurs check is disabled,
        // a type may contain itself, and we stop at the first repeat.
        final Set<Integer> active2 = new HashSet<>(active);
        if (type instanceof TypeVar) {
          active2.add(((TypeVar) type).ordinal);
        }
        return fnType.copy(typeSystem, t ->
            t instanceof TypeVar && active2.contains(((TypeVar) t).ordinal)
                ? t
                : substitute(t, active2));
      default:
        return type2;
    }
  }

  /** Unifies two types, extending the substitution; throws
   * {@link MismatchException} if they cannot be unified.
   *
   * <p>If the occurs check is disabled, the substitution may be cyclic, and
   * a pair of function types may be reached again while its components are
   * being unified. Such a pair is assumed to unify. */
  public void unify(Type type1, Type type2) {
    unify(type1, type2, new HashSet<>());
  }

  private void unify(Type type1, Type type2,
      Set<Pair<Type, Type>> active) {
    type1 = resolve(type1);
    type2 = resolve(type2);
    if (type1.equals(type2)) {
      return;
    }
    if (type2 instanceof TypeVar && !(type1 instanceof TypeVar)) {
      unify(type2, type1, active);
      return;
    }
    switch (type1.op()) {
      case TY_VAR:
        final TypeVar var1 = (TypeVar) type1;
        if (occursCheck && substitute(type2).contains(var1)) {
          throw new MismatchException(substitute(var1), substitute(type2),
              "type variable " + var1 + " occurs in "
                  + substitute(type2));
        }
        variables.put(var1.ordinal, type2);
        return;

      case FUNCTION_TYPE:
        if (type2 instanceof FnType) {
          if (!active.add(Pair.of(type1, type2))) {
            return;
          }
          final FnType fnType1 = (FnType) type1;
          final FnType fnType2 = (FnType) type2;
          try {
            unify(fnType1.paramType, fnType2.paramType, active);
            unify(fnType1.resultType, fnType2.resultType, active);
            return;
          } catch (MismatchException e) {
            throw new MismatchException(substitute(type1), substitute(type2),
                e);
          }
        }
        break;

      default:
        // Two different named types, or a named type and a function type
        break;
    }
    throw new MismatchException(substitute(type1), substitute(type2));
  }

  /** Thrown when two types cannot be unified. */
  public static class MismatchException extends RuntimeException {
    public final Type type1;
    public final Type type2;

    MismatchException(Type type1, Type type2) {
      this(type1, type2, "cannot unify " + type1 + " with " + type2);
    }

    MismatchException(Type type1, Type type2, String message) {
      super(message);
      this.type1 = type1;
      this.type2 = type2;
    }

    MismatchException(Type type1, Type type2, MismatchException cause) {
      super("cannot unify " + type1 + " with " + type2 + ": "
          + cause.getMessage(), cause);
      this.type1 = type1;
      this.type2 = type2;
    }
  }
}

// End TypeUnifier.java
