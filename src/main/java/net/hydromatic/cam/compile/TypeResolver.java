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
package net.hydromatic.cam.compile;

import static java.util.Objects.requireNonNull;

import net.hydromatic.cam.ast.Ast;
import net.hydromatic.cam.ast.Pos;
import net.hydromatic.cam.type.Binding;
import net.hydromatic.cam.type.NamedType;
import net.hydromatic.cam.type.Type;
import net.hydromatic.cam.type.TypeSystem;
import net.hydromatic.cam.type.TypeUnifier;
import net.hydromatic.cam.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deduces the type of an expression.
 *
 * <p>Inference is syntax-directed. Each node is assigned a type, and
 * constraints between the types of a node and its children are solved by
 * unification as soon as they arise:
 *
 * <ul>
 *   <li>an integer literal has type {@code Int}; a literal with a declared
 *       type has that type;
 *   <li>a variable has the type of its binder;
 *   <li>a lambda {@code (lambda x:T. e)} has type {@code T -> U}, where
 *       {@code U} is the type of {@code e} with {@code x} of type {@code T};
 *       if {@code T} is not declared, it is a fresh type variable;
 *   <li>for an application {@code (f a)}, the type of {@code f} is unified
 *       with {@code A -> R}, where {@code A} is the type of {@code a} and
 *       {@code R} is fresh; the type of the application is {@code R};
 *   <li>both operands of {@code +} and {@code *} are unified with
 *       {@code Int}.
 * </ul>
 *
 * <p>There is no let-polymorphism: each binder has a single type.
 */
public class TypeResolver {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(TypeResolver.class);

  private final TypeSystem typeSystem;
  private final TypeUnifier unifier;

  private TypeResolver(TypeSystem typeSystem, boolean occursCheck) {
    this.typeSystem = requireNonNull(typeSystem);
    this.unifier = new TypeUnifier(typeSystem, occursCheck);
  }

  /** Deduces the type of an expression, with the occurs check. */
  public static Type deduceType(TypeSystem typeSystem, Environment env,
      Ast.Exp exp) {
    return deduceType(typeSystem, env, exp, true);
  }

  /** Deduces the type of an expression.
   *
   * <p>Each binding in the environment that has no type is assigned a fresh
   * type variable. The result has all substitutions applied.
   *
   * @throws UnboundVariableException if a variable is not bound
   * @throws TypeException if the expression is not well-typed */
  public static Type deduceType(TypeSystem typeSystem, Environment env,
      Ast.Exp exp, boolean occursCheck) {
    final TypeResolver typeResolver =
        new TypeResolver(typeSystem, occursCheck);
    TypeEnv typeEnv = TypeEnv.EMPTY;
    for (Binding binding : env.bindings()) {
      final Type type = binding.type != null
          ? binding.type
          : typeSystem.typeVariable();
      typeEnv = typeEnv.bind(binding.name, type);
    }
    final Type type = typeResolver.deduce(typeEnv, exp);
    final Type type2 = typeResolver.unifier.substitute(type);
    LOGGER.debug("deduced type {} for [{}]", type2, exp);
    return type2;
  }

  /** Converts a type annotation into a type. */
  public static Type toType(TypeSystem typeSystem, Ast.Type type) {
    switch (type.op) {
    case NAMED_TYPE:
      return typeSystem.lookup(((Ast.NamedType) type).name);
    case FUNCTION_TYPE:
      final Ast.FunctionType functionType = (Ast.FunctionType) type;
      return typeSystem.fnType(toType(typeSystem, functionType.paramType),
          toType(typeSystem, functionType.resultType));
    default:
      throw new AssertionError("unknown type " + type.op);
    }
  }

  private Type deduce(TypeEnv env, Ast.Exp exp) {
    switch (exp.op) {
    case INT_LITERAL:
    case BOOL_LITERAL:
    case VALUE_LITERAL:
      final Ast.Literal literal = (Ast.Literal) exp;
      if (literal.type != null) {
        return toType(typeSystem, literal.type);
      }
      switch (exp.op) {
      case INT_LITERAL:
        return typeSystem.intType();
      case BOOL_LITERAL:
        return typeSystem.boolType();
      default:
        return typeSystem.typeVariable();
      }

    case ID:
      final Ast.Id id = (Ast.Id) exp;
      final Type type = env.getOpt(id.name);
      if (type == null) {
        throw new UnboundVariableException(id.name, id.pos);
      }
      return type;

    case FN:
      final Ast.Fn fn = (Ast.Fn) exp;
      final Type paramType = fn.paramType != null
          ? toType(typeSystem, fn.paramType)
          : typeSystem.typeVariable();
      final Type bodyType = deduce(env.bind(fn.param, paramType), fn.body);
      return typeSystem.fnType(paramType, bodyType);

    case APPLY:
      final Ast.Apply apply = (Ast.Apply) exp;
      final Type fnType = deduce(env, apply.fn);
      final Type argType = deduce(env, apply.arg);
      final TypeVar resultType = typeSystem.typeVariable();
      try {
        unifier.unify(fnType, typeSystem.fnType(argType, resultType));
      } catch (TypeUnifier.MismatchException e) {
        throw TypeException.ofApply(apply.pos, unifier.substitute(fnType),
            unifier.substitute(argType), e);
      }
      return unifier.substitute(resultType);

    case PLUS:
    case TIMES:
      final Ast.InfixCall infixCall = (Ast.InfixCall) exp;
      final NamedType intType = typeSystem.intType();
      for (Ast.Exp arg : infixCall.args()) {
        final Type type1 = deduce(env, arg);
        try {
          unifier.unify(type1, intType);
        } catch (TypeUnifier.MismatchException e) {
          throw TypeException.ofOperand(arg.pos, infixCall,
              unifier.substitute(type1), intType, e);
        }
      }
      return intType;

    default:
      throw new AssertionError("unknown expression " + exp.op);
    }
  }

  /** Context for type inference: a persistent list of (name, type)
   * pairs. */
  private static class TypeEnv {
    static final TypeEnv EMPTY = new TypeEnv("", null, null);

    final String name;
    final @Nullable Type type;
    final @Nullable TypeEnv parent;

    TypeEnv(String name, @Nullable Type type, @Nullable TypeEnv parent) {
      this.name = name;
      this.type = type;
      this.parent = parent;
    }

    TypeEnv bind(String name, Type type) {
      return new TypeEnv(name, requireNonNull(type), this);
    }

    @Nullable Type getOpt(String name) {
      for (TypeEnv e = this; e.parent != null; e = e.parent) {
        if (e.name.equals(name)) {
          return e.type;
        }
      }
      return null;
    }
  }

  /** Error while deducing type.
   *
   * <p>{@link #expected} and {@link #actual} are the two types that could
   * not be unified. If the error occurred in an application,
   * {@link #fnType} and {@link #argType} are the types of the function and
   * the argument. */
  public static class TypeException extends CompileException {
    public final Type expected;
    public final Type actual;
    public final @Nullable Type fnType;
    public final @Nullable Type argType;

    public TypeException(String message, Pos pos, Type expected, Type actual,
        @Nullable Type fnType, @Nullable Type argType,
        @Nullable Throwable cause) {
      super(message, pos, cause);
      this.expected = requireNonNull(expected);
      this.actual = requireNonNull(actual);
      this.fnType = fnType;
      this.argType = argType;
    }

    static TypeException ofApply(Pos pos, Type fnType, Type argType,
        TypeUnifier.MismatchException e) {
      final TypeUnifier.MismatchException root = root(e);
      return new TypeException("type mismatch: function of type " + fnType
          + " cannot be applied to argument of type " + argType
          + " (" + root.getMessage() + ")",
          pos, root.type1, root.type2, fnType, argType, e);
    }

    static TypeException ofOperand(Pos pos, Ast.InfixCall infixCall,
        Type type, Type expected, TypeUnifier.MismatchException e) {
      return new TypeException("type mismatch: operand of '"
          + infixCall.op.padded.trim() + "' has type " + type
          + " but must have type " + expected,
          pos, expected, type, null, null, e);
    }

    /** Returns the innermost mismatch, the pair of types that are actually
     * incompatible. */
    private static TypeUnifier.MismatchException root(
        TypeUnifier.MismatchException e) {
      while (e.getCause() instanceof TypeUnifier.MismatchException) {
        e = (TypeUnifier.MismatchException) e.getCause();
      }
      return e;
    }
  }
}

// End TypeResolver.java
