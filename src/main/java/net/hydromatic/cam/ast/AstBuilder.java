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
package net.hydromatic.cam.ast;

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigDecimal;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates an unresolved identifier. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name, Ast.Id.UNRESOLVED);
  }

  /** Creates an identifier with a given lexical index. */
  public Ast.Id id(Pos pos, String name, int index) {
    return new Ast.Id(pos, name, index);
  }

  /** Creates an {@code int} literal. */
  public Ast.Literal intLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value, null);
  }

  /** Creates an {@code int} literal. */
  public Ast.Literal intLiteral(Pos pos, int value) {
    return intLiteral(pos, BigDecimal.valueOf(value));
  }

  /** Creates a {@code boolean} literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean b) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, b, null);
  }

  /** Creates a literal of an arbitrary value with a declared type.
   *
   * <p>For example, {@code constant(pos, "red", namedType(pos, "Color"))}. */
  @SuppressWarnings("rawtypes")
  public Ast.Literal constant(Pos pos, Comparable value, Ast.Type type) {
    return new Ast.Literal(pos, Op.VALUE_LITERAL, value, type);
  }

  /** Creates a lambda. */
  public Ast.Fn fn(Pos pos, String param, Ast.@Nullable Type paramType,
      Ast.Exp body) {
    return new Ast.Fn(pos, param, paramType, body);
  }

  /** Creates an application, whose position spans the function and the
   * argument. */
  public Ast.Apply apply(Ast.Exp fn, Ast.Exp arg) {
    return new Ast.Apply(fn.pos.plus(arg.pos), fn, arg);
  }

  /** Creates an application with a given position. */
  public Ast.Apply apply(Pos pos, Ast.Exp fn, Ast.Exp arg) {
    return new Ast.Apply(pos, fn, arg);
  }

  /** Creates a call to an infix operator. */
  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  /** Creates a call to an infix operator, whose position spans the two
   * operands. */
  private Ast.InfixCall infix(Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(a0.pos.plus(a1.pos), op, a0, a1);
  }

  public Ast.InfixCall plus(Ast.Exp a0, Ast.Exp a1) {
    return infix(Op.PLUS, a0, a1);
  }

  public Ast.InfixCall times(Ast.Exp a0, Ast.Exp a1) {
    return infix(Op.TIMES, a0, a1);
  }

  public Ast.NamedType namedType(Pos pos, String name) {
    checkArgument(!name.isEmpty(), "empty type name");
    return new Ast.NamedType(pos, name);
  }

  public Ast.FunctionType functionType(Pos pos, Ast.Type paramType,
      Ast.Type resultType) {
    return new Ast.FunctionType(pos, paramType, resultType);
  }
}

// End AstBuilder.java
