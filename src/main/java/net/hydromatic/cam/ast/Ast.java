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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.cam.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.ObjIntConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class for a type annotation.
   *
   * <p>For example, "Bool" in "{@code (lambda x:Bool. x)}" is a
   * {@link NamedType}. */
  public abstract static class Type extends AstNode {
    Type(Pos pos, Op op) {
      super(pos, op);
    }

    @Override public abstract Type accept(Shuttle shuttle);
  }

  /** Parse tree node of a type constant, such as "{@code Int}". */
  public static class NamedType extends Type {
    public final String name;

    NamedType(Pos pos, String name) {
      super(pos, Op.NAMED_TYPE);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof NamedType
          && this.name.equals(((NamedType) o).name);
    }

    public Type accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Parse tree node of a function type, such as "{@code Int -> Bool}". */
  public static class FunctionType extends Type {
    public final Type paramType;
    public final Type resultType;

    FunctionType(Pos pos, Type paramType, Type resultType) {
      super(pos, Op.FUNCTION_TYPE);
      this.paramType = requireNonNull(paramType);
      this.resultType = requireNonNull(resultType);
    }

    @Override public int hashCode() {
      return paramType.hashCode() * 31 + resultType.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionType
          && this.paramType.equals(((FunctionType) o).paramType)
          && this.resultType.equals(((FunctionType) o).resultType);
    }

    public Type accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.type(left, paramType, op, resultType, right);
    }
  }

  /** Base class of expression ("term") nodes. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    public void forEachArg(ObjIntConsumer<Exp> action) {
      // no args
    }

    @Override public abstract Exp accept(Shuttle shuttle);

    /** Returns a list of all arguments. */
    public final List<Exp> args() {
      final ImmutableList.Builder<Exp> args = ImmutableList.builder();
      forEachArg((exp, value) -> args.add(exp));
      return args.build();
    }
  }

  /** Parse tree node of an identifier (variable).
   *
   * <p>After resolution, {@link #index} is the number of binders between this
   * occurrence and the binder that defines it; 0 means the nearest enclosing
   * binder. Before resolution, the index is {@link #UNRESOLVED}. */
  public static class Id extends Exp {
    /** Value of {@link #index} for an identifier that has not been resolved. */
    public static final int UNRESOLVED = -1;

    public final String name;
    public final int index;

    /** Creates an Id. */
    Id(Pos pos, String name, int index) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
      this.index = index;
      checkArgument(index >= UNRESOLVED, "invalid index %s", index);
    }

    /** Returns whether this identifier has been assigned a lexical index. */
    public boolean isResolved() {
      return index != UNRESOLVED;
    }

    public Id accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name, index);
    }

    /** Creates a copy of this {@code Id} with a given index,
     * or {@code this} if the index is the same. */
    public Id copy(int index) {
      return this.index == index
          ? this
          : new Id(pos, name, index);
    }
  }

  /** Parse tree node of a literal (constant).
   *
   * <p>Integer literals have a {@link java.math.BigDecimal} value and no
   * declared type. A literal built by {@link AstBuilder#constant} may hold
   * any value, and declares its type. */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;
    public final @Nullable Type type;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, Comparable value, @Nullable Type type) {
      super(pos, op);
      this.value = requireNonNull(value);
      this.type = type;
      checkArgument(op == Op.INT_LITERAL
          || op == Op.BOOL_LITERAL
          || op == Op.VALUE_LITERAL);
    }

    @Override public int hashCode() {
      return Objects.hash(op, value, type);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && this.op == ((Literal) o).op
          && this.value.equals(((Literal) o).value)
          && Objects.equals(this.type, ((Literal) o).type);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }
  }

  /** Lambda expression.
   *
   * <p>For example, "{@code (lambda x:Int. (x + 1))}" has parameter "x",
   * parameter type "Int" and body "{@code (x + 1)}". */
  public static class Fn extends Exp {
    public final String param;
    public final @Nullable Type paramType;
    public final Exp body;

    Fn(Pos pos, String param, @Nullable Type paramType, Exp body) {
      super(pos, Op.FN);
      this.param = requireNonNull(param);
      this.paramType = paramType;
      this.body = requireNonNull(body);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(body, 0);
    }

    public Fn accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("(lambda ").append(param);
      if (paramType != null) {
        w.append(":").append(paramType, 0, 0);
      }
      return w.append(op.padded).append(body, 0, 0).append(")");
    }

    /** Creates a copy of this {@code Fn} with given contents,
     * or {@code this} if the contents are the same. */
    public Fn copy(String param, Exp body) {
      return this.param.equals(param)
          && this.body.equals(body)
          ? this
          : ast.fn(pos, param, paramType, body);
    }
  }

  /** Application of a function to an argument, such as "{@code (f x)}". */
  public static class Apply extends Exp {
    public final Exp fn;
    public final Exp arg;

    Apply(Pos pos, Exp fn, Exp arg) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(fn, 0);
      action.accept(arg, 1);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(fn, op, arg);
    }

    public Apply copy(Exp fn, Exp arg) {
      return this.fn.equals(fn) && this.arg.equals(arg) ? this
          : new Apply(pos, fn, arg);
    }
  }

  /** Call to an infix arithmetic operator, such as "{@code (x + 1)}". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isArithmetic(), "not an infix operator: %s", op);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a0, 0);
      action.accept(a1, 1);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(a0, op, a1);
    }

    /** Creates a copy of this {@code InfixCall} with given contents,
     * or {@code this} if the contents are the same. */
    public InfixCall copy(Exp a0, Exp a1) {
      return this.a0.equals(a0)
          && this.a1.equals(a1)
          ? this
          : new InfixCall(pos, op, a0, a1);
    }
  }
}

// End Ast.java
