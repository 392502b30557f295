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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.cam.ast.AstBuilder.ast;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;
import net.hydromatic.cam.ast.Ast;
import net.hydromatic.cam.ast.Op;
import net.hydromatic.cam.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reduces expressions by substitution, using call-by-value.
 *
 * <p>This is a reference semantics for the abstract machine: for a closed
 * program whose result is an integer, {@link #normalize} and the machine
 * give the same result.
 *
 * <p>Works on named expressions; lexical indices are ignored, and are not
 * valid in the result.
 *
 * <p>Values are literals, lambdas, and free variables. A step is one of:
 *
 * <ul>
 *   <li>{@code ((lambda x. e) v)} &rarr; {@code e[v/x]}, if {@code v} is a
 *       value;
 *   <li>{@code (m + n)} &rarr; the sum, if {@code m} and {@code n} are
 *       integer literals; similarly {@code *};
 *   <li>a step inside the function of an application (or the left operand of
 *       an operator), or, once that is a value, inside the argument (or right
 *       operand).
 * </ul>
 *
 * <p>There are no steps inside the body of a lambda.
 */
public class Reducer {
  private final NameGenerator nameGenerator;

  /** Creates a Reducer. */
  public Reducer(NameGenerator nameGenerator) {
    this.nameGenerator = nameGenerator;
  }

  /** Creates a Reducer with a new name generator. */
  public Reducer() {
    this(new NameGenerator());
  }

  /** Returns whether an expression is a value. */
  public static boolean isValue(Ast.Exp exp) {
    switch (exp.op) {
    case ID:
    case FN:
    case INT_LITERAL:
    case BOOL_LITERAL:
    case VALUE_LITERAL:
      return true;
    default:
      return false;
    }
  }

  /** Performs one step of reduction; returns null if no step applies. */
  public Ast.@Nullable Exp reduce(Ast.Exp exp) {
    switch (exp.op) {
    case APPLY:
      final Ast.Apply apply = (Ast.Apply) exp;
      if (!isValue(apply.fn)) {
        final Ast.Exp fn = reduce(apply.fn);
        return fn == null ? null : apply.copy(fn, apply.arg);
      }
      if (!isValue(apply.arg)) {
        final Ast.Exp arg = reduce(apply.arg);
        return arg == null ? null : apply.copy(apply.fn, arg);
      }
      if (apply.fn instanceof Ast.Fn) {
        final Ast.Fn fn = (Ast.Fn) apply.fn;
        return substitute(fn.body, fn.param, apply.arg);
      }
      // Applying a free variable or a literal; stuck
      return null;

    case PLUS:
    case TIMES:
      final Ast.InfixCall infixCall = (Ast.InfixCall) exp;
      if (!isValue(infixCall.a0)) {
        final Ast.Exp a0 = reduce(infixCall.a0);
        return a0 == null ? null : infixCall.copy(a0, infixCall.a1);
      }
      if (!isValue(infixCall.a1)) {
        final Ast.Exp a1 = reduce(infixCall.a1);
        return a1 == null ? null : infixCall.copy(infixCall.a0, a1);
      }
      if (infixCall.a0.op == Op.INT_LITERAL
          && infixCall.a1.op == Op.INT_LITERAL) {
        final BigDecimal v0 = (BigDecimal) ((Ast.Literal) infixCall.a0).value;
        final BigDecimal v1 = (BigDecimal) ((Ast.Literal) infixCall.a1).value;
        final int v = exp.op == Op.PLUS
            ? v0.intValueExact() + v1.intValueExact()
            : v0.intValueExact() * v1.intValueExact();
        return ast.intLiteral(exp.pos, v);
      }
      return null;

    default:
      return null;
    }
  }

  /** Reduces an expression until no step applies, or until
   * {@code maxSteps} steps have been taken, and returns the last
   * expression. */
  public Ast.Exp normalize(Ast.Exp exp, int maxSteps) {
    checkArgument(maxSteps >= 0, "negative step count %s", maxSteps);
    for (int i = 0; i < maxSteps; i++) {
      final Ast.Exp exp2 = reduce(exp);
      if (exp2 == null) {
        break;
      }
      exp = exp2;
    }
    return exp;
  }

  /** Replaces free occurrences of {@code name} in {@code exp} with
   * {@code value}, renaming bound variables so that free variables of
   * {@code value} are not captured. */
  public Ast.Exp substitute(Ast.Exp exp, String name, Ast.Exp value) {
    switch (exp.op) {
    case ID:
      return ((Ast.Id) exp).name.equals(name) ? value : exp;

    case FN:
      final Ast.Fn fn = (Ast.Fn) exp;
      if (fn.param.equals(name)) {
        return fn; // name is shadowed
      }
      final Set<String> valueVars = freeVariables(value);
      if (valueVars.contains(fn.param)
          && freeVariables(fn.body).contains(name)) {
        // Renaming the parameter avoids capturing the free occurrence of
        // fn.param in value.
        final Set<String> avoid = new HashSet<>(valueVars);
        avoid.addAll(freeVariables(fn.body));
        avoid.add(name);
        final String param2 = nameGenerator.fresh(fn.param, avoid);
        final Ast.Exp body2 =
            substitute(fn.body, fn.param, ast.id(fn.pos, param2));
        return fn.copy(param2, substitute(body2, name, value));
      }
      return fn.copy(fn.param, substitute(fn.body, name, value));

    case APPLY:
      final Ast.Apply apply = (Ast.Apply) exp;
      return apply.copy(substitute(apply.fn, name, value),
          substitute(apply.arg, name, value));

    case PLUS:
    case TIMES:
      final Ast.InfixCall infixCall = (Ast.InfixCall) exp;
      return infixCall.copy(substitute(infixCall.a0, name, value),
          substitute(infixCall.a1, name, value));

    default:
      return exp;
    }
  }

  /** Returns the names of the free variables of an expression. */
  public static Set<String> freeVariables(Ast.Exp exp) {
    final Set<String> names = new HashSet<>();
    exp.accept(
        new Visitor() {
          final Set<String> bound = new HashSet<>();

          @Override protected void visit(Ast.Id id) {
            if (!bound.contains(id.name)) {
              names.add(id.name);
            }
          }

          @Override protected void visit(Ast.Fn fn) {
            final boolean added = bound.add(fn.param);
            fn.body.accept(this);
            if (added) {
              bound.remove(fn.param);
            }
          }
        });
    return names;
  }
}

// End Reducer.java
