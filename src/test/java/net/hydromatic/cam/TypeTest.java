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
package net.hydromatic.cam;

import static net.hydromatic.cam.Matchers.throwsA;
import static net.hydromatic.cam.Ml.ml;
import static net.hydromatic.cam.Ml.mlE;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.cam.ast.Ast;
import net.hydromatic.cam.ast.Pos;
import net.hydromatic.cam.compile.Environment;
import net.hydromatic.cam.compile.Environments;
import net.hydromatic.cam.compile.TypeResolver;
import net.hydromatic.cam.compile.UnboundVariableException;
import net.hydromatic.cam.eval.Prop;
import net.hydromatic.cam.parse.CamParser;
import net.hydromatic.cam.type.Binding;
import net.hydromatic.cam.type.Type;
import net.hydromatic.cam.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests type inference. */
public class TypeTest {
  /** Applies {@code x} and {@code y} to themselves, then passes both to
   * {@code k}, which forces their types to unify. */
  static final String SELF_APPLIED_PAIR = "(lambda x. (lambda y. (lambda k. "
      + "((((lambda a. (lambda b. (lambda c. c))) (x x)) (y y)) "
      + "((lambda e. (k y)) (k x))))))";

  private static final TypeSystem TYPE_SYSTEM = new TypeSystem();

  private static Ml mlBool(String ml) {
    return ml(ml)
        .withBinding(Binding.of("true", TYPE_SYSTEM.boolType(), true))
        .withBinding(Binding.of("false", TYPE_SYSTEM.boolType(), false));
  }

  @Test void testLiteral() {
    ml("42").assertType("Int");
    ml("(1 + 2)").assertType("Int");
    ml("(3 * (1 + 2))").assertType("Int");
    mlBool("true").assertType("Bool");
  }

  @Test void testLambda() {
    ml("(lambda x. x)").assertType("'a -> 'a");
    ml("(lambda x. (x + 1))").assertType("Int -> Int");
    ml("(lambda x. (lambda y. x))").assertType("'a -> 'b -> 'a");
    ml("(lambda x. (lambda y. y))").assertType("'a -> 'b -> 'b");
    ml("(lambda x:Int. x)").assertType("Int -> Int");
    ml("(lambda f:Int -> Bool. f)").assertType("(Int -> Bool) -> Int -> Bool");
  }

  @Test void testApply() {
    ml("((lambda x. (x + 1)) 42)").assertType("Int");
    ml("((lambda x. x) 42)").assertType("Int");
    ml("(((lambda x. (lambda y. x)) 1) 2)").assertType("Int");
    ml("((lambda x. (lambda y. (x + y))) 10)").assertType("Int -> Int");
    ml("(lambda f. (lambda x. (f (f x))))")
        .assertType("('a -> 'a) -> 'a -> 'a");
    ml("(lambda f. (lambda g. (lambda x. (f (g x)))))")
        .assertType("('a -> 'b) -> ('c -> 'a) -> 'c -> 'b");
  }

  /** The argument of an annotated lambda must have the declared type. */
  @Test void testBool() {
    mlBool("((lambda x:Bool. x) true)").assertType("Bool");
    mlBool("((lambda x. x) false)").assertType("Bool");
    mlBool("(lambda x:Bool. x)").assertType("Bool -> Bool");
    mlE("$((lambda x:Bool. x) 0)$")
        .assertTypeThrows("type mismatch: function of type Bool -> Bool "
            + "cannot be applied to argument of type Int "
            + "(cannot unify Bool with Int)");
  }

  @Test void testTypeExceptionDetails() {
    final Ast.Exp exp = CamParser.parse("((lambda x:Bool. x) 0)");
    final TypeSystem typeSystem = new TypeSystem();
    final TypeResolver.TypeException e =
        assertThrows(TypeResolver.TypeException.class, () ->
            TypeResolver.deduceType(typeSystem, Environments.empty(), exp));
    assertThat(e.expected, is(typeSystem.boolType()));
    assertThat(e.actual, is(typeSystem.intType()));
    assertThat(String.valueOf(e.fnType), is("Bool -> Bool"));
    assertThat(String.valueOf(e.argType), is("Int"));
  }

  @Test void testApplyNonFunction() {
    mlE("$(1 2)$")
        .assertTypeThrows("type mismatch: function of type Int cannot be "
            + "applied to argument of type Int "
            + "(cannot unify Int with Int -> 'a)");
  }

  @Test void testOperand() {
    mlE("(lambda x:Bool. ($x$ + 1))")
        .assertTypeThrows("type mismatch: operand of '+' has type Bool "
            + "but must have type Int");
    mlE("(lambda f:Int -> Int. (2 * $f$))")
        .assertTypeThrows("type mismatch: operand of '*' has type "
            + "Int -> Int but must have type Int");
  }

  @Test void testOperandException() {
    final Ast.Exp exp = CamParser.parse("(lambda x:Bool. (x + 1))");
    final TypeResolver.TypeException e =
        assertThrows(TypeResolver.TypeException.class, () ->
            TypeResolver.deduceType(new TypeSystem(), Environments.empty(),
                exp));
    assertThat(e.fnType, nullValue());
    assertThat(e.argType, nullValue());
  }

  @Test void testUnbound() {
    ml("y")
        .assertTypeThrows(
            throwsA(UnboundVariableException.class, is("unbound variable: y")));
    mlE("(lambda x. ($y$ + x))")
        .assertTypeThrows(
            throwsA(UnboundVariableException.class, "unbound variable: y",
                new Pos("", 1, 13, 1, 14)));
  }

  /** Variables in the environment that have no declared type get a fresh
   * type variable each. */
  @Test void testUntypedEnvironment() {
    ml("((lambda x. x) y)")
        .withBinding(Binding.of("y"))
        .assertType("'a");
    ml("(f y)")
        .withBinding(Binding.of("f"))
        .withBinding(Binding.of("y"))
        .assertType("'a");
    ml("(y + 1)")
        .withBinding(Binding.of("y"))
        .assertType("Int");
  }

  @Test void testShadowedType() {
    mlBool("((lambda true. (true + 1)) 2)").assertType("Int");
  }

  /** Self-application cannot be typed: the type of {@code x} would have to
   * contain itself. */
  @Test void testOccursCheck() {
    mlE("(lambda x. $(x x)$)")
        .assertTypeThrows("type mismatch: function of type 'a cannot be "
            + "applied to argument of type 'a "
            + "(type variable 'a occurs in 'a -> 'b)");
    ml("((lambda x. (x x)) (lambda x. (x x)))")
        .assertTypeThrows(
            throwsA(TypeResolver.TypeException.class,
                containsString("occurs")));
  }

  /** With the occurs check disabled, self-application is given a cyclic
   * type, which is printed without expanding the cycle. */
  @Test void testOccursCheckDisabled() {
    ml("(lambda x. (x x))")
        .with(Prop.OCCURS_CHECK, false)
        .assertType("('a -> 'b) -> 'b");
  }

  /** With the occurs check disabled, two variables that each have a cyclic
   * type can be unified with each other. */
  @Test void testOccursCheckDisabledUnifyCycles() {
    ml(SELF_APPLIED_PAIR)
        .with(Prop.OCCURS_CHECK, false)
        .assertType("('a -> 'b) -> ('c -> 'b) -> (('c -> 'b) -> 'd) -> 'd");
    ml(SELF_APPLIED_PAIR)
        .assertTypeThrows(
            throwsA(TypeResolver.TypeException.class,
                containsString("occurs")));
  }

  /** Deducing the type of the same expression twice gives the same type
   * if the type system is reset in between. */
  @Test void testDeterministic() {
    final Ast.Exp exp = CamParser.parse("(lambda x. (lambda y. x))");
    final TypeSystem typeSystem = new TypeSystem();
    final Environment env = Environments.empty();
    final Type type1 = TypeResolver.deduceType(typeSystem, env, exp);
    final Type type2 = TypeResolver.deduceType(typeSystem, env, exp);
    assertThat(type2, not(is(type1)));
    assertThat(typeSystem.unqualified(type2),
        is(typeSystem.unqualified(type1)));

    typeSystem.reset();
    final Type type3 = TypeResolver.deduceType(typeSystem, env, exp);
    assertThat(type3, is(type1));
    assertThat(type3.toString(), is("'a -> 'b -> 'a"));
  }
}

// End TypeTest.java
