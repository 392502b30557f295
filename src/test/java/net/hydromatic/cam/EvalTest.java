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

import static net.hydromatic.cam.Ml.ml;
import static net.hydromatic.cam.Ml.mlE;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cam.compile.Compiles;
import net.hydromatic.cam.compile.Environments;
import net.hydromatic.cam.compile.Tracers;
import net.hydromatic.cam.compile.TypeResolver;
import net.hydromatic.cam.compile.UnboundVariableException;
import net.hydromatic.cam.eval.Closure;
import net.hydromatic.cam.eval.Machine;
import net.hydromatic.cam.eval.MachineException;
import net.hydromatic.cam.eval.Prop;
import net.hydromatic.cam.type.Binding;
import net.hydromatic.cam.type.TypeSystem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests that expressions evaluate to the right values, end to end. */
public class EvalTest {
  private static final TypeSystem TYPE_SYSTEM = new TypeSystem();

  @Test void testLiteral() {
    ml("42").assertEvalIs(42);
    ml("(1 + 2)").assertEvalIs(3);
    ml("((2 + 3) * 4)").assertEvalIs(20);
    ml("(2 + (3 * 4))").assertEvalIs(14);
  }

  @Test void testApply() {
    ml("((lambda x. (x + 1)) 42)").assertEvalIs(43);
    ml("((lambda x. x) 7)").assertEvalIs(7);
    ml("((lambda x. (x * x)) ((lambda y. (y + 1)) 2))").assertEvalIs(9);
  }

  /** The constant combinator returns its first argument; the variant that
   * returns its second argument returns the second. */
  @Test void testCurried() {
    ml("(((lambda x. (lambda y. x)) 1) 2)").assertEvalIs(1);
    ml("(((lambda x. (lambda y. y)) 1) 2)").assertEvalIs(2);
    ml("((lambda x. (lambda y. x)) 1 2)").assertEvalIs(1);
  }

  /** A closure remembers the environment in which it was created, even after
   * the call that created it has returned. */
  @Test void testCapture() {
    ml("(((lambda x. (lambda y. (x + y))) 40) 2)").assertEvalIs(42);
    ml("((lambda x. ((lambda y. (x + y)) 10)) 32)").assertEvalIs(42);
    ml("((lambda f. ((f 1) + (f 2))) (lambda z. (z * 10)))").assertEvalIs(30);
    ml("((lambda x. ((lambda x. (x + 1)) (x * 2))) 5)").assertEvalIs(11);
    ml("((((lambda a. (lambda b. (lambda c. ((a * b) + c)))) 6) 7) 0)")
        .assertEvalIs(42);
  }

  @Test void testHigherOrder() {
    ml("((lambda f. (f (f 3))) (lambda x. (x * x)))").assertEvalIs(81);
    ml("(((lambda f. (lambda x. (f (f x)))) (lambda y. (y + 10))) 1)")
        .assertEvalIs(21);
  }

  @Test void testReturnClosure() {
    ml("((lambda x. (lambda y. (x + y))) 10)")
        .assertEval(instanceOf(Closure.class));

    final Object o =
        Compiles.eval(Environments.empty(),
            "((lambda x. (lambda y. (x + y))) 10)");
    assertThat(o, instanceOf(Closure.class));
    final Closure closure = (Closure) o;
    assertThat(closure.evalEnv.toString(), is("[10]"));
  }

  @Test void testBool() {
    ml("((lambda x:Bool. x) true)")
        .withBinding(Binding.of("true", TYPE_SYSTEM.boolType(), true))
        .assertEvalIs(true);
    ml("(((lambda x. (lambda y. y)) true) false)")
        .withBinding(Binding.of("true", TYPE_SYSTEM.boolType(), true))
        .withBinding(Binding.of("false", TYPE_SYSTEM.boolType(), false))
        .assertEvalIs(false);
  }

  /** A variable bound in the environment but not in the program evaluates to
   * its value, which for a symbol is its own name. */
  @Test void testFreeVariable() {
    ml("((lambda x. x) y)")
        .withBinding(Binding.of("y"))
        .assertEvalIs("y");
    ml("(((lambda x. (lambda y. x)) a) b)")
        .withBinding(Binding.of("a"))
        .withBinding(Binding.of("b"))
        .assertEvalIs("a");
    ml("(n + 1)")
        .withBinding(Binding.of("n", TYPE_SYSTEM.intType(), 9))
        .assertEvalIs(10);
  }

  @Test void testUnbound() {
    mlE("((lambda x. x) $y$)")
        .assertCompileException(UnboundVariableException.class,
            "unbound variable: y");

    // The resolver rejects unbound variables even if type checking is
    // disabled
    mlE("((lambda x. x) $y$)")
        .with(Prop.TYPE_CHECK, false)
        .assertCompileException(UnboundVariableException.class,
            "unbound variable: y");
  }

  @Test void testTypeError() {
    mlE("$((lambda x. (x + 1)) (lambda y. y))$")
        .assertCompileException(TypeResolver.TypeException.class,
            "type mismatch: function of type Int -> Int cannot be applied "
                + "to argument of type 'b -> 'b");
  }

  /** With type checking disabled, ill-typed programs compile, and fail in
   * the machine. */
  @Test void testRuntimeError() {
    ml("(1 2)")
        .with(Prop.TYPE_CHECK, false)
        .assertEvalThrows(MachineException.Kind.NOT_CALLABLE);
    ml("((lambda x. (x + 1)) (lambda y. y))")
        .with(Prop.TYPE_CHECK, false)
        .assertEvalThrows(MachineException.Kind.ARITHMETIC_TYPE);
    ml("(lambda x. (x x))")
        .with(Prop.TYPE_CHECK, false)
        .assertEval(instanceOf(Closure.class));
  }

  @Test void testStepLimit() {
    final String ml = "((lambda x. (x + 1)) 42)";
    ml(ml).with(Prop.STEP_LIMIT, 9).assertEvalIs(43);
    ml(ml).with(Prop.STEP_LIMIT, 8)
        .assertEvalThrows(MachineException.Kind.STEP_LIMIT_EXCEEDED);

    // Self-application does not terminate; the step limit stops it
    ml("((lambda x. (x x)) (lambda x. (x x)))")
        .with(Prop.TYPE_CHECK, false)
        .with(Prop.STEP_LIMIT, 1_000)
        .assertEvalThrows(MachineException.Kind.STEP_LIMIT_EXCEEDED);
  }

  @Test void testSteps() {
    final List<Machine.State> states = new ArrayList<>();
    ml("((lambda x. (x + 1)) 42)")
        .withTracer(Tracers.withOnStep(Tracers.empty(), states::add))
        .assertEvalIs(43);
    assertThat(states.size(), is(9));
    assertThat(states.get(0).pc, is(0));
    assertThat(states.get(0).stack.isEmpty(), is(true));
    assertThat(states.get(2).instruction.toString(), is("APPLY"));
    assertThat(states.get(3).instruction.toString(), is("GRAB"));
    assertThat(states.get(3).dumpDepth, is(1));
    assertThat(states.get(4).env.toString(), is("[42]"));
    assertThat(states.get(8).pc, is(8));
    assertThat(states.get(8).dumpDepth, is(0));
  }

  /** Running the same program twice gives the same result. */
  @Test void testDeterministic() {
    final String ml = "(((lambda x. (lambda y. (x * y))) 6) 7)";
    final Object o1 = Compiles.eval(Environments.empty(), ml);
    final Object o2 = Compiles.eval(Environments.empty(), ml);
    assertThat(o1, is((Object) 42));
    assertThat(o2, is(o1));
  }

  /** The machine does not use the Java stack to evaluate nested
   * expressions. */
  @Test void testDeep() {
    final int n = 2_000;
    final String sum =
        Strings.repeat("(1 + ", n - 1) + "1" + Strings.repeat(")", n - 1);
    ml(sum).assertEvalIs(n);

    final String calls =
        Strings.repeat("((lambda x. x) ", n) + "7" + Strings.repeat(")", n);
    ml(calls).assertEvalIs(7);
  }

  /** The machine computes the same result as reduction by substitution. */
  @ParameterizedTest
  @ValueSource(strings = {
      "42",
      "(1 + 2)",
      "((lambda x. (x + 1)) 42)",
      "(((lambda x. (lambda y. x)) 1) 2)",
      "(((lambda x. (lambda y. (x * y))) 6) 7)",
      "((lambda f. (f (f 3))) (lambda x. (x * x)))",
      "(((lambda f. (lambda x. (f (f x)))) (lambda y. (y + 10))) 1)",
      "((lambda x. ((lambda x. (x + 1)) (x * 2))) 5)",
      "((lambda x. ((lambda y. (x + y)) 10)) 32)",
      "((lambda x. (lambda y. y)) 1 2)",
      "(((lambda x. (lambda y. ((lambda x. (x + y)) (y * x)))) 3) 4)"
  })
  void testMachineAgreesWithReducer(String ml) {
    ml(ml).assertMachineAgreesWithReducer();
  }
}

// End EvalTest.java
