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
package net.hydromatic.cam.eval;

import static net.hydromatic.cam.eval.Instruction.access;
import static net.hydromatic.cam.eval.Instruction.closure;
import static net.hydromatic.cam.eval.Instruction.constant;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests {@link Machine} on programs built by hand. */
public class MachineTest {
  private static MachineException assertFails(Program program,
      MachineException.Kind kind) {
    final MachineException e =
        assertThrows(MachineException.class, () -> new Machine(program).run());
    assertThat(e.kind, is(kind));
    return e;
  }

  @Test void testConst() {
    final Program program = Program.of(constant(42), Instruction.RETURN);
    assertThat(new Machine(program).run(), is((Object) 42));
  }

  @Test void testArithmetic() {
    final Program program =
        Program.of(constant(6), constant(3), constant(4), Instruction.ADD,
            Instruction.MUL, Instruction.RETURN);
    assertThat(new Machine(program).run(), is((Object) 42));
  }

  /** Running off the end of the program halts with the value on top of the
   * stack. */
  @Test void testFallOffEnd() {
    assertThat(new Machine(Program.of(constant(5))).run(), is((Object) 5));

    final MachineException e = assertFails(Program.of(),
        MachineException.Kind.STACK_UNDERFLOW);
    assertThat(e.pc, is(0));
    assertFails(Program.of(constant(1), constant(2)),
        MachineException.Kind.UNBALANCED_STACK);
  }

  /** Entry 0 of the initial environment is the last value. */
  @Test void testInitialEnvironment() {
    final EvalEnv env = EvalEnv.of(ImmutableList.of("a", "b", "c"));
    final Program program0 = Program.of(access(0), Instruction.RETURN);
    final Program program2 = Program.of(access(2), Instruction.RETURN);
    assertThat(new Machine(program0).run(env), is((Object) "c"));
    assertThat(new Machine(program2).run(env), is((Object) "a"));
  }

  /** Applies the successor function to 42. */
  @Test void testApply() {
    final Program program =
        Program.of(constant(42),
            closure(5),
            Instruction.GRAB,
            access(0),
            constant(1),
            Instruction.ADD,
            Instruction.RETURN,
            Instruction.APPLY,
            Instruction.RETURN);
    assertThat(new Machine(program).run(), is((Object) 43));
  }

  /** A closure that is the result of the program holds the environment in
   * which it was created. */
  @Test void testClosureResult() {
    final Program program =
        Program.of(constant(10),
            closure(6),
            Instruction.GRAB,
            closure(3),
            Instruction.GRAB,
            access(1),
            Instruction.RETURN,
            Instruction.RETURN,
            Instruction.APPLY,
            Instruction.RETURN);
    final Object result = new Machine(program).run();
    assertThat(result, instanceOf(Closure.class));
    final Closure closure = (Closure) result;
    assertThat(closure.entry, is(4));
    assertThat(closure.evalEnv.size(), is(1));
    assertThat(closure.evalEnv.get(0), is((Object) 10));
  }

  @Test void testVariableAccess() {
    final MachineException e =
        assertFails(Program.of(access(0), Instruction.RETURN),
            MachineException.Kind.VARIABLE_ACCESS);
    assertThat(e.pc, is(0));
    assertThat(e.getMessage(),
        is("variable access out of range at pc 0: "
            + "index 0, environment size 0"));

    final EvalEnv env = EvalEnv.of(ImmutableList.of(1, 2));
    final Program program =
        Program.of(constant(0), Instruction.GRAB, access(3),
            Instruction.RETURN);
    final MachineException e2 =
        assertThrows(MachineException.class,
            () -> new Machine(program).run(env));
    assertThat(e2.kind, is(MachineException.Kind.VARIABLE_ACCESS));
    assertThat(e2.pc, is(2));
  }

  @Test void testStackUnderflow() {
    assertFails(Program.of(Instruction.APPLY),
        MachineException.Kind.STACK_UNDERFLOW);
    assertFails(Program.of(constant(1), Instruction.ADD),
        MachineException.Kind.STACK_UNDERFLOW);
    assertFails(Program.of(Instruction.GRAB),
        MachineException.Kind.STACK_UNDERFLOW);
    final MachineException e =
        assertFails(Program.of(Instruction.RETURN),
            MachineException.Kind.STACK_UNDERFLOW);
    assertThat(e.getMessage(),
        is("stack underflow at pc 0: empty stack in RETURN"));
  }

  @Test void testNotCallable() {
    final MachineException e =
        assertFails(
            Program.of(constant(1), constant(2), Instruction.APPLY,
                Instruction.RETURN),
            MachineException.Kind.NOT_CALLABLE);
    assertThat(e.getMessage(),
        is("value is not callable at pc 2: cannot apply 2"));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is("uncaught exception value is not callable at pc 2: "
            + "cannot apply 2"));
  }

  @Test void testArithmeticType() {
    assertFails(
        Program.of(constant(true), constant(1), Instruction.ADD,
            Instruction.RETURN),
        MachineException.Kind.ARITHMETIC_TYPE);
    assertFails(
        Program.of(closure(0), constant(1), Instruction.MUL,
            Instruction.RETURN),
        MachineException.Kind.ARITHMETIC_TYPE);
  }

  /** RETURN with an empty dump halts; the stack must then be empty. */
  @Test void testUnbalancedStack() {
    final MachineException e =
        assertFails(
            Program.of(constant(1), constant(2), Instruction.RETURN),
            MachineException.Kind.UNBALANCED_STACK);
    assertThat(e.pc, is(2));
  }

  @Test void testStepLimit() {
    final Program program =
        Program.of(constant(1), constant(2), Instruction.ADD,
            Instruction.RETURN);
    assertThat(new Machine(program, 4, null).run(), is((Object) 3));
    final MachineException e =
        assertThrows(MachineException.class,
            () -> new Machine(program, 3, null).run());
    assertThat(e.kind, is(MachineException.Kind.STEP_LIMIT_EXCEEDED));
    assertThat(e.pc, is(3));
  }

  @Test void testStepLimitFromSession() {
    final Program program =
        Program.of(constant(1), constant(2), Instruction.ADD,
            Instruction.RETURN);
    final Session session =
        new Session(ImmutableMap.<Prop, Object>of(Prop.STEP_LIMIT, 2));
    final Machine machine = Machine.create(program, session, null);
    final MachineException e =
        assertThrows(MachineException.class, machine::run);
    assertThat(e.kind, is(MachineException.Kind.STEP_LIMIT_EXCEEDED));
  }

  @Test void testListener() {
    final List<String> list = new ArrayList<>();
    final Program program =
        Program.of(constant(1), constant(2), Instruction.ADD,
            Instruction.RETURN);
    new Machine(program, -1, state -> list.add(state.toString())).run();
    assertThat(list,
        contains("step 0: pc=0 CONST 1 stack=[] env=[] dump=0",
            "step 1: pc=1 CONST 2 stack=[1] env=[] dump=0",
            "step 2: pc=2 ADD stack=[2, 1] env=[] dump=0",
            "step 3: pc=3 RETURN stack=[3] env=[] dump=0"));
  }

  /** The operand stack and the dump are not limited by the Java stack. */
  @Test void testDeepStack() {
    final int n = 100_000;
    final List<Instruction> instructions = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      instructions.add(constant(1));
    }
    for (int i = 1; i < n; i++) {
      instructions.add(Instruction.ADD);
    }
    instructions.add(Instruction.RETURN);
    assertThat(new Machine(Program.of(instructions)).run(), is((Object) n));
  }

  @Test void testDisassemble() {
    final Program program =
        Program.of(constant(42), closure(2), Instruction.GRAB, access(0),
            Instruction.RETURN);
    assertThat(program.disassemble(),
        is("0: CONST 42\n"
            + "1: CLOSURE 2\n"
            + "2: GRAB\n"
            + "3: ACCESS 0\n"
            + "4: RETURN\n"));
    assertThat(program.toString(),
        is("[CONST 42, CLOSURE 2, GRAB, ACCESS 0, RETURN]"));
  }

  @Test void testEvalEnv() {
    final EvalEnv env = EvalEnv.EMPTY.bind("x").bind("y");
    assertThat(env.size(), is(2));
    assertThat(env.get(0), is((Object) "y"));
    assertThat(env.get(1), is((Object) "x"));
    assertThat(env.toString(), is("[y, x]"));
    assertThat(EvalEnv.EMPTY.size(), is(0));
    assertThat(EvalEnv.of(ImmutableList.of("x", "y")).toString(),
        is(env.toString()));
    assertThrows(IndexOutOfBoundsException.class, () -> env.get(2));
  }
}

// End MachineTest.java
