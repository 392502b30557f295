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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Categorical abstract machine.
 *
 * <p>The machine state consists of a program counter, an operand stack, an
 * environment ({@link EvalEnv}) and a dump. The dump is a stack of frames,
 * each holding the address and environment to restore when a call returns.
 * All three stacks live on the heap; running a deeply nested program never
 * grows the Java stack.
 *
 * <p>Transitions:
 *
 * <ul>
 *   <li>{@code CONST v}: push v
 *   <li>{@code ACCESS i}: push entry i of the environment
 *   <li>{@code CLOSURE n}: push a closure of the next instruction and the
 *       current environment, then skip the n instructions of its body
 *   <li>{@code GRAB}: pop a value and bind it in the environment
 *   <li>{@code APPLY}: pop a closure, then an argument; push a frame to the
 *       dump; switch to the closure's environment; push the argument, and
 *       jump to the closure's entry
 *   <li>{@code RETURN}: pop the result; if the dump is empty, halt, otherwise
 *       pop a frame, restore its address and environment, and push the result
 *   <li>{@code ADD}, {@code MUL}: pop two integers, push their sum or product
 * </ul>
 *
 * <p>Every {@code APPLY} adds a frame to the dump, even in tail position.
 */
public class Machine {
  private static final Logger LOGGER = LoggerFactory.getLogger(Machine.class);

  private final Program program;
  private final int stepLimit;
  private final @Nullable Consumer<State> stepListener;

  /** Creates a Machine.
   *
   * @param program Program to run
   * @param stepLimit Maximum number of instructions to execute, or -1 if
   *                  there is no limit
   * @param stepListener Called before each instruction is executed, or null
   */
  public Machine(Program program, int stepLimit,
      @Nullable Consumer<State> stepListener) {
    this.program = requireNonNull(program);
    this.stepLimit = stepLimit;
    this.stepListener = stepListener;
  }

  /** Creates a Machine with no step limit and no listener. */
  public Machine(Program program) {
    this(program, -1, null);
  }

  /** Creates a Machine configured by the properties of a session. */
  public static Machine create(Program program, Session session,
      @Nullable Consumer<State> stepListener) {
    final @Nullable Integer stepLimit =
        Prop.STEP_LIMIT.intValueOpt(session.map);
    return new Machine(program, stepLimit == null ? -1 : stepLimit,
        stepListener);
  }

  /** Runs the program in an empty environment. */
  public Object run() {
    return run(EvalEnv.EMPTY);
  }

  /** Runs the program in a given initial environment, and returns the
   * value that it halts with. */
  public Object run(EvalEnv initialEnv) {
    final Deque<Object> stack = new ArrayDeque<>();
    final Deque<Frame> dump = new ArrayDeque<>();
    EvalEnv env = requireNonNull(initialEnv);
    int pc = 0;
    int step = 0;
    final boolean tracing = stepListener != null || LOGGER.isTraceEnabled();
    for (;;) {
      if (pc >= program.size()) {
        // Ran off the end of the program; halt with the top of the stack.
        return halt(stack, pc);
      }
      if (stepLimit >= 0 && step >= stepLimit) {
        throw new MachineException(MachineException.Kind.STEP_LIMIT_EXCEEDED,
            pc, "executed " + step + " instructions");
      }
      final Instruction instruction = program.get(pc);
      if (tracing) {
        final State state =
            new State(step, pc, instruction, stack, env, dump.size());
        LOGGER.trace("{}", state);
        if (stepListener != null) {
          stepListener.accept(state);
        }
      }
      ++step;
      switch (instruction.opcode) {
      case CONST:
        stack.push(requireNonNull(instruction.operand));
        ++pc;
        break;

      case ACCESS:
        final int index = instruction.intOperand();
        if (index >= env.size()) {
          throw new MachineException(MachineException.Kind.VARIABLE_ACCESS,
              pc, "index " + index + ", environment size " + env.size());
        }
        stack.push(env.get(index));
        ++pc;
        break;

      case CLOSURE:
        stack.push(new Closure(pc + 1, env));
        pc += instruction.intOperand() + 1;
        break;

      case GRAB:
        env = env.bind(pop(stack, instruction, pc));
        ++pc;
        break;

      case APPLY:
        final Object fn = pop(stack, instruction, pc);
        final Object arg = pop(stack, instruction, pc);
        if (!(fn instanceof Closure)) {
          throw new MachineException(MachineException.Kind.NOT_CALLABLE, pc,
              "cannot apply " + fn);
        }
        final Closure closure = (Closure) fn;
        dump.push(new Frame(pc + 1, env));
        env = closure.evalEnv;
        stack.push(arg);
        pc = closure.entry;
        break;

      case RETURN:
        final Object result = pop(stack, instruction, pc);
        if (dump.isEmpty()) {
          if (!stack.isEmpty()) {
            throw new MachineException(MachineException.Kind.UNBALANCED_STACK,
                pc, (stack.size() + 1) + " values on stack");
          }
          LOGGER.debug("halted after {} steps", step);
          return result;
        }
        final Frame frame = dump.pop();
        pc = frame.pc;
        env = frame.env;
        stack.push(result);
        break;

      case ADD:
      case MUL:
        final Object right = pop(stack, instruction, pc);
        final Object left = pop(stack, instruction, pc);
        if (!(left instanceof Integer) || !(right instanceof Integer)) {
          throw new MachineException(MachineException.Kind.ARITHMETIC_TYPE,
              pc, "operands " + left + " and " + right);
        }
        final int a = (Integer) left;
        final int b = (Integer) right;
        stack.push(instruction.opcode == Instruction.Opcode.ADD
            ? a + b
            : a * b);
        ++pc;
        break;

      default:
        throw new AssertionError("unknown opcode " + instruction.opcode);
      }
    }
  }

  private static Object halt(Deque<Object> stack, int pc) {
    if (stack.size() != 1) {
      throw new MachineException(
          stack.isEmpty()
              ? MachineException.Kind.STACK_UNDERFLOW
              : MachineException.Kind.UNBALANCED_STACK,
          pc, stack.size() + " values on stack at end of program");
    }
    return stack.pop();
  }

  private static Object pop(Deque<Object> stack, Instruction instruction,
      int pc) {
    final Object o = stack.poll();
    if (o == null) {
      throw new MachineException(MachineException.Kind.STACK_UNDERFLOW, pc,
          "empty stack in " + instruction);
    }
    return o;
  }

  /** Entry in the dump. */
  private static class Frame {
    final int pc;
    final EvalEnv env;

    Frame(int pc, EvalEnv env) {
      this.pc = pc;
      this.env = env;
    }
  }

  /** Snapshot of the state of the machine, taken before an instruction is
   * executed. */
  public static class State {
    public final int step;
    public final int pc;
    public final Instruction instruction;
    /** Contents of the operand stack, top first. */
    public final ImmutableList<Object> stack;
    public final EvalEnv env;
    public final int dumpDepth;

    State(int step, int pc, Instruction instruction, Deque<Object> stack,
        EvalEnv env, int dumpDepth) {
      this.step = step;
      this.pc = pc;
      this.instruction = instruction;
      this.stack = ImmutableList.copyOf(stack);
      this.env = env;
      this.dumpDepth = dumpDepth;
    }

    @Override public String toString() {
      return "step " + step + ": pc=" + pc + " " + instruction
          + " stack=" + stack + " env=" + env + " dump=" + dumpDepth;
    }
  }
}

// End Machine.java
