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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Instruction of the abstract machine.
 *
 * <p>An instruction is an opcode and, for some opcodes, an operand.
 * Instructions are immutable. */
public final class Instruction {
  public static final Instruction GRAB = new Instruction(Opcode.GRAB, null);
  public static final Instruction APPLY = new Instruction(Opcode.APPLY, null);
  public static final Instruction RETURN =
      new Instruction(Opcode.RETURN, null);
  public static final Instruction ADD = new Instruction(Opcode.ADD, null);
  public static final Instruction MUL = new Instruction(Opcode.MUL, null);

  public final Opcode opcode;
  public final @Nullable Object operand;

  private Instruction(Opcode opcode, @Nullable Object operand) {
    this.opcode = requireNonNull(opcode);
    this.operand = operand;
  }

  /** Creates an instruction that pushes the value of the {@code index}th
   * environment entry; 0 is the most recently bound. */
  public static Instruction access(int index) {
    checkArgument(index >= 0, "negative index %s", index);
    return new Instruction(Opcode.ACCESS, index);
  }

  /** Creates an instruction that pushes a constant. */
  public static Instruction constant(Object value) {
    return new Instruction(Opcode.CONST, requireNonNull(value));
  }

  /** Creates an instruction that pushes a closure whose code is the
   * {@code size} instructions that follow, and then skips over them. */
  public static Instruction closure(int size) {
    checkArgument(size >= 0, "negative size %s", size);
    return new Instruction(Opcode.CLOSURE, size);
  }

  /** Returns the operand, which must be an integer (the index of an
   * {@code ACCESS} or the size of a {@code CLOSURE}). */
  public int intOperand() {
    return (Integer) requireNonNull(operand, "operand");
  }

  @Override public int hashCode() {
    return Objects.hash(opcode, operand);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Instruction
        && opcode == ((Instruction) o).opcode
        && Objects.equals(operand, ((Instruction) o).operand);
  }

  @Override public String toString() {
    return operand == null ? opcode.name() : opcode.name() + " " + operand;
  }

  /** Operation code. */
  public enum Opcode {
    /** Pushes the value of an environment entry. */
    ACCESS,
    /** Pushes a constant. */
    CONST,
    /** Pushes a closure that captures the current environment. */
    CLOSURE,
    /** Pops a value and binds it as the innermost environment entry. */
    GRAB,
    /** Pops a closure and an argument, and calls the closure. */
    APPLY,
    /** Returns from a call, or halts if there is no caller. */
    RETURN,
    ADD,
    MUL
  }
}

// End Instruction.java
