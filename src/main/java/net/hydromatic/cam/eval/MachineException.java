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

import net.hydromatic.cam.ast.Pos;
import net.hydromatic.cam.util.CamException;

/** Error that occurs while the abstract machine is running a program. */
public class MachineException extends RuntimeException
    implements CamException {
  public final Kind kind;
  /** Address of the instruction that failed, or the size of the program if
   * execution ran off its end. */
  public final int pc;

  /** Creates a MachineException. */
  public MachineException(Kind kind, int pc, String detail) {
    super(kind.description + " at pc " + pc + ": " + detail);
    this.kind = requireNonNull(kind);
    this.pc = pc;
  }

  @Override public String toString() {
    return kind + " at pc " + pc;
  }

  /** Returns {@link Pos#ZERO}; machine errors are located by {@link #pc},
   * not by a position in source text. */
  @Override public Pos pos() {
    return Pos.ZERO;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("uncaught exception ").append(getMessage());
  }

  /** Kinds of machine error. */
  public enum Kind {
    /** {@code ACCESS} index is not less than the size of the environment. */
    VARIABLE_ACCESS("variable access out of range"),
    /** An instruction needs more operands than are on the stack. */
    STACK_UNDERFLOW("stack underflow"),
    /** {@code APPLY} found a value that is not a closure. */
    NOT_CALLABLE("value is not callable"),
    /** {@code ADD} or {@code MUL} found an operand that is not an
     * integer. */
    ARITHMETIC_TYPE("arithmetic on non-integer"),
    STEP_LIMIT_EXCEEDED("step limit exceeded"),
    /** The program halted with other than one value on the stack. */
    UNBALANCED_STACK("unbalanced stack at halt");

    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }
}

// End MachineException.java
