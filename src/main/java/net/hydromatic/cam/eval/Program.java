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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Compiled program: an immutable list of instructions. Execution starts at
 * the first instruction. */
public final class Program {
  public final ImmutableList<Instruction> instructions;

  private Program(ImmutableList<Instruction> instructions) {
    this.instructions = instructions;
  }

  /** Creates a program. */
  public static Program of(List<Instruction> instructions) {
    return new Program(ImmutableList.copyOf(instructions));
  }

  /** Creates a program. */
  public static Program of(Instruction... instructions) {
    return new Program(ImmutableList.copyOf(instructions));
  }

  public int size() {
    return instructions.size();
  }

  public Instruction get(int pc) {
    return instructions.get(pc);
  }

  /** Returns a listing of this program, one instruction per line, each
   * preceded by its address; for example, "{@code 0: CONST 42}". */
  public String disassemble() {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < instructions.size(); i++) {
      b.append(i).append(": ").append(instructions.get(i)).append('\n');
    }
    return b.toString();
  }

  @Override public int hashCode() {
    return instructions.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Program
        && instructions.equals(((Program) o).instructions);
  }

  @Override public String toString() {
    return instructions.toString();
  }
}

// End Program.java
