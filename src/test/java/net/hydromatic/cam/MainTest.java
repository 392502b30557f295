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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cam.eval.Prop;
import org.junit.jupiter.api.Test;

/** Tests the batch runner, {@link Main}. */
public class MainTest {
  /** Runs a set of lines through {@link Main}, and returns the output. */
  private static String run(String in, String... args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final StringWriter out = new StringWriter();
    new Main(argList, new StringReader(in), out, propMap).run();
    return out.toString();
  }

  private static String lines(String... lines) {
    final StringBuilder b = new StringBuilder();
    for (String line : lines) {
      b.append(line).append(System.lineSeparator());
    }
    return b.toString();
  }

  @Test void testValues() {
    final String in = "42\n"
        + "((lambda x. (x + 1)) 42)\n"
        + "(lambda x. x)\n"
        + "true\n"
        + "((lambda x:Bool. x) false)\n";
    assertThat(run(in),
        is(
            lines("val it = 42 : Int",
                "val it = 43 : Int",
                "val it = fn : 'a -> 'a",
                "val it = true : Bool",
                "val it = false : Bool")));
  }

  /** The types of successive lines do not depend on each other. */
  @Test void testTypeVariablesRenumbered() {
    final String in = "(lambda x. (lambda y. x))\n"
        + "(lambda f. (lambda x. (f (f x))))\n"
        + "(lambda x. (lambda y. x))\n";
    assertThat(run(in),
        is(
            lines("val it = fn : 'a -> 'b -> 'a",
                "val it = fn : ('a -> 'a) -> 'a -> 'a",
                "val it = fn : 'a -> 'b -> 'a")));
  }

  /** After an error, the runner carries on with the next line. */
  @Test void testErrors() {
    final String in = "y\n"
        + "(1 2)\n"
        + "(x\n"
        + "(lambda x. (x x))\n"
        + "42\n";
    assertThat(run(in),
        is(
            lines("1.1 Error: unbound variable: y",
                "1.1-1.6 Error: type mismatch: function of type Int cannot "
                    + "be applied to argument of type Int "
                    + "(cannot unify Int with Int -> 'a)",
                "1.3 Error: expected ')' but found end of input",
                "1.11-1.16 Error: type mismatch: function of type 'a cannot "
                    + "be applied to argument of type 'a "
                    + "(type variable 'a occurs in 'a -> 'b)",
                "val it = 42 : Int")));
  }

  @Test void testEcho() {
    final String in = "# a comment\n"
        + "\n"
        + "(2 * 21)\n";
    assertThat(run(in, "--echo"),
        is(lines("# a comment", "", "(2 * 21)", "val it = 42 : Int")));
    assertThat(run(in), is(lines("val it = 42 : Int")));
  }

  @Test void testTypeCheckDisabled() {
    final String in = "42\n"
        + "(lambda x. x)\n"
        + "(1 2)\n"
        + "((lambda x. (x + 1)) (lambda y. y))\n";
    assertThat(run(in, "--typeCheck=false"),
        is(
            lines("val it = 42",
                "val it = fn",
                "uncaught exception value is not callable at pc 2: "
                    + "cannot apply 1",
                "uncaught exception arithmetic on non-integer at pc 8: "
                    + "operands Closure(entry = 1, evalEnv = [false, true]) "
                    + "and 1")));
  }

  @Test void testOccursCheckDisabled() {
    assertThat(run("(lambda x. (x x))\n", "--occursCheck=false"),
        is(lines("val it = fn : ('a -> 'b) -> 'b")));
  }

  /** A program whose types are cyclic does not stop the run. */
  @Test void testOccursCheckDisabledCycles() {
    final String in = TypeTest.SELF_APPLIED_PAIR + "\n(1 + 2)\n";
    assertThat(run(in, "--occursCheck=false"),
        is(
            lines("val it = fn : "
                    + "('a -> 'b) -> ('c -> 'b) -> (('c -> 'b) -> 'd) -> 'd",
                "val it = 3 : Int")));
  }

  @Test void testStepLimit() {
    final String in = "((lambda x. (x + 1)) 42)\n";
    assertThat(run(in, "--stepLimit=5"),
        is(
            lines("uncaught exception step limit exceeded at pc 4: "
                + "executed 5 instructions")));
    assertThat(run(in, "--stepLimit=100"), is(lines("val it = 43 : Int")));
  }

  @Test void testBadProperty() {
    final RuntimeException e =
        assertThrows(RuntimeException.class, () -> run("1\n", "--foo=bar"));
    assertThat(e.getMessage(), is("property foo not found"));
    final RuntimeException e2 =
        assertThrows(RuntimeException.class,
            () -> run("1\n", "--stepLimit=many"));
    assertThat(e2.getMessage(),
        is("value for property stepLimit must be an integer"));
  }
}

// End MainTest.java
