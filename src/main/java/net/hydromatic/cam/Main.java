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

import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.cam.compile.CompiledStatement;
import net.hydromatic.cam.compile.Compiles;
import net.hydromatic.cam.compile.Environment;
import net.hydromatic.cam.compile.Environments;
import net.hydromatic.cam.compile.Tracers;
import net.hydromatic.cam.eval.Prop;
import net.hydromatic.cam.eval.Session;
import net.hydromatic.cam.type.TypeSystem;
import net.hydromatic.cam.util.CamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Batch runner.
 *
 * <p>Reads one expression per line, and for each prints its value and type,
 * for example "{@code val it = 43 : Int}", or a description of the error.
 * An error does not stop the run; the next line is read as usual. Blank lines
 * and lines that start with "{@code #}" are ignored.
 *
 * <p>Arguments are "{@code --echo}", to print each line before its result,
 * and "{@code --<property>=<value>}" to set a property; for example
 * "{@code --stepLimit=1000}". */
public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private final BufferedReader in;
  private final PrintWriter out;
  private final boolean echo;
  final TypeSystem typeSystem = new TypeSystem();
  final Session session;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final Main main =
        new Main(argList, new InputStreamReader(System.in),
            new OutputStreamWriter(System.out), propMap);
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main.
   *
   * <p>Arguments of the form "{@code --name=value}" set properties in
   * {@code propMap}. */
  public Main(List<String> argList, Reader in, Writer out,
      Map<Prop, Object> propMap) {
    this.in = buffer(in);
    this.out = buffer(out);
    this.echo = argList.contains("--echo");
    for (String arg : argList) {
      final int i = arg.indexOf('=');
      if (arg.startsWith("--") && i > 0) {
        Prop.lookup(arg.substring(2, i))
            .setLenient(propMap, arg.substring(i + 1));
      }
    }
    this.session = new Session(propMap);
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  private static BufferedReader buffer(Reader in) {
    if (in instanceof BufferedReader) {
      return (BufferedReader) in;
    } else {
      return new BufferedReader(in);
    }
  }

  /** Reads and runs every line of the input. */
  public void run() {
    final Environment env = Environments.basic(typeSystem);
    final Consumer<String> outLines = out::println;
    try {
      for (;;) {
        final String line = in.readLine();
        if (line == null) {
          break;
        }
        if (echo) {
          outLines.accept(line);
        }
        if (line.trim().isEmpty() || line.trim().startsWith("#")) {
          continue;
        }
        command(env, line, outLines);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    out.flush();
  }

  /** Compiles and runs one expression, writing its result or error. */
  void command(Environment env, String line, Consumer<String> outLines) {
    try {
      final CompiledStatement compiled =
          Compiles.prepareStatement(typeSystem, session, env, line,
              Tracers.empty());
      compiled.eval(session, outLines);
    } catch (RuntimeException e) {
      if (!(e instanceof CamException)) {
        throw e;
      }
      LOGGER.debug("error in [{}]", line, e);
      final StringBuilder buf = new StringBuilder();
      ((CamException) e).describeTo(buf);
      outLines.accept(buf.toString());
    }
  }
}

// End Main.java
