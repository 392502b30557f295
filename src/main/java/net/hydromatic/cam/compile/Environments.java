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

import static java.util.Objects.requireNonNull;

import java.util.function.Consumer;
import net.hydromatic.cam.type.Binding;
import net.hydromatic.cam.type.NamedType;
import net.hydromatic.cam.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Returns the empty environment. */
  public static Environment empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /** Creates an environment with only "true" and "false", both of type
   * {@code Bool}. */
  public static Environment basic(TypeSystem typeSystem) {
    final NamedType bool = typeSystem.lookup(NamedType.BOOL);
    return empty()
        .bind("true", bool, true)
        .bind("false", bool, false);
  }

  /** Creates an environment that is a given environment plus bindings. */
  static Environment bind(Environment env, Iterable<Binding> bindings) {
    for (Binding binding : bindings) {
      env = env.bind(binding);
    }
    return env;
  }

  /**
   * Environment that inherits from a parent environment and adds one binding.
   */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Binding binding;
    private final int size;

    SubEnvironment(Environment parent, Binding binding) {
      this.parent = requireNonNull(parent);
      this.binding = requireNonNull(binding);
      this.size = parent.size() + 1;
    }

    @Override
    public String toString() {
      return binding.name + ", ...";
    }

    @Override
    public @Nullable Binding getOpt(String name) {
      if (name.equals(binding.name)) {
        return binding;
      }
      return parent.getOpt(name);
    }

    @Override
    public int size() {
      return size;
    }

    void visit(Consumer<Binding> consumer) {
      consumer.accept(binding);
      parent.visit(consumer);
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override
    public String toString() {
      return "[]";
    }

    @Override
    public @Nullable Binding getOpt(String name) {
      return null;
    }

    @Override
    public int size() {
      return 0;
    }

    @Override
    void visit(Consumer<Binding> consumer) {
    }
  }
}

// End Environments.java
