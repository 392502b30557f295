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

import java.util.function.Consumer;
import net.hydromatic.cam.ast.Ast;
import net.hydromatic.cam.eval.Machine;
import net.hydromatic.cam.eval.Program;
import net.hydromatic.cam.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the parsed
   * expression, then calls the underlying tracer. */
  public static Tracer withOnParse(Tracer tracer, Consumer<Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onParse(Ast.Exp exp) {
        consumer.accept(exp);
        super.onParse(exp);
      }
    };
  }

  /** Returns a tracer that performs the given action on the deduced type,
   * then calls the underlying tracer. */
  public static Tracer withOnType(Tracer tracer, Consumer<Type> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onType(Type type) {
        consumer.accept(type);
        super.onType(type);
      }
    };
  }

  /** Returns a tracer that performs the given action on the resolved
   * expression, then calls the underlying tracer. */
  public static Tracer withOnResolved(Tracer tracer,
      Consumer<Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResolved(Ast.Exp exp) {
        consumer.accept(exp);
        super.onResolved(exp);
      }
    };
  }

  /** Returns a tracer that performs the given action on a program,
   * then calls the underlying tracer. */
  public static Tracer withOnPlan(Tracer tracer, Consumer<Program> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPlan(Program program) {
        consumer.accept(program);
        super.onPlan(program);
      }
    };
  }

  /** Returns a tracer that performs the given action before each step of
   * the machine, then calls the underlying tracer. */
  public static Tracer withOnStep(Tracer tracer,
      Consumer<Machine.State> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onStep(Machine.State state) {
        consumer.accept(state);
        super.onStep(state);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of an
   * evaluation, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer, Consumer<Object> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(Object o) {
        consumer.accept(o);
        super.onResult(o);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<@Nullable Throwable> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean onException(@Nullable Throwable e) {
        consumer.accept(e);
        super.onException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onParse(Ast.Exp exp) {
    }

    @Override public void onType(Type type) {
    }

    @Override public void onResolved(Ast.Exp exp) {
    }

    @Override public void onPlan(Program program) {
    }

    @Override public void onStep(Machine.State state) {
    }

    @Override public void onResult(Object o) {
    }

    @Override public boolean onException(@Nullable Throwable e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onParse(Ast.Exp exp) {
      tracer.onParse(exp);
    }

    @Override public void onType(Type type) {
      tracer.onType(type);
    }

    @Override public void onResolved(Ast.Exp exp) {
      tracer.onResolved(exp);
    }

    @Override public void onPlan(Program program) {
      tracer.onPlan(program);
    }

    @Override public void onStep(Machine.State state) {
      tracer.onStep(state);
    }

    @Override public void onResult(Object o) {
      tracer.onResult(o);
    }

    @Override public boolean onException(@Nullable Throwable e) {
      return tracer.onException(e);
    }
  }
}

// End Tracers.java
