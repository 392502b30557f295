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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.cam.ast.AstNode;
import net.hydromatic.cam.ast.AstWriter;
import net.hydromatic.cam.ast.Pos;
import net.hydromatic.cam.type.Type;
import net.hydromatic.cam.util.CamException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an AST node by its string representation. */
  static <T extends AstNode> Matcher<T> isAst(Class<? extends T> clazz,
      String expected) {
    return new CustomTypeSafeMatcher<T>("ast with value " + expected) {
      @Override protected boolean matchesSafely(T t) {
        assertThat(clazz.isInstance(t), is(true));
        final String s = t.toString();
        return s.equals(expected);
      }
    };
  }

  /** Matches an AST node by its string representation, including the
   * lexical index of each variable. */
  static <T extends AstNode> Matcher<T> isResolvedAst(String expected) {
    return new CustomTypeSafeMatcher<T>("resolved ast " + expected) {
      @Override protected boolean matchesSafely(T t) {
        return t.unparse(new AstWriter().withIndexes()).equals(expected);
      }
    };
  }

  /** Matches a type by its string representation. */
  static Matcher<Type> hasDescription(String expected) {
    return new CustomTypeSafeMatcher<Type>("type " + expected) {
      @Override protected boolean matchesSafely(Type type) {
        return type.toString().equals(expected);
      }
    };
  }

  static Matcher<Throwable> throwsA(String message) {
    return new CustomTypeSafeMatcher<Throwable>("throwable: " + message) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item.toString().contains(message);
      }
    };
  }

  static <T extends Throwable> Matcher<Throwable> throwsA(Class<T> clazz,
      Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + messageMatcher) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }

  /** Matches an exception of a given class whose message contains a given
   * string and, if {@code pos} is not null, whose position is
   * {@code pos}. */
  static <T extends Throwable> Matcher<Throwable> throwsA(Class<T> clazz,
      String message, @Nullable Pos pos) {
    final Matcher<String> messageMatcher = containsString(message);
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + message + (pos == null ? "" : " at " + pos)) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage())
            && (pos == null
                || item instanceof CamException
                && ((CamException) item).pos().equals(pos));
      }
    };
  }
}

// End Matchers.java
