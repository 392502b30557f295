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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop} and {@link Session}. */
public class PropTest {
  @Test void testDefaults() {
    final Session session = new Session();
    assertThat(session.typeCheck(), is(true));
    assertThat(session.occursCheck(), is(true));
    assertThat(Prop.STEP_LIMIT.intValueOpt(session.map), nullValue());
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("typeCheck"), is(Prop.TYPE_CHECK));
    assertThat(Prop.lookup("TYPE_CHECK"), is(Prop.TYPE_CHECK));
    assertThat(Prop.lookup("stepLimit"), is(Prop.STEP_LIMIT));
    final RuntimeException e =
        assertThrows(RuntimeException.class, () -> Prop.lookup("foo"));
    assertThat(e.getMessage(), is("property foo not found"));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.TYPE_CHECK.setLenient(map, "false");
    Prop.STEP_LIMIT.setLenient(map, "100");
    final Session session = new Session(map);
    assertThat(session.typeCheck(), is(false));
    assertThat(Prop.STEP_LIMIT.intValueOpt(map), is(100));

    assertThrows(RuntimeException.class,
        () -> Prop.OCCURS_CHECK.setLenient(map, "yes"));
    assertThrows(RuntimeException.class,
        () -> Prop.STEP_LIMIT.setLenient(map, "many"));
    assertThat(session.occursCheck(), is(true));

    // Removing a value restores the default
    Prop.STEP_LIMIT.set(map, null);
    assertThat(Prop.STEP_LIMIT.intValueOpt(map), nullValue());
  }

  @Test void testSetInvalid() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThrows(RuntimeException.class,
        () -> Prop.STEP_LIMIT.set(map, "100"));
    assertThrows(RuntimeException.class,
        () -> Prop.TYPE_CHECK.set(map, null));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.STEP_LIMIT.booleanValue(map));
  }
}

// End PropTest.java
