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
package net.hydromatic.recpat.refactor;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("allowSelection"), is(Prop.ALLOW_SELECTION));
    assertThat(Prop.lookup("AND_PATTERN_FALLBACK"),
        is(Prop.AND_PATTERN_FALLBACK));
    assertThrows(IllegalArgumentException.class, () ->
        Prop.lookup("noSuchProperty"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.ALLOW_SELECTION));
    assertThat(Prop.BY_CAMEL_NAME.size(), is(Prop.values().length));
  }

  @Test void testValues() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.ALLOW_SELECTION.booleanValue(map), is(false));
    assertThat(Prop.AND_PATTERN_FALLBACK.booleanValue(map), is(true));
    assertThat(Prop.CHECK_BINDINGS.booleanValue(map), is(true));
    assertThat(Prop.TITLE.stringValue(map), is("Use recursive patterns"));

    Prop.ALLOW_SELECTION.set(map, true);
    assertThat(Prop.ALLOW_SELECTION.booleanValue(map), is(true));
    Prop.ALLOW_SELECTION.set(map, null);
    assertThat(Prop.ALLOW_SELECTION.booleanValue(map), is(false));

    assertThrows(IllegalArgumentException.class, () ->
        Prop.TITLE.set(map, 1));
    assertThrows(IllegalArgumentException.class, () ->
        Prop.TITLE.booleanValue(map));
  }
}

// End PropTest.java
