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
package net.hydromatic.recpat.ast;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.recpat.util.Pair;
import org.junit.jupiter.api.Test;

/** Tests for {@link Pos}. */
public class PosTest {
  @Test void testSplit() {
    final Pair<String, Pos> caret = Pos.split("a == 1 $$&& b", '$', "f.cs");
    assertThat(caret.left, is("a == 1 && b"));
    assertThat(caret.right.isEmpty(), is(true));
    assertThat(caret.right, hasToString("f.cs:1.8-1.8"));

    final Pair<String, Pos> selection =
        Pos.split("x\n$a == 1$ && b", '$', "");
    assertThat(selection.left, is("x\na == 1 && b"));
    assertThat(selection.right.isEmpty(), is(false));
    assertThat(selection.right, hasToString("2.1-2.7"));

    assertThrows(IllegalArgumentException.class, () ->
        Pos.split("a $ b", '$', ""));
    assertThrows(IllegalArgumentException.class, () ->
        Pos.split("$a$ $b", '$', ""));
  }

  @Test void testContains() {
    final Pos pos = new Pos("", 1, 3, 1, 6);
    assertThat(pos.contains(new Pos("", 1, 3, 1, 3)), is(true));
    assertThat(pos.contains(new Pos("", 1, 5, 1, 5)), is(true));
    assertThat(pos.contains(new Pos("", 1, 6, 1, 6)), is(false));
    assertThat(pos.contains(new Pos("", 1, 2, 1, 4)), is(false));
    // only the start of the argument matters
    assertThat(pos.contains(new Pos("", 1, 4, 2, 1)), is(true));

    final Pos multiLine = new Pos("", 1, 8, 3, 2);
    assertThat(multiLine.contains(new Pos("", 2, 1, 2, 1)), is(true));
    assertThat(multiLine.contains(new Pos("", 3, 2, 3, 2)), is(false));

    assertThat(Pos.ZERO.contains(Pos.ZERO), is(false));
  }

  @Test void testPlus() {
    final Pos a = new Pos("", 1, 3, 1, 6);
    final Pos b = new Pos("", 2, 1, 2, 4);
    assertThat(a.plus(b), hasToString("1.3-2.4"));
    assertThat(b.plus(a), hasToString("1.3-2.4"));
    assertThat(a.plus(Pos.ZERO), is(a));
    assertThat(Pos.ZERO.plus(b), is(b));
  }
}

// End PosTest.java
