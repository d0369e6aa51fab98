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

import static net.hydromatic.recpat.SnippetParser.parseExp;
import static net.hydromatic.recpat.SnippetParser.parsePat;
import static net.hydromatic.recpat.ast.AstBuilder.ast;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.nullValue;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.recpat.ast.Ast;
import net.hydromatic.recpat.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link TermClassifier} and {@link PatternSynthesizer}. */
public class TermClassifierTest {
  private final SemanticModel model =
      SemanticModels.builder()
          .property("b", "c")
          .constant("Color.Red", 0)
          .constant("Text.Nothing", null)
          .build();
  private final TermClassifier classifier = new TermClassifier(model);

  private Term classify(String s) {
    return classifier.classify(parseExp(s), false);
  }

  private Ast.Pat pattern(String s) {
    return PatternSynthesizer.createPattern(classify(s));
  }

  @Test void testComparison() {
    assertThat(classify("a.b == 1"), hasToString("term(a.b, 1)"));
    assertThat(classify("1 == a.b"), hasToString("term(a.b, 1, flipped)"));
    assertThat(classify("a.b != Color.Red"),
        hasToString("term(a.b, Color.Red)"));
    assertThat(classify("a.b < -3"), hasToString("term(a.b, -3)"));
  }

  /** A comparison needs exactly one constant operand. */
  @Test void testComparisonWithoutReceiver() {
    assertThat(classify("a.b == a.c"), nullValue());
    assertThat(classify("1 == 2"), nullValue());
    assertThat(classify("Color.Red == 0"), nullValue());
  }

  @Test void testOtherShapes() {
    assertThat(classify("a.b"), hasToString("term(a.b, true)"));
    assertThat(classify("!a.b"), hasToString("term(a.b, false)"));
    assertThat(classify("a.F(1)"), hasToString("term(a.F(1), true)"));
    assertThat(classify("e is C"), hasToString("term(e, C)"));
    assertThat(classify("e is { b: 1 } x"),
        hasToString("term(e, { b: 1 } x)"));
    assertThat(classify("e is not null"), hasToString("term(e, not null)"));
  }

  /** In "&amp;&amp;", the right operand is classified, or in a guard the
   * leftmost. */
  @Test void testAndAlso() {
    final Ast.Exp exp = parseExp("x && a.b == 1 && a.c");
    assertThat(classifier.classify(exp, false),
        hasToString("term(a.c, true)"));
    assertThat(classifier.classify(exp, true),
        hasToString("term(x, true)"));
  }

  @Test void testCreatePattern() {
    assertThat(pattern("a.b == 1"), hasToString("1"));
    assertThat(pattern("a.b != 1"), hasToString("not 1"));
    assertThat(pattern("a.b < 1"), hasToString("< 1"));
    assertThat(pattern("a.b >= 1"), hasToString(">= 1"));
    assertThat(pattern("1 == a.b"), hasToString("1"));
    assertThat(pattern("1 < a.b"), hasToString("> 1"));
    assertThat(pattern("1 <= a.b"), hasToString(">= 1"));
    assertThat(pattern("1 > a.b"), hasToString("< 1"));
    assertThat(pattern("1 >= a.b"), hasToString("<= 1"));
    assertThat(pattern("a.b is C"), hasToString("C"));
    assertThat(pattern("a.b is C or null"), hasToString("C or null"));
    assertThat(pattern("!a.b"), sameInstance(TermClassifier.FALSE_PATTERN));
    assertThat(pattern("a.b"), sameInstance(TermClassifier.TRUE_PATTERN));
  }

  @Test void testFlip() {
    for (String op : new String[] {"<", "<=", ">", ">="}) {
      final Term term = classify("1 " + op + " a.b");
      assertThat(term.flipped, is(true));
      final Ast.RelationalPat pat =
          (Ast.RelationalPat) PatternSynthesizer.createPattern(term);
      assertThat(pat.operator.flip(), is(term.source.op));
    }
  }

  @Test void testSubpatternAndWrap() {
    final List<Ast.Id> names =
        ImmutableList.of(ast.id(Pos.ZERO, "b"), ast.id(Pos.ZERO, "c"));
    final Ast.Pat one = pattern("a.b == 1");
    assertThat(PatternSynthesizer.subpattern(names, one),
        hasToString("b: { c: 1 }"));
    assertThat(PatternSynthesizer.wrap(names, one),
        hasToString("{ b: { c: 1 } }"));
    assertThat(PatternSynthesizer.wrap(names.subList(1, 2), one),
        hasToString("{ c: 1 }"));
    assertThat(PatternSynthesizer.wrap(ImmutableList.of(), one),
        sameInstance(one));
    assertThrows(IllegalArgumentException.class, () ->
        PatternSynthesizer.subpattern(ImmutableList.of(), one));
  }

  private boolean matchesNull(String pat) {
    return PatternSynthesizer.matchesNull(parsePat(pat), model);
  }

  @Test void testMatchesNull() {
    assertThat(matchesNull("null"), is(true));
    assertThat(matchesNull("not 1"), is(true));
    assertThat(matchesNull("not Color.Red"), is(true));
    assertThat(matchesNull("Text.Nothing"), is(true));
    assertThat(matchesNull("var x"), is(true));
    assertThat(matchesNull("C or null"), is(true));
    assertThat(matchesNull("(null)"), is(true));
    assertThat(matchesNull("1"), is(false));
    assertThat(matchesNull("Color.Red"), is(false));
    assertThat(matchesNull("not null"), is(false));
    assertThat(matchesNull("not (1 or null)"), is(false));
    assertThat(matchesNull("var x and not null"), is(false));
    assertThat(matchesNull("> 1"), is(false));
    assertThat(matchesNull("{ }"), is(false));
    assertThat(matchesNull("C c"), is(false));
  }
}

// End TermClassifierTest.java
