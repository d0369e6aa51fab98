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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.nullValue;

import static java.util.Objects.requireNonNull;

import net.hydromatic.recpat.ast.Annotation;
import net.hydromatic.recpat.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link ContainingPatternMerger}. */
public class ContainingPatternMergerTest {
  private final SemanticModel model =
      SemanticModels.builder().property("P", "Q").build();
  private final ContainingPatternMerger merger =
      new ContainingPatternMerger(model, true, true);

  private ContainingPatternMerger.Found find(String pat, String receiver) {
    return merger.find(parsePat(pat), parseExp(receiver));
  }

  /** Merges pattern {@code generated} into the pattern that declares the
   * receiver. */
  private Ast.Pat merge(ContainingPatternMerger merger, String pat,
      String receiver, String generated) {
    final ContainingPatternMerger.Found found =
        merger.find(parsePat(pat), parseExp(receiver));
    assertThat(found == null, is(false));
    return merger.rewrite(found, parsePat(generated));
  }

  private Ast.Pat merge(String pat, String receiver, String generated) {
    return merge(merger, pat, receiver, generated);
  }

  @Test void testFind() {
    assertThat(find("C c", "c.P"), hasToString("found(c in C c, [P])"));
    assertThat(find("{ P: var v }", "v.Q"),
        hasToString("found(v in var v, [Q])"));
    assertThat(find("{ P: 1 } x", "x"),
        hasToString("found(x in { P: 1 } x, [])"));
    assertThat(find("C c or D c", "c.P"),
        hasToString("found(c in C c, [P])"));
  }

  @Test void testFindFails() {
    // receiver is not an identifier
    assertThat(find("C c", "P"), nullValue());
    assertThat(find("C c", "c.M().P"), nullValue());
    // no such designation
    assertThat(find("C c", "d.P"), nullValue());
    // designation is not held by a var, declaration or recursive pattern
    assertThat(find("var (c, d)", "c.P"), nullValue());
  }

  /** Adding a subpattern keeps the designation and the type. */
  @Test void testAddSubpattern() {
    assertThat(merge("var v", "v.P", "1"), hasToString("{ P: 1 } v"));
    assertThat(merge("C c", "c.P", "> 1"), hasToString("C { P: > 1 } c"));
    assertThat(merge("C { P: 1 } c", "c.Q", "2"),
        hasToString("C { P: 1, Q: 2 } c"));
    assertThat(merge("{ P: 1 } c", "c.Q.P", "null"),
        hasToString("{ P: 1, Q: { P: null } } c"));
    assertThat(merge("C { P: 1 } c", "c.P", "2"), nullValue());
  }

  @Test void testCombine() {
    assertThat(merge("var v", "v", "C"), hasToString("C v"));
    assertThat(merge("var v", "v", "{ P: 1 }"), hasToString("{ P: 1 } v"));
    assertThat(merge("C v", "v", "{ P: 1 }"), hasToString("C { P: 1 } v"));
    assertThat(merge("{ P: 1 } v", "v", "C"), hasToString("C { P: 1 } v"));
    assertThat(merge("C v", "v", "not null"),
        hasToString("(C v) and (not null)"));
    assertThat(merge("var v", "v", "{ P: 1 } w"),
        hasToString("(var v) and ({ P: 1 } w)"));

    final ContainingPatternMerger strictMerger =
        new ContainingPatternMerger(model, false, true);
    assertThat(merge(strictMerger, "C v", "v", "not null"), nullValue());
    assertThat(merge(strictMerger, "var v", "v", "C"), hasToString("C v"));
  }

  /** With or without the check that designations survive, a merge gives
   * the same pattern. */
  @Test void testCheckBindings() {
    final ContainingPatternMerger uncheckedMerger =
        new ContainingPatternMerger(model, true, false);
    final String[][] merges = {
        {"var v", "v.P", "1"},
        {"C c", "c.P", "> 1"},
        {"{ P: 1 } c", "c.Q", "2"},
        {"var v", "v", "C"},
        {"C v", "v", "not null"},
    };
    for (String[] m : merges) {
      final Ast.Pat checked = merge(m[0], m[1], m[2]);
      final Ast.Pat unchecked = merge(uncheckedMerger, m[0], m[1], m[2]);
      assertThat(unchecked, is(checked));
      assertThat(Designations.contains(unchecked,
              requireNonNull(Designations.of(parsePat(m[0])))),
          is(true));
    }
  }

  @Test void testAnnotations() {
    final Ast.Pat pat = merge("C c", "c.P", "1");
    assertThat(pat.hasAnnotation(Annotation.FORMAT), is(true));
    assertThat(pat.hasAnnotation(Annotation.SIMPLIFY), is(true));
  }
}

// End ContainingPatternMergerTest.java
