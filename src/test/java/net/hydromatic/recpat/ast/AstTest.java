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

import static net.hydromatic.recpat.ast.AstBuilder.ast;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.recpat.SnippetParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link Ast}, in particular how nodes are printed. */
public class AstTest {
  private static final Pos Z = Pos.ZERO;

  private static Ast.Id id(String name) {
    return ast.id(Z, name);
  }

  private static Ast.ConstantPat constant(long value) {
    return ast.constantPat(Z, ast.intLiteral(Z, value));
  }

  @Test void testUnparseInfix() {
    final Ast.Exp a = id("a");
    final Ast.Exp b = id("b");
    final Ast.Exp c = id("c");
    assertThat(ast.andAlso(Z, ast.andAlso(Z, a, b), c),
        hasToString("a && b && c"));
    assertThat(ast.andAlso(Z, a, ast.andAlso(Z, b, c)),
        hasToString("a && (b && c)"));
    assertThat(ast.andAlso(Z, ast.orElse(Z, a, b), c),
        hasToString("(a || b) && c"));
    assertThat(ast.orElse(Z, a, ast.andAlso(Z, b, c)),
        hasToString("a || b && c"));
    assertThat(ast.not(Z, ast.andAlso(Z, a, b)), hasToString("!(a && b)"));
    assertThat(
        ast.not(Z, ast.isPattern(Z, a, ast.constantPat(Z, ast.nullLiteral(Z)))),
        hasToString("!(a is null)"));
    assertThat(
        ast.andAlso(Z, ast.isType(Z, a, ast.namedType(Z, "C")),
            ast.infixCall(Z, Op.EQ, b, ast.negate(Z, ast.intLiteral(Z, 1)))),
        hasToString("a is C && b == -1"));
  }

  @Test void testUnparseMemberAccess() {
    final Ast.Exp a = id("a");
    final Ast.ConditionalAccess ab =
        ast.conditionalAccess(Z, a, ast.memberBinding(Z, id("b")));
    assertThat(ab, hasToString("a?.b"));
    assertThat(ast.memberAccess(Z, ab, id("c")), hasToString("(a?.b).c"));
    assertThat(
        ast.conditionalAccess(Z, a,
            ast.memberAccess(Z, ast.memberBinding(Z, id("b")), id("c"))),
        hasToString("a?.b.c"));
    assertThat(
        ast.memberAccess(Z, ast.call(Z, id("f"), ImmutableList.of(a, id("b"))),
            id("c")),
        hasToString("f(a, b).c"));
  }

  @Test void testUnparseLiteral() {
    assertThat(ast.stringLiteral(Z, "a\"b"), hasToString("\"a\\\"b\""));
    assertThat(ast.charLiteral(Z, 'x'), hasToString("'x'"));
    assertThat(ast.realLiteral(Z, 2.5), hasToString("2.5"));
    assertThat(ast.boolLiteral(Z, false), hasToString("false"));
    assertThat(ast.nullLiteral(Z), hasToString("null"));
  }

  @Test void testUnparsePattern() {
    final Ast.Subpattern p = ast.subpattern(Z, id("P"), constant(1));
    final Ast.Subpattern q = ast.subpattern(Z, id("Q"), constant(2));
    final Ast.SingleDesignation x = ast.singleDesignation(Z, "x");
    assertThat(ast.propertyPat(Z, ImmutableList.of(p, q)),
        hasToString("{ P: 1, Q: 2 }"));
    assertThat(ast.propertyPat(Z, ImmutableList.of()), hasToString("{ }"));
    assertThat(
        ast.recursivePat(Z, ast.namedType(Z, "C"), null, ImmutableList.of(p),
            x),
        hasToString("C { P: 1 } x"));
    assertThat(
        ast.recursivePat(Z, ast.namedType(Z, "Point"),
            ImmutableList.of(ast.subpattern(Z, null, constant(0))), null,
            null),
        hasToString("Point(0)"));
    assertThat(ast.notPat(Z, ast.orPat(Z, constant(1), constant(2))),
        hasToString("not (1 or 2)"));
    assertThat(
        ast.orPat(Z, ast.andPat(Z, constant(1), constant(2)), constant(3)),
        hasToString("1 and 2 or 3"));
    assertThat(ast.relationalPat(Z, Op.GE, ast.intLiteral(Z, 0)),
        hasToString(">= 0"));
    assertThat(
        ast.varPat(Z,
            ast.parenthesizedDesignation(Z,
                ImmutableList.of(x, ast.singleDesignation(Z, "y")))),
        hasToString("var (x, y)"));
  }

  @Test void testRecursivePatternChecks() {
    final Ast.Subpattern p1 = ast.subpattern(Z, id("P"), constant(1));
    final Ast.Subpattern p2 = ast.subpattern(Z, id("P"), constant(2));
    assertThrows(IllegalArgumentException.class, () ->
        ast.propertyPat(Z, ImmutableList.of(p1, p2)));
    assertThrows(IllegalArgumentException.class, () ->
        ast.recursivePat(Z, ast.namedType(Z, "C"), null, null, null));
    assertThrows(IllegalArgumentException.class, () ->
        ast.propertyPat(Z,
            ImmutableList.of(ast.subpattern(Z, null, constant(1)))));

    final Ast.RecursivePat pat = ast.propertyPat(Z, ImmutableList.of(p1));
    assertThat(pat.hasProperty("P"), is(true));
    assertThat(pat.hasProperty("Q"), is(false));
    assertThat(
        pat.addProperty(ast.subpattern(Z, id("Q"), constant(2))),
        hasToString("{ P: 1, Q: 2 }"));
    assertThrows(IllegalArgumentException.class, () -> pat.addProperty(p2));
  }

  @Test void testUnparseStatement() {
    final String s = "switch (o) {\n"
        + "case C { P: 1 } c when c.Q:\n"
        + "case null:\n"
        + "  return 1;\n"
        + "default:\n"
        + "  if (b) { } else return;\n"
        + "}";
    assertThat(SnippetParser.parse(s),
        hasToString("switch (o) { case C { P: 1 } c when c.Q: case null: "
            + "return 1; default: if (b) { } else return; }"));
  }

  /** Copying a node with the same children returns the node itself;
   * children are compared by reference, not structure. */
  @Test void testCopy() {
    final Ast.InfixCall call =
        (Ast.InfixCall) SnippetParser.parseExp("a.b == 1");
    assertThat(call.copy(call.a0, call.a1), sameInstance(call));
    final Ast.Exp a0 = SnippetParser.parseExp("a.b");
    assertThat(a0, is(call.a0));
    final Ast.InfixCall call2 = call.copy(a0, call.a1);
    assertThat(call2 == call, is(false));
    assertThat(call2, is(call));
    assertThat(call2.a0, sameInstance(a0));
  }

  @Test void testAnnotations() {
    final Ast.Exp a = id("a");
    final Ast.Exp a2 = a.annotate(Annotation.FORMAT);
    assertThat(a.hasAnnotation(Annotation.FORMAT), is(false));
    assertThat(a2.hasAnnotation(Annotation.FORMAT), is(true));
    assertThat(a2.hasAnnotation(Annotation.SIMPLIFY), is(false));
    assertThat(a2, is(a));
    final Ast.Pat pat = constant(1).annotate(Annotation.SIMPLIFY);
    assertThat(pat.hasAnnotation(Annotation.SIMPLIFY), is(true));
  }

  @Test void testParserPositions() {
    final Ast.InfixCall and =
        (Ast.InfixCall) SnippetParser.parseExp("a.b == 1\n&& c");
    assertThat(and.pos, hasToString("1.1-2.5"));
    assertThat(and.a0.pos, hasToString("1.1-1.9"));
    assertThat(and.a1.pos, hasToString("2.4"));
  }
}

// End AstTest.java
