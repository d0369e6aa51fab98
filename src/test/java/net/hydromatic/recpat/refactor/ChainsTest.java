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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.nullValue;

import net.hydromatic.recpat.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link Chains}. */
public class ChainsTest {
  private final SemanticModel model =
      SemanticModels.builder()
          .property("b", "c", "d")
          .field("f")
          .local("a", "x")
          .symbol(Symbol.of("S", SymbolKind.PROPERTY, true, false))
          .build();

  private Chain decompose(String s) {
    return Chains.decompose(parseExp(s), model);
  }

  private CommonReceiver common(String left, String right) {
    return Chains.commonReceiver(parseExp(left), parseExp(right), model);
  }

  @Test void testDecompose() {
    assertThat(decompose("a.b.c"), hasToString("chain(a, [b, c])"));
    assertThat(decompose("a.f"), hasToString("chain(a, [f])"));
    assertThat(decompose("a"), hasToString("chain(a, [])"));
    assertThat(decompose("b.c"), hasToString("chain(null, [b, c])"));
    assertThat(decompose("this.b"), hasToString("chain(this, [b])"));
    assertThat(decompose("a.M().c"), hasToString("chain(a.M(), [c])"));
    // a static member ends the chain
    assertThat(decompose("a.S.c"), hasToString("chain(a.S, [c])"));
    // so does an unknown name
    assertThat(decompose("a.z.c"), hasToString("chain(a.z, [c])"));
  }

  @Test void testDecomposeConditionalAccess() {
    final Chain chain = decompose("a?.b.c");
    assertThat(chain, hasToString("chain(a, [b, c])"));
    assertThat(chain.links, hasToString("[b of a, c of a?.b]"));
    assertThat(decompose("a?.b?.c"), hasToString("chain(a, [b, c])"));
    assertThat(decompose("a?.b?.c").links,
        hasToString("[b of a, c of a?.b]"));
    assertThat(decompose("a?.M().c"), hasToString("chain(a?.M(), [c])"));
    assertThat(decompose("a?.M().c").links, hasToString("[c of a?.M()]"));
  }

  /** Converting a chain to an expression and decomposing again gives the
   * same chain. */
  @Test void testToExp() {
    for (String s : new String[] {"a.b.c", "b.c", "a?.b.c", "a.M().c", "a"}) {
      final Chain chain = decompose(s);
      final Ast.Exp exp = Chains.toExp(chain);
      final Chain chain2 = Chains.decompose(exp, model);
      assertThat(chain2.toString(), is(chain.toString()));
    }
    assertThat(Chains.toExp(decompose("a?.b.c")), hasToString("a.b.c"));
    assertThat(Chains.toExp(decompose("b.c")), hasToString("b.c"));
  }

  @Test void testCommonReceiver() {
    assertThat(common("a.b", "a.c"), hasToString("common(a, [b], [c])"));
    assertThat(common("a.b.c", "a.b.d"),
        hasToString("common(a.b, [c], [d])"));
    assertThat(common("a.b.c", "a.d"),
        hasToString("common(a, [b, c], [d])"));
    assertThat(common("a.b.c.d", "a.b"),
        hasToString("common(a, [b, c, d], [b])"));
    assertThat(common("b", "c"), hasToString("common(null, [b], [c])"));
    assertThat(common("b", "c").receiverOrThis(), hasToString("this"));
    assertThat(common("a?.b.c", "a?.b.d"),
        hasToString("common(a?.b, [c], [d])"));
  }

  @Test void testIsNullConditional() {
    assertThat(Chains.isNullConditional(parseExp("a?.b")), is(true));
    assertThat(Chains.isNullConditional(parseExp("a?.b.c")), is(true));
    assertThat(Chains.isNullConditional(parseExp("(a?.b).c")), is(true));
    assertThat(Chains.isNullConditional(parseExp("a.b?.M().c")), is(true));
    assertThat(Chains.isNullConditional(parseExp("a.b.c")), is(false));
    assertThat(Chains.isNullConditional(parseExp("a.M().c")), is(false));
    assertThat(Chains.isNullConditional(parseExp("M(a?.b)")), is(false));
  }

  @Test void testNoCommonReceiver() {
    assertThat(common("a.b", "x.b"), nullValue());
    assertThat(common("a", "a.b"), nullValue());
    assertThat(common("a.b", "b"), nullValue());
    assertThat(common("a.M().b", "a.N().b"), nullValue());
  }
}

// End ChainsTest.java
