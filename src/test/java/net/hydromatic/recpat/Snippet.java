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
package net.hydromatic.recpat;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.notNullValue;
import static org.hamcrest.core.IsNull.nullValue;
import static org.junit.jupiter.api.Assertions.fail;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.recpat.ast.AstNode;
import net.hydromatic.recpat.ast.Pos;
import net.hydromatic.recpat.refactor.Prop;
import net.hydromatic.recpat.refactor.RecursivePatternRefactoring;
import net.hydromatic.recpat.refactor.Replacement;
import net.hydromatic.recpat.refactor.SemanticModel;
import net.hydromatic.recpat.refactor.SemanticModels;
import net.hydromatic.recpat.refactor.Symbol;
import net.hydromatic.recpat.refactor.Term;
import net.hydromatic.recpat.refactor.Tracer;
import net.hydromatic.recpat.refactor.Tracers;
import net.hydromatic.recpat.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.Matcher;

/**
 * Fluent test helper for requesting a rewrite at a position within a
 * snippet of code.
 *
 * <p>The snippet marks the position with two '$' characters; "$$" is a
 * caret, "$a.b$" selects "a.b".
 */
class Snippet {
  private final String text;
  private final ImmutableList<Symbol> symbols;
  private final ImmutableMap<String, Object> constants;
  private final @Nullable SemanticModel model;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;

  private Snippet(String text, ImmutableList<Symbol> symbols,
      ImmutableMap<String, Object> constants, @Nullable SemanticModel model,
      Map<Prop, Object> propMap, Tracer tracer) {
    this.text = requireNonNull(text);
    this.symbols = requireNonNull(symbols);
    this.constants = requireNonNull(constants);
    this.model = model;
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a {@code Snippet}. */
  static Snippet snippet(String text) {
    return new Snippet(text, ImmutableList.of(), ImmutableMap.of(), null,
        ImmutableMap.of(), Tracers.empty());
  }

  /** Declares instance properties. */
  Snippet withProperties(String... names) {
    final ImmutableList.Builder<Symbol> b = ImmutableList.builder();
    b.addAll(symbols);
    for (String name : names) {
      b.add(Symbol.property(name));
    }
    return withSymbols(b.build());
  }

  /** Declares a symbol. */
  Snippet withSymbol(Symbol symbol) {
    return withSymbols(
        ImmutableList.<Symbol>builder().addAll(symbols).add(symbol).build());
  }

  private Snippet withSymbols(ImmutableList<Symbol> symbols) {
    return new Snippet(text, symbols, constants, model, propMap, tracer);
  }

  /** Declares a named constant. */
  Snippet withConstant(String exp, Object value) {
    final Map<String, Object> map = new HashMap<>(constants);
    map.put(exp, value);
    return new Snippet(text, symbols, ImmutableMap.copyOf(map), model,
        propMap, tracer);
  }

  /** Uses a given semantic model, ignoring declared symbols and
   * constants. */
  Snippet withModel(SemanticModel model) {
    return new Snippet(text, symbols, constants, model, propMap, tracer);
  }

  Snippet withProp(Prop prop, Object value) {
    return new Snippet(text, symbols, constants, model,
        plus(propMap, prop, value), tracer);
  }

  Snippet withTracer(Tracer tracer) {
    return new Snippet(text, symbols, constants, model, propMap, tracer);
  }

  Snippet withOnTerm(Consumer<Term> consumer) {
    return withTracer(Tracers.withOnTerm(tracer, consumer));
  }

  Snippet withOnNoRewrite(BiConsumer<@Nullable AstNode, String> consumer) {
    return withTracer(Tracers.withOnNoRewrite(tracer, consumer));
  }

  Snippet withOnRewrite(Consumer<Replacement> consumer) {
    return withTracer(Tracers.withOnRewrite(tracer, consumer));
  }

  /** Returns a map plus (adding or overwriting) an extra (key, value). */
  private static <K, V> Map<K, V> plus(Map<K, V> map, K k, V v) {
    final Map<K, V> map2 = new HashMap<>(map);
    map2.put(k, v);
    return map2;
  }

  SemanticModel model() {
    if (model != null) {
      return model;
    }
    final SemanticModels.Builder b = SemanticModels.builder();
    symbols.forEach(b::symbol);
    constants.forEach(b::constant);
    return b.build();
  }

  /** Parses the snippet and requests a rewrite at the marked position,
   * passing the tree and the result to a consumer. */
  @CanIgnoreReturnValue
  Snippet withResult(BiConsumer<AstNode, @Nullable Replacement> consumer) {
    final Pair<String, Pos> pair = Pos.split(text, '$', "");
    final AstNode root = SnippetParser.parse(pair.left);
    final RecursivePatternRefactoring refactoring =
        RecursivePatternRefactoring.of(model(), propMap, tracer);
    consumer.accept(root, refactoring.tryBuildRewrite(root, pair.right));
    return this;
  }

  /** Asserts that the rewritten snippet, printed, is as expected. */
  @CanIgnoreReturnValue
  Snippet assertRewrite(String expected) {
    return assertRewrite(is(expected));
  }

  @CanIgnoreReturnValue
  Snippet assertRewrite(Matcher<String> matcher) {
    return withResult((root, replacement) -> {
      assertThat("no rewrite for " + text, replacement, notNullValue());
      assertThat(replacement.apply(root).toString(), matcher);
    });
  }

  /** Asserts that the replacement node, printed, is as expected. */
  @CanIgnoreReturnValue
  Snippet assertReplacement(String expected) {
    return withResult((root, replacement) -> {
      assertThat("no rewrite for " + text, replacement, notNullValue());
      assertThat(replacement.replacement.toString(), is(expected));
    });
  }

  /** Asserts that the refactoring offers no rewrite. */
  @CanIgnoreReturnValue
  Snippet assertNoRewrite() {
    return withResult((root, replacement) ->
        assertThat(replacement, nullValue()));
  }

  /** Asserts that the refactoring offers no rewrite, and that the reason it
   * gives matches. */
  @CanIgnoreReturnValue
  Snippet assertNoRewrite(Matcher<String> reasonMatcher) {
    final List<String> reasons = new ArrayList<>();
    return withOnNoRewrite((node, reason) -> reasons.add(reason))
        .withResult((root, replacement) -> {
          assertThat(replacement, nullValue());
          assertThat(reasons.size(), is(1));
          assertThat(reasons.get(0), reasonMatcher);
        });
  }

  /** Asserts that requesting a rewrite throws. */
  @CanIgnoreReturnValue
  Snippet assertError(Matcher<Throwable> matcher) {
    try {
      withResult((root, replacement) -> { });
      fail("expected error");
    } catch (RuntimeException e) {
      assertThat(e, matcher);
    }
    return this;
  }
}

// End Snippet.java
