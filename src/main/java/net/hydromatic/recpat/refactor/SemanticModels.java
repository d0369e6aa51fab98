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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.recpat.ast.Ast;
import net.hydromatic.recpat.ast.AstNode;
import net.hydromatic.recpat.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link SemanticModel}. */
public abstract class SemanticModels {
  private SemanticModels() {}

  /** Creates a builder for a table-driven semantic model. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a model that remembers each answer of an underlying model and
   * throws {@link RefactorException} if a later answer for the same node
   * differs.
   *
   * <p>The result is stateful; create one for each request.
   */
  public static SemanticModel checked(SemanticModel model) {
    return new CheckedSemanticModel(model);
  }

  /** Builder for a table-driven semantic model.
   *
   * <p>Literals (and negated numeric literals) are constants. Other
   * expressions are constants if they have been registered via
   * {@link #constant}, keyed by their source text. Identifiers are resolved
   * by name; there are no scopes. */
  public static class Builder {
    private final Map<String, Symbol> symbols = new HashMap<>();
    private final Map<String, ConstantValue> constants = new HashMap<>();

    private Builder() {
    }

    /** Registers a symbol. A later symbol with the same name replaces an
     * earlier one. */
    @CanIgnoreReturnValue
    public Builder symbol(Symbol symbol) {
      symbols.put(symbol.name, symbol);
      return this;
    }

    /** Registers instance fields. */
    @CanIgnoreReturnValue
    public Builder field(String... names) {
      for (String name : names) {
        symbol(Symbol.field(name));
      }
      return this;
    }

    /** Registers instance properties. */
    @CanIgnoreReturnValue
    public Builder property(String... names) {
      for (String name : names) {
        symbol(Symbol.property(name));
      }
      return this;
    }

    /** Registers local variables. */
    @CanIgnoreReturnValue
    public Builder local(String... names) {
      for (String name : names) {
        symbol(Symbol.local(name));
      }
      return this;
    }

    /** Registers a named constant, such as {@code Color.Red}; {@code text} is
     * the expression as {@link AstNode#toString()} prints it. */
    @CanIgnoreReturnValue
    public Builder constant(String text, @Nullable Object value) {
      constants.put(text, ConstantValue.of(value));
      return this;
    }

    /** Creates a semantic model. */
    public SemanticModel build() {
      return new TableSemanticModel(ImmutableMap.copyOf(symbols),
          ImmutableMap.copyOf(constants));
    }
  }

  /** Semantic model backed by tables. */
  private static class TableSemanticModel implements SemanticModel {
    private final ImmutableMap<String, Symbol> symbols;
    private final ImmutableMap<String, ConstantValue> constants;

    TableSemanticModel(ImmutableMap<String, Symbol> symbols,
        ImmutableMap<String, ConstantValue> constants) {
      this.symbols = symbols;
      this.constants = constants;
    }

    @Override public @Nullable ConstantValue getConstantValue(Ast.Exp exp) {
      switch (exp.op) {
      case BOOL_LITERAL:
      case CHAR_LITERAL:
      case INT_LITERAL:
      case REAL_LITERAL:
      case STRING_LITERAL:
      case NULL_LITERAL:
        return ConstantValue.of(((Ast.Literal) exp).value);

      case NEGATE:
        final Ast.Exp a = ((Ast.PrefixCall) exp).a;
        if (a.op == Op.INT_LITERAL) {
          return ConstantValue.of(
              -(Long) requireNonNull(((Ast.Literal) a).value));
        }
        if (a.op == Op.REAL_LITERAL) {
          return ConstantValue.of(
              -(Double) requireNonNull(((Ast.Literal) a).value));
        }
        break;

      default:
        break;
      }
      return constants.get(exp.toString());
    }

    @Override public @Nullable Symbol getSymbol(Ast.Id id) {
      return symbols.get(id.name);
    }
  }

  /** Semantic model that checks that an underlying model answers each
   * question consistently. */
  private static class CheckedSemanticModel implements SemanticModel {
    /** Placeholder for a null answer. */
    private static final Object NONE = new Object();

    private final SemanticModel model;
    private final Map<AstNode, Object> constantAnswers =
        new IdentityHashMap<>();
    private final Map<AstNode, Object> symbolAnswers =
        new IdentityHashMap<>();

    CheckedSemanticModel(SemanticModel model) {
      this.model = requireNonNull(model);
    }

    @Override public @Nullable ConstantValue getConstantValue(Ast.Exp exp) {
      final ConstantValue value = model.getConstantValue(exp);
      check(constantAnswers, exp, value, "constant value");
      return value;
    }

    @Override public @Nullable Symbol getSymbol(Ast.Id id) {
      final Symbol symbol = model.getSymbol(id);
      check(symbolAnswers, id, symbol, "symbol");
      return symbol;
    }

    private static void check(Map<AstNode, Object> answers, AstNode node,
        @Nullable Object answer, String what) {
      final Object o = answer == null ? NONE : answer;
      final Object previous = answers.putIfAbsent(node, o);
      if (previous != null && !Objects.equals(previous, o)) {
        throw new RefactorException("semantic model gave inconsistent "
            + what + " for '" + node + "': "
            + (previous == NONE ? null : previous) + " then " + answer,
            node.pos);
      }
    }
  }
}

// End SemanticModels.java
