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

import static net.hydromatic.recpat.ast.AstBuilder.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.recpat.ast.Ast;
import net.hydromatic.recpat.ast.Op;
import net.hydromatic.recpat.ast.Pos;

/** Builds patterns from terms. */
public abstract class PatternSynthesizer {
  private PatternSynthesizer() {}

  /**
   * Creates the pattern that tests a term's receiver against its target.
   *
   * <p>A pattern target is returned as is; a type target becomes a type
   * pattern. A constant target becomes a constant pattern ({@code ==}), a
   * negated constant pattern ({@code !=}), or a relational pattern; if the
   * constant was on the left of the comparison, the relational operator is
   * flipped, so that {@code 5 < x.Y} becomes {@code > 5}.
   */
  public static Ast.Pat createPattern(Term term) {
    if (term.target instanceof Ast.Pat) {
      return (Ast.Pat) term.target;
    }
    if (term.target instanceof Ast.Type) {
      return ast.typePat(term.target.pos, (Ast.Type) term.target);
    }
    final Ast.Exp constant = (Ast.Exp) term.target;
    final Op op = term.source.op;
    switch (op) {
    case EQ:
      return ast.constantPat(constant.pos, constant);
    case NE:
      return ast.notPat(term.source.pos,
          ast.constantPat(constant.pos, constant));
    case LT:
    case LE:
    case GT:
    case GE:
      return ast.relationalPat(term.source.pos,
          term.flipped ? op.flip() : op, constant);
    default:
      throw new AssertionError("unexpected op " + op);
    }
  }

  /**
   * Creates a subpattern that applies a pattern at the end of a path of
   * names.
   *
   * <p>For example, names [a, b] and pattern {@code 1} give subpattern
   * {@code a: { b: 1 }}.
   */
  public static Ast.Subpattern subpattern(List<Ast.Id> names, Ast.Pat pat) {
    checkArgument(!names.isEmpty(), "names must not be empty");
    Ast.Subpattern subpattern =
        ast.subpattern(Pos.ZERO, names.get(names.size() - 1), pat);
    for (int i = names.size() - 2; i >= 0; i--) {
      subpattern = ast.subpattern(Pos.ZERO, names.get(i),
          ast.propertyPat(Pos.ZERO, ImmutableList.of(subpattern)));
    }
    return subpattern;
  }

  /**
   * Creates a pattern that applies a pattern at the end of a path of names;
   * returns the pattern itself if there are no names.
   *
   * <p>For example, names [a, b] and pattern {@code 1} give
   * {@code { a: { b: 1 } }}.
   */
  public static Ast.Pat wrap(List<Ast.Id> names, Ast.Pat pat) {
    if (names.isEmpty()) {
      return pat;
    }
    return ast.propertyPat(Pos.ZERO,
        ImmutableList.of(subpattern(names, pat)));
  }

  /** Returns whether a pattern matches the null value; for example
   * {@code null}, {@code not 1} and {@code var x}, but not {@code not null}
   * or {@code { }}. */
  public static boolean matchesNull(Ast.Pat pat, SemanticModel model) {
    switch (pat.op) {
    case CONSTANT_PAT:
      final ConstantValue value =
          model.getConstantValue(((Ast.ConstantPat) pat).exp);
      return value != null && value.value == null;
    case VAR_PAT:
      return true;
    case NOT_PAT:
      return !matchesNull(((Ast.NotPat) pat).pat, model);
    case AND_PAT:
      final Ast.InfixPat andPat = (Ast.InfixPat) pat;
      return matchesNull(andPat.p0, model) && matchesNull(andPat.p1, model);
    case OR_PAT:
      final Ast.InfixPat orPat = (Ast.InfixPat) pat;
      return matchesNull(orPat.p0, model) || matchesNull(orPat.p1, model);
    case PARENTHESIZED_PAT:
      return matchesNull(((Ast.ParenthesizedPat) pat).pat, model);
    default:
      return false;
    }
  }
}

// End PatternSynthesizer.java
