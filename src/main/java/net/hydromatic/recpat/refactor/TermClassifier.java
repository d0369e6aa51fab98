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

import static java.util.Objects.requireNonNull;

import net.hydromatic.recpat.ast.Ast;
import net.hydromatic.recpat.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Reads an expression as a {@link Term}. */
public class TermClassifier {
  /** Pattern "true", the target of a bare boolean operand. */
  public static final Ast.Pat TRUE_PATTERN =
      ast.constantPat(Pos.ZERO, ast.boolLiteral(Pos.ZERO, true));

  /** Pattern "false", the target of a negated operand. */
  public static final Ast.Pat FALSE_PATTERN =
      ast.constantPat(Pos.ZERO, ast.boolLiteral(Pos.ZERO, false));

  private final SemanticModel model;

  public TermClassifier(SemanticModel model) {
    this.model = requireNonNull(model);
  }

  /**
   * Classifies an expression.
   *
   * <p>If the expression is "&amp;&amp;", classifies its right operand, or its
   * left operand if {@code inGuard}; because "&amp;&amp;" is left-associative,
   * that is the operand next to the caret in {@code x && a && b}, and the
   * leftmost operand of a guard.
   *
   * @param exp Expression
   * @param inGuard Whether the expression is the condition of a "when" clause
   * @return Term, or null if the expression is a comparison that does not
   *   have exactly one constant operand
   */
  public @Nullable Term classify(Ast.Exp exp, boolean inGuard) {
    switch (exp.op) {
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      return classifyComparison((Ast.InfixCall) exp);

    case AND_ALSO:
      final Ast.InfixCall andAlso = (Ast.InfixCall) exp;
      return classify(inGuard ? andAlso.a0 : andAlso.a1, inGuard);

    case IS_TYPE:
      final Ast.IsType isType = (Ast.IsType) exp;
      return new Term(isType.exp, isType.type, false, exp);

    case IS_PATTERN:
      final Ast.IsPattern isPattern = (Ast.IsPattern) exp;
      return new Term(isPattern.exp, isPattern.pat, false, exp);

    case NOT:
      return new Term(((Ast.PrefixCall) exp).a, FALSE_PATTERN, false, exp);

    default:
      return new Term(exp, TRUE_PATTERN, false, exp);
    }
  }

  private @Nullable Term classifyComparison(Ast.InfixCall call) {
    final boolean leftConstant = model.getConstantValue(call.a0) != null;
    final boolean rightConstant = model.getConstantValue(call.a1) != null;
    if (leftConstant == rightConstant) {
      // Neither side constant, or both; either way there is no receiver.
      return null;
    }
    return leftConstant
        ? new Term(call.a1, call.a0, true, call)
        : new Term(call.a0, call.a1, false, call);
  }
}

// End TermClassifier.java
