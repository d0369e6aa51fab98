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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /** The singleton instance of the AST builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ast;

  private static final ImmutableSet<Annotation> NONE = ImmutableSet.of();

  // expressions

  /** Creates an identifier. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name, NONE);
  }

  /** Creates a "this" expression. */
  public Ast.This this_(Pos pos) {
    return new Ast.This(pos, NONE);
  }

  /** Creates a boolean literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean value) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, value, NONE);
  }

  /** Creates a character literal. */
  public Ast.Literal charLiteral(Pos pos, char value) {
    return new Ast.Literal(pos, Op.CHAR_LITERAL, value, NONE);
  }

  /** Creates an integer literal. */
  public Ast.Literal intLiteral(Pos pos, long value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value, NONE);
  }

  /** Creates a floating-point literal. */
  public Ast.Literal realLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Op.REAL_LITERAL, value, NONE);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value, NONE);
  }

  /** Creates a {@code null} literal. */
  public Ast.Literal nullLiteral(Pos pos) {
    return new Ast.Literal(pos, Op.NULL_LITERAL, null, NONE);
  }

  public Ast.MemberAccess memberAccess(Pos pos, Ast.Exp exp, Ast.Id name) {
    return new Ast.MemberAccess(pos, exp, name, NONE);
  }

  public Ast.MemberBinding memberBinding(Pos pos, Ast.Id name) {
    return new Ast.MemberBinding(pos, name, NONE);
  }

  public Ast.ConditionalAccess conditionalAccess(Pos pos, Ast.Exp exp,
      Ast.Exp whenNotNull) {
    return new Ast.ConditionalAccess(pos, exp, whenNotNull, NONE);
  }

  public Ast.Call call(Pos pos, Ast.Exp fn, List<Ast.Exp> args) {
    return new Ast.Call(pos, fn, ImmutableList.copyOf(args), NONE);
  }

  public Ast.PrefixCall not(Pos pos, Ast.Exp a) {
    return new Ast.PrefixCall(pos, Op.NOT, a, NONE);
  }

  public Ast.PrefixCall negate(Pos pos, Ast.Exp a) {
    return new Ast.PrefixCall(pos, Op.NEGATE, a, NONE);
  }

  /** Creates a call to an infix operator: a comparison, "&amp;&amp;" or
   * "||". */
  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1, NONE);
  }

  public Ast.InfixCall andAlso(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return infixCall(pos, Op.AND_ALSO, a0, a1);
  }

  public Ast.InfixCall orElse(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return infixCall(pos, Op.OR_ELSE, a0, a1);
  }

  public Ast.IsType isType(Pos pos, Ast.Exp exp, Ast.Type type) {
    return new Ast.IsType(pos, exp, type, NONE);
  }

  public Ast.IsPattern isPattern(Pos pos, Ast.Exp exp, Ast.Pat pat) {
    return new Ast.IsPattern(pos, exp, pat, NONE);
  }

  public Ast.SwitchExp switchExp(Pos pos, Ast.Exp exp,
      List<Ast.SwitchArm> arms) {
    return new Ast.SwitchExp(pos, exp, ImmutableList.copyOf(arms), NONE);
  }

  // types

  public Ast.NamedType namedType(Pos pos, String name) {
    return new Ast.NamedType(pos, name);
  }

  // patterns

  public Ast.VarPat varPat(Pos pos, Ast.Designation designation) {
    return new Ast.VarPat(pos, designation, NONE);
  }

  public Ast.DeclarationPat declarationPat(Pos pos, Ast.Type type,
      Ast.Designation designation) {
    return new Ast.DeclarationPat(pos, type, designation, NONE);
  }

  /** Creates a recursive pattern.
   *
   * <p>Each argument other than {@code pos} may be null, but at least one of
   * {@code positional} and {@code properties} must be non-null. */
  public Ast.RecursivePat recursivePat(Pos pos, Ast.@Nullable Type type,
      @Nullable List<Ast.Subpattern> positional,
      @Nullable List<Ast.Subpattern> properties,
      Ast.@Nullable Designation designation) {
    return new Ast.RecursivePat(pos, type,
        positional == null ? null : ImmutableList.copyOf(positional),
        properties == null ? null : ImmutableList.copyOf(properties),
        designation, NONE);
  }

  /** Creates a recursive pattern that has only a property part,
   * "{ P: 1, Q: 2 }". */
  public Ast.RecursivePat propertyPat(Pos pos,
      List<Ast.Subpattern> properties) {
    return recursivePat(pos, null, null, properties, null);
  }

  public Ast.Subpattern subpattern(Pos pos, Ast.@Nullable Id name,
      Ast.Pat pat) {
    return new Ast.Subpattern(pos, name, pat);
  }

  public Ast.ConstantPat constantPat(Pos pos, Ast.Exp exp) {
    return new Ast.ConstantPat(pos, exp, NONE);
  }

  public Ast.RelationalPat relationalPat(Pos pos, Op operator, Ast.Exp exp) {
    return new Ast.RelationalPat(pos, operator, exp, NONE);
  }

  public Ast.TypePat typePat(Pos pos, Ast.Type type) {
    return new Ast.TypePat(pos, type, NONE);
  }

  public Ast.NotPat notPat(Pos pos, Ast.Pat pat) {
    return new Ast.NotPat(pos, pat, NONE);
  }

  public Ast.InfixPat andPat(Pos pos, Ast.Pat p0, Ast.Pat p1) {
    return new Ast.InfixPat(pos, Op.AND_PAT, p0, p1, NONE);
  }

  public Ast.InfixPat orPat(Pos pos, Ast.Pat p0, Ast.Pat p1) {
    return new Ast.InfixPat(pos, Op.OR_PAT, p0, p1, NONE);
  }

  public Ast.ParenthesizedPat parenthesizedPat(Pos pos, Ast.Pat pat) {
    return new Ast.ParenthesizedPat(pos, pat, NONE);
  }

  // designations

  public Ast.SingleDesignation singleDesignation(Pos pos, String name) {
    return new Ast.SingleDesignation(pos, name);
  }

  public Ast.ParenthesizedDesignation parenthesizedDesignation(Pos pos,
      List<Ast.Designation> designations) {
    return new Ast.ParenthesizedDesignation(pos,
        ImmutableList.copyOf(designations));
  }

  // switch

  public Ast.WhenClause whenClause(Pos pos, Ast.Exp condition) {
    return new Ast.WhenClause(pos, condition);
  }

  public Ast.CaseLabel caseLabel(Pos pos, Ast.Pat pat,
      Ast.@Nullable WhenClause whenClause) {
    return new Ast.CaseLabel(pos, pat, whenClause);
  }

  public Ast.DefaultLabel defaultLabel(Pos pos) {
    return new Ast.DefaultLabel(pos);
  }

  public Ast.SwitchArm switchArm(Pos pos, Ast.Pat pat,
      Ast.@Nullable WhenClause whenClause, Ast.Exp exp) {
    return new Ast.SwitchArm(pos, pat, whenClause, exp);
  }

  // statements

  public Ast.SwitchStmt switchStmt(Pos pos, Ast.Exp exp,
      List<Ast.SwitchSection> sections) {
    return new Ast.SwitchStmt(pos, exp, ImmutableList.copyOf(sections));
  }

  public Ast.SwitchSection switchSection(Pos pos, List<Ast.Label> labels,
      List<Ast.Stmt> stmts) {
    return new Ast.SwitchSection(pos, ImmutableList.copyOf(labels),
        ImmutableList.copyOf(stmts));
  }

  public Ast.ExpStmt expStmt(Pos pos, Ast.Exp exp) {
    return new Ast.ExpStmt(pos, exp);
  }

  public Ast.Return return_(Pos pos, Ast.@Nullable Exp exp) {
    return new Ast.Return(pos, exp);
  }

  public Ast.Break break_(Pos pos) {
    return new Ast.Break(pos);
  }

  public Ast.If if_(Pos pos, Ast.Exp condition, Ast.Stmt ifTrue,
      Ast.@Nullable Stmt ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  public Ast.Block block(Pos pos, List<Ast.Stmt> stmts) {
    return new Ast.Block(pos, ImmutableList.copyOf(stmts));
  }
}

// End AstBuilder.java
