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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),
  THIS(true),

  // literals
  BOOL_LITERAL(true),
  CHAR_LITERAL(true),
  INT_LITERAL(true),
  REAL_LITERAL(true),
  STRING_LITERAL(true),
  NULL_LITERAL(true),

  // member access and invocation
  MEMBER_ACCESS(".", 9),
  /** The ".b" part of "a?.b"; occurs only inside a conditional access. */
  MEMBER_BINDING(true),
  /** Binds less tightly than {@link #MEMBER_ACCESS}, so that "(a?.b).c"
   * keeps its parentheses. */
  CONDITIONAL_ACCESS("?", 8),
  CALL("()", 9),

  // prefix operators
  NOT("!", 7),
  NEGATE("-", 7),

  // infix operators
  SWITCH_EXP(" switch ", 5),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  IS_TYPE(" is ", 4),
  IS_PATTERN(" is ", 4),
  EQ(" == ", 3),
  NE(" != ", 3),
  AND_ALSO(" && ", 2),
  OR_ELSE(" || ", 1),

  // types
  NAMED_TYPE(true),

  // patterns
  VAR_PAT(true),
  DECLARATION_PAT(true),
  RECURSIVE_PAT(true),
  CONSTANT_PAT(true),
  RELATIONAL_PAT(true),
  TYPE_PAT(true),
  PARENTHESIZED_PAT(true),
  NOT_PAT("not ", 3),
  AND_PAT(" and ", 2),
  OR_PAT(" or ", 1),

  // miscellaneous
  SUBPATTERN,
  SINGLE_DESIGNATION(true),
  PARENTHESIZED_DESIGNATION(true),
  WHEN_CLAUSE,
  CASE_LABEL,
  DEFAULT_LABEL,
  SWITCH_ARM,

  // statements
  SWITCH_STMT,
  SWITCH_SECTION,
  EXP_STMT,
  RETURN,
  BREAK,
  IF,
  BLOCK;

  /** Padded name, e.g. " == ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns the operator token, e.g. "==" for {@link #EQ}. */
  public String token() {
    return padded.trim();
  }

  /** Returns whether this is one of the six comparison operators. */
  public boolean isComparison() {
    switch (this) {
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      return true;
    default:
      return false;
    }
  }

  /** Returns whether this is an ordering comparison, such as "<". */
  public boolean isRelational() {
    return isComparison() && this != EQ && this != NE;
  }

  /** Returns the relational operator that gives the same result when its
   * operands are swapped; for example "a < b" is "b > a". */
  public Op flip() {
    switch (this) {
    case LT:
      return GT;
    case LE:
      return GE;
    case GE:
      return LE;
    case GT:
      return LT;
    default:
      throw new AssertionError("unexpected op " + this);
    }
  }
}

// End Op.java
