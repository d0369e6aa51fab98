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

import net.hydromatic.recpat.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Answers the questions about meaning that a syntax tree alone cannot.
 *
 * <p>A host supplies an implementation backed by its compiler;
 * {@link SemanticModels#builder()} creates one from tables.
 */
public interface SemanticModel {
  /** Returns the compile-time constant value of an expression, or null if
   * the expression is not a constant. */
  @Nullable ConstantValue getConstantValue(Ast.Exp exp);

  /** Returns the symbol that an identifier refers to, or null if it cannot
   * be resolved. */
  @Nullable Symbol getSymbol(Ast.Id id);
}

// End SemanticModel.java
