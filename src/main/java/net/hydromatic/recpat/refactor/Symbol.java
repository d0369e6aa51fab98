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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Locale;
import java.util.Objects;

/** What an identifier refers to. */
public class Symbol {
  public final String name;
  public final SymbolKind kind;
  public final boolean isStatic;
  /** Whether the type that declares this member is a nullable wrapper, such
   * as {@code int?}, whose {@code Value} and {@code HasValue} cannot be
   * matched by a property pattern. */
  public final boolean containingTypeIsNullable;

  private Symbol(String name, SymbolKind kind, boolean isStatic,
      boolean containingTypeIsNullable) {
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.isStatic = isStatic;
    this.containingTypeIsNullable = containingTypeIsNullable;
    checkArgument(!isStatic || kind.isMember() || kind == SymbolKind.TYPE,
        "%s %s cannot be static", kind, name);
    checkArgument(!containingTypeIsNullable || kind.isMember(),
        "%s %s has no containing type", kind, name);
  }

  /** Creates a Symbol. */
  public static Symbol of(String name, SymbolKind kind, boolean isStatic,
      boolean containingTypeIsNullable) {
    return new Symbol(name, kind, isStatic, containingTypeIsNullable);
  }

  /** Creates an instance field. */
  public static Symbol field(String name) {
    return of(name, SymbolKind.FIELD, false, false);
  }

  /** Creates an instance property. */
  public static Symbol property(String name) {
    return of(name, SymbolKind.PROPERTY, false, false);
  }

  /** Creates a local variable. */
  public static Symbol local(String name) {
    return of(name, SymbolKind.LOCAL, false, false);
  }

  /**
   * Returns whether an access to this symbol can become an entry of a property
   * pattern: a field or property that is not static and is not declared by a
   * nullable wrapper type.
   */
  public boolean isConvertibleMember() {
    return (kind == SymbolKind.FIELD || kind == SymbolKind.PROPERTY)
        && !isStatic
        && !containingTypeIsNullable;
  }

  @Override public int hashCode() {
    return Objects.hash(name, kind, isStatic, containingTypeIsNullable);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Symbol
        && name.equals(((Symbol) o).name)
        && kind == ((Symbol) o).kind
        && isStatic == ((Symbol) o).isStatic
        && containingTypeIsNullable == ((Symbol) o).containingTypeIsNullable;
  }

  @Override public String toString() {
    return (isStatic ? "static " : "")
        + kind.name().toLowerCase(Locale.ROOT) + " " + name;
  }
}

// End Symbol.java
