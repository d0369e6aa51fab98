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

import static net.hydromatic.recpat.util.Static.anyMatch;
import static net.hydromatic.recpat.util.Static.append;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Returns a set that contains existing annotations plus some more. */
  static ImmutableSet<Annotation> union(ImmutableSet<Annotation> annotations,
      Annotation... extra) {
    return ImmutableSet.<Annotation>builder()
        .addAll(annotations)
        .add(extra)
        .build();
  }

  /** Returns whether two lists contain the same nodes, compared by
   * identity. */
  static boolean same(@Nullable List<?> list0, @Nullable List<?> list1) {
    if (list0 == null || list1 == null) {
      return list0 == list1;
    }
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (list0.get(i) != list1.get(i)) {
        return false;
      }
    }
    return true;
  }

  /** Base class of expression parse tree nodes. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op, ImmutableSet<Annotation> annotations) {
      super(pos, op, annotations);
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);

    /** Returns a copy of this expression with the given annotations. */
    public abstract Exp withAnnotations(ImmutableSet<Annotation> annotations);

    /** Returns a copy of this expression with some annotations added. */
    public Exp annotate(Annotation... annotations) {
      return withAnnotations(union(this.annotations, annotations));
    }
  }

  /** Parse tree node of an identifier. */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name, ImmutableSet<Annotation> annotations) {
      super(pos, Op.ID, annotations);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Id
              && this.name.equals(((Id) o).name);
    }

    @Override
    public Id accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public Id withAnnotations(ImmutableSet<Annotation> annotations) {
      return new Id(pos, name, annotations);
    }
  }

  /** Parse tree node of the "this" expression. */
  public static class This extends Exp {
    This(Pos pos, ImmutableSet<Annotation> annotations) {
      super(pos, Op.THIS, annotations);
    }

    @Override
    public int hashCode() {
      return "this".hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof This;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("this");
    }

    @Override
    public This withAnnotations(ImmutableSet<Annotation> annotations) {
      return new This(pos, annotations);
    }
  }

  /** Parse tree node of a literal (constant). */
  public static class Literal extends Exp {
    /** Value; null if and only if this is the {@code null} literal. */
    public final @Nullable Object value;

    Literal(Pos pos, Op op, @Nullable Object value,
        ImmutableSet<Annotation> annotations) {
      super(pos, op, annotations);
      this.value = value;
      checkArgument(op == Op.BOOL_LITERAL
          || op == Op.CHAR_LITERAL
          || op == Op.INT_LITERAL
          || op == Op.REAL_LITERAL
          || op == Op.STRING_LITERAL
          || op == Op.NULL_LITERAL);
      checkArgument((value == null) == (op == Op.NULL_LITERAL));
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && this.op == ((Literal) o).op
              && Objects.equals(this.value, ((Literal) o).value);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
      case NULL_LITERAL:
        return w.append("null");
      case STRING_LITERAL:
        return w.append("\"")
            .append(((String) requireNonNull(value))
                .replace("\\", "\\\\")
                .replace("\"", "\\\""))
            .append("\"");
      case CHAR_LITERAL:
        return w.append("'").append(String.valueOf(value)).append("'");
      default:
        return w.append(String.valueOf(value));
      }
    }

    @Override
    public Literal withAnnotations(ImmutableSet<Annotation> annotations) {
      return new Literal(pos, op, value, annotations);
    }
  }

  /** Parse tree node of a member access, "a.b". */
  public static class MemberAccess extends Exp {
    public final Exp exp;
    public final Id name;

    MemberAccess(Pos pos, Exp exp, Id name,
        ImmutableSet<Annotation> annotations) {
      super(pos, Op.MEMBER_ACCESS, annotations);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(exp, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof MemberAccess
              && this.exp.equals(((MemberAccess) o).exp)
              && this.name.equals(((MemberAccess) o).name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(exp, left, op.left).append(".").append(name.name);
    }

    @Override
    public MemberAccess withAnnotations(ImmutableSet<Annotation> annotations) {
      return new MemberAccess(pos, exp, name, annotations);
    }

    /** Creates a copy of this {@code MemberAccess} with given contents,
     * or {@code this} if the contents are the same. */
    public MemberAccess copy(Exp exp, Id name) {
      return this.exp == exp
          && this.name == name
          ? this
          : new MemberAccess(pos, exp, name, annotations);
    }
  }

  /** Parse tree node of a member binding, the ".b" in "a?.b".
   *
   * <p>Occurs only inside the {@link ConditionalAccess#whenNotNull} part of a
   * conditional access, as the leftmost node of that part. */
  public static class MemberBinding extends Exp {
    public final Id name;

    MemberBinding(Pos pos, Id name, ImmutableSet<Annotation> annotations) {
      super(pos, Op.MEMBER_BINDING, annotations);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof MemberBinding
              && this.name.equals(((MemberBinding) o).name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(".").append(name.name);
    }

    @Override
    public MemberBinding withAnnotations(
        ImmutableSet<Annotation> annotations) {
      return new MemberBinding(pos, name, annotations);
    }
  }

  /** Parse tree node of a null-safe conditional access, "a?.b.c".
   *
   * <p>If {@link #exp} evaluates to null, the whole expression is null and
   * {@link #whenNotNull} is not evaluated. */
  public static class ConditionalAccess extends Exp {
    public final Exp exp;
    public final Exp whenNotNull;

    ConditionalAccess(Pos pos, Exp exp, Exp whenNotNull,
        ImmutableSet<Annotation> annotations) {
      super(pos, Op.CONDITIONAL_ACCESS, annotations);
      this.exp = requireNonNull(exp);
      this.whenNotNull = requireNonNull(whenNotNull);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp, whenNotNull);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ConditionalAccess
              && this.exp.equals(((ConditionalAccess) o).exp)
              && this.whenNotNull.equals(((ConditionalAccess) o).whenNotNull);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      // The "when not null" part starts with a member binding, so it never
      // needs parentheses.
      return w.append(exp, left, op.left).append("?")
          .append(whenNotNull, 0, 0);
    }

    @Override
    public ConditionalAccess withAnnotations(
        ImmutableSet<Annotation> annotations) {
      return new ConditionalAccess(pos, exp, whenNotNull, annotations);
    }

    /** Creates a copy of this {@code ConditionalAccess} with given contents,
     * or {@code this} if the contents are the same. */
    public ConditionalAccess copy(Exp exp, Exp whenNotNull) {
      return this.exp == exp
          && this.whenNotNull == whenNotNull
          ? this
          : new ConditionalAccess(pos, exp, whenNotNull, annotations);
    }
  }

  /** Parse tree node of a method invocation, "f(x, y)". */
  public static class Call extends Exp {
    public final Exp fn;
    public final List<Exp> args;

    Call(Pos pos, Exp fn, ImmutableList<Exp> args,
        ImmutableSet<Annotation> annotations) {
      super(pos, Op.CALL, annotations);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Call
              && this.fn.equals(((Call) o).fn)
              && this.args.equals(((Call) o).args);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(fn, left, op.left).append("(")
          .appendAll(args, ", ")
          .append(")");
    }

    @Override
    public Call withAnnotations(ImmutableSet<Annotation> annotations) {
      return new Call(pos, fn, ImmutableList.copyOf(args), annotations);
    }

    /** Creates a copy of this {@code Call} with given contents,
     * or {@code this} if the contents are the same. */
    public Call copy(Exp fn, List<Exp> args) {
      return this.fn == fn
          && same(this.args, args)
          ? this
          : new Call(pos, fn, ImmutableList.copyOf(args), annotations);
    }
  }

  /** Call to a prefix operator, "!a" or "-a". */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a, ImmutableSet<Annotation> annotations) {
      super(pos, op, annotations);
      this.a = requireNonNull(a);
      checkArgument(op == Op.NOT || op == Op.NEGATE);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof PrefixCall
              && this.op == ((PrefixCall) o).op
              && this.a.equals(((PrefixCall) o).a);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }

    @Override
    public PrefixCall withAnnotations(ImmutableSet<Annotation> annotations) {
      return new PrefixCall(pos, op, a, annotations);
    }

    /** Creates a copy of this {@code PrefixCall} with given contents,
     * or {@code this} if the contents are the same. */
    public PrefixCall copy(Exp a) {
      return this.a == a
          ? this
          : new PrefixCall(pos, op, a, annotations);
    }
  }

  /** Call to an infix operator: a comparison, "&amp;&amp;" or "||". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1,
        ImmutableSet<Annotation> annotations) {
      super(pos, op, annotations);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isComparison()
          || op == Op.AND_ALSO
          || op == Op.OR_ELSE);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof InfixCall
              && this.op == ((InfixCall) o).op
              && this.a0.equals(((InfixCall) o).a0)
              && this.a1.equals(((InfixCall) o).a1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    @Override
    public InfixCall withAnnotations(ImmutableSet<Annotation> annotations) {
      return new InfixCall(pos, op, a0, a1, annotations);
    }

    /** Creates a copy of this {@code InfixCall} with given contents
     * and same operator,
     * or {@code this} if the contents are the same. */
    public InfixCall copy(Exp a0, Exp a1) {
      return this.a0 == a0
          && this.a1 == a1
          ? this
          : new InfixCall(pos, op, a0, a1, annotations);
    }
  }

  /** Type test, "e is T". */
  public static class IsType extends Exp {
    public final Exp exp;
    public final Type type;

    IsType(Pos pos, Exp exp, Type type,
        ImmutableSet<Annotation> annotations) {
      super(pos, Op.IS_TYPE, annotations);
      this.exp = requireNonNull(exp);
      this.type = requireNonNull(type);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp, type);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IsType
              && this.exp.equals(((IsType) o).exp)
              && this.type.equals(((IsType) o).type);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.is(left, exp, op, type, right);
    }

    @Override
    public IsType withAnnotations(ImmutableSet<Annotation> annotations) {
      return new IsType(pos, exp, type, annotations);
    }

    /** Creates a copy of this {@code IsType} with given contents,
     * or {@code this} if the contents are the same. */
    public IsType copy(Exp exp, Type type) {
      return this.exp == exp
          && this.type == type
          ? this
          : new IsType(pos, exp, type, annotations);
    }
  }

  /** Pattern test, "e is P". */
  public static class IsPattern extends Exp {
    public final Exp exp;
    public final Pat pat;

    IsPattern(Pos pos, Exp exp, Pat pat,
        ImmutableSet<Annotation> annotations) {
      super(pos, Op.IS_PATTERN, annotations);
      this.exp = requireNonNull(exp);
      this.pat = requireNonNull(pat);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp, pat);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IsPattern
              && this.exp.equals(((IsPattern) o).exp)
              && this.pat.equals(((IsPattern) o).pat);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.is(left, exp, op, pat, right);
    }

    @Override
    public IsPattern withAnnotations(ImmutableSet<Annotation> annotations) {
      return new IsPattern(pos, exp, pat, annotations);
    }

    /** Creates a copy of this {@code IsPattern} with given contents,
     * or {@code this} if the contents are the same. */
    public IsPattern copy(Exp exp, Pat pat) {
      return this.exp == exp
          && this.pat == pat
          ? this
          : new IsPattern(pos, exp, pat, annotations);
    }
  }

  /** Switch expression, "e switch { p1 =&gt; r1, p2 =&gt; r2 }". */
  public static class SwitchExp extends Exp {
    public final Exp exp;
    public final List<SwitchArm> arms;

    SwitchExp(Pos pos, Exp exp, ImmutableList<SwitchArm> arms,
        ImmutableSet<Annotation> annotations) {
      super(pos, Op.SWITCH_EXP, annotations);
      this.exp = requireNonNull(exp);
      this.arms = requireNonNull(arms);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp, arms);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SwitchExp
              && this.exp.equals(((SwitchExp) o).exp)
              && this.arms.equals(((SwitchExp) o).arms);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(exp, left, op.left)
          .append(op.padded)
          .append("{ ")
          .appendAll(arms, ", ")
          .append(" }");
    }

    @Override
    public SwitchExp withAnnotations(ImmutableSet<Annotation> annotations) {
      return new SwitchExp(pos, exp, ImmutableList.copyOf(arms), annotations);
    }

    /** Creates a copy of this {@code SwitchExp} with given contents,
     * or {@code this} if the contents are the same. */
    public SwitchExp copy(Exp exp, List<SwitchArm> arms) {
      return this.exp == exp
          && same(this.arms, arms)
          ? this
          : new SwitchExp(pos, exp, ImmutableList.copyOf(arms), annotations);
    }
  }

  /** Base class for parse tree nodes that represent types. */
  public abstract static class Type extends AstNode {
    Type(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Type accept(Shuttle shuttle);
  }

  /** Parse tree for a named type (e.g. "C" or "int?"). */
  public static class NamedType extends Type {
    public final String name;

    NamedType(Pos pos, String name) {
      super(pos, Op.NAMED_TYPE);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof NamedType
              && this.name.equals(((NamedType) o).name);
    }

    @Override
    public Type accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Base class for a pattern.
   *
   * <p>For example, "C { P: 1 } c" in "e is C { P: 1 } c" is a
   * {@link RecursivePat}; "var v" in "case var v:" is a {@link VarPat}. */
  public abstract static class Pat extends AstNode {
    Pat(Pos pos, Op op, ImmutableSet<Annotation> annotations) {
      super(pos, op, annotations);
    }

    @Override
    public abstract Pat accept(Shuttle shuttle);

    /** Returns a copy of this pattern with the given annotations. */
    public abstract Pat withAnnotations(ImmutableSet<Annotation> annotations);

    /** Returns a copy of this pattern with some annotations added. */
    public Pat annotate(Annotation... annotations) {
      return withAnnotations(union(this.annotations, annotations));
    }
  }

  /** Var pattern, "var x"; binds without constraining. */
  public static class VarPat extends Pat {
    public final Designation designation;

    VarPat(Pos pos, Designation designation,
        ImmutableSet<Annotation> annotations) {
      super(pos, Op.VAR_PAT, annotations);
      this.designation = requireNonNull(designation);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, designation);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof VarPat
              && this.designation.equals(((VarPat) o).designation);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("var ").append(designation, 0, 0);
    }

    @Override
    public VarPat withAnnotations(ImmutableSet<Annotation> annotations) {
      return new VarPat(pos, designation, annotations);
    }

    /** Creates a copy of this {@code VarPat} with given contents,
     * or {@code this} if the contents are the same. */
    public VarPat copy(Designation designation) {
      return this.designation == designation
          ? this
          : new VarPat(pos, designation, annotations);
    }
  }

  /** Declaration pattern, "C c"; tests the type and binds. */
  public static class DeclarationPat extends Pat {
    public final Type type;
    public final Designation designation;

    DeclarationPat(Pos pos, Type type, Designation designation,
        ImmutableSet<Annotation> annotations) {
      super(pos, Op.DECLARATION_PAT, annotations);
      this.type = requireNonNull(type);
      this.designation = requireNonNull(designation);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, type, designation);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof DeclarationPat
              && this.type.equals(((DeclarationPat) o).type)
              && this.designation.equals(((DeclarationPat) o).designation);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(type, 0, 0).append(" ").append(designation, 0, 0);
    }

    @Override
    public DeclarationPat withAnnotations(
        ImmutableSet<Annotation> annotations) {
      return new DeclarationPat(pos, type, designation, annotations);
    }

    /** Creates a copy of this {@code DeclarationPat} with given contents,
     * or {@code this} if the contents are the same. */
    public DeclarationPat copy(Type type, Designation designation) {
      return this.type == type
          && this.designation == designation
          ? this
          : new DeclarationPat(pos, type, designation, annotations);
    }
  }

  /** Recursive pattern, "C(1, 2) { P: 1, Q: var q } c".
   *
   * <p>Every part is optional, but at least one of the positional part and
   * the property part is present. Within the property part, names are
   * unique. */
  public static class RecursivePat extends Pat {
    public final @Nullable Type type;
    public final @Nullable List<Subpattern> positional;
    public final @Nullable List<Subpattern> properties;
    public final @Nullable Designation designation;

    RecursivePat(Pos pos, @Nullable Type type,
        @Nullable ImmutableList<Subpattern> positional,
        @Nullable ImmutableList<Subpattern> properties,
        @Nullable Designation designation,
        ImmutableSet<Annotation> annotations) {
      super(pos, Op.RECURSIVE_PAT, annotations);
      this.type = type;
      this.positional = positional;
      this.properties = properties;
      this.designation = designation;
      checkArgument(positional != null || properties != null,
          "recursive pattern needs a positional or property part");
      if (properties != null) {
        final Set<String> names = new HashSet<>();
        for (Subpattern subpattern : properties) {
          checkArgument(subpattern.name != null,
              "property subpattern must have a name");
          checkArgument(names.add(subpattern.name.name),
              "duplicate subpattern name %s", subpattern.name.name);
        }
      }
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, type, positional, properties, designation);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof RecursivePat
              && Objects.equals(this.type, ((RecursivePat) o).type)
              && Objects.equals(this.positional, ((RecursivePat) o).positional)
              && Objects.equals(this.properties, ((RecursivePat) o).properties)
              && Objects.equals(this.designation,
                  ((RecursivePat) o).designation);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (type != null) {
        w.append(type, 0, 0);
      }
      if (positional != null) {
        w.append("(").appendAll(positional, ", ").append(")");
      }
      if (properties != null) {
        w.append(type != null || positional != null ? " " : "");
        if (properties.isEmpty()) {
          w.append("{ }");
        } else {
          w.append("{ ").appendAll(properties, ", ").append(" }");
        }
      }
      if (designation != null) {
        w.append(" ").append(designation, 0, 0);
      }
      return w;
    }

    @Override
    public RecursivePat withAnnotations(ImmutableSet<Annotation> annotations) {
      return new RecursivePat(pos, type, copyOpt(positional),
          copyOpt(properties), designation, annotations);
    }

    /** Returns whether the property part has a subpattern with the given
     * name. */
    public boolean hasProperty(String name) {
      return properties != null
          && anyMatch(properties, subpattern ->
              subpattern.name != null && subpattern.name.name.equals(name));
    }

    /** Returns a copy of this pattern with a different type. */
    public RecursivePat withType(@Nullable Type type) {
      return copy(type, positional, properties, designation);
    }

    /** Returns a copy of this pattern with a different designation. */
    public RecursivePat withDesignation(@Nullable Designation designation) {
      return copy(type, positional, properties, designation);
    }

    /** Returns a copy of this pattern with a subpattern appended to the
     * property part. Throws if the name is already present. */
    public RecursivePat addProperty(Subpattern subpattern) {
      final List<Subpattern> list =
          properties == null ? ImmutableList.of() : properties;
      return copy(type, positional, append(list, subpattern), designation);
    }

    /** Creates a copy of this {@code RecursivePat} with given contents,
     * or {@code this} if the contents are the same. */
    public RecursivePat copy(@Nullable Type type,
        @Nullable List<Subpattern> positional,
        @Nullable List<Subpattern> properties,
        @Nullable Designation designation) {
      return this.type == type
          && same(this.positional, positional)
          && same(this.properties, properties)
          && this.designation == designation
          ? this
          : new RecursivePat(pos, type, copyOpt(positional),
              copyOpt(properties), designation, annotations);
    }

    private static @Nullable ImmutableList<Subpattern> copyOpt(
        @Nullable List<Subpattern> list) {
      return list == null ? null : ImmutableList.copyOf(list);
    }
  }

  /** One element of the positional or property part of a recursive pattern,
   * "P: 1" or just "1". */
  public static class Subpattern extends AstNode {
    public final @Nullable Id name;
    public final Pat pat;

    Subpattern(Pos pos, @Nullable Id name, Pat pat) {
      super(pos, Op.SUBPATTERN);
      this.name = name;
      this.pat = requireNonNull(pat);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, pat);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Subpattern
              && Objects.equals(this.name, ((Subpattern) o).name)
              && this.pat.equals(((Subpattern) o).pat);
    }

    @Override
    public Subpattern accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (name != null) {
        w.append(name.name).append(": ");
      }
      return w.append(pat, 0, 0);
    }

    /** Creates a copy of this {@code Subpattern} with given contents,
     * or {@code this} if the contents are the same. */
    public Subpattern copy(@Nullable Id name, Pat pat) {
      return this.name == name
          && this.pat == pat
          ? this
          : new Subpattern(pos, name, pat);
    }
  }

  /** Constant pattern, "1" or "null". */
  public static class ConstantPat extends Pat {
    public final Exp exp;

    ConstantPat(Pos pos, Exp exp, ImmutableSet<Annotation> annotations) {
      super(pos, Op.CONSTANT_PAT, annotations);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ConstantPat
              && this.exp.equals(((ConstantPat) o).exp);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 0, 0);
    }

    @Override
    public ConstantPat withAnnotations(ImmutableSet<Annotation> annotations) {
      return new ConstantPat(pos, exp, annotations);
    }
  }

  /** Relational pattern, "&lt; 5" or "&gt;= 0". */
  public static class RelationalPat extends Pat {
    /** One of {@link Op#LT}, {@link Op#LE}, {@link Op#GT}, {@link Op#GE}. */
    public final Op operator;
    public final Exp exp;

    RelationalPat(Pos pos, Op operator, Exp exp,
        ImmutableSet<Annotation> annotations) {
      super(pos, Op.RELATIONAL_PAT, annotations);
      this.operator = requireNonNull(operator);
      this.exp = requireNonNull(exp);
      checkArgument(operator.isRelational());
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, operator, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof RelationalPat
              && this.operator == ((RelationalPat) o).operator
              && this.exp.equals(((RelationalPat) o).exp);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(operator.token()).append(" ").append(exp, 0, 0);
    }

    @Override
    public RelationalPat withAnnotations(
        ImmutableSet<Annotation> annotations) {
      return new RelationalPat(pos, operator, exp, annotations);
    }
  }

  /** Type pattern, "C"; tests the type without binding. */
  public static class TypePat extends Pat {
    public final Type type;

    TypePat(Pos pos, Type type, ImmutableSet<Annotation> annotations) {
      super(pos, Op.TYPE_PAT, annotations);
      this.type = requireNonNull(type);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, type);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TypePat
              && this.type.equals(((TypePat) o).type);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(type, 0, 0);
    }

    @Override
    public TypePat withAnnotations(ImmutableSet<Annotation> annotations) {
      return new TypePat(pos, type, annotations);
    }
  }

  /** Negated pattern, "not null". */
  public static class NotPat extends Pat {
    public final Pat pat;

    NotPat(Pos pos, Pat pat, ImmutableSet<Annotation> annotations) {
      super(pos, Op.NOT_PAT, annotations);
      this.pat = requireNonNull(pat);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, pat);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof NotPat
              && this.pat.equals(((NotPat) o).pat);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, pat, right);
    }

    @Override
    public NotPat withAnnotations(ImmutableSet<Annotation> annotations) {
      return new NotPat(pos, pat, annotations);
    }

    /** Creates a copy of this {@code NotPat} with given contents,
     * or {@code this} if the contents are the same. */
    public NotPat copy(Pat pat) {
      return this.pat == pat
          ? this
          : new NotPat(pos, pat, annotations);
    }
  }

  /** Pattern built from an infix combinator applied to two patterns,
   * "p0 and p1" or "p0 or p1". */
  public static class InfixPat extends Pat {
    public final Pat p0;
    public final Pat p1;

    InfixPat(Pos pos, Op op, Pat p0, Pat p1,
        ImmutableSet<Annotation> annotations) {
      super(pos, op, annotations);
      this.p0 = requireNonNull(p0);
      this.p1 = requireNonNull(p1);
      checkArgument(op == Op.AND_PAT || op == Op.OR_PAT);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, p0, p1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof InfixPat
              && this.op == ((InfixPat) o).op
              && this.p0.equals(((InfixPat) o).p0)
              && this.p1.equals(((InfixPat) o).p1);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, p0, op, p1, right);
    }

    @Override
    public InfixPat withAnnotations(ImmutableSet<Annotation> annotations) {
      return new InfixPat(pos, op, p0, p1, annotations);
    }

    /** Creates a copy of this {@code InfixPat} with given contents
     * and same operator,
     * or {@code this} if the contents are the same. */
    public InfixPat copy(Pat p0, Pat p1) {
      return this.p0 == p0
          && this.p1 == p1
          ? this
          : new InfixPat(pos, op, p0, p1, annotations);
    }
  }

  /** Parenthesized pattern, "(p)". */
  public static class ParenthesizedPat extends Pat {
    public final Pat pat;

    ParenthesizedPat(Pos pos, Pat pat, ImmutableSet<Annotation> annotations) {
      super(pos, Op.PARENTHESIZED_PAT, annotations);
      this.pat = requireNonNull(pat);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, pat);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ParenthesizedPat
              && this.pat.equals(((ParenthesizedPat) o).pat);
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(pat, 0, 0).append(")");
    }

    @Override
    public ParenthesizedPat withAnnotations(
        ImmutableSet<Annotation> annotations) {
      return new ParenthesizedPat(pos, pat, annotations);
    }

    /** Creates a copy of this {@code ParenthesizedPat} with given contents,
     * or {@code this} if the contents are the same. */
    public ParenthesizedPat copy(Pat pat) {
      return this.pat == pat
          ? this
          : new ParenthesizedPat(pos, pat, annotations);
    }
  }

  /** Base class for the variable designation of a pattern. */
  public abstract static class Designation extends AstNode {
    Designation(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Designation accept(Shuttle shuttle);
  }

  /** Designation of one variable, the "c" in "C c". */
  public static class SingleDesignation extends Designation {
    public final String name;

    SingleDesignation(Pos pos, String name) {
      super(pos, Op.SINGLE_DESIGNATION);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SingleDesignation
              && this.name.equals(((SingleDesignation) o).name);
    }

    @Override
    public Designation accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Designation of several variables, the "(x, y)" in "var (x, y)". */
  public static class ParenthesizedDesignation extends Designation {
    public final List<Designation> designations;

    ParenthesizedDesignation(Pos pos,
        ImmutableList<Designation> designations) {
      super(pos, Op.PARENTHESIZED_DESIGNATION);
      this.designations = requireNonNull(designations);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, designations);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ParenthesizedDesignation
              && this.designations.equals(
                  ((ParenthesizedDesignation) o).designations);
    }

    @Override
    public Designation accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").appendAll(designations, ", ").append(")");
    }

    /** Creates a copy of this {@code ParenthesizedDesignation} with given
     * contents, or {@code this} if the contents are the same. */
    public ParenthesizedDesignation copy(List<Designation> designations) {
      return same(this.designations, designations)
          ? this
          : new ParenthesizedDesignation(pos,
              ImmutableList.copyOf(designations));
    }
  }

  /** Guard of a case label or switch arm, "when c.P == 1". */
  public static class WhenClause extends AstNode {
    public final Exp condition;

    WhenClause(Pos pos, Exp condition) {
      super(pos, Op.WHEN_CLAUSE);
      this.condition = requireNonNull(condition);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, condition);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof WhenClause
              && this.condition.equals(((WhenClause) o).condition);
    }

    @Override
    public WhenClause accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("when ").append(condition, 0, 0);
    }

    /** Creates a copy of this {@code WhenClause} with given contents,
     * or {@code this} if the contents are the same. */
    public WhenClause copy(Exp condition) {
      return this.condition == condition
          ? this
          : new WhenClause(pos, condition);
    }
  }

  /** Base class for the labels of a switch section. */
  public abstract static class Label extends AstNode {
    Label(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Label accept(Shuttle shuttle);
  }

  /** Pattern label of a switch section, "case C c when c.P == 1:". */
  public static class CaseLabel extends Label {
    public final Pat pat;
    public final @Nullable WhenClause whenClause;

    CaseLabel(Pos pos, Pat pat, @Nullable WhenClause whenClause) {
      super(pos, Op.CASE_LABEL);
      this.pat = requireNonNull(pat);
      this.whenClause = whenClause;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, pat, whenClause);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof CaseLabel
              && this.pat.equals(((CaseLabel) o).pat)
              && Objects.equals(this.whenClause, ((CaseLabel) o).whenClause);
    }

    @Override
    public Label accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("case ").append(pat, 0, 0);
      if (whenClause != null) {
        w.append(" ").append(whenClause, 0, 0);
      }
      return w.append(":");
    }

    /** Creates a copy of this {@code CaseLabel} with given contents,
     * or {@code this} if the contents are the same. */
    public CaseLabel copy(Pat pat, @Nullable WhenClause whenClause) {
      return this.pat == pat
          && this.whenClause == whenClause
          ? this
          : new CaseLabel(pos, pat, whenClause);
    }
  }

  /** Default label of a switch section, "default:". */
  public static class DefaultLabel extends Label {
    DefaultLabel(Pos pos) {
      super(pos, Op.DEFAULT_LABEL);
    }

    @Override
    public int hashCode() {
      return op.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof DefaultLabel;
    }

    @Override
    public Label accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("default:");
    }
  }

  /** Arm of a switch expression, "C c when c.P == 1 =&gt; 0". */
  public static class SwitchArm extends AstNode {
    public final Pat pat;
    public final @Nullable WhenClause whenClause;
    public final Exp exp;

    SwitchArm(Pos pos, Pat pat, @Nullable WhenClause whenClause, Exp exp) {
      super(pos, Op.SWITCH_ARM);
      this.pat = requireNonNull(pat);
      this.whenClause = whenClause;
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, pat, whenClause, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SwitchArm
              && this.pat.equals(((SwitchArm) o).pat)
              && Objects.equals(this.whenClause, ((SwitchArm) o).whenClause)
              && this.exp.equals(((SwitchArm) o).exp);
    }

    @Override
    public SwitchArm accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(pat, 0, 0);
      if (whenClause != null) {
        w.append(" ").append(whenClause, 0, 0);
      }
      return w.append(" => ").append(exp, 0, 0);
    }

    /** Creates a copy of this {@code SwitchArm} with given contents,
     * or {@code this} if the contents are the same. */
    public SwitchArm copy(Pat pat, @Nullable WhenClause whenClause, Exp exp) {
      return this.pat == pat
          && this.whenClause == whenClause
          && this.exp == exp
          ? this
          : new SwitchArm(pos, pat, whenClause, exp);
    }
  }

  /** Base class for statements. */
  public abstract static class Stmt extends AstNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Stmt accept(Shuttle shuttle);
  }

  /** Switch statement, "switch (e) { case ...: ... }". */
  public static class SwitchStmt extends Stmt {
    public final Exp exp;
    public final List<SwitchSection> sections;

    SwitchStmt(Pos pos, Exp exp, ImmutableList<SwitchSection> sections) {
      super(pos, Op.SWITCH_STMT);
      this.exp = requireNonNull(exp);
      this.sections = requireNonNull(sections);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp, sections);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SwitchStmt
              && this.exp.equals(((SwitchStmt) o).exp)
              && this.sections.equals(((SwitchStmt) o).sections);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("switch (").append(exp, 0, 0).append(") {");
      for (SwitchSection section : sections) {
        w.append(" ").append(section, 0, 0);
      }
      return w.append(" }");
    }

    /** Creates a copy of this {@code SwitchStmt} with given contents,
     * or {@code this} if the contents are the same. */
    public SwitchStmt copy(Exp exp, List<SwitchSection> sections) {
      return this.exp == exp
          && same(this.sections, sections)
          ? this
          : new SwitchStmt(pos, exp, ImmutableList.copyOf(sections));
    }
  }

  /** Section of a switch statement: one or more labels, then statements. */
  public static class SwitchSection extends AstNode {
    public final List<Label> labels;
    public final List<Stmt> stmts;

    SwitchSection(Pos pos, ImmutableList<Label> labels,
        ImmutableList<Stmt> stmts) {
      super(pos, Op.SWITCH_SECTION);
      this.labels = requireNonNull(labels);
      this.stmts = requireNonNull(stmts);
      checkArgument(!labels.isEmpty(), "section must have a label");
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, labels, stmts);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SwitchSection
              && this.labels.equals(((SwitchSection) o).labels)
              && this.stmts.equals(((SwitchSection) o).stmts);
    }

    @Override
    public SwitchSection accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.appendAll(labels, " ");
      for (Stmt stmt : stmts) {
        w.append(" ").append(stmt, 0, 0);
      }
      return w;
    }

    /** Creates a copy of this {@code SwitchSection} with given contents,
     * or {@code this} if the contents are the same. */
    public SwitchSection copy(List<Label> labels, List<Stmt> stmts) {
      return same(this.labels, labels)
          && same(this.stmts, stmts)
          ? this
          : new SwitchSection(pos, ImmutableList.copyOf(labels),
              ImmutableList.copyOf(stmts));
    }
  }

  /** Expression statement, "f(x);". */
  public static class ExpStmt extends Stmt {
    public final Exp exp;

    ExpStmt(Pos pos, Exp exp) {
      super(pos, Op.EXP_STMT);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ExpStmt
              && this.exp.equals(((ExpStmt) o).exp);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 0, 0).append(";");
    }

    /** Creates a copy of this {@code ExpStmt} with given contents,
     * or {@code this} if the contents are the same. */
    public ExpStmt copy(Exp exp) {
      return this.exp == exp ? this : new ExpStmt(pos, exp);
    }
  }

  /** Return statement, "return e;" or "return;". */
  public static class Return extends Stmt {
    public final @Nullable Exp exp;

    Return(Pos pos, @Nullable Exp exp) {
      super(pos, Op.RETURN);
      this.exp = exp;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Return
              && Objects.equals(this.exp, ((Return) o).exp);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("return");
      if (exp != null) {
        w.append(" ").append(exp, 0, 0);
      }
      return w.append(";");
    }

    /** Creates a copy of this {@code Return} with given contents,
     * or {@code this} if the contents are the same. */
    public Return copy(@Nullable Exp exp) {
      return this.exp == exp ? this : new Return(pos, exp);
    }
  }

  /** Break statement, "break;". */
  public static class Break extends Stmt {
    Break(Pos pos) {
      super(pos, Op.BREAK);
    }

    @Override
    public int hashCode() {
      return op.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Break;
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("break;");
    }
  }

  /** "If" statement, "if (c) s1 else s2". */
  public static class If extends Stmt {
    public final Exp condition;
    public final Stmt ifTrue;
    public final @Nullable Stmt ifFalse;

    If(Pos pos, Exp condition, Stmt ifTrue, @Nullable Stmt ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, condition, ifTrue, ifFalse);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof If
              && this.condition.equals(((If) o).condition)
              && this.ifTrue.equals(((If) o).ifTrue)
              && Objects.equals(this.ifFalse, ((If) o).ifFalse);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("if (").append(condition, 0, 0).append(") ")
          .append(ifTrue, 0, 0);
      if (ifFalse != null) {
        w.append(" else ").append(ifFalse, 0, 0);
      }
      return w;
    }

    /** Creates a copy of this {@code If} with given contents,
     * or {@code this} if the contents are the same. */
    public If copy(Exp condition, Stmt ifTrue, @Nullable Stmt ifFalse) {
      return this.condition == condition
          && this.ifTrue == ifTrue
          && this.ifFalse == ifFalse
          ? this
          : new If(pos, condition, ifTrue, ifFalse);
    }
  }

  /** Block of statements, "{ s1 s2 }". */
  public static class Block extends Stmt {
    public final List<Stmt> stmts;

    Block(Pos pos, ImmutableList<Stmt> stmts) {
      super(pos, Op.BLOCK);
      this.stmts = requireNonNull(stmts);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, stmts);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Block
              && this.stmts.equals(((Block) o).stmts);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (stmts.isEmpty()) {
        return w.append("{ }");
      }
      w.append("{");
      for (Stmt stmt : stmts) {
        w.append(" ").append(stmt, 0, 0);
      }
      return w.append(" }");
    }

    /** Creates a copy of this {@code Block} with given contents,
     * or {@code this} if the contents are the same. */
    public Block copy(List<Stmt> stmts) {
      return same(this.stmts, stmts)
          ? this
          : new Block(pos, ImmutableList.copyOf(stmts));
    }
  }
}

// End Ast.java
