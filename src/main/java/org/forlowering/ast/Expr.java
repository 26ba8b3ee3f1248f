/*
 * Copyright 2025 The Forlowering Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.forlowering.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable expression tree.
 *
 * <p>Exprs are values: two Exprs with the same structure are equal (except that {@link Ref}s
 * compare their symbols by identity). Since they are never mutated, an Expr can appear at more
 * than one place in a tree, and a transformation that wants to change a subexpression returns a
 * new Expr rather than editing its parent.
 */
public abstract class Expr {

  // Subclasses are the nested classes below.
  private Expr() {}

  public static Const of(long value) {
    return new Const(value);
  }

  public static Name name(String name) {
    return new Name(name);
  }

  public static Ref ref(Symbol symbol) {
    return new Ref(symbol);
  }

  public static Call call(String name, Expr... args) {
    return new Call(name, ImmutableList.copyOf(args));
  }

  public static Call call(String name, ImmutableList<Expr> args) {
    return new Call(name, args);
  }

  public static Prim prim(Primitive primitive, Expr... args) {
    return new Prim(primitive, ImmutableList.copyOf(args));
  }

  public static Element element(Expr tuple, int position) {
    return new Element(tuple, position);
  }

  /** Returns true if this is a {@link Call} to a function with the given name. */
  public boolean isCall(String name) {
    return false;
  }

  /** Returns true if this is a {@link Prim} with the given primitive. */
  public boolean isPrim(Primitive primitive) {
    return false;
  }

  /** An integer constant. */
  public static final class Const extends Expr {
    public final long value;

    Const(long value) {
      this.value = value;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Const c && c.value == value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /**
   * A reference to a name that has not been resolved to a Symbol yet, e.g. a user variable or a
   * previously-declared range.
   */
  public static final class Name extends Expr {
    public final String name;

    Name(String name) {
      Preconditions.checkArgument(!name.isEmpty());
      this.name = name;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Name n && n.name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A reference to a Symbol created by lowering. */
  public static final class Ref extends Expr {
    public final Symbol symbol;

    Ref(Symbol symbol) {
      this.symbol = Preconditions.checkNotNull(symbol);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Ref r && r.symbol == symbol;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(symbol);
    }

    @Override
    public String toString() {
      return symbol.toString();
    }
  }

  /**
   * A call to a function identified by name. Operators, range builders, and the iteration protocol
   * runtime are all represented as Calls.
   */
  public static final class Call extends Expr {
    public final String name;
    public final ImmutableList<Expr> args;

    Call(String name, ImmutableList<Expr> args) {
      Preconditions.checkArgument(!name.isEmpty());
      this.name = name;
      this.args = args;
    }

    public Expr arg(int i) {
      return args.get(i);
    }

    public int numArgs() {
      return args.size();
    }

    @Override
    public boolean isCall(String name) {
      return this.name.equals(name);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Call c && c.name.equals(name) && c.args.equals(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override
    public String toString() {
      return args.stream().map(Expr::toString).collect(Collectors.joining(", ", name + "(", ")"));
    }
  }

  /** The language primitives that can appear in an unlowered iterable expression. */
  public enum Primitive {
    /** {@code zip(a, b, ...)}: iterate the operands in lockstep. */
    ZIP,

    /** {@code (...t)}: spread the elements of a tuple as separate operands. */
    TUPLE_EXPAND
  }

  /** An application of a language primitive. */
  public static final class Prim extends Expr {
    public final Primitive primitive;
    public final ImmutableList<Expr> args;

    Prim(Primitive primitive, ImmutableList<Expr> args) {
      this.primitive = Preconditions.checkNotNull(primitive);
      this.args = args;
    }

    @Override
    public boolean isPrim(Primitive primitive) {
      return this.primitive == primitive;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Prim p && p.primitive == primitive && p.args.equals(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(primitive, args);
    }

    @Override
    public String toString() {
      String joined = args.stream().map(Expr::toString).collect(Collectors.joining(", "));
      return (primitive == Primitive.ZIP) ? "zip(" + joined + ")" : "(..." + joined + ")";
    }
  }

  /** The element at a (zero-based) position of a tuple-valued expression. */
  public static final class Element extends Expr {
    public final Expr tuple;
    public final int position;

    Element(Expr tuple, int position) {
      Preconditions.checkArgument(position >= 0);
      this.tuple = Preconditions.checkNotNull(tuple);
      this.position = position;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Element e && e.position == position && e.tuple.equals(tuple);
    }

    @Override
    public int hashCode() {
      return 31 * tuple.hashCode() + position;
    }

    @Override
    public String toString() {
      return tuple + "[" + position + "]";
    }
  }
}
