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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A statement. Like {@link Expr}s, Stmts are immutable once constructed (the flags on the {@link
 * Symbol}s they define are the only exception).
 *
 * <p>{@link #toString} returns the multi-line form produced by {@link AstPrinter}.
 */
public abstract class Stmt {

  // Subclasses are the nested classes below and LoweredLoop.
  Stmt() {}

  @Override
  public String toString() {
    return AstPrinter.print(this);
  }

  /** Declares a Symbol. */
  public static final class Def extends Stmt {
    public final Symbol symbol;

    public Def(Symbol symbol) {
      this.symbol = Preconditions.checkNotNull(symbol);
    }
  }

  /** Stores the value of an expression into a Symbol. */
  public static final class Move extends Stmt {
    public final Symbol target;
    public final Expr value;

    public Move(Symbol target, Expr value) {
      this.target = Preconditions.checkNotNull(target);
      this.value = Preconditions.checkNotNull(value);
    }
  }

  /** Assigns to a user variable that has not been resolved to a Symbol. */
  public static final class Assign extends Stmt {
    public final String name;
    public final Expr value;

    public Assign(String name, Expr value) {
      this.name = name;
      this.value = Preconditions.checkNotNull(value);
    }
  }

  /** Evaluates an expression for its side effects. */
  public static final class Eval extends Stmt {
    public final Expr expr;

    public Eval(Expr expr) {
      this.expr = Preconditions.checkNotNull(expr);
    }
  }

  /**
   * Schedules {@code action} to run when control leaves the enclosing {@link Block}, however it
   * leaves (falling off the end, a branch to a label outside the block, a return, or a propagated
   * failure). Deferred actions run in the reverse of the order in which they were reached.
   */
  public static final class Defer extends Stmt {
    public final Stmt action;

    public Defer(Stmt action) {
      this.action = Preconditions.checkNotNull(action);
    }
  }

  /** Marks the position of a {@link Label}. */
  public static final class LabelDef extends Stmt {
    public final Label label;

    public LabelDef(Label label) {
      this.label = Preconditions.checkNotNull(label);
    }
  }

  /** A sequence of statements that forms a scope for declarations and deferred actions. */
  public static final class Block extends Stmt {
    public final ImmutableList<Stmt> stmts;

    public Block(List<? extends Stmt> stmts) {
      this.stmts = ImmutableList.copyOf(stmts);
    }

    public static Block of(Stmt... stmts) {
      return new Block(ImmutableList.copyOf(stmts));
    }

    public static Block empty() {
      return new Block(ImmutableList.of());
    }

    public boolean isEmpty() {
      return stmts.isEmpty();
    }

    public Stmt get(int i) {
      return stmts.get(i);
    }

    public int size() {
      return stmts.size();
    }
  }

  /**
   * Exits the innermost enclosing loop, or the enclosing loop with the given user label if {@code
   * userLabel} is non-null.
   */
  public static final class Break extends Stmt {
    public final @Nullable String userLabel;

    public Break(@Nullable String userLabel) {
      this.userLabel = userLabel;
    }
  }

  /** Skips to the next iteration of the innermost (or labeled) enclosing loop. */
  public static final class Continue extends Stmt {
    public final @Nullable String userLabel;

    public Continue(@Nullable String userLabel) {
      this.userLabel = userLabel;
    }
  }

  /** Returns from the enclosing routine, with an optional value. */
  public static final class Return extends Stmt {
    public final @Nullable Expr value;

    public Return(@Nullable Expr value) {
      this.value = value;
    }
  }

  /** Raises a failure that propagates out of all enclosing blocks. */
  public static final class Throw extends Stmt {
    public final Expr value;

    public Throw(Expr value) {
      this.value = Preconditions.checkNotNull(value);
    }
  }

  /** A conditional; {@code otherwise} is empty if there was no else branch. */
  public static final class If extends Stmt {
    public final Expr condition;
    public final Block then;
    public final Block otherwise;

    public If(Expr condition, Block then, Block otherwise) {
      this.condition = Preconditions.checkNotNull(condition);
      this.then = Preconditions.checkNotNull(then);
      this.otherwise = Preconditions.checkNotNull(otherwise);
    }
  }
}
