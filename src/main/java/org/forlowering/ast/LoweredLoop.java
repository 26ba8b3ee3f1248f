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
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.FormatMethod;
import org.forlowering.LoweringError;
import org.forlowering.RuntimeNames;
import org.jspecify.annotations.Nullable;

/**
 * The loop statement produced by lowering a surface loop.
 *
 * <p>A LoweredLoop repeatedly runs its body, whose first statement advances {@link #handle} and
 * stores the produced value in {@link #index}; the loop is complete when the handle has no more
 * values. The loop appears in a block with the declarations of those two symbols, the handle's
 * initialization and deferred release, and the loop's break label (see {@code LoopAssembler}).
 *
 * <p>There are exactly three kinds of LoweredLoop, one subclass for each {@link Kind}. Fields that
 * only make sense for some kinds (task intents, the synthesized flag) are only present on those
 * subclasses; a pass that needs them must use {@link #asTaskParallel} or {@link
 * #asOrderIndependent}, which fail if the loop is of a different kind.
 */
public abstract class LoweredLoop extends Stmt {

  /** The three loop kinds; later passes rely on these names and meanings. */
  public enum Kind {
    /** A {@code for} loop: iterations run one after another. */
    SEQUENTIAL("sequential"),

    /** A {@code foreach} loop: iterations may be reordered or vectorized. */
    ORDER_INDEPENDENT("order-independent"),

    /** A {@code coforall} loop: a task is spawned for each value produced by the handle. */
    TASK_PARALLEL("task-parallel");

    public final String displayName;

    Kind(String displayName) {
      this.displayName = displayName;
    }
  }

  /** How the handle of a synchronized loop was constructed. */
  public enum ZipForm {
    /** {@code zip(a, b, ...)}: one handle per operand. */
    SOURCES,

    /** {@code zip((...t))}: the tuple {@code t} supplies the operands. */
    TUPLE_SPREAD,

    /** An old-style synchronized loop over an already-built tuple. */
    LEGACY_TUPLE
  }

  /**
   * Whether the loop's handle iterates a single source or several sources in lockstep. Instances
   * are either {@link #SINGLE} or a {@link Synchronized}.
   */
  public abstract static class Sourcing {
    private Sourcing() {}

    /** The Sourcing of every loop over a single iterable. */
    public static final Sourcing SINGLE = new Single();

    public abstract boolean isSynchronized();

    /** Returns this as a Synchronized; fails if the loop iterates a single source. */
    public Synchronized asSynchronized() {
      throw LoweringError.misuse("%s is not a synchronized loop sourcing", this);
    }

    private static final class Single extends Sourcing {
      @Override
      public boolean isSynchronized() {
        return false;
      }

      @Override
      public String toString() {
        return "single";
      }
    }
  }

  /**
   * The sourcing of a loop that iterates several sources in lockstep; the handle is a tuple with
   * one element handle per source, and each produced value is a tuple with one element per source.
   */
  public static final class Synchronized extends Sourcing {
    /** The value of {@link #arity} when the number of sources is not known statically. */
    public static final int UNKNOWN_ARITY = -1;

    public final ZipForm form;

    /** The number of sources, or {@link #UNKNOWN_ARITY}. */
    public final int arity;

    public Synchronized(ZipForm form, int arity) {
      Preconditions.checkArgument(arity > 0 || arity == UNKNOWN_ARITY);
      this.form = Preconditions.checkNotNull(form);
      this.arity = arity;
    }

    @Override
    public boolean isSynchronized() {
      return true;
    }

    @Override
    public Synchronized asSynchronized() {
      return this;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Synchronized s && s.form == form && s.arity == arity;
    }

    @Override
    public int hashCode() {
      return form.hashCode() * 31 + arity;
    }

    @Override
    public String toString() {
      String n = (arity == UNKNOWN_ARITY) ? "?" : String.valueOf(arity);
      return form.name().toLowerCase() + "/" + n;
    }
  }

  /** The fields shared by all loop kinds. */
  public record Header(
      Symbol index,
      Symbol handle,
      Sourcing sourcing,
      Label continueLabel,
      Label breakLabel,
      @Nullable String userLabel,
      ImmutableList<LoopAttribute> attributes,
      boolean isForExpression) {}

  private final Header header;

  /**
   * The fetch of the next value, the index destructuring, the user's loop body, and the continue
   * label, in that order.
   */
  private final ImmutableList<Stmt> body;

  private LoweredLoop(Header header, ImmutableList<Stmt> body) {
    this.header = Preconditions.checkNotNull(header);
    this.body = body;
  }

  public abstract Kind kind();

  /** The temporary that receives each value produced by {@link #handle}. */
  public Symbol index() {
    return header.index();
  }

  /** The iteration handle (a tuple of handles if the loop is synchronized). */
  public Symbol handle() {
    return header.handle();
  }

  public Sourcing sourcing() {
    return header.sourcing();
  }

  public boolean isSynchronized() {
    return header.sourcing().isSynchronized();
  }

  /** Branching here starts the next iteration. */
  public Label continueLabel() {
    return header.continueLabel();
  }

  /** Branching here exits the loop; defined immediately after the loop. */
  public Label breakLabel() {
    return header.breakLabel();
  }

  /** The label the user gave this loop, or null. */
  public @Nullable String userLabel() {
    return header.userLabel();
  }

  public ImmutableList<LoopAttribute> attributes() {
    return header.attributes();
  }

  /** True if this loop is the lowering of a loop expression rather than a loop statement. */
  public boolean isForExpression() {
    return header.isForExpression();
  }

  public ImmutableList<Stmt> body() {
    return body;
  }

  /** The statement that advances the handle; always the first statement of the body. */
  public Stmt.Move fetch() {
    return (Stmt.Move) body.get(0);
  }

  public boolean isOrderIndependent() {
    return kind() == Kind.ORDER_INDEPENDENT;
  }

  public boolean isTaskParallel() {
    return kind() == Kind.TASK_PARALLEL;
  }

  /**
   * True if this loop was produced by lowering a higher-level parallel construct rather than
   * written directly by the user; diagnostics about it should refer to that construct.
   */
  public boolean isSynthesized() {
    return false;
  }

  /** Returns true if {@code symbol} is this loop's index of interest. */
  public boolean isInductionVariable(Symbol symbol) {
    return symbol == header.index();
  }

  /** Returns this loop as a TaskParallel; fails if it is some other kind. */
  public TaskParallel asTaskParallel() {
    throw LoweringError.misuse("%s loop has no task-parallel fields", kind().displayName);
  }

  /** Returns this loop as an OrderIndependent; fails if it is some other kind. */
  public OrderIndependent asOrderIndependent() {
    throw LoweringError.misuse("%s loop has no order-independent fields", kind().displayName);
  }

  /** Returns the task intents for this loop's kind, or an empty list if it has none. */
  public ImmutableList<TaskIntent> taskIntents() {
    return ImmutableList.of();
  }

  /**
   * Checks the structural invariants of a lowered loop, throwing a {@link LoweringError} if any
   * fails.
   */
  public void verify() {
    if (body.size() < 2) {
      throw verifyError("body is missing its fetch or continue label");
    }
    if (!(body.get(0) instanceof Stmt.Move move)
        || move.target != header.index()
        || !move.value.equals(Expr.call(RuntimeNames.ITERATOR_INDEX, Expr.ref(header.handle())))) {
      throw verifyError("first statement is not the fetch of %s", header.index());
    }
    if (!(Iterables.getLast(body) instanceof Stmt.LabelDef def)
        || def.label != header.continueLabel()) {
      throw verifyError("last statement is not the continue label %s", header.continueLabel());
    }
    if (!header.index().hasFlag(Symbol.Flag.INDEX_OF_INTEREST)) {
      throw verifyError("index %s is not flagged INDEX_OF_INTEREST", header.index());
    }
    if (!header.handle().hasFlag(Symbol.Flag.EXPR_TEMP)) {
      throw verifyError("handle %s is not flagged EXPR_TEMP", header.handle());
    }
    if (header.index().hasFlag(Symbol.Flag.TASK_PARALLEL_INDEX) != isTaskParallel()) {
      throw verifyError("TASK_PARALLEL_INDEX flag on %s doesn't match kind", header.index());
    }
  }

  @FormatMethod
  private LoweringError verifyError(String fmt, Object... fmtArgs) {
    return LoweringError.contractViolation(
        "LoweredLoop.verify (%s loop over %s): %s",
        kind().displayName, header.handle(), String.format(fmt, fmtArgs));
  }

  /** A sequential loop. */
  public static final class Sequential extends LoweredLoop {
    public Sequential(Header header, ImmutableList<Stmt> body) {
      super(header, body);
    }

    @Override
    public Kind kind() {
      return Kind.SEQUENTIAL;
    }
  }

  /** A loop whose iterations may run in any order. */
  public static final class OrderIndependent extends LoweredLoop {
    private final boolean synthesized;
    private final ImmutableList<TaskIntent> intents;

    public OrderIndependent(
        Header header,
        ImmutableList<Stmt> body,
        boolean synthesized,
        ImmutableList<TaskIntent> intents) {
      super(header, body);
      this.synthesized = synthesized;
      this.intents = intents;
    }

    @Override
    public Kind kind() {
      return Kind.ORDER_INDEPENDENT;
    }

    @Override
    public boolean isSynthesized() {
      return synthesized;
    }

    @Override
    public OrderIndependent asOrderIndependent() {
      return this;
    }

    @Override
    public ImmutableList<TaskIntent> taskIntents() {
      return intents;
    }
  }

  /** A loop that spawns a task for each value produced by its handle. */
  public static final class TaskParallel extends LoweredLoop {
    private final ImmutableList<TaskIntent> intents;

    public TaskParallel(
        Header header, ImmutableList<Stmt> body, ImmutableList<TaskIntent> intents) {
      super(header, body);
      this.intents = intents;
    }

    @Override
    public Kind kind() {
      return Kind.TASK_PARALLEL;
    }

    @Override
    public TaskParallel asTaskParallel() {
      return this;
    }

    @Override
    public ImmutableList<TaskIntent> taskIntents() {
      return intents;
    }
  }
}
