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

package org.forlowering.lower;

import static org.forlowering.RuntimeNames.FREE_ITERATOR;
import static org.forlowering.RuntimeNames.GET_ITERATOR;
import static org.forlowering.RuntimeNames.GET_ITERATOR_ZIP;
import static org.forlowering.RuntimeNames.ITERATOR_INDEX;

import org.forlowering.ast.Expr;
import org.forlowering.ast.Stmt;
import org.forlowering.ast.Symbol;

/**
 * Emits the calls of the iteration protocol: acquiring a handle from an iterable, advancing the
 * handle to produce the next value, and releasing the handle.
 *
 * <p>The emitter only builds statements; it is up to {@link LoopAssembler} to place the release
 * where it will run on every exit from the loop, and the fetch where it will run once per
 * iteration.
 */
public final class IterationProtocol {

  /** The name of the temporary that holds an iteration handle. */
  public static final String HANDLE_NAME = "_iterator";

  /** A new handle symbol and the statement that initializes it. */
  public record Acquisition(Symbol handle, Stmt.Move init) {}

  private final LoweringContext cx;

  IterationProtocol(LoweringContext cx) {
    this.cx = cx;
  }

  /**
   * Returns a new handle initialized from {@code iterable}, i.e. {@code handle =
   * getIterator(iterable)}.
   */
  public Acquisition emit(Expr iterable) {
    return bind(acquire(iterable));
  }

  /**
   * Returns a new handle initialized by {@code acquisition}, which must already be an expression
   * that returns a handle (or a tuple of handles).
   */
  public Acquisition bind(Expr acquisition) {
    Symbol handle = cx.newTemp(HANDLE_NAME, Symbol.Flag.EXPR_TEMP);
    return new Acquisition(handle, new Stmt.Move(handle, acquisition));
  }

  /** Returns {@code getIterator(iterable)}. */
  static Expr acquire(Expr iterable) {
    return Expr.call(GET_ITERATOR, iterable);
  }

  /** Returns {@code getIteratorZip(tuple)}. */
  static Expr acquireSynchronized(Expr tuple) {
    return Expr.call(GET_ITERATOR_ZIP, tuple);
  }

  /** Returns {@code index = iteratorIndex(handle)}. */
  public static Stmt.Move fetch(Symbol index, Symbol handle) {
    return new Stmt.Move(index, Expr.call(ITERATOR_INDEX, Expr.ref(handle)));
  }

  /** Returns {@code freeIterator(handle)}. */
  public static Stmt release(Symbol handle) {
    return new Stmt.Eval(Expr.call(FREE_ITERATOR, Expr.ref(handle)));
  }
}
