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

import static org.forlowering.RuntimeNames.BUILD_BOUNDED_RANGE;
import static org.forlowering.RuntimeNames.BUILD_LOW_BOUNDED_RANGE;
import static org.forlowering.RuntimeNames.BY;
import static org.forlowering.RuntimeNames.COUNT;
import static org.forlowering.RuntimeNames.DIRECT_COUNTED_RANGE_ITER;
import static org.forlowering.RuntimeNames.DIRECT_RANGE_ITER;
import static org.forlowering.RuntimeNames.DIRECT_STRIDED_RANGE_ITER;

import com.google.common.flogger.FluentLogger;
import org.forlowering.ast.Expr;
import org.jspecify.annotations.Nullable;

/**
 * Replaces iteration over simple anonymous ranges with calls to direct iterators that take the
 * bounds (and stride or count) as arguments, avoiding the construction of a range value that would
 * only be iterated once.
 *
 * <p>Only three shapes are recognized:
 *
 * <ul>
 *   <li>{@code lo..hi}, which becomes {@code directRangeIter(lo, hi)};
 *   <li>{@code lo..hi by stride}, which becomes {@code directStridedRangeIter(lo, hi, stride)};
 *   <li>{@code lo..#count}, which becomes {@code directCountedRangeIter(lo, count)}.
 * </ul>
 *
 * <p>Everything else is returned unchanged, including unbounded ranges, {@code align}, more than
 * one {@code by}, a counted range that is also strided or bounded, and references to a range
 * stored in a variable. Recognition depends on the names of the range builder functions, so if an
 * earlier transformation has changed the expression into some other shape the optimizer just
 * declines.
 *
 * <p>The optimizer is a pure function of its argument and the options; callers substitute the
 * result where the argument was.
 */
public final class DirectRangeOptimizer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The three range shapes with a direct iterator. */
  public enum Shape {
    /** {@code lo..hi} */
    FULLY_BOUNDED_UNSTRIDED,

    /** {@code lo..hi by stride} */
    FULLY_BOUNDED_STRIDED,

    /** {@code lo..#count} */
    LOW_BOUNDED_COUNTED
  }

  /**
   * A range expression that matched one of the recognized shapes, with the subexpressions needed
   * to build its direct iterator. {@code high}, {@code stride} and {@code count} are non-null
   * exactly when the shape uses them.
   */
  public record SimpleRange(
      Shape shape,
      Expr low,
      @Nullable Expr high,
      @Nullable Expr stride,
      @Nullable Expr count) {

    /** Returns the call to the direct iterator for this range. */
    public Expr toDirectIterator() {
      return switch (shape) {
        case FULLY_BOUNDED_UNSTRIDED -> Expr.call(DIRECT_RANGE_ITER, low, high);
        case FULLY_BOUNDED_STRIDED -> Expr.call(DIRECT_STRIDED_RANGE_ITER, low, high, stride);
        case LOW_BOUNDED_COUNTED -> Expr.call(DIRECT_COUNTED_RANGE_ITER, low, count);
      };
    }
  }

  private final LoweringOptions options;

  public DirectRangeOptimizer(LoweringOptions options) {
    this.options = options;
  }

  /**
   * If {@code iterable} is one of the simple range shapes (and the optimization has not been
   * disabled) returns the equivalent direct iterator call; otherwise returns {@code iterable}.
   */
  public Expr tryOptimize(Expr iterable) {
    if (!options.optimizeRangeIteration) {
      return iterable;
    }
    SimpleRange range = classify(iterable);
    if (range == null) {
      return iterable;
    }
    Expr result = range.toDirectIterator();
    logger.atFine().log("Replacing range iteration over %s with %s", iterable, result);
    return result;
  }

  /**
   * Returns a SimpleRange describing {@code iterable} if it is one of the recognized shapes,
   * otherwise null. Does not check whether the optimization is enabled.
   */
  public static @Nullable SimpleRange classify(Expr iterable) {
    if (!(iterable instanceof Expr.Call call)) {
      return null;
    }
    Expr range;
    Expr stride = null;
    Expr count = null;
    if (call.isCall(BY) && call.numArgs() == 2) {
      range = call.arg(0);
      stride = call.arg(1);
    } else if (call.isCall(COUNT) && call.numArgs() == 2) {
      range = call.arg(0);
      count = call.arg(1);
    } else {
      range = call;
    }
    // The (inner) range must be a call to one of the range builders; anything else (a variable,
    // a nested "by", an "align", ...) isn't something we recognize.
    if (!(range instanceof Expr.Call builder)) {
      return null;
    }
    boolean fullyBounded = builder.isCall(BUILD_BOUNDED_RANGE) && builder.numArgs() == 2;
    boolean lowBounded = builder.isCall(BUILD_LOW_BOUNDED_RANGE) && builder.numArgs() == 1;
    if (fullyBounded && count == null) {
      Expr low = builder.arg(0);
      Expr high = builder.arg(1);
      return (stride == null)
          ? new SimpleRange(Shape.FULLY_BOUNDED_UNSTRIDED, low, high, null, null)
          : new SimpleRange(Shape.FULLY_BOUNDED_STRIDED, low, high, stride, null);
    } else if (lowBounded && count != null && stride == null) {
      return new SimpleRange(Shape.LOW_BOUNDED_COUNTED, builder.arg(0), null, null, count);
    }
    return null;
  }
}
