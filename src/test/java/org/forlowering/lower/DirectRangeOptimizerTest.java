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

import static com.google.common.truth.Truth.assertThat;
import static org.forlowering.RuntimeNames.ALIGN;
import static org.forlowering.RuntimeNames.BUILD_BOUNDED_RANGE;
import static org.forlowering.RuntimeNames.BUILD_HIGH_BOUNDED_RANGE;
import static org.forlowering.RuntimeNames.BUILD_LOW_BOUNDED_RANGE;
import static org.forlowering.RuntimeNames.BUILD_UNBOUNDED_RANGE;
import static org.forlowering.RuntimeNames.BY;
import static org.forlowering.RuntimeNames.COUNT;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.forlowering.ast.Expr;
import org.forlowering.lower.DirectRangeOptimizer.Shape;
import org.forlowering.lower.DirectRangeOptimizer.SimpleRange;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class DirectRangeOptimizerTest {

  private static final Expr LO = Expr.name("lo");
  private static final Expr HI = Expr.name("hi");

  private static Expr bounded(Expr lo, Expr hi) {
    return Expr.call(BUILD_BOUNDED_RANGE, lo, hi);
  }

  private static Expr lowBounded(Expr lo) {
    return Expr.call(BUILD_LOW_BOUNDED_RANGE, lo);
  }

  private final DirectRangeOptimizer optimizer = new DirectRangeOptimizer(LoweringOptions.DEFAULT);

  @Test
  public void fullyBounded() {
    Expr range = bounded(LO, HI);
    SimpleRange simple = DirectRangeOptimizer.classify(range);
    assertThat(simple.shape()).isEqualTo(Shape.FULLY_BOUNDED_UNSTRIDED);
    assertThat(simple.stride()).isNull();
    assertThat(optimizer.tryOptimize(range).toString()).isEqualTo("directRangeIter(lo, hi)");
  }

  @Test
  public void fullyBoundedStrided() {
    Expr range = Expr.call(BY, bounded(Expr.of(1), HI), Expr.of(-2));
    assertThat(DirectRangeOptimizer.classify(range).shape()).isEqualTo(Shape.FULLY_BOUNDED_STRIDED);
    assertThat(optimizer.tryOptimize(range).toString())
        .isEqualTo("directStridedRangeIter(1, hi, -2)");
  }

  @Test
  public void lowBoundedCounted() {
    Expr range = Expr.call(COUNT, lowBounded(LO), Expr.name("n"));
    SimpleRange simple = DirectRangeOptimizer.classify(range);
    assertThat(simple.shape()).isEqualTo(Shape.LOW_BOUNDED_COUNTED);
    assertThat(simple.high()).isNull();
    assertThat(simple.count()).isEqualTo(Expr.name("n"));
    assertThat(optimizer.tryOptimize(range).toString()).isEqualTo("directCountedRangeIter(lo, n)");
  }

  /** Iterables that must be returned unchanged. */
  enum NotSimple {
    NAMED_RANGE(Expr.name("r")),
    CONSTANT(Expr.of(7)),
    STRIDED_NAMED_RANGE(Expr.call(BY, Expr.name("r"), Expr.of(2))),
    DOUBLE_BY(Expr.call(BY, Expr.call(BY, bounded(LO, HI), Expr.of(2)), Expr.of(3))),
    ALIGNED(Expr.call(ALIGN, bounded(LO, HI), Expr.of(1))),
    STRIDED_ALIGNED(Expr.call(BY, Expr.call(ALIGN, bounded(LO, HI), Expr.of(1)), Expr.of(2))),
    BOUNDED_COUNTED(Expr.call(COUNT, bounded(LO, HI), Expr.of(3))),
    COUNTED_STRIDED(Expr.call(BY, Expr.call(COUNT, lowBounded(LO), Expr.of(3)), Expr.of(2))),
    LOW_BOUNDED(lowBounded(LO)),
    LOW_BOUNDED_STRIDED(Expr.call(BY, lowBounded(LO), Expr.of(2))),
    HIGH_BOUNDED(Expr.call(BUILD_HIGH_BOUNDED_RANGE, HI)),
    HIGH_BOUNDED_COUNTED(Expr.call(COUNT, Expr.call(BUILD_HIGH_BOUNDED_RANGE, HI), Expr.of(3))),
    UNBOUNDED(Expr.call(BUILD_UNBOUNDED_RANGE)),
    WRONG_ARITY(Expr.call(BUILD_BOUNDED_RANGE, LO)),
    BY_WRONG_ARITY(Expr.call(BY, bounded(LO, HI))),
    OTHER_CALL(Expr.call("range", LO, HI));

    final Expr iterable;

    NotSimple(Expr iterable) {
      this.iterable = iterable;
    }
  }

  @Test
  public void notSimple(@TestParameter NotSimple notSimple) {
    assertThat(DirectRangeOptimizer.classify(notSimple.iterable)).isNull();
    assertThat(optimizer.tryOptimize(notSimple.iterable)).isSameInstanceAs(notSimple.iterable);
  }

  enum Simple {
    UNSTRIDED(bounded(LO, HI)),
    STRIDED(Expr.call(BY, bounded(LO, HI), Expr.name("s"))),
    COUNTED(Expr.call(COUNT, lowBounded(Expr.of(0)), Expr.of(10)));

    final Expr iterable;

    Simple(Expr iterable) {
      this.iterable = iterable;
    }
  }

  @Test
  public void idempotent(@TestParameter Simple simple) {
    Expr once = optimizer.tryOptimize(simple.iterable);
    assertThat(once).isNotEqualTo(simple.iterable);
    assertThat(optimizer.tryOptimize(once)).isSameInstanceAs(once);
  }

  @Test
  public void disabled(@TestParameter Simple simple) {
    DirectRangeOptimizer disabled =
        new DirectRangeOptimizer(LoweringOptions.DEFAULT.withOptimizeRangeIteration(false));
    assertThat(disabled.tryOptimize(simple.iterable)).isSameInstanceAs(simple.iterable);
    // classify() doesn't look at the options
    assertThat(DirectRangeOptimizer.classify(simple.iterable)).isNotNull();
  }

  @Test
  public void doesNotModifyInput() {
    Expr range = Expr.call(BY, bounded(LO, HI), Expr.of(2));
    String before = range.toString();
    optimizer.tryOptimize(range);
    assertThat(range.toString()).isEqualTo(before);
  }
}
