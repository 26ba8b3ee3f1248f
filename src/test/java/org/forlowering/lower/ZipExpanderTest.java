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
import static org.forlowering.RuntimeNames.BUILD_BOUNDED_RANGE;
import static org.forlowering.RuntimeNames.BUILD_TUPLE;
import static org.junit.Assert.assertThrows;

import org.forlowering.LoweringError;
import org.forlowering.ast.Expr;
import org.forlowering.ast.LoweredLoop.Synchronized;
import org.forlowering.ast.LoweredLoop.ZipForm;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ZipExpanderTest {

  private final ZipExpander expander =
      new ZipExpander(new DirectRangeOptimizer(LoweringOptions.DEFAULT));

  private static Expr.Prim zip(Expr... sources) {
    return Expr.prim(Expr.Primitive.ZIP, sources);
  }

  @Test
  public void sourcesInOrder() {
    ZipExpander.Expansion expansion = expander.expand(zip(Expr.name("a"), Expr.name("b")));
    assertThat(expansion.acquisition().toString())
        .isEqualTo("buildTuple(getIterator(a), getIterator(b))");
    assertThat(expansion.sourcing()).isEqualTo(new Synchronized(ZipForm.SOURCES, 2));
  }

  @Test
  public void eachSourceIsOptimized() {
    Expr range = Expr.call(BUILD_BOUNDED_RANGE, Expr.of(1), Expr.name("n"));
    ZipExpander.Expansion expansion =
        expander.expand(zip(Expr.name("xs"), range, Expr.name("ys")));
    assertThat(expansion.acquisition().toString())
        .isEqualTo(
            "buildTuple(getIterator(xs), getIterator(directRangeIter(1, n)), getIterator(ys))");
    assertThat(expansion.sourcing().arity).isEqualTo(3);
  }

  @Test
  public void singleSource() {
    ZipExpander.Expansion expansion = expander.expand(zip(Expr.name("a")));
    assertThat(expansion.acquisition().toString()).isEqualTo("getIterator(a)");
    assertThat(expansion.sourcing()).isEqualTo(new Synchronized(ZipForm.SOURCES, 1));
  }

  @Test
  public void tupleSpreadIsNotWrapped() {
    Expr spread = Expr.prim(Expr.Primitive.TUPLE_EXPAND, Expr.name("t"));
    ZipExpander.Expansion expansion = expander.expand(zip(spread));
    assertThat(expansion.acquisition()).isEqualTo(Expr.call("getIteratorZip", Expr.name("t")));
    assertThat(expansion.sourcing().form).isEqualTo(ZipForm.TUPLE_SPREAD);
    assertThat(expansion.sourcing().arity).isEqualTo(Synchronized.UNKNOWN_ARITY);
  }

  @Test
  public void tupleSpreadIsNotOptimized() {
    Expr range = Expr.call(BUILD_BOUNDED_RANGE, Expr.of(1), Expr.name("n"));
    Expr spread = Expr.prim(Expr.Primitive.TUPLE_EXPAND, range);
    assertThat(expander.expand(zip(spread)).acquisition().toString())
        .isEqualTo("getIteratorZip(buildBoundedRange(1, n))");
  }

  @Test
  public void emptyZip() {
    LoweringError e = assertThrows(LoweringError.class, () -> expander.expand(zip()));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.CONTRACT_VIOLATION);
  }

  @Test
  public void malformedSpread() {
    Expr spread = Expr.prim(Expr.Primitive.TUPLE_EXPAND, Expr.name("t"), Expr.name("u"));
    LoweringError e = assertThrows(LoweringError.class, () -> expander.expand(zip(spread)));
    assertThat(e).hasMessageThat().contains("malformed tuple expansion");
  }

  @Test
  public void spreadAmongOtherSources() {
    Expr spread = Expr.prim(Expr.Primitive.TUPLE_EXPAND, Expr.name("t"));
    LoweringError e =
        assertThrows(LoweringError.class, () -> expander.expand(zip(Expr.name("a"), spread)));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.CONTRACT_VIOLATION);
    assertThat(e).hasMessageThat().contains("must be the only source");
  }

  @Test
  public void notAZip() {
    Expr.Prim spread = Expr.prim(Expr.Primitive.TUPLE_EXPAND, Expr.name("t"));
    assertThrows(LoweringError.class, () -> expander.expand(spread));
  }

  @Test
  public void legacyTupleCall() {
    Expr tuple =
        Expr.call(
            BUILD_TUPLE, Expr.name("xs"), Expr.call(BUILD_BOUNDED_RANGE, Expr.of(0), Expr.of(9)));
    ZipExpander.Expansion expansion = expander.expandLegacy(tuple);
    assertThat(expansion.acquisition().toString())
        .isEqualTo("getIteratorZip(buildTuple(xs, directRangeIter(0, 9)))");
    assertThat(expansion.sourcing()).isEqualTo(new Synchronized(ZipForm.LEGACY_TUPLE, 2));
  }

  @Test
  public void legacyOtherExpression() {
    ZipExpander.Expansion expansion = expander.expandLegacy(Expr.name("t"));
    assertThat(expansion.acquisition().toString()).isEqualTo("getIteratorZip(t)");
    assertThat(expansion.sourcing().arity).isEqualTo(Synchronized.UNKNOWN_ARITY);
  }

  @Test
  public void legacyEmptyTuple() {
    assertThrows(LoweringError.class, () -> expander.expandLegacy(Expr.call(BUILD_TUPLE)));
  }
}
