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
import static org.forlowering.RuntimeNames.CHECK_TUPLE_SIZE;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.forlowering.LoweringError;
import org.forlowering.ast.Expr;
import org.forlowering.ast.IndexPattern;
import org.forlowering.ast.LoopAttribute;
import org.forlowering.ast.LoweredLoop;
import org.forlowering.ast.Stmt;
import org.forlowering.ast.Symbol;
import org.forlowering.ast.TaskIntent;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LoopAssemblerTest {

  private final LoopAssembler assembler = new LoopAssembler(LoweringOptions.DEFAULT);

  private static final Stmt EMIT_I = new Stmt.Eval(Expr.call("emit", Expr.name("i")));

  private static LoweredLoop loopOf(Stmt.Block block) {
    return (LoweredLoop) block.get(4);
  }

  @Test
  public void blockShape() {
    Stmt.Block block =
        assembler.buildForLoop(
            IndexPattern.bind("i"), Expr.name("xs"), Stmt.Block.of(EMIT_I), false, false);
    assertThat(block.size()).isEqualTo(6);
    LoweredLoop loop = loopOf(block);
    assertThat(((Stmt.Def) block.get(0)).symbol).isSameInstanceAs(loop.index());
    assertThat(((Stmt.Def) block.get(1)).symbol).isSameInstanceAs(loop.handle());
    Stmt.Move init = (Stmt.Move) block.get(2);
    assertThat(init.target).isSameInstanceAs(loop.handle());
    assertThat(init.value.toString()).isEqualTo("getIterator(xs)");
    Stmt.Defer defer = (Stmt.Defer) block.get(3);
    assertThat(defer.action.toString()).isEqualTo("freeIterator(_iterator#2)\n");
    assertThat(((Stmt.LabelDef) block.get(5)).label).isSameInstanceAs(loop.breakLabel());
    assertThat(loop.kind()).isEqualTo(LoweredLoop.Kind.SEQUENTIAL);
    assertThat(loop.sourcing()).isSameInstanceAs(LoweredLoop.Sourcing.SINGLE);
  }

  /** The fetch comes first, then the index binding, then the user's statements. */
  @Test
  public void bodyOrder() {
    Stmt.Block block =
        assembler.buildForLoop(
            IndexPattern.bind("i"), Expr.name("xs"), Stmt.Block.of(EMIT_I), false, false);
    LoweredLoop loop = loopOf(block);
    ImmutableList<Stmt> body = loop.body();
    assertThat(body).hasSize(5);
    assertThat(body.get(0)).isSameInstanceAs(loop.fetch());
    Stmt.Def def = (Stmt.Def) body.get(1);
    assertThat(def.symbol.name).isEqualTo("i");
    assertThat(def.symbol.flags()).containsExactly(Symbol.Flag.INDEX_VAR);
    Stmt.Move bind = (Stmt.Move) body.get(2);
    assertThat(bind.target).isSameInstanceAs(def.symbol);
    assertThat(bind.value).isEqualTo(Expr.ref(loop.index()));
    assertThat(body.get(3)).isSameInstanceAs(EMIT_I);
    assertThat(((Stmt.LabelDef) body.get(4)).label).isSameInstanceAs(loop.continueLabel());
  }

  /** A synchronized loop fetches the tuple of values once, then destructures it, then runs. */
  @Test
  public void zipBodyOrder() {
    Stmt emit = new Stmt.Eval(Expr.call("emit", Expr.name("a"), Expr.name("b")));
    Stmt.Block block =
        assembler.buildForLoop(
            IndexPattern.tuple(IndexPattern.bind("a"), IndexPattern.bind("b")),
            Expr.prim(Expr.Primitive.ZIP, Expr.name("xs"), Expr.name("ys")),
            Stmt.Block.of(emit),
            true,
            false);
    LoweredLoop loop = loopOf(block);
    assertThat(loop.isSynchronized()).isTrue();
    ImmutableList<Stmt> body = loop.body();
    assertThat(body).hasSize(8);
    assertThat(body.get(0)).isSameInstanceAs(loop.fetch());
    Expr index = Expr.ref(loop.index());
    assertThat(((Stmt.Eval) body.get(1)).expr)
        .isEqualTo(Expr.call(CHECK_TUPLE_SIZE, index, Expr.of(2)));
    Stmt.Def defA = (Stmt.Def) body.get(2);
    assertThat(defA.symbol.name).isEqualTo("a");
    assertThat(((Stmt.Move) body.get(3)).value).isEqualTo(Expr.element(index, 0));
    Stmt.Def defB = (Stmt.Def) body.get(4);
    assertThat(defB.symbol.name).isEqualTo("b");
    assertThat(((Stmt.Move) body.get(5)).value).isEqualTo(Expr.element(index, 1));
    assertThat(body.get(6)).isSameInstanceAs(emit);
    assertThat(((Stmt.LabelDef) body.get(7)).label).isSameInstanceAs(loop.continueLabel());
  }

  @Test
  public void symbolsAndLabelsAreNumberedInOrder() {
    Stmt.Block block =
        assembler.buildForLoop(
            IndexPattern.bind("i"), Expr.name("xs"), Stmt.Block.empty(), false, false);
    LoweredLoop loop = loopOf(block);
    assertThat(loop.index().toString()).isEqualTo("_indexOfInterest#1");
    assertThat(loop.handle().toString()).isEqualTo("_iterator#2");
    assertThat(loop.continueLabel().toString()).isEqualTo("_continueLabel#3");
    assertThat(loop.breakLabel().toString()).isEqualTo("_breakLabel#4");
    // A second loop from the same assembler continues the numbering.
    LoweredLoop second =
        loopOf(
            assembler.buildForLoop(null, Expr.name("ys"), Stmt.Block.empty(), false, false));
    assertThat(second.index().id).isEqualTo(6);
  }

  @Test
  public void rangeIsOptimized() {
    Expr range = Expr.call(BUILD_BOUNDED_RANGE, Expr.of(1), Expr.of(5));
    Stmt.Block block =
        assembler.buildForLoop(IndexPattern.bind("i"), range, Stmt.Block.empty(), false, false);
    assertThat(((Stmt.Move) block.get(2)).value.toString())
        .isEqualTo("getIterator(directRangeIter(1, 5))");
  }

  @Test
  public void rangeOptimizationDisabled() {
    LoopAssembler unoptimized =
        new LoopAssembler(LoweringOptions.DEFAULT.withOptimizeRangeIteration(false));
    Expr range = Expr.call(BUILD_BOUNDED_RANGE, Expr.of(1), Expr.of(5));
    Stmt.Block block =
        unoptimized.buildForLoop(IndexPattern.bind("i"), range, Stmt.Block.empty(), false, false);
    assertThat(((Stmt.Move) block.get(2)).value.toString())
        .isEqualTo("getIterator(buildBoundedRange(1, 5))");
  }

  @Test
  public void elidedIndex() {
    LoweredLoop loop =
        loopOf(assembler.buildForLoop(null, Expr.name("xs"), Stmt.Block.empty(), false, false));
    Stmt.Def def = (Stmt.Def) loop.body().get(1);
    assertThat(def.symbol.name).isEqualTo("_elidedIdx");
  }

  @Test
  public void emptyBody() {
    LoweredLoop loop =
        loopOf(
            assembler.buildForLoop(
                IndexPattern.SKIP, Expr.name("xs"), Stmt.Block.empty(), false, false));
    // Just the fetch and the continue label.
    assertThat(loop.body()).hasSize(2);
    loop.verify();
  }

  @Test
  public void taskParallelFlags() {
    ImmutableList<TaskIntent> intents = ImmutableList.of(new TaskIntent("ref", "sum"));
    LoweredLoop loop =
        loopOf(
            assembler.buildCoforallLoop(
                IndexPattern.tuple(IndexPattern.bind("a"), IndexPattern.bind("b")),
                Expr.name("pairs"),
                Stmt.Block.empty(),
                false,
                intents));
    assertThat(loop.isTaskParallel()).isTrue();
    assertThat(loop.index().flags())
        .containsExactly(Symbol.Flag.INDEX_OF_INTEREST, Symbol.Flag.TASK_PARALLEL_INDEX);
    assertThat(loop.asTaskParallel().taskIntents()).isEqualTo(intents);
    // checkTupleSize, then def a, a = ..., def b, b = ...
    Stmt.Def a = (Stmt.Def) loop.body().get(2);
    Stmt.Def b = (Stmt.Def) loop.body().get(4);
    assertThat(a.symbol.flags())
        .containsExactly(Symbol.Flag.INDEX_VAR, Symbol.Flag.TASK_PARALLEL_INDEX);
    assertThat(b.symbol.hasFlag(Symbol.Flag.TASK_PARALLEL_INDEX)).isTrue();
    assertThat(((Stmt.Move) loop.body().get(5)).value.toString())
        .isEqualTo("_indexOfInterest#1[1]");
  }

  @Test
  public void orderIndependent() {
    LoweredLoop loop =
        loopOf(
            assembler.buildForeachLoop(
                IndexPattern.bind("i"),
                Expr.name("xs"),
                Stmt.Block.empty(),
                false,
                ImmutableList.of()));
    assertThat(loop.isOrderIndependent()).isTrue();
    assertThat(loop.isSynthesized()).isFalse();
    assertThat(loop.index().hasFlag(Symbol.Flag.TASK_PARALLEL_INDEX)).isFalse();
  }

  @Test
  public void loweredForall() {
    LoweredLoop loop =
        loopOf(
            assembler.buildLoweredForallLoop(
                IndexPattern.bind("i"),
                Expr.name("xs"),
                Stmt.Block.empty(),
                false,
                ImmutableList.of(new TaskIntent("in", "x"))));
    assertThat(loop.isOrderIndependent()).isTrue();
    assertThat(loop.isSynthesized()).isTrue();
    assertThat(loop.asOrderIndependent().taskIntents()).hasSize(1);
  }

  @Test
  public void forExpressionAndLabelAndAttributes() {
    LoopAttribute unroll = new LoopAttribute("unroll", ImmutableList.of(Expr.of(4)));
    LoweredLoop loop =
        loopOf(
            assembler.assemble(
                LoopRequest.builder(LoweredLoop.Kind.SEQUENTIAL, Expr.name("xs"))
                    .indices(IndexPattern.bind("x"))
                    .forExpression(true)
                    .userLabel("outer")
                    .attributes(ImmutableList.of(unroll))
                    .build()));
    assertThat(loop.isForExpression()).isTrue();
    assertThat(loop.userLabel()).isEqualTo("outer");
    assertThat(loop.attributes()).containsExactly(unroll);
  }

  @Test
  public void zipPrimitive() {
    Expr zip = Expr.prim(Expr.Primitive.ZIP, Expr.name("xs"), Expr.name("ys"));
    LoopRequest request =
        LoopRequest.builder(LoweredLoop.Kind.SEQUENTIAL, zip)
            .indices(IndexPattern.tuple(IndexPattern.bind("x"), IndexPattern.bind("y")))
            .build();
    assertThat(request.zippered()).isTrue();
    Stmt.Block block = assembler.assemble(request);
    LoweredLoop loop = loopOf(block);
    assertThat(loop.isSynchronized()).isTrue();
    assertThat(loop.sourcing().asSynchronized().arity).isEqualTo(2);
    assertThat(((Stmt.Move) block.get(2)).value.toString())
        .isEqualTo("buildTuple(getIterator(xs), getIterator(ys))");
    // Still only one handle, and one release.
    assertThat(block.stmts.stream().filter(s -> s instanceof Stmt.Defer).count()).isEqualTo(1);
  }

  @Test
  public void legacyZip() {
    Expr tuple = Expr.call(BUILD_TUPLE, Expr.name("xs"), Expr.name("ys"));
    Stmt.Block block =
        assembler.buildForLoop(
            IndexPattern.tuple(IndexPattern.bind("x"), IndexPattern.bind("y")),
            tuple,
            Stmt.Block.empty(),
            true,
            false);
    LoweredLoop loop = loopOf(block);
    assertThat(loop.sourcing().asSynchronized().form).isEqualTo(LoweredLoop.ZipForm.LEGACY_TUPLE);
    assertThat(((Stmt.Move) block.get(2)).value.toString())
        .isEqualTo("getIteratorZip(buildTuple(xs, ys))");
  }

  @Test
  public void intentsOnSequentialLoop() {
    LoopRequest request =
        LoopRequest.builder(LoweredLoop.Kind.SEQUENTIAL, Expr.name("xs"))
            .intents(ImmutableList.of(new TaskIntent("ref", "x")))
            .build();
    LoweringError e = assertThrows(LoweringError.class, () -> assembler.assemble(request));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.CONTRACT_VIOLATION);
  }

  @Test
  public void missingIterable() {
    LoopRequest request = LoopRequest.builder(LoweredLoop.Kind.SEQUENTIAL, null).build();
    assertThrows(LoweringError.class, () -> assembler.assemble(request));
  }

  @Test
  public void emptyTuplePattern() {
    LoopRequest request =
        LoopRequest.builder(LoweredLoop.Kind.SEQUENTIAL, Expr.name("xs"))
            .indices(IndexPattern.tuple(ImmutableList.of()))
            .build();
    LoweringError e = assertThrows(LoweringError.class, () -> assembler.assemble(request));
    assertThat(e).hasMessageThat().contains("empty tuple index pattern");
  }

  @Test
  public void emptyZip() {
    Expr zip = Expr.prim(Expr.Primitive.ZIP);
    LoopRequest request = LoopRequest.builder(LoweredLoop.Kind.SEQUENTIAL, zip).build();
    assertThrows(LoweringError.class, () -> assembler.assemble(request));
  }

  @Test
  public void printed() {
    Stmt.Block block =
        assembler.buildForeachLoop(
            IndexPattern.bind("i"),
            Expr.name("xs"),
            Stmt.Block.of(EMIT_I),
            false,
            ImmutableList.of());
    assertThat(block.toString())
        .isEqualTo(
            String.join(
                "\n",
                "{",
                "  def _indexOfInterest#1 (INDEX_OF_INTEREST)",
                "  def _iterator#2 (EXPR_TEMP)",
                "  _iterator#2 = getIterator(xs)",
                "  defer freeIterator(_iterator#2)",
                "  loop order-independent index=_indexOfInterest#1 handle=_iterator#2 {",
                "    _indexOfInterest#1 = iteratorIndex(_iterator#2)",
                "    def i (INDEX_VAR)",
                "    i = _indexOfInterest#1",
                "    emit(i)",
                "    label _continueLabel#3",
                "  }",
                "  label _breakLabel#4",
                "}",
                ""));
  }
}
