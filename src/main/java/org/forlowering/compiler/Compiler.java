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

package org.forlowering.compiler;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.forlowering.ast.Stmt;
import org.forlowering.compiler.LoopsParser.UnitContext;
import org.forlowering.lower.LoopAssembler;
import org.forlowering.lower.LoweringOptions;

/** Reads loop source text and lowers each loop it contains. */
public final class Compiler {

  // Static methods only
  private Compiler() {}

  /**
   * Lowers a unit of loop source text. The result is a block containing one statement for each
   * top-level statement of the input; each loop (at any depth) has been replaced by the block
   * that {@link LoopAssembler} builds for it.
   *
   * <p>Inner loops are lowered before the loops that contain them, so their temporaries and labels
   * have smaller ids.
   *
   * @throws CompileError if the input is not valid
   */
  public static Stmt.Block lower(CharStream input, LoweringOptions options) {
    UnitContext unit = parse(input);
    return new StatementBuilder(new LoopAssembler(options)).buildUnit(unit);
  }

  /** Parses a unit of loop source text. */
  public static UnitContext parse(CharStream input) {
    // Throw CompileErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new CompileError(CompileError.Kind.SYNTAX, msg, lineNum, charPositionInLine);
          }
        };
    LoopsLexer lexer = new LoopsLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    LoopsParser parser = new LoopsParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser.unit();
  }
}
