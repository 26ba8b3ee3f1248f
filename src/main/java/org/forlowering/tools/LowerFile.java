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

package org.forlowering.tools;

import java.io.IOException;
import java.nio.file.Path;
import org.antlr.v4.runtime.CharStreams;
import org.forlowering.LoweringError;
import org.forlowering.ast.AstPrinter;
import org.forlowering.ast.Stmt;
import org.forlowering.compiler.CompileError;
import org.forlowering.compiler.Compiler;
import org.forlowering.lower.LoweringOptions;

/**
 * A simple command-line tool that prints the lowered form of a loop source file.
 *
 * <p>The output is a comment in the form expected by the golden-file tests, so it can be appended
 * to a test file once it has been checked. Set {@code -DnoOptimizeRangeIteration=true} to see the
 * lowering without direct range iteration.
 */
public class LowerFile {
  private LowerFile() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: lowerFile <fileName>");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    checkUsage(args.length == 1);
    LoweringOptions options = LoweringOptions.fromSystemProperties();
    Path file = Path.of(args[0]);
    Stmt.Block unit;
    try {
      unit = Compiler.lower(CharStreams.fromPath(file), options);
    } catch (CompileError e) {
      System.err.printf("%s: %s\n", file.getFileName(), e.getMessage());
      System.exit(1);
      return;
    } catch (LoweringError e) {
      System.err.printf("%s: %s\n", file.getFileName(), e.getMessage());
      e.printStackTrace();
      System.exit(2);
      return;
    }
    String flags =
        options.optimizeRangeIteration ? "" : LoweringOptions.NO_OPTIMIZE_RANGE_ITERATION;
    System.out.printf("/* LOWER (%s)\n", flags);
    AstPrinter.print(unit.stmts).lines().forEach(line -> System.out.println("  " + line));
    System.out.println("*/");
  }
}
