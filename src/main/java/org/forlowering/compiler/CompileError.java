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

import com.google.errorprone.annotations.FormatMethod;
import org.antlr.v4.runtime.Token;
import org.jspecify.annotations.Nullable;

/**
 * Thrown for errors in loop source text: syntax errors, and loops that the notation can express but
 * that aren't meaningful (such as a {@code with} clause on a sequential loop).
 */
public class CompileError extends RuntimeException {

  /** What part of the loop source was rejected. */
  public enum Kind {
    /** Rejected by the lexer or parser. */
    SYNTAX,
    /** A loop header that can't be lowered, e.g. intents on a {@code for} or a reused label. */
    LOOP_HEADER,
    /** A {@code break} or {@code continue} with no matching enclosing loop. */
    BRANCH_TARGET,
    /** A malformed index pattern, or a placeholder used outside of one. */
    INDEX_PATTERN,
    /** An integer literal that doesn't fit in a long. */
    LITERAL
  }

  public final Kind kind;
  public final String msg;
  public final int lineNum;
  public final int charPositionInLine;

  public CompileError(Kind kind, String msg, int lineNum, int charPositionInLine) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  /** Returns a CompileError located at the start of {@code token}. */
  @FormatMethod
  static CompileError at(@Nullable Token token, Kind kind, String fmt, Object... fmtArgs) {
    String msg = (fmtArgs.length == 0) ? fmt : String.format(fmt, fmtArgs);
    // A missing token only comes from a synthesized node; 0:0 beats a NullPointerException.
    return (token == null)
        ? new CompileError(kind, msg, 0, 0)
        : new CompileError(kind, msg, token.getLine(), token.getCharPositionInLine());
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s:%s)", msg, lineNum, charPositionInLine);
  }
}
