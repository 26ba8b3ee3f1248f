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

package org.forlowering;

import com.google.errorprone.annotations.FormatMethod;

/**
 * An internal compiler error. Thrown when lowering is given input that violates its contract (a
 * bug in whatever produced the input) or when a later pass queries a lowered loop as if it had a
 * representation it doesn't (a bug in that pass).
 *
 * <p>These are never user errors and are never recovered from; a well-formed program should not
 * be able to trigger one. User errors in loop source text are reported as {@link
 * org.forlowering.compiler.CompileError}s instead.
 */
public class LoweringError extends RuntimeException {

  /** Distinguishes the two ways lowering can be misused. */
  public enum Kind {
    /** The input to lowering was malformed. */
    CONTRACT_VIOLATION,

    /** A consumer of lowered output asked for something the representation doesn't have. */
    MISUSE
  }

  public final Kind kind;

  private LoweringError(Kind kind, String msg) {
    super(msg);
    this.kind = kind;
  }

  /** Returns a new LoweringError for malformed input. */
  @FormatMethod
  public static LoweringError contractViolation(String fmt, Object... fmtArgs) {
    return new LoweringError(Kind.CONTRACT_VIOLATION, String.format(fmt, fmtArgs));
  }

  /** Returns a new LoweringError for a query that doesn't apply to the lowered representation. */
  @FormatMethod
  public static LoweringError misuse(String fmt, Object... fmtArgs) {
    return new LoweringError(Kind.MISUSE, String.format(fmt, fmtArgs));
  }

  @Override
  public String getMessage() {
    return String.format("internal error (%s): %s", kind, super.getMessage());
  }
}
