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

/**
 * Configuration for a compilation. Options are read once (usually from system properties, see
 * {@link #fromSystemProperties}) and passed explicitly to the lowering components, so that each
 * component's output depends only on its input and the options.
 */
public final class LoweringOptions {

  /** The system property that disables the range iteration optimization when set to "true". */
  public static final String NO_OPTIMIZE_RANGE_ITERATION = "noOptimizeRangeIteration";

  /** All optimizations enabled. */
  public static final LoweringOptions DEFAULT = new LoweringOptions(true);

  /**
   * If false, iteration over simple anonymous ranges is left in its general form instead of being
   * replaced with a direct range iterator. Disabling it is useful when tracking down a
   * miscompilation that might be caused by the optimization.
   */
  public final boolean optimizeRangeIteration;

  private LoweringOptions(boolean optimizeRangeIteration) {
    this.optimizeRangeIteration = optimizeRangeIteration;
  }

  /** Returns options determined by the current system properties. */
  public static LoweringOptions fromSystemProperties() {
    boolean noOptimize = Boolean.parseBoolean(System.getProperty(NO_OPTIMIZE_RANGE_ITERATION));
    return noOptimize ? DEFAULT.withOptimizeRangeIteration(false) : DEFAULT;
  }

  /** Returns a copy of these options with {@link #optimizeRangeIteration} set as specified. */
  public LoweringOptions withOptimizeRangeIteration(boolean enabled) {
    return (enabled == optimizeRangeIteration) ? this : new LoweringOptions(enabled);
  }

  @Override
  public String toString() {
    return "LoweringOptions{optimizeRangeIteration=" + optimizeRangeIteration + "}";
  }
}
