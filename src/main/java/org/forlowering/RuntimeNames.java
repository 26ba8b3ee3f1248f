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

/**
 * The names of the runtime functions that lowered loops call, and of the range builders that the
 * range optimizer recognizes. These are a fixed contract with the runtime and with the parser;
 * since recognition is purely by name, changing one here without changing the other side breaks
 * the optimization silently.
 */
public final class RuntimeNames {

  // Constants only
  private RuntimeNames() {}

  /** {@code getIterator(iterable)}: returns a new iteration handle. */
  public static final String GET_ITERATOR = "getIterator";

  /** {@code getIteratorZip(tuple)}: returns a tuple of handles, one per element of the tuple. */
  public static final String GET_ITERATOR_ZIP = "getIteratorZip";

  /** {@code iteratorIndex(handle)}: advances the handle and returns the value it produces. */
  public static final String ITERATOR_INDEX = "iteratorIndex";

  /** {@code freeIterator(handle)}: releases a handle (or each handle of a tuple of handles). */
  public static final String FREE_ITERATOR = "freeIterator";

  /** {@code buildTuple(a, b, ...)}: constructs a tuple. */
  public static final String BUILD_TUPLE = "buildTuple";

  /** {@code checkTupleSize(value, n)}: fails unless value is a tuple of size n. */
  public static final String CHECK_TUPLE_SIZE = "checkTupleSize";

  /** {@code lo..hi} */
  public static final String BUILD_BOUNDED_RANGE = "buildBoundedRange";

  /** {@code lo..} */
  public static final String BUILD_LOW_BOUNDED_RANGE = "buildLowBoundedRange";

  /** {@code ..hi} */
  public static final String BUILD_HIGH_BOUNDED_RANGE = "buildHighBoundedRange";

  /** {@code ..} */
  public static final String BUILD_UNBOUNDED_RANGE = "buildUnboundedRange";

  /** {@code range by stride} */
  public static final String BY = "by";

  /** {@code range # count} */
  public static final String COUNT = "#";

  /** {@code range align alignment} */
  public static final String ALIGN = "align";

  /** {@code directRangeIter(lo, hi)}: iterates lo, lo+1, ..., hi. */
  public static final String DIRECT_RANGE_ITER = "directRangeIter";

  /** {@code directStridedRangeIter(lo, hi, stride)} */
  public static final String DIRECT_STRIDED_RANGE_ITER = "directStridedRangeIter";

  /** {@code directCountedRangeIter(lo, count)}: iterates lo, lo+1, ..., lo+count-1. */
  public static final String DIRECT_COUNTED_RANGE_ITER = "directCountedRangeIter";
}
