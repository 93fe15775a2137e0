/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.lgc.ir.ranges;

/**
 * Whether an indexed access is provably within its collection.
 *
 * Safe iff the index can't be below the minimum valid index, and can't
 * exceed the guaranteed minimum length of the collection.  The second part
 * may instead be proven by a relational fact between index and length.
 */
public class ProvenBound {
  public final Interval index;
  public final Interval length;
  private final boolean safe;
  /** True if the upper bound was proven by a relational fact */
  public final boolean byFact;

  private ProvenBound(Interval index, Interval length, boolean safe,
                      boolean byFact) {
    this.index = index;
    this.length = length;
    this.safe = safe;
    this.byFact = byFact;
  }

  /**
   * Check from intervals alone
   */
  public static ProvenBound check(Interval index, Interval length,
                                  long minIndex) {
    return check(index, length, minIndex, false);
  }

  /**
   * @param factProvesUpper true if a relational fact shows index <= length
   */
  public static ProvenBound check(Interval index, Interval length,
                                  long minIndex, boolean factProvesUpper) {
    if (index.isBottom() || length.isBottom()) {
      // Unreachable: nothing to prove, but nothing to elide either
      return new ProvenBound(index, length, false, false);
    }
    boolean lowerOk = index.hasFiniteLo() && index.lo >= minIndex;
    // The lower bound of the length is the length guaranteed on every path
    boolean upperByInterval = index.hasFiniteHi() && length.hasFiniteLo() &&
                              index.hi <= length.lo;
    boolean upperOk = upperByInterval || factProvesUpper;
    return new ProvenBound(index, length, lowerOk && upperOk,
                           lowerOk && !upperByInterval && factProvesUpper);
  }

  public static ProvenBound unresolved() {
    return new ProvenBound(Interval.TOP, Interval.NON_NEGATIVE, false, false);
  }

  public boolean isSafe() {
    return safe;
  }

  @Override
  public String toString() {
    return (safe ? "safe" : "unresolved") + " index " + index +
           " length " + length + (byFact ? " (relational)" : "");
  }
}
