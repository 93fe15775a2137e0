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
 * Interval of 64-bit integers.
 *
 * {@link Long#MIN_VALUE} and {@link Long#MAX_VALUE} stand for unbounded
 * below and above.  Arithmetic over-approximates: a result whose exact value
 * might not fit in a long is {@link #TOP}, never wrapped.
 */
public class Interval {
  public static final long NEG_INF = Long.MIN_VALUE;
  public static final long POS_INF = Long.MAX_VALUE;

  public static final Interval TOP = new Interval(NEG_INF, POS_INF);
  public static final Interval BOTTOM = new Interval(POS_INF, NEG_INF);
  public static final Interval NON_NEGATIVE = new Interval(0, POS_INF);
  public static final Interval BOOL = new Interval(0, 1);

  public final long lo;
  public final long hi;

  private Interval(long lo, long hi) {
    this.lo = lo;
    this.hi = hi;
  }

  public static Interval of(long lo, long hi) {
    if (lo > hi) {
      return BOTTOM;
    }
    return new Interval(lo, hi);
  }

  public static Interval constant(long c) {
    return new Interval(c, c);
  }

  public static Interval atLeast(long lo) {
    return of(lo, POS_INF);
  }

  public static Interval atMost(long hi) {
    return of(NEG_INF, hi);
  }

  public boolean isBottom() {
    return lo > hi;
  }

  public boolean isTop() {
    return lo == NEG_INF && hi == POS_INF;
  }

  public boolean isConstant() {
    return lo == hi && lo != NEG_INF && hi != POS_INF;
  }

  public boolean hasFiniteLo() {
    return !isBottom() && lo != NEG_INF;
  }

  public boolean hasFiniteHi() {
    return !isBottom() && hi != POS_INF;
  }

  public boolean isFinite() {
    return hasFiniteLo() && hasFiniteHi();
  }

  public boolean contains(long v) {
    return lo <= v && v <= hi;
  }

  /**
   * @return true if every value of this is in other
   */
  public boolean within(Interval other) {
    return isBottom() || (other.lo <= lo && hi <= other.hi);
  }

  public Interval join(Interval other) {
    if (isBottom()) {
      return other;
    } else if (other.isBottom()) {
      return this;
    }
    return of(Math.min(lo, other.lo), Math.max(hi, other.hi));
  }

  public Interval meet(Interval other) {
    if (isBottom() || other.isBottom()) {
      return BOTTOM;
    }
    return of(Math.max(lo, other.lo), Math.min(hi, other.hi));
  }

  /**
   * Widen this (the previous value) with next: any bound that grew becomes
   * unbounded.
   */
  public Interval widen(Interval next) {
    if (isBottom()) {
      return next;
    } else if (next.isBottom()) {
      return this;
    }
    long newLo = next.lo < lo ? NEG_INF : lo;
    long newHi = next.hi > hi ? POS_INF : hi;
    return of(newLo, newHi);
  }

  /**
   * Narrow this (a widened value) with next.  Only unbounded bounds are
   * replaced, so finite bounds are never lost.
   */
  public Interval narrow(Interval next) {
    if (isBottom() || next.isBottom()) {
      return this;
    }
    long newLo = lo == NEG_INF ? next.lo : lo;
    long newHi = hi == POS_INF ? next.hi : hi;
    return of(newLo, newHi);
  }

  public Interval add(Interval other) {
    if (isBottom() || other.isBottom()) {
      return BOTTOM;
    }
    try {
      long newLo = (lo == NEG_INF || other.lo == NEG_INF) ?
                    NEG_INF : Math.addExact(lo, other.lo);
      long newHi = (hi == POS_INF || other.hi == POS_INF) ?
                    POS_INF : Math.addExact(hi, other.hi);
      return of(newLo, newHi);
    } catch (ArithmeticException e) {
      return TOP;
    }
  }

  public Interval negate() {
    if (isBottom()) {
      return BOTTOM;
    }
    return of(hi == POS_INF ? NEG_INF : -hi, lo == NEG_INF ? POS_INF : -lo);
  }

  public Interval sub(Interval other) {
    return add(other.negate());
  }

  public Interval mul(Interval other) {
    if (isBottom() || other.isBottom()) {
      return BOTTOM;
    }
    if (isZero() || other.isZero()) {
      return constant(0);
    }
    if (!isFinite() || !other.isFinite()) {
      return TOP;
    }
    try {
      long p1 = Math.multiplyExact(lo, other.lo);
      long p2 = Math.multiplyExact(lo, other.hi);
      long p3 = Math.multiplyExact(hi, other.lo);
      long p4 = Math.multiplyExact(hi, other.hi);
      return of(Math.min(Math.min(p1, p2), Math.min(p3, p4)),
                Math.max(Math.max(p1, p2), Math.max(p3, p4)));
    } catch (ArithmeticException e) {
      return TOP;
    }
  }

  /**
   * Truncating division.  A divisor that may be zero gives {@link #TOP}.
   */
  public Interval div(Interval other) {
    if (isBottom() || other.isBottom()) {
      return BOTTOM;
    }
    if (other.contains(0) || !isFinite() || !other.isFinite()) {
      return TOP;
    }
    // Divisor has a single sign, so the quotient is monotone in each operand
    long q1 = lo / other.lo;
    long q2 = lo / other.hi;
    long q3 = hi / other.lo;
    long q4 = hi / other.hi;
    return of(Math.min(Math.min(q1, q2), Math.min(q3, q4)),
              Math.max(Math.max(q1, q2), Math.max(q3, q4)));
  }

  /**
   * Remainder with the sign of the dividend.  A divisor that may be zero
   * gives {@link #TOP}.
   */
  public Interval mod(Interval other) {
    if (isBottom() || other.isBottom()) {
      return BOTTOM;
    }
    if (other.contains(0)) {
      return TOP;
    }
    long maxAbs;
    if (!other.isFinite()) {
      maxAbs = POS_INF;
    } else {
      maxAbs = Math.max(Math.abs(other.lo), Math.abs(other.hi)) - 1;
    }
    if (lo >= 0) {
      return of(0, Math.min(hi, maxAbs));
    } else if (hi <= 0) {
      return of(Math.max(lo, maxAbs == POS_INF ? NEG_INF : -maxAbs), 0);
    } else {
      return of(maxAbs == POS_INF ? NEG_INF : -maxAbs, maxAbs);
    }
  }

  private boolean isZero() {
    return lo == 0 && hi == 0;
  }

  @Override
  public int hashCode() {
    return Long.valueOf(lo).hashCode() * 31 + Long.valueOf(hi).hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Interval)) {
      return false;
    }
    Interval other = (Interval)obj;
    if (isBottom()) {
      return other.isBottom();
    }
    return lo == other.lo && hi == other.hi;
  }

  @Override
  public String toString() {
    if (isBottom()) {
      return "[]";
    }
    return "[" + (lo == NEG_INF ? "-inf" : Long.toString(lo)) + ", " +
            (hi == POS_INF ? "+inf" : Long.toString(hi)) + "]";
  }
}
