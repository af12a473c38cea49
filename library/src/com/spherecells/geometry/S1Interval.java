/*
 * Copyright 2005 Google Inc.
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
package com.spherecells.geometry;

import static com.spherecells.geometry.SphereMath.M_PI;

import com.google.errorprone.annotations.CheckReturnValue;
import java.io.Serializable;

/**
 * A closed interval on the unit circle, used for longitude ranges. Points are angles in
 * [-Pi, Pi]. The lower bound may exceed the upper bound, in which case the interval is "inverted"
 * and passes through the point at angle Pi.
 *
 * <p>The angle Pi has two representations. Internally it is stored as Pi, so the endpoints of
 * ordinary intervals lie in (-Pi, Pi]. The two special intervals use -Pi: the full interval is
 * [-Pi, Pi] and the empty interval is [Pi, -Pi].
 */
@CheckReturnValue
public final class S1Interval implements Serializable {
  private static final long serialVersionUID = 1L;

  private static final S1Interval EMPTY = new S1Interval(M_PI, -M_PI, true);
  private static final S1Interval FULL = new S1Interval(-M_PI, M_PI, true);

  private final double lo;
  private final double hi;

  /**
   * Both endpoints must be in [-Pi, Pi]. An endpoint of -Pi is moved to Pi unless the other
   * endpoint is already Pi.
   */
  public S1Interval(double lo, double hi) {
    this(lo, hi, false);
  }

  private S1Interval(double lo, double hi, boolean checked) {
    double newLo = lo;
    double newHi = hi;
    if (!checked) {
      // Both tests read the arguments, so [-Pi, -Pi] becomes the point Pi.
      if (lo == -M_PI && hi != M_PI) {
        newLo = M_PI;
      }
      if (hi == -M_PI && lo != M_PI) {
        newHi = M_PI;
      }
    }
    this.lo = newLo;
    this.hi = newHi;
  }

  public static S1Interval empty() {
    return EMPTY;
  }

  public static S1Interval full() {
    return FULL;
  }

  public static S1Interval fromPoint(double radians) {
    if (radians == -M_PI) {
      radians = M_PI;
    }
    return new S1Interval(radians, radians, true);
  }

  /** Returns the shorter of the two intervals with endpoints {@code p1} and {@code p2}. */
  public static S1Interval fromPointPair(double p1, double p2) {
    if (p1 == -M_PI) {
      p1 = M_PI;
    }
    if (p2 == -M_PI) {
      p2 = M_PI;
    }
    if (positiveDistance(p1, p2) <= M_PI) {
      return new S1Interval(p1, p2, true);
    }
    return new S1Interval(p2, p1, true);
  }

  public double lo() {
    return lo;
  }

  public double hi() {
    return hi;
  }

  /**
   * Neither bound may exceed Pi in absolute value, and -Pi may appear only in the empty and full
   * intervals.
   */
  public boolean isValid() {
    return Math.abs(lo) <= M_PI
        && Math.abs(hi) <= M_PI
        && !(lo == -M_PI && hi != M_PI)
        && !(hi == -M_PI && lo != M_PI);
  }

  public boolean isFull() {
    return hi - lo == 2 * M_PI;
  }

  public boolean isEmpty() {
    return lo - hi == 2 * M_PI;
  }

  /** True if {@code lo() > hi()}, which includes the empty interval. */
  public boolean isInverted() {
    return lo > hi;
  }

  /** Returns the midpoint, in (-Pi, Pi]. Arbitrary for the empty and full intervals. */
  public double getCenter() {
    double center = 0.5 * (lo + hi);
    if (!isInverted()) {
      return center;
    }
    return (center <= 0) ? (center + M_PI) : (center - M_PI);
  }

  /** The length of the empty interval is negative. */
  public double getLength() {
    double length = hi - lo;
    if (length >= 0) {
      return length;
    }
    length += 2 * M_PI;
    return (length > 0) ? length : -1;
  }

  public boolean contains(double p) {
    if (p == -M_PI) {
      p = M_PI;
    }
    return fastContains(p);
  }

  /** As {@link #contains(double)}, but {@code p} must already be normalized away from -Pi. */
  public boolean fastContains(double p) {
    if (isInverted()) {
      return (p >= lo || p <= hi) && !isEmpty();
    } else {
      return p >= lo && p <= hi;
    }
  }

  public boolean contains(S1Interval y) {
    if (isInverted()) {
      if (y.isInverted()) {
        return y.lo >= lo && y.hi <= hi;
      }
      return (y.lo >= lo || y.hi <= hi) && !isEmpty();
    } else {
      if (y.isInverted()) {
        return isFull() || y.isEmpty();
      }
      return y.lo >= lo && y.hi <= hi;
    }
  }

  /** The intervals [-Pi,-3] and [2,Pi] intersect, since +/-Pi is the same point. */
  public boolean intersects(S1Interval y) {
    if (isEmpty() || y.isEmpty()) {
      return false;
    }
    if (isInverted()) {
      // Every non-empty inverted interval contains Pi.
      return y.isInverted() || y.lo <= hi || y.hi >= lo;
    } else {
      if (y.isInverted()) {
        return y.lo <= hi || y.hi >= lo;
      }
      return y.lo <= hi && y.hi >= lo;
    }
  }

  /** Returns the smallest interval containing this one and the angle {@code p}. */
  public S1Interval addPoint(double p) {
    if (p == -M_PI) {
      p = M_PI;
    }
    if (fastContains(p)) {
      return this;
    }
    if (isEmpty()) {
      return fromPoint(p);
    }
    double dlo = positiveDistance(p, lo);
    double dhi = positiveDistance(hi, p);
    return dlo < dhi ? new S1Interval(p, hi) : new S1Interval(lo, p);
  }

  /**
   * Returns this interval grown by {@code margin} on each side, or shrunk if the margin is
   * negative. The full interval stays full and the empty interval stays empty.
   */
  public S1Interval expanded(double margin) {
    if (margin >= 0) {
      if (isEmpty()) {
        return this;
      }
      // Allow a 1-bit rounding error on each endpoint.
      if (getLength() + 2 * margin + 2 * SphereMath.DBL_EPSILON >= 2 * M_PI) {
        return FULL;
      }
    } else {
      if (isFull()) {
        return this;
      }
      if (getLength() + 2 * margin - 2 * SphereMath.DBL_EPSILON <= 0) {
        return EMPTY;
      }
    }
    double newLo = Platform.IEEEremainder(lo - margin, 2 * M_PI);
    double newHi = Platform.IEEEremainder(hi + margin, 2 * M_PI);
    if (newLo <= -M_PI) {
      newLo = M_PI;
    }
    return new S1Interval(newLo, newHi);
  }

  /** Returns the smallest interval containing both this interval and {@code y}. */
  public S1Interval union(S1Interval y) {
    if (y.isEmpty()) {
      return this;
    }
    if (fastContains(y.lo)) {
      if (fastContains(y.hi)) {
        // Either this contains y, or together they wrap the whole circle.
        return contains(y) ? this : FULL;
      }
      return new S1Interval(lo, y.hi, true);
    }
    if (fastContains(y.hi)) {
      return new S1Interval(y.lo, hi, true);
    }
    // Neither endpoint of y is inside: y contains this interval, or they are disjoint.
    if (isEmpty() || y.fastContains(lo)) {
      return y;
    }
    double dlo = positiveDistance(y.hi, lo);
    double dhi = positiveDistance(hi, y.lo);
    return dlo < dhi ? new S1Interval(y.lo, hi, true) : new S1Interval(lo, y.hi, true);
  }

  /**
   * Returns true if each endpoint of this interval is within {@code maxError} of the
   * corresponding endpoint of {@code y}, without inverting either interval.
   */
  public boolean approxEquals(S1Interval y, double maxError) {
    if (isEmpty()) {
      return y.getLength() <= 2 * maxError;
    }
    if (y.isEmpty()) {
      return getLength() <= 2 * maxError;
    }
    if (isFull()) {
      return y.getLength() >= 2 * (M_PI - maxError);
    }
    if (y.isFull()) {
      return getLength() >= 2 * (M_PI - maxError);
    }
    return Math.abs(Platform.IEEEremainder(y.lo - lo, 2 * M_PI)) <= maxError
        && Math.abs(Platform.IEEEremainder(y.hi - hi, 2 * M_PI)) <= maxError
        && Math.abs(getLength() - y.getLength()) <= 2 * maxError;
  }

  public boolean approxEquals(S1Interval y) {
    return approxEquals(y, 1e-15);
  }

  @Override
  public boolean equals(Object that) {
    if (that instanceof S1Interval) {
      S1Interval y = (S1Interval) that;
      return lo == y.lo && hi == y.hi;
    }
    return false;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value = 37 * value + Double.doubleToLongBits(lo);
    value = 37 * value + Double.doubleToLongBits(hi);
    return (int) ((value >>> 32) ^ value);
  }

  @Override
  public String toString() {
    return "[" + lo + ", " + hi + "]";
  }

  /**
   * Returns the distance from {@code a} to {@code b} measured counter-clockwise, in [0, 2*Pi).
   * Small positive distances keep full precision.
   */
  public static double positiveDistance(double a, double b) {
    double d = b - a;
    if (d >= 0) {
      return d;
    }
    // If b == Pi and a == (-Pi + eps), the result must be close to 2*Pi, not zero.
    return (b + M_PI) - (a - M_PI);
  }
}
