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

import com.google.errorprone.annotations.CheckReturnValue;
import java.io.Serializable;

/**
 * A closed, bounded interval on the real line. Any interval with {@code lo > hi} is empty;
 * zero-length intervals contain a single point. Used for latitude ranges and for the (u,v) extent
 * of a cell on its cube face.
 */
@CheckReturnValue
public final class R1Interval implements Serializable {
  private static final long serialVersionUID = 1L;

  private final double lo;
  private final double hi;

  /** Creates the interval [lo, hi], which is empty if {@code lo > hi}. */
  public R1Interval(double lo, double hi) {
    this.lo = lo;
    this.hi = hi;
  }

  public static R1Interval empty() {
    return new R1Interval(1, 0);
  }

  public static R1Interval fromPoint(double p) {
    return new R1Interval(p, p);
  }

  /** Returns the minimal interval containing both points, in either order. */
  public static R1Interval fromPointPair(double p1, double p2) {
    return p1 <= p2 ? new R1Interval(p1, p2) : new R1Interval(p2, p1);
  }

  public double lo() {
    return lo;
  }

  public double hi() {
    return hi;
  }

  public boolean isEmpty() {
    return lo > hi;
  }

  /** For empty intervals the result is arbitrary. */
  public double getCenter() {
    return 0.5 * (lo + hi);
  }

  /** The length of an empty interval is negative. */
  public double getLength() {
    return hi - lo;
  }

  public boolean contains(double p) {
    return p >= lo && p <= hi;
  }

  public boolean contains(R1Interval y) {
    if (y.isEmpty()) {
      return true;
    }
    return y.lo >= lo && y.hi <= hi;
  }

  public boolean intersects(R1Interval y) {
    if (lo <= y.lo) {
      return y.lo <= hi && y.lo <= y.hi;
    } else {
      return lo <= y.hi && lo <= hi;
    }
  }

  /** Expands both ends by {@code radius}. The expansion of an empty interval is empty. */
  public R1Interval expanded(double radius) {
    if (isEmpty()) {
      return this;
    }
    return new R1Interval(lo - radius, hi + radius);
  }

  public R1Interval addPoint(double p) {
    if (isEmpty()) {
      return fromPoint(p);
    } else if (p < lo) {
      return new R1Interval(p, hi);
    } else if (p > hi) {
      return new R1Interval(lo, p);
    }
    return this;
  }

  public R1Interval union(R1Interval y) {
    if (isEmpty()) {
      return y;
    }
    if (y.isEmpty()) {
      return this;
    }
    return new R1Interval(Math.min(lo, y.lo), Math.max(hi, y.hi));
  }

  /** Empty intervals need no special casing here. */
  public R1Interval intersection(R1Interval y) {
    return new R1Interval(Math.max(lo, y.lo), Math.min(hi, y.hi));
  }

  /**
   * Returns true if each endpoint of this interval is within {@code maxError} of the
   * corresponding endpoint of {@code y}. An empty interval matches any interval whose length is
   * at most {@code maxError}.
   */
  public boolean approxEquals(R1Interval y, double maxError) {
    if (isEmpty()) {
      return y.getLength() <= maxError;
    }
    if (y.isEmpty()) {
      return getLength() <= maxError;
    }
    return Math.abs(y.lo - lo) <= maxError && Math.abs(y.hi - hi) <= maxError;
  }

  public boolean approxEquals(R1Interval y) {
    return approxEquals(y, 1e-15);
  }

  /** Two intervals are equal if they contain the same set of points. */
  @Override
  public boolean equals(Object that) {
    if (that instanceof R1Interval) {
      R1Interval y = (R1Interval) that;
      return (lo == y.lo && hi == y.hi) || (isEmpty() && y.isEmpty());
    }
    return false;
  }

  @Override
  public int hashCode() {
    // All empty intervals are equal, so they share one hash.
    return isEmpty() ? 17 : 31 * Double.hashCode(lo) + Double.hashCode(hi);
  }

  @Override
  public String toString() {
    return "[" + lo + ", " + hi + "]";
  }
}
