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

import com.google.common.base.Preconditions;

/**
 * A measure of cells that halves (for lengths) or quarters (for areas) with each level. The
 * constants are the derivatives of the quadratic projection; all values are in radians or
 * steradians on the unit sphere.
 */
public final class Metric {
  /** Every cell at level k has a width of at least {@code MIN_WIDTH.getValue(k)}. */
  public static final Metric MIN_WIDTH = new Metric(1, 2 * SphereMath.M_SQRT2 / 3);

  public static final Metric AVG_EDGE = new Metric(1, 1.459213746386106062);
  /** Bounds the distance between the centers of consecutive cells on the curve. */
  public static final Metric MAX_EDGE = new Metric(1, 1.704897179199218452);
  public static final Metric MAX_DIAG = new Metric(1, 2.438654594434021032);

  public static final Metric MIN_AREA = new Metric(2, 8 * SphereMath.M_SQRT2 / 9);
  public static final Metric AVG_AREA = new Metric(2, 4 * SphereMath.M_PI / 6);
  public static final Metric MAX_AREA = new Metric(2, 2.635799256963161491);

  private final double deriv;
  private final int dim;

  /** Defines a metric of the given dimension (1 = length, 2 = area). */
  public Metric(int dim, double deriv) {
    Preconditions.checkArgument(dim == 1 || dim == 2, "dim must be 1 or 2, was %s", dim);
    this.deriv = deriv;
    this.dim = dim;
  }

  /** The value at level 0, scaled by 2^-(dim * level) for deeper levels. */
  public double deriv() {
    return deriv;
  }

  public int dim() {
    return dim;
  }

  public double getValue(int level) {
    return Math.scalb(deriv, -dim * level);
  }

  /** Returns the level at which the metric is closest to {@code value}; always a valid level. */
  public int getClosestLevel(double value) {
    return getMinLevel((dim == 1 ? SphereMath.M_SQRT2 : 2) * value);
  }

  /**
   * Returns the minimum level such that the metric is at most {@code value}, or
   * {@link CellId#MAX_LEVEL} if there is no such level.
   */
  public int getMinLevel(double value) {
    if (value <= 0) {
      return CellId.MAX_LEVEL;
    }
    // Rounds a fractional level up; getExponent returns the exponent of a fraction in [1,2).
    int exponent = Platform.getExponent(value / deriv);
    int level = Math.max(0, Math.min(CellId.MAX_LEVEL, -(exponent >> (dim - 1))));
    assert level == CellId.MAX_LEVEL || getValue(level) <= value;
    assert level == 0 || getValue(level - 1) > value;
    return level;
  }

  /**
   * Returns the maximum level such that the metric is at least {@code value}, or zero if there is
   * no such level.
   */
  public int getMaxLevel(double value) {
    if (value <= 0) {
      return CellId.MAX_LEVEL;
    }
    // Rounds a fractional level down.
    int exponent = Platform.getExponent(deriv / value);
    int level = Math.max(0, Math.min(CellId.MAX_LEVEL, exponent >> (dim - 1)));
    assert level == 0 || getValue(level) >= value;
    assert level == CellId.MAX_LEVEL || getValue(level + 1) < value;
    return level;
  }
}
