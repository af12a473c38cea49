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

/** Numeric constants and spherical triangle measures shared by the cell classes. */
public final class SphereMath {
  public static final double M_PI = Math.PI;
  public static final double M_1_PI = 1.0 / Math.PI;
  public static final double M_PI_2 = Math.PI / 2.0;
  public static final double M_PI_4 = Math.PI / 4.0;
  public static final double M_SQRT2 = Math.sqrt(2);

  /** The difference between 1.0 and the next larger double, i.e. 2^-52. */
  public static final double DBL_EPSILON = Math.ulp(1.0);

  private SphereMath() {}

  /**
   * Returns the area of the spherical triangle ABC, whose vertices must be unit length. The
   * result is always non-negative.
   *
   * <p>l'Huilier's formula is used unless the triangle is so long and thin that the cancellation
   * in its (s - a) terms would be worse than the absolute error of Girard's formula.
   */
  public static double area(SpherePoint a, SpherePoint b, SpherePoint c) {
    double sa = b.angle(c);
    double sb = c.angle(a);
    double sc = a.angle(b);
    double s = 0.5 * (sa + sb + sc);
    if (s >= 3e-4) {
      double s2 = s * s;
      double dmin = s - Math.max(sa, Math.max(sb, sc));
      if (dmin < 1e-2 * s * s2 * s2) {
        // Inflate by Girard's worst-case error so the comparison stays conservative.
        double area = girardArea(a, b, c);
        if (dmin < s * (0.1 * (area + 5e-15))) {
          return area;
        }
      }
    }
    double t = Math.tan(0.5 * s)
        * Math.tan(0.5 * (s - sa))
        * Math.tan(0.5 * (s - sb))
        * Math.tan(0.5 * (s - sc));
    return 4 * Math.atan(Math.sqrt(Math.max(0.0, t)));
  }

  /**
   * Returns the area of triangle ABC from the angles between the planes of its edges. Accurate to
   * about 5e-15 in absolute terms, which is poor for very small triangles.
   */
  public static double girardArea(SpherePoint a, SpherePoint b, SpherePoint c) {
    SpherePoint ab = robustCrossProd(a, b);
    SpherePoint bc = robustCrossProd(b, c);
    SpherePoint ac = robustCrossProd(a, c);
    return Math.max(0.0, ab.angle(ac) - ab.angle(bc) + bc.angle(ac));
  }

  /**
   * Returns a vector orthogonal to both {@code a} and {@code b}, computed as (b + a) x (b - a),
   * which is twice a x b but keeps its precision when the two points are nearly equal.
   */
  static SpherePoint robustCrossProd(SpherePoint a, SpherePoint b) {
    return b.add(a).crossProd(b.sub(a));
  }
}
