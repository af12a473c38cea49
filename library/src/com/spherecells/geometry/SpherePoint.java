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
 * A direction in 3D space, usually (but not necessarily) of unit length, used to represent
 * points on the sphere. Instances are immutable.
 */
@CheckReturnValue
public final class SpherePoint implements Comparable<SpherePoint>, Serializable {
  private static final long serialVersionUID = 1L;

  public static final SpherePoint ORIGIN = new SpherePoint(0, 0, 0);
  public static final SpherePoint X_POS = new SpherePoint(1, 0, 0);
  public static final SpherePoint X_NEG = new SpherePoint(-1, 0, 0);
  public static final SpherePoint Y_POS = new SpherePoint(0, 1, 0);
  public static final SpherePoint Y_NEG = new SpherePoint(0, -1, 0);
  public static final SpherePoint Z_POS = new SpherePoint(0, 0, 1);
  public static final SpherePoint Z_NEG = new SpherePoint(0, 0, -1);

  final double x;
  final double y;
  final double z;

  public SpherePoint(double x, double y, double z) {
    this.x = x;
    this.y = y;
    this.z = z;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  public double getZ() {
    return z;
  }

  /** Returns the coordinate along the given axis (0 = x, 1 = y, 2 = z). */
  public double get(int axis) {
    return (axis == 0) ? x : (axis == 1) ? y : z;
  }

  public SpherePoint add(SpherePoint p) {
    return new SpherePoint(x + p.x, y + p.y, z + p.z);
  }

  public SpherePoint sub(SpherePoint p) {
    return new SpherePoint(x - p.x, y - p.y, z - p.z);
  }

  public SpherePoint mul(double scale) {
    return new SpherePoint(x * scale, y * scale, z * scale);
  }

  public SpherePoint neg() {
    return new SpherePoint(-x, -y, -z);
  }

  public double dotProd(SpherePoint p) {
    return x * p.x + y * p.y + z * p.z;
  }

  public SpherePoint crossProd(SpherePoint p) {
    return new SpherePoint(y * p.z - z * p.y, z * p.x - x * p.z, x * p.y - y * p.x);
  }

  public double norm2() {
    return x * x + y * y + z * z;
  }

  public double norm() {
    return Math.sqrt(norm2());
  }

  /** Returns a unit-length copy of this point, or the origin if this point is the origin. */
  public SpherePoint normalize() {
    double n = norm();
    if (n != 0) {
      n = 1.0 / n;
    }
    return mul(n);
  }

  /** Returns the angle between this vector and {@code p}, in radians, in the range [0, Pi]. */
  public double angle(SpherePoint p) {
    return Math.atan2(crossProd(p).norm(), dotProd(p));
  }

  /** Returns the square of the Euclidean distance to {@code p}. */
  public double getDistance2(SpherePoint p) {
    double dx = x - p.x;
    double dy = y - p.y;
    double dz = z - p.z;
    return dx * dx + dy * dy + dz * dz;
  }

  /** Returns a unit vector orthogonal to this one. */
  public SpherePoint ortho() {
    switch (largestAbsComponent()) {
      case 1:
        return crossProd(Z_POS).normalize();
      case 2:
        return crossProd(X_POS).normalize();
      default:
        return crossProd(Y_POS).normalize();
    }
  }

  /** Returns the index of the component with the largest absolute value. */
  public int largestAbsComponent() {
    return largestAbsComponent(x, y, z);
  }

  static int largestAbsComponent(double x, double y, double z) {
    double absX = Math.abs(x);
    double absY = Math.abs(y);
    double absZ = Math.abs(z);
    if (absX > absY) {
      return absX > absZ ? 0 : 2;
    }
    return absY > absZ ? 1 : 2;
  }

  /** Returns true if the point is within {@code 5 * DBL_EPSILON} of unit length. */
  public boolean isUnitLength() {
    return Math.abs(norm2() - 1) <= 5 * SphereMath.DBL_EPSILON;
  }

  public boolean equalsPoint(SpherePoint p) {
    return x == p.x && y == p.y && z == p.z;
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof SpherePoint && equalsPoint((SpherePoint) that);
  }

  /** Hashes the absolute coordinates, so that +0.0 and -0.0 hash alike. */
  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(Math.abs(x));
    value += 37 * value + Double.doubleToLongBits(Math.abs(y));
    value += 37 * value + Double.doubleToLongBits(Math.abs(z));
    return (int) (value ^ (value >>> 32));
  }

  /** Lexicographic order on (x, y, z). */
  @Override
  public int compareTo(SpherePoint other) {
    if (x != other.x) {
      return x < other.x ? -1 : 1;
    }
    if (y != other.y) {
      return y < other.y ? -1 : 1;
    }
    if (z != other.z) {
      return z < other.z ? -1 : 1;
    }
    return 0;
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ", " + z + ")";
  }
}
