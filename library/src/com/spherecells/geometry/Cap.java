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
import static com.spherecells.geometry.SphereMath.M_PI_2;
import static java.lang.Math.max;

import com.google.errorprone.annotations.CheckReturnValue;
import java.io.Serializable;

/**
 * A disc-shaped region of the sphere: all points within some angle of a unit-length axis.
 *
 * <p>The cap is stored as its axis and its height, the distance from the axis point to the cutting
 * plane measured along the axis. A negative height is the empty cap and a height of 2 or more is
 * the full sphere. Point containment compares heights without trigonometry.
 */
@CheckReturnValue
public final class Cap implements Region, Serializable {
  private static final long serialVersionUID = 1L;

  /** Multiplier that rounds a computed height up by one ulp. */
  private static final double ROUND_UP = 1.0 + SphereMath.DBL_EPSILON;

  private final SpherePoint axis;
  private final double height;

  private Cap(SpherePoint axis, double height) {
    this.axis = axis;
    this.height = height;
  }

  /** {@code axis} should be unit length. */
  public static Cap fromAxisHeight(SpherePoint axis, double height) {
    return new Cap(axis, height);
  }

  /** {@code axis} should be unit length and {@code angle} should be in [0, Pi]. */
  public static Cap fromAxisAngle(SpherePoint axis, Angle angle) {
    // The min() handles Angle.INFINITY.
    double d = Math.sin(0.5 * Math.min(angle.radians(), M_PI));
    return new Cap(axis, 2 * d * d);
  }

  /** {@code area} is in steradians and should be in [0, 4*Pi]. */
  public static Cap fromAxisArea(SpherePoint axis, double area) {
    return new Cap(axis, area / (2 * M_PI));
  }

  public static Cap empty() {
    return new Cap(SpherePoint.X_POS, -1);
  }

  public static Cap full() {
    return new Cap(SpherePoint.X_POS, 2);
  }

  public SpherePoint axis() {
    return axis;
  }

  public double height() {
    return height;
  }

  public double area() {
    return 2 * M_PI * max(0.0, height);
  }

  /** Returns the opening angle of the cap; negative for the empty cap. */
  public Angle angle() {
    if (isEmpty()) {
      return Angle.radians(-1);
    }
    return Angle.radians(2 * Math.asin(Math.sqrt(0.5 * Math.min(height, 2))));
  }

  /** Negative heights are valid and mean the cap is empty. */
  public boolean isValid() {
    return axis.isUnitLength() && height <= 2;
  }

  public boolean isEmpty() {
    return height < 0;
  }

  public boolean isFull() {
    return height >= 2;
  }

  /**
   * Returns the complement of the interior of this cap. The complement of a single-point cap is
   * full, like the complement of the empty cap.
   */
  public Cap complement() {
    double newHeight = isEmpty() ? 2 : (isFull() ? -1 : 2 - max(height, 0.0));
    return fromAxisHeight(axis.neg(), newHeight);
  }

  /** Returns true if this cap contains every point of {@code other}. */
  public boolean contains(Cap other) {
    if (isFull() || other.isEmpty()) {
      return true;
    }
    return angle().radians() >= axis.angle(other.axis) + other.angle().radians();
  }

  public boolean intersects(Cap other) {
    if (isEmpty() || other.isEmpty()) {
      return false;
    }
    return angle().radians() + other.angle().radians() >= axis.angle(other.axis);
  }

  /** {@code p} should be unit length. */
  @Override
  public boolean contains(SpherePoint p) {
    return axis.sub(p).norm2() <= 2 * height;
  }

  public boolean interiorContains(SpherePoint p) {
    return isFull() || axis.sub(p).norm2() < 2 * height;
  }

  /**
   * Returns this cap grown just enough to contain {@code p}, which should be unit length. An empty
   * cap becomes the single point {@code p}; otherwise the axis is unchanged.
   */
  public Cap addPoint(SpherePoint p) {
    if (isEmpty()) {
      return new Cap(p, 0);
    }
    double dist2 = axis.sub(p).norm2();
    return new Cap(axis, max(height, ROUND_UP * 0.5 * dist2));
  }

  /** Returns this cap grown just enough to contain {@code other}, keeping this cap's axis. */
  public Cap addCap(Cap other) {
    if (isEmpty()) {
      return other;
    }
    if (other.isEmpty()) {
      return this;
    }
    double angle = axis.angle(other.axis) + other.angle().radians();
    if (angle >= M_PI) {
      return new Cap(axis, 2);
    }
    double d = Math.sin(0.5 * angle);
    return new Cap(axis, max(height, ROUND_UP * 2 * d * d));
  }

  @Override
  public Cap getCapBound() {
    return this;
  }

  @Override
  public LatLngRect getRectBound() {
    if (isEmpty()) {
      return LatLngRect.empty();
    }
    if (isFull()) {
      return LatLngRect.full();
    }

    LatLng axisLatLng = new LatLng(axis);
    double capAngle = angle().radians();

    boolean allLongitudes = false;
    double latLo = axisLatLng.latRadians() - capAngle;
    double latHi = axisLatLng.latRadians() + capAngle;
    double lngLo = -M_PI;
    double lngHi = M_PI;
    if (latLo <= -M_PI_2) {
      latLo = -M_PI_2;
      allLongitudes = true;
    }
    if (latHi >= M_PI_2) {
      latHi = M_PI_2;
      allLongitudes = true;
    }
    if (!allLongitudes) {
      // In the right spherical triangle formed by the north pole, the axis and the tangent point
      // of a meridian, sin(A) = sin(capAngle) / sin(colatitude).
      double sinA = Math.sin(capAngle);
      double sinC = Math.cos(axisLatLng.latRadians());
      if (sinA <= sinC) {
        double angleA = Math.asin(sinA / sinC);
        lngLo = Platform.IEEEremainder(axisLatLng.lngRadians() - angleA, 2 * M_PI);
        lngHi = Platform.IEEEremainder(axisLatLng.lngRadians() + angleA, 2 * M_PI);
      }
    }
    return new LatLngRect(new R1Interval(latLo, latHi), new S1Interval(lngLo, lngHi));
  }

  @Override
  public boolean contains(Cell cell) {
    // Vertices are checked first because the complement of a very small cap is not representable.
    SpherePoint[] vertices = new SpherePoint[4];
    for (int k = 0; k < 4; ++k) {
      vertices[k] = cell.getVertex(k);
      if (!contains(vertices[k])) {
        return false;
      }
    }
    return !complement().intersects(cell, vertices);
  }

  @Override
  public boolean mayIntersect(Cell cell) {
    SpherePoint[] vertices = new SpherePoint[4];
    for (int k = 0; k < 4; ++k) {
      vertices[k] = cell.getVertex(k);
      if (contains(vertices[k])) {
        return true;
      }
    }
    return intersects(cell, vertices);
  }

  /**
   * Returns true if this cap intersects {@code cell}, given that none of the cell's
   * {@code vertices} are contained by the cap.
   */
  boolean intersects(Cell cell, SpherePoint[] vertices) {
    // A hemisphere or larger cap and the cell are both convex here, so with no vertex inside
    // there is no intersection.
    if (height >= 1) {
      return false;
    }
    if (isEmpty()) {
      return false;
    }
    if (cell.contains(axis)) {
      return true;
    }

    // Otherwise the cap can only meet the cell through the interior of an edge.
    double sin2Angle = height * (2 - height);
    for (int k = 0; k < 4; ++k) {
      SpherePoint edge = cell.getEdgeRaw(k);
      double dot = axis.dotProd(edge);
      if (dot > 0) {
        // The axis is inside this edge's half-space; the opposite edge decides.
        continue;
      }
      if (dot * dot > sin2Angle * edge.norm2()) {
        return false;
      }
      SpherePoint dir = edge.crossProd(axis);
      if (dir.dotProd(vertices[k]) < 0 && dir.dotProd(vertices[(k + 1) & 3]) > 0) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if the axes are within {@code maxError} and so are the heights. */
  public boolean approxEquals(Cap other, double maxError) {
    return (axis.sub(other.axis).norm() <= maxError && Math.abs(height - other.height) <= maxError)
        || (isEmpty() && other.height <= maxError)
        || (other.isEmpty() && height <= maxError)
        || (isFull() && other.height >= 2 - maxError)
        || (other.isFull() && height >= 2 - maxError);
  }

  public boolean approxEquals(Cap other) {
    return approxEquals(other, 1e-14);
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof Cap)) {
      return false;
    }
    Cap other = (Cap) that;
    return (axis.equalsPoint(other.axis) && height == other.height)
        || (isEmpty() && other.isEmpty())
        || (isFull() && other.isFull());
  }

  @Override
  public int hashCode() {
    if (isFull()) {
      return 17;
    } else if (isEmpty()) {
      return 37;
    }
    int result = 17;
    result = 37 * result + axis.hashCode();
    long heightBits = Double.doubleToLongBits(height);
    return 37 * result + (int) (heightBits ^ (heightBits >>> 32));
  }

  @Override
  public String toString() {
    return "[Axis=" + axis + ", Angle=" + angle() + "]";
  }
}
