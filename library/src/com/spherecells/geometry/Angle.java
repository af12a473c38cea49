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

import java.io.Serializable;

/**
 * A one-dimensional angle, stored in radians. Used for angular distances on the unit sphere,
 * e.g. the radius by which {@link CellUnion#expand(Angle, int)} grows a region.
 */
public final class Angle implements Comparable<Angle>, Serializable {
  private static final long serialVersionUID = 1L;

  public static final Angle ZERO = new Angle(0);
  public static final Angle INFINITY = new Angle(Double.POSITIVE_INFINITY);

  private final double radians;

  private Angle(double radians) {
    this.radians = radians;
  }

  public static Angle radians(double radians) {
    return new Angle(radians);
  }

  public static Angle degrees(double degrees) {
    return new Angle(Math.toRadians(degrees));
  }

  /** Returns the angle between two points, which need not be unit length. */
  public static Angle between(SpherePoint a, SpherePoint b) {
    return new Angle(a.angle(b));
  }

  public double radians() {
    return radians;
  }

  public double degrees() {
    return Math.toDegrees(radians);
  }

  public Angle add(Angle a) {
    return new Angle(radians + a.radians);
  }

  public Angle sub(Angle a) {
    return new Angle(radians - a.radians);
  }

  public boolean lessThan(Angle that) {
    return radians < that.radians;
  }

  public boolean greaterThan(Angle that) {
    return radians > that.radians;
  }

  @Override
  public int compareTo(Angle that) {
    return Double.compare(radians, that.radians);
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof Angle && radians == ((Angle) that).radians;
  }

  @Override
  public int hashCode() {
    long value = Double.doubleToLongBits(radians);
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return degrees() + "d";
  }
}
