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

/** A point on the unit sphere as a latitude/longitude pair, stored in radians. */
@CheckReturnValue
public final class LatLng implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final LatLng CENTER = new LatLng(0.0, 0.0);

  private final double latRadians;
  private final double lngRadians;

  private LatLng(double latRadians, double lngRadians) {
    this.latRadians = latRadians;
    this.lngRadians = lngRadians;
  }

  public LatLng(Angle lat, Angle lng) {
    this(lat.radians(), lng.radians());
  }

  /** Converts a point, which need not be unit length. */
  public LatLng(SpherePoint p) {
    this(latitude(p).radians(), longitude(p).radians());
  }

  public static LatLng fromRadians(double latRadians, double lngRadians) {
    return new LatLng(latRadians, lngRadians);
  }

  public static LatLng fromDegrees(double latDegrees, double lngDegrees) {
    return new LatLng(Math.toRadians(latDegrees), Math.toRadians(lngDegrees));
  }

  public static Angle latitude(SpherePoint p) {
    // atan2 is much more accurate than asin near the poles, and p need not be unit length.
    return Angle.radians(Math.atan2(p.z, Math.sqrt(p.x * p.x + p.y * p.y)));
  }

  /** atan2(0, 0) is defined to be zero. */
  public static Angle longitude(SpherePoint p) {
    return Angle.radians(Math.atan2(p.y, p.x));
  }

  public Angle lat() {
    return Angle.radians(latRadians);
  }

  public Angle lng() {
    return Angle.radians(lngRadians);
  }

  public double latRadians() {
    return latRadians;
  }

  public double lngRadians() {
    return lngRadians;
  }

  public double latDegrees() {
    return Math.toDegrees(latRadians);
  }

  public double lngDegrees() {
    return Math.toDegrees(lngRadians);
  }

  /** True if the latitude is within [-90, 90] degrees and the longitude within [-180, 180]. */
  public boolean isValid() {
    return Math.abs(latRadians) <= SphereMath.M_PI_2 && Math.abs(lngRadians) <= SphereMath.M_PI;
  }

  /** Clamps the latitude and wraps the longitude so that the result is valid. */
  public LatLng normalized() {
    return new LatLng(
        Math.max(-SphereMath.M_PI_2, Math.min(SphereMath.M_PI_2, latRadians)),
        Platform.IEEEremainder(lngRadians, 2 * SphereMath.M_PI));
  }

  /** Returns the equivalent unit-length point. */
  public SpherePoint toPoint() {
    double cosLat = Math.cos(latRadians);
    return new SpherePoint(
        Math.cos(lngRadians) * cosLat, Math.sin(lngRadians) * cosLat, Math.sin(latRadians));
  }

  /** Returns the surface distance to {@code o} by the haversine formula. */
  public Angle getDistance(LatLng o) {
    double dlat = Math.sin(0.5 * (o.latRadians - latRadians));
    double dlng = Math.sin(0.5 * (o.lngRadians - lngRadians));
    double x = dlat * dlat + dlng * dlng * Math.cos(latRadians) * Math.cos(o.latRadians);
    return Angle.radians(2 * Math.asin(Math.sqrt(Math.min(1.0, x))));
  }

  @Override
  public boolean equals(Object that) {
    if (that instanceof LatLng) {
      LatLng o = (LatLng) that;
      return latRadians == o.latRadians && lngRadians == o.lngRadians;
    }
    return false;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(latRadians);
    value += 37 * value + Double.doubleToLongBits(lngRadians);
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "(" + latRadians + ", " + lngRadians + ")";
  }

  /** Returns "lat,lng" in degrees. */
  public String toStringDegrees() {
    return latDegrees() + "," + lngDegrees();
  }
}
