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
 * A closed latitude/longitude rectangle: a latitude {@link R1Interval} within [-Pi/2, Pi/2] and
 * a longitude {@link S1Interval}. The latitude and longitude ranges are both empty or both
 * non-empty.
 */
@CheckReturnValue
public final class LatLngRect implements Serializable {
  private static final long serialVersionUID = 1L;

  private final R1Interval lat;
  private final S1Interval lng;

  public LatLngRect(R1Interval lat, S1Interval lng) {
    this.lat = lat;
    this.lng = lng;
  }

  /** Builds the rectangle with corners {@code lo} and {@code hi}. */
  public LatLngRect(LatLng lo, LatLng hi) {
    this(
        new R1Interval(lo.latRadians(), hi.latRadians()),
        new S1Interval(lo.lngRadians(), hi.lngRadians()));
  }

  public static LatLngRect empty() {
    return new LatLngRect(R1Interval.empty(), S1Interval.empty());
  }

  public static LatLngRect full() {
    return new LatLngRect(fullLat(), S1Interval.full());
  }

  public static R1Interval fullLat() {
    return new R1Interval(-SphereMath.M_PI_2, SphereMath.M_PI_2);
  }

  public static LatLngRect fromPoint(LatLng p) {
    return new LatLngRect(p, p);
  }

  public R1Interval lat() {
    return lat;
  }

  public S1Interval lng() {
    return lng;
  }

  public LatLng lo() {
    return LatLng.fromRadians(lat.lo(), lng.lo());
  }

  public LatLng hi() {
    return LatLng.fromRadians(lat.hi(), lng.hi());
  }

  public boolean isValid() {
    return Math.abs(lat.lo()) <= SphereMath.M_PI_2
        && Math.abs(lat.hi()) <= SphereMath.M_PI_2
        && lng.isValid()
        && lat.isEmpty() == lng.isEmpty();
  }

  public boolean isEmpty() {
    return lat.isEmpty();
  }

  public boolean isFull() {
    return lat.equals(fullLat()) && lng.isFull();
  }

  public LatLng getCenter() {
    return LatLng.fromRadians(lat.getCenter(), lng.getCenter());
  }

  /** Returns the surface area of the rectangle on the unit sphere. */
  public double area() {
    if (isEmpty()) {
      return 0;
    }
    return lng.getLength() * (Math.sin(lat.hi()) - Math.sin(lat.lo()));
  }

  /** {@code ll} must be valid. */
  public boolean contains(LatLng ll) {
    return lat.contains(ll.latRadians()) && lng.contains(ll.lngRadians());
  }

  public boolean contains(SpherePoint p) {
    return contains(new LatLng(p));
  }

  public boolean contains(LatLngRect other) {
    return lat.contains(other.lat) && lng.contains(other.lng);
  }

  public boolean intersects(LatLngRect other) {
    return lat.intersects(other.lat) && lng.intersects(other.lng);
  }

  /** Returns the smallest rectangle containing this one and {@code ll}, which must be valid. */
  public LatLngRect addPoint(LatLng ll) {
    return new LatLngRect(lat.addPoint(ll.latRadians()), lng.addPoint(ll.lngRadians()));
  }

  public LatLngRect addPoint(SpherePoint p) {
    return addPoint(new LatLng(p));
  }

  /**
   * Grows the latitude range by {@code latMargin} (clamped to the poles) and the longitude range
   * by {@code lngMargin} (wrapped). Both margins must be non-negative. An empty rectangle stays
   * empty.
   */
  public LatLngRect expanded(double latMargin, double lngMargin) {
    return new LatLngRect(
        lat.expanded(latMargin).intersection(fullLat()), lng.expanded(lngMargin));
  }

  /**
   * Returns this rectangle with a full longitude range if it touches either pole, so that it
   * contains every representation of that pole; otherwise returns it unchanged.
   */
  public LatLngRect polarClosure() {
    if (lat.lo() == -SphereMath.M_PI_2 || lat.hi() == SphereMath.M_PI_2) {
      return new LatLngRect(lat, S1Interval.full());
    }
    return this;
  }

  public LatLngRect union(LatLngRect other) {
    return new LatLngRect(lat.union(other.lat), lng.union(other.lng));
  }

  public boolean approxEquals(LatLngRect other, double maxError) {
    return lat.approxEquals(other.lat, maxError) && lng.approxEquals(other.lng, maxError);
  }

  public boolean approxEquals(LatLngRect other) {
    return approxEquals(other, 1e-15);
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof LatLngRect)) {
      return false;
    }
    LatLngRect otherRect = (LatLngRect) that;
    return lat.equals(otherRect.lat) && lng.equals(otherRect.lng);
  }

  @Override
  public int hashCode() {
    int value = 17;
    value = 37 * value + lat.hashCode();
    return (37 * value + lng.hashCode());
  }

  @Override
  public String toString() {
    return "[Lo=" + lo() + ", Hi=" + hi() + "]";
  }
}
