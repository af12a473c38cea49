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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LatLngRectTest extends GeometryTestCase {

  private static LatLngRect rectFromDegrees(
      double latLo, double lngLo, double latHi, double lngHi) {
    return new LatLngRect(LatLng.fromDegrees(latLo, lngLo), LatLng.fromDegrees(latHi, lngHi));
  }

  @Test
  public void testEmptyAndFull() {
    LatLngRect empty = LatLngRect.empty();
    LatLngRect full = LatLngRect.full();
    assertTrue(empty.isValid());
    assertTrue(empty.isEmpty());
    assertFalse(empty.isFull());
    assertTrue(full.isValid());
    assertTrue(full.isFull());
    assertFalse(full.isEmpty());
    assertExactly(0.0, empty.area());
    assertDoubleNear(4 * M_PI, full.area());
    assertTrue(full.contains(empty));
    assertFalse(empty.intersects(full));

    // Mismatched emptiness is invalid.
    assertFalse(new LatLngRect(R1Interval.empty(), S1Interval.full()).isValid());
    assertFalse(new LatLngRect(new R1Interval(0, 2), S1Interval.full()).isValid());
  }

  @Test
  public void testAccessors() {
    LatLngRect r = rectFromDegrees(-90, 0, -45, 180);
    assertDoubleNear(-90, r.lo().latDegrees());
    assertDoubleNear(-45, r.hi().latDegrees());
    assertDoubleNear(0, r.lo().lngDegrees());
    assertDoubleNear(180, r.hi().lngDegrees());
    assertTrue(r.isValid());
    assertDoubleNear(-67.5, r.getCenter().latDegrees());
    assertDoubleNear(90, r.getCenter().lngDegrees());
    assertEquals(LatLngRect.fromPoint(LatLng.CENTER), rectFromDegrees(0, 0, 0, 0));
  }

  @Test
  public void testContainsAcrossTheAntimeridian() {
    LatLngRect r = rectFromDegrees(-30, 170, 30, -170);
    assertTrue(r.lng().isInverted());
    assertTrue(r.contains(LatLng.fromDegrees(0, 180)));
    assertTrue(r.contains(LatLng.fromDegrees(10, -175)));
    assertTrue(r.contains(LatLng.fromDegrees(-30, 170)));
    assertFalse(r.contains(LatLng.fromDegrees(0, 0)));
    assertFalse(r.contains(LatLng.fromDegrees(31, 180)));
    assertTrue(r.contains(LatLng.fromDegrees(0, 175).toPoint()));
    assertDoubleNear(Math.toRadians(20), r.lng().getLength(), 1e-14);

    assertTrue(r.contains(rectFromDegrees(-10, 175, 10, -175)));
    assertFalse(r.contains(rectFromDegrees(-10, 160, 10, -175)));
    assertTrue(r.intersects(rectFromDegrees(-10, 160, 10, 175)));
    assertFalse(r.intersects(rectFromDegrees(-10, -160, 10, 160)));
    assertFalse(r.intersects(rectFromDegrees(40, 175, 50, -175)));
  }

  @Test
  public void testDegenerateRectOnTheAntimeridian() {
    LatLng p = LatLng.fromRadians(0, -M_PI);
    LatLngRect r = new LatLngRect(p, p);
    assertFalse(r.isEmpty());
    assertTrue(r.contains(p));
    assertTrue(r.contains(LatLng.fromRadians(0, M_PI)));
    assertEquals(new S1Interval(M_PI, M_PI), r.lng());
  }

  @Test
  public void testAddPointAndUnion() {
    LatLngRect r = LatLngRect.empty();
    r = r.addPoint(LatLng.fromDegrees(0, 0));
    r = r.addPoint(LatLng.fromRadians(0, -0.5));
    r = r.addPoint(LatLng.fromRadians(0.5, 0.25));
    r = r.addPoint(LatLng.fromRadians(-0.5, -0.125));
    assertEquals(new LatLngRect(new R1Interval(-0.5, 0.5), new S1Interval(-0.5, 0.25)), r);

    LatLngRect p = LatLngRect.empty().addPoint(SpherePoint.Y_POS);
    assertDoubleNear(90, p.lo().lngDegrees());
    assertTrue(p.contains(SpherePoint.Y_POS));

    LatLngRect u = r.union(rectFromDegrees(60, 100, 70, 110));
    assertTrue(u.contains(r));
    assertTrue(u.contains(LatLng.fromDegrees(65, 105)));
    assertTrue(r.union(LatLngRect.empty()).equals(r));
  }

  @Test
  public void testExpandedAndPolarClosure() {
    LatLngRect r = rectFromDegrees(70, 150, 80, 170).expanded(Math.toRadians(20), 0);
    assertExactly(M_PI_2, r.lat().hi());
    assertDoubleNear(50, Math.toDegrees(r.lat().lo()), 1e-13);
    assertDoubleNear(150, Math.toDegrees(r.lng().lo()), 1e-13);
    assertTrue(r.polarClosure().lng().isFull());
    assertTrue(r.polarClosure().contains(LatLng.fromRadians(M_PI_2, -0.5)));

    LatLngRect wrapped = rectFromDegrees(-10, 170, 10, 175).expanded(0, Math.toRadians(10));
    // [170, 175] grows to [160, -175] across the antimeridian.
    assertTrue(wrapped.contains(LatLng.fromDegrees(0, -177)));
    assertTrue(wrapped.contains(LatLng.fromDegrees(0, 165)));
    assertFalse(wrapped.contains(LatLng.fromDegrees(0, -172)));
    assertTrue(LatLngRect.empty().expanded(1, 1).isEmpty());
    LatLngRect equatorial = rectFromDegrees(-10, 0, 10, 20);
    assertEquals(equatorial, equatorial.polarClosure());
  }

  @Test
  public void testArea() {
    assertDoubleNear(2 * M_PI, new LatLngRect(new R1Interval(0, M_PI_2), S1Interval.full()).area());
    assertDoubleNear(M_PI, rectFromDegrees(0, 0, 90, 180).area(), 1e-14);
    // A band of equal latitudes has area proportional to its longitude span.
    assertDoubleNear(
        2 * rectFromDegrees(-20, 0, 20, 45).area(), rectFromDegrees(-20, 0, 20, 90).area(), 1e-14);
  }

  @Test
  public void testApproxEqualsAndHashing() {
    LatLngRect r = rectFromDegrees(1, 2, 3, 4);
    assertTrue(r.approxEquals(rectFromDegrees(1, 2, 3, 4)));
    assertFalse(r.approxEquals(rectFromDegrees(1, 2, 3, 5)));
    assertTrue(r.approxEquals(rectFromDegrees(1, 2, 3, 5), Math.toRadians(1.0001)));
    assertEquals(r.hashCode(), rectFromDegrees(1, 2, 3, 4).hashCode());
  }
}
