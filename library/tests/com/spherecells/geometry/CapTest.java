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
import static com.spherecells.geometry.SphereMath.M_PI_4;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CapTest extends GeometryTestCase {
  /** About 9 times the double-precision roundoff relative error. */
  private static final double EPS = 1e-15;

  /** Tolerance for latitudes and longitudes measured in degrees. */
  private static final double DEGREE_EPS = 1e-13;

  private static SpherePoint getLatLngPoint(double latDegrees, double lngDegrees) {
    return LatLng.fromDegrees(latDegrees, lngDegrees).toPoint();
  }

  @Test
  public void testEmptyAndFull() {
    Cap empty = Cap.empty();
    Cap full = Cap.full();
    assertTrue(empty.isValid());
    assertTrue(empty.isEmpty());
    assertTrue(empty.complement().isFull());
    assertTrue(full.isValid());
    assertTrue(full.isFull());
    assertTrue(full.complement().isEmpty());
    assertExactly(2.0, full.height());
    assertDoubleNear(180, full.angle().degrees());
    assertTrue(empty.angle().radians() < 0);
    assertExactly(0.0, empty.area());
    assertDoubleNear(4 * M_PI, full.area());

    assertTrue(empty.contains(empty));
    assertTrue(full.contains(empty));
    assertTrue(full.contains(full));
    assertFalse(empty.intersects(empty));
    assertTrue(full.intersects(full));
    assertFalse(full.intersects(empty));
    assertEquals(Cap.empty(), Cap.fromAxisHeight(SpherePoint.Z_POS, -0.5));
    assertEquals(Cap.full().hashCode(), Cap.fromAxisHeight(SpherePoint.Y_NEG, 2).hashCode());
  }

  @Test
  public void testSingletons() {
    Cap xaxis = Cap.fromAxisHeight(SpherePoint.X_POS, 0);
    assertTrue(xaxis.contains(SpherePoint.X_POS));
    assertFalse(xaxis.contains(new SpherePoint(1, 1e-20, 0)));
    assertExactly(0.0, xaxis.angle().radians());

    Cap yaxis = Cap.fromAxisAngle(SpherePoint.Y_POS, Angle.radians(0));
    assertFalse(yaxis.contains(xaxis.axis()));
    assertExactly(0.0, yaxis.height());

    // The complement of a singleton is full, so complementing twice does not return it.
    Cap xcomp = xaxis.complement();
    assertTrue(xcomp.isValid());
    assertTrue(xcomp.isFull());
    assertTrue(xcomp.contains(xaxis.axis()));
    assertTrue(xcomp.complement().isValid());
    assertTrue(xcomp.complement().isEmpty());
    assertFalse(xcomp.complement().contains(xaxis.axis()));
  }

  @Test
  public void testTinyCap() {
    // Small enough that a unit vector perturbed this far along a tangent needs no renormalizing.
    final double tinyRad = 1e-10;
    Cap tiny =
        Cap.fromAxisAngle(new SpherePoint(1, 2, 3).normalize(), Angle.radians(tinyRad));
    SpherePoint tangent = tiny.axis().crossProd(new SpherePoint(3, 2, 1)).normalize();
    assertTrue(tiny.contains(tiny.axis().add(tangent.mul(0.99 * tinyRad))));
    assertFalse(tiny.contains(tiny.axis().add(tangent.mul(1.01 * tinyRad))));
  }

  @Test
  public void testHemisphereAndConcaveCaps() {
    Cap hemi = Cap.fromAxisHeight(new SpherePoint(1, 0, 1).normalize(), 1);
    assertEquals(hemi.axis().neg(), hemi.complement().axis());
    assertExactly(1.0, hemi.complement().height());
    assertTrue(hemi.contains(SpherePoint.X_POS));
    assertFalse(hemi.complement().contains(SpherePoint.X_POS));
    assertTrue(hemi.contains(new SpherePoint(1, 0, -(1 - EPS)).normalize()));
    assertFalse(hemi.interiorContains(new SpherePoint(1, 0, -(1 + EPS)).normalize()));

    Cap concave = Cap.fromAxisAngle(getLatLngPoint(80, 10), Angle.degrees(150));
    assertTrue(concave.contains(getLatLngPoint(-70 * (1 - EPS), 10)));
    assertFalse(concave.contains(getLatLngPoint(-70 * (1 + EPS), 10)));
    assertTrue(concave.contains(getLatLngPoint(-50 * (1 - EPS), -170)));
    assertFalse(concave.contains(getLatLngPoint(-50 * (1 + EPS), -170)));

    Cap tiny = Cap.fromAxisAngle(new SpherePoint(1, 2, 3).normalize(), Angle.radians(1e-10));
    assertTrue(hemi.contains(tiny));
    assertTrue(hemi.contains(Cap.fromAxisAngle(SpherePoint.X_POS, Angle.radians(M_PI_4 - EPS))));
    assertFalse(
        hemi.contains(Cap.fromAxisAngle(SpherePoint.X_POS, Angle.radians(M_PI_4 + EPS))));
    assertTrue(concave.contains(hemi));
    assertTrue(concave.intersects(hemi.complement()));
    assertFalse(concave.contains(Cap.fromAxisHeight(concave.axis().neg(), 0.1)));
  }

  @Test
  public void testFromAxisArea() {
    Cap cap = Cap.fromAxisArea(SpherePoint.Z_POS, 2 * M_PI);
    assertDoubleNear(1.0, cap.height());
    assertDoubleNear(90, cap.angle().degrees(), DEGREE_EPS);
    assertDoubleNear(2 * M_PI, cap.area());
    assertTrue(Cap.fromAxisArea(SpherePoint.Z_POS, 4 * M_PI).isFull());
  }

  @Test
  public void testAddPoint() {
    Cap cap = Cap.empty().addPoint(SpherePoint.Z_POS);
    assertEquals(SpherePoint.Z_POS, cap.axis());
    assertExactly(0.0, cap.height());

    cap = cap.addPoint(SpherePoint.X_POS);
    assertEquals(SpherePoint.Z_POS, cap.axis());
    assertTrue(cap.contains(SpherePoint.X_POS));
    assertTrue(cap.contains(SpherePoint.Y_NEG));
    assertFalse(cap.contains(new SpherePoint(0, 1, -0.1).normalize()));
    assertDoubleNear(1.0, cap.height(), 1e-15);

    cap = cap.addPoint(SpherePoint.Z_NEG);
    assertTrue(cap.isFull());

    for (int i = 0; i < 100; ++i) {
      Cap random = getRandomCap(1e-6, 1);
      SpherePoint p = randomPoint();
      Cap grown = random.addPoint(p);
      assertTrue(grown.contains(p));
      assertTrue(grown.contains(random));
    }
  }

  @Test
  public void testAddCap() {
    assertTrue(Cap.empty().addCap(Cap.empty()).isEmpty());
    Cap north = Cap.fromAxisAngle(SpherePoint.Z_POS, Angle.degrees(10));
    assertEquals(north, Cap.empty().addCap(north));
    assertEquals(north, north.addCap(Cap.empty()));

    Cap east = Cap.fromAxisAngle(SpherePoint.Y_POS, Angle.degrees(20));
    Cap merged = north.addCap(east);
    assertEquals(north.axis(), merged.axis());
    assertDoubleNear(110, merged.angle().degrees(), 1e-12);
    assertTrue(merged.contains(getLatLngPoint(-15, 90)));
    assertFalse(merged.contains(getLatLngPoint(-25, 90)));
    assertTrue(north.addCap(Cap.fromAxisAngle(SpherePoint.Z_NEG, Angle.degrees(1))).isFull());
  }

  @Test
  public void testRectBound() {
    assertTrue(Cap.empty().getRectBound().isEmpty());
    assertTrue(Cap.full().getRectBound().isFull());

    // Includes the south pole.
    LatLngRect rect =
        Cap.fromAxisAngle(getLatLngPoint(-45, 57), Angle.degrees(50)).getRectBound();
    assertDoubleNear(-90, Math.toDegrees(rect.lat().lo()), DEGREE_EPS);
    assertDoubleNear(5, Math.toDegrees(rect.lat().hi()), DEGREE_EPS);
    assertTrue(rect.lng().isFull());

    // Centered on the equator.
    rect = Cap.fromAxisAngle(getLatLngPoint(0, 50), Angle.degrees(20)).getRectBound();
    assertDoubleNear(-20, Math.toDegrees(rect.lat().lo()), DEGREE_EPS);
    assertDoubleNear(20, Math.toDegrees(rect.lat().hi()), DEGREE_EPS);
    assertDoubleNear(30, Math.toDegrees(rect.lng().lo()), DEGREE_EPS);
    assertDoubleNear(70, Math.toDegrees(rect.lng().hi()), DEGREE_EPS);

    // Centered on the north pole.
    rect = Cap.fromAxisAngle(getLatLngPoint(90, 123), Angle.degrees(10)).getRectBound();
    assertDoubleNear(80, Math.toDegrees(rect.lat().lo()), DEGREE_EPS);
    assertDoubleNear(90, Math.toDegrees(rect.lat().hi()), DEGREE_EPS);
    assertTrue(rect.lng().isFull());
  }

  @Test
  public void testCells() {
    // The distance from the center of a face to one of its vertices.
    final double faceRadius = Math.atan(SphereMath.M_SQRT2);

    for (int face = 0; face < 6; ++face) {
      Cell rootCell = Cell.fromFace(face);
      // Leaf cells at the midpoint of the v=1 edge and at the u=1, v=1 corner.
      Cell edgeCell = new Cell(Projection.faceUvToXyz(face, 0, 1 - EPS));
      Cell cornerCell = new Cell(Projection.faceUvToXyz(face, 1 - EPS, 1 - EPS));

      assertTrue(Cap.full().contains(rootCell));
      assertFalse(Cap.empty().mayIntersect(rootCell));

      // Near the (1,1) corner the curve stays on the same face.
      CellId first = cornerCell.id().prev().prev().prev();
      CellId last = cornerCell.id().next().next().next().next();
      for (CellId id = first; id.lessThan(last); id = id.next()) {
        Cell cell = new Cell(id);
        assertEquals(id.equals(cornerCell.id()), cell.getCapBound().contains(cornerCell));
        assertEquals(
            id.parent().contains(cornerCell.id()), cell.getCapBound().mayIntersect(cornerCell));
      }

      int antiFace = (face + 3) % 6;
      for (int capFace = 0; capFace < 6; ++capFace) {
        SpherePoint center = Projection.getNorm(capFace);

        // Barely contains all of capFace.
        Cap covering = Cap.fromAxisAngle(center, Angle.radians(faceRadius + EPS));
        assertEquals(capFace == face, covering.contains(rootCell));
        assertEquals(capFace != antiFace, covering.mayIntersect(rootCell));
        assertEquals(center.dotProd(edgeCell.getCenter()) > 0.1, covering.contains(edgeCell));
        assertEquals(covering.contains(edgeCell), covering.mayIntersect(edgeCell));
        assertEquals(capFace == face, covering.contains(cornerCell));
        assertEquals(
            center.dotProd(cornerCell.getCenter()) > 0, covering.mayIntersect(cornerCell));

        // Barely reaches past the edges of capFace.
        Cap bulging = Cap.fromAxisAngle(center, Angle.radians(M_PI_4 + EPS));
        assertFalse(bulging.contains(rootCell));
        assertEquals(capFace != antiFace, bulging.mayIntersect(rootCell));
        assertEquals(capFace == face, bulging.contains(edgeCell));
        assertEquals(center.dotProd(edgeCell.getCenter()) > 0.1, bulging.mayIntersect(edgeCell));
        assertFalse(bulging.contains(cornerCell));
        assertFalse(bulging.mayIntersect(cornerCell));

        Cap singleton = Cap.fromAxisAngle(center, Angle.radians(0));
        assertEquals(capFace == face, singleton.mayIntersect(rootCell));
        assertFalse(singleton.mayIntersect(edgeCell));
        assertFalse(singleton.mayIntersect(cornerCell));
      }
    }
  }
}
