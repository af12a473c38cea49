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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ProjectionTest extends GeometryTestCase {

  @Test
  public void testStUvEndpoints() {
    assertExactly(-1.0, Projection.stToUv(0));
    assertExactly(0.0, Projection.stToUv(0.5));
    assertExactly(1.0, Projection.stToUv(1));
    assertExactly(0.0, Projection.uvToSt(-1));
    assertExactly(0.5, Projection.uvToSt(0));
    assertExactly(1.0, Projection.uvToSt(1));
  }

  @Test
  public void testStUvInverses() {
    for (int i = 0; i < 1000; ++i) {
      double s = rand.nextDouble();
      assertDoubleNear(s, Projection.uvToSt(Projection.stToUv(s)), 1e-15);
      double u = uniform(-1, 1);
      assertDoubleNear(u, Projection.stToUv(Projection.uvToSt(u)), 1e-15);
    }
  }

  @Test
  public void testStToIj() {
    assertEquals(0, Projection.stToIj(-1));
    assertEquals(0, Projection.stToIj(0));
    assertEquals(CellId.MAX_SIZE / 2, Projection.stToIj(0.5));
    assertEquals(CellId.MAX_SIZE - 1, Projection.stToIj(1));
    assertEquals(CellId.MAX_SIZE - 1, Projection.stToIj(1.5));
    assertEquals(CellId.MAX_SIZE - 1, Projection.stToIj(2));
    assertEquals(CellId.MAX_SIZE - 1, Projection.stToIj(1e10));
    assertExactly(0.5, Projection.ijToStMin(CellId.MAX_SIZE / 2));
    assertExactly(1.0, Projection.ijToStMin(CellId.MAX_SIZE));
    assertExactly(0.5, Projection.siTiToSt(Projection.MAX_SITI / 2));
    // The lower edge of the level-1 cell that starts at the face midpoint.
    assertExactly(0.0, Projection.ijToUv(CellId.MAX_SIZE / 2 + 12345, CellId.MAX_SIZE / 2));
  }

  @Test
  public void testFaceUvRoundTrip() {
    for (int face = 0; face < 6; ++face) {
      SpherePoint center = Projection.faceUvToXyz(face, 0, 0);
      assertEquals(Projection.getNorm(face), center);
      assertEquals(face, Projection.xyzToFace(center));
      assertEquals(
          Projection.getUAxis(face),
          Projection.faceUvToXyz(face, 1, 0).sub(center));
      assertEquals(
          Projection.getVAxis(face),
          Projection.faceUvToXyz(face, 0, 1).sub(center));
      // The opposite face cannot project this face's points.
      assertNull(Projection.faceXyzToUv((face + 3) % 6, center));
    }
    for (int i = 0; i < 1000; ++i) {
      int face = random(6);
      double u = uniform(-1, 1);
      double v = uniform(-1, 1);
      SpherePoint p = Projection.faceUvToXyz(face, u, v);
      assertEquals(face, Projection.xyzToFace(p));
      R2Vector uv = Projection.faceXyzToUv(face, p);
      assertNotNull(uv);
      assertDoubleNear(u, uv.x(), 1e-15);
      assertDoubleNear(v, uv.y(), 1e-15);
    }
  }

  @Test
  public void testEdgeNormals() {
    for (int face = 0; face < 6; ++face) {
      for (int i = 0; i < 10; ++i) {
        double u = uniform(-1, 1);
        double v = uniform(-1, 1);
        SpherePoint p = Projection.faceUvToXyz(face, u, v);
        // Each edge plane holds every point with that coordinate. The u-normal points toward
        // smaller u and the v-normal toward larger v.
        assertDoubleNear(0, Projection.getUNorm(face, u).dotProd(p), 1e-15);
        assertDoubleNear(0, Projection.getVNorm(face, v).dotProd(p), 1e-15);
        assertTrue(Projection.getUNorm(face, u - 0.5).dotProd(p) < 0);
        assertTrue(Projection.getUNorm(face, u + 0.5).dotProd(p) > 0);
        assertTrue(Projection.getVNorm(face, v - 0.5).dotProd(p) > 0);
        assertTrue(Projection.getVNorm(face, v + 0.5).dotProd(p) < 0);
      }
    }
  }
}
