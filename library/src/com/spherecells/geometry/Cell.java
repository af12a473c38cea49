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

import static com.spherecells.geometry.SphereMath.DBL_EPSILON;
import static com.spherecells.geometry.SphereMath.M_PI_2;
import static com.spherecells.geometry.SphereMath.M_PI_4;

import java.io.Serializable;

/**
 * The geometry of the cell named by a {@link CellId}: its (u,v) rectangle on its cube face, and
 * from that its vertices, edges, area and bounds. Cells are immutable.
 */
public final class Cell implements Region, Serializable {
  private static final long serialVersionUID = 1L;

  /**
   * The four equatorial faces reach +/-45 degrees latitude at the midpoints of their top and
   * bottom edges. The two polar faces reach down to +/-35.26 degrees at their vertices.
   */
  private static final double POLE_MIN_LAT = Math.asin(Math.sqrt(1. / 3)) - 0.5 * DBL_EPSILON;

  private final CellId cellId;
  private final byte face;
  private final byte level;
  private final byte orientation;
  private final double uMin;
  private final double uMax;
  private final double vMin;
  private final double vMax;

  public Cell(CellId id) {
    cellId = id;
    CellId.FaceIJ fij = id.toFaceIJOrientation();
    face = (byte) fij.face;
    orientation = (byte) fij.orientation;
    level = (byte) id.level();
    int cellSize = CellId.getSizeIJ(level);
    int iLo = fij.i & -cellSize;
    int jLo = fij.j & -cellSize;
    uMin = Projection.stToUv(Projection.ijToStMin(iLo));
    uMax = Projection.stToUv(Projection.ijToStMin(iLo + cellSize));
    vMin = Projection.stToUv(Projection.ijToStMin(jLo));
    vMax = Projection.stToUv(Projection.ijToStMin(jLo + cellSize));
  }

  /** Returns the leaf cell containing {@code p}. */
  public Cell(SpherePoint p) {
    this(CellId.fromPoint(p));
  }

  public static Cell fromFace(int face) {
    return new Cell(CellId.fromFace(face));
  }

  public CellId id() {
    return cellId;
  }

  public int face() {
    return face;
  }

  public int level() {
    return level;
  }

  public int orientation() {
    return orientation;
  }

  public boolean isLeaf() {
    return level == CellId.MAX_LEVEL;
  }

  /** Returns the u-range of the cell on its face. */
  public R1Interval getBoundU() {
    return new R1Interval(uMin, uMax);
  }

  /** Returns the v-range of the cell on its face. */
  public R1Interval getBoundV() {
    return new R1Interval(vMin, vMax);
  }

  /** As {@link #getVertexRaw(int)}, normalized to unit length. */
  public SpherePoint getVertex(int k) {
    return getVertexRaw(k).normalize();
  }

  /**
   * Returns vertex k (0..3) in counter-clockwise order: lower left, lower right, upper right,
   * upper left in the (u,v) plane. Not necessarily unit length.
   */
  public SpherePoint getVertexRaw(int k) {
    return Projection.faceUvToXyz(
        face, ((k >> 1) ^ (k & 1)) == 0 ? uMin : uMax, (k >> 1) == 0 ? vMin : vMax);
  }

  /**
   * Returns the inward-facing normal of the great circle through vertices k and k+1 (mod 4). Not
   * necessarily unit length.
   */
  public SpherePoint getEdgeRaw(int k) {
    switch (k & 3) {
      case 0:
        return Projection.getVNorm(face, vMin); // Bottom
      case 1:
        return Projection.getUNorm(face, uMax); // Right
      case 2:
        return Projection.getVNorm(face, vMax).neg(); // Top
      default:
        return Projection.getUNorm(face, uMin).neg(); // Left
    }
  }

  /**
   * Returns the unit-length point at which the cell splits into its children. This is not the
   * centroid of the cell.
   */
  public SpherePoint getCenter() {
    return getCenterRaw().normalize();
  }

  public SpherePoint getCenterRaw() {
    return cellId.toPointRaw();
  }

  /** Returns the average area of cells at {@code level}, in steradians. */
  public static double averageArea(int level) {
    return Metric.AVG_AREA.getValue(level);
  }

  /** Accurate to within a factor of 1.7 and very cheap. */
  public double averageArea() {
    return averageArea(level);
  }

  /**
   * Returns the area of the cell to within 3% at every level, and within 0.1% from level 5 on.
   */
  public double approxArea() {
    // All cells at the first two levels have the same area.
    if (level < 2) {
      return averageArea(level);
    }

    // Projected area: half the length of the cross product of the diagonals.
    double flatArea =
        0.5 * getVertex(2).sub(getVertex(0)).crossProd(getVertex(3).sub(getVertex(1))).norm();

    // Treat the cell as a spherical cap, whose area is 2 / (1 + sqrt(1 - r*r)) times that of its
    // projected disc, with Pi*r*r == flatArea.
    return flatArea * 2 / (1 + Math.sqrt(1 - Math.min(SphereMath.M_1_PI * flatArea, 1.0)));
  }

  /** Returns the area of the cell to about 6 digits, even for leaf cells (around 1e-18). */
  public double exactArea() {
    SpherePoint v0 = getVertex(0);
    SpherePoint v1 = getVertex(1);
    SpherePoint v2 = getVertex(2);
    SpherePoint v3 = getVertex(3);
    return SphereMath.area(v0, v1, v2) + SphereMath.area(v0, v2, v3);
  }

  @Override
  public Cap getCapBound() {
    // The split point is close to the minimal cap axis and cheap to compute.
    Cap cap = Cap.fromAxisHeight(getCenter(), 0);
    for (int k = 0; k < 4; ++k) {
      cap = cap.addPoint(getVertex(k));
    }
    return cap;
  }

  @Override
  public LatLngRect getRectBound() {
    if (level > 0) {
      // Below level 0 the extremes occur at the vertices: one diagonal pair fixes the latitude
      // range and the other pair the longitude range. (i,j) picks the corner farthest from the
      // equator, from the sign of each axis and the cell's (u,v) quadrant.
      double u = uMin + uMax;
      double v = vMin + vMax;
      int i = (Projection.getUAxis(face).z == 0 ? (u < 0) : (u > 0)) ? 1 : 0;
      int j = (Projection.getVAxis(face).z == 0 ? (v < 0) : (v > 0)) ? 1 : 0;
      R1Interval lat =
          R1Interval.fromPointPair(
              LatLng.latitude(getPoint(i, j)).radians(),
              LatLng.latitude(getPoint(1 - i, 1 - j)).radians());
      S1Interval lng =
          S1Interval.fromPointPair(
              LatLng.longitude(getPoint(i, 1 - j)).radians(),
              LatLng.longitude(getPoint(1 - i, j)).radians());

      // Normalizing the vertices can move a contained point's latitude or longitude by up to
      // 2 * DBL_EPSILON past these bounds.
      return new LatLngRect(lat, lng).expanded(2 * DBL_EPSILON, 2 * DBL_EPSILON).polarClosure();
    }

    LatLngRect bound;
    switch (face) {
      case 0:
        bound =
            new LatLngRect(new R1Interval(-M_PI_4, M_PI_4), new S1Interval(-M_PI_4, M_PI_4));
        break;
      case 1:
        bound =
            new LatLngRect(new R1Interval(-M_PI_4, M_PI_4), new S1Interval(M_PI_4, 3 * M_PI_4));
        break;
      case 2:
        bound = new LatLngRect(new R1Interval(POLE_MIN_LAT, M_PI_2), S1Interval.full());
        break;
      case 3:
        bound =
            new LatLngRect(
                new R1Interval(-M_PI_4, M_PI_4), new S1Interval(3 * M_PI_4, -3 * M_PI_4));
        break;
      case 4:
        bound =
            new LatLngRect(
                new R1Interval(-M_PI_4, M_PI_4), new S1Interval(-3 * M_PI_4, -M_PI_4));
        break;
      default:
        bound = new LatLngRect(new R1Interval(-M_PI_2, -POLE_MIN_LAT), S1Interval.full());
        break;
    }
    // Latitude needs room for the rounding of a contained point's computed latitude. Longitude
    // comes from a single atan2, which is semi-monotonic.
    return bound.expanded(DBL_EPSILON, 0);
  }

  @Override
  public boolean mayIntersect(Cell cell) {
    return cellId.intersects(cell.cellId);
  }

  /**
   * Returns true if {@code p}, which need not be unit length, lies in the cell. Points on the
   * boundary between two faces are contained by the cells on both sides.
   */
  @Override
  public boolean contains(SpherePoint p) {
    R2Vector uv = Projection.faceXyzToUv(face, p);
    if (uv == null) {
      return false;
    }
    return uv.x() >= uMin && uv.x() <= uMax && uv.y() >= vMin && uv.y() <= vMax;
  }

  @Override
  public boolean contains(Cell cell) {
    return cellId.contains(cell.cellId);
  }

  private SpherePoint getPoint(int i, int j) {
    return Projection.faceUvToXyz(face, i == 0 ? uMin : uMax, j == 0 ? vMin : vMax);
  }

  @Override
  public String toString() {
    return "[" + face + ", " + level + ", " + orientation + ", " + cellId + "]";
  }

  @Override
  public int hashCode() {
    int value = 17;
    value = 37 * (37 * (37 * value + face) + orientation) + level;
    return 37 * value + cellId.hashCode();
  }

  @Override
  public boolean equals(Object that) {
    if (that instanceof Cell) {
      Cell thatCell = (Cell) that;
      return cellId.equals(thatCell.cellId);
    }
    return false;
  }
}
