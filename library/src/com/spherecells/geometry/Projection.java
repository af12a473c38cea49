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

import org.jspecify.annotations.Nullable;

/**
 * The coordinate systems used to map points on the sphere to cells.
 *
 * <ul>
 *   <li>(face, i, j): leaf-cell coordinates. "i" and "j" are integers in [0, 2^30) identifying a
 *       leaf cell on a face. The faces are oriented so that the Hilbert curve connects
 *       continuously from one face to the next.
 *   <li>(face, s, t): cell-space coordinates, reals in [0,1]. (0.5, 0.5) is the center of the face
 *       cell.
 *   <li>(face, si, ti): s and t multiplied by 2^31, which represents the centers and edges of all
 *       cells exactly.
 *   <li>(face, u, v): cube-space coordinates in [-1,1], obtained from (s,t) by the quadratic
 *       transform {@link #stToUv} that makes cell areas more uniform.
 *   <li>(x, y, z): a direction vector, not necessarily unit length.
 * </ul>
 *
 * All of these systems are right-handed on every face.
 */
public final class Projection {
  /** The largest si or ti coordinate; valid values are in [0, MAX_SITI]. */
  public static final long MAX_SITI = 1L << (CellId.MAX_LEVEL + 1);

  private static final SpherePoint[][] FACE_UVW_AXES = {
    {SpherePoint.Y_POS, SpherePoint.Z_POS, SpherePoint.X_POS},
    {SpherePoint.X_NEG, SpherePoint.Z_POS, SpherePoint.Y_POS},
    {SpherePoint.X_NEG, SpherePoint.Y_NEG, SpherePoint.Z_POS},
    {SpherePoint.Z_NEG, SpherePoint.Y_NEG, SpherePoint.X_NEG},
    {SpherePoint.Z_NEG, SpherePoint.X_POS, SpherePoint.Y_NEG},
    {SpherePoint.Y_POS, SpherePoint.X_POS, SpherePoint.Z_NEG}
  };

  private Projection() {}

  /** Quadratic transform from an s- or t-value in [0,1] to a u- or v-value in [-1,1]. */
  public static double stToUv(double s) {
    if (s >= 0.5) {
      return (1 / 3.) * (4 * s * s - 1);
    } else {
      return (1 / 3.) * (1 - 4 * (1 - s) * (1 - s));
    }
  }

  /** Inverse of {@link #stToUv}, up to rounding. */
  public static double uvToSt(double u) {
    if (u >= 0) {
      return 0.5 * Math.sqrt(1 + 3 * u);
    } else {
      return 1 - 0.5 * Math.sqrt(1 - 3 * u);
    }
  }

  /**
   * Returns the i- or j-index of the leaf cell containing the given s- or t-value, clamped to the
   * range of valid leaf indices.
   */
  public static int stToIj(double s) {
    // Clamp before narrowing; far out-of-range values overflow an int.
    return (int) Math.max(0, Math.min(CellId.MAX_SIZE - 1, Math.round(CellId.MAX_SIZE * s - 0.5)));
  }

  /** Returns the smallest s- or t-value in leaf cell {@code i}, which is in [0, 2^30]. */
  public static double ijToStMin(int i) {
    return (1.0 / CellId.MAX_SIZE) * i;
  }

  /** Returns the u- or v-value of the lower edge of the cell of size {@code cellSize} at ij. */
  public static double ijToUv(int ij, int cellSize) {
    return stToUv(ijToStMin(ij & -cellSize));
  }

  public static double siTiToSt(long si) {
    return (1.0 / MAX_SITI) * si;
  }

  /** Converts (face, u, v) to a direction vector. {@code face} must be in [0, 5]. */
  public static SpherePoint faceUvToXyz(int face, double u, double v) {
    switch (face) {
      case 0:
        return new SpherePoint(1, u, v);
      case 1:
        return new SpherePoint(-u, 1, v);
      case 2:
        return new SpherePoint(-u, -v, 1);
      case 3:
        return new SpherePoint(-1, -v, -u);
      case 4:
        return new SpherePoint(v, -1, -u);
      default:
        return new SpherePoint(v, u, -1);
    }
  }

  /**
   * Returns the (u,v) coordinates of {@code p} on {@code face}, or null if {@code p} is not on the
   * face's side of the sphere. The result may lie outside [-1,1].
   */
  public static @Nullable R2Vector faceXyzToUv(int face, SpherePoint p) {
    if (face < 3) {
      if (p.get(face) <= 0) {
        return null;
      }
    } else {
      if (p.get(face - 3) >= 0) {
        return null;
      }
    }
    return validFaceXyzToUv(face, p);
  }

  /**
   * Returns the (u,v) coordinates of {@code p} on {@code face}, which must be a face whose normal
   * has a positive dot product with {@code p}.
   */
  public static R2Vector validFaceXyzToUv(int face, SpherePoint p) {
    switch (face) {
      case 0:
        return new R2Vector(p.y / p.x, p.z / p.x);
      case 1:
        return new R2Vector(-p.x / p.y, p.z / p.y);
      case 2:
        return new R2Vector(-p.x / p.z, -p.y / p.z);
      case 3:
        return new R2Vector(p.z / p.x, p.y / p.x);
      case 4:
        return new R2Vector(p.z / p.y, -p.x / p.y);
      default:
        return new R2Vector(-p.y / p.z, -p.x / p.z);
    }
  }

  /** Returns the face containing {@code p}. Points on a face boundary map to a repeatable face. */
  public static int xyzToFace(SpherePoint p) {
    switch (p.largestAbsComponent()) {
      case 0:
        return (p.x < 0) ? 3 : 0;
      case 1:
        return (p.y < 0) ? 4 : 1;
      default:
        return (p.z < 0) ? 5 : 2;
    }
  }

  /**
   * Returns the right-handed normal, not necessarily unit length, of the plane through the origin
   * containing the edge at {@code u} in the direction of the positive v-axis.
   */
  public static SpherePoint getUNorm(int face, double u) {
    switch (face) {
      case 0:
        return new SpherePoint(u, -1, 0);
      case 1:
        return new SpherePoint(1, u, 0);
      case 2:
        return new SpherePoint(1, 0, u);
      case 3:
        return new SpherePoint(-u, 0, 1);
      case 4:
        return new SpherePoint(0, -u, 1);
      default:
        return new SpherePoint(0, -1, -u);
    }
  }

  /** As {@link #getUNorm}, for the edge at {@code v} in the direction of the positive u-axis. */
  public static SpherePoint getVNorm(int face, double v) {
    switch (face) {
      case 0:
        return new SpherePoint(-v, 0, 1);
      case 1:
        return new SpherePoint(0, -v, 1);
      case 2:
        return new SpherePoint(0, -1, -v);
      case 3:
        return new SpherePoint(v, -1, 0);
      case 4:
        return new SpherePoint(1, v, 0);
      default:
        return new SpherePoint(1, 0, v);
    }
  }

  public static SpherePoint getUAxis(int face) {
    return FACE_UVW_AXES[face][0];
  }

  public static SpherePoint getVAxis(int face) {
    return FACE_UVW_AXES[face][1];
  }

  /** Returns the unit normal of the face. */
  public static SpherePoint getNorm(int face) {
    return FACE_UVW_AXES[face][2];
  }
}
