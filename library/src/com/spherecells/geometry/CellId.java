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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.UnmodifiableIterator;
import com.google.common.primitives.UnsignedLongs;
import com.google.errorprone.annotations.CheckReturnValue;
import java.io.Serializable;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A 64-bit unsigned identifier of one cell of the spherical cell hierarchy:
 *
 * <pre>
 * id = [face][face_pos]
 * </pre>
 *
 * <p>{@code face} is 3 bits (0..5) selecting a cube face. {@code face_pos} is 61 bits giving the
 * position of the cell center along a Hilbert curve over that face.
 *
 * <p>The id of a level-k cell holds the face, then k bit pairs that select one of four children
 * at each level, then a single 1 bit, then zeros. The level is therefore given by the position of
 * the lowest set bit, and the id of a parent lies at the midpoint of the ids of its descendants.
 * Increasing ids trace one continuous curve over the whole sphere, and the descendants of a cell
 * occupy the contiguous range {@code [rangeMin(), rangeMax()]}.
 */
@CheckReturnValue
public final class CellId implements Comparable<CellId>, Serializable {
  private static final long serialVersionUID = 1L;

  // Only 60 bits are needed for a leaf position; the extra bit marks the center of a leaf.
  public static final int FACE_BITS = 3;
  public static final int NUM_FACES = 6;
  public static final int MAX_LEVEL = 30;
  public static final int POS_BITS = 2 * MAX_LEVEL + 1;
  public static final int MAX_SIZE = 1 << MAX_LEVEL;

  /** All 64 bits set; larger than any valid id when compared unsigned. */
  public static final long MAX_UNSIGNED = -1L;

  private static final double IJ_TO_ST = 1.0 / MAX_SIZE;

  // A Hilbert curve orientation is a combination of these two bits.
  private static final int SWAP_MASK = 0x01;
  private static final int INVERT_MASK = 0x02;

  /** Maps an orientation and a child position (0..3) to the child's (i,j) quadrant, as i*2+j. */
  private static final int[][] POS_TO_IJ = {
    {0, 1, 3, 2}, // canonical order
    {0, 2, 3, 1}, // axes swapped
    {3, 2, 0, 1}, // bits inverted
    {3, 1, 0, 2}, // swapped and inverted
  };

  /** Inverse of POS_TO_IJ. */
  private static final int[][] IJ_TO_POS = {
    {0, 1, 3, 2},
    {0, 3, 1, 2},
    {2, 3, 1, 0},
    {2, 1, 3, 0},
  };

  /** The orientation change when descending into child position 0..3. */
  private static final int[] POS_TO_ORIENTATION = {SWAP_MASK, 0, 0, INVERT_MASK | SWAP_MASK};

  private static final CharMatcher MATCHES_ZERO = CharMatcher.is('0');

  private final long id;

  public CellId(long id) {
    this.id = id;
  }

  /** Returns the invalid id 0. */
  public static CellId none() {
    return new CellId(0);
  }

  /** Returns an invalid id that is larger than every valid id. */
  public static CellId sentinel() {
    return new CellId(MAX_UNSIGNED);
  }

  public static CellId fromFace(int face) {
    return new CellId((((long) face) << POS_BITS) + lowestOnBitForLevel(0));
  }

  /**
   * Returns the cell at {@code level} containing the Hilbert position {@code pos} (an unsigned
   * {@link #POS_BITS}-bit value) on {@code face}.
   */
  public static CellId fromFacePosLevel(int face, long pos, int level) {
    return new CellId((((long) face) << POS_BITS) + (pos | 1)).parent(level);
  }

  /** Returns the leaf cell containing {@code p}, which need not be unit length. */
  public static CellId fromPoint(SpherePoint p) {
    int face = Projection.xyzToFace(p);
    R2Vector uv = Projection.validFaceXyzToUv(face, p);
    int i = Projection.stToIj(Projection.uvToSt(uv.x()));
    int j = Projection.stToIj(Projection.uvToSt(uv.y()));
    return fromFaceIJ(face, i, j);
  }

  public static CellId fromLatLng(LatLng ll) {
    return fromPoint(ll.toPoint());
  }

  /** Returns the leaf cell with the given face and (i,j) coordinates, each in [0, MAX_SIZE). */
  public static CellId fromFaceIJ(int face, int i, int j) {
    // Alternating faces have opposite curve orientations so that every face is right-handed.
    int orientation = face & SWAP_MASK;
    long pos = 0;
    for (int k = MAX_LEVEL - 1; k >= 0; --k) {
      int ij = (((i >>> k) & 1) << 1) | ((j >>> k) & 1);
      int childPos = IJ_TO_POS[orientation][ij];
      pos = (pos << 2) | childPos;
      orientation ^= POS_TO_ORIENTATION[childPos];
    }
    return new CellId((((long) face) << POS_BITS) + (pos << 1) + 1);
  }

  /** Calls {@link #fromFaceIJ} if {@code sameFace}, otherwise wraps (i,j) onto the next face. */
  public static CellId fromFaceIJSame(int face, int i, int j, boolean sameFace) {
    if (sameFace) {
      return fromFaceIJ(face, i, j);
    }
    return fromFaceIJWrap(face, i, j);
  }

  /**
   * Given (i,j) just outside {@code face}, returns the leaf cell on the adjacent face that is
   * nearest to it.
   */
  private static CellId fromFaceIJWrap(int face, int i, int j) {
    // Clamp to one leaf beyond the face boundary; this also avoids 32-bit overflow for face cells.
    i = Math.max(-1, Math.min(MAX_SIZE, i));
    j = Math.max(-1, Math.min(MAX_SIZE, j));

    // Project through xyz to find the adjacent face. The linear projection u = 2s - 1 is enough
    // here. (u,v) is clamped to just outside [-1,1] so reprojection cannot land in the wrong leaf.
    final double limit = 1.0 + SphereMath.DBL_EPSILON;
    double u = Math.max(-limit, Math.min(limit, IJ_TO_ST * ((i << 1) + 1 - MAX_SIZE)));
    double v = Math.max(-limit, Math.min(limit, IJ_TO_ST * ((j << 1) + 1 - MAX_SIZE)));

    SpherePoint p = Projection.faceUvToXyz(face, u, v);
    face = Projection.xyzToFace(p);
    R2Vector uv = Projection.validFaceXyzToUv(face, p);
    return fromFaceIJ(
        face, Projection.stToIj(0.5 * (uv.x() + 1)), Projection.stToIj(0.5 * (uv.y() + 1)));
  }

  /**
   * Decodes a token produced by {@link #toToken()}. Missing trailing digits are zeros.
   *
   * @throws NumberFormatException if the token is null, empty or not hexadecimal
   */
  public static CellId fromToken(@Nullable String token) {
    if (token == null) {
      throw new NumberFormatException("Null string in CellId.fromToken");
    }
    if (token.isEmpty()) {
      throw new NumberFormatException("Empty string in CellId.fromToken");
    }
    int length = token.length();
    if (length > 16 || "X".equals(token)) {
      return none();
    }
    long value = 0;
    for (int pos = 0; pos < length; pos++) {
      int digit = Character.digit(token.charAt(pos), 16);
      if (digit == -1) {
        throw new NumberFormatException(token);
      }
      value = value * 16 + digit;
    }
    return new CellId(value << (4 * (16 - length)));
  }

  /**
   * Returns the id as lowercase hex with trailing zeros removed, or "X" for the zero id. Larger
   * cells give shorter tokens; the longest is 16 characters.
   */
  public String toToken() {
    if (id == 0) {
      return "X";
    }
    String hex = Ascii.toLowerCase(Long.toHexString(id));
    return MATCHES_ZERO.trimTrailingFrom(Strings.padStart(hex, 16, '0'));
  }

  public long id() {
    return id;
  }

  public boolean isValid() {
    return face() < NUM_FACES && ((lowestOnBit() & 0x1555555555555555L) != 0);
  }

  public int face() {
    return (int) (id >>> POS_BITS);
  }

  /** The Hilbert position of the cell center on its face, in [0, 2^POS_BITS). */
  public long pos() {
    return id & (-1L >>> FACE_BITS);
  }

  public int level() {
    if (isLeaf()) {
      return MAX_LEVEL;
    }
    return MAX_LEVEL - (Long.numberOfTrailingZeros(id) >> 1);
  }

  public boolean isLeaf() {
    return ((int) id & 1) != 0;
  }

  public boolean isFace() {
    return (id & (lowestOnBitForLevel(0) - 1)) == 0;
  }

  public int getSizeIJ() {
    return getSizeIJ(level());
  }

  /** Returns the edge length in (i,j) units of cells at {@code level}. */
  public static int getSizeIJ(int level) {
    return 1 << (MAX_LEVEL - level);
  }

  public static double getSizeST(int level) {
    return Projection.ijToStMin(getSizeIJ(level));
  }

  /**
   * Returns the position (0..3) of this cell's ancestor at {@code level} within its own parent.
   * {@code level} must be in [1, level()].
   */
  public int childPosition(int level) {
    return (int) (id >>> (2 * (MAX_LEVEL - level) + 1)) & 3;
  }

  /** Returns the first leaf cell contained by this cell. The range is inclusive. */
  public CellId rangeMin() {
    return new CellId(id - (lowestOnBit() - 1));
  }

  /** Returns the last leaf cell contained by this cell. The range is inclusive. */
  public CellId rangeMax() {
    return new CellId(id + (lowestOnBit() - 1));
  }

  /** Returns true if {@code other} is this cell or one of its descendants. */
  public boolean contains(CellId other) {
    return other.greaterOrEquals(rangeMin()) && other.lessOrEquals(rangeMax());
  }

  public boolean intersects(CellId other) {
    return other.rangeMin().lessOrEquals(rangeMax())
        && other.rangeMax().greaterOrEquals(rangeMin());
  }

  /** Requires {@code level() > 0}. */
  public CellId parent() {
    long newLsb = lowestOnBit() << 2;
    return new CellId((id & -newLsb) | newLsb);
  }

  /** Returns the ancestor at {@code level}, which must be in [0, level()]. */
  public CellId parent(int level) {
    assert level >= 0 && level <= this.level();
    long newLsb = lowestOnBitForLevel(level);
    return new CellId((id & -newLsb) | newLsb);
  }

  /** Returns the child at curve position 0..3. Undefined for leaf cells. */
  public CellId child(int position) {
    // Move the lsb down two places (subtract 4 * newLsb, add newLsb), then step to the child.
    long newLsb = lowestOnBit() >>> 2;
    return new CellId(id + (2 * position + 1 - 4) * newLsb);
  }

  /** Returns the four children in curve order, or nothing for a leaf cell. */
  public Iterable<CellId> children() {
    if (isLeaf()) {
      return ImmutableList.of();
    }
    return childrenAtLevel(level() + 1);
  }

  /** Returns the descendants at {@code level}, which must be in [level(), MAX_LEVEL]. */
  public Iterable<CellId> childrenAtLevel(final int level) {
    Preconditions.checkState(isValid(), "Invalid cell %s", this);
    Preconditions.checkArgument(
        level >= level() && level <= MAX_LEVEL,
        "Level %s is outside [%s, %s]",
        level,
        level(),
        MAX_LEVEL);
    return new Iterable<CellId>() {
      @Override
      public Iterator<CellId> iterator() {
        return new UnmodifiableIterator<CellId>() {
          private CellId next = childBegin(level);
          private final long childEnd = childEnd(level).id();

          @Override
          public boolean hasNext() {
            return next.id() != childEnd;
          }

          @Override
          public CellId next() {
            if (!hasNext()) {
              throw new NoSuchElementException();
            }
            CellId current = next;
            next = next.next();
            return current;
          }
        };
      }
    };
  }

  // Iteration over children uses childBegin() .. childEnd() with next(), comparing with equals();
  // the end value is exclusive and may not be a valid id.

  /** Returns the first child in curve order. Requires {@code level() < MAX_LEVEL}. */
  public CellId childBegin() {
    long oldLsb = lowestOnBit();
    return new CellId(id - oldLsb + (oldLsb >>> 2));
  }

  /** Returns the first descendant at {@code level}, which must be in [level(), MAX_LEVEL]. */
  public CellId childBegin(int level) {
    assert level >= this.level() && level <= MAX_LEVEL;
    return new CellId(id - lowestOnBit() + lowestOnBitForLevel(level));
  }

  /** Returns the id just past the last child. It may be invalid. */
  public CellId childEnd() {
    long oldLsb = lowestOnBit();
    return new CellId(id + oldLsb + (oldLsb >>> 2));
  }

  /** Returns the id just past the last descendant at {@code level}. It may be invalid. */
  public CellId childEnd(int level) {
    assert level >= this.level() && level <= MAX_LEVEL;
    return new CellId(id + lowestOnBit() + lowestOnBitForLevel(level));
  }

  /** Returns the next cell at this level along the curve. Does not wrap from face 5 to 0. */
  public CellId next() {
    return new CellId(id + (lowestOnBit() << 1));
  }

  /** Returns the previous cell at this level along the curve. Does not wrap. */
  public CellId prev() {
    return new CellId(id - (lowestOnBit() << 1));
  }

  /** Returns the first cell at {@code level} on the whole curve. */
  public static CellId begin(int level) {
    return fromFace(0).childBegin(level);
  }

  /** Returns the exclusive, invalid end of the curve at {@code level}. */
  public static CellId end(int level) {
    return fromFace(NUM_FACES - 1).childEnd(level);
  }

  /** Returns {@code 1L << (2 * (MAX_LEVEL - level()))}. */
  public long lowestOnBit() {
    return id & -id;
  }

  public static long lowestOnBitForLevel(int level) {
    return 1L << (2 * (MAX_LEVEL - level));
  }

  /** Returns the unit-length center of the cell. */
  public SpherePoint toPoint() {
    return toPointRaw().normalize();
  }

  /** Returns the center of the cell as a direction vector, not necessarily unit length. */
  public SpherePoint toPointRaw() {
    // The (i,j) returned for a non-leaf cell is one of the two leaves nearest its center:
    // (imin + s/2, jmin + s/2) or (imin + s/2 - 1, jmin + s/2 - 1). The low bit of i tells them
    // apart, and delta moves both onto the center in (si,ti) space.
    FaceIJ fij = toFaceIJOrientation();
    int delta = isLeaf() ? 1 : (((fij.i ^ (((int) id) >>> 2)) & 1) != 0) ? 2 : 0;
    long si = 2L * fij.i + delta;
    long ti = 2L * fij.j + delta;
    return Projection.faceUvToXyz(
        fij.face,
        Projection.stToUv(Projection.siTiToSt(si)),
        Projection.stToUv(Projection.siTiToSt(ti)));
  }

  public LatLng toLatLng() {
    return new LatLng(toPointRaw());
  }

  /** A face, a leaf (i,j) position on it, and the curve orientation of the cell. */
  public static final class FaceIJ {
    public final int face;
    public final int i;
    public final int j;
    /** A combination of the swap (1) and invert (2) bits. */
    public final int orientation;

    FaceIJ(int face, int i, int j, int orientation) {
      this.face = face;
      this.i = i;
      this.j = j;
      this.orientation = orientation;
    }
  }

  /**
   * Returns the face and leaf (i,j) of this cell, and the curve orientation at this cell's level.
   * For a non-leaf cell the (i,j) is a leaf adjacent to the cell center.
   */
  public FaceIJ toFaceIJOrientation() {
    int face = face();
    int level = level();
    int orientation = face & SWAP_MASK;
    int cellOrientation = orientation;
    int i = 0;
    int j = 0;
    for (int k = 1; k <= MAX_LEVEL; ++k) {
      int childPos = (int) (id >>> (2 * (MAX_LEVEL - k) + 1)) & 3;
      int ij = POS_TO_IJ[orientation][childPos];
      i = (i << 1) | (ij >>> 1);
      j = (j << 1) | (ij & 1);
      orientation ^= POS_TO_ORIENTATION[childPos];
      if (k == level) {
        cellOrientation = orientation;
      }
    }
    return new FaceIJ(face, i, j, cellOrientation);
  }

  /**
   * Sets {@code neighbors[0..3]} to the cells adjacent across the bottom, right, top and left
   * edges. The four are always distinct.
   */
  public void getEdgeNeighbors(CellId[] neighbors) {
    int level = level();
    int size = getSizeIJ(level);
    FaceIJ fij = toFaceIJOrientation();
    neighbors[0] =
        fromFaceIJSame(fij.face, fij.i, fij.j - size, fij.j - size >= 0).parent(level);
    neighbors[1] =
        fromFaceIJSame(fij.face, fij.i + size, fij.j, fij.i + size < MAX_SIZE).parent(level);
    neighbors[2] =
        fromFaceIJSame(fij.face, fij.i, fij.j + size, fij.j + size < MAX_SIZE).parent(level);
    neighbors[3] =
        fromFaceIJSame(fij.face, fij.i - size, fij.j, fij.i - size >= 0).parent(level);
  }

  /**
   * Appends the cells at {@code level} that touch the vertex of {@code parent(level)} closest to
   * this cell. There are four, or three at a cube corner. Requires {@code level < level()}.
   */
  public void getVertexNeighbors(int level, Collection<CellId> output) {
    assert level < level();
    FaceIJ fij = toFaceIJOrientation();

    // The next bit of i and j tells which quadrant of parent(level) this cell lies in.
    int halfSize = getSizeIJ(level + 1);
    int size = halfSize << 1;
    boolean isame;
    boolean jsame;
    int ioffset;
    int joffset;
    if ((fij.i & halfSize) != 0) {
      ioffset = size;
      isame = (fij.i + size) < MAX_SIZE;
    } else {
      ioffset = -size;
      isame = (fij.i - size) >= 0;
    }
    if ((fij.j & halfSize) != 0) {
      joffset = size;
      jsame = (fij.j + size) < MAX_SIZE;
    } else {
      joffset = -size;
      jsame = (fij.j - size) >= 0;
    }

    output.add(parent(level));
    output.add(fromFaceIJSame(fij.face, fij.i + ioffset, fij.j, isame).parent(level));
    output.add(fromFaceIJSame(fij.face, fij.i, fij.j + joffset, jsame).parent(level));
    // Both neighbors off-face means a cube corner, which has only three cells.
    if (isame || jsame) {
      output.add(
          fromFaceIJSame(fij.face, fij.i + ioffset, fij.j + joffset, isame && jsame)
              .parent(level));
    }
  }

  /**
   * Appends every cell at {@code nbrLevel} whose boundary touches this cell's boundary but whose
   * interior is disjoint from it, including cells touching only at a corner. Requires
   * {@code nbrLevel >= level()}. Near cube corners a neighbor may be appended twice.
   */
  public void getAllNeighbors(int nbrLevel, List<CellId> output) {
    FaceIJ fij = toFaceIJOrientation();

    // Start from the lower-left leaf, since nbrLevel may be finer than this cell.
    int size = getSizeIJ();
    int i = fij.i & -size;
    int j = fij.j & -size;

    int nbrSize = getSizeIJ(nbrLevel);
    assert nbrSize <= size;

    // Top, bottom, left, right and diagonal neighbors in one pass. The exit test is at the end
    // of the loop to avoid 32-bit overflow.
    for (int k = -nbrSize; ; k += nbrSize) {
      boolean sameFace;
      if (k < 0) {
        sameFace = j + k >= 0;
      } else if (k >= size) {
        sameFace = j + k < MAX_SIZE;
      } else {
        sameFace = true;
        output.add(fromFaceIJSame(fij.face, i + k, j - nbrSize, j - size >= 0).parent(nbrLevel));
        output.add(
            fromFaceIJSame(fij.face, i + k, j + size, j + size < MAX_SIZE).parent(nbrLevel));
      }
      output.add(
          fromFaceIJSame(fij.face, i - nbrSize, j + k, sameFace && i - size >= 0)
              .parent(nbrLevel));
      output.add(
          fromFaceIJSame(fij.face, i + size, j + k, sameFace && i + size < MAX_SIZE)
              .parent(nbrLevel));
      if (k >= size) {
        break;
      }
    }
  }

  public boolean lessThan(CellId x) {
    return UnsignedLongs.compare(id, x.id) < 0;
  }

  public boolean greaterThan(CellId x) {
    return UnsignedLongs.compare(id, x.id) > 0;
  }

  public boolean lessOrEquals(CellId x) {
    return UnsignedLongs.compare(id, x.id) <= 0;
  }

  public boolean greaterOrEquals(CellId x) {
    return UnsignedLongs.compare(id, x.id) >= 0;
  }

  /** Orders ids as unsigned 64-bit values, which is curve order. */
  @Override
  public int compareTo(CellId that) {
    return UnsignedLongs.compare(id, that.id);
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof CellId && id == ((CellId) that).id;
  }

  @Override
  public int hashCode() {
    return (int) ((id >>> 32) + id);
  }

  @Override
  public String toString() {
    return "(face=" + face() + ", level=" + level() + ", token=" + toToken() + ")";
  }
}
