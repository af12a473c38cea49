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

import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A region of the sphere described as a collection of {@link CellId}s.
 *
 * <p>Most operations require the union to be <em>normalized</em>: the ids are sorted in
 * increasing order, no id's range overlaps another's, and no four ids are the children of one
 * parent. The {@code initFrom*} and {@link #initSwap} entry points normalize their input; the
 * {@code initRaw*} entry points leave that to the caller. Queries never normalize on the caller's
 * behalf, so a union that is not normalized gives results that reflect exactly the ids it holds.
 *
 * <p>Every algebraic operation that writes into this union produces a normalized result,
 * provided its operands were normalized.
 *
 * <p>Instances are mutable and not thread-safe.
 */
public class CellUnion implements Region, Iterable<CellId>, Serializable {
  private static final long serialVersionUID = 1L;

  private static final Logger logger = Platform.getLoggerForClass(CellUnion.class);

  private ArrayList<CellId> cellIds = new ArrayList<>();

  public CellUnion() {}

  /** Removes every cell, leaving the empty region. */
  public void clear() {
    cellIds.clear();
  }

  /** Returns a new union holding the same ids as {@code other}, without normalizing them. */
  public static CellUnion copyFrom(CellUnion other) {
    CellUnion copy = new CellUnion();
    copy.initRawCellIds(other.cellIds);
    return copy;
  }

  /** Returns the union of the six face cells. */
  public static CellUnion wholeSphere() {
    List<CellId> faces = new ArrayList<>(CellId.NUM_FACES);
    for (int face = 0; face < CellId.NUM_FACES; ++face) {
      faces.add(CellId.fromFace(face));
    }
    CellUnion result = new CellUnion();
    result.initRawSwap(faces);
    return result;
  }

  /** Replaces the contents with a copy of {@code ids} and normalizes; {@code ids} is unchanged. */
  @CanIgnoreReturnValue
  public CellUnion initFromCellIds(List<CellId> ids) {
    initRawCellIds(ids);
    normalize();
    return this;
  }

  /** Replaces the contents with the given raw 64-bit ids and normalizes. */
  @CanIgnoreReturnValue
  public CellUnion initFromIds(List<Long> ids) {
    initRawIds(ids);
    normalize();
    return this;
  }

  /** Moves the contents of {@code ids} into this union, leaving it empty, and normalizes. */
  @CanIgnoreReturnValue
  public CellUnion initSwap(List<CellId> ids) {
    initRawSwap(ids);
    normalize();
    return this;
  }

  /** Replaces the contents with a copy of {@code ids}, which must already be normalized. */
  @CanIgnoreReturnValue
  public CellUnion initRawCellIds(List<CellId> ids) {
    cellIds = new ArrayList<>(ids);
    return this;
  }

  /** Replaces the contents with the given raw 64-bit ids, which must already be normalized. */
  @CanIgnoreReturnValue
  public CellUnion initRawIds(List<Long> ids) {
    ArrayList<CellId> materialized = new ArrayList<>(ids.size());
    for (long id : ids) {
      materialized.add(new CellId(id));
    }
    cellIds = materialized;
    return this;
  }

  /**
   * Moves the contents of {@code ids} into this union without normalizing, leaving {@code ids}
   * empty. This is for callers that already hold a normalized list, such as one converted back
   * from another representation; every query assumes the result is normalized.
   */
  @CanIgnoreReturnValue
  public CellUnion initRawSwap(List<CellId> ids) {
    cellIds = new ArrayList<>(ids);
    ids.clear();
    return this;
  }

  /** Replaces the contents with the single valid cell {@code id}. */
  @CanIgnoreReturnValue
  public CellUnion initFromCellId(CellId id) {
    Preconditions.checkArgument(id.isValid(), "invalid cell id %s", id);
    cellIds.clear();
    cellIds.add(id);
    return this;
  }

  /**
   * Replaces the contents with the normalized cover of the leaf cells from {@code minId} to {@code
   * maxId} inclusive. Both must be leaf cells and {@code minId <= maxId}.
   */
  @CanIgnoreReturnValue
  public CellUnion initFromMinMax(CellId minId, CellId maxId) {
    assert minId.isValid() && maxId.isValid();
    assert maxId.isLeaf();
    return initFromBeginEnd(minId, maxId.next());
  }

  /**
   * As {@link #initFromMinMax}, but {@code end} is exclusive. The result is empty when {@code
   * begin} equals {@code end}.
   */
  @CanIgnoreReturnValue
  public CellUnion initFromBeginEnd(CellId begin, CellId end) {
    assert begin.isLeaf() && end.isLeaf();
    assert begin.lessOrEquals(end);

    // Greedily take the largest cell that starts at "begin" and stays below "end".
    cellIds.clear();
    CellId start = begin;
    while (start.lessThan(end)) {
      CellId cell = start;
      while (!cell.isFace()) {
        CellId parent = cell.parent();
        if (!parent.rangeMin().equals(start) || !parent.rangeMax().lessThan(end)) {
          break;
        }
        cell = parent;
      }
      cellIds.add(cell);
      start = cell.rangeMax().next();
    }
    assert isNormalized();
    return this;
  }

  public int size() {
    return cellIds.size();
  }

  public boolean isEmpty() {
    return cellIds.isEmpty();
  }

  public CellId cellId(int i) {
    return cellIds.get(i);
  }

  /** Returns a read-only view of the ids, in order. */
  public List<CellId> cellIds() {
    return Collections.unmodifiableList(cellIds);
  }

  @Override
  public Iterator<CellId> iterator() {
    return Iterators.unmodifiableIterator(cellIds.iterator());
  }

  /** Releases unused capacity in the backing list. */
  public void pack() {
    cellIds.trimToSize();
  }

  /** Returns true if the ids are sorted and no two of them overlap. */
  public boolean isValid() {
    for (int i = 1; i < cellIds.size(); ++i) {
      if (!cellIds.get(i - 1).rangeMax().lessThan(cellIds.get(i).rangeMin())) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if the union is valid and has no run of four sibling cells. */
  public boolean isNormalized() {
    for (int i = 1; i < cellIds.size(); ++i) {
      if (!cellIds.get(i - 1).rangeMax().lessThan(cellIds.get(i).rangeMin())) {
        return false;
      }
      if (i >= 3
          && areSiblings(
              cellIds.get(i - 3), cellIds.get(i - 2), cellIds.get(i - 1), cellIds.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if the four distinct cells {@code a..c} and {@code d} share a parent. */
  private static boolean areSiblings(CellId a, CellId b, CellId c, CellId d) {
    // Four siblings always XOR to zero, which rules out most candidates cheaply.
    if ((a.id() ^ b.id() ^ c.id()) != d.id()) {
      return false;
    }
    long mask = siblingMask(d);
    long masked = d.id() & mask;
    return !d.isFace()
        && (a.id() & mask) == masked
        && (b.id() & mask) == masked
        && (c.id() & mask) == masked;
  }

  /** Returns a mask that clears the two child-position bits of {@code id} and its marker bit. */
  private static long siblingMask(CellId id) {
    long mask = id.lowestOnBit() << 1;
    return ~(mask + (mask << 1));
  }

  /** Returns the ids of this union with every cell above {@code minLevel} split down to it. */
  public List<CellId> denormalized(int minLevel) {
    ArrayList<CellId> output = new ArrayList<>();
    denormalize(minLevel, 1, output);
    return output;
  }

  /**
   * Replaces {@code output} with the ids of this union, splitting every cell whose level is below
   * {@code minLevel}, or whose {@code level - minLevel} is not a multiple of {@code levelMod}, into
   * its descendants at the next acceptable level. Levels never exceed {@link CellId#MAX_LEVEL},
   * which is a multiple of 1, 2 and 3.
   *
   * @param minLevel in [0, {@link CellId#MAX_LEVEL}]
   * @param levelMod in [1, 3]
   */
  public void denormalize(int minLevel, int levelMod, List<CellId> output) {
    Preconditions.checkArgument(
        minLevel >= 0 && minLevel <= CellId.MAX_LEVEL, "minLevel out of range: %s", minLevel);
    Preconditions.checkArgument(
        levelMod >= 1 && levelMod <= 3, "levelMod out of range: %s", levelMod);

    output.clear();
    for (CellId id : cellIds) {
      int level = id.level();
      int newLevel = max(minLevel, level);
      if (levelMod > 1) {
        newLevel += (CellId.MAX_LEVEL - (newLevel - minLevel)) % levelMod;
        newLevel = min(CellId.MAX_LEVEL, newLevel);
      }
      if (newLevel == level) {
        output.add(id);
        continue;
      }
      CellId end = id.childEnd(newLevel);
      for (CellId child = id.childBegin(newLevel); !child.equals(end); child = child.next()) {
        output.add(child);
      }
    }
  }

  /**
   * Sorts the ids, drops the ones covered by others, and replaces every complete group of four
   * siblings by their parent, repeatedly. Returns true if the number of ids went down.
   *
   * <p>Must be called before any query on a union built through an {@code initRaw*} method whose
   * input was not already normalized.
   */
  @CanIgnoreReturnValue
  public boolean normalize() {
    return normalize(cellIds);
  }

  /** As {@link #normalize()}, applied in place to {@code ids}. */
  @CanIgnoreReturnValue
  public static boolean normalize(List<CellId> ids) {
    Collections.sort(ids);

    // ids[0, out) is the normalized prefix, written over the part already consumed.
    int out = 0;
    for (int i = 0; i < ids.size(); ++i) {
      CellId id = ids.get(i);

      if (out > 0 && ids.get(out - 1).contains(id)) {
        continue;
      }
      while (out > 0 && id.contains(ids.get(out - 1))) {
        --out;
      }

      // Fold the last three outputs and "id" into their parent while they are siblings. A merge
      // may complete a group one level up, so this repeats.
      while (out >= 3) {
        CellId a = ids.get(out - 3);
        CellId b = ids.get(out - 2);
        CellId c = ids.get(out - 1);
        if ((a.id() ^ b.id() ^ c.id()) != id.id()) {
          break;
        }
        long mask = siblingMask(id);
        long masked = id.id() & mask;
        if ((a.id() & mask) != masked
            || (b.id() & mask) != masked
            || (c.id() & mask) != masked
            || id.isFace()) {
          break;
        }
        id = id.parent();
        out -= 3;
      }
      ids.set(out++, id);
    }

    int size = ids.size();
    if (out == size) {
      return false;
    }
    ids.subList(out, size).clear();
    return true;
  }

  /**
   * Returns true if {@code id} lies entirely inside this union. Logarithmic in the size of the
   * union.
   *
   * <p>Four sibling cells in a union that is valid but not normalized do not contain their parent.
   */
  public boolean contains(CellId id) {
    // Each id is the midpoint of its range along the curve, so only the two neighbours of its
    // insertion point can contain it.
    int pos = insertionPoint(cellIds, id);
    if (pos < cellIds.size() && cellIds.get(pos).rangeMin().lessOrEquals(id)) {
      return true;
    }
    return pos != 0 && cellIds.get(pos - 1).rangeMax().greaterOrEquals(id);
  }

  /** Returns true if {@code id} shares a leaf cell with this union. Logarithmic in its size. */
  public boolean intersects(CellId id) {
    int pos = insertionPoint(cellIds, id);
    if (pos < cellIds.size() && cellIds.get(pos).rangeMin().lessOrEquals(id.rangeMax())) {
      return true;
    }
    return pos != 0 && cellIds.get(pos - 1).rangeMax().greaterOrEquals(id.rangeMin());
  }

  /** Returns true if every cell of {@code that} is contained by this union. */
  public boolean contains(CellUnion that) {
    for (CellId id : that.cellIds) {
      if (!contains(id)) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if any cell of {@code that} intersects this union. */
  public boolean intersects(CellUnion that) {
    for (CellId id : that.cellIds) {
      if (intersects(id)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean contains(Cell cell) {
    return contains(cell.id());
  }

  @Override
  public boolean mayIntersect(Cell cell) {
    return intersects(cell.id());
  }

  /** {@code p} need not be unit length. */
  @Override
  public boolean contains(SpherePoint p) {
    return contains(CellId.fromPoint(p));
  }

  /** Returns a new union covering the leaf cells of either operand. */
  public static CellUnion union(CellUnion x, CellUnion y) {
    CellUnion result = new CellUnion();
    result.getUnion(x, y);
    return result;
  }

  /** Returns a new union covering the leaf cells of both operands. */
  public static CellUnion intersection(CellUnion x, CellUnion y) {
    CellUnion result = new CellUnion();
    result.getIntersection(x, y);
    return result;
  }

  /** Returns a new union covering the leaf cells of {@code x} that are not in {@code y}. */
  public static CellUnion difference(CellUnion x, CellUnion y) {
    CellUnion result = new CellUnion();
    result.getDifference(x, y);
    return result;
  }

  /** Sets this union to {@code x} union {@code y}. Neither operand may be this union. */
  @SuppressWarnings("ReferenceEquality")
  public void getUnion(CellUnion x, CellUnion y) {
    Preconditions.checkArgument(x != this, "receiver must not be an operand");
    Preconditions.checkArgument(y != this, "receiver must not be an operand");
    cellIds.clear();
    cellIds.ensureCapacity(x.size() + y.size());
    cellIds.addAll(x.cellIds);
    cellIds.addAll(y.cellIds);
    normalize();
  }

  /**
   * Sets this union to the part of {@code x} inside {@code id}. This splits a union into pieces
   * along the cell hierarchy. {@code x} must be normalized and must not be this union.
   */
  @SuppressWarnings("ReferenceEquality")
  public void getIntersection(CellUnion x, CellId id) {
    Preconditions.checkArgument(x != this, "receiver must not be an operand");
    cellIds.clear();
    if (x.contains(id)) {
      cellIds.add(id);
      return;
    }
    CellId idMax = id.rangeMax();
    int size = x.cellIds.size();
    for (int pos = insertionPoint(x.cellIds, id.rangeMin());
        pos < size && x.cellIds.get(pos).lessOrEquals(idMax);
        ++pos) {
      cellIds.add(x.cellIds.get(pos));
    }
  }

  /**
   * Sets this union to {@code x} intersected with {@code y}. Neither operand may be this union.
   * The result is normalized when both operands are.
   */
  @SuppressWarnings("ReferenceEquality")
  public void getIntersection(CellUnion x, CellUnion y) {
    Preconditions.checkArgument(x != this && y != this, "receiver must not be an operand");
    getIntersection(x.cellIds, y.cellIds, cellIds);
    assert isNormalized() || !x.isNormalized() || !y.isNormalized();
  }

  /**
   * Replaces {@code results} with the intersection of the sorted lists {@code x} and {@code y}.
   * The inputs need not be normalized beyond being valid; runs of four siblings pass through.
   * Takes constant time when every cell of one list lies before every cell of the other.
   */
  @SuppressWarnings("ReferenceEquality")
  public static void getIntersection(List<CellId> x, List<CellId> y, List<CellId> results) {
    Preconditions.checkArgument(x != results && y != results, "results must not be an operand");
    results.clear();
    int i = 0;
    int j = 0;
    while (i < x.size() && j < y.size()) {
      CellId xCell = x.get(i);
      CellId yCell = y.get(j);
      CellId xMin = xCell.rangeMin();
      CellId yMin = yCell.rangeMin();
      int order = xMin.compareTo(yMin);
      if (order > 0) {
        // xCell starts inside yCell or after it ends.
        if (xCell.lessOrEquals(yCell.rangeMax())) {
          results.add(xCell);
          ++i;
        } else {
          j = lowerBound(y, xMin, j + 1);
          if (xCell.lessOrEquals(y.get(j - 1).rangeMax())) {
            --j;
          }
        }
      } else if (order < 0) {
        if (yCell.lessOrEquals(xCell.rangeMax())) {
          results.add(yCell);
          ++j;
        } else {
          i = lowerBound(x, yMin, i + 1);
          if (yCell.lessOrEquals(x.get(i - 1).rangeMax())) {
            --i;
          }
        }
      } else {
        // Same start, so the smaller id is the smaller cell and lies inside the other.
        if (xCell.lessThan(yCell)) {
          results.add(xCell);
          ++i;
        } else {
          results.add(yCell);
          ++j;
        }
      }
    }
  }

  /**
   * Sets this union to the leaf cells of {@code x} that are not in {@code y}. Neither operand may
   * be this union. The result is normalized when {@code x} is.
   */
  @SuppressWarnings("ReferenceEquality")
  public void getDifference(CellUnion x, CellUnion y) {
    Preconditions.checkArgument(x != this && y != this, "receiver must not be an operand");
    cellIds.clear();
    for (CellId id : x.cellIds) {
      subtract(id, y);
    }
    assert isNormalized() || !x.isNormalized();
  }

  /** Appends the part of {@code cell} outside {@code y}, splitting cells that straddle it. */
  private void subtract(CellId cell, CellUnion y) {
    if (!y.intersects(cell)) {
      cellIds.add(cell);
    } else if (!y.contains(cell)) {
      for (int k = 0; k < 4; ++k) {
        subtract(cell.child(k), y);
      }
    }
  }

  /** Returns the index of {@code key} in {@code ids}, or the index where it would be inserted. */
  private static int insertionPoint(List<CellId> ids, CellId key) {
    int pos = Collections.binarySearch(ids, key);
    return pos < 0 ? -pos - 1 : pos;
  }

  /** As {@link #insertionPoint}, searching only from index {@code low} on. */
  private static int lowerBound(List<CellId> ids, CellId key, int low) {
    int high = ids.size() - 1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      int cmp = ids.get(mid).compareTo(key);
      if (cmp < 0) {
        low = mid + 1;
      } else if (cmp > 0) {
        high = mid - 1;
      } else {
        return mid;
      }
    }
    return low;
  }

  /**
   * Grows the union by a ring of cells at {@code level} around its boundary.
   *
   * <p>Every cell is first widened to its ancestor at {@code level} if it is smaller than that;
   * then the cell and all of its neighbours at {@code level} are added. Widening can push the
   * boundary out by up to one extra cell width at {@code level} before the ring is added. The
   * output grows exponentially with {@code level}: a level 10 cell expanded at level 20 gains
   * about 4000 neighbours. {@link #expand(Angle, int)} is usually the better choice.
   */
  public void expand(int level) {
    Preconditions.checkArgument(
        level >= 0 && level <= CellId.MAX_LEVEL, "level out of range: %s", level);
    int inputSize = size();
    ArrayList<CellId> output = new ArrayList<>();
    long levelLsb = CellId.lowestOnBitForLevel(level);
    for (int i = inputSize - 1; i >= 0; --i) {
      CellId id = cellIds.get(i);
      if (id.lowestOnBit() < levelLsb) {
        id = id.parent(level);
        // Skip the preceding cells the widened cell already covers.
        while (i > 0 && id.contains(cellIds.get(i - 1))) {
          --i;
        }
      }
      output.add(id);
      id.getAllNeighbors(level, output);
    }
    initSwap(output);
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("expand(" + level + "): " + inputSize + " cells -> " + size() + " cells");
    }
  }

  /**
   * Grows the union to hold every point within {@code minRadius} of it, using cells no more than
   * {@code maxLevelDiff} levels below the largest input cell. The level limit trades accuracy for
   * size when a large region grows by a small distance: with {@code maxLevelDiff == 4} the region
   * always grows by about 1/16 the width of its largest cell. The output can be up to {@code 4 *
   * (1 + 2^maxLevelDiff)} times larger than the input.
   */
  public void expand(Angle minRadius, int maxLevelDiff) {
    Preconditions.checkArgument(maxLevelDiff >= 0, "maxLevelDiff must be >= 0: %s", maxLevelDiff);
    if (isEmpty()) {
      return;
    }
    int minLevel = CellId.MAX_LEVEL;
    for (CellId id : cellIds) {
      minLevel = min(minLevel, id.level());
    }
    // The finest level at which every cell is at least minRadius wide.
    int radiusLevel = Metric.MIN_WIDTH.getMaxLevel(minRadius.radians());
    boolean twoPass = radiusLevel == 0 && minRadius.radians() > Metric.MIN_WIDTH.getValue(0);
    if (twoPass) {
      // Wider than a face cell; one face-level ring first.
      expand(0);
    }
    int level = min(minLevel + maxLevelDiff, radiusLevel);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "expand(" + minRadius + ", " + maxLevelDiff + "): level " + level
              + (twoPass ? " after a face-level pass" : ""));
    }
    expand(level);
  }

  /**
   * Returns a cap around the area-weighted centroid of the cells, large enough to hold every
   * cell's own cap bound. It is not the smallest bounding cap, but it is close.
   */
  @Override
  public Cap getCapBound() {
    if (cellIds.isEmpty()) {
      return Cap.empty();
    }
    SpherePoint centroid = SpherePoint.ORIGIN;
    for (CellId id : cellIds) {
      centroid = centroid.add(id.toPoint().mul(Cell.averageArea(id.level())));
    }
    if (centroid.equalsPoint(SpherePoint.ORIGIN)) {
      centroid = SpherePoint.X_POS;
    } else {
      centroid = centroid.normalize();
    }

    // Bounding just the vertices is not enough: the union may cover more than a hemisphere.
    Cap cap = Cap.fromAxisHeight(centroid, 0);
    for (CellId id : cellIds) {
      cap = cap.addCap(new Cell(id).getCapBound());
    }
    return cap;
  }

  @Override
  public LatLngRect getRectBound() {
    LatLngRect bound = LatLngRect.empty();
    for (CellId id : cellIds) {
      bound = bound.union(new Cell(id).getRectBound());
    }
    return bound;
  }

  /** Returns the number of leaf cells covered; at most 6 * 2^60 for the whole sphere. */
  public long leafCellsCovered() {
    long numLeaves = 0;
    for (CellId id : cellIds) {
      int depth = CellId.MAX_LEVEL - id.level();
      numLeaves += 1L << (depth << 1);
    }
    return numLeaves;
  }

  /**
   * Returns the leaf count times the average leaf area. Cheap, but ignores cell distortion and so
   * may be off by a factor of 1.7; compare {@link #leafCellsCovered()} directly for relative sizes.
   */
  public double averageBasedArea() {
    return Cell.averageArea(CellId.MAX_LEVEL) * leafCellsCovered();
  }

  /** Returns the sum of {@link Cell#approxArea()} over the cells. */
  public double approxArea() {
    double area = 0;
    for (CellId id : cellIds) {
      area += new Cell(id).approxArea();
    }
    return area;
  }

  /** Returns the sum of {@link Cell#exactArea()} over the cells. */
  public double exactArea() {
    double area = 0;
    for (CellId id : cellIds) {
      area += new Cell(id).exactArea();
    }
    return area;
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof CellUnion)) {
      return false;
    }
    return cellIds.equals(((CellUnion) that).cellIds);
  }

  @Override
  public int hashCode() {
    int value = 17;
    for (CellId id : cellIds) {
      value = 37 * value + id.hashCode();
    }
    return value;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < cellIds.size(); ++i) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(cellIds.get(i).toToken());
    }
    return sb.append(']').toString();
  }
}
