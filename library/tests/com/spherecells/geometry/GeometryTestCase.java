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
import static org.junit.Assert.assertTrue;

import java.util.Random;
import org.junit.Before;

/** Common code for geometry tests. */
public abstract class GeometryTestCase {
  /** A rough Earth radius, for turning test distances into angles. */
  public static final double APPROXIMATE_EARTH_RADIUS_KM = 6371.01;

  /** Fixed so that failures reproduce. */
  private static final long SEED = 123455;

  protected Random rand;

  @Before
  public final void setUpRandom() {
    rand = new Random(SEED);
  }

  public static void assertDoubleNear(double expected, double actual) {
    assertDoubleNear(expected, actual, 1e-9);
  }

  public static void assertDoubleNear(double expected, double actual, double error) {
    assertTrue(
        "expected " + expected + " +/- " + error + " but was " + actual,
        Math.abs(expected - actual) <= error);
  }

  /** Asserts bit-for-bit equality, so that 0.0 and -0.0 differ. */
  public static void assertExactly(double expected, double actual) {
    assertEquals(Double.doubleToLongBits(expected), Double.doubleToLongBits(actual));
  }

  /** Asserts that the points are within {@code eps} of each other. */
  public static void assertPointsNear(SpherePoint expected, SpherePoint actual, double eps) {
    assertTrue(
        "expected " + expected + " but was " + actual,
        expected.getDistance2(actual) <= eps * eps);
  }

  public static Angle kmToAngle(double km) {
    return Angle.radians(km / APPROXIMATE_EARTH_RADIUS_KM);
  }

  /** Returns a random unit-length point. */
  public SpherePoint randomPoint() {
    return new SpherePoint(uniform(-1, 1), uniform(-1, 1), uniform(-1, 1)).normalize();
  }

  /**
   * Returns a random cell at {@code level}. Uniform over the curve, which is only roughly uniform
   * over the sphere.
   */
  public CellId getRandomCellId(int level) {
    int face = random(CellId.NUM_FACES);
    long pos = rand.nextLong() & ((1L << (2 * CellId.MAX_LEVEL)) - 1);
    return CellId.fromFacePosLevel(face, pos, level);
  }

  /** Returns a random cell at a random level. */
  public CellId getRandomCellId() {
    return getRandomCellId(random(CellId.MAX_LEVEL + 1));
  }

  public double uniform(double a, double b) {
    return a + (b - a) * rand.nextDouble();
  }

  /** Returns true about one time in {@code n}. */
  public boolean oneIn(int n) {
    return random(n) == 0;
  }

  /** Returns a value in [0, n), or 0 when n is 0. */
  public int random(int n) {
    return n == 0 ? 0 : rand.nextInt(n);
  }

  /** Returns a cap whose area is log-uniformly distributed in [minArea, maxArea]. */
  public Cap getRandomCap(double minArea, double maxArea) {
    double capArea = maxArea * Math.pow(minArea / maxArea, rand.nextDouble());
    return Cap.fromAxisArea(randomPoint(), capArea);
  }
}
