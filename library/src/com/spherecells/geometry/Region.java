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

/**
 * A two-dimensional region of the unit sphere. The interface is limited to the bounds and cell
 * tests needed to approximate one region by a simpler one.
 */
public interface Region {

  /** Returns a bounding spherical cap. */
  Cap getCapBound();

  /** Returns a bounding latitude-longitude rectangle. */
  LatLngRect getRectBound();

  /**
   * Returns true if the region completely contains {@code cell}. A false result means either that
   * it does not, or that containment could not be determined.
   */
  boolean contains(Cell cell);

  /** Returns true if the region contains {@code p}, which generally must be unit length. */
  boolean contains(SpherePoint p);

  /**
   * Returns false if the region does not intersect {@code cell}. A true result means either that
   * it does, or that the relationship could not be determined.
   */
  boolean mayIntersect(Cell cell);
}
