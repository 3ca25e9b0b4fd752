/*-
 * #%L
 * Genome Damage and Stability Centre Diffraction Analysis
 *
 * Software for diffraction image analysis
 * %%
 * Copyright (C) 2011 - 2020 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.diffraction.image;

import java.util.Objects;

/**
 * Factory for {@link PixelMask} instances.
 */
public final class PixelMasks {
  /** A mask containing every pixel. */
  private static final PixelMask ALL = (x, y) -> true;

  /** No public construction. */
  private PixelMasks() {}

  /**
   * Get a mask containing every pixel.
   *
   * @return the mask
   */
  public static PixelMask all() {
    return ALL;
  }

  /**
   * Get a mask containing the rows with an index strictly greater than the cut-off.
   *
   * @param row the cut-off row
   * @return the mask
   */
  public static PixelMask rowsAfter(int row) {
    return (x, y) -> y > row;
  }

  /**
   * Get a mask containing the rows with an index greater than or equal to the cut-off.
   *
   * @param row the first included row
   * @return the mask
   */
  public static PixelMask rowsFrom(int row) {
    return (x, y) -> y >= row;
  }

  /**
   * Get a mask that excludes a rectangle, for example a beam block region.
   *
   * @param x the x origin of the rectangle
   * @param y the y origin of the rectangle
   * @param width the width
   * @param height the height
   * @return the mask
   * @throws IllegalArgumentException if the width or height are negative
   */
  public static PixelMask excludeRectangle(int x, int y, int width, int height) {
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("Negative rectangle size: " + width + "x" + height);
    }
    final int maxx = x + width;
    final int maxy = y + height;
    return (px, py) -> px < x || py < y || px >= maxx || py >= maxy;
  }

  /**
   * Get a mask containing pixels in both masks.
   *
   * @param first the first mask
   * @param second the second mask
   * @return the mask
   */
  public static PixelMask and(PixelMask first, PixelMask second) {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    return (x, y) -> first.contains(x, y) && second.contains(x, y);
  }
}
