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

package uk.ac.sussex.gdsc.diffraction.radial;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.diffraction.image.DiffractionImage;
import uk.ac.sussex.gdsc.diffraction.image.PixelMask;
import uk.ac.sussex.gdsc.diffraction.image.PixelMasks;

/**
 * Computes the radial average of an image around a center.
 *
 * <p>Pixels are binned by the distance to the center rounded to the nearest integer. The bins are
 * all the distinct radii in the image. Pixels outside the mask contribute to no bin; a bin with
 * no contributing pixels has a mean of zero.
 *
 * <p>The pixel count of each bin starts at {@link #INITIAL_BIN_COUNT}. This damps the mean of bins
 * with few pixels (most noticeable at small radii).
 */
public final class RadialAverager {
  /** The initial pixel count of each radial bin. */
  public static final int INITIAL_BIN_COUNT = 1;

  private static final Logger LOGGER = Logger.getLogger(RadialAverager.class.getName());

  /** No public construction. */
  private RadialAverager() {}

  /**
   * Gets the default mask for the center. This excludes the rows with an index below the first
   * coordinate of the center, which contain the beam block.
   *
   * @param xc the x center
   * @param yc the y center
   * @return the mask
   */
  public static PixelMask defaultMask(int xc, int yc) {
    return PixelMasks.rowsFrom(xc);
  }

  /**
   * Compute the radial average using the {@link #defaultMask(int, int) default mask}.
   *
   * @param image the image
   * @param xc the x center
   * @param yc the y center
   * @param name the name of the image
   * @return the radial average
   * @throws IllegalArgumentException if the center is outside the image
   */
  public static RadialCurve average(DiffractionImage image, int xc, int yc, String name) {
    return average(image, xc, yc, defaultMask(xc, yc), name);
  }

  /**
   * Compute the radial average.
   *
   * @param image the image
   * @param xc the x center
   * @param yc the y center
   * @param mask the mask of included pixels
   * @param name the name of the image
   * @return the radial average
   * @throws IllegalArgumentException if the center is outside the image
   */
  public static RadialCurve average(DiffractionImage image, int xc, int yc, PixelMask mask,
      String name) {
    Objects.requireNonNull(mask, "mask");
    final int width = image.getWidth();
    final int height = image.getHeight();
    if (xc < 0 || xc >= width || yc < 0 || yc >= height) {
      throw new IllegalArgumentException(
          "Center " + xc + "," + yc + " is outside the image " + width + "x" + height);
    }

    // The furthest pixel is a corner
    final int maxDx = Math.max(xc, width - 1 - xc);
    final int maxDy = Math.max(yc, height - 1 - yc);
    final int maxRadius = radius(maxDx * maxDx + maxDy * maxDy);

    final boolean[] present = new boolean[maxRadius + 1];
    final double[] sum = new double[maxRadius + 1];
    final int[] count = new int[maxRadius + 1];
    Arrays.fill(count, INITIAL_BIN_COUNT);

    long included = 0;
    for (int y = 0; y < height; y++) {
      final int dy2 = (y - yc) * (y - yc);
      for (int x = 0, i = y * width; x < width; x++, i++) {
        final int r = radius((x - xc) * (x - xc) + dy2);
        present[r] = true;
        if (mask.contains(x, y)) {
          sum[r] += image.get(i);
          count[r]++;
          included++;
        }
      }
    }

    int size = 0;
    for (final boolean b : present) {
      if (b) {
        size++;
      }
    }
    final double[] radii = new double[size];
    final double[] mean = new double[size];
    for (int r = 0, j = 0; r < present.length; r++) {
      if (present[r]) {
        radii[j] = r;
        mean[j] = sum[r] / count[r];
        j++;
      }
    }

    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine(String.format("Radial average of %s around %d,%d: %d bins from %d pixels",
          name, xc, yc, size, included));
    }
    return RadialCurve.wrap(radii, mean, name + " radial average");
  }

  private static int radius(int d2) {
    return (int) Math.round(Math.sqrt(d2));
  }
}
