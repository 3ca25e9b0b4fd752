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

/**
 * Piecewise linear interpolation of sampled data.
 *
 * <p>Values outside the sampled domain are clamped to the value at the nearest end.
 */
public final class LinearInterpolation {

  /** No public construction. */
  private LinearInterpolation() {}

  /**
   * Interpolate the function at the given position.
   *
   * <p>The sample positions must be non-decreasing. This is not checked.
   *
   * @param xp the sample positions
   * @param fp the sample values
   * @param x the position
   * @return the value
   * @throws IllegalArgumentException if the sample data is empty or of different lengths
   */
  public static double interpolate(double[] xp, double[] fp, double x) {
    checkSamples(xp, fp);
    return value(xp, fp, x);
  }

  /**
   * Interpolate the function at each of the given positions.
   *
   * <p>The sample positions must be non-decreasing. This is not checked.
   *
   * @param xp the sample positions
   * @param fp the sample values
   * @param x the positions
   * @return the values
   * @throws IllegalArgumentException if the sample data is empty or of different lengths
   */
  public static double[] interpolate(double[] xp, double[] fp, double[] x) {
    checkSamples(xp, fp);
    final double[] values = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      values[i] = value(xp, fp, x[i]);
    }
    return values;
  }

  private static void checkSamples(double[] xp, double[] fp) {
    if (xp.length != fp.length) {
      throw new IllegalArgumentException(
          "Sample length mismatch: " + xp.length + " != " + fp.length);
    }
    if (xp.length == 0) {
      throw new IllegalArgumentException("No samples");
    }
  }

  private static double value(double[] xp, double[] fp, double x) {
    final int last = xp.length - 1;
    if (x <= xp[0]) {
      return fp[0];
    }
    if (x >= xp[last]) {
      return fp[last];
    }
    // Find the first sample above x. This handles duplicate sample positions.
    int lo = 0;
    int hi = last;
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      if (xp[mid] > x) {
        hi = mid;
      } else {
        lo = mid + 1;
      }
    }
    final int j = lo - 1;
    final double fraction = (x - xp[j]) / (xp[lo] - xp[j]);
    return fp[j] + fraction * (fp[lo] - fp[j]);
  }
}
