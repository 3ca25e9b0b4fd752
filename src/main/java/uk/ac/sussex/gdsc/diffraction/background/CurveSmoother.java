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

package uk.ac.sussex.gdsc.diffraction.background;

import uk.ac.sussex.gdsc.diffraction.radial.RadialCurve;

/**
 * Smooths curve data using a centred moving average. The window is truncated at the ends of the
 * data.
 */
public final class CurveSmoother {

  /** No public construction. */
  private CurveSmoother() {}

  /**
   * Compute the moving average. The window size is the number of samples in the average and
   * should be odd; an even size is increased by 1. A size below 2 returns a copy of the data.
   *
   * @param y the data
   * @param window the window size
   * @return the smoothed data
   */
  public static double[] movingAverage(double[] y, int window) {
    if (window < 2 || y.length == 0) {
      return y.clone();
    }
    final int half = window / 2;
    // Rolling sum over [i - half, i + half]
    final double[] smooth = new double[y.length];
    double sum = 0;
    int lo = 0;
    int hi = -1;
    for (int i = 0; i < y.length; i++) {
      final int from = Math.max(0, i - half);
      final int to = Math.min(y.length - 1, i + half);
      while (hi < to) {
        sum += y[++hi];
      }
      while (lo < from) {
        sum -= y[lo++];
      }
      smooth[i] = sum / (hi - lo + 1);
    }
    return smooth;
  }

  /**
   * Smooth the curve y data.
   *
   * @param curve the curve
   * @param window the window size
   * @return the smoothed curve
   * @see #movingAverage(double[], int)
   */
  public static RadialCurve smooth(RadialCurve curve, int window) {
    return new RadialCurve(curve.getX(), movingAverage(curve.getY(), window), curve.getLabel());
  }
}
