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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import uk.ac.sussex.gdsc.diffraction.profile.PeakProfiles;
import uk.ac.sussex.gdsc.diffraction.profile.ProfileFunction;
import uk.ac.sussex.gdsc.diffraction.profile.PseudoVoigtFunction;
import uk.ac.sussex.gdsc.diffraction.radial.LinearInterpolation;
import uk.ac.sussex.gdsc.diffraction.radial.RadialCurve;

/**
 * Estimates the inelastic background from the constant level beneath diffraction features.
 *
 * <p>Each feature is identified by an anchor point. A window of samples around the anchor is
 * fitted with a pseudo-Voigt profile plus a constant. The constants of all windows describe a
 * 'stair-step' background that is linearly interpolated over the whole curve. The data is
 * assumed to be corrected for diffuse scattering from the substrate.
 */
public class StitchedVoigtBackground {
  /** The default number of samples on each side of the feature. */
  public static final int DEFAULT_CHUNK_SIZE = 5;
  /** The initial guess for the Gaussian and Lorentzian widths. */
  public static final double INITIAL_WIDTH = 0.1;

  private static final Logger LOGGER = Logger.getLogger(StitchedVoigtBackground.class.getName());

  private int chunkSize = DEFAULT_CHUNK_SIZE;
  private int smoothingWindow;

  /**
   * Gets the chunk size.
   *
   * @return the chunk size
   */
  public int getChunkSize() {
    return chunkSize;
  }

  /**
   * Sets the number of samples on each side of the feature. Each window has
   * {@code 2 * chunkSize + 1} samples.
   *
   * @param chunkSize the new chunk size
   * @return this
   * @throws IllegalArgumentException if the chunk size is not at least 2
   */
  public StitchedVoigtBackground setChunkSize(int chunkSize) {
    this.chunkSize = validateChunkSize(chunkSize);
    return this;
  }

  /**
   * Check the chunk size is valid.
   *
   * @param chunkSize the chunk size
   * @return the chunk size
   * @throws IllegalArgumentException if the chunk size is not at least 2
   */
  public static int validateChunkSize(int chunkSize) {
    // The window must have more samples than the 5 fit parameters
    if (chunkSize < 2) {
      throw new IllegalArgumentException("Chunk size must be at least 2: " + chunkSize);
    }
    return chunkSize;
  }

  /**
   * Gets the smoothing window.
   *
   * @return the smoothing window
   */
  public int getSmoothingWindow() {
    return smoothingWindow;
  }

  /**
   * Sets the moving average window used to smooth the background. Use 0 to disable smoothing
   * (the default).
   *
   * @param smoothingWindow the new smoothing window
   * @return this
   * @see CurveSmoother#movingAverage(double[], int)
   */
  public StitchedVoigtBackground setSmoothingWindow(int smoothingWindow) {
    this.smoothingWindow = Math.max(0, smoothingWindow);
    return this;
  }

  /**
   * Estimate the background.
   *
   * <p>Anchor points are arrays of {x} or {x, y}; only the x position is used.
   *
   * @param curve the curve
   * @param anchors the anchor points
   * @return the background
   * @throws IllegalArgumentException if there are no anchors or an anchor is invalid
   * @throws AnchorOutOfRangeException if a feature window is outside the curve
   */
  public StitchedBackground estimate(RadialCurve curve, double[][] anchors) {
    final int[] windowStart = findWindows(curve, anchors);
    final int windowSize = 2 * chunkSize + 1;
    final double[] x = curve.getX();
    final double[] y = curve.getY();

    final List<VoigtParameters> features = new ArrayList<>(windowStart.length);
    final double[][] levels = new double[windowStart.length * windowSize][];
    int count = 0;
    for (final int from : windowStart) {
      final double[] xw = Arrays.copyOfRange(x, from, from + windowSize);
      final double[] yw = Arrays.copyOfRange(y, from, from + windowSize);
      final VoigtParameters feature = fitFeature(xw, yw);
      features.add(feature);
      final double level = feature.getBackgroundLevel();
      for (final double value : xw) {
        levels[count++] = new double[] {value, level};
      }
    }

    // Windows may be given in any order. The sort is stable.
    Arrays.sort(levels, (a, b) -> Double.compare(a[0], b[0]));
    final double[] xp = new double[levels.length];
    final double[] fp = new double[levels.length];
    for (int i = 0; i < levels.length; i++) {
      xp[i] = levels[i][0];
      fp[i] = levels[i][1];
    }
    double[] bg = LinearInterpolation.interpolate(xp, fp, x);
    if (smoothingWindow > 1) {
      bg = CurveSmoother.movingAverage(bg, smoothingWindow);
    }
    final RadialCurve background = new RadialCurve(x, bg, "background");

    final List<RadialCurve> profiles = new ArrayList<>(features.size());
    for (int i = 0; i < features.size(); i++) {
      final VoigtParameters f = features.get(i);
      // Shift the profile onto the data
      profiles.add(new RadialCurve(x, PeakProfiles.pseudoVoigt(x, f.getHeight(), f.getCenter(),
          f.getWidthG(), f.getWidthL(), f.getBackgroundLevel()), "peak" + i));
    }

    return new StitchedBackground(background, features, profiles);
  }

  /**
   * Find the start index of the window around each anchor. All windows are validated before
   * any fitting.
   *
   * @param curve the curve
   * @param anchors the anchors
   * @return the window start indices
   */
  private int[] findWindows(RadialCurve curve, double[][] anchors) {
    if (ArrayUtils.isEmpty(anchors)) {
      throw new IllegalArgumentException("No anchor points");
    }
    final int[] start = new int[anchors.length];
    for (int i = 0; i < anchors.length; i++) {
      final double position = anchorPosition(anchors, i);
      final int index = curve.nearestIndex(position);
      final int from = index - chunkSize;
      final int to = index + chunkSize;
      if (from < 0 || to >= curve.size()) {
        throw new AnchorOutOfRangeException(String.format(
            "Feature window [%d, %d] around anchor %d (x=%s) is outside the curve [0, %d)", from,
            to, i, position, curve.size()));
      }
      start[i] = from;
    }
    return start;
  }

  /**
   * Get the x position of the anchor.
   *
   * @param anchors the anchors
   * @param index the index
   * @return the position
   * @throws IllegalArgumentException if the anchor is empty or not finite
   */
  static double anchorPosition(double[][] anchors, int index) {
    final double[] anchor = anchors[index];
    if (ArrayUtils.isEmpty(anchor)) {
      throw new IllegalArgumentException("Empty anchor point " + index);
    }
    if (!Double.isFinite(anchor[0])) {
      throw new IllegalArgumentException("Non-finite anchor point " + index + ": " + anchor[0]);
    }
    return anchor[0];
  }

  /**
   * Fit a pseudo-Voigt plus constant to the window.
   *
   * <p>A fit that is degenerate is not used. The feature is then flagged as not converged and
   * the window minimum is the background level.
   *
   * @param xw the window x
   * @param yw the window y
   * @return the feature
   * @see #checkFeature(double[], double, double)
   */
  private static VoigtParameters fitFeature(double[] xw, double[] yw) {
    // Remove most of the offset to improve the fit
    double min = yw[0];
    for (final double v : yw) {
      min = Math.min(min, v);
    }
    double max = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < yw.length; i++) {
      yw[i] -= min;
      max = Math.max(max, yw[i]);
    }
    final double[] guess = {max, (xw[xw.length - 1] - xw[0]) / 2 + xw[0], INITIAL_WIDTH,
        INITIAL_WIDTH, 0};

    // A feature cannot be wider than its window
    final double maxWidth = Math.max(ProfileFunction.MIN_WIDTH, xw[xw.length - 1] - xw[0]);
    final double[] fit;
    try {
      fit = LeastSquaresFitter.fit(new PseudoVoigtFunction(xw, maxWidth), yw, guess);
    } catch (TooManyIterationsException | TooManyEvaluationsException
        | ConvergenceException ex) {
      LOGGER.log(Level.WARNING, ex, () -> String.format(
          "Failed to fit the feature at x=%s; using the window minimum as the background",
          guess[1]));
      return new VoigtParameters(guess, min, false);
    }
    final String problem = checkFeature(fit, maxWidth, max);
    if (problem != null) {
      LOGGER.warning(() -> String.format(
          "Degenerate fit of the feature at x=%s (%s): %s; using the window minimum as the "
              + "background",
          guess[1], problem, Arrays.toString(fit)));
      return new VoigtParameters(guess, min, false);
    }
    return new VoigtParameters(fit, min, true);
  }

  /**
   * Check the fit of a normalised window. The fit is degenerate if a width is at the limit of
   * the parameter validator, or the offset is further from the window minimum than the window
   * range.
   *
   * @param fit the fitted parameters {height, center, widthG, widthL, offset}
   * @param maxWidth the maximum width
   * @param range the window range (maximum - minimum)
   * @return the problem (or null if the fit is valid)
   */
  static String checkFeature(double[] fit, double maxWidth, double range) {
    for (final int i : new int[] {PseudoVoigtFunction.WIDTH_G, PseudoVoigtFunction.WIDTH_L}) {
      if (fit[i] >= maxWidth) {
        return "width at the window span";
      }
      if (fit[i] <= ProfileFunction.MIN_WIDTH) {
        return "width at the minimum";
      }
    }
    final double offset = fit[PseudoVoigtFunction.OFFSET];
    if (offset < -range || offset > range) {
      return "background outside the window range";
    }
    return null;
  }
}
