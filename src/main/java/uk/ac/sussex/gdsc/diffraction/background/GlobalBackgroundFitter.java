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

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import uk.ac.sussex.gdsc.diffraction.profile.ProfileFunction;
import uk.ac.sussex.gdsc.diffraction.radial.RadialCurve;

/**
 * Fits a single smooth function through background anchor points to estimate the inelastic
 * scattering background.
 *
 * <p>The curve is interpolated at the anchor x positions and the chosen {@link FitFamily} is fitted
 * to those values. If the fit fails the initial guess is used and the result is flagged as not
 * converged. The fitted function is evaluated over the entire curve.
 */
public final class GlobalBackgroundFitter {
  private static final Logger LOGGER = Logger.getLogger(GlobalBackgroundFitter.class.getName());

  /** No public construction. */
  private GlobalBackgroundFitter() {}

  /**
   * Fit the background using the default guess of the family.
   *
   * @param curve the curve
   * @param anchors the anchor points: {x} or {x, y}; only x is used
   * @param family the family
   * @return the fit
   * @throws IllegalArgumentException if there are no anchors or an anchor is invalid
   * @throws AnchorOutOfRangeException if an anchor is outside the curve domain
   * @see FitFamily#createGuess(RadialCurve)
   */
  public static BackgroundFit fit(RadialCurve curve, double[][] anchors, FitFamily family) {
    return fit(curve, anchors, family, family.createGuess(curve));
  }

  /**
   * Fit the background.
   *
   * @param curve the curve
   * @param anchors the anchor points: {x} or {x, y}; only x is used
   * @param family the family
   * @param guess the initial guess (the full parameters of the family)
   * @return the fit
   * @throws IllegalArgumentException if there are no anchors, an anchor is invalid, or the guess
   *         has the wrong length
   * @throws AnchorOutOfRangeException if an anchor is outside the curve domain
   */
  public static BackgroundFit fit(RadialCurve curve, double[][] anchors, FitFamily family,
      double[] guess) {
    Objects.requireNonNull(family, "family");
    if (guess.length != FitFamily.NUMBER_OF_PARAMETERS) {
      throw new IllegalArgumentException("Guess requires " + FitFamily.NUMBER_OF_PARAMETERS
          + " parameters: " + guess.length);
    }
    final double[] x = anchorPositions(curve, anchors);
    final double[] y = curve.valuesAt(x);
    final double[] initial = guess.clone();

    final ProfileFunction function = family.createFunction(x, initial);
    double[] parameters;
    boolean converged;
    String message;
    if (x.length < function.getNumberOfParameters()) {
      message = String.format("%s fit requires at least %d anchor points: %d", family,
          function.getNumberOfParameters(), x.length);
      parameters = initial.clone();
      converged = false;
    } else {
      try {
        final double[] fit = LeastSquaresFitter.fit(function, y, family.toStart(initial));
        parameters = family.toParameters(fit, initial);
        converged = true;
        message = "";
      } catch (TooManyIterationsException | TooManyEvaluationsException
          | ConvergenceException ex) {
        message = family + " fit failed: " + ex.getMessage();
        parameters = initial.clone();
        converged = false;
      }
    }
    if (converged) {
      final double[] fitted = parameters;
      LOGGER.fine(() -> family + " background: " + Arrays.toString(fitted));
    } else {
      LOGGER.log(Level.WARNING, "{0}; using the initial guess", message);
    }

    final RadialCurve background = new RadialCurve(curve.getX(),
        family.evaluate(curve.getX(), parameters), "IBG " + curve.getLabel());
    return new BackgroundFit(family, initial, parameters, converged, message, background);
  }

  /**
   * Get the anchor x positions in ascending order. The order of the anchors does not change the
   * fit.
   *
   * @param curve the curve
   * @param anchors the anchors
   * @return the positions
   */
  private static double[] anchorPositions(RadialCurve curve, double[][] anchors) {
    if (ArrayUtils.isEmpty(anchors)) {
      throw new IllegalArgumentException("No anchor points");
    }
    if (curve.isEmpty()) {
      throw new IllegalArgumentException("Empty curve");
    }
    final double min = curve.getX(0);
    final double max = curve.getX(curve.size() - 1);
    final double[] x = new double[anchors.length];
    for (int i = 0; i < x.length; i++) {
      x[i] = StitchedVoigtBackground.anchorPosition(anchors, i);
      if (x[i] < min || x[i] > max) {
        throw new AnchorOutOfRangeException(
            "Anchor " + i + " (x=" + x[i] + ") is outside the curve [" + min + ", " + max + "]");
      }
    }
    Arrays.sort(x);
    return x;
  }
}
