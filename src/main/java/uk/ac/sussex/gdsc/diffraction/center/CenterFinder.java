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

package uk.ac.sussex.gdsc.diffraction.center;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimplePointChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import uk.ac.sussex.gdsc.diffraction.image.DiffractionImage;

/**
 * Finds the center of a diffraction pattern from an initial guess of the center and the radius of
 * a diffraction ring.
 *
 * <p>The {@link CircularIntensityMetric} is minimised over (x, y, r) using the downhill simplex
 * method in scaled units. Only the center is taken from the optimum: the radius of the result is
 * the guessed radius.
 *
 * <p>The search has a fixed evaluation budget. If the budget is exhausted the best point evaluated
 * is returned and flagged as not converged.
 */
public class CenterFinder {
  /** The initial simplex step as a fraction of each non-zero start coordinate. */
  private static final double STEP_FRACTION = 0.05;
  /** The initial simplex step for a start coordinate of zero. */
  private static final double ZERO_STEP = 0.00025;

  private static final Logger LOGGER = Logger.getLogger(CenterFinder.class.getName());

  private final CenterFinderOptions options;

  /**
   * Create an instance with the default options.
   */
  public CenterFinder() {
    this(new CenterFinderOptions());
  }

  /**
   * Create an instance. The options are copied.
   *
   * @param options the options
   */
  public CenterFinder(CenterFinderOptions options) {
    this.options = options.copy();
  }

  /**
   * Gets a copy of the options.
   *
   * @return the options
   */
  public CenterFinderOptions getOptions() {
    return options.copy();
  }

  /**
   * Find the center.
   *
   * @param image the image
   * @param xg the x center guess (pixels)
   * @param yg the y center guess (pixels)
   * @param rg the ring radius guess (pixels)
   * @return the result
   */
  public CenterResult findCenter(DiffractionImage image, double xg, double yg, double rg) {
    final double scale = options.getScaleFactor();
    final CircularIntensityMetric metric = new CircularIntensityMetric(image, options);
    final BestPointFunction function = new BestPointFunction(metric);

    final double[] start = {xg / scale, yg / scale, rg / scale};
    final double[] steps = new double[start.length];
    for (int i = 0; i < start.length; i++) {
      steps[i] = start[i] == 0 ? ZERO_STEP : STEP_FRACTION * start[i];
    }

    final SimplexOptimizer optimizer = new SimplexOptimizer(
        new SimplePointChecker<>(options.getRelativeThreshold(), options.getAbsoluteThreshold()));

    double[] point;
    double value;
    boolean converged;
    try {
      final PointValuePair optimum = optimizer.optimize(new MaxEval(options.getMaxEvaluations()),
          new ObjectiveFunction(function), GoalType.MINIMIZE, new InitialGuess(start),
          new NelderMeadSimplex(steps));
      point = optimum.getPoint();
      value = optimum.getValue();
      converged = true;
    } catch (final TooManyEvaluationsException ex) {
      LOGGER.log(Level.WARNING, () -> String.format(
          "Center search did not converge within %d evaluations; using the best point",
          options.getMaxEvaluations()));
      point = function.getBestPoint();
      value = function.getBestValue();
      converged = false;
    }

    if (value == Double.POSITIVE_INFINITY) {
      LOGGER.warning(() -> String.format(
          "No pixels found on the ring around %s,%s (r=%s); the center is the initial guess", xg,
          yg, rg));
    }

    final CenterResult result = new CenterResult(point[0] * scale, point[1] * scale, rg,
        point[2] * scale, value, function.getEvaluations(), converged);
    LOGGER.fine(() -> String.format("Guess %s,%s (r=%s) : %s after %d evaluations", xg, yg, rg,
        result, result.getEvaluations()));
    return result;
  }

  /**
   * Wraps a function and records the best (minimum) point evaluated.
   */
  private static class BestPointFunction implements MultivariateFunction {
    private final MultivariateFunction delegate;
    private double[] bestPoint;
    private double bestValue = Double.NaN;
    private int evaluations;

    BestPointFunction(MultivariateFunction delegate) {
      this.delegate = delegate;
    }

    @Override
    public double value(double[] point) {
      final double value = delegate.value(point);
      evaluations++;
      if (bestPoint == null || value < bestValue) {
        bestPoint = point.clone();
        bestValue = value;
      }
      return value;
    }

    double[] getBestPoint() {
      return bestPoint;
    }

    double getBestValue() {
      return bestValue;
    }

    int getEvaluations() {
      return evaluations;
    }
  }
}
