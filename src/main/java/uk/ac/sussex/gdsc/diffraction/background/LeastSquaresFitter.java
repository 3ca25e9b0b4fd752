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
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresFactory;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem.Evaluation;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.ConvergenceChecker;
import uk.ac.sussex.gdsc.diffraction.profile.ProfileFunction;

/**
 * Fits a profile function to observed data using the Levenberg-Marquardt algorithm.
 */
final class LeastSquaresFitter {
  /** The relative change in the cost used to stop the fit. */
  static final double RELATIVE_COST_THRESHOLD = 1e-10;
  /** The maximum number of iterations. */
  static final int MAX_ITERATIONS = 3000;

  /** No public construction. */
  private LeastSquaresFitter() {}

  /**
   * Fit the function.
   *
   * @param function the function
   * @param y the observed values at each x position of the function
   * @param start the start point
   * @return the fitted parameters
   * @throws ConvergenceException if the fit fails to converge or the result is not finite
   * @throws TooManyIterationsException if the iteration limit is reached
   * @throws TooManyEvaluationsException if the evaluation limit is reached
   */
  static double[] fit(ProfileFunction function, double[] y, double[] start) {
    final LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer();
    final RealVector observed = new ArrayRealVector(y, true);
    final ConvergenceChecker<Evaluation> checker = (iteration, previous,
        current) -> relativeError(previous.getCost(), current.getCost()) < RELATIVE_COST_THRESHOLD;
    final double[] ones = new double[y.length];
    Arrays.fill(ones, 1.0);
    final RealMatrix weightMatrix = new DiagonalMatrix(ones, false);
    final int maxEvaluations = Integer.MAX_VALUE;
    final boolean lazyEvaluation = false;

    final LeastSquaresProblem problem = LeastSquaresFactory.create(function, observed,
        new ArrayRealVector(start, true), weightMatrix, checker, maxEvaluations, MAX_ITERATIONS,
        lazyEvaluation, function.getParameterValidator());
    final Optimum optimum = optimizer.optimize(problem);
    final double[] fit = optimum.getPoint().toArray();
    for (final double v : fit) {
      if (!Double.isFinite(v)) {
        throw new ConvergenceException();
      }
    }
    return fit;
  }

  /**
   * Compute the relative error between two values.
   *
   * @param a the first value
   * @param b the second value
   * @return the relative error
   */
  static double relativeError(double a, double b) {
    final double max = Math.max(Math.abs(a), Math.abs(b));
    return max == 0 ? 0 : Math.abs(a - b) / max;
  }
}
