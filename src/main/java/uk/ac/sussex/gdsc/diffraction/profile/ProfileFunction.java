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

package uk.ac.sussex.gdsc.diffraction.profile;

import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.RealVector;

/**
 * Base class for a profile function evaluated at a fixed set of x positions for use in least
 * squares fitting.
 */
public abstract class ProfileFunction implements MultivariateJacobianFunction {
  /**
   * The smallest absolute width allowed by the parameter validator. This prevents division by
   * zero in the Lorentzian and Gaussian terms.
   */
  public static final double MIN_WIDTH = 1e-10;

  /** The x positions. */
  protected final double[] x;

  /**
   * Create an instance.
   *
   * @param x the x positions
   */
  ProfileFunction(double[] x) {
    this.x = x.clone();
  }

  /**
   * Get the number of x positions.
   *
   * @return the size
   */
  public int size() {
    return x.length;
  }

  /**
   * Gets the number of fitted parameters.
   *
   * @return the number of parameters
   */
  public abstract int getNumberOfParameters();

  /**
   * Compute the values of the function.
   *
   * @param point the point
   * @return the values
   */
  public abstract double[] values(RealVector point);

  /**
   * Gets the parameter validator used during fitting. The default implementation returns null
   * (no constraints).
   *
   * @return the parameter validator (or null)
   */
  public ParameterValidator getParameterValidator() {
    return null;
  }

  /**
   * Create a validator that ensures the given parameters are in the range
   * {@code [MIN_WIDTH, maxWidth]}. Widths enter the profiles squared so the sign is ignored.
   *
   * @param maxWidth the maximum width
   * @param indices the indices of the width parameters
   * @return the parameter validator
   */
  static ParameterValidator widthValidator(double maxWidth, int... indices) {
    return point -> {
      for (final int i : indices) {
        final double w = Math.abs(point.getEntry(i));
        point.setEntry(i, Math.min(Math.max(w, MIN_WIDTH), maxWidth));
      }
      return point;
    };
  }
}
