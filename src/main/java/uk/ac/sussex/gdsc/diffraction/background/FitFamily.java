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

import uk.ac.sussex.gdsc.diffraction.profile.BiExponentialFunction;
import uk.ac.sussex.gdsc.diffraction.profile.BiLorentzianFunction;
import uk.ac.sussex.gdsc.diffraction.profile.PeakProfiles;
import uk.ac.sussex.gdsc.diffraction.profile.ProfileFunction;
import uk.ac.sussex.gdsc.diffraction.radial.RadialCurve;

/**
 * The function family used for a global inelastic background fit. Each family has six
 * parameters and derives its default initial guess from the curve being fitted.
 */
public enum FitFamily {
  /**
   * Bi-exponential decay {a, b, c, d, e, f}.
   *
   * <pre>
   * f(x) = a * exp(-b * (x - f)) + c * exp(-d * (x - f)) + e
   * </pre>
   *
   * <p>Default guess: {ymax/2, 1/50, ymax/2, 1/150, ymin, xmin}. The shift f is held at the guess
   * during fitting.
   */
  BIEXPONENTIAL("Bi-exponential") {
    @Override
    public double[] createGuess(double xmin, double ymin, double ymax) {
      return new double[] {ymax / 2, 1 / 50.0, ymax / 2, 1 / 150.0, ymin, xmin};
    }

    @Override
    ProfileFunction createFunction(double[] x, double[] guess) {
      return new BiExponentialFunction(x, guess[5]);
    }

    @Override
    double[] toStart(double[] guess) {
      return new double[] {guess[0], guess[1], guess[2], guess[3], guess[4]};
    }

    @Override
    double[] toParameters(double[] fit, double[] guess) {
      return new double[] {fit[0], fit[1], fit[2], fit[3], fit[4], guess[5]};
    }

    @Override
    public double[] evaluate(double[] x, double[] p) {
      return PeakProfiles.biExponential(x, p[0], p[1], p[2], p[3], p[4], p[5]);
    }
  },

  /**
   * Bi-Lorentzian {center, amp1, amp2, width1, width2, offset}.
   *
   * <p>Default guess: {xmin, ymax/1.5, ymax/2, 50, 150, ymin}.
   */
  BILORENTZIAN("Bi-Lorentzian") {
    @Override
    public double[] createGuess(double xmin, double ymin, double ymax) {
      return new double[] {xmin, ymax / 1.5, ymax / 2.0, 50.0, 150.0, ymin};
    }

    @Override
    ProfileFunction createFunction(double[] x, double[] guess) {
      return new BiLorentzianFunction(x);
    }

    @Override
    double[] toStart(double[] guess) {
      return guess.clone();
    }

    @Override
    double[] toParameters(double[] fit, double[] guess) {
      return fit.clone();
    }

    @Override
    public double[] evaluate(double[] x, double[] p) {
      return PeakProfiles.biLorentzian(x, p[0], p[1], p[2], p[3], p[4], p[5]);
    }
  };

  /** The number of parameters of each family. */
  public static final int NUMBER_OF_PARAMETERS = 6;

  private final String description;

  FitFamily(String description) {
    this.description = description;
  }

  /**
   * Gets the description.
   *
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return getDescription();
  }

  /**
   * Create from the description.
   *
   * @param description the description
   * @return the family (or null)
   * @see #getDescription()
   */
  public static FitFamily fromDescription(String description) {
    for (final FitFamily value : values()) {
      if (value.getDescription().equals(description)) {
        return value;
      }
    }
    return null;
  }

  /**
   * Create the default initial guess from the curve.
   *
   * @param curve the curve
   * @return the guess
   * @throws IllegalArgumentException if the curve is empty
   */
  public double[] createGuess(RadialCurve curve) {
    if (curve.isEmpty()) {
      throw new IllegalArgumentException("Empty curve");
    }
    double ymin = curve.getY(0);
    double ymax = ymin;
    for (int i = 1; i < curve.size(); i++) {
      final double v = curve.getY(i);
      if (ymin > v) {
        ymin = v;
      } else if (ymax < v) {
        ymax = v;
      }
    }
    // x is sorted
    return createGuess(curve.getX(0), ymin, ymax);
  }

  /**
   * Create the default initial guess from the curve limits.
   *
   * @param xmin the minimum x
   * @param ymin the minimum y
   * @param ymax the maximum y
   * @return the guess
   */
  public abstract double[] createGuess(double xmin, double ymin, double ymax);

  /**
   * Create the function to fit at the given x positions.
   *
   * @param x the x positions
   * @param guess the full initial guess
   * @return the function
   */
  abstract ProfileFunction createFunction(double[] x, double[] guess);

  /**
   * Extract the fitted parameters from the full parameters.
   *
   * @param guess the full parameters
   * @return the fit start point
   */
  abstract double[] toStart(double[] guess);

  /**
   * Combine the fitted parameters with the full guess to create the full parameters.
   *
   * @param fit the fitted parameters
   * @param guess the full initial guess
   * @return the full parameters
   */
  abstract double[] toParameters(double[] fit, double[] guess);

  /**
   * Evaluate the function.
   *
   * @param x the x positions
   * @param parameters the full parameters
   * @return the values
   */
  public abstract double[] evaluate(double[] x, double[] parameters);
}
