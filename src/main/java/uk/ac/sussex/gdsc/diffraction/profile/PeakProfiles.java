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

/**
 * Peak and background profiles used to model radially averaged diffraction curves.
 *
 * <p>The peak shapes have a maximum height of 1 (they are not normalised to unit area). Widths
 * must be non-zero; a zero Lorentzian width at the centre is undefined.
 */
public final class PeakProfiles {

  /** The weight of the Gaussian component in the pseudo-Voigt profile. */
  public static final double VOIGT_GAUSSIAN_FRACTION = 0.5;

  /** No public construction. */
  private PeakProfiles() {}

  /**
   * Compute a Gaussian with a maximum height of 1.
   *
   * <pre>
   * f(x) = exp(-(x - xc)^2 / (2 * w)^2)
   * </pre>
   *
   * @param x the x
   * @param center the center
   * @param width the width
   * @return the value
   */
  public static double gaussian(double x, double center, double width) {
    final double dx = x - center;
    final double w2 = 2 * width;
    return Math.exp(-(dx * dx) / (w2 * w2));
  }

  /**
   * Compute a Lorentzian with a maximum height of 1.
   *
   * <pre>
   * f(x) = (w/2)^2 / ((x - xc)^2 + (w/2)^2)
   * </pre>
   *
   * @param x the x
   * @param center the center
   * @param width the width (full width at half maximum)
   * @return the value
   */
  public static double lorentzian(double x, double center, double width) {
    final double dx = x - center;
    final double hw2 = 0.25 * width * width;
    return hw2 / (dx * dx + hw2);
  }

  /**
   * Compute a pseudo-Voigt profile using an equal mix of a Gaussian and a Lorentzian.
   *
   * @param x the x
   * @param height the height
   * @param center the center
   * @param widthG the Gaussian width
   * @param widthL the Lorentzian width
   * @param offset the constant offset
   * @return the value
   */
  public static double pseudoVoigt(double x, double height, double center, double widthG,
      double widthL, double offset) {
    return height * (VOIGT_GAUSSIAN_FRACTION * gaussian(x, center, widthG)
        + (1 - VOIGT_GAUSSIAN_FRACTION) * lorentzian(x, center, widthL)) + offset;
  }

  /**
   * Compute a bi-exponential decay.
   *
   * <pre>
   * f(x) = a * exp(-b * (x - f)) + c * exp(-d * (x - f)) + e
   * </pre>
   *
   * @param x the x
   * @param a the first amplitude
   * @param b the first rate
   * @param c the second amplitude
   * @param d the second rate
   * @param e the offset
   * @param f the x shift
   * @return the value
   */
  public static double biExponential(double x, double a, double b, double c, double d, double e,
      double f) {
    final double u = x - f;
    return a * Math.exp(-b * u) + c * Math.exp(-d * u) + e;
  }

  /**
   * Compute the sum of two Lorentzians sharing a center plus an offset.
   *
   * @param x the x
   * @param center the center
   * @param amp1 the first amplitude
   * @param amp2 the second amplitude
   * @param width1 the first width
   * @param width2 the second width
   * @param offset the offset
   * @return the value
   */
  public static double biLorentzian(double x, double center, double amp1, double amp2,
      double width1, double width2, double offset) {
    return amp1 * lorentzian(x, center, width1) + amp2 * lorentzian(x, center, width2) + offset;
  }

  /**
   * Compute a Gaussian at each x.
   *
   * @param x the x
   * @param center the center
   * @param width the width
   * @return the values
   * @see #gaussian(double, double, double)
   */
  public static double[] gaussian(double[] x, double center, double width) {
    final double[] values = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      values[i] = gaussian(x[i], center, width);
    }
    return values;
  }

  /**
   * Compute a Lorentzian at each x.
   *
   * @param x the x
   * @param center the center
   * @param width the width
   * @return the values
   * @see #lorentzian(double, double, double)
   */
  public static double[] lorentzian(double[] x, double center, double width) {
    final double[] values = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      values[i] = lorentzian(x[i], center, width);
    }
    return values;
  }

  /**
   * Compute a pseudo-Voigt profile at each x.
   *
   * @param x the x
   * @param height the height
   * @param center the center
   * @param widthG the Gaussian width
   * @param widthL the Lorentzian width
   * @param offset the constant offset
   * @return the values
   * @see #pseudoVoigt(double, double, double, double, double, double)
   */
  public static double[] pseudoVoigt(double[] x, double height, double center, double widthG,
      double widthL, double offset) {
    final double[] values = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      values[i] = pseudoVoigt(x[i], height, center, widthG, widthL, offset);
    }
    return values;
  }

  /**
   * Compute a bi-exponential at each x.
   *
   * @param x the x
   * @param a the first amplitude
   * @param b the first rate
   * @param c the second amplitude
   * @param d the second rate
   * @param e the offset
   * @param f the x shift
   * @return the values
   * @see #biExponential(double, double, double, double, double, double, double)
   */
  public static double[] biExponential(double[] x, double a, double b, double c, double d,
      double e, double f) {
    final double[] values = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      values[i] = biExponential(x[i], a, b, c, d, e, f);
    }
    return values;
  }

  /**
   * Compute a bi-Lorentzian at each x.
   *
   * @param x the x
   * @param center the center
   * @param amp1 the first amplitude
   * @param amp2 the second amplitude
   * @param width1 the first width
   * @param width2 the second width
   * @param offset the offset
   * @return the values
   * @see #biLorentzian(double, double, double, double, double, double, double)
   */
  public static double[] biLorentzian(double[] x, double center, double amp1, double amp2,
      double width1, double width2, double offset) {
    final double[] values = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      values[i] = biLorentzian(x[i], center, amp1, amp2, width1, width2, offset);
    }
    return values;
  }
}
