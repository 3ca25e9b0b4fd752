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

import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * Pseudo-Voigt function with a constant offset.
 *
 * <pre>
 * f(x) = H * (0.5 * G(x; xc, wg) + 0.5 * L(x; xc, wl)) + c
 *
 * G = exp(-(x - xc)^2 / (2 * wg)^2)
 * L = (wl/2)^2 / ((x - xc)^2 + (wl/2)^2)
 * </pre>
 *
 * <p>The parameters are {H, xc, wg, wl, c}.
 */
public class PseudoVoigtFunction extends ProfileFunction {
  /** Index of the height parameter. */
  public static final int HEIGHT = 0;
  /** Index of the center parameter. */
  public static final int CENTER = 1;
  /** Index of the Gaussian width parameter. */
  public static final int WIDTH_G = 2;
  /** Index of the Lorentzian width parameter. */
  public static final int WIDTH_L = 3;
  /** Index of the offset parameter. */
  public static final int OFFSET = 4;

  private static final int NUMBER_OF_PARAMETERS = 5;

  /** The maximum width used by the parameter validator. */
  private final double maxWidth;

  /**
   * Create an instance with no upper limit on the widths.
   *
   * @param x the x positions
   */
  public PseudoVoigtFunction(double[] x) {
    this(x, Double.POSITIVE_INFINITY);
  }

  /**
   * Create an instance.
   *
   * <p>A broad Lorentzian is indistinguishable from a constant within a limited range of x. The
   * maximum width prevents the fit trading the offset against the Lorentzian component.
   *
   * @param x the x positions
   * @param maxWidth the maximum width
   * @throws IllegalArgumentException if the maximum width is below {@link #MIN_WIDTH}
   */
  public PseudoVoigtFunction(double[] x, double maxWidth) {
    super(x);
    if (!(maxWidth >= MIN_WIDTH)) {
      throw new IllegalArgumentException("Invalid maximum width: " + maxWidth);
    }
    this.maxWidth = maxWidth;
  }

  /**
   * Gets the maximum width.
   *
   * @return the maximum width
   */
  public double getMaxWidth() {
    return maxWidth;
  }

  @Override
  public int getNumberOfParameters() {
    return NUMBER_OF_PARAMETERS;
  }

  /**
   * {@inheritDoc}
   *
   * @param point {H, xc, wg, wl, c}
   */
  @Override
  public Pair<RealVector, RealMatrix> value(RealVector point) {
    final double height = point.getEntry(HEIGHT);
    final double center = point.getEntry(CENTER);
    final double wg = point.getEntry(WIDTH_G);
    final double wl = point.getEntry(WIDTH_L);
    final double[] value = new double[x.length];
    final double[][] jacobian = new double[x.length][NUMBER_OF_PARAMETERS];

    final double fg = PeakProfiles.VOIGT_GAUSSIAN_FRACTION;
    final double fl = 1 - fg;
    final double wg2 = wg * wg;
    final double hw = 0.5 * wl;
    final double hw2 = hw * hw;
    for (int i = 0; i < x.length; i++) {
      final double u = x[i] - center;
      final double u2 = u * u;
      // G = exp(-u^2 / 4wg^2)
      // dG/dxc = G * u / 2wg^2
      // dG/dwg = G * u^2 / 2wg^3
      final double g = Math.exp(-u2 / (4 * wg2));
      final double dgdc = g * u / (2 * wg2);
      final double dgdw = g * u2 / (2 * wg2 * wg);
      // L = h^2 / (u^2 + h^2) with h = wl/2
      // dL/dxc = 2 u h^2 / (u^2 + h^2)^2
      // dL/dwl = h u^2 / (u^2 + h^2)^2
      final double d = u2 + hw2;
      final double l = hw2 / d;
      final double d2 = d * d;
      final double dldc = 2 * u * hw2 / d2;
      final double dldw = hw * u2 / d2;

      final double shape = fg * g + fl * l;
      value[i] = height * shape + point.getEntry(OFFSET);
      final double[] row = jacobian[i];
      row[HEIGHT] = shape;
      row[CENTER] = height * (fg * dgdc + fl * dldc);
      row[WIDTH_G] = height * fg * dgdw;
      row[WIDTH_L] = height * fl * dldw;
      row[OFFSET] = 1;
    }
    return new Pair<>(new ArrayRealVector(value, false),
        new Array2DRowRealMatrix(jacobian, false));
  }

  /**
   * {@inheritDoc}
   *
   * @param point {H, xc, wg, wl, c}
   */
  @Override
  public double[] values(RealVector point) {
    return PeakProfiles.pseudoVoigt(x, point.getEntry(HEIGHT), point.getEntry(CENTER),
        point.getEntry(WIDTH_G), point.getEntry(WIDTH_L), point.getEntry(OFFSET));
  }

  @Override
  public ParameterValidator getParameterValidator() {
    return widthValidator(maxWidth, WIDTH_G, WIDTH_L);
  }
}
