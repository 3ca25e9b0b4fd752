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
 * Two Lorentzians sharing a center with a constant offset.
 *
 * <pre>
 * f(x) = a1 * L(x; xc, w1) + a2 * L(x; xc, w2) + c
 * </pre>
 *
 * <p>The parameters are {xc, a1, a2, w1, w2, c}.
 */
public class BiLorentzianFunction extends ProfileFunction {
  private static final int NUMBER_OF_PARAMETERS = 6;

  /**
   * Create an instance.
   *
   * @param x the x positions
   */
  public BiLorentzianFunction(double[] x) {
    super(x);
  }

  @Override
  public int getNumberOfParameters() {
    return NUMBER_OF_PARAMETERS;
  }

  /**
   * {@inheritDoc}
   *
   * @param point {xc, a1, a2, w1, w2, c}
   */
  @Override
  public Pair<RealVector, RealMatrix> value(RealVector point) {
    final double center = point.getEntry(0);
    final double a1 = point.getEntry(1);
    final double a2 = point.getEntry(2);
    final double h1 = 0.5 * point.getEntry(3);
    final double h2 = 0.5 * point.getEntry(4);
    final double h12 = h1 * h1;
    final double h22 = h2 * h2;
    final double[] value = new double[x.length];
    final double[][] jacobian = new double[x.length][NUMBER_OF_PARAMETERS];
    for (int i = 0; i < x.length; i++) {
      final double u = x[i] - center;
      final double u2 = u * u;
      final double d1 = u2 + h12;
      final double d2 = u2 + h22;
      final double l1 = h12 / d1;
      final double l2 = h22 / d2;
      final double d1s = d1 * d1;
      final double d2s = d2 * d2;
      value[i] = a1 * l1 + a2 * l2 + point.getEntry(5);
      final double[] row = jacobian[i];
      row[0] = a1 * 2 * u * h12 / d1s + a2 * 2 * u * h22 / d2s;
      row[1] = l1;
      row[2] = l2;
      row[3] = a1 * h1 * u2 / d1s;
      row[4] = a2 * h2 * u2 / d2s;
      row[5] = 1;
    }
    return new Pair<>(new ArrayRealVector(value, false),
        new Array2DRowRealMatrix(jacobian, false));
  }

  /**
   * {@inheritDoc}
   *
   * @param point {xc, a1, a2, w1, w2, c}
   */
  @Override
  public double[] values(RealVector point) {
    return PeakProfiles.biLorentzian(x, point.getEntry(0), point.getEntry(1), point.getEntry(2),
        point.getEntry(3), point.getEntry(4), point.getEntry(5));
  }

  @Override
  public ParameterValidator getParameterValidator() {
    return widthValidator(Double.POSITIVE_INFINITY, 3, 4);
  }
}
