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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * Bi-exponential decay function.
 *
 * <pre>
 * f(x) = a * exp(-b * (x - f)) + c * exp(-d * (x - f)) + e
 * </pre>
 *
 * <p>The shift {@code f} scales both amplitudes by a constant and cannot be fitted together with
 * them. It is held fixed and the fitted parameters are {a, b, c, d, e}.
 */
public class BiExponentialFunction extends ProfileFunction {
  private static final int NUMBER_OF_PARAMETERS = 5;

  /** The x shift. */
  private final double shift;

  /**
   * Create an instance.
   *
   * @param x the x positions
   * @param shift the x shift
   */
  public BiExponentialFunction(double[] x, double shift) {
    super(x);
    this.shift = shift;
  }

  /**
   * Gets the x shift.
   *
   * @return the shift
   */
  public double getShift() {
    return shift;
  }

  @Override
  public int getNumberOfParameters() {
    return NUMBER_OF_PARAMETERS;
  }

  /**
   * {@inheritDoc}
   *
   * @param point {a, b, c, d, e}
   */
  @Override
  public Pair<RealVector, RealMatrix> value(RealVector point) {
    final double a = point.getEntry(0);
    final double b = point.getEntry(1);
    final double c = point.getEntry(2);
    final double d = point.getEntry(3);
    final double e = point.getEntry(4);
    final double[] value = new double[x.length];
    final double[][] jacobian = new double[x.length][NUMBER_OF_PARAMETERS];
    for (int i = 0; i < x.length; i++) {
      // df_da = exp(-b * u)
      // df_db = -a * u * exp(-b * u)
      // df_dc = exp(-d * u)
      // df_dd = -c * u * exp(-d * u)
      // df_de = 1
      final double u = x[i] - shift;
      final double e1 = Math.exp(-b * u);
      final double e2 = Math.exp(-d * u);
      value[i] = a * e1 + c * e2 + e;
      final double[] row = jacobian[i];
      row[0] = e1;
      row[1] = -a * u * e1;
      row[2] = e2;
      row[3] = -c * u * e2;
      row[4] = 1;
    }
    return new Pair<>(new ArrayRealVector(value, false),
        new Array2DRowRealMatrix(jacobian, false));
  }

  /**
   * {@inheritDoc}
   *
   * @param point {a, b, c, d, e}
   */
  @Override
  public double[] values(RealVector point) {
    return PeakProfiles.biExponential(x, point.getEntry(0), point.getEntry(1), point.getEntry(2),
        point.getEntry(3), point.getEntry(4), shift);
  }
}
