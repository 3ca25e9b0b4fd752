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
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class ProfileFunctionTest {
  private static final double DELTA = 0x1.0p-24;
  private static final double RELATIVE_ERROR = 1e-4;

  @Test
  void canComputePseudoVoigtFunction() {
    final double[] x = range(2.5, 3.5, 0.05);
    final ProfileFunction f = new PseudoVoigtFunction(x);
    Assertions.assertEquals(5, f.getNumberOfParameters());
    Assertions.assertEquals(x.length, f.size());
    for (final double height : new double[] {1, 5}) {
      for (final double center : new double[] {2.9, 3.03}) {
        for (final double wg : new double[] {0.05, 0.1}) {
          for (final double wl : new double[] {0.07, 0.2}) {
            final double[] point = {height, center, wg, wl, 1.5};
            assertValues(f, point,
                PeakProfiles.pseudoVoigt(x, height, center, wg, wl, 1.5));
            assertJacobian(f, point);
          }
        }
      }
    }
  }

  @Test
  void canComputeBiExponentialFunction() {
    final double[] x = range(0, 200, 10);
    for (final double shift : new double[] {0, 15}) {
      final BiExponentialFunction f = new BiExponentialFunction(x, shift);
      Assertions.assertEquals(5, f.getNumberOfParameters());
      Assertions.assertEquals(shift, f.getShift());
      for (final double b : new double[] {0.01, 0.03}) {
        for (final double d : new double[] {0.005, 0.001}) {
          final double[] point = {5, b, 2, d, 1};
          assertValues(f, point, PeakProfiles.biExponential(x, 5, b, 2, d, 1, shift));
          assertJacobian(f, point);
        }
      }
    }
  }

  @Test
  void canComputeBiLorentzianFunction() {
    final double[] x = range(0, 200, 10);
    final ProfileFunction f = new BiLorentzianFunction(x);
    Assertions.assertEquals(6, f.getNumberOfParameters());
    for (final double center : new double[] {-5, 3}) {
      for (final double w1 : new double[] {30, 50}) {
        for (final double w2 : new double[] {120, 150}) {
          final double[] point = {center, 6, 3, w1, w2, 1};
          assertValues(f, point, PeakProfiles.biLorentzian(x, center, 6, 3, w1, w2, 1));
          assertJacobian(f, point);
        }
      }
    }
  }

  @Test
  void widthValidatorPreventsZeroWidth() {
    final ParameterValidator validator = new PseudoVoigtFunction(new double[] {0, 1})
        .getParameterValidator();
    final RealVector point = validator.validate(new ArrayRealVector(new double[] {1, 0, 0, -0.5,
        -2}));
    Assertions.assertEquals(ProfileFunction.MIN_WIDTH, point.getEntry(PseudoVoigtFunction.WIDTH_G));
    Assertions.assertEquals(0.5, point.getEntry(PseudoVoigtFunction.WIDTH_L));
    // Others are unchanged
    Assertions.assertEquals(0, point.getEntry(PseudoVoigtFunction.CENTER));
    Assertions.assertEquals(-2, point.getEntry(PseudoVoigtFunction.OFFSET));
  }

  @Test
  void widthValidatorLimitsMaximumWidth() {
    final PseudoVoigtFunction f = new PseudoVoigtFunction(new double[] {0, 1}, 0.5);
    Assertions.assertEquals(0.5, f.getMaxWidth());
    final RealVector point = f.getParameterValidator()
        .validate(new ArrayRealVector(new double[] {1, 0, 3, 0.25, 0}));
    Assertions.assertEquals(0.5, point.getEntry(PseudoVoigtFunction.WIDTH_G));
    Assertions.assertEquals(0.25, point.getEntry(PseudoVoigtFunction.WIDTH_L));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new PseudoVoigtFunction(new double[] {0, 1}, 0));
  }

  @Test
  void biExponentialHasNoValidator() {
    Assertions.assertNull(new BiExponentialFunction(new double[] {0, 1}, 0)
        .getParameterValidator());
  }

  @Test
  void functionCopiesPositions() {
    final double[] x = {1, 2, 3};
    final ProfileFunction f = new PseudoVoigtFunction(x);
    x[0] = 100;
    final double[] values = f.values(new ArrayRealVector(new double[] {1, 1, 0.1, 0.1, 0}));
    Assertions.assertEquals(1.0, values[0], 1e-12);
  }

  private static double[] range(double min, double max, double step) {
    final int n = (int) Math.round((max - min) / step) + 1;
    final double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = min + i * step;
    }
    return x;
  }

  private static void assertValues(ProfileFunction f, double[] point, double[] expected) {
    final RealVector p = new ArrayRealVector(point, false);
    final double[] value = f.value(p).getFirst().toArray();
    final double[] values = f.values(p);
    Assertions.assertEquals(expected.length, value.length);
    for (int i = 0; i < expected.length; i++) {
      Assertions.assertEquals(expected[i], value[i], Math.abs(expected[i]) * 1e-12, "value");
      Assertions.assertEquals(expected[i], values[i], Math.abs(expected[i]) * 1e-12, "values");
    }
  }

  private static void assertJacobian(ProfileFunction f, double[] point) {
    final RealVector p = new ArrayRealVector(point, true);
    final Pair<RealVector, RealMatrix> pair = f.value(p);
    final RealMatrix jacobian = pair.getSecond();
    Assertions.assertEquals(f.size(), jacobian.getRowDimension());
    Assertions.assertEquals(f.getNumberOfParameters(), jacobian.getColumnDimension());
    for (int j = 0; j < point.length; j++) {
      final double[] analytic = jacobian.getColumn(j);
      // Central difference with a step relative to the parameter
      final double h = DELTA * Math.max(1, Math.abs(point[j]));
      p.setEntry(j, point[j] - h);
      final RealVector v1 = f.value(p).getFirst();
      p.setEntry(j, point[j] + h);
      final RealVector v2 = f.value(p).getFirst();
      p.setEntry(j, point[j]);
      final double[] numeric = v2.subtract(v1).mapDivide(2 * h).toArray();
      double scale = 0;
      for (final double v : numeric) {
        scale = Math.max(scale, Math.abs(v));
      }
      for (int i = 0; i < numeric.length; i++) {
        Assertions.assertEquals(numeric[i], analytic[i],
            Math.max(1e-10, scale * RELATIVE_ERROR), "jacobian column " + j);
      }
    }
  }
}
