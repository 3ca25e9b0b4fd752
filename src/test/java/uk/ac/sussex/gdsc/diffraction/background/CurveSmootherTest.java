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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.diffraction.radial.RadialCurve;

@SuppressWarnings({"javadoc"})
class CurveSmootherTest {
  @Test
  void canComputeMovingAverage() {
    final double[] y = {1, 2, 3, 4, 5};
    // Window truncated at the ends
    Assertions.assertArrayEquals(new double[] {1.5, 2, 3, 4, 4.5},
        CurveSmoother.movingAverage(y, 3), 1e-15);
    Assertions.assertArrayEquals(new double[] {2, 2.5, 3, 3.5, 4},
        CurveSmoother.movingAverage(y, 5), 1e-15);
    // Even windows are increased by 1
    Assertions.assertArrayEquals(CurveSmoother.movingAverage(y, 5),
        CurveSmoother.movingAverage(y, 4));
  }

  @Test
  void smallWindowReturnsCopy() {
    final double[] y = {1, 5, 2};
    final double[] s = CurveSmoother.movingAverage(y, 1);
    Assertions.assertArrayEquals(y, s);
    Assertions.assertNotSame(y, s);
    Assertions.assertArrayEquals(new double[0], CurveSmoother.movingAverage(new double[0], 3));
  }

  @Test
  void constantIsUnchanged() {
    final double[] y = new double[20];
    Arrays.fill(y, 3.5);
    Assertions.assertArrayEquals(y, CurveSmoother.movingAverage(y, 7), 1e-14);
  }

  @Test
  void canSmoothCurve() {
    final RadialCurve curve =
        new RadialCurve(new double[] {0, 1, 2}, new double[] {0, 3, 0}, "data");
    final RadialCurve smooth = CurveSmoother.smooth(curve, 3);
    Assertions.assertEquals("data", smooth.getLabel());
    Assertions.assertArrayEquals(curve.getX(), smooth.getX());
    Assertions.assertArrayEquals(new double[] {1.5, 1, 1.5}, smooth.getY(), 1e-15);
  }
}
