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

package uk.ac.sussex.gdsc.diffraction.radial;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.diffraction.image.DiffractionImage;
import uk.ac.sussex.gdsc.diffraction.image.PixelMask;
import uk.ac.sussex.gdsc.diffraction.image.PixelMasks;

@SuppressWarnings({"javadoc"})
class RadialAveragerTest {
  @Test
  void outputIsSortedAndUnique() {
    final UniformRandomProvider rng = RandomSource.SPLIT_MIX_64.create(8979L);
    for (final int[] dims : new int[][] {{1, 1}, {7, 3}, {40, 25}}) {
      final int w = dims[0];
      final int h = dims[1];
      final double[] data = new double[w * h];
      for (int i = 0; i < data.length; i++) {
        data[i] = rng.nextDouble() * 50;
      }
      final DiffractionImage image = DiffractionImage.wrap(w, h, data);
      for (int repeat = 0; repeat < 5; repeat++) {
        final int xc = rng.nextInt(w);
        final int yc = rng.nextInt(h);
        final RadialCurve curve = RadialAverager.average(image, xc, yc, "random");
        final double[] x = curve.getX();
        Assertions.assertEquals(x.length, curve.getY().length);
        Assertions.assertEquals(0, x[0]);
        for (int i = 1; i < x.length; i++) {
          Assertions.assertTrue(x[i] > x[i - 1], "x is not strictly increasing");
        }
      }
    }
  }

  @Test
  void canAverageWithoutMask() {
    // 3x3 image with the center at (1, 1)
    final DiffractionImage image =
        DiffractionImage.wrap(3, 3, new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9});
    final RadialCurve curve = RadialAverager.average(image, 1, 1, PixelMasks.all(), "img");
    Assertions.assertEquals("img radial average", curve.getLabel());
    // Radius 0: the center; radius 1: edge neighbours; radius 1.41 rounds to 1
    Assertions.assertArrayEquals(new double[] {0, 1}, curve.getX());
    // Counts start at 1
    Assertions.assertEquals(5.0 / (1 + RadialAverager.INITIAL_BIN_COUNT), curve.getY(0), 1e-12);
    Assertions.assertEquals(40.0 / (8 + RadialAverager.INITIAL_BIN_COUNT), curve.getY(1), 1e-12);
  }

  @Test
  void maskedPixelsAreExcluded() {
    final DiffractionImage image =
        DiffractionImage.wrap(3, 3, new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9});
    final PixelMask mask = PixelMasks.rowsFrom(1);
    final RadialCurve curve = RadialAverager.average(image, 1, 1, mask, "img");
    Assertions.assertArrayEquals(new double[] {0, 1}, curve.getX());
    // Radius 1 includes 4, 6, 7, 8, 9
    Assertions.assertEquals(34.0 / 6, curve.getY(1), 1e-12);
  }

  @Test
  void defaultMaskUsesFirstCenterCoordinateAsRow() {
    final PixelMask mask = RadialAverager.defaultMask(5, 20);
    Assertions.assertFalse(mask.contains(0, 4));
    Assertions.assertTrue(mask.contains(0, 5));
    Assertions.assertTrue(mask.contains(0, 19));
  }

  @Test
  void averageThrowsWithCenterOutsideImage() {
    final DiffractionImage image = DiffractionImage.wrap(3, 3, new double[9]);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> RadialAverager.average(image, 3, 1, "img"));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> RadialAverager.average(image, 1, -1, "img"));
  }

  @Test
  void ringImageHasPeakAtRingRadius() {
    final DiffractionImage image = createRing(100, 100, 50, 60, 30, 3, 100, 1);
    final RadialCurve curve = RadialAverager.average(image, 50, 60, "ring");
    int max = 0;
    for (int i = 1; i < curve.size(); i++) {
      if (curve.getY(i) > curve.getY(max)) {
        max = i;
      }
    }
    Assertions.assertEquals(30, curve.getX(max), 1);
    // A clear peak above the background
    Assertions.assertTrue(curve.getY(max) > 50 * curve.getY(curve.nearestIndex(10)));
  }

  /**
   * Create an image with a Gaussian ring profile on a constant background.
   */
  static DiffractionImage createRing(int width, int height, double xc, double yc, double radius,
      double sd, double amplitude, double background) {
    final double[] data = new double[width * height];
    for (int y = 0, i = 0; y < height; y++) {
      for (int x = 0; x < width; x++, i++) {
        final double d = Math.hypot(x - xc, y - yc) - radius;
        data[i] = background + amplitude * Math.exp(-0.5 * d * d / (sd * sd));
      }
    }
    return DiffractionImage.wrap(width, height, data);
  }
}
