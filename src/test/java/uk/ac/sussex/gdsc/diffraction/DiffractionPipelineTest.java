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

package uk.ac.sussex.gdsc.diffraction;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.diffraction.DiffractionPipeline.BackgroundMethod;
import uk.ac.sussex.gdsc.diffraction.DiffractionPipeline.Result;
import uk.ac.sussex.gdsc.diffraction.background.FitFamily;
import uk.ac.sussex.gdsc.diffraction.background.StitchedBackground;
import uk.ac.sussex.gdsc.diffraction.background.VoigtParameters;
import uk.ac.sussex.gdsc.diffraction.center.CenterFinderOptions;
import uk.ac.sussex.gdsc.diffraction.image.DiffractionImage;
import uk.ac.sussex.gdsc.diffraction.image.PixelMasks;
import uk.ac.sussex.gdsc.diffraction.radial.RadialCurve;

@SuppressWarnings({"javadoc"})
class DiffractionPipelineTest {
  private static DiffractionImage image;

  @BeforeAll
  static void beforeAll() {
    final UniformRandomProvider rng = RandomSource.SPLIT_MIX_64.create(42L);
    final int size = 100;
    final double[] data = new double[size * size];
    for (int y = 0, i = 0; y < size; y++) {
      for (int x = 0; x < size; x++, i++) {
        final double d = Math.hypot(x - 50, y - 60) - 30;
        data[i] = 5 + rng.nextDouble() + 100 * Math.exp(-0.5 * d * d / 16);
      }
    }
    image = DiffractionImage.wrap(size, size, data);
  }

  private static DiffractionPipeline createPipeline() {
    return new DiffractionPipeline()
        .setCenterOptions(new CenterFinderOptions().setMask(PixelMasks.all()));
  }

  @Test
  void canRunStitchedPipeline() {
    final DiffractionPipeline pipeline = createPipeline();
    final Result result = pipeline.run(image, 48, 58, 28, new double[][] {{30}}, "ring");
    Assertions.assertNotNull(result.getCenter());
    final int[] center = result.getPixelCenter();
    Assertions.assertEquals(50, center[0], 1);
    Assertions.assertEquals(60, center[1], 1);

    final RadialCurve average = result.getRadialAverage();
    Assertions.assertEquals("ring radial average", average.getLabel());
    // No cutoff
    Assertions.assertSame(average, result.getCurve());
    Assertions.assertNull(result.getBackgroundFit());
    final StitchedBackground stitched = result.getStitchedBackground();
    Assertions.assertNotNull(stitched);
    Assertions.assertSame(stitched.getBackground(), result.getBackground());

    // The ring is wider than the default window so the fit is rejected
    Assertions.assertFalse(stitched.isConverged());
    final VoigtParameters feature = stitched.getFeatures().get(0);
    final int peak = average.nearestIndex(30);
    double min = Double.POSITIVE_INFINITY;
    for (int i = peak - pipeline.getChunkSize(); i <= peak + pipeline.getChunkSize(); i++) {
      min = Math.min(min, average.getY(i));
    }
    Assertions.assertEquals(min, feature.getBackgroundLevel());

    final RadialCurve corrected = result.getCorrected();
    Assertions.assertArrayEquals(average.getX(), corrected.getX());
    for (int i = 0; i < average.size(); i++) {
      Assertions.assertEquals(min, result.getBackground().getY(i), 1e-10);
      Assertions.assertEquals(average.getY(i) - min, corrected.getY(i), 1e-10);
    }
  }

  @Test
  void canRunWithoutCenterSearch() {
    final DiffractionPipeline pipeline = createPipeline().setFindCenter(false).setCutoff(5);
    final Result result = pipeline.run(image, 50.4, 59.6, 30, new double[][] {{30}}, "ring");
    Assertions.assertNull(result.getCenter());
    Assertions.assertArrayEquals(new int[] {50, 60}, result.getPixelCenter());
    final RadialCurve average = result.getRadialAverage();
    final RadialCurve curve = result.getCurve();
    Assertions.assertEquals(5, curve.getX(0));
    Assertions.assertEquals(average.size() - average.nearestIndex(5), curve.size());
    Assertions.assertEquals(curve.size(), result.getCorrected().size());
  }

  @Test
  void canRunGlobalPipeline() {
    final DiffractionPipeline pipeline = createPipeline().setFindCenter(false)
        .setBackgroundMethod(BackgroundMethod.BILORENTZIAN);
    final Result result =
        pipeline.run(image, 50, 60, 30, new double[][] {{5}, {10}, {15}, {45}, {55}, {65}, {75}},
            "ring");
    Assertions.assertNull(result.getStitchedBackground());
    Assertions.assertNotNull(result.getBackgroundFit());
    Assertions.assertEquals(FitFamily.BILORENTZIAN, result.getBackgroundFit().getFamily());
    Assertions.assertEquals("IBG ring radial average", result.getBackground().getLabel());
    Assertions.assertEquals(result.getCurve().size(), result.getCorrected().size());
  }

  @Test
  void canUseCustomAverageMask() {
    final DiffractionPipeline pipeline =
        createPipeline().setFindCenter(false).setAverageMask(PixelMasks.rowsFrom(1000));
    final Result result = pipeline.run(image, 50, 60, 30, new double[][] {{30}}, "ring");
    // All pixels excluded
    for (final double v : result.getRadialAverage().getY()) {
      Assertions.assertEquals(0, v);
    }
  }

  @Test
  void hasDefaults() {
    final DiffractionPipeline pipeline = new DiffractionPipeline();
    Assertions.assertTrue(pipeline.isFindCenter());
    Assertions.assertTrue(Double.isNaN(pipeline.getCutoff()));
    Assertions.assertEquals(BackgroundMethod.STITCHED_VOIGT, pipeline.getBackgroundMethod());
    Assertions.assertNull(pipeline.getAverageMask());
    Assertions.assertEquals(5, pipeline.getChunkSize());
    Assertions.assertEquals(0, pipeline.getSmoothingWindow());
    Assertions.assertEquals(CenterFinderOptions.DEFAULT_SCALE_FACTOR,
        pipeline.getCenterOptions().getScaleFactor());
    Assertions.assertThrows(IllegalArgumentException.class, () -> pipeline.setChunkSize(1));
    Assertions.assertThrows(NullPointerException.class, () -> pipeline.setBackgroundMethod(null));
  }

  @Test
  void canConvertBackgroundMethodDescription() {
    for (final BackgroundMethod method : BackgroundMethod.values()) {
      Assertions.assertSame(method, BackgroundMethod.fromDescription(method.toString()));
    }
    Assertions.assertNull(BackgroundMethod.STITCHED_VOIGT.getFitFamily());
    Assertions.assertEquals(FitFamily.BIEXPONENTIAL,
        BackgroundMethod.BIEXPONENTIAL.getFitFamily());
    Assertions.assertNull(BackgroundMethod.fromDescription("Unknown"));
  }
}
