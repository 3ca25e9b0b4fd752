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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.diffraction.profile.PeakProfiles;
import uk.ac.sussex.gdsc.diffraction.radial.RadialCurve;

@SuppressWarnings({"javadoc"})
class BackgroundEstimatorTest {
  @Test
  void canRemoveStitchedBackground() {
    final double[] x = new double[200];
    final double[] y = new double[200];
    for (int i = 0; i < x.length; i++) {
      x[i] = i * 0.05;
    }
    for (int i = 0; i < x.length; i++) {
      y[i] = 3 + PeakProfiles.pseudoVoigt(x[i], 2, x[50], 0.1, 0.1, 0)
          + PeakProfiles.pseudoVoigt(x[i], 1, x[120], 0.1, 0.1, 0);
    }
    final RadialCurve curve = new RadialCurve(x, y, "data");
    final double[][] anchors = {{x[50]}, {x[120]}};
    final StitchedBackground bg = BackgroundEstimator.stitched(curve, anchors);
    final RadialCurve corrected = BackgroundEstimator.subtract(curve, bg.getBackground());
    Assertions.assertEquals("data", corrected.getLabel());
    Assertions.assertEquals(2, corrected.getY(50), 2e-2);
    Assertions.assertEquals(1, corrected.getY(120), 2e-2);
    Assertions.assertEquals(0, corrected.getY(0), 2e-2);

    // Smaller windows
    final StitchedBackground bg3 = BackgroundEstimator.stitched(curve, anchors, 3);
    Assertions.assertEquals(2, bg3.getFeatures().size());
    Assertions.assertEquals(3, bg3.getBackground().getY(100), 2e-2);
  }

  @Test
  void canRemoveGlobalBackground() {
    final double[] x = new double[200];
    for (int i = 0; i < x.length; i++) {
      x[i] = i;
    }
    final RadialCurve curve =
        new RadialCurve(x, PeakProfiles.biExponential(x, 5, 0.02, 2, 0.01, 1, 0), "data");
    final BackgroundFit fit = BackgroundEstimator.global(curve,
        new double[][] {{0}, {20}, {50}, {90}, {140}, {199}}, FitFamily.BIEXPONENTIAL);
    final RadialCurve corrected = BackgroundEstimator.subtract(curve, fit.getBackground());
    for (int i = 0; i < corrected.size(); i++) {
      Assertions.assertEquals(0, corrected.getY(i), 0.01);
    }
  }
}
