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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class PeakProfilesTest {
  @Test
  void canComputeGaussian() {
    Assertions.assertEquals(1.0, PeakProfiles.gaussian(3.5, 3.5, 0.2));
    // exp(-(x-c)^2 / (2w)^2)
    Assertions.assertEquals(Math.exp(-1), PeakProfiles.gaussian(4, 3, 0.5), 1e-15);
    Assertions.assertEquals(PeakProfiles.gaussian(2, 3, 0.5), PeakProfiles.gaussian(4, 3, 0.5));
  }

  @Test
  void canComputeLorentzian() {
    Assertions.assertEquals(1.0, PeakProfiles.lorentzian(3.5, 3.5, 0.2));
    // Half maximum at half the width from the center
    Assertions.assertEquals(0.5, PeakProfiles.lorentzian(3.25, 3, 0.5), 1e-15);
    Assertions.assertEquals(PeakProfiles.lorentzian(2, 3, 0.5),
        PeakProfiles.lorentzian(4, 3, 0.5));
  }

  @Test
  void pseudoVoigtAtCenterIsHeightPlusOffset() {
    for (final double height : new double[] {0.5, 1, 10}) {
      for (final double center : new double[] {-2, 0, 7.25}) {
        for (final double offset : new double[] {0, 3, -1.5}) {
          Assertions.assertEquals(height + offset,
              PeakProfiles.pseudoVoigt(center, height, center, 0.1, 0.3, offset), 1e-12);
        }
      }
    }
  }

  @Test
  void pseudoVoigtIsEqualBlend() {
    final double x = 1.3;
    final double expected = 2 * (0.5 * PeakProfiles.gaussian(x, 1, 0.2)
        + 0.5 * PeakProfiles.lorentzian(x, 1, 0.4)) + 1;
    Assertions.assertEquals(expected, PeakProfiles.pseudoVoigt(x, 2, 1, 0.2, 0.4, 1), 1e-15);
  }

  @Test
  void canComputeBiExponential() {
    Assertions.assertEquals(5 + 2 + 1, PeakProfiles.biExponential(0, 5, 0.02, 2, 0.01, 1, 0));
    final double x = 40;
    Assertions.assertEquals(5 * Math.exp(-0.02 * 30) + 2 * Math.exp(-0.01 * 30) + 1,
        PeakProfiles.biExponential(x, 5, 0.02, 2, 0.01, 1, 10), 1e-12);
  }

  @Test
  void canComputeBiLorentzian() {
    Assertions.assertEquals(6 + 3 + 1, PeakProfiles.biLorentzian(2, 2, 6, 3, 40, 160, 1), 1e-12);
    Assertions.assertEquals(6 * 0.5 + 3 * 0.5 + 1,
        PeakProfiles.biLorentzian(22, 2, 6, 3, 40, 40, 1), 1e-12);
  }

  @Test
  void arrayFormsMatchScalarForms() {
    final double[] x = {0, 0.5, 1, 2.5, 10};
    final double[] g = PeakProfiles.gaussian(x, 1, 0.3);
    final double[] l = PeakProfiles.lorentzian(x, 1, 0.3);
    final double[] v = PeakProfiles.pseudoVoigt(x, 2, 1, 0.3, 0.4, 0.5);
    final double[] be = PeakProfiles.biExponential(x, 5, 0.02, 2, 0.01, 1, 0.5);
    final double[] bl = PeakProfiles.biLorentzian(x, 0, 6, 3, 4, 16, 1);
    for (int i = 0; i < x.length; i++) {
      Assertions.assertEquals(PeakProfiles.gaussian(x[i], 1, 0.3), g[i]);
      Assertions.assertEquals(PeakProfiles.lorentzian(x[i], 1, 0.3), l[i]);
      Assertions.assertEquals(PeakProfiles.pseudoVoigt(x[i], 2, 1, 0.3, 0.4, 0.5), v[i]);
      Assertions.assertEquals(PeakProfiles.biExponential(x[i], 5, 0.02, 2, 0.01, 1, 0.5), be[i]);
      Assertions.assertEquals(PeakProfiles.biLorentzian(x[i], 0, 6, 3, 4, 16, 1), bl[i]);
    }
  }
}
