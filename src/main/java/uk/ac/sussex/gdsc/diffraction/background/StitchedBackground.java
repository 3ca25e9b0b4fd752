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

import java.util.Collections;
import java.util.List;
import uk.ac.sussex.gdsc.diffraction.radial.RadialCurve;

/**
 * The result of a stitched pseudo-Voigt background estimate.
 */
public final class StitchedBackground {
  private final RadialCurve background;
  private final List<VoigtParameters> features;
  private final List<RadialCurve> profiles;

  /**
   * Create an instance.
   *
   * @param background the background
   * @param features the feature fits
   * @param profiles the feature profiles
   */
  StitchedBackground(RadialCurve background, List<VoigtParameters> features,
      List<RadialCurve> profiles) {
    this.background = background;
    this.features = Collections.unmodifiableList(features);
    this.profiles = Collections.unmodifiableList(profiles);
  }

  /**
   * Gets the background evaluated over the curve domain.
   *
   * @return the background
   */
  public RadialCurve getBackground() {
    return background;
  }

  /**
   * Gets the pseudo-Voigt fit of each feature window, in the order of the anchors.
   *
   * @return the features
   */
  public List<VoigtParameters> getFeatures() {
    return features;
  }

  /**
   * Gets the fitted pseudo-Voigt profile of each feature evaluated over the curve domain. These
   * are for inspection only.
   *
   * @return the profiles
   */
  public List<RadialCurve> getProfiles() {
    return profiles;
  }

  /**
   * Checks if all the feature fits converged.
   *
   * @return true if converged
   */
  public boolean isConverged() {
    for (final VoigtParameters f : features) {
      if (!f.isConverged()) {
        return false;
      }
    }
    return true;
  }
}
