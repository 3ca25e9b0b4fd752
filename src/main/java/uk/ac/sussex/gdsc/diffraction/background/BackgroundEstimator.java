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

import uk.ac.sussex.gdsc.diffraction.radial.RadialCurve;

/**
 * Estimates and removes the inelastic scattering background of a radial curve.
 *
 * <p>Two strategies are available:
 *
 * <ul>
 *
 * <li>Stitched: pseudo-Voigt fits at diffraction features define local constant background
 * levels that are interpolated over the curve. See {@link StitchedVoigtBackground}.
 *
 * <li>Global: a bi-exponential or bi-Lorentzian function is fitted through background anchor
 * points. See {@link GlobalBackgroundFitter}.
 *
 * </ul>
 */
public final class BackgroundEstimator {

  /** No public construction. */
  private BackgroundEstimator() {}

  /**
   * Estimate the background using stitched pseudo-Voigt fits with the default chunk size and no
   * smoothing.
   *
   * @param curve the curve
   * @param features the diffraction feature anchor points
   * @return the stitched background
   */
  public static StitchedBackground stitched(RadialCurve curve, double[][] features) {
    return new StitchedVoigtBackground().estimate(curve, features);
  }

  /**
   * Estimate the background using stitched pseudo-Voigt fits.
   *
   * @param curve the curve
   * @param features the diffraction feature anchor points
   * @param chunkSize the number of samples on each side of a feature
   * @return the stitched background
   */
  public static StitchedBackground stitched(RadialCurve curve, double[][] features,
      int chunkSize) {
    return new StitchedVoigtBackground().setChunkSize(chunkSize).estimate(curve, features);
  }

  /**
   * Estimate the background using a global fit through background anchor points.
   *
   * @param curve the curve
   * @param anchors the background anchor points
   * @param family the function family
   * @return the fit
   */
  public static BackgroundFit global(RadialCurve curve, double[][] anchors, FitFamily family) {
    return GlobalBackgroundFitter.fit(curve, anchors, family);
  }

  /**
   * Subtract the background from the curve.
   *
   * @param curve the curve
   * @param background the background
   * @return the corrected curve
   */
  public static RadialCurve subtract(RadialCurve curve, RadialCurve background) {
    return curve.subtract(background);
  }
}
