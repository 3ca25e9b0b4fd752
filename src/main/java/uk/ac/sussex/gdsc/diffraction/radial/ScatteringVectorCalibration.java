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

/**
 * Linear calibration of the radial position to the scattering vector magnitude using two indexed
 * diffraction peaks.
 *
 * <pre>
 * q = slope * x + intercept
 * </pre>
 */
public final class ScatteringVectorCalibration {
  private final double slope;
  private final double intercept;

  /**
   * Create an instance.
   *
   * @param slope the slope
   * @param intercept the intercept
   */
  private ScatteringVectorCalibration(double slope, double intercept) {
    this.slope = slope;
    this.intercept = intercept;
  }

  /**
   * Create a calibration from the positions of two peaks with known scattering vectors.
   *
   * @param x1 the position of the first peak
   * @param q1 the scattering vector of the first peak
   * @param x2 the position of the second peak
   * @param q2 the scattering vector of the second peak
   * @return the calibration
   * @throws IllegalArgumentException if the peak positions are equal or the calibration is not
   *         finite
   */
  public static ScatteringVectorCalibration fromPeaks(double x1, double q1, double x2, double q2) {
    if (x1 == x2) {
      throw new IllegalArgumentException("Peak positions must be different: " + x1);
    }
    final double slope = (q2 - q1) / (x2 - x1);
    final double intercept = q1 - slope * x1;
    if (!Double.isFinite(slope) || !Double.isFinite(intercept)) {
      throw new IllegalArgumentException("Non-finite calibration: q = " + slope + " x + "
          + intercept);
    }
    return new ScatteringVectorCalibration(slope, intercept);
  }

  /**
   * Gets the slope.
   *
   * @return the slope
   */
  public double getSlope() {
    return slope;
  }

  /**
   * Gets the intercept.
   *
   * @return the intercept
   */
  public double getIntercept() {
    return intercept;
  }

  /**
   * Convert the position to the scattering vector.
   *
   * @param x the position
   * @return the scattering vector
   */
  public double toScatteringVector(double x) {
    return slope * x + intercept;
  }

  /**
   * Create a copy of the curve with the x positions converted to the scattering vector.
   *
   * @param curve the curve
   * @return the calibrated curve
   * @throws MalformedCurveException if the calibration has a negative slope (the x data would be
   *         decreasing)
   */
  public RadialCurve calibrate(RadialCurve curve) {
    final double[] q = curve.getX();
    for (int i = 0; i < q.length; i++) {
      q[i] = toScatteringVector(q[i]);
    }
    return curve.withX(q);
  }
}
