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

/**
 * The pseudo-Voigt fit of a single diffraction feature window.
 *
 * <p>The fit is performed on the window data after subtraction of the window minimum. The local
 * background level is the fitted offset plus the window minimum.
 */
public final class VoigtParameters {
  private final double height;
  private final double center;
  private final double widthG;
  private final double widthL;
  private final double offset;
  private final double windowMinimum;
  private final boolean converged;

  /**
   * Create an instance.
   *
   * @param parameters {height, center, widthG, widthL, offset}
   * @param windowMinimum the window minimum
   * @param converged the converged flag
   */
  VoigtParameters(double[] parameters, double windowMinimum, boolean converged) {
    height = parameters[0];
    center = parameters[1];
    widthG = parameters[2];
    widthL = parameters[3];
    offset = parameters[4];
    this.windowMinimum = windowMinimum;
    this.converged = converged;
  }

  /**
   * Gets the height.
   *
   * @return the height
   */
  public double getHeight() {
    return height;
  }

  /**
   * Gets the center.
   *
   * @return the center
   */
  public double getCenter() {
    return center;
  }

  /**
   * Gets the Gaussian width.
   *
   * @return the Gaussian width
   */
  public double getWidthG() {
    return widthG;
  }

  /**
   * Gets the Lorentzian width.
   *
   * @return the Lorentzian width
   */
  public double getWidthL() {
    return widthL;
  }

  /**
   * Gets the fitted offset of the normalised window.
   *
   * @return the offset
   */
  public double getOffset() {
    return offset;
  }

  /**
   * Gets the minimum of the window before normalisation.
   *
   * @return the window minimum
   */
  public double getWindowMinimum() {
    return windowMinimum;
  }

  /**
   * Gets the local constant background level.
   *
   * @return the background level
   */
  public double getBackgroundLevel() {
    return offset + windowMinimum;
  }

  /**
   * Checks if the fit converged. If false the parameters are the initial guess.
   *
   * @return true if converged
   */
  public boolean isConverged() {
    return converged;
  }

  /**
   * Gets the parameters.
   *
   * @return {height, center, widthG, widthL, offset}
   */
  public double[] toArray() {
    return new double[] {height, center, widthG, widthL, offset};
  }
}
