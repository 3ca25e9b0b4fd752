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
 * The result of a global inelastic background fit.
 *
 * <p>If the fit failed the parameters are the initial guess and {@link #isConverged()} is false.
 */
public final class BackgroundFit {
  private final FitFamily family;
  private final double[] initialGuess;
  private final double[] parameters;
  private final boolean converged;
  private final String message;
  private final RadialCurve background;

  /**
   * Create an instance.
   *
   * @param family the family
   * @param initialGuess the initial guess
   * @param parameters the parameters
   * @param converged the converged flag
   * @param message the diagnostic message
   * @param background the background
   */
  BackgroundFit(FitFamily family, double[] initialGuess, double[] parameters, boolean converged,
      String message, RadialCurve background) {
    this.family = family;
    this.initialGuess = initialGuess;
    this.parameters = parameters;
    this.converged = converged;
    this.message = message;
    this.background = background;
  }

  /**
   * Gets the function family.
   *
   * @return the family
   */
  public FitFamily getFamily() {
    return family;
  }

  /**
   * Gets a copy of the initial guess.
   *
   * @return the initial guess
   */
  public double[] getInitialGuess() {
    return initialGuess.clone();
  }

  /**
   * Gets a copy of the parameters. The order is defined by the {@link FitFamily}.
   *
   * @return the parameters
   */
  public double[] getParameters() {
    return parameters.clone();
  }

  /**
   * Checks if the fit converged.
   *
   * @return true if converged
   */
  public boolean isConverged() {
    return converged;
  }

  /**
   * Gets the diagnostic message. This is empty if the fit converged.
   *
   * @return the message
   */
  public String getMessage() {
    return message;
  }

  /**
   * Gets the background evaluated over the curve domain.
   *
   * @return the background
   */
  public RadialCurve getBackground() {
    return background;
  }
}
