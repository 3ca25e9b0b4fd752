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

package uk.ac.sussex.gdsc.diffraction.center;

/**
 * The result of a center search.
 *
 * <p>The radius is the radius supplied with the initial guess. The radius found by the optimiser
 * is available as a diagnostic.
 */
public final class CenterResult {
  private final double x;
  private final double y;
  private final double radius;
  private final double optimisedRadius;
  private final double value;
  private final int evaluations;
  private final boolean converged;

  /**
   * Create an instance.
   *
   * @param x the x center
   * @param y the y center
   * @param radius the radius
   * @param optimisedRadius the optimised radius
   * @param value the metric value
   * @param evaluations the number of evaluations
   * @param converged the converged flag
   */
  CenterResult(double x, double y, double radius, double optimisedRadius, double value,
      int evaluations, boolean converged) {
    this.x = x;
    this.y = y;
    this.radius = radius;
    this.optimisedRadius = optimisedRadius;
    this.value = value;
    this.evaluations = evaluations;
    this.converged = converged;
  }

  /**
   * Gets the x center (pixels).
   *
   * @return the x
   */
  public double getX() {
    return x;
  }

  /**
   * Gets the y center (pixels).
   *
   * @return the y
   */
  public double getY() {
    return y;
  }

  /**
   * Gets the radius (pixels). This is the radius of the initial guess.
   *
   * @return the radius
   */
  public double getRadius() {
    return radius;
  }

  /**
   * Gets the radius found by the optimiser (pixels). This is not used as the result radius.
   *
   * @return the optimised radius
   */
  public double getOptimisedRadius() {
    return optimisedRadius;
  }

  /**
   * Gets the metric value at the optimum.
   *
   * @return the value
   */
  public double getValue() {
    return value;
  }

  /**
   * Gets the number of metric evaluations.
   *
   * @return the evaluations
   */
  public int getEvaluations() {
    return evaluations;
  }

  /**
   * Checks if the optimiser converged. If false the result is the best point found within the
   * evaluation budget.
   *
   * @return true if converged
   */
  public boolean isConverged() {
    return converged;
  }

  /**
   * Gets the center rounded to the nearest pixel.
   *
   * @return {x, y}
   */
  public int[] getPixelCenter() {
    return new int[] {(int) Math.round(x), (int) Math.round(y)};
  }

  @Override
  public String toString() {
    return String.format("Center %g,%g (r=%g, converged=%b)", x, y, radius, converged);
  }
}
