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

import uk.ac.sussex.gdsc.diffraction.image.PixelMask;
import uk.ac.sussex.gdsc.diffraction.image.PixelMasks;

/**
 * Provides the options for the {@link CenterFinder}.
 */
public class CenterFinderOptions {
  /** The default scale factor between pixel and optimiser units. */
  public static final double DEFAULT_SCALE_FACTOR = 20;
  /** The default tolerance for the squared distance residual of pixels on the ring. */
  public static final double DEFAULT_TOLERANCE = 10;
  /** The default row cut-off. Rows at or above this index contain the beam block. */
  public static final int DEFAULT_ROW_CUTOFF = 550;
  /** The default maximum number of metric evaluations. */
  public static final int DEFAULT_MAX_EVALUATIONS = 600;
  /** The default relative threshold for convergence of the simplex points. */
  public static final double DEFAULT_RELATIVE_THRESHOLD = 1e-6;
  /** The default absolute threshold for convergence of the simplex points (optimiser units). */
  public static final double DEFAULT_ABSOLUTE_THRESHOLD = 1e-4;

  private double scaleFactor;
  private double tolerance;
  private int rowCutoff;
  private PixelMask mask;
  private int maxEvaluations;
  private double relativeThreshold;
  private double absoluteThreshold;

  /**
   * Create an instance with the default options.
   */
  public CenterFinderOptions() {
    scaleFactor = DEFAULT_SCALE_FACTOR;
    tolerance = DEFAULT_TOLERANCE;
    rowCutoff = DEFAULT_ROW_CUTOFF;
    maxEvaluations = DEFAULT_MAX_EVALUATIONS;
    relativeThreshold = DEFAULT_RELATIVE_THRESHOLD;
    absoluteThreshold = DEFAULT_ABSOLUTE_THRESHOLD;
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  private CenterFinderOptions(CenterFinderOptions source) {
    scaleFactor = source.scaleFactor;
    tolerance = source.tolerance;
    rowCutoff = source.rowCutoff;
    mask = source.mask;
    maxEvaluations = source.maxEvaluations;
    relativeThreshold = source.relativeThreshold;
    absoluteThreshold = source.absoluteThreshold;
  }

  /**
   * Copy the options.
   *
   * @return the copy
   */
  public CenterFinderOptions copy() {
    return new CenterFinderOptions(this);
  }

  /**
   * Gets the scale factor.
   *
   * @return the scale factor
   */
  public double getScaleFactor() {
    return scaleFactor;
  }

  /**
   * Sets the scale factor between pixel units and optimiser units.
   *
   * @param scaleFactor the new scale factor
   * @return this
   * @throws IllegalArgumentException if not strictly positive and finite
   */
  public CenterFinderOptions setScaleFactor(double scaleFactor) {
    if (!(scaleFactor > 0 && scaleFactor < Double.POSITIVE_INFINITY)) {
      throw new IllegalArgumentException("Scale factor must be positive: " + scaleFactor);
    }
    this.scaleFactor = scaleFactor;
    return this;
  }

  /**
   * Gets the tolerance.
   *
   * @return the tolerance
   */
  public double getTolerance() {
    return tolerance;
  }

  /**
   * Sets the tolerance for the squared distance residual of pixels on the ring.
   *
   * @param tolerance the new tolerance
   * @return this
   * @throws IllegalArgumentException if not strictly positive
   */
  public CenterFinderOptions setTolerance(double tolerance) {
    if (!(tolerance > 0)) {
      throw new IllegalArgumentException("Tolerance must be positive: " + tolerance);
    }
    this.tolerance = tolerance;
    return this;
  }

  /**
   * Gets the row cut-off.
   *
   * @return the row cut-off
   */
  public int getRowCutoff() {
    return rowCutoff;
  }

  /**
   * Sets the row cut-off. Only rows with an index above the cut-off are used when no explicit
   * mask is set.
   *
   * @param rowCutoff the new row cut-off
   * @return this
   */
  public CenterFinderOptions setRowCutoff(int rowCutoff) {
    this.rowCutoff = rowCutoff;
    return this;
  }

  /**
   * Gets the mask. If no mask has been set this returns the row cut-off mask.
   *
   * @return the mask
   * @see PixelMasks#rowsAfter(int)
   */
  public PixelMask getMask() {
    return mask == null ? PixelMasks.rowsAfter(rowCutoff) : mask;
  }

  /**
   * Sets the mask of pixels used by the metric. Set to null to use the row cut-off.
   *
   * @param mask the new mask
   * @return this
   */
  public CenterFinderOptions setMask(PixelMask mask) {
    this.mask = mask;
    return this;
  }

  /**
   * Gets the max evaluations.
   *
   * @return the max evaluations
   */
  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  /**
   * Sets the maximum number of metric evaluations.
   *
   * @param maxEvaluations the new max evaluations
   * @return this
   * @throws IllegalArgumentException if not strictly positive
   */
  public CenterFinderOptions setMaxEvaluations(int maxEvaluations) {
    if (maxEvaluations < 1) {
      throw new IllegalArgumentException("Max evaluations must be positive: " + maxEvaluations);
    }
    this.maxEvaluations = maxEvaluations;
    return this;
  }

  /**
   * Gets the relative threshold.
   *
   * @return the relative threshold
   */
  public double getRelativeThreshold() {
    return relativeThreshold;
  }

  /**
   * Sets the relative threshold for convergence of the simplex points.
   *
   * @param relativeThreshold the new relative threshold
   * @return this
   */
  public CenterFinderOptions setRelativeThreshold(double relativeThreshold) {
    this.relativeThreshold = relativeThreshold;
    return this;
  }

  /**
   * Gets the absolute threshold.
   *
   * @return the absolute threshold
   */
  public double getAbsoluteThreshold() {
    return absoluteThreshold;
  }

  /**
   * Sets the absolute threshold for convergence of the simplex points (in optimiser units).
   *
   * @param absoluteThreshold the new absolute threshold
   * @return this
   */
  public CenterFinderOptions setAbsoluteThreshold(double absoluteThreshold) {
    this.absoluteThreshold = absoluteThreshold;
    return this;
  }
}
