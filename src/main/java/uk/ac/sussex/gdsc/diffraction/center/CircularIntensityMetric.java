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

import java.util.Objects;
import org.apache.commons.math3.analysis.MultivariateFunction;
import uk.ac.sussex.gdsc.diffraction.image.DiffractionImage;
import uk.ac.sussex.gdsc.diffraction.image.PixelMask;

/**
 * Scores a candidate circle on an image using the inverse of the mean intensity of the pixels on
 * the circle. A bright diffraction ring has a low score.
 *
 * <p>The circle (x, y, r) is specified in scaled units; pixel units are the scaled units
 * multiplied by the scale factor. A pixel (px, py) is on the circle when:
 *
 * <pre>
 * |(px - x * s)^2 + (py - y * s)^2 - (r * s)^2| &lt; tolerance
 * </pre>
 *
 * <p>and it is contained in the mask. If no pixels are selected, or their mean is zero, the score
 * is positive infinity.
 */
public class CircularIntensityMetric implements MultivariateFunction {
  private final DiffractionImage image;
  private final double scaleFactor;
  private final double tolerance;
  private final PixelMask mask;

  /**
   * Create an instance.
   *
   * @param image the image
   * @param scaleFactor the scale factor
   * @param tolerance the tolerance for the squared distance residual
   * @param mask the mask of pixels to use
   */
  public CircularIntensityMetric(DiffractionImage image, double scaleFactor, double tolerance,
      PixelMask mask) {
    this.image = Objects.requireNonNull(image, "image");
    this.scaleFactor = scaleFactor;
    this.tolerance = tolerance;
    this.mask = Objects.requireNonNull(mask, "mask");
  }

  /**
   * Create an instance using the settings from the options.
   *
   * @param image the image
   * @param options the options
   */
  public CircularIntensityMetric(DiffractionImage image, CenterFinderOptions options) {
    this(image, options.getScaleFactor(), options.getTolerance(), options.getMask());
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
   * {@inheritDoc}
   *
   * @param point {x, y, r} in scaled units
   */
  @Override
  public double value(double[] point) {
    return value(point[0], point[1], point[2]);
  }

  /**
   * Compute the metric.
   *
   * @param x the x center (scaled units)
   * @param y the y center (scaled units)
   * @param r the radius (scaled units)
   * @return the inverse mean intensity on the circle
   */
  public double value(double x, double y, double r) {
    final double mean = meanIntensity(x * scaleFactor, y * scaleFactor, r * scaleFactor);
    // Degenerate selections are an infinite cost; never NaN
    if (!(mean > 0)) {
      return Double.POSITIVE_INFINITY;
    }
    return 1 / mean;
  }

  /**
   * Compute the mean intensity of the pixels on the circle.
   *
   * @param cx the x center (pixel units)
   * @param cy the y center (pixel units)
   * @param radius the radius (pixel units)
   * @return the mean intensity (NaN if no pixels are selected)
   */
  public double meanIntensity(double cx, double cy, double radius) {
    final double r2 = radius * radius;
    // Pixels beyond this distance have a residual above the tolerance
    final double outer = Math.sqrt(r2 + tolerance);
    if (!Double.isFinite(cx) || !Double.isFinite(cy) || !Double.isFinite(outer)) {
      return Double.NaN;
    }
    final int minx = (int) Math.max(0, Math.ceil(cx - outer));
    final int maxx = (int) Math.min(image.getWidth() - 1, Math.floor(cx + outer));
    final int miny = (int) Math.max(0, Math.ceil(cy - outer));
    final int maxy = (int) Math.min(image.getHeight() - 1, Math.floor(cy + outer));

    double sum = 0;
    int count = 0;
    for (int py = miny; py <= maxy; py++) {
      final double dy = py - cy;
      final double dy2 = dy * dy;
      for (int px = minx; px <= maxx; px++) {
        final double dx = px - cx;
        final double residual = dx * dx + dy2 - r2;
        if (Math.abs(residual) < tolerance && mask.contains(px, py)) {
          sum += image.get(px, py);
          count++;
        }
      }
    }
    return count == 0 ? Double.NaN : sum / count;
  }
}
