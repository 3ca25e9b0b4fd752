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

package uk.ac.sussex.gdsc.diffraction.image;

import java.util.Arrays;
import java.util.List;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Computes the pixel-wise mean of images sharing a shape, e.g. repeated exposures that share a
 * beam center.
 */
public final class ImageAverager {

  /** No public construction. */
  private ImageAverager() {}

  /**
   * Compute the mean image.
   *
   * @param images the images
   * @return the mean image
   * @throws IllegalArgumentException if there are no images or the shapes differ
   */
  public static DiffractionImage average(DiffractionImage... images) {
    if (ArrayUtils.isEmpty(images)) {
      throw new IllegalArgumentException("No images");
    }
    return average(Arrays.asList(images));
  }

  /**
   * Compute the mean image.
   *
   * @param images the images
   * @return the mean image
   * @throws IllegalArgumentException if there are no images or the shapes differ
   */
  public static DiffractionImage average(List<DiffractionImage> images) {
    if (images.isEmpty()) {
      throw new IllegalArgumentException("No images");
    }
    final DiffractionImage first = images.get(0);
    final double[] sum = new double[first.size()];
    for (final DiffractionImage image : images) {
      if (!first.isSameShape(image)) {
        throw new IllegalArgumentException("Image shape " + image.getWidth() + "x"
            + image.getHeight() + " does not match " + first.getWidth() + "x" + first.getHeight());
      }
      for (int i = 0; i < sum.length; i++) {
        sum[i] += image.get(i);
      }
    }
    final double n = images.size();
    for (int i = 0; i < sum.length; i++) {
      sum[i] /= n;
    }
    return DiffractionImage.wrap(first.getWidth(), first.getHeight(), sum);
  }
}
