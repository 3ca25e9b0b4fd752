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

import ij.process.ImageProcessor;
import java.util.Objects;

/**
 * An immutable 2D grid of intensity values.
 *
 * <p>Data is stored row-major with the origin at the top-left. The row index (y) increases
 * downward.
 */
public final class DiffractionImage {
  private final int width;
  private final int height;
  private final double[] data;

  /**
   * Create an instance. The data is not copied.
   *
   * @param width the width
   * @param height the height
   * @param data the data
   */
  private DiffractionImage(int width, int height, double[] data) {
    this.width = width;
    this.height = height;
    this.data = data;
  }

  /**
   * Create an image from row-major data. The data is copied.
   *
   * @param width the width
   * @param height the height
   * @param data the data
   * @return the image
   * @throws IllegalArgumentException if the dimensions do not match the data length
   */
  public static DiffractionImage wrap(int width, int height, double[] data) {
    checkDimensions(width, height, Objects.requireNonNull(data, "data").length);
    return new DiffractionImage(width, height, data.clone());
  }

  /**
   * Create an image from row-major data. The data is copied.
   *
   * @param width the width
   * @param height the height
   * @param data the data
   * @return the image
   * @throws IllegalArgumentException if the dimensions do not match the data length
   */
  public static DiffractionImage wrap(int width, int height, float[] data) {
    checkDimensions(width, height, Objects.requireNonNull(data, "data").length);
    final double[] copy = new double[data.length];
    for (int i = 0; i < copy.length; i++) {
      copy[i] = data[i];
    }
    return new DiffractionImage(width, height, copy);
  }

  /**
   * Create an image from rows of data. All rows must have the same length.
   *
   * @param rows the rows
   * @return the image
   * @throws IllegalArgumentException if the rows are empty or ragged
   */
  public static DiffractionImage fromRows(double[][] rows) {
    Objects.requireNonNull(rows, "rows");
    if (rows.length == 0) {
      throw new IllegalArgumentException("No rows");
    }
    final int w = rows[0].length;
    final double[] data = new double[w * rows.length];
    for (int y = 0; y < rows.length; y++) {
      if (rows[y].length != w) {
        throw new IllegalArgumentException("Row " + y + " length " + rows[y].length
            + " does not match width " + w);
      }
      System.arraycopy(rows[y], 0, data, y * w, w);
    }
    checkDimensions(w, rows.length, data.length);
    return new DiffractionImage(w, rows.length, data);
  }

  /**
   * Create an image from an ImageJ processor. Any processor type is converted to float values
   * using the first channel.
   *
   * @param ip the image processor
   * @return the image
   */
  public static DiffractionImage fromProcessor(ImageProcessor ip) {
    final float[] pixels = (float[]) ip.toFloat(0, null).getPixels();
    final double[] data = new double[pixels.length];
    for (int i = 0; i < data.length; i++) {
      data[i] = pixels[i];
    }
    return new DiffractionImage(ip.getWidth(), ip.getHeight(), data);
  }

  private static void checkDimensions(int width, int height, int length) {
    if (width < 1 || height < 1) {
      throw new IllegalArgumentException("Invalid dimensions: " + width + "x" + height);
    }
    if ((long) width * height != length) {
      throw new IllegalArgumentException(
          "Data length " + length + " does not match dimensions " + width + "x" + height);
    }
  }

  /**
   * Gets the width.
   *
   * @return the width
   */
  public int getWidth() {
    return width;
  }

  /**
   * Gets the height.
   *
   * @return the height
   */
  public int getHeight() {
    return height;
  }

  /**
   * Gets the number of pixels.
   *
   * @return the size
   */
  public int size() {
    return data.length;
  }

  /**
   * Gets the value at the given column and row.
   *
   * @param x the x (column)
   * @param y the y (row)
   * @return the value
   */
  public double get(int x, int y) {
    return data[y * width + x];
  }

  /**
   * Gets the value at the given row-major index.
   *
   * @param index the index
   * @return the value
   */
  public double get(int index) {
    return data[index];
  }

  /**
   * Checks if the other image has the same dimensions.
   *
   * @param other the other image
   * @return true if the same shape
   */
  public boolean isSameShape(DiffractionImage other) {
    return width == other.width && height == other.height;
  }

  /**
   * Get a copy of the row-major data.
   *
   * @return the data
   */
  public double[] toArray() {
    return data.clone();
  }
}
