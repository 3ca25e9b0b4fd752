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

import java.util.Objects;
import org.apache.commons.lang3.ArrayUtils;

/**
 * A radially averaged diffraction pattern, background or fit.
 *
 * <p>The curve is immutable. Data is copied on construction and when returned. All operations
 * return a new curve.
 */
public final class RadialCurve {
  private final double[] x;
  private final double[] y;
  private final String label;

  /**
   * Create an instance. The data is copied.
   *
   * @param x the x data (non-decreasing)
   * @param y the y data
   * @param label the label
   * @throws MalformedCurveException if the lengths differ or x is not non-decreasing
   */
  public RadialCurve(double[] x, double[] y, String label) {
    this(check(x.clone(), y), y.clone(), label, false);
  }

  /**
   * Create an instance without copying or checking the data.
   *
   * @param x the x data
   * @param y the y data
   * @param label the label
   * @param unused used to disambiguate the constructor
   */
  private RadialCurve(double[] x, double[] y, String label, boolean unused) {
    this.x = x;
    this.y = y;
    this.label = label == null ? "" : label;
  }

  /**
   * Create a curve from data owned by the caller after validation. No copy is made.
   *
   * @param x the x data
   * @param y the y data
   * @param label the label
   * @return the curve
   */
  static RadialCurve wrap(double[] x, double[] y, String label) {
    return new RadialCurve(check(x, y), y, label, false);
  }

  private static double[] check(double[] x, double[] y) {
    if (x.length != y.length) {
      throw new MalformedCurveException(
          "x and y lengths differ: " + x.length + " != " + y.length);
    }
    for (int i = 0; i < x.length; i++) {
      if (!Double.isFinite(x[i])) {
        throw new MalformedCurveException("Non-finite x at index " + i + ": " + x[i]);
      }
      if (i != 0 && x[i] < x[i - 1]) {
        throw new MalformedCurveException(
            "x is decreasing at index " + i + ": " + x[i - 1] + " > " + x[i]);
      }
    }
    return x;
  }

  /**
   * Gets a copy of the x data.
   *
   * @return the x data
   */
  public double[] getX() {
    return x.clone();
  }

  /**
   * Gets a copy of the y data.
   *
   * @return the y data
   */
  public double[] getY() {
    return y.clone();
  }

  /**
   * Gets the x value at the index.
   *
   * @param index the index
   * @return the x value
   */
  public double getX(int index) {
    return x[index];
  }

  /**
   * Gets the y value at the index.
   *
   * @param index the index
   * @return the y value
   */
  public double getY(int index) {
    return y[index];
  }

  /**
   * Gets the label.
   *
   * @return the label
   */
  public String getLabel() {
    return label;
  }

  /**
   * Gets the number of samples.
   *
   * @return the size
   */
  public int size() {
    return x.length;
  }

  /**
   * Checks if the curve has no samples.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return x.length == 0;
  }

  /**
   * Create a copy with a new label.
   *
   * @param label the label
   * @return the curve
   */
  public RadialCurve withLabel(String label) {
    return new RadialCurve(x, y, label, false);
  }

  /**
   * Create a copy with new x data, for example after calibration to the scattering vector.
   *
   * @param newX the new x data
   * @return the curve
   * @throws MalformedCurveException if the length differs or x is not non-decreasing
   */
  public RadialCurve withX(double[] newX) {
    return new RadialCurve(check(newX.clone(), y), y, label, false);
  }

  /**
   * Find the index of the sample nearest to the value. If two samples are equally close the
   * lower index is returned.
   *
   * @param value the value
   * @return the index (or -1 if empty)
   */
  public int nearestIndex(double value) {
    int index = -1;
    double min = Double.POSITIVE_INFINITY;
    for (int i = 0; i < x.length; i++) {
      final double d = Math.abs(x[i] - value);
      if (d < min) {
        min = d;
        index = i;
      }
    }
    return index;
  }

  /**
   * Interpolate the y value at the position. Values outside the curve domain are clamped to the
   * nearest end value.
   *
   * @param position the position
   * @return the value
   * @throws IllegalArgumentException if the curve is empty
   */
  public double valueAt(double position) {
    return LinearInterpolation.interpolate(x, y, position);
  }

  /**
   * Interpolate the y values at the positions.
   *
   * @param positions the positions
   * @return the values
   * @throws IllegalArgumentException if the curve is empty
   * @see #valueAt(double)
   */
  public double[] valuesAt(double[] positions) {
    return LinearInterpolation.interpolate(x, y, positions);
  }

  /**
   * Subtract the other curve from this curve. The other curve is linearly interpolated onto the x
   * positions of this curve. The label of this curve is kept.
   *
   * @param other the other curve
   * @return the difference
   * @throws IllegalArgumentException if the other curve is empty
   */
  public RadialCurve subtract(RadialCurve other) {
    Objects.requireNonNull(other, "other");
    final double[] diff = other.valuesAt(x);
    for (int i = 0; i < diff.length; i++) {
      diff[i] = y[i] - diff[i];
    }
    return new RadialCurve(x, diff, label, false);
  }

  /**
   * Remove the low end of the curve. The samples from the index nearest the threshold to the end
   * are retained.
   *
   * @param threshold the threshold
   * @return the curve
   */
  public RadialCurve cutoff(double threshold) {
    final int index = Math.max(0, nearestIndex(threshold));
    return new RadialCurve(ArrayUtils.subarray(x, index, x.length),
        ArrayUtils.subarray(y, index, y.length), "Cutoff " + label, false);
  }

  /**
   * Compute the integral of the curve between the limits using the trapezoid rule. The curve is
   * interpolated at the limits.
   *
   * @param min the lower limit
   * @param max the upper limit
   * @return the integral (zero if the range is empty or outside the curve)
   */
  public double integrate(double min, double max) {
    final int n = x.length;
    if (n < 2) {
      return 0;
    }
    final double lower = Math.max(min, x[0]);
    final double upper = Math.min(max, x[n - 1]);
    if (!(lower < upper)) {
      return 0;
    }
    double sum = 0;
    double px = lower;
    double py = valueAt(lower);
    for (int i = 0; i < n; i++) {
      if (x[i] <= lower) {
        continue;
      }
      if (x[i] >= upper) {
        break;
      }
      sum += 0.5 * (x[i] - px) * (y[i] + py);
      px = x[i];
      py = y[i];
    }
    sum += 0.5 * (upper - px) * (valueAt(upper) + py);
    return sum;
  }

  @Override
  public String toString() {
    return "RadialCurve[" + label + ", n=" + x.length + "]";
  }
}
