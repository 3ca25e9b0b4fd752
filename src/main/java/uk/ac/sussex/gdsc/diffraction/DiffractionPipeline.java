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

package uk.ac.sussex.gdsc.diffraction;

import java.util.Objects;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.diffraction.background.BackgroundEstimator;
import uk.ac.sussex.gdsc.diffraction.background.BackgroundFit;
import uk.ac.sussex.gdsc.diffraction.background.FitFamily;
import uk.ac.sussex.gdsc.diffraction.background.GlobalBackgroundFitter;
import uk.ac.sussex.gdsc.diffraction.background.StitchedBackground;
import uk.ac.sussex.gdsc.diffraction.background.StitchedVoigtBackground;
import uk.ac.sussex.gdsc.diffraction.center.CenterFinder;
import uk.ac.sussex.gdsc.diffraction.center.CenterFinderOptions;
import uk.ac.sussex.gdsc.diffraction.center.CenterResult;
import uk.ac.sussex.gdsc.diffraction.image.DiffractionImage;
import uk.ac.sussex.gdsc.diffraction.image.PixelMask;
import uk.ac.sussex.gdsc.diffraction.radial.RadialAverager;
import uk.ac.sussex.gdsc.diffraction.radial.RadialCurve;

/**
 * Runs the analysis of a single diffraction image: find the center, compute the radial average,
 * remove the low-x region, estimate the inelastic background and subtract it.
 */
public class DiffractionPipeline {
  private static final Logger LOGGER = Logger.getLogger(DiffractionPipeline.class.getName());

  /**
   * The background estimation method.
   */
  public enum BackgroundMethod {
    /** Constant levels beneath pseudo-Voigt fits to each feature. */
    STITCHED_VOIGT("Stitched pseudo-Voigt", null),
    /** A global bi-exponential fit through background anchors. */
    BIEXPONENTIAL(FitFamily.BIEXPONENTIAL.getDescription(), FitFamily.BIEXPONENTIAL),
    /** A global bi-Lorentzian fit through background anchors. */
    BILORENTZIAN(FitFamily.BILORENTZIAN.getDescription(), FitFamily.BILORENTZIAN);

    private final String description;
    private final FitFamily family;

    BackgroundMethod(String description, FitFamily family) {
      this.description = description;
      this.family = family;
    }

    /**
     * Gets the description.
     *
     * @return the description
     */
    public String getDescription() {
      return description;
    }

    /**
     * Gets the family for a global fit.
     *
     * @return the family (or null for the stitched method)
     */
    public FitFamily getFitFamily() {
      return family;
    }

    @Override
    public String toString() {
      return getDescription();
    }

    /**
     * Create from the description.
     *
     * @param description the description
     * @return the method (or null)
     */
    public static BackgroundMethod fromDescription(String description) {
      for (final BackgroundMethod value : values()) {
        if (value.getDescription().equals(description)) {
          return value;
        }
      }
      return null;
    }
  }

  /**
   * The intermediate and final curves of the analysis.
   */
  public static final class Result {
    private final CenterResult center;
    private final int[] pixelCenter;
    private final RadialCurve radialAverage;
    private final RadialCurve curve;
    private final RadialCurve background;
    private final RadialCurve corrected;
    private final StitchedBackground stitchedBackground;
    private final BackgroundFit backgroundFit;

    Result(CenterResult center, int[] pixelCenter, RadialCurve radialAverage, RadialCurve curve,
        RadialCurve background, RadialCurve corrected, StitchedBackground stitchedBackground,
        BackgroundFit backgroundFit) {
      this.center = center;
      this.pixelCenter = pixelCenter;
      this.radialAverage = radialAverage;
      this.curve = curve;
      this.background = background;
      this.corrected = corrected;
      this.stitchedBackground = stitchedBackground;
      this.backgroundFit = backgroundFit;
    }

    /**
     * Gets the center search result.
     *
     * @return the center (or null if the center was not searched)
     */
    public CenterResult getCenter() {
      return center;
    }

    /**
     * Gets the pixel center used for the radial average.
     *
     * @return {x, y}
     */
    public int[] getPixelCenter() {
      return pixelCenter.clone();
    }

    /**
     * Gets the radial average of the image.
     *
     * @return the radial average
     */
    public RadialCurve getRadialAverage() {
      return radialAverage;
    }

    /**
     * Gets the curve after the low-x cutoff. This is the radial average if no cutoff was applied.
     *
     * @return the curve
     */
    public RadialCurve getCurve() {
      return curve;
    }

    /**
     * Gets the background.
     *
     * @return the background
     */
    public RadialCurve getBackground() {
      return background;
    }

    /**
     * Gets the background corrected curve.
     *
     * @return the corrected curve
     */
    public RadialCurve getCorrected() {
      return corrected;
    }

    /**
     * Gets the stitched background.
     *
     * @return the stitched background (or null if a global fit was used)
     */
    public StitchedBackground getStitchedBackground() {
      return stitchedBackground;
    }

    /**
     * Gets the global background fit.
     *
     * @return the fit (or null if the stitched method was used)
     */
    public BackgroundFit getBackgroundFit() {
      return backgroundFit;
    }
  }

  private CenterFinderOptions centerOptions = new CenterFinderOptions();
  private boolean findCenter = true;
  private PixelMask averageMask;
  private double cutoff = Double.NaN;
  private BackgroundMethod backgroundMethod = BackgroundMethod.STITCHED_VOIGT;
  private int chunkSize = StitchedVoigtBackground.DEFAULT_CHUNK_SIZE;
  private int smoothingWindow;

  /**
   * Gets a copy of the center finder options.
   *
   * @return the center options
   */
  public CenterFinderOptions getCenterOptions() {
    return centerOptions.copy();
  }

  /**
   * Sets the center finder options. The options are copied.
   *
   * @param centerOptions the center options
   * @return this
   */
  public DiffractionPipeline setCenterOptions(CenterFinderOptions centerOptions) {
    this.centerOptions = centerOptions.copy();
    return this;
  }

  /**
   * Checks if the center is refined from the guess.
   *
   * @return true if finding the center
   */
  public boolean isFindCenter() {
    return findCenter;
  }

  /**
   * Set to true to refine the center from the guess. Otherwise the guess is used directly.
   *
   * @param findCenter the find center flag
   * @return this
   */
  public DiffractionPipeline setFindCenter(boolean findCenter) {
    this.findCenter = findCenter;
    return this;
  }

  /**
   * Gets the radial average mask.
   *
   * @return the mask (or null to use the default for the center)
   * @see RadialAverager#defaultMask(int, int)
   */
  public PixelMask getAverageMask() {
    return averageMask;
  }

  /**
   * Sets the radial average mask. Use null for the default mask for the center.
   *
   * @param averageMask the mask
   * @return this
   */
  public DiffractionPipeline setAverageMask(PixelMask averageMask) {
    this.averageMask = averageMask;
    return this;
  }

  /**
   * Gets the cutoff.
   *
   * @return the cutoff (NaN if disabled)
   */
  public double getCutoff() {
    return cutoff;
  }

  /**
   * Sets the x threshold used to remove the low-x region of the radial average. Use NaN to
   * disable.
   *
   * @param cutoff the cutoff
   * @return this
   * @see RadialCurve#cutoff(double)
   */
  public DiffractionPipeline setCutoff(double cutoff) {
    this.cutoff = cutoff;
    return this;
  }

  /**
   * Gets the background method.
   *
   * @return the background method
   */
  public BackgroundMethod getBackgroundMethod() {
    return backgroundMethod;
  }

  /**
   * Sets the background method.
   *
   * @param backgroundMethod the background method
   * @return this
   */
  public DiffractionPipeline setBackgroundMethod(BackgroundMethod backgroundMethod) {
    this.backgroundMethod = Objects.requireNonNull(backgroundMethod, "backgroundMethod");
    return this;
  }

  /**
   * Gets the chunk size for the stitched background.
   *
   * @return the chunk size
   */
  public int getChunkSize() {
    return chunkSize;
  }

  /**
   * Sets the chunk size for the stitched background.
   *
   * @param chunkSize the chunk size
   * @return this
   * @see StitchedVoigtBackground#setChunkSize(int)
   */
  public DiffractionPipeline setChunkSize(int chunkSize) {
    this.chunkSize = StitchedVoigtBackground.validateChunkSize(chunkSize);
    return this;
  }

  /**
   * Gets the smoothing window for the stitched background.
   *
   * @return the smoothing window
   */
  public int getSmoothingWindow() {
    return smoothingWindow;
  }

  /**
   * Sets the smoothing window for the stitched background. Use 0 to disable.
   *
   * @param smoothingWindow the smoothing window
   * @return this
   * @see StitchedVoigtBackground#setSmoothingWindow(int)
   */
  public DiffractionPipeline setSmoothingWindow(int smoothingWindow) {
    this.smoothingWindow = Math.max(0, smoothingWindow);
    return this;
  }

  /**
   * Run the analysis.
   *
   * <p>Anchor points are positions on the (cutoff) radial average: diffraction features for the
   * stitched method or background points for a global fit.
   *
   * @param image the image
   * @param xg the x center guess (pixels)
   * @param yg the y center guess (pixels)
   * @param rg the ring radius guess (pixels)
   * @param anchors the anchor points
   * @param name the name of the image
   * @return the result
   */
  public Result run(DiffractionImage image, double xg, double yg, double rg, double[][] anchors,
      String name) {
    CenterResult center = null;
    int[] pixelCenter;
    if (findCenter) {
      center = new CenterFinder(centerOptions).findCenter(image, xg, yg, rg);
      pixelCenter = center.getPixelCenter();
    } else {
      pixelCenter = new int[] {(int) Math.round(xg), (int) Math.round(yg)};
    }

    final int xc = pixelCenter[0];
    final int yc = pixelCenter[1];
    final PixelMask mask = averageMask == null ? RadialAverager.defaultMask(xc, yc) : averageMask;
    final RadialCurve radialAverage = RadialAverager.average(image, xc, yc, mask, name);
    final RadialCurve curve = Double.isNaN(cutoff) ? radialAverage : radialAverage.cutoff(cutoff);

    StitchedBackground stitched = null;
    BackgroundFit fit = null;
    RadialCurve background;
    if (backgroundMethod == BackgroundMethod.STITCHED_VOIGT) {
      stitched = new StitchedVoigtBackground().setChunkSize(chunkSize)
          .setSmoothingWindow(smoothingWindow).estimate(curve, anchors);
      background = stitched.getBackground();
    } else {
      fit = GlobalBackgroundFitter.fit(curve, anchors, backgroundMethod.getFitFamily());
      background = fit.getBackground();
    }
    final RadialCurve corrected = BackgroundEstimator.subtract(curve, background);

    LOGGER.fine(() -> String.format("%s: center %d,%d; %d radii; %s background", name, xc, yc,
        curve.size(), backgroundMethod));
    return new Result(center, pixelCenter, radialAverage, curve, background, corrected, stitched,
        fit);
  }
}
