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

import ij.Prefs;
import uk.ac.sussex.gdsc.diffraction.DiffractionPipeline.BackgroundMethod;
import uk.ac.sussex.gdsc.diffraction.center.CenterFinderOptions;

/**
 * Loads and saves the analysis settings using the ImageJ preferences.
 *
 * <p>Masks are not persisted. The center finder uses the row cutoff mask and the radial average
 * uses the default mask for the center.
 */
public final class DiffractionPreferences {
  private static final String KEY_SCALE_FACTOR = "gdsc.diffraction.center.scale_factor";
  private static final String KEY_TOLERANCE = "gdsc.diffraction.center.tolerance";
  private static final String KEY_ROW_CUTOFF = "gdsc.diffraction.center.row_cutoff";
  private static final String KEY_MAX_EVALUATIONS = "gdsc.diffraction.center.max_evaluations";
  private static final String KEY_RELATIVE_THRESHOLD =
      "gdsc.diffraction.center.relative_threshold";
  private static final String KEY_ABSOLUTE_THRESHOLD =
      "gdsc.diffraction.center.absolute_threshold";
  private static final String KEY_FIND_CENTER = "gdsc.diffraction.find_center";
  private static final String KEY_CUTOFF = "gdsc.diffraction.cutoff";
  private static final String KEY_BACKGROUND_METHOD = "gdsc.diffraction.background.method";
  private static final String KEY_CHUNK_SIZE = "gdsc.diffraction.background.chunk_size";
  private static final String KEY_SMOOTHING_WINDOW =
      "gdsc.diffraction.background.smoothing_window";

  /** No public construction. */
  private DiffractionPreferences() {}

  /**
   * Load the center finder options. Missing values use the defaults.
   *
   * @return the options
   */
  public static CenterFinderOptions loadCenterOptions() {
    return new CenterFinderOptions()
        .setScaleFactor(Prefs.get(KEY_SCALE_FACTOR, CenterFinderOptions.DEFAULT_SCALE_FACTOR))
        .setTolerance(Prefs.get(KEY_TOLERANCE, CenterFinderOptions.DEFAULT_TOLERANCE))
        .setRowCutoff(
            (int) Prefs.get(KEY_ROW_CUTOFF, CenterFinderOptions.DEFAULT_ROW_CUTOFF))
        .setMaxEvaluations(
            (int) Prefs.get(KEY_MAX_EVALUATIONS, CenterFinderOptions.DEFAULT_MAX_EVALUATIONS))
        .setRelativeThreshold(
            Prefs.get(KEY_RELATIVE_THRESHOLD, CenterFinderOptions.DEFAULT_RELATIVE_THRESHOLD))
        .setAbsoluteThreshold(
            Prefs.get(KEY_ABSOLUTE_THRESHOLD, CenterFinderOptions.DEFAULT_ABSOLUTE_THRESHOLD));
  }

  /**
   * Save the center finder options.
   *
   * @param options the options
   */
  public static void saveCenterOptions(CenterFinderOptions options) {
    Prefs.set(KEY_SCALE_FACTOR, options.getScaleFactor());
    Prefs.set(KEY_TOLERANCE, options.getTolerance());
    Prefs.set(KEY_ROW_CUTOFF, options.getRowCutoff());
    Prefs.set(KEY_MAX_EVALUATIONS, options.getMaxEvaluations());
    Prefs.set(KEY_RELATIVE_THRESHOLD, options.getRelativeThreshold());
    Prefs.set(KEY_ABSOLUTE_THRESHOLD, options.getAbsoluteThreshold());
  }

  /**
   * Load the pipeline settings. Missing values use the defaults.
   *
   * @return the pipeline
   */
  public static DiffractionPipeline loadPipeline() {
    final DiffractionPipeline pipeline = new DiffractionPipeline();
    BackgroundMethod method = BackgroundMethod.fromDescription(
        Prefs.get(KEY_BACKGROUND_METHOD, pipeline.getBackgroundMethod().getDescription()));
    if (method == null) {
      method = pipeline.getBackgroundMethod();
    }
    return pipeline.setCenterOptions(loadCenterOptions())
        .setFindCenter(Prefs.get(KEY_FIND_CENTER, pipeline.isFindCenter()))
        .setCutoff(Prefs.get(KEY_CUTOFF, pipeline.getCutoff()))
        .setBackgroundMethod(method)
        .setChunkSize((int) Prefs.get(KEY_CHUNK_SIZE, pipeline.getChunkSize()))
        .setSmoothingWindow((int) Prefs.get(KEY_SMOOTHING_WINDOW, pipeline.getSmoothingWindow()));
  }

  /**
   * Save the pipeline settings, including the center finder options.
   *
   * @param pipeline the pipeline
   */
  public static void savePipeline(DiffractionPipeline pipeline) {
    saveCenterOptions(pipeline.getCenterOptions());
    Prefs.set(KEY_FIND_CENTER, pipeline.isFindCenter());
    Prefs.set(KEY_CUTOFF, pipeline.getCutoff());
    Prefs.set(KEY_BACKGROUND_METHOD, pipeline.getBackgroundMethod().getDescription());
    Prefs.set(KEY_CHUNK_SIZE, pipeline.getChunkSize());
    Prefs.set(KEY_SMOOTHING_WINDOW, pipeline.getSmoothingWindow());
  }
}
