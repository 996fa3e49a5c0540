/*
 * Copyright (c) 2024-2025 The gma Development Team
 */

package io.github.gma.modules.dataprocessing.fit_erp;

import io.github.gma.modules.dataprocessing.fit_gamma.FitResult;
import io.github.gma.modules.dataprocessing.fit_gamma.GmaFitEngine;
import io.github.gma.modules.dataprocessing.fit_gamma.GmaFitOutput;
import io.github.gma.modules.dataprocessing.fit_gamma.GmaResults;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Records the last call and answers with a fixed Gamma fit.
 */
class RecordingGmaFitEngine implements GmaFitEngine {

  static final double[] X0 = {4.0, 0.2, 1.5};

  private final Supplier<FitResult> resultSupplier;
  int calls;
  double[] data;
  int winStart;
  int winLength;
  Map<String, Object> options;
  GmaFitOutput lastOutput;

  RecordingGmaFitEngine() {
    this(null);
  }

  /**
   * @param resultSupplier supplies the fit result, null for a {@link GmaResults} of the window
   */
  RecordingGmaFitEngine(Supplier<FitResult> resultSupplier) {
    this.resultSupplier = resultSupplier;
  }

  @Override
  public GmaFitOutput fit(double[] data, int winStart, int winLength,
      Map<String, Object> options) {
    calls++;
    this.data = data;
    this.winStart = winStart;
    this.winLength = winLength;
    this.options = options;

    final Map<String, Object> argsUsed = new LinkedHashMap<>(options);
    argsUsed.put("winStart", winStart);
    argsUsed.put("winLength", winLength);
    final FitResult results = resultSupplier != null ? resultSupplier.get()
        : new GmaResults(5, 0.25, 2.0, winStart, winLength);
    lastOutput = new GmaFitOutput(results, X0.clone(), argsUsed);
    return lastOutput;
  }
}
