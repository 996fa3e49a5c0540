/*
 * Copyright (c) 2024-2025 The gma Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.gma.modules.dataprocessing.fit_gamma;

import java.util.Map;
import org.jetbrains.annotations.NotNull;

/**
 * Fits a Gamma PDF to a one-dimensional sample sequence. Validation of the options is owned by
 * the implementation.
 */
@FunctionalInterface
public interface GmaFitEngine {

  /**
   * @param data        sample sequence
   * @param winStart    1-based first sample of the search window
   * @param winLength   number of samples of the search window
   * @param options     engine options by name
   * @return the fit result, the initial guess and the arguments used
   */
  @NotNull GmaFitOutput fit(double @NotNull [] data, int winStart, int winLength,
      @NotNull Map<String, Object> options);
}
