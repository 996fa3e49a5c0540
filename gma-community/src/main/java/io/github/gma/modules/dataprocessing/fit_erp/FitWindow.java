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

package io.github.gma.modules.dataprocessing.fit_erp;

import com.google.common.collect.Range;
import com.google.common.primitives.Ints;
import io.github.gma.parameters.parametertypes.IntegerParameter;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Search window of the fitting engine in samples. Whether the window fits into the data is
 * checked by the engine.
 *
 * @param start  1-based first sample
 * @param length number of samples
 */
public record FitWindow(int start, int length) {

  /**
   * @throws InvalidFitWindowException if start or length are not positive
   */
  public FitWindow {
    check(ErpFitParameters.WINDOW_START, start);
    check(ErpFitParameters.WINDOW_LENGTH, length);
  }

  /**
   * @return a window starting at {@code start} with a length of all samples, at least 1
   */
  public static @NotNull FitWindow ofFullLength(int start, int numberOfSamples) {
    return new FitWindow(start, Math.max(1, numberOfSamples));
  }

  /**
   * @return closed-open range of 1-based sample numbers, the end saturates at
   * {@link Integer#MAX_VALUE}
   */
  public @NotNull Range<Integer> toSampleRange() {
    return Range.closedOpen(start, Ints.saturatedCast((long) start + length));
  }

  private static void check(IntegerParameter parameter, int value) {
    final List<String> errors = new ArrayList<>(1);
    if (!parameter.checkValue(value, errors)) {
      throw new InvalidFitWindowException(parameter.getName(), value, String.join("; ", errors));
    }
  }
}
