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

import io.github.gma.datamodel.erp.ErpContainer;
import org.jetbrains.annotations.NotNull;

/**
 * Slices the samples of one channel and bin out of the data cube. Always returns new arrays, the
 * container is never modified.
 */
public class ErpDataExtractor {

  /**
   * @return the samples at {@code [channel, :, bin]}
   */
  public double @NotNull [] extract(@NotNull ErpContainer container,
      @NotNull ResolvedChannel channel, @NotNull ResolvedBin bin) {
    final int samples = container.getNumberOfSamples();
    final double[] data = new double[samples];
    for (int i = 0; i < samples; i++) {
      data[i] = container.getValue(channel.index() - 1, i, bin.index() - 1);
    }
    return data;
  }

  /**
   * @param invert reverse the polarity of the extracted samples
   */
  public double @NotNull [] extract(@NotNull ErpContainer container,
      @NotNull ResolvedChannel channel, @NotNull ResolvedBin bin, boolean invert) {
    final double[] data = extract(container, channel, bin);
    return invert ? invert(data) : data;
  }

  /**
   * @return a new array holding the element-wise negation
   */
  public static double @NotNull [] invert(double @NotNull [] data) {
    final double[] inverted = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      inverted[i] = data[i] * -1;
    }
    return inverted;
  }
}
