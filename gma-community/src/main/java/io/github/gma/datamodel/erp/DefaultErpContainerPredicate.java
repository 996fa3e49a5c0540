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

package io.github.gma.datamodel.erp;

import org.jetbrains.annotations.Nullable;

/**
 * Accepts containers with a rectangular data cube whose channel and bin dimensions match the
 * channel locations and bin descriptors, and a positive, finite sampling rate. An empty cube is
 * structurally fine here.
 */
public class DefaultErpContainerPredicate implements ErpContainerPredicate {

  @Override
  public boolean isValidContainer(@Nullable ErpContainer container) {
    if (container == null || !container.hasData() || !container.isRectangular()) {
      return false;
    }
    if (container.getChannelLocations().size() != container.getNumberOfChannels()) {
      return false;
    }
    // bins cannot be counted without samples
    if (container.getNumberOfSamples() > 0
        && container.getBinDescriptors().size() != container.getNumberOfBins()) {
      return false;
    }
    final double srate = container.getSamplingRate();
    return Double.isFinite(srate) && srate > 0;
  }
}
