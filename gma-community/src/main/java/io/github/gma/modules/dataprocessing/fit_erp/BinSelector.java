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
import io.github.gma.datamodel.erp.ErpContainer;
import org.jetbrains.annotations.NotNull;

/**
 * Bins are selected by number only.
 */
public class BinSelector {

  /**
   * @param bin 1-based bin number
   * @throws BinIndexOutOfRangeException if the bin is outside 1 ... bin count
   */
  public @NotNull ResolvedBin select(int bin, @NotNull ErpContainer container) {
    final Range<Integer> valid = IndexRanges.oneBased(container.getNumberOfBins());
    if (!valid.contains(bin)) {
      throw new BinIndexOutOfRangeException(bin, valid);
    }
    return new ResolvedBin(bin);
  }
}
