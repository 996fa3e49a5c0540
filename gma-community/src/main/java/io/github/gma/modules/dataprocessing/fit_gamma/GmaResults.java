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

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;
import com.google.common.primitives.Ints;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.util.FastMath;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Gamma PDF parameters of a fitted component. The PDF is defined in samples relative to the first
 * sample of the search window and scaled by {@code yScale}.
 */
public class GmaResults implements FitResult {

  private static final Logger logger = Logger.getLogger(GmaResults.class.getName());

  private final double shape;
  private final double rate;
  private final double yScale;
  private final int winStart;
  private final int winLength;
  private final Map<Integer, ErpInfo> erpInfos = new TreeMap<>();

  /**
   * @param shape     shape k, must be positive
   * @param rate      rate, must be positive
   * @param yScale    amplitude scaling of the PDF
   * @param winStart  1-based first sample of the search window
   * @param winLength length of the search window
   */
  public GmaResults(double shape, double rate, double yScale, int winStart, int winLength) {
    Preconditions.checkArgument(shape > 0, "shape must be positive: %s", shape);
    Preconditions.checkArgument(rate > 0, "rate must be positive: %s", rate);
    Preconditions.checkArgument(winStart >= 1, "winStart must be positive: %s", winStart);
    Preconditions.checkArgument(winLength >= 1, "winLength must be positive: %s", winLength);
    this.shape = shape;
    this.rate = rate;
    this.yScale = yScale;
    this.winStart = winStart;
    this.winLength = winLength;
  }

  public double getShape() {
    return shape;
  }

  public double getRate() {
    return rate;
  }

  public double getScale() {
    return 1d / rate;
  }

  public double getYScale() {
    return yScale;
  }

  public int getWinStart() {
    return winStart;
  }

  public int getWinLength() {
    return winLength;
  }

  /**
   * @return closed-open range of 1-based sample numbers searched by the fit, the end saturates at
   * {@link Integer#MAX_VALUE}
   */
  public @NotNull Range<Integer> getWindow() {
    return Range.closedOpen(winStart, Ints.saturatedCast((long) winStart + winLength));
  }

  /**
   * @return mode of the PDF in samples relative to the window start, 0 for shape < 1
   */
  public double getMode() {
    return shape >= 1 ? (shape - 1) / rate : 0d;
  }

  public double getMean() {
    return shape / rate;
  }

  public double getSkewness() {
    return 2d / FastMath.sqrt(shape);
  }

  /**
   * @param length number of samples
   * @return the scaled PDF evaluated at 0 ... length - 1 samples after the window start
   */
  public double @NotNull [] getFittedCurve(int length) {
    final GammaDistribution pdf = new GammaDistribution(shape, getScale());
    final double[] curve = new double[length];
    for (int i = 0; i < length; i++) {
      curve[i] = yScale * pdf.density(i);
    }
    return curve;
  }

  @Override
  public void addErpInfo(@NotNull ErpInfo info, int channel) {
    Preconditions.checkArgument(channel >= 1, "channel must be positive: %s", channel);
    final ErpInfo previous = erpInfos.put(channel, info);
    if (previous != null) {
      logger.fine(() -> "Replaced ERP info of channel " + channel);
    }
  }

  public @Nullable ErpInfo getErpInfo(int channel) {
    return erpInfos.get(channel);
  }

  /**
   * @return provenance records by 1-based channel number, ascending
   */
  public @NotNull Map<Integer, ErpInfo> getErpInfos() {
    return Collections.unmodifiableMap(erpInfos);
  }

  @Override
  public String toString() {
    return "GmaResults{shape=" + shape + ", rate=" + rate + ", yScale=" + yScale + ", winStart="
        + winStart + ", winLength=" + winLength + '}';
  }
}
