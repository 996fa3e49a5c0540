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

import io.github.gma.datamodel.erp.ChannelLocation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Describes where the data of a {@link FitResult} came from. Arrays and maps are copied on
 * construction and on access.
 *
 * @param type            container kind, {@link #ERP_INFO_TYPE} for ERP containers
 * @param setName         name of the ERP set
 * @param samplingRate    sampling rate in Hz
 * @param xmin            epoch start in seconds
 * @param filename        source file name
 * @param filepath        source file path
 * @param data            the sample sequence as stored in the container, before inversion
 * @param binIndex        1-based bin number
 * @param binDescriptor   bin descriptor
 * @param channelLabel    channel label
 * @param channelLocation channel location record
 * @param argsUsed        the arguments the engine used for the fit
 * @param x0              initial guess of the presearch (shape, rate, y-scaling)
 * @param dataInverted    true if the data was multiplied by -1 before fitting
 */
public record ErpInfo(@NotNull String type, @Nullable String setName, double samplingRate,
                      double xmin, @Nullable String filename, @Nullable String filepath,
                      double @NotNull [] data, int binIndex, @Nullable String binDescriptor,
                      @NotNull String channelLabel, @NotNull ChannelLocation channelLocation,
                      @NotNull Map<String, Object> argsUsed, double @NotNull [] x0,
                      boolean dataInverted) {

  public static final String ERP_INFO_TYPE = "ERP";

  public ErpInfo {
    data = data.clone();
    x0 = x0.clone();
    argsUsed = Collections.unmodifiableMap(new LinkedHashMap<>(argsUsed));
  }

  @Override
  public double @NotNull [] data() {
    return data.clone();
  }

  @Override
  public double @NotNull [] x0() {
    return x0.clone();
  }

  /**
   * @return duration of one sample in seconds
   */
  public double getSamplingInterval() {
    return 1d / samplingRate;
  }

  /**
   * @param sample 1-based sample number
   * @return latency of the sample relative to the time locking event in seconds
   */
  public double getLatency(int sample) {
    return xmin + (sample - 1) * getSamplingInterval();
  }
}
