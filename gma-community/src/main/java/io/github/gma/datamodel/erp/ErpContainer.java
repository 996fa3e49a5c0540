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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Averaged ERP data of one subject or grand average. The data cube is indexed as
 * {@code [channel][sample][bin]} (0-based in Java). Channel and bin numbers used by the fitting
 * modules are 1-based.
 * <p>
 * The container does not enforce structural consistency on construction, use an
 * {@link ErpContainerPredicate} to check a candidate. The data cube is not copied, callers must
 * not modify it after handing it over.
 */
public class ErpContainer {

  private final double[][][] data;
  private final @NotNull List<ChannelLocation> channelLocations;
  private final @NotNull List<String> binDescriptors;
  private final double samplingRate;
  private final double xmin;
  private final @Nullable String erpName;
  private final @Nullable String filename;
  private final @Nullable String filepath;

  private ErpContainer(Builder builder) {
    this.data = builder.data;
    this.channelLocations = Collections.unmodifiableList(new ArrayList<>(builder.channelLocations));
    this.binDescriptors = Collections.unmodifiableList(new ArrayList<>(builder.binDescriptors));
    this.samplingRate = builder.samplingRate;
    this.xmin = builder.xmin;
    this.erpName = builder.erpName;
    this.filename = builder.filename;
    this.filepath = builder.filepath;
  }

  public static @NotNull Builder builder() {
    return new Builder();
  }

  public boolean hasData() {
    return data != null;
  }

  public int getNumberOfChannels() {
    return data == null ? 0 : data.length;
  }

  /**
   * @return the number of samples of the first channel, 0 if there is no data
   */
  public int getNumberOfSamples() {
    if (data == null || data.length == 0 || data[0] == null) {
      return 0;
    }
    return data[0].length;
  }

  /**
   * @return the number of bins of the first sample of the first channel, 0 if there is no data
   */
  public int getNumberOfBins() {
    if (getNumberOfSamples() == 0 || data[0][0] == null) {
      return 0;
    }
    return data[0][0].length;
  }

  /**
   * @param channel 0-based channel index
   * @param sample  0-based sample index
   * @param bin     0-based bin index
   */
  public double getValue(int channel, int sample, int bin) {
    return data[channel][sample][bin];
  }

  /**
   * @return true if every channel has the same number of samples and every sample the same number
   * of bins
   */
  public boolean isRectangular() {
    if (data == null) {
      return false;
    }
    final int samples = getNumberOfSamples();
    final int bins = getNumberOfBins();
    for (double[][] channel : data) {
      if (channel == null || channel.length != samples) {
        return false;
      }
      for (double[] sample : channel) {
        if (sample == null || sample.length != bins) {
          return false;
        }
      }
    }
    return true;
  }

  public @NotNull List<ChannelLocation> getChannelLocations() {
    return channelLocations;
  }

  /**
   * @param channel 1-based channel number
   */
  public @NotNull ChannelLocation getChannelLocation(int channel) {
    return channelLocations.get(channel - 1);
  }

  public @NotNull List<String> getBinDescriptors() {
    return binDescriptors;
  }

  /**
   * @param bin 1-based bin number
   */
  public @NotNull String getBinDescriptor(int bin) {
    return binDescriptors.get(bin - 1);
  }

  public double getSamplingRate() {
    return samplingRate;
  }

  /**
   * @return epoch start in seconds relative to the time locking event
   */
  public double getXmin() {
    return xmin;
  }

  public @Nullable String getErpName() {
    return erpName;
  }

  public @Nullable String getFilename() {
    return filename;
  }

  public @Nullable String getFilepath() {
    return filepath;
  }

  @Override
  public String toString() {
    return "ErpContainer{" + erpName + ", channels=" + getNumberOfChannels() + ", samples="
        + getNumberOfSamples() + ", bins=" + getNumberOfBins() + ", srate=" + samplingRate + '}';
  }

  public static class Builder {

    private double[][][] data;
    private List<ChannelLocation> channelLocations = List.of();
    private List<String> binDescriptors = List.of();
    private double samplingRate = Double.NaN;
    private double xmin;
    private String erpName;
    private String filename;
    private String filepath;

    private Builder() {
    }

    public Builder data(double[][][] data) {
      this.data = data;
      return this;
    }

    public Builder channelLocations(@NotNull List<ChannelLocation> channelLocations) {
      this.channelLocations = channelLocations;
      return this;
    }

    public Builder channelLabels(@NotNull String... labels) {
      this.channelLocations = Arrays.stream(labels).map(ChannelLocation::of).toList();
      return this;
    }

    public Builder binDescriptors(@NotNull List<String> binDescriptors) {
      this.binDescriptors = binDescriptors;
      return this;
    }

    public Builder binDescriptors(@NotNull String... binDescriptors) {
      this.binDescriptors = List.of(binDescriptors);
      return this;
    }

    public Builder samplingRate(double samplingRate) {
      this.samplingRate = samplingRate;
      return this;
    }

    public Builder xmin(double xmin) {
      this.xmin = xmin;
      return this;
    }

    public Builder erpName(@Nullable String erpName) {
      this.erpName = erpName;
      return this;
    }

    public Builder filename(@Nullable String filename) {
      this.filename = filename;
      return this;
    }

    public Builder filepath(@Nullable String filepath) {
      this.filepath = filepath;
      return this;
    }

    public ErpContainer build() {
      return new ErpContainer(this);
    }
  }
}
