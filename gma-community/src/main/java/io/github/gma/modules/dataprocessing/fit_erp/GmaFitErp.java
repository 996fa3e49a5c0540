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
import io.github.gma.modules.dataprocessing.fit_gamma.GmaFitEngine;
import io.github.gma.modules.dataprocessing.fit_gamma.GmaFitOutput;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Fits a Gamma PDF to the data of one channel and bin of an {@link ErpContainer}.
 * <p>
 * The container is validated and the channel and bin are resolved before the engine is called,
 * all of these failures are fatal ({@link ErpFitException}). The selected samples are optionally
 * inverted and handed to the {@link GmaFitEngine} together with the search window and all options
 * but {@link ErpFitOptions#INVERT_DATA}. Afterwards the sampling rate, set name and other meta
 * data are attached to the fit result as {@link io.github.gma.modules.dataprocessing.fit_gamma.ErpInfo}.
 * Attaching is best effort, a failure there only produces a warning.
 * <p>
 * Usage:
 * <pre>{@code
 * GmaFitErp gma = new GmaFitErp(engine);
 * gma.fit(erp, ChannelSelector.of("Cz"), 1);
 * gma.fit(erp, ChannelSelector.of(2), 1, 50, 100,
 *     ErpFitOptions.builder().invertData(true).set(ErpFitOptions.PS_TYPE, "grid").build());
 * }</pre>
 * Instances hold no state between calls.
 */
public class GmaFitErp {

  private static final Logger logger = Logger.getLogger(GmaFitErp.class.getName());

  private final @NotNull GmaFitEngine engine;
  private final @NotNull ErpContainerValidator validator;
  private final @NotNull ChannelResolver channelResolver;
  private final @NotNull BinSelector binSelector;
  private final @NotNull ErpDataExtractor extractor;
  private final @NotNull OptionForwarder forwarder;
  private final @NotNull ResultEnricher enricher;

  public GmaFitErp(@NotNull GmaFitEngine engine) {
    this(engine, new ErpContainerValidator(), new ChannelResolver());
  }

  public GmaFitErp(@NotNull GmaFitEngine engine, @NotNull ErpContainerValidator validator,
      @NotNull ChannelResolver channelResolver) {
    this(engine, validator, channelResolver, new BinSelector(), new ErpDataExtractor(),
        new OptionForwarder(), new ResultEnricher());
  }

  public GmaFitErp(@NotNull GmaFitEngine engine, @NotNull ErpContainerValidator validator,
      @NotNull ChannelResolver channelResolver, @NotNull BinSelector binSelector,
      @NotNull ErpDataExtractor extractor, @NotNull OptionForwarder forwarder,
      @NotNull ResultEnricher enricher) {
    this.engine = engine;
    this.validator = validator;
    this.channelResolver = channelResolver;
    this.binSelector = binSelector;
    this.extractor = extractor;
    this.forwarder = forwarder;
    this.enricher = enricher;
  }

  /**
   * Fits the whole epoch.
   */
  public @NotNull GmaFitErpResult fit(@Nullable ErpContainer erp, @NotNull ChannelSelector channel,
      int bin) {
    return fit(erp, channel, bin, ErpFitParameters.WINDOW_START.getDefaultValue(), null,
        ErpFitOptions.defaults());
  }

  public @NotNull GmaFitErpResult fit(@Nullable ErpContainer erp, @NotNull ChannelSelector channel,
      int bin, @NotNull ErpFitOptions options) {
    return fit(erp, channel, bin, ErpFitParameters.WINDOW_START.getDefaultValue(), null, options);
  }

  /**
   * Searches from {@code winStart} to the end of the epoch.
   */
  public @NotNull GmaFitErpResult fit(@Nullable ErpContainer erp, @NotNull ChannelSelector channel,
      int bin, int winStart) {
    return fit(erp, channel, bin, winStart, null, ErpFitOptions.defaults());
  }

  public @NotNull GmaFitErpResult fit(@Nullable ErpContainer erp, @NotNull ChannelSelector channel,
      int bin, int winStart, int winLength) {
    return fit(erp, channel, bin, winStart, winLength, ErpFitOptions.defaults());
  }

  public @NotNull GmaFitErpResult fit(@Nullable ErpContainer erp, @NotNull ChannelSelector channel,
      int bin, int winStart, int winLength, @NotNull ErpFitOptions options) {
    return fit(erp, channel, bin, winStart, Integer.valueOf(winLength), options);
  }

  /**
   * @param erp       the container, read only
   * @param channel   channel number or label
   * @param bin       1-based bin number
   * @param winStart  1-based first sample of the search window
   * @param winLength length of the search window, null for all samples
   * @param options   invertData and options passed on to the engine
   * @return the engine output, with the provenance attached to the fit result if possible
   * @throws ErpFitException on invalid containers, channels, bins or windows; the engine is not
   *                         called then
   */
  private @NotNull GmaFitErpResult fit(@Nullable ErpContainer erp,
      @NotNull ChannelSelector channel, int bin, int winStart, @Nullable Integer winLength,
      @NotNull ErpFitOptions options) {
    validator.validate(erp);
    final ResolvedChannel resolvedChannel = channelResolver.resolve(channel, erp);
    final ResolvedBin resolvedBin = binSelector.select(bin, erp);
    final FitWindow window = winLength == null ? FitWindow.ofFullLength(winStart,
        erp.getNumberOfSamples()) : new FitWindow(winStart, winLength);

    final boolean invert = options.isInvertData();
    final double[] fitData = extractor.extract(erp, resolvedChannel, resolvedBin, invert);
    // provenance keeps the samples as stored in the container
    final double[] data =
        invert ? extractor.extract(erp, resolvedChannel, resolvedBin) : fitData;

    logger.finest(() -> "Fitting " + erp.getErpName() + " channel " + resolvedChannel.label()
        + " (" + resolvedChannel.index() + "), bin " + resolvedBin.index() + ", window start "
        + window.start() + " length " + window.length() + (invert ? ", inverted" : ""));

    final GmaFitCall call = forwarder.forward(fitData, window, options);
    final GmaFitOutput output = call.invoke(engine);

    final EnrichmentOutcome enrichment = enricher.enrich(output, erp, resolvedChannel,
        resolvedBin, data, invert);
    return new GmaFitErpResult(output.results(), output.x0(), output.argsUsed(), enrichment);
  }
}
