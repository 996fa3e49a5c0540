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
import io.github.gma.modules.dataprocessing.fit_gamma.ErpInfo;
import io.github.gma.modules.dataprocessing.fit_gamma.FitResult;
import io.github.gma.modules.dataprocessing.fit_gamma.GmaFitOutput;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Attaches an {@link ErpInfo} to the fit result. Provenance is best effort: any failure is logged
 * as a single warning and reported in the outcome, the fit result itself is left as it is.
 */
public class ResultEnricher {

  private static final Logger logger = Logger.getLogger(ResultEnricher.class.getName());

  /**
   * @param data         the samples as extracted from the container, before inversion
   * @param dataInverted true if the engine received the inverted samples
   */
  public @NotNull EnrichmentOutcome enrich(@NotNull GmaFitOutput output,
      @NotNull ErpContainer container, @NotNull ResolvedChannel channel, @NotNull ResolvedBin bin,
      double @NotNull [] data, boolean dataInverted) {
    try {
      final ErpInfo info = new ErpInfo(ErpInfo.ERP_INFO_TYPE, container.getErpName(),
          container.getSamplingRate(), container.getXmin(), container.getFilename(),
          container.getFilepath(), data, bin.index(), container.getBinDescriptor(bin.index()),
          channel.label(), channel.location(),
          Objects.requireNonNullElse(output.argsUsed(), Map.of()),
          Objects.requireNonNullElse(output.x0(), new double[0]), dataInverted);
      final FitResult results = Objects.requireNonNull(output.results(),
          "The fitting engine returned no result");
      results.addErpInfo(info, channel.index());
      return new EnrichmentOutcome.Attached(info);
    } catch (RuntimeException e) {
      final ErpFitWarning warning = ErpFitWarning.of(e);
      logger.log(Level.WARNING,
          "Adding ERP info to GmaResults failed (" + warning.identifier() + "). Error: "
              + warning.message(), e);
      return new EnrichmentOutcome.Recovered(warning);
    }
  }
}
