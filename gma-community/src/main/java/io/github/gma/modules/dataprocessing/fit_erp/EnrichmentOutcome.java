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

import io.github.gma.modules.dataprocessing.fit_gamma.ErpInfo;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;

/**
 * Outcome of attaching the provenance record to a fit result.
 */
public sealed interface EnrichmentOutcome {

  boolean isAttached();

  @NotNull Optional<ErpFitWarning> getWarning();

  record Attached(@NotNull ErpInfo info) implements EnrichmentOutcome {

    @Override
    public boolean isAttached() {
      return true;
    }

    @Override
    public @NotNull Optional<ErpFitWarning> getWarning() {
      return Optional.empty();
    }
  }

  record Recovered(@NotNull ErpFitWarning warning) implements EnrichmentOutcome {

    @Override
    public boolean isAttached() {
      return false;
    }

    @Override
    public @NotNull Optional<ErpFitWarning> getWarning() {
      return Optional.of(warning);
    }
  }
}
