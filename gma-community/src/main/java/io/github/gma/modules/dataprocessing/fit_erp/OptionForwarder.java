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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Assembles the arguments of the fitting engine call. Only the window is checked here, the
 * engine validates its own options.
 */
public class OptionForwarder {

  private static final Logger logger = Logger.getLogger(OptionForwarder.class.getName());

  public @NotNull GmaFitCall forward(double @NotNull [] data, @NotNull FitWindow window,
      @NotNull ErpFitOptions options) {
    final ImmutableMap<String, Object> forwarded = ImmutableMap.copyOf(
        Maps.filterKeys(options.getPassThroughOptions(),
            name -> !ErpFitOptions.RESERVED_KEYS.contains(name)));
    for (String name : forwarded.keySet()) {
      if (!ErpFitOptions.KNOWN_ENGINE_OPTIONS.contains(name)) {
        logger.fine(() -> "Forwarding option unknown to the adapter: " + name);
      }
    }
    return new GmaFitCall(data, window, forwarded);
  }
}
