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

import io.github.gma.parameters.parametertypes.BooleanParameter;
import io.github.gma.parameters.parametertypes.IntegerParameter;

/**
 * Arguments consumed by the ERP adapter itself. Everything else is passed on to the fitting
 * engine unchecked, see {@link ErpFitOptions}.
 */
public final class ErpFitParameters {

  public static final IntegerParameter WINDOW_START = new IntegerParameter("winStart", """
      First data point of the search window for the component of interest (1-based).
      Passed on to the fitting engine.
      """, 1, 1, null);

  /**
   * The default depends on the container and is resolved to the number of samples.
   */
  public static final IntegerParameter WINDOW_LENGTH = new IntegerParameter("winLength", """
      Length of the search window for the component of interest in data points.
      Defaults to the number of samples. Passed on to the fitting engine.
      """, null, 1, null);

  public static final BooleanParameter INVERT_DATA = new BooleanParameter("invertData", """
      Reverse the polarity of the selected channel (data * -1) before it is handed to the
      fitting engine. Use for negative going components.
      """, false);

  private ErpFitParameters() {
  }
}
