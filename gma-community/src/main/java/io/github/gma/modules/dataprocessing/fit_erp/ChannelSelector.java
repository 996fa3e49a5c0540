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

import com.google.common.base.Preconditions;
import org.jetbrains.annotations.NotNull;

/**
 * Selects a channel either by its 1-based number or by its label.
 */
public sealed interface ChannelSelector {

  static @NotNull ChannelSelector of(int channel) {
    return new Index(channel);
  }

  static @NotNull ChannelSelector of(@NotNull String label) {
    return new Label(label);
  }

  /**
   * @param channel 1-based channel number, range checked on resolution
   */
  record Index(int channel) implements ChannelSelector {

    @Override
    public String toString() {
      return Integer.toString(channel);
    }
  }

  record Label(@NotNull String label) implements ChannelSelector {

    public Label {
      Preconditions.checkNotNull(label, "label");
    }

    @Override
    public String toString() {
      return label;
    }
  }
}
