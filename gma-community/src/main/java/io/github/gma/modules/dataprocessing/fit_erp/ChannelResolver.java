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
import io.github.gma.datamodel.erp.ChannelLabelLookup;
import io.github.gma.datamodel.erp.ChannelLocation;
import io.github.gma.datamodel.erp.ErpContainer;
import java.util.OptionalInt;
import org.jetbrains.annotations.NotNull;

/**
 * Maps a {@link ChannelSelector} to the channel number, label and location within a container.
 */
public class ChannelResolver {

  private final @NotNull ChannelLabelLookup labelLookup;

  public ChannelResolver() {
    this(ChannelLabelLookup.ignoringCase());
  }

  public ChannelResolver(@NotNull ChannelLabelLookup labelLookup) {
    this.labelLookup = labelLookup;
  }

  /**
   * @throws ChannelIndexOutOfRangeException if a channel number is outside 1 ... channel count
   * @throws ChannelNotFoundException        if no channel carries the label
   */
  public @NotNull ResolvedChannel resolve(@NotNull ChannelSelector selector,
      @NotNull ErpContainer container) {
    if (selector instanceof ChannelSelector.Index index) {
      return resolveIndex(index.channel(), container);
    }
    if (selector instanceof ChannelSelector.Label label) {
      return resolveLabel(label.label(), container);
    }
    throw new IllegalArgumentException("Unsupported channel selector " + selector);
  }

  private ResolvedChannel resolveIndex(int channel, ErpContainer container) {
    final Range<Integer> valid = IndexRanges.oneBased(container.getNumberOfChannels());
    if (!valid.contains(channel)) {
      throw new ChannelIndexOutOfRangeException(channel, valid);
    }
    final ChannelLocation location = container.getChannelLocation(channel);
    return new ResolvedChannel(channel, location.label(), location);
  }

  private ResolvedChannel resolveLabel(String label, ErpContainer container) {
    final OptionalInt channel = labelLookup.resolveLabelToIndex(container, label);
    if (channel.isEmpty()) {
      throw new ChannelNotFoundException(label);
    }
    // guard against lookups that do not respect the container bounds
    return resolveIndex(channel.getAsInt(), container);
  }
}
