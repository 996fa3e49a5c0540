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

import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import org.jetbrains.annotations.NotNull;

/**
 * Resolves a channel label to its 1-based channel number. Duplicate labels are allowed, the first
 * match wins.
 */
@FunctionalInterface
public interface ChannelLabelLookup {

  /**
   * @return the 1-based channel number or empty if no channel carries the label
   */
  @NotNull OptionalInt resolveLabelToIndex(@NotNull ErpContainer container, @NotNull String label);

  /**
   * Trimmed, case-insensitive comparison ("cz" matches "Cz").
   */
  static @NotNull ChannelLabelLookup ignoringCase() {
    return (container, label) -> firstMatch(container.getChannelLocations(),
        label.trim().toLowerCase(Locale.ROOT), true);
  }

  /**
   * Exact, case-sensitive comparison.
   */
  static @NotNull ChannelLabelLookup exact() {
    return (container, label) -> firstMatch(container.getChannelLocations(), label, false);
  }

  private static OptionalInt firstMatch(List<ChannelLocation> locations, String label,
      boolean normalize) {
    for (int i = 0; i < locations.size(); i++) {
      String candidate = locations.get(i).label();
      if (normalize) {
        candidate = candidate.trim().toLowerCase(Locale.ROOT);
      }
      if (candidate.equals(label)) {
        return OptionalInt.of(i + 1);
      }
    }
    return OptionalInt.empty();
  }
}
