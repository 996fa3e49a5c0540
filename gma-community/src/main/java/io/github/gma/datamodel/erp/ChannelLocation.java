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

import com.google.common.base.Preconditions;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Location record of a single EEG channel. Only the label is mandatory, polar and cartesian
 * coordinates are {@link Double#NaN} if unknown.
 *
 * @param label  channel label, e.g. "Cz"
 * @param theta  polar angle in degrees
 * @param radius polar radius
 * @param x      cartesian x
 * @param y      cartesian y
 * @param z      cartesian z
 * @param type   channel type, e.g. "EEG" or "EOG"
 */
public record ChannelLocation(@NotNull String label, double theta, double radius, double x,
                              double y, double z, @Nullable String type) {

  public ChannelLocation {
    Preconditions.checkNotNull(label, "channel label");
  }

  public static @NotNull ChannelLocation of(@NotNull String label) {
    return new ChannelLocation(label, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
        null);
  }

  public boolean hasCoordinates() {
    return !Double.isNaN(x) && !Double.isNaN(y) && !Double.isNaN(z);
  }
}
