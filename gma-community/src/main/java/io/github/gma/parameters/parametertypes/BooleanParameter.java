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

package io.github.gma.parameters.parametertypes;

import io.github.gma.parameters.Parameter;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class BooleanParameter implements Parameter<Boolean> {

  private final @NotNull String name;
  private final @NotNull String description;
  private final boolean defaultValue;

  public BooleanParameter(@NotNull String name, @NotNull String description,
      boolean defaultValue) {
    this.name = name;
    this.description = description;
    this.defaultValue = defaultValue;
  }

  @Override
  public @NotNull String getName() {
    return name;
  }

  @Override
  public @NotNull String getDescription() {
    return description;
  }

  @Override
  public @NotNull Boolean getDefaultValue() {
    return defaultValue;
  }

  /**
   * @return the value, or the default if the value is null
   */
  public boolean getValueOrDefault(@Nullable Boolean value) {
    return value != null ? value : defaultValue;
  }

  @Override
  public boolean checkValue(@Nullable Boolean value, @NotNull Collection<String> errorMessages) {
    // unset falls back to the default
    return true;
  }

  @Override
  public String toString() {
    return name;
  }
}
