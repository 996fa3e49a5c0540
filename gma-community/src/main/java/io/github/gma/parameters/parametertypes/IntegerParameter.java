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

public class IntegerParameter implements Parameter<Integer> {

  private final @NotNull String name;
  private final @NotNull String description;
  private final @Nullable Integer defaultValue;
  private final @Nullable Integer minimum;
  private final @Nullable Integer maximum;

  public IntegerParameter(@NotNull String name, @NotNull String description,
      @Nullable Integer defaultValue) {
    this(name, description, defaultValue, null, null);
  }

  public IntegerParameter(@NotNull String name, @NotNull String description,
      @Nullable Integer defaultValue, @Nullable Integer minimum, @Nullable Integer maximum) {
    this.name = name;
    this.description = description;
    this.defaultValue = defaultValue;
    this.minimum = minimum;
    this.maximum = maximum;
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
  public @Nullable Integer getDefaultValue() {
    return defaultValue;
  }

  @Override
  public boolean checkValue(@Nullable Integer value, @NotNull Collection<String> errorMessages) {
    if (value == null) {
      errorMessages.add(name + " is not set");
      return false;
    }
    if (minimum != null && value < minimum) {
      errorMessages.add(name + " lies outside its bounds: " + value + " < " + minimum);
      return false;
    }
    if (maximum != null && value > maximum) {
      errorMessages.add(name + " lies outside its bounds: " + value + " > " + maximum);
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return name;
  }
}
