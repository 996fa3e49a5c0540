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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;

/**
 * Named options of an ERP fit. {@link #INVERT_DATA} is consumed by the adapter, all other options
 * are passed on to the fitting engine in insertion order without validation, so options the
 * engine adds later need no change here.
 */
public final class ErpFitOptions {

  public static final String INVERT_DATA = ErpFitParameters.INVERT_DATA.getName();

  /**
   * Keys consumed by the adapter and never forwarded.
   */
  public static final ImmutableSet<String> RESERVED_KEYS = ImmutableSet.of(INVERT_DATA);

  // options known to be accepted by the Gamma model fitting engine
  public static final String OPTIMIZE_FULL = "optimizeFull";
  public static final String SEG_MIN_LENGTH = "segMinLength";
  public static final String SEG_PAD = "segPad";
  public static final String SEG_EXTENSION = "segExtension";
  public static final String MAX_SRC_IT = "maxSrcIt";
  public static final String LOG_ENABLED = "logEnabled";
  public static final String LOG_SRC = "logSrc";
  public static final String LOG_FN = "logFn";
  public static final String COST_FN = "costFn";
  public static final String PS_TYPE = "psType";
  public static final String PS_MAX_IT = "psMaxIt";
  public static final String XTOL = "xtol";
  public static final String FTOL = "ftol";

  public static final ImmutableSet<String> KNOWN_ENGINE_OPTIONS = ImmutableSet.of(OPTIMIZE_FULL,
      SEG_MIN_LENGTH, SEG_PAD, SEG_EXTENSION, MAX_SRC_IT, LOG_ENABLED, LOG_SRC, LOG_FN, COST_FN,
      PS_TYPE, PS_MAX_IT, XTOL, FTOL);

  private static final ErpFitOptions DEFAULTS = builder().build();

  private final boolean invertData;
  private final @NotNull ImmutableMap<String, Object> passThroughOptions;

  private ErpFitOptions(Builder builder) {
    this.invertData = builder.invertData;
    this.passThroughOptions = ImmutableMap.copyOf(builder.passThroughOptions);
  }

  public static @NotNull ErpFitOptions defaults() {
    return DEFAULTS;
  }

  public static @NotNull Builder builder() {
    return new Builder();
  }

  public boolean isInvertData() {
    return invertData;
  }

  /**
   * @return all options except the reserved keys
   */
  public @NotNull ImmutableMap<String, Object> getPassThroughOptions() {
    return passThroughOptions;
  }

  public @NotNull Optional<Object> getPassThroughOption(@NotNull String name) {
    return Optional.ofNullable(passThroughOptions.get(name));
  }

  public @NotNull Builder toBuilder() {
    final Builder builder = builder().invertData(invertData);
    builder.passThroughOptions.putAll(passThroughOptions);
    return builder;
  }

  @Override
  public String toString() {
    return "ErpFitOptions{" + INVERT_DATA + "=" + invertData + ", " + passThroughOptions + '}';
  }

  public static class Builder {

    private boolean invertData = ErpFitParameters.INVERT_DATA.getDefaultValue();
    private final Map<String, Object> passThroughOptions = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder invertData(boolean invertData) {
      this.invertData = invertData;
      return this;
    }

    /**
     * Sets an option by name. {@link #INVERT_DATA} is accepted as a raw key and must carry a
     * Boolean.
     */
    public Builder set(@NotNull String name, @NotNull Object value) {
      Preconditions.checkNotNull(name, "option name");
      Preconditions.checkNotNull(value, "value of option %s", name);
      if (INVERT_DATA.equals(name)) {
        Preconditions.checkArgument(value instanceof Boolean, "%s must be a Boolean but was %s",
            name, value.getClass().getSimpleName());
        return invertData((Boolean) value);
      }
      passThroughOptions.put(name, value);
      return this;
    }

    public Builder setAll(@NotNull Map<String, ?> options) {
      options.forEach(this::set);
      return this;
    }

    public ErpFitOptions build() {
      return new ErpFitOptions(this);
    }
  }
}
