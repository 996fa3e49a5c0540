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

import io.github.gma.datamodel.erp.ErpContainer;
import io.github.gma.datamodel.erp.ErpContainerPredicate;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Rejects containers that are not well-formed or do not carry any data.
 */
public class ErpContainerValidator {

  private final @NotNull ErpContainerPredicate predicate;

  public ErpContainerValidator() {
    this(ErpContainerPredicate.defaultPredicate());
  }

  public ErpContainerValidator(@NotNull ErpContainerPredicate predicate) {
    this.predicate = predicate;
  }

  /**
   * @throws InvalidContainerException if the predicate fails or the data cube is empty
   */
  public void validate(@Nullable ErpContainer container) {
    if (container == null) {
      throw new InvalidContainerException("no container");
    }
    if (!predicate.isValidContainer(container)) {
      throw new InvalidContainerException("structure check failed for " + container);
    }
    if (container.getNumberOfChannels() == 0 || container.getNumberOfSamples() == 0
        || container.getNumberOfBins() == 0) {
      throw new InvalidContainerException("no data in " + container);
    }
  }
}
