/*
 * Copyright (c) 2024-2025 The gma Development Team
 */

package io.github.gma.modules.dataprocessing.fit_erp;

import io.github.gma.datamodel.erp.ErpContainer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ErpContainerValidatorTest {

  private final ErpContainerValidator validator = new ErpContainerValidator();

  @Test
  void testValidContainer() {
    Assertions.assertDoesNotThrow(() -> validator.validate(ErpTestData.erp()));
  }

  @Test
  void testNullContainer() {
    final InvalidContainerException e = Assertions.assertThrows(InvalidContainerException.class,
        () -> validator.validate(null));
    Assertions.assertEquals("gmaFitErp:invalidStruct", e.getIdentifier());
  }

  @Test
  void testPredicateRejects() {
    final ErpContainerValidator rejecting = new ErpContainerValidator(c -> false);
    Assertions.assertThrows(InvalidContainerException.class,
        () -> rejecting.validate(ErpTestData.erp()));
  }

  @Test
  void testNoBins() {
    final ErpContainer erp = ErpContainer.builder().data(new double[2][10][0])
        .channelLabels("Fz", "Cz").samplingRate(250).build();
    Assertions.assertThrows(InvalidContainerException.class, () -> validator.validate(erp));
  }

  @Test
  void testNoChannels() {
    final ErpContainer erp = ErpContainer.builder().data(new double[0][][]).samplingRate(250)
        .build();
    Assertions.assertThrows(InvalidContainerException.class, () -> validator.validate(erp));
  }

  @Test
  void testNoSamples() {
    final ErpContainer erp = ErpContainer.builder().data(new double[1][0][]).channelLabels("Cz")
        .samplingRate(250).build();
    Assertions.assertThrows(InvalidContainerException.class, () -> validator.validate(erp));
  }

  @Test
  void testNullContainerWithPermissivePredicate() {
    final ErpContainerValidator permissive = new ErpContainerValidator(c -> true);
    Assertions.assertThrows(InvalidContainerException.class, () -> permissive.validate(null));
  }
}
