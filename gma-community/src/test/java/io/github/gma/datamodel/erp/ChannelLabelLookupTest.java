/*
 * Copyright (c) 2024-2025 The gma Development Team
 */

package io.github.gma.datamodel.erp;

import java.util.OptionalInt;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ChannelLabelLookupTest {

  private final ErpContainer erp = ErpContainer.builder().data(new double[4][1][1])
      .channelLabels("Fz", "Cz", "VEOG", "cz").binDescriptors("a").samplingRate(100).build();

  @Test
  void testIgnoringCase() {
    final ChannelLabelLookup lookup = ChannelLabelLookup.ignoringCase();
    Assertions.assertEquals(OptionalInt.of(3), lookup.resolveLabelToIndex(erp, "veog"));
    Assertions.assertEquals(OptionalInt.of(1), lookup.resolveLabelToIndex(erp, " FZ "));
    Assertions.assertEquals(OptionalInt.empty(), lookup.resolveLabelToIndex(erp, "Oz"));
  }

  @Test
  void testDuplicatesFirstMatchWins() {
    Assertions.assertEquals(OptionalInt.of(2),
        ChannelLabelLookup.ignoringCase().resolveLabelToIndex(erp, "CZ"));
  }

  @Test
  void testExact() {
    final ChannelLabelLookup lookup = ChannelLabelLookup.exact();
    Assertions.assertEquals(OptionalInt.of(2), lookup.resolveLabelToIndex(erp, "Cz"));
    Assertions.assertEquals(OptionalInt.of(4), lookup.resolveLabelToIndex(erp, "cz"));
    Assertions.assertEquals(OptionalInt.empty(), lookup.resolveLabelToIndex(erp, "CZ"));
  }
}
