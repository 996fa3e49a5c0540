/*
 * Copyright (c) 2024-2025 The gma Development Team
 */

package io.github.gma.datamodel.erp;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ErpContainerTest {

  @Test
  void testDimensions() {
    final double[][][] data = new double[3][100][2];
    data[1][42][1] = 7.5;
    final ErpContainer erp = ErpContainer.builder().data(data).channelLabels("Fz", "Cz", "Pz")
        .binDescriptors("Standard", "Deviant").samplingRate(250).erpName("grand").build();

    Assertions.assertEquals(3, erp.getNumberOfChannels());
    Assertions.assertEquals(100, erp.getNumberOfSamples());
    Assertions.assertEquals(2, erp.getNumberOfBins());
    Assertions.assertEquals(7.5, erp.getValue(1, 42, 1));
    Assertions.assertEquals("Cz", erp.getChannelLocation(2).label());
    Assertions.assertEquals("Deviant", erp.getBinDescriptor(2));
    Assertions.assertTrue(erp.isRectangular());
  }

  @Test
  void testWithoutData() {
    final ErpContainer erp = ErpContainer.builder().build();
    Assertions.assertFalse(erp.hasData());
    Assertions.assertEquals(0, erp.getNumberOfChannels());
    Assertions.assertEquals(0, erp.getNumberOfSamples());
    Assertions.assertEquals(0, erp.getNumberOfBins());
    Assertions.assertFalse(erp.isRectangular());
  }

  @Test
  void testListsAreReadOnly() {
    final ErpContainer erp = ErpContainer.builder().channelLabels("Cz").build();
    Assertions.assertThrows(UnsupportedOperationException.class,
        () -> erp.getChannelLocations().add(ChannelLocation.of("Pz")));
  }

  @Test
  void testChannelLocationCoordinates() {
    Assertions.assertFalse(ChannelLocation.of("Cz").hasCoordinates());
    Assertions.assertTrue(new ChannelLocation("Cz", 90, 0, 0, 0, 1, "EEG").hasCoordinates());
  }

  @Test
  void testChannelLocationRequiresLabel() {
    Assertions.assertThrows(NullPointerException.class, () -> ChannelLocation.of(null));
    Assertions.assertThrows(NullPointerException.class,
        () -> new ChannelLocation(null, 90, 0, 0, 0, 1, "EEG"));
  }
}
