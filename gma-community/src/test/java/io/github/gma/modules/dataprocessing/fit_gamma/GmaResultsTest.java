/*
 * Copyright (c) 2024-2025 The gma Development Team
 */

package io.github.gma.modules.dataprocessing.fit_gamma;

import com.google.common.collect.Range;
import io.github.gma.datamodel.erp.ChannelLocation;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GmaResultsTest {

  private static ErpInfo info(String label) {
    return new ErpInfo(ErpInfo.ERP_INFO_TYPE, "set", 250, -0.2, "f.erp", "/tmp",
        new double[]{1, 2, 3}, 1, "Standard", label, ChannelLocation.of(label), Map.of("xtol", 1e-6),
        new double[]{4, 0.2, 1}, false);
  }

  @Test
  void testDerivedValues() {
    final GmaResults results = new GmaResults(5, 0.25, 2, 10, 100);
    Assertions.assertEquals(16, results.getMode(), 1e-12);
    Assertions.assertEquals(20, results.getMean(), 1e-12);
    Assertions.assertEquals(4, results.getScale(), 1e-12);
    Assertions.assertEquals(2 / Math.sqrt(5), results.getSkewness(), 1e-12);
    Assertions.assertEquals(Range.closedOpen(10, 110), results.getWindow());
  }

  @Test
  void testModeBelowShapeOne() {
    Assertions.assertEquals(0, new GmaResults(0.5, 1, 1, 1, 10).getMode());
  }

  @Test
  void testFittedCurvePeaksAtMode() {
    final GmaResults results = new GmaResults(5, 0.25, 2, 1, 100);
    final double[] curve = results.getFittedCurve(100);
    int apex = 0;
    for (int i = 1; i < curve.length; i++) {
      if (curve[i] > curve[apex]) {
        apex = i;
      }
    }
    Assertions.assertEquals(16, apex);
    Assertions.assertTrue(curve[apex] > 0);
  }

  @Test
  void testInvalidParameters() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new GmaResults(0, 1, 1, 1, 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new GmaResults(1, -1, 1, 1, 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new GmaResults(1, 1, 1, 0, 1));
  }

  @Test
  void testErpInfoByChannel() {
    final GmaResults results = new GmaResults(5, 0.25, 2, 1, 100);
    results.addErpInfo(info("Pz"), 3);
    results.addErpInfo(info("Fz"), 1);
    results.addErpInfo(info("Pz2"), 3);

    Assertions.assertEquals(List.of(1, 3), List.copyOf(results.getErpInfos().keySet()));
    Assertions.assertEquals("Pz2", results.getErpInfo(3).channelLabel());
    Assertions.assertNull(results.getErpInfo(2));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> results.addErpInfo(info("x"), 0));
  }

  @Test
  void testErpInfoCopiesArrays() {
    final double[] data = {1, 2, 3};
    final ErpInfo info = new ErpInfo(ErpInfo.ERP_INFO_TYPE, null, 100, 0, null, null, data, 1,
        null, "Cz", ChannelLocation.of("Cz"), Map.of(), new double[0], false);
    data[0] = 99;
    info.data()[1] = 99;
    Assertions.assertArrayEquals(new double[]{1, 2, 3}, info.data());
  }

  @Test
  void testErpInfoLatency() {
    final ErpInfo info = info("Cz");
    Assertions.assertEquals(0.004, info.getSamplingInterval(), 1e-12);
    Assertions.assertEquals(-0.2, info.getLatency(1), 1e-12);
    Assertions.assertEquals(0.0, info.getLatency(51), 1e-12);
  }

  @Test
  void testWindowNearIntegerLimit() {
    final GmaResults results = new GmaResults(5, 0.25, 2, Integer.MAX_VALUE - 10, 100);
    Assertions.assertEquals(Range.closedOpen(Integer.MAX_VALUE - 10, Integer.MAX_VALUE),
        results.getWindow());
    Assertions.assertTrue(results.toString().contains("winLength=100"));
  }
}
