/*
 * Copyright (c) 2024-2025 The gma Development Team
 */

package io.github.gma.modules.dataprocessing.fit_erp;

import io.github.gma.datamodel.erp.ErpContainer;
import io.github.gma.modules.dataprocessing.fit_gamma.ErpInfo;
import io.github.gma.modules.dataprocessing.fit_gamma.FitResult;
import io.github.gma.modules.dataprocessing.fit_gamma.GmaResults;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GmaFitErpTest {

  private final ErpContainer erp = ErpTestData.erp();

  @Test
  void testFitByChannelNumber() {
    final RecordingGmaFitEngine engine = new RecordingGmaFitEngine();
    final GmaFitErpResult result = new GmaFitErp(engine).fit(erp, ChannelSelector.of(2), 1, 1,
        100, ErpFitOptions.builder().invertData(false).build());

    Assertions.assertEquals(1, engine.calls);
    Assertions.assertArrayEquals(ErpTestData.samples(2, 1), engine.data);
    Assertions.assertEquals(1, engine.winStart);
    Assertions.assertEquals(100, engine.winLength);
    Assertions.assertTrue(engine.options.isEmpty());

    Assertions.assertSame(engine.lastOutput.results(), result.results());
    Assertions.assertSame(engine.lastOutput.x0(), result.x0());
    Assertions.assertSame(engine.lastOutput.argsUsed(), result.argsUsed());
    Assertions.assertTrue(result.enrichment().isAttached());

    final ErpInfo info = ((GmaResults) result.results()).getErpInfo(2);
    Assertions.assertNotNull(info);
    Assertions.assertEquals("Cz", info.channelLabel());
    Assertions.assertEquals(1, info.binIndex());
    Assertions.assertEquals("Standard", info.binDescriptor());
    Assertions.assertArrayEquals(ErpTestData.samples(2, 1), info.data());
    Assertions.assertArrayEquals(RecordingGmaFitEngine.X0, info.x0());
    Assertions.assertEquals(100, info.argsUsed().get("winLength"));
    Assertions.assertFalse(info.dataInverted());
  }

  @Test
  void testFitByLabelMatchesFitByNumber() {
    final RecordingGmaFitEngine byNumber = new RecordingGmaFitEngine();
    final RecordingGmaFitEngine byLabel = new RecordingGmaFitEngine();
    final GmaFitErpResult numbered = new GmaFitErp(byNumber).fit(erp, ChannelSelector.of(2), 1,
        1, 100);
    final GmaFitErpResult labeled = new GmaFitErp(byLabel).fit(erp, ChannelSelector.of("Cz"), 1,
        1, 100);

    Assertions.assertArrayEquals(byNumber.data, byLabel.data);
    Assertions.assertEquals(byNumber.winStart, byLabel.winStart);
    Assertions.assertEquals(byNumber.winLength, byLabel.winLength);
    final ErpInfo fromNumber = ((GmaResults) numbered.results()).getErpInfo(2);
    final ErpInfo fromLabel = ((GmaResults) labeled.results()).getErpInfo(2);
    Assertions.assertNotNull(fromLabel);
    Assertions.assertEquals(fromNumber.channelLabel(), fromLabel.channelLabel());
    Assertions.assertEquals(fromNumber.channelLocation(), fromLabel.channelLocation());
  }

  @Test
  void testDefaultWindowCoversAllSamples() {
    final RecordingGmaFitEngine engine = new RecordingGmaFitEngine();
    new GmaFitErp(engine).fit(erp, ChannelSelector.of("Pz"), 2);
    Assertions.assertEquals(1, engine.winStart);
    Assertions.assertEquals(ErpTestData.SAMPLES, engine.winLength);

    new GmaFitErp(engine).fit(erp, ChannelSelector.of("Pz"), 2, 50);
    Assertions.assertEquals(50, engine.winStart);
    Assertions.assertEquals(ErpTestData.SAMPLES, engine.winLength);
  }

  @Test
  void testInvertedDataIsForwardedAndOriginalIsRecorded() {
    final RecordingGmaFitEngine engine = new RecordingGmaFitEngine();
    final ErpFitOptions options = ErpFitOptions.builder().invertData(true)
        .set(ErpFitOptions.PS_TYPE, "grid").set(ErpFitOptions.MAX_SRC_IT, 3).build();
    final GmaFitErpResult result = new GmaFitErp(engine).fit(erp, ChannelSelector.of(1), 2,
        options);

    final double[] original = ErpTestData.samples(1, 2);
    for (int i = 0; i < original.length; i++) {
      Assertions.assertEquals(-1 * original[i], engine.data[i]);
    }
    Assertions.assertEquals(Map.of("psType", "grid", "maxSrcIt", 3), engine.options);

    final ErpInfo info = ((GmaResults) result.results()).getErpInfo(1);
    Assertions.assertArrayEquals(original, info.data());
    Assertions.assertTrue(info.dataInverted());
    Assertions.assertFalse(info.argsUsed().containsKey("invertData"));
  }

  @Test
  void testEmptyContainerFailsBeforeEngineCall() {
    final RecordingGmaFitEngine engine = new RecordingGmaFitEngine();
    final ErpContainer empty = ErpContainer.builder().data(new double[3][100][0])
        .channelLabels("Fz", "Cz", "Pz").samplingRate(250).build();

    Assertions.assertThrows(InvalidContainerException.class,
        () -> new GmaFitErp(engine).fit(empty, ChannelSelector.of(1), 1));
    Assertions.assertThrows(InvalidContainerException.class,
        () -> new GmaFitErp(engine).fit(null, ChannelSelector.of(1), 1));
    Assertions.assertEquals(0, engine.calls);
  }

  @Test
  void testSelectionErrorsFailBeforeEngineCall() {
    final RecordingGmaFitEngine engine = new RecordingGmaFitEngine();
    final GmaFitErp gma = new GmaFitErp(engine);

    Assertions.assertThrows(ChannelIndexOutOfRangeException.class,
        () -> gma.fit(erp, ChannelSelector.of(0), 1));
    Assertions.assertThrows(ChannelIndexOutOfRangeException.class,
        () -> gma.fit(erp, ChannelSelector.of(4), 1));
    Assertions.assertThrows(ChannelNotFoundException.class,
        () -> gma.fit(erp, ChannelSelector.of("Oz"), 1));
    Assertions.assertThrows(BinIndexOutOfRangeException.class,
        () -> gma.fit(erp, ChannelSelector.of(1), 0));
    Assertions.assertThrows(BinIndexOutOfRangeException.class,
        () -> gma.fit(erp, ChannelSelector.of(1), 3));
    Assertions.assertThrows(InvalidFitWindowException.class,
        () -> gma.fit(erp, ChannelSelector.of(1), 1, 0));
    Assertions.assertThrows(InvalidFitWindowException.class,
        () -> gma.fit(erp, ChannelSelector.of(1), 1, 1, 0));
    Assertions.assertEquals(0, engine.calls);
  }

  @Test
  void testFailingAttachmentKeepsEngineOutput() {
    final FitResult broken = (info, channel) -> {
      throw new UnsupportedOperationException("no ERP info support");
    };
    final RecordingGmaFitEngine engine = new RecordingGmaFitEngine(() -> broken);

    try (WarningCollector collector = new WarningCollector(ResultEnricher.class)) {
      final GmaFitErpResult result = new GmaFitErp(engine).fit(erp, ChannelSelector.of(2), 1);

      Assertions.assertSame(broken, result.results());
      Assertions.assertSame(engine.lastOutput.x0(), result.x0());
      Assertions.assertArrayEquals(RecordingGmaFitEngine.X0, result.x0());
      Assertions.assertSame(engine.lastOutput.argsUsed(), result.argsUsed());
      Assertions.assertFalse(result.enrichment().isAttached());
      Assertions.assertEquals("no ERP info support",
          result.enrichment().getWarning().orElseThrow().message());
      Assertions.assertEquals(1, collector.warnings.size());
    }
  }

  @Test
  void testEngineErrorsPropagate() {
    final IllegalArgumentException failure = new IllegalArgumentException("psType unknown");
    final GmaFitErp gma = new GmaFitErp((data, winStart, winLength, options) -> {
      throw failure;
    });
    final IllegalArgumentException thrown = Assertions.assertThrows(
        IllegalArgumentException.class, () -> gma.fit(erp, ChannelSelector.of(1), 1));
    Assertions.assertSame(failure, thrown);
  }

  @Test
  void testContainerIsNotModified() {
    final RecordingGmaFitEngine engine = new RecordingGmaFitEngine();
    new GmaFitErp(engine).fit(erp, ChannelSelector.of(3), 2,
        ErpFitOptions.builder().invertData(true).build());
    engine.data[0] = 0;
    Assertions.assertEquals(ErpTestData.value(2, 0, 1), erp.getValue(2, 0, 1));
  }

  @Test
  void testWindowNearIntegerLimitWithFinestLogging() {
    final Logger logger = Logger.getLogger(GmaFitErp.class.getName());
    final Level previous = logger.getLevel();
    logger.setLevel(Level.FINEST);
    try {
      final RecordingGmaFitEngine engine = new RecordingGmaFitEngine();
      new GmaFitErp(engine).fit(erp, ChannelSelector.of(1), 1, Integer.MAX_VALUE - 10, 100);
      Assertions.assertEquals(1, engine.calls);
      Assertions.assertEquals(Integer.MAX_VALUE - 10, engine.winStart);
      Assertions.assertEquals(100, engine.winLength);
    } finally {
      logger.setLevel(previous);
    }
  }
}
