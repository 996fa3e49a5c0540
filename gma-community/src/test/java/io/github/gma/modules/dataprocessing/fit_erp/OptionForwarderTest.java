/*
 * Copyright (c) 2024-2025 The gma Development Team
 */

package io.github.gma.modules.dataprocessing.fit_erp;

import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class OptionForwarderTest {

  private final OptionForwarder forwarder = new OptionForwarder();

  @Test
  void testForwardsDataWindowAndOptions() {
    final double[] data = {1, 2, 3};
    final ErpFitOptions options = ErpFitOptions.builder().invertData(true)
        .set(ErpFitOptions.SEG_MIN_LENGTH, 5).set("notYetKnown", "x").build();
    final GmaFitCall call = forwarder.forward(data, new FitWindow(2, 2), options);

    Assertions.assertSame(data, call.data());
    Assertions.assertEquals(new FitWindow(2, 2), call.window());
    Assertions.assertEquals(Map.of("segMinLength", 5, "notYetKnown", "x"), call.options());
  }

  @Test
  void testInvokePassesArguments() {
    final RecordingGmaFitEngine engine = new RecordingGmaFitEngine();
    final double[] data = {4, 5, 6};
    final GmaFitCall call = forwarder.forward(data, new FitWindow(1, 3),
        ErpFitOptions.builder().set(ErpFitOptions.FTOL, 1e-6).build());
    call.invoke(engine);

    Assertions.assertEquals(1, engine.calls);
    Assertions.assertSame(data, engine.data);
    Assertions.assertEquals(1, engine.winStart);
    Assertions.assertEquals(3, engine.winLength);
    Assertions.assertEquals(Map.of("ftol", 1e-6), engine.options);
  }

  @Test
  void testInvertDataIsNotForwarded() {
    final ErpFitOptions options = ErpFitOptions.builder().set(ErpFitOptions.INVERT_DATA, true)
        .set(ErpFitOptions.PS_TYPE, "grid").build();
    final GmaFitCall call = forwarder.forward(new double[]{1}, new FitWindow(1, 1), options);
    for (String reserved : ErpFitOptions.RESERVED_KEYS) {
      Assertions.assertFalse(call.options().containsKey(reserved));
    }
    Assertions.assertEquals(Map.of("psType", "grid"), call.options());
  }
}
