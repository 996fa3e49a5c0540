/*
 * Copyright (c) 2024-2025 The gma Development Team
 */

package io.github.gma.parameters.parametertypes;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class IntegerParameterTest {

  private final IntegerParameter parameter = new IntegerParameter("winStart", "first sample", 1,
      1, 10);

  @Test
  void testNameAndDescription() {
    Assertions.assertEquals("winStart", parameter.getName());
    Assertions.assertEquals("first sample", parameter.getDescription());
    Assertions.assertEquals(1, parameter.getDefaultValue());
  }

  @Test
  void testWithinBounds() {
    final List<String> errors = new ArrayList<>();
    Assertions.assertTrue(parameter.checkValue(1, errors));
    Assertions.assertTrue(parameter.checkValue(10, errors));
    Assertions.assertTrue(errors.isEmpty());
  }

  @Test
  void testOutsideBounds() {
    final List<String> errors = new ArrayList<>();
    Assertions.assertFalse(parameter.checkValue(0, errors));
    Assertions.assertFalse(parameter.checkValue(11, errors));
    Assertions.assertFalse(parameter.checkValue(null, errors));
    Assertions.assertEquals(3, errors.size());
    Assertions.assertTrue(errors.get(0).startsWith("winStart"));
  }

  @Test
  void testUnbounded() {
    final IntegerParameter unbounded = new IntegerParameter("n", "any", null);
    Assertions.assertNull(unbounded.getDefaultValue());
    Assertions.assertTrue(unbounded.checkValue(Integer.MIN_VALUE, new ArrayList<>()));
  }

  @Test
  void testBooleanDefault() {
    final BooleanParameter invert = new BooleanParameter("invertData", "invert", false);
    Assertions.assertFalse(invert.getValueOrDefault(null));
    Assertions.assertTrue(invert.getValueOrDefault(true));
  }
}
