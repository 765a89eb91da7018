package com.github.concurrencia;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.concurrencia.ModelCheckException.Code;
import com.github.concurrencia.ModelConfiguration.ModelConfigurationBuilder;

/**
 * Tests for model configuration defaults and validation.
 */
public class ModelConfigurationTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testDefaults() throws ModelCheckException {
    final ModelConfiguration config = ModelConfigurationBuilder.newBuilder().build();
    assertEquals(6, config.getVillages());
    assertEquals(13, config.getMaxGroups());
    assertEquals(13, config.getCapacity());
    assertTrue(config.isStrictCapacity());

    final ModelConfiguration small = ModelConfigurationBuilder.newBuilder().villages(2).build();
    assertEquals(5, small.getMaxGroups());
  }

  @Test
  public void testFewerGroupsThanCapacity() throws ModelCheckException {
    final ModelConfiguration config =
        ModelConfigurationBuilder.newBuilder().villages(2).maxGroups(1).build();
    assertEquals(1, config.getMaxGroups());
    assertEquals(5, config.getCapacity());
  }

  @Test
  public void testInvalidConfigurations() {
    final ModelConfigurationBuilder[] invalid =
        new ModelConfigurationBuilder[] {ModelConfigurationBuilder.newBuilder().villages(0),
            ModelConfigurationBuilder.newBuilder().villages(2).maxGroups(0),
            ModelConfigurationBuilder.newBuilder().villages(2).maxGroups(6)};
    for (final ModelConfigurationBuilder builder : invalid) {
      try {
        builder.build();
        fail("Expected an invalid configuration");
      } catch (ModelCheckException problem) {
        assertEquals(Code.INVALID_MODEL_CONFIG, problem.getCode());
      }
    }
  }

  @Test
  public void testRelaxedCapacity() throws ModelCheckException {
    final ModelConfiguration config = ModelConfigurationBuilder.newBuilder().villages(2)
        .maxGroups(6).strictCapacity(false).build();
    assertFalse(config.isStrictCapacity());
    assertEquals(6, config.getMaxGroups());
    assertEquals(5, config.getCapacity());
  }
}
