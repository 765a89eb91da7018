package com.github.concurrencia;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Parameters of the Concurrencia domain model. Use the {@code ModelConfigurationBuilder} to build
 * it.
 * 
 * Notes:<br>
 * 1. villages defaults to 6 and maxGroups to 2*villages+1: enough groups to fill all villages and
 * trains, but not the cable car.<br>
 * 2. maxGroups above 2*villages+1 breaks the capacity invariant and is rejected unless
 * strictCapacity is explicitly switched off, which is only meant for demonstrating the resulting
 * violations.<br>
 */
public final class ModelConfiguration {
  private static final Logger logger =
      LogManager.getLogger(ModelConfiguration.class.getSimpleName());

  static final int defaultVillages = 6;

  private final int villages;
  private final int maxGroups;
  private final boolean strictCapacity;

  public int getVillages() {
    return villages;
  }

  public int getMaxGroups() {
    return maxGroups;
  }

  public boolean isStrictCapacity() {
    return strictCapacity;
  }

  /**
   * The largest number of groups the system can hold without overfilling the cable car.
   */
  public int getCapacity() {
    return capacityFor(villages);
  }

  static int capacityFor(final int villages) {
    return 2 * villages + 1;
  }

  public final static class ModelConfigurationBuilder {
    private int villages = defaultVillages;
    private Integer maxGroups;
    private boolean strictCapacity = true;

    public static ModelConfigurationBuilder newBuilder() {
      return new ModelConfigurationBuilder();
    }

    public ModelConfigurationBuilder villages(final int villages) {
      this.villages = villages;
      return this;
    }

    public ModelConfigurationBuilder maxGroups(final int maxGroups) {
      this.maxGroups = maxGroups;
      return this;
    }

    public ModelConfigurationBuilder strictCapacity(final boolean strictCapacity) {
      this.strictCapacity = strictCapacity;
      return this;
    }

    public ModelConfiguration build() throws ModelCheckException {
      final ModelConfiguration config = new ModelConfiguration(villages,
          maxGroups != null ? maxGroups : capacityFor(villages), strictCapacity);
      config.validate();
      return config;
    }

    private ModelConfigurationBuilder() {}
  }

  private void validate() throws ModelCheckException {
    StringBuilder messages = new StringBuilder();
    if (villages < 1) {
      messages.append("villages must be at least 1. ");
    }
    if (maxGroups < 1) {
      messages.append("maxGroups must be at least 1. ");
    }
    if (villages >= 1 && maxGroups > getCapacity()) {
      if (strictCapacity) {
        messages.append("maxGroups must not exceed 2*villages+1=").append(getCapacity())
            .append(". ");
      } else {
        logger.warn(String.format(
            "maxGroups=%d exceeds the capacity %d of %d villages, expect violations", maxGroups,
            getCapacity(), villages));
      }
    }
    if (messages.length() > 0) {
      throw new ModelCheckException(ModelCheckException.Code.INVALID_MODEL_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "ModelConfiguration [villages=" + villages + ", maxGroups=" + maxGroups
        + ", strictCapacity=" + strictCapacity + "]";
  }

  private ModelConfiguration(final int villages, final int maxGroups,
      final boolean strictCapacity) {
    this.villages = villages;
    this.maxGroups = maxGroups;
    this.strictCapacity = strictCapacity;
  }

}
