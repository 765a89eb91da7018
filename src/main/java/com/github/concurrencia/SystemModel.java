package com.github.concurrencia;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.concurrencia.ModelCheckException.Code;

/**
 * A process under verification together with the safety and progress properties it is checked
 * against. Progress properties are keyed by name, in declaration order.
 */
public final class SystemModel {
  private final Process system;
  private final List<Process> safetyProperties;
  private final Map<String, ProgressProperty> progressProperties;

  private SystemModel(final Process system, final List<Process> safetyProperties,
      final Map<String, ProgressProperty> progressProperties) {
    this.system = system;
    this.safetyProperties = Collections.unmodifiableList(safetyProperties);
    this.progressProperties = Collections.unmodifiableMap(progressProperties);
  }

  public String getName() {
    return system.getName();
  }

  public Process getSystem() {
    return system;
  }

  public List<Process> getSafetyProperties() {
    return safetyProperties;
  }

  public Map<String, ProgressProperty> getProgressProperties() {
    return progressProperties;
  }

  public SystemModelBuilder toBuilder() {
    final SystemModelBuilder builder = SystemModelBuilder.newBuilder().system(system);
    builder.safetyProperties.addAll(safetyProperties);
    builder.progressProperties.putAll(progressProperties);
    return builder;
  }

  @Override
  public String toString() {
    return "SystemModel [system=" + system.getName() + ", safetyProperties="
        + safetyProperties.size() + ", progressProperties=" + progressProperties.keySet() + "]";
  }

  public final static class SystemModelBuilder {
    private Process system;
    private final List<Process> safetyProperties = new ArrayList<>();
    private final Map<String, ProgressProperty> progressProperties = new LinkedHashMap<>();

    public static SystemModelBuilder newBuilder() {
      return new SystemModelBuilder();
    }

    public SystemModelBuilder system(final Process system) {
      this.system = system;
      return this;
    }

    public SystemModelBuilder safetyProperty(final Process property) {
      safetyProperties.add(property);
      return this;
    }

    public SystemModelBuilder progressProperty(final ProgressProperty property) {
      progressProperties.put(property.getName(), property);
      return this;
    }

    public SystemModel build() throws ModelCheckException {
      if (system == null) {
        throw new ModelCheckException(Code.INVALID_PROCESS, "System model has no process");
      }
      final List<String> names = new ArrayList<>();
      for (final Process property : safetyProperties) {
        if (property == null) {
          throw new ModelCheckException(Code.INVALID_PROCESS, "Safety property cannot be null");
        }
        if (names.contains(property.getName()) || property.getName().equals(system.getName())) {
          throw new ModelCheckException(Code.INVALID_PROCESS,
              "Duplicate safety property name " + property.getName());
        }
        names.add(property.getName());
      }
      return new SystemModel(system, new ArrayList<>(safetyProperties),
          new LinkedHashMap<>(progressProperties));
    }

    private SystemModelBuilder() {}
  }
}
