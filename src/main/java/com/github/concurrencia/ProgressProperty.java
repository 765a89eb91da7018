package com.github.concurrencia;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A named progress property: in every infinite execution, some action of the target set happens
 * infinitely often.
 */
public final class ProgressProperty {
  private final String name;
  private final Set<Action> targetActions;

  public ProgressProperty(final String name, final Set<Action> targetActions) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException("Progress property name cannot be blank");
    }
    if (targetActions == null || targetActions.isEmpty()) {
      throw new IllegalArgumentException("Progress property " + name + " has no target actions");
    }
    this.name = name.trim();
    this.targetActions = Collections.unmodifiableSet(new LinkedHashSet<>(targetActions));
  }

  public ProgressProperty(final String name, final Action... targetActions) {
    this(name, new LinkedHashSet<>(Arrays.asList(targetActions)));
  }

  public String getName() {
    return name;
  }

  public Set<Action> getTargetActions() {
    return targetActions;
  }

  /**
   * Hidden actions never count towards progress.
   */
  public boolean isSatisfiedBy(final Action action) {
    return !action.isTau() && targetActions.contains(action);
  }

  @Override
  public String toString() {
    return "ProgressProperty [name=" + name + ", targetActions=" + targetActions + "]";
  }
}
