package com.github.concurrencia;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A pure label rewrite: an optional path prefix (process labelling, {@code train[2]:TRAIN})
 * followed by {@code old -> new} substitutions expressed on the prefixed labels. Relabelings are
 * immutable; every mutator returns a new instance.
 */
public final class Relabeling {
  private static final Relabeling identity =
      new Relabeling(Collections.emptyList(), Collections.emptyMap());

  private final List<Object> prefix;
  private final Map<Action, Action> renames;

  private Relabeling(final List<Object> prefix, final Map<Action, Action> renames) {
    this.prefix = prefix;
    this.renames = renames;
  }

  public static Relabeling identity() {
    return identity;
  }

  public static Relabeling prefix(final Object... prefix) {
    return new Relabeling(Collections.unmodifiableList(Arrays.asList(prefix)),
        Collections.emptyMap());
  }

  public Relabeling rename(final Action oldAction, final Action newAction) {
    if (oldAction == null || newAction == null || oldAction.isTau() || newAction.isTau()) {
      throw new IllegalArgumentException("Cannot relabel " + oldAction + " to " + newAction);
    }
    final Map<Action, Action> updated = new LinkedHashMap<>(renames);
    updated.put(oldAction, newAction);
    return new Relabeling(prefix, Collections.unmodifiableMap(updated));
  }

  public Action apply(final Action action) {
    if (action.isTau()) {
      return action;
    }
    final Action prefixed = prefix.isEmpty() ? action : action.prefixed(prefix.toArray());
    final Action renamed = renames.get(prefixed);
    return renamed != null ? renamed : prefixed;
  }

  public boolean isIdentity() {
    return prefix.isEmpty() && renames.isEmpty();
  }

  @Override
  public String toString() {
    return "Relabeling [prefix=" + prefix + ", renames=" + renames + "]";
  }
}
