package com.github.concurrencia;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.concurrencia.ModelCheckException.Code;

/**
 * An immutable action label. Structurally an action is a path of string and integer identifiers
 * followed by a name, eg. {@code train[2].dst.enter} has the path {@code [train, 2, dst]} and the
 * name {@code enter}. Equality is structural.
 * 
 * Two processes share an action iff it appears in both of their alphabets.
 */
public final class Action implements Comparable<Action> {
  private static final Pattern identifier = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern segment =
      Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)((?:\\[-?[0-9]+\\])*)");
  private static final Pattern index = Pattern.compile("\\[(-?[0-9]+)\\]");

  /**
   * The internal action produced by hiding. It never appears in an alphabet and never
   * synchronizes.
   */
  public static final Action TAU = new Action(Collections.emptyList(), "tau");

  private final List<Object> path;
  private final String name;
  private final String rendered;

  private Action(final List<Object> path, final String name) {
    this.path = Collections.unmodifiableList(new ArrayList<>(path));
    this.name = name;
    this.rendered = render(this.path, name);
  }

  /**
   * Build a root-level action, eg. {@code arrive}.
   */
  public static Action named(final String name) {
    return of(Collections.emptyList(), name);
  }

  /**
   * Build an action from its path elements and name. Path elements must be identifiers or
   * integers and the path may not start with an integer.
   */
  public static Action of(final List<?> path, final String name) {
    if (name == null || !identifier.matcher(name).matches() || "tau".equals(name) && path.isEmpty()) {
      throw new IllegalArgumentException("Illegal action name: " + name);
    }
    final List<Object> elements = new ArrayList<>(path.size());
    for (final Object element : path) {
      if (element instanceof Integer) {
        if (elements.isEmpty()) {
          throw new IllegalArgumentException("Action path cannot start with an index: " + path);
        }
      } else if (!(element instanceof String) || !identifier.matcher((String) element).matches()) {
        throw new IllegalArgumentException("Illegal action path element: " + element);
      }
      elements.add(element);
    }
    return new Action(elements, name);
  }

  /**
   * Parse the rendered form of an action, eg. {@code train[2].dst.enter}.
   */
  public static Action parse(final String label) throws ModelCheckException {
    if (label == null || label.trim().isEmpty()) {
      throw new ModelCheckException(Code.INVALID_ACTION, "Action label cannot be blank");
    }
    final String[] segments = label.trim().split("\\.", -1);
    final List<Object> path = new ArrayList<>();
    for (int iter = 0; iter < segments.length; iter++) {
      final Matcher matcher = segment.matcher(segments[iter]);
      if (!matcher.matches()) {
        throw new ModelCheckException(Code.INVALID_ACTION, "Malformed action label: " + label);
      }
      final boolean last = iter == segments.length - 1;
      if (last && !matcher.group(2).isEmpty()) {
        throw new ModelCheckException(Code.INVALID_ACTION,
            "Action name cannot carry an index: " + label);
      }
      if (last) {
        if ("tau".equals(matcher.group(1)) && path.isEmpty()) {
          return TAU;
        }
        return new Action(path, matcher.group(1));
      }
      path.add(matcher.group(1));
      final Matcher indices = index.matcher(matcher.group(2));
      while (indices.find()) {
        path.add(Integer.valueOf(indices.group(1)));
      }
    }
    throw new ModelCheckException(Code.INVALID_ACTION, "Malformed action label: " + label);
  }

  /**
   * Prepend path elements to this action, the way process labelling {@code train[i]:TRAIN} does.
   */
  public Action prefixed(final Object... prefix) {
    if (this == TAU) {
      return this;
    }
    final List<Object> elements = new ArrayList<>(prefix.length + path.size());
    for (final Object element : prefix) {
      elements.add(element);
    }
    elements.addAll(path);
    return of(elements, name);
  }

  public List<Object> getPath() {
    return path;
  }

  public String getName() {
    return name;
  }

  public boolean isTau() {
    return this == TAU;
  }

  private static String render(final List<Object> path, final String name) {
    final StringBuilder builder = new StringBuilder();
    for (final Object element : path) {
      if (element instanceof Integer) {
        builder.append('[').append(element).append(']');
      } else {
        if (builder.length() > 0) {
          builder.append('.');
        }
        builder.append(element);
      }
    }
    if (builder.length() > 0) {
      builder.append('.');
    }
    return builder.append(name).toString();
  }

  @Override
  public int compareTo(final Action other) {
    return rendered.compareTo(other.rendered);
  }

  @Override
  public int hashCode() {
    return rendered.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    Action other = (Action) obj;
    return path.equals(other.path) && name.equals(other.name);
  }

  @Override
  public String toString() {
    return rendered;
  }
}
