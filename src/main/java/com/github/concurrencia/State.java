package com.github.concurrencia;

import com.github.concurrencia.ModelCheckException.Code;

/**
 * This object represents an immutable, explicitly named local state eg. EMPTY or OCCUPIED. Two
 * states are equal iff their names are.
 */
public final class State implements LocalState {
  final static int maxStateNameLength = 20;
  private final String name;

  public State(final String name) throws ModelCheckException {
    if (name == null || name.trim().isEmpty() || name.trim().length() > maxStateNameLength) {
      throw new ModelCheckException(Code.INVALID_STATE_NAME);
    }
    this.name = name.trim();
  }

  /**
   * For statically known, valid names.
   */
  static State of(final String name) {
    try {
      return new State(name);
    } catch (ModelCheckException problem) {
      throw new IllegalArgumentException(problem.getMessage(), problem);
    }
  }

  public String getName() {
    return name;
  }

  @Override
  public String describe() {
    return name;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
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
    State other = (State) obj;
    return name.equals(other.name);
  }

  @Override
  public String toString() {
    return "State [name=" + name + "]";
  }
}
