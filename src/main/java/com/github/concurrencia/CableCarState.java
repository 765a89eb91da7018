package com.github.concurrencia;

/**
 * The cable car as a single local state. Only the six reachable combinations of (occupied,
 * inValley, isReturning) exist as constants; an empty car is never returning.
 */
public enum CableCarState implements LocalState {
  EMPTY_VALLEY(false, true, false),
  EMPTY_TERMINUS(false, false, false),
  NEW_GROUP_VALLEY(true, true, false),
  NEW_GROUP_TERMINUS(true, false, false),
  RETURNING_TERMINUS(true, false, true),
  RETURNING_VALLEY(true, true, true);

  private final boolean occupied;
  private final boolean inValley;
  private final boolean returning;

  private CableCarState(final boolean occupied, final boolean inValley,
      final boolean returning) {
    this.occupied = occupied;
    this.inValley = inValley;
    this.returning = returning;
  }

  public boolean isOccupied() {
    return occupied;
  }

  public boolean isInValley() {
    return inValley;
  }

  public boolean isReturning() {
    return returning;
  }

  /**
   * Look up the constant for the given flags.
   * 
   * @throws IllegalArgumentException for unreachable combinations
   */
  public static CableCarState of(final boolean occupied, final boolean inValley,
      final boolean returning) {
    for (final CableCarState state : values()) {
      if (state.occupied == occupied && state.inValley == inValley
          && state.returning == returning) {
        return state;
      }
    }
    throw new IllegalArgumentException(String.format(
        "Unreachable cable car state occupied=%b, inValley=%b, returning=%b", occupied, inValley,
        returning));
  }

  @Override
  public String describe() {
    return name();
  }
}
