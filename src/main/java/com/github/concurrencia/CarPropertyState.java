package com.github.concurrencia;

/**
 * Local state of the cable car safety property: the car flags plus the number of groups admitted
 * into the system and not yet departed.
 */
public final class CarPropertyState implements LocalState {
  private final boolean occupied;
  private final boolean inValley;
  private final boolean returning;
  private final int groups;

  public CarPropertyState(final boolean occupied, final boolean inValley, final boolean returning,
      final int groups) {
    this.occupied = occupied;
    this.inValley = inValley;
    this.returning = returning;
    this.groups = groups;
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

  public int getGroups() {
    return groups;
  }

  @Override
  public String describe() {
    return String.format("(%s,%s,%s,%d)", occupied ? "T" : "F", inValley ? "T" : "F",
        returning ? "T" : "F", groups);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + (occupied ? 1231 : 1237);
    result = prime * result + (inValley ? 1231 : 1237);
    result = prime * result + (returning ? 1231 : 1237);
    result = prime * result + groups;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CarPropertyState)) {
      return false;
    }
    final CarPropertyState other = (CarPropertyState) obj;
    return occupied == other.occupied && inValley == other.inValley
        && returning == other.returning && groups == other.groups;
  }

  @Override
  public String toString() {
    return "CarPropertyState [occupied=" + occupied + ", inValley=" + inValley + ", returning="
        + returning + ", groups=" + groups + "]";
  }
}
