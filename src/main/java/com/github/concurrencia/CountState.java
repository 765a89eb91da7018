package com.github.concurrencia;

/**
 * A bounded integer local state, eg. the number of groups a counter has admitted.
 */
public final class CountState implements LocalState {
  private final int count;

  public CountState(final int count) {
    this.count = count;
  }

  public int getCount() {
    return count;
  }

  public CountState increment() {
    return new CountState(count + 1);
  }

  public CountState decrement() {
    return new CountState(count - 1);
  }

  @Override
  public String describe() {
    return Integer.toString(count);
  }

  @Override
  public int hashCode() {
    return count;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CountState)) {
      return false;
    }
    return count == ((CountState) obj).count;
  }

  @Override
  public String toString() {
    return "CountState [count=" + count + "]";
  }
}
