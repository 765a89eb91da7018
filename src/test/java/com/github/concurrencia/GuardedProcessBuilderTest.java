package com.github.concurrencia;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.concurrencia.ModelCheckException.Code;

/**
 * Tests for the expansion of guarded rules into explicit processes.
 */
public class GuardedProcessBuilderTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testCounter() throws ModelCheckException {
    final ExplicitProcess counter = ConcurrenciaModel.counter(3);
    assertEquals(4, counter.getStates().size());
    // 3 arrives and 3 departs
    assertEquals(6, counter.getTransitions().size());
    assertFalse(counter.transition(new CountState(0), ConcurrenciaModel.DEPART).isPresent());
    assertFalse(counter.transition(new CountState(3), ConcurrenciaModel.ARRIVE).isPresent());
    assertEquals(new CountState(2),
        counter.transition(new CountState(1), ConcurrenciaModel.ARRIVE).get());
  }

  @Test
  public void testSafeCarStates() throws ModelCheckException {
    final ExplicitProcess safeCar = ConcurrenciaModel.safeCar(2);
    final CarPropertyState initial = (CarPropertyState) safeCar.getInitialState();
    assertFalse(initial.isOccupied());
    assertTrue(initial.isInValley());

    // identical guards on operate and arrive in the valley are alternatives, not duplicates
    assertTrue(safeCar.transition(initial, ConcurrenciaModel.ARRIVE).isPresent());
    assertTrue(safeCar.transition(initial, ConcurrenciaModel.OPERATE).isPresent());

    final CarPropertyState full = new CarPropertyState(false, true, false, 2);
    assertTrue(safeCar.getStates().contains(full));
    assertFalse(safeCar.transition(full, ConcurrenciaModel.ARRIVE).isPresent());

    final CarPropertyState newGroupUp = new CarPropertyState(true, false, false, 1);
    assertFalse(safeCar.transition(newGroupUp, ConcurrenciaModel.OPERATE).isPresent());
    assertEquals(new CarPropertyState(false, false, false, 1),
        safeCar.transition(newGroupUp, ConcurrenciaModel.LEAVE).get());
  }

  @Test
  public void testOverlappingGuardsAreAmbiguous() {
    final Action tick = Action.named("tick");
    try {
      GuardedProcessBuilder.newBuilder("CLOCK", CountState.class).initial(new CountState(0))
          .rule(s -> s.getCount() < 2, tick, CountState::increment)
          .rule(s -> s.getCount() == 1, tick, CountState::decrement).build();
      fail("Overlapping guards with different successors must be rejected");
    } catch (ModelCheckException problem) {
      assertEquals(Code.AMBIGUOUS_TRANSITION, problem.getCode());
      assertTrue(problem.getMessage().contains("CLOCK"));
    }
  }

  @Test
  public void testUnboundedRulesAreRejected() {
    try {
      GuardedProcessBuilder.newBuilder("RUNAWAY", CountState.class).initial(new CountState(0))
          .rule(s -> true, Action.named("tick"), CountState::increment).build();
      fail("An unbounded local state space must be rejected");
    } catch (ModelCheckException problem) {
      assertEquals(Code.INVALID_PROCESS, problem.getCode());
    }
  }

  @Test
  public void testDeclaredOnlyActions() throws ModelCheckException {
    final Action reset = Action.named("reset");
    final ExplicitProcess process = GuardedProcessBuilder.newBuilder("ONCE", CountState.class)
        .initial(new CountState(0)).alphabet(reset)
        .rule(s -> s.getCount() == 0, Action.named("fire"), CountState::increment).build();
    assertTrue(process.getAlphabet().contains(reset));
    assertTrue(process.steps(new CountState(1)).isEmpty());
  }
}
