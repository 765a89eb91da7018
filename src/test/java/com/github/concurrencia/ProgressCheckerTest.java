package com.github.concurrencia;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;

import org.junit.Test;

import com.github.concurrencia.ExplicitProcess.ProcessBuilder;

/**
 * Tests for terminal set detection and progress witnesses.
 */
public class ProgressCheckerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final Action a = Action.named("a");
  private final Action b = Action.named("b");
  private final Action c = Action.named("c");
  private final Action d = Action.named("d");
  private final Action e = Action.named("e");
  private final State s0 = State.of("S0");
  private final State s1 = State.of("S1");
  private final State s2 = State.of("S2");
  private final State s3 = State.of("S3");

  private static ReachableGraph explore(final Process process) throws ModelCheckException {
    return new StateSpaceExplorer(CheckerConfiguration.defaults()).explore(process);
  }

  // S0 -a-> S1 -c-> S1, S0 -b-> S2 -d-> S3 -e-> S2
  private ProgressChecker forked() throws ModelCheckException {
    return new ProgressChecker(explore(ProcessBuilder.newBuilder("FORK").initial(s0)
        .transition(s0, a, s1).transition(s0, b, s2).transition(s1, c, s1).transition(s2, d, s3)
        .transition(s3, e, s2).build()));
  }

  @Test
  public void testTerminalSets() throws ModelCheckException {
    final ProgressChecker checker = forked();
    assertEquals(2, checker.getTerminalSets().size());
    assertArrayEquals(new int[] {1}, checker.getTerminalSets().get(0));
    assertArrayEquals(new int[] {2, 3}, checker.getTerminalSets().get(1));
  }

  @Test
  public void testWitness() throws ModelCheckException {
    final ProgressChecker checker = forked();
    final Optional<Witness> starving = checker.check(new ProgressProperty("C", c));
    assertTrue(starving.isPresent());
    final Witness witness = starving.get();
    assertEquals("C", witness.getProgressName());
    assertEquals(Collections.singleton(c), witness.getTargetActions());
    assertEquals(Collections.singletonList(b), witness.getPrefixTrace());
    assertEquals(Arrays.asList(d, e), witness.getCycleTrace());
    assertEquals(new HashSet<>(Arrays.asList(d, e)), witness.getActionsInTerminalSet());

    // the self-loop on S1 is reported first when it lacks the target
    final Witness selfLoop = checker.check(new ProgressProperty("D", d)).get();
    assertEquals(Collections.singletonList(a), selfLoop.getPrefixTrace());
    assertEquals(Collections.singletonList(c), selfLoop.getCycleTrace());

    assertFalse(checker.check(new ProgressProperty("C_OR_E", c, e)).isPresent());
  }

  @Test
  public void testTransientCyclesAndDeadlocksAreIgnored() throws ModelCheckException {
    // S0 -a-> S1 -b-> S0 is a cycle that can always be left through c, S2 is a deadlock
    final ProgressChecker checker = new ProgressChecker(explore(ProcessBuilder
        .newBuilder("LEAKY").initial(s0).transition(s0, a, s1).transition(s1, b, s0)
        .transition(s0, c, s2).build()));
    assertTrue(checker.getTerminalSets().isEmpty());
    assertFalse(checker.check(new ProgressProperty("A", a)).isPresent());
  }

  @Test
  public void testHiddenActionsNeverCount() throws ModelCheckException {
    final Process hidden = Composition.newBuilder("SILENT")
        .participant("spinner", ProcessBuilder.newBuilder("SPINNER").initial(s0)
            .transition(s0, a, s0).build())
        .hide(a).build();
    final Witness witness =
        new ProgressChecker(explore(hidden)).check(new ProgressProperty("A", a)).get();
    assertTrue(witness.getPrefixTrace().isEmpty());
    assertEquals(Collections.singletonList(Action.TAU), witness.getCycleTrace());
    assertEquals(Collections.singleton(Action.TAU), witness.getActionsInTerminalSet());
  }

  @Test
  public void testProgressPropertyNeedsTargets() {
    try {
      new ProgressProperty("NOTHING", new HashSet<Action>());
      fail("A progress property without targets is meaningless");
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("NOTHING"));
    }
  }
}
