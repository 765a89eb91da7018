package com.github.concurrencia;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import com.github.concurrencia.ExplicitProcess.ProcessBuilder;
import com.github.concurrencia.ModelCheckException.Code;
import com.github.concurrencia.ReachableGraph.Edge;

/**
 * Tests to maintain the synchronization semantics of composed processes.
 */
public class CompositionTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final Action a = Action.named("a");
  private final Action b = Action.named("b");
  private final Action c = Action.named("c");
  private final State s0 = State.of("S0");
  private final State s1 = State.of("S1");

  // S0 -a-> S1 -b-> S0
  private ExplicitProcess alternating() throws ModelCheckException {
    return ProcessBuilder.newBuilder("ALT").initial(s0).transition(s0, a, s1).transition(s1, b, s0)
        .build();
  }

  private ExplicitProcess loop(final String name, final Action action)
      throws ModelCheckException {
    return ProcessBuilder.newBuilder(name).initial(s0).transition(s0, action, s0).build();
  }

  @Test
  public void testUnsharedActionsInterleave() throws ModelCheckException {
    final Process composed = Composition.newBuilder("PAIR").participant("left", loop("L", a))
        .participant("right", loop("R", b)).build();
    final List<Transition> steps = composed.steps(composed.getInitialState());
    assertEquals(2, steps.size());
    assertEquals(a, steps.get(0).getAction());
    assertEquals(b, steps.get(1).getAction());
    assertEquals(new HashSet<>(Arrays.asList(a, b)), composed.getAlphabet());
  }

  @Test
  public void testSharedActionsSynchronize() throws ModelCheckException {
    // ALT only allows b after a, so the shared b is blocked at first although B_LOOP offers it
    final Process composed = Composition.newBuilder("SYNC").participant("alt", alternating())
        .participant("bLoop", loop("B_LOOP", b)).build();
    final ComposedState initial = (ComposedState) composed.getInitialState();
    assertFalse(composed.transition(initial, b).isPresent());

    final ComposedState afterA = (ComposedState) composed.transition(initial, a).get();
    assertEquals(s1, afterA.get("alt"));
    assertEquals(s0, afterA.get("bLoop"));
    final List<Transition> steps = composed.steps(afterA);
    assertEquals(1, steps.size());
    assertEquals(b, steps.get(0).getAction());
    assertEquals(initial, steps.get(0).getToState());
    assertEquals(Arrays.asList("alt", "bLoop"), ((ComposedProcess) composed).sharedBy(b));
    assertEquals(Collections.singletonList("alt"), ((ComposedProcess) composed).sharedBy(a));
  }

  @Test
  public void testExtensionBlocks() throws ModelCheckException {
    final Process extended = Processes.extend(loop("R", b), Collections.singleton(a));
    assertTrue(extended.getAlphabet().contains(a));
    final Process composed = Composition.newBuilder("BLOCKED").participant("left", loop("L", a))
        .participant("right", extended).build();
    final List<Transition> steps = composed.steps(composed.getInitialState());
    assertEquals(1, steps.size());
    assertEquals(b, steps.get(0).getAction());

    // the same holds for composites, which are extended by wrapping
    final Process nested = Processes.extend(
        Composition.newBuilder("INNER").participant("right", loop("R", b)).build(),
        Collections.singleton(a));
    final Process outer = Composition.newBuilder("OUTER").participant("left", loop("L", a))
        .participant("inner", nested).build();
    assertEquals(1, outer.steps(outer.getInitialState()).size());
  }

  @Test
  public void testHiding() throws ModelCheckException {
    final Process composed = Composition.newBuilder("HIDDEN").participant("alt", alternating())
        .hide(a).build();
    assertEquals(Collections.singleton(b), composed.getAlphabet());
    final List<Transition> steps = composed.steps(composed.getInitialState());
    assertEquals(1, steps.size());
    assertTrue(steps.get(0).getAction().isTau());
    assertFalse(composed.transition(composed.getInitialState(), a).isPresent());
  }

  @Test
  public void testTauStepsInterleaveWithSharedActions() throws ModelCheckException {
    final Process inner = Composition.newBuilder("INNER").participant("alt", alternating())
        .hide(a).build();
    // the hidden a of INNER must not synchronize with the visible a of L
    final Process outer = Composition.newBuilder("OUTER").participant("inner", inner)
        .participant("left", loop("L", a)).build();
    final List<Transition> steps = outer.steps(outer.getInitialState());
    assertEquals(2, steps.size());
    assertTrue(steps.get(0).getAction().isTau());
    assertEquals(a, steps.get(1).getAction());
    final ComposedState afterTau = (ComposedState) steps.get(0).getToState();
    assertEquals(s1, afterTau.resolve("alt"));
    assertEquals(s0, afterTau.resolve("left"));
  }

  @Test
  public void testParticipantRelabeling() throws ModelCheckException {
    final Process composed = Composition.newBuilder("LABELLED")
        .participant("first", alternating(), Relabeling.prefix("first"))
        .participant("second", alternating(), Relabeling.prefix("second").rename(
            a.prefixed("second"), b.prefixed("first")))
        .relabel(b.prefixed("second"), c).build();
    final Set<Action> expected =
        new HashSet<>(Arrays.asList(a.prefixed("first"), b.prefixed("first"), c));
    assertEquals(expected, composed.getAlphabet());
    // first.b needs first to be in S1 and second to be in S0
    final LocalState afterA = composed.transition(composed.getInitialState(), a.prefixed("first"))
        .get();
    final ComposedState both = (ComposedState) composed.transition(afterA, b.prefixed("first"))
        .get();
    assertEquals(s0, both.get("first"));
    assertEquals(s1, both.get("second"));
    assertTrue(composed.transition(both, c).isPresent());
  }

  @Test
  public void testMergingRelabelings() throws ModelCheckException {
    // a and b leave different states of ALT, so merging them is still deterministic
    final Process merged = Processes.relabel(alternating(), Relabeling.identity().rename(a, b));
    assertEquals(Collections.singleton(b), merged.getAlphabet());
    assertEquals(s1, merged.transition(s0, b).get());

    final ExplicitProcess choice = ProcessBuilder.newBuilder("CHOICE").initial(s0)
        .transition(s0, a, s0).transition(s0, b, s1).build();
    try {
      Processes.relabel(choice, Relabeling.identity().rename(a, b));
      fail("Explicit processes reject ambiguous merges eagerly");
    } catch (ModelCheckException problem) {
      assertEquals(Code.AMBIGUOUS_TRANSITION, problem.getCode());
    }

    final Process composite =
        Composition.newBuilder("COMPOSITE").participant("alt", alternating()).build();
    try {
      Processes.relabel(composite, Relabeling.identity().rename(a, b));
      fail("Composites reject merging relabelings");
    } catch (ModelCheckException problem) {
      assertEquals(Code.INVALID_RELABELING, problem.getCode());
    }
  }

  @Test
  public void testInvalidCompositions() throws ModelCheckException {
    try {
      Composition.newBuilder("EMPTY").build();
      fail("Empty compositions are invalid");
    } catch (ModelCheckException problem) {
      assertEquals(Code.INVALID_PROCESS, problem.getCode());
    }
    try {
      Composition.newBuilder("TWINS").participant("twin", alternating())
          .participant("twin", alternating()).build();
      fail("Participant names must be unique");
    } catch (ModelCheckException problem) {
      assertEquals(Code.INVALID_PROCESS, problem.getCode());
      assertTrue(problem.getMessage().contains("twin"));
    }
  }

  /**
   * P || relabel(P) with the copy hidden offers exactly the visible actions of P in every state,
   * and its tau steps never move P, so both have the same visible traces.
   */
  @Test
  public void testRelabeledHiddenCopyPreservesTraces() throws ModelCheckException {
    final ExplicitProcess original = ConcurrenciaModel.cableCar();
    final Relabeling disjoint = Relabeling.prefix("copy");
    final Process copy = Processes.relabel(original, disjoint);
    final Process composed = Composition.newBuilder("ROUND_TRIP").participant("original", original)
        .participant("copy", copy).hide(copy.getAlphabet()).build();
    assertEquals(original.getAlphabet(), composed.getAlphabet());

    final ReachableGraph graph =
        new StateSpaceExplorer(CheckerConfiguration.defaults()).explore(composed);
    assertEquals(original.getStates().size() * original.getStates().size(), graph.size());
    for (int node = 0; node < graph.size(); node++) {
      final LocalState local = ((ComposedState) graph.getState(node)).get("original");
      final Set<Action> expected = new HashSet<>();
      for (final Transition transition : original.steps(local)) {
        expected.add(transition.getAction());
      }
      final Set<Action> visible = new HashSet<>();
      for (final Edge edge : graph.getEdges(node)) {
        final LocalState next = ((ComposedState) graph.getState(edge.getTo())).get("original");
        if (edge.getAction().isTau()) {
          assertEquals(local, next);
        } else {
          visible.add(edge.getAction());
          assertEquals(original.transition(local, edge.getAction()).get(), next);
        }
      }
      assertEquals(expected, visible);
    }
  }
}
