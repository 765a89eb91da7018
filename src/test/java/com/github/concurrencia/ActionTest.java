package com.github.concurrencia;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import com.github.concurrencia.ModelCheckException.Code;

/**
 * Tests to maintain the sanity of action labels.
 */
public class ActionTest {

  @Test
  public void testRendering() {
    assertEquals("arrive", Action.named("arrive").toString());
    assertEquals("start.leave", Action.of(Arrays.asList("start"), "leave").toString());
    assertEquals("train[2].dst.enter",
        Action.of(Arrays.asList("train", 2, "dst"), "enter").toString());
    assertEquals("grid[1][3].go", Action.of(Arrays.asList("grid", 1, 3), "go").toString());
  }

  @Test
  public void testParse() throws ModelCheckException {
    final Action parsed = Action.parse("train[2].dst.enter");
    assertEquals(Arrays.asList("train", 2, "dst"), parsed.getPath());
    assertEquals("enter", parsed.getName());
    assertEquals(ConcurrenciaModel.DST_ENTER.prefixed("train", 2), parsed);
    assertEquals(Action.named("leave"), Action.parse(" leave "));
    assertSame(Action.TAU, Action.parse("tau"));
  }

  @Test
  public void testMalformedLabels() {
    for (final String label : new String[] {"", "train[x].go", "a..b", "go[1]", "1go", "a.b."}) {
      try {
        Action.parse(label);
        fail("Expected " + label + " to be rejected");
      } catch (ModelCheckException problem) {
        assertEquals(Code.INVALID_ACTION, problem.getCode());
      }
    }
  }

  @Test
  public void testIllegalConstruction() {
    try {
      Action.of(Arrays.asList(1, "train"), "go");
      fail("A path cannot start with an index");
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("index"));
    }
    try {
      Action.named("tau");
      fail("tau is reserved");
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("tau"));
    }
  }

  @Test
  public void testPrefixing() {
    final Action enter = Action.named("enter");
    final Action prefixed = enter.prefixed("village", 3);
    assertEquals("village[3].enter", prefixed.toString());
    assertNotEquals(enter, prefixed);
    assertSame(Action.TAU, Action.TAU.prefixed("village", 3));
    assertTrue(Action.TAU.isTau());
    assertFalse(prefixed.isTau());
  }

  @Test
  public void testOrdering() {
    assertTrue(Action.named("arrive").compareTo(Action.named("depart")) < 0);
    assertEquals(0, Action.named("leave").compareTo(Action.named("leave")));
  }
}
