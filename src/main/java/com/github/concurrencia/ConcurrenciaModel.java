package com.github.concurrencia;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.concurrencia.ExplicitProcess.ProcessBuilder;
import com.github.concurrencia.SystemModel.SystemModelBuilder;

/**
 * The Concurrencia domain: every process, safety property and progress property of the tour
 * group protocol, and the wiring of the full system
 * {@code CONCURRENCIA = ENTRY_EXIT || CIRCUIT}.
 */
public final class ConcurrenciaModel {
  private static final Logger logger =
      LogManager.getLogger(ConcurrenciaModel.class.getSimpleName());

  public static final Action ARRIVE = Action.named("arrive");
  public static final Action DEPART = Action.named("depart");
  public static final Action OPERATE = Action.named("operate");
  public static final Action ENTER = Action.named("enter");
  public static final Action LEAVE = Action.named("leave");
  public static final Action START_LEAVE = Action.of(Arrays.asList("start"), "leave");
  public static final Action DST_ENTER = Action.of(Arrays.asList("dst"), "enter");

  public static final String ARRIVE_PROGRESS = "ARRIVE";
  public static final String DEPART_PROGRESS = "DEPART";
  public static final String BOARD_PROGRESS = "BOARD";
  public static final String ALIGHT_PROGRESS = "ALIGHT";

  static final State EMPTY = State.of("EMPTY");
  static final State OCCUPIED = State.of("OCCUPIED");
  static final State READY = State.of("READY");

  private ConcurrenciaModel() {}

  /**
   * The full model for the given configuration: the system process plus SAFE_VILLAGE[1..N],
   * SAFE_TRAIN[0..N], SAFE_CAR and the four progress properties.
   */
  public static SystemModel build(final ModelConfiguration config) throws ModelCheckException {
    final int villages = config.getVillages();
    final Process system = concurrencia(entryExit(config, cableCar()),
        VillageCircuitBuilder.newBuilder(villages).build());
    final SystemModelBuilder builder = SystemModelBuilder.newBuilder().system(system);
    for (int iter = 1; iter <= villages; iter++) {
      builder.safetyProperty(safeVillage(iter));
    }
    for (int iter = 0; iter <= villages; iter++) {
      builder.safetyProperty(safeTrain(iter, villages));
    }
    builder.safetyProperty(safeCar(config.getCapacity()));
    builder.progressProperty(new ProgressProperty(ARRIVE_PROGRESS, ARRIVE));
    builder.progressProperty(new ProgressProperty(DEPART_PROGRESS, DEPART));
    builder.progressProperty(new ProgressProperty(BOARD_PROGRESS, boardActions(villages)));
    builder.progressProperty(new ProgressProperty(ALIGHT_PROGRESS, alightActions(villages)));
    final SystemModel model = builder.build();
    logger.info(String.format("Built %s for %s", model, config));
    return model;
  }

  public static Process concurrencia(final Process entryExit, final Process circuit)
      throws ModelCheckException {
    return Composition.newBuilder("CONCURRENCIA").participant("entryExit", entryExit)
        .participant("circuit", circuit).build();
  }

  /**
   * {@code ENTRY_EXIT = PRODUCER || CONSUMER || OPERATOR || CABLE_CAR || COUNTER}. The cable car
   * is a parameter so that variants of it can be checked.
   */
  public static Process entryExit(final ModelConfiguration config, final Process cableCar)
      throws ModelCheckException {
    return Composition.newBuilder("ENTRY_EXIT").participant("producer", producer())
        .participant("consumer", consumer()).participant("operator", operator())
        .participant("cableCar", cableCar).participant("counter", counter(config.getMaxGroups()))
        .build();
  }

  public static ExplicitProcess producer() throws ModelCheckException {
    return loop("PRODUCER", ARRIVE);
  }

  public static ExplicitProcess consumer() throws ModelCheckException {
    return loop("CONSUMER", DEPART);
  }

  public static ExplicitProcess operator() throws ModelCheckException {
    return loop("OPERATOR", OPERATE);
  }

  /**
   * Limits the number of groups in the system: {@code arrive} while fewer than max groups are
   * in, {@code depart} while any is.
   */
  public static ExplicitProcess counter(final int max) throws ModelCheckException {
    return GuardedProcessBuilder.newBuilder("COUNTER", CountState.class).initial(new CountState(0))
        .rule(s -> s.getCount() < max, ARRIVE, CountState::increment)
        .rule(s -> s.getCount() > 0, DEPART, CountState::decrement).build();
  }

  public static ExplicitProcess cableCar() throws ModelCheckException {
    return ProcessBuilder.newBuilder("CABLE_CAR").initial(CableCarState.EMPTY_VALLEY)
        .transition(CableCarState.EMPTY_VALLEY, ARRIVE, CableCarState.NEW_GROUP_VALLEY)
        .transition(CableCarState.EMPTY_VALLEY, OPERATE, CableCarState.EMPTY_TERMINUS)
        .transition(CableCarState.EMPTY_TERMINUS, OPERATE, CableCarState.EMPTY_VALLEY)
        .transition(CableCarState.EMPTY_TERMINUS, ENTER, CableCarState.RETURNING_TERMINUS)
        .transition(CableCarState.NEW_GROUP_VALLEY, OPERATE, CableCarState.NEW_GROUP_TERMINUS)
        .transition(CableCarState.NEW_GROUP_TERMINUS, LEAVE, CableCarState.EMPTY_TERMINUS)
        .transition(CableCarState.RETURNING_TERMINUS, OPERATE, CableCarState.RETURNING_VALLEY)
        .transition(CableCarState.RETURNING_VALLEY, DEPART, CableCarState.EMPTY_VALLEY).build();
  }

  public static ExplicitProcess train() throws ModelCheckException {
    return ProcessBuilder.newBuilder("TRAIN").initial(EMPTY).transition(EMPTY, START_LEAVE, OCCUPIED)
        .transition(OCCUPIED, DST_ENTER, EMPTY).build();
  }

  public static ExplicitProcess village() throws ModelCheckException {
    return ProcessBuilder.newBuilder("VILLAGE").initial(EMPTY).transition(EMPTY, ENTER, OCCUPIED)
        .transition(OCCUPIED, LEAVE, EMPTY).build();
  }

  /**
   * The village is entered from train i-1 and left on train i, one group at a time.
   */
  public static ExplicitProcess safeVillage(final int village) throws ModelCheckException {
    return ProcessBuilder.newBuilder("SAFE_VILLAGE[" + village + "]").initial(EMPTY)
        .transition(EMPTY, DST_ENTER.prefixed("train", village - 1), OCCUPIED)
        .transition(OCCUPIED, START_LEAVE.prefixed("train", village), EMPTY).build();
  }

  public static ExplicitProcess safeTrain(final int train, final int villages)
      throws ModelCheckException {
    return ProcessBuilder.newBuilder("SAFE_TRAIN[" + train + "]").initial(EMPTY)
        .transition(EMPTY, trainStartLeave(train), OCCUPIED)
        .transition(OCCUPIED, trainDstEnter(train, villages), EMPTY).build();
  }

  /**
   * The cable car protocol over (occupied, inValley, isReturning, groups). A new group is only
   * carried up and a returning group only carried down, and no group arrives once capacity
   * groups are in the system.
   */
  public static ExplicitProcess safeCar(final int capacity) throws ModelCheckException {
    return GuardedProcessBuilder.newBuilder("SAFE_CAR", CarPropertyState.class)
        .initial(new CarPropertyState(false, true, false, 0))
        .rule(s -> !s.isOccupied() && s.isInValley() && s.getGroups() < capacity, ARRIVE,
            s -> new CarPropertyState(true, true, false, s.getGroups() + 1))
        .rule(s -> s.isOccupied() && s.isInValley() && s.isReturning() && s.getGroups() > 0,
            DEPART, s -> new CarPropertyState(false, true, false, s.getGroups() - 1))
        .rule(s -> s.isOccupied() && !s.isInValley() && !s.isReturning(), LEAVE,
            s -> new CarPropertyState(false, false, false, s.getGroups()))
        .rule(s -> !s.isOccupied() && !s.isInValley(), ENTER,
            s -> new CarPropertyState(true, false, true, s.getGroups()))
        .rule(s -> !s.isOccupied(), OPERATE,
            s -> new CarPropertyState(false, !s.isInValley(), false, s.getGroups()))
        .rule(s -> s.isOccupied() && s.isInValley() && !s.isReturning(), OPERATE,
            s -> new CarPropertyState(true, false, false, s.getGroups()))
        .rule(s -> s.isOccupied() && !s.isInValley() && s.isReturning(), OPERATE,
            s -> new CarPropertyState(true, true, true, s.getGroups()))
        .build();
  }

  /**
   * Label of train i picking up a group; train 0 picks up at the terminus.
   */
  public static Action trainStartLeave(final int train) {
    return train == 0 ? LEAVE : START_LEAVE.prefixed("train", train);
  }

  /**
   * Label of train i dropping off a group; the last train drops off at the terminus.
   */
  public static Action trainDstEnter(final int train, final int villages) {
    return train == villages ? ENTER : DST_ENTER.prefixed("train", train);
  }

  public static Set<Action> boardActions(final int villages) {
    final Set<Action> actions = new LinkedHashSet<>();
    for (int iter = 0; iter <= villages; iter++) {
      actions.add(trainStartLeave(iter));
    }
    return actions;
  }

  public static Set<Action> alightActions(final int villages) {
    final Set<Action> actions = new LinkedHashSet<>();
    for (int iter = 0; iter <= villages; iter++) {
      actions.add(trainDstEnter(iter, villages));
    }
    return actions;
  }

  private static ExplicitProcess loop(final String name, final Action action)
      throws ModelCheckException {
    return ProcessBuilder.newBuilder(name).initial(READY).transition(READY, action, READY).build();
  }
}
