package com.github.concurrencia;

/**
 * Builds the village circuit: villages {@code village[1..N]} chained by trains
 * {@code train[0..N]}. Train i-1 delivers into village i and train i picks up from it, so a group
 * rides every train and visits every village exactly once, in order.
 * 
 * The outer ends are renamed to {@code leave} (boarding train 0 at the terminus) and
 * {@code enter} (alighting from train N at the terminus), the labels shared with the cable car.
 */
public final class VillageCircuitBuilder {
  private final int villages;

  private VillageCircuitBuilder(final int villages) {
    this.villages = villages;
  }

  public static VillageCircuitBuilder newBuilder(final int villages) {
    return new VillageCircuitBuilder(villages);
  }

  public Process build() throws ModelCheckException {
    if (villages < 1) {
      throw new ModelCheckException(ModelCheckException.Code.INVALID_MODEL_CONFIG,
          "A circuit needs at least one village, got " + villages);
    }
    final Process train = ConcurrenciaModel.train();
    final Process village = ConcurrenciaModel.village();
    final Composition circuit = Composition.newBuilder("CIRCUIT");
    for (int iter = 0; iter <= villages; iter++) {
      circuit.participant(trainName(iter), train, Relabeling.prefix("train", iter));
    }
    for (int iter = 1; iter <= villages; iter++) {
      final Relabeling relabeling = Relabeling.prefix("village", iter)
          .rename(ConcurrenciaModel.ENTER.prefixed("village", iter),
              ConcurrenciaModel.DST_ENTER.prefixed("train", iter - 1))
          .rename(ConcurrenciaModel.LEAVE.prefixed("village", iter),
              ConcurrenciaModel.START_LEAVE.prefixed("train", iter));
      circuit.participant(villageName(iter), village, relabeling);
    }
    circuit.relabel(ConcurrenciaModel.START_LEAVE.prefixed("train", 0), ConcurrenciaModel.LEAVE);
    circuit.relabel(ConcurrenciaModel.DST_ENTER.prefixed("train", villages),
        ConcurrenciaModel.ENTER);
    return circuit.build();
  }

  public static String trainName(final int train) {
    return "train[" + train + "]";
  }

  public static String villageName(final int village) {
    return "village[" + village + "]";
  }
}
