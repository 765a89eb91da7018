package com.github.concurrencia;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.concurrencia.CheckerConfiguration.CheckerConfigurationBuilder;
import com.github.concurrencia.ModelConfiguration.ModelConfigurationBuilder;

/**
 * Command line entry point. Builds the Concurrencia model, checks safety and the requested
 * progress properties, and prints every violation with its full trace.
 * 
 * Exit codes: 0 if the model verifies, 1 on violations, 2 on errors.
 */
public final class ConcurrenciaVerifier {
  private static final Logger logger =
      LogManager.getLogger(ConcurrenciaVerifier.class.getSimpleName());

  static final int VERIFIED = 0;
  static final int VIOLATED = 1;
  static final int FAILED = 2;

  private static final String usage = "Usage: ConcurrenciaVerifier [--villages N] "
      + "[--max-groups M] [--max-states C] [--parallel] [--no-strict-capacity] "
      + "[--progress NAME]...";

  private ConcurrenciaVerifier() {}

  public static void main(final String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(final String[] args, final PrintStream out, final PrintStream err) {
    final ModelConfigurationBuilder modelConfig = ModelConfigurationBuilder.newBuilder();
    final CheckerConfigurationBuilder checkerConfig = CheckerConfigurationBuilder.newBuilder();
    final List<String> progressNames = new ArrayList<>();
    try {
      for (int iter = 0; iter < args.length; iter++) {
        switch (args[iter]) {
          case "--villages":
            modelConfig.villages(intValue(args, ++iter));
            break;
          case "--max-groups":
            modelConfig.maxGroups(intValue(args, ++iter));
            break;
          case "--max-states":
            checkerConfig.maxStates(intValue(args, ++iter));
            break;
          case "--parallel":
            checkerConfig.explorationMode(ExplorationMode.PARALLEL);
            break;
          case "--no-strict-capacity":
            modelConfig.strictCapacity(false);
            break;
          case "--progress":
            progressNames.add(stringValue(args, ++iter));
            break;
          case "--help":
            out.println(usage);
            return VERIFIED;
          default:
            throw new IllegalArgumentException("Unknown option " + args[iter]);
        }
      }
    } catch (IllegalArgumentException badArgs) {
      err.println(badArgs.getMessage());
      err.println(usage);
      return FAILED;
    }

    try {
      final SystemModel model = ConcurrenciaModel.build(modelConfig.build());
      final ModelChecker checker = ModelChecker.ModelCheckerBuilder.newBuilder()
          .config(checkerConfig.build()).model(model).build();
      boolean violated = false;

      final List<Violation> violations = checker.verifySafety();
      for (final Violation violation : violations) {
        out.println("Safety violation of " + violation.getPropertyName() + ":");
        printTrace(out, violation.getTrace());
        violated = true;
      }
      if (violations.isEmpty()) {
        out.println("Safety: no violations");
      }

      final Map<String, Optional<Witness>> witnesses;
      if (progressNames.isEmpty()) {
        witnesses = checker.verifyAllProgress();
      } else {
        witnesses = new LinkedHashMap<>();
        for (final String progressName : progressNames) {
          witnesses.put(progressName, checker.verifyProgress(progressName));
        }
      }
      for (final Map.Entry<String, Optional<Witness>> entry : witnesses.entrySet()) {
        if (!entry.getValue().isPresent()) {
          out.println("Progress " + entry.getKey() + ": holds");
          continue;
        }
        final Witness witness = entry.getValue().get();
        out.println("Progress violation of " + entry.getKey() + " " + witness.getTargetActions()
            + ":");
        out.println("  prefix:");
        printTrace(out, witness.getPrefixTrace());
        out.println("  cycle:");
        printTrace(out, witness.getCycleTrace());
        out.println("  actions in terminal set: " + witness.getActionsInTerminalSet());
        violated = true;
      }
      out.println(checker.getStatistics().getLastExploration());
      return violated ? VIOLATED : VERIFIED;
    } catch (ModelCheckException problem) {
      logger.error("Verification failed", problem);
      err.println(problem.getCode() + ": " + problem.getMessage());
      return FAILED;
    }
  }

  private static void printTrace(final PrintStream out, final List<Action> trace) {
    for (final Action action : trace) {
      out.println("    " + action);
    }
  }

  private static String stringValue(final String[] args, final int index) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + args[index - 1]);
    }
    return args[index];
  }

  private static int intValue(final String[] args, final int index) {
    final String value = stringValue(args, index);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException notANumber) {
      throw new IllegalArgumentException(
          "Expected a number for " + args[index - 1] + " but got " + value);
    }
  }
}
