package com.github.concurrencia;

/**
 * Unified single exception that's thrown and handled by the checker. The idea is to use the code
 * enum to encapsulate various error conditions. Note that safety and progress violations are not
 * errors, they are the regular output of a check and are reported via {@link Violation} and
 * {@link Witness}.
 */
public final class ModelCheckException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public ModelCheckException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public ModelCheckException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public ModelCheckException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_MODEL_CONFIG("Domain model configuration is invalid"),
    // 2.
    INVALID_CHECKER_CONFIG("Checker configuration is invalid"),
    // 3.
    STATE_EXPLOSION(
        "Reachable state space exceeded the configured cap. Exploration was aborted and is not retried."),
    // 4.
    AMBIGUOUS_TRANSITION("Process yields more than one successor for the same state and action"),
    // 5.
    INVALID_STATE_NAME(
        "State name cannot be null, blank or greater than " + State.maxStateNameLength
            + " characters"),
    // 6.
    INVALID_STATE("Null or foreign state is invalid"),
    // 7.
    INVALID_ACTION("Action label is null or malformed"),
    // 8.
    INVALID_PROCESS("Process definition is invalid"),
    // 9.
    INVALID_RELABELING("Relabeling merges distinct actions of a composite process"),
    // 10.
    UNKNOWN_PROGRESS_PROPERTY("No progress property is registered under the given name"),
    // 11.
    INTERRUPTED("Checker was interrupted"),
    // 12.
    UNKNOWN_FAILURE("Checker failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
