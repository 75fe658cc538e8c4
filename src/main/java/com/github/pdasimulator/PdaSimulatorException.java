package com.github.pdasimulator;

/**
 * Unified single exception that's thrown and handled by this simulator. The code enum
 * encapsulates the various error conditions. Note that running an automaton never throws this:
 * rejection, stuck configurations and guard failures are all reported as a {@link StepOutcome}.
 * Only malformed definitions, bad configuration and lock timeouts end up here.
 */
public final class PdaSimulatorException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public PdaSimulatorException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public PdaSimulatorException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public PdaSimulatorException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_STATE_NAME(
        "State name cannot be blank or greater than " + State.maxStateNameLength + " characters"),
    // 2.
    INVALID_STATE("Null state is invalid"),
    // 3.
    INVALID_OPERATION("Operation symbols cannot be null or empty"),
    // 4.
    INVALID_AUTOMATON("Automaton must declare at least one state"),
    // 5.
    ILLEGAL_TRANSITION("Transition references a state that is not part of the automaton"),
    // 6.
    INVALID_SIMULATOR_CONFIG("Simulator configuration is invalid"),
    // 7.
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire read or write lock to perform requested operation. This is retryable."),
    // 8.
    INTERRUPTED("Simulator was interrupted");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
