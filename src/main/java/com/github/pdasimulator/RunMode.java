package com.github.pdasimulator;

/**
 * This represents who drives the step loop once a run is started.
 */
public enum RunMode {
  // auto step through the run asynchronously on a daemon thread different from the caller thread
  AUTO_ASYNC,
  // auto step through the run on the caller thread, start() returns once the run has halted
  AUTO_CALLER_THREAD,
  // caller steps manually via step()
  MANUAL;
}
