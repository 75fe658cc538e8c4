package com.github.pdasimulator;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.pdasimulator.PdaSimulatorException.Code;

/**
 * Drives runs of a {@link PushdownAutomaton}: owns the lifecycle phase, the simulation cursor and
 * the stack, and delegates single steps to a {@link StepExecutor}.
 *
 * Notes:<br>
 * 1. every mutation of the simulation state happens under the write lock, one step at a time. The
 * lock is never held across the inter-step delay, which is what lets {@link #stop()} and
 * {@link #reset()} get in between two steps<br>
 *
 * 2. cancellation is cooperative: an automatic step loop checks, before every step, that the phase
 * is still RUNNING and that the run it was started for is still the current one<br>
 *
 * 3. listeners are invoked on the stepping thread while the write lock is held<br>
 */
public final class PdaSimulatorImpl implements PdaSimulator {
  private static final Logger logger = LogManager.getLogger(PdaSimulatorImpl.class.getSimpleName());

  private final String simulatorId = UUID.randomUUID().toString();

  private final static long lockAcquisitionMillis = 100L;

  private final SimulatorConfiguration config;
  private final PushdownAutomaton automaton;
  private final SimulationState simulationState = new SimulationState();
  private final PushdownStack stack = new PushdownStack();
  private final StepExecutor executor;
  private final SimulationStatistics statistics;
  private final List<SimulationListener> listeners = new CopyOnWriteArrayList<>();

  private final AtomicReference<SimulationPhase> phase =
      new AtomicReference<>(SimulationPhase.NOT_STARTED);
  private volatile String runId;
  private volatile StepOutcome verdict;
  private volatile SimulationRunner runner;

  private final ReentrantReadWriteLock simulatorSuperLock = new ReentrantReadWriteLock(true);
  private final WriteLock simulatorWriteLock = simulatorSuperLock.writeLock();
  private final ReadLock simulatorReadLock = simulatorSuperLock.readLock();

  public PdaSimulatorImpl(final SimulatorConfiguration config, final PushdownAutomaton automaton,
      final List<SimulationListener> listeners) throws PdaSimulatorException {
    if (config == null) {
      throw new PdaSimulatorException(Code.INVALID_SIMULATOR_CONFIG,
          "Simulator configuration cannot be null");
    }
    if (automaton == null) {
      throw new PdaSimulatorException(Code.INVALID_AUTOMATON, "Automaton cannot be null");
    }
    this.config = config;
    this.automaton = automaton;
    if (listeners != null) {
      for (final SimulationListener listener : listeners) {
        addListener(listener);
      }
    }
    this.statistics = new SimulationStatistics(simulatorId);
    this.executor = new StepExecutor(simulatorId, automaton, simulationState, stack,
        new SimulationListener() {
          @Override
          public void onEvent(final SimulationEvent event) {
            dispatch(event);
          }
        }, config.getMaxSteps());
    this.runId = UUID.randomUUID().toString();
    executor.initialize(runId);
    statistics.record(currentConfiguration());
    logInfo(runId, "Fired up simulator with " + config + " for " + automaton);
  }

  @Override
  public boolean start() throws PdaSimulatorException {
    final String startedRunId;
    acquire(simulatorWriteLock, "Timed out while trying to start run");
    try {
      if (phase.get() == SimulationPhase.RUNNING) {
        logWarning(runId, "Cannot start a run while another one is in progress");
        return false;
      }
      startedRunId = UUID.randomUUID().toString();
      runId = startedRunId;
      verdict = null;
      executor.initialize(startedRunId);
      simulationState.markStarted();
      phase.set(SimulationPhase.RUNNING);
      statistics.runStarted(startedRunId);
      statistics.record(currentConfiguration());
      dispatch(SimulationEvent.runStarted(startedRunId));
      logInfo(startedRunId, "Started run in " + config.getRunMode() + " mode");
    } finally {
      simulatorWriteLock.unlock();
    }

    switch (config.getRunMode()) {
      case AUTO_CALLER_THREAD:
        runLoop(startedRunId);
        break;
      case AUTO_ASYNC:
        final SimulationRunner asyncRunner = new SimulationRunner(startedRunId);
        runner = asyncRunner;
        asyncRunner.start();
        break;
      case MANUAL:
      default:
        break;
    }
    return true;
  }

  @Override
  public boolean stop() throws PdaSimulatorException {
    acquire(simulatorWriteLock, "Timed out while trying to stop run");
    try {
      if (phase.get() != SimulationPhase.RUNNING) {
        logInfo(runId, "No run in progress, nothing to stop");
        return false;
      }
      phase.set(SimulationPhase.STOPPED);
      simulationState.markFinished();
      stack.reset();
      statistics.runStopped();
      dispatch(SimulationEvent.runStopped(runId));
      logInfo(runId, "Stopped run with " + statistics);
      return true;
    } finally {
      simulatorWriteLock.unlock();
    }
  }

  @Override
  public boolean reset() throws PdaSimulatorException {
    acquire(simulatorWriteLock, "Timed out while trying to reset simulator");
    try {
      phase.set(SimulationPhase.NOT_STARTED);
      verdict = null;
      executor.initialize(runId);
      statistics.runReset();
      statistics.record(currentConfiguration());
      dispatch(SimulationEvent.runReset(runId));
      return true;
    } finally {
      simulatorWriteLock.unlock();
    }
  }

  @Override
  public Optional<StepOutcome> step() throws PdaSimulatorException {
    return step(null);
  }

  /**
   * Steps the current run. A non-null expected run id makes it a no-op unless that run is still the
   * current one, checked under the write lock.
   */
  private Optional<StepOutcome> step(final String expectedRunId) throws PdaSimulatorException {
    acquire(simulatorWriteLock, "Timed out while trying to step run");
    try {
      if (phase.get() != SimulationPhase.RUNNING
          || (expectedRunId != null && !expectedRunId.equals(runId))) {
        return Optional.empty();
      }
      final Optional<StepOutcome> outcome = executor.step();
      if (outcome.isPresent()) {
        statistics.stepped(outcome.get());
        if (outcome.get().isTerminal()) {
          verdict = outcome.get();
          phase.set(SimulationPhase.FINISHED);
          logInfo(runId, "Finished run with " + statistics);
        } else {
          statistics.record(currentConfiguration());
        }
      }
      return outcome;
    } finally {
      simulatorWriteLock.unlock();
    }
  }

  @Override
  public boolean awaitCompletion(final long timeoutMillis) throws PdaSimulatorException {
    final SimulationRunner asyncRunner = runner;
    if (asyncRunner != null) {
      try {
        asyncRunner.join(timeoutMillis);
      } catch (InterruptedException exception) {
        Thread.currentThread().interrupt();
        throw new PdaSimulatorException(Code.INTERRUPTED, exception);
      }
    }
    return phase.get() != SimulationPhase.RUNNING;
  }

  @Override
  public SimulationPhase getPhase() {
    return phase.get();
  }

  @Override
  public SimulationState readSimulationState() throws PdaSimulatorException {
    acquire(simulatorReadLock, "Timed out while trying to read simulation state");
    try {
      return simulationState.copy();
    } finally {
      simulatorReadLock.unlock();
    }
  }

  @Override
  public List<String> readStack() throws PdaSimulatorException {
    acquire(simulatorReadLock, "Timed out while trying to read stack");
    try {
      return stack.snapshot();
    } finally {
      simulatorReadLock.unlock();
    }
  }

  @Override
  public Optional<StepOutcome> getVerdict() {
    return Optional.ofNullable(verdict);
  }

  @Override
  public void addListener(final SimulationListener listener) {
    if (listener != null) {
      listeners.add(listener);
    }
  }

  @Override
  public void removeListener(final SimulationListener listener) {
    listeners.remove(listener);
  }

  @Override
  public String getId() {
    return simulatorId;
  }

  @Override
  public PushdownAutomaton getAutomaton() {
    return automaton;
  }

  @Override
  public SimulatorConfiguration getConfiguration() {
    return config;
  }

  @Override
  public SimulationStatistics getStatistics() {
    return statistics;
  }

  /**
   * Step until the given run halts, is stopped or is superseded by another run, pausing between
   * steps for the configured delay.
   */
  private void runLoop(final String loopRunId) throws PdaSimulatorException {
    while (isCurrentRun(loopRunId)) {
      step(loopRunId);
      if (!isCurrentRun(loopRunId)) {
        break;
      }
      pause();
    }
    logDebug(loopRunId, "Step loop exited in phase " + phase.get());
  }

  private boolean isCurrentRun(final String loopRunId) {
    return phase.get() == SimulationPhase.RUNNING && loopRunId.equals(runId);
  }

  private void pause() throws PdaSimulatorException {
    if (config.getStepDelayMillis() <= 0L) {
      return;
    }
    try {
      Thread.sleep(config.getStepDelayMillis());
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new PdaSimulatorException(Code.INTERRUPTED, exception);
    }
  }

  private Configuration currentConfiguration() {
    return new Configuration(simulationState.getCurrentState(),
        simulationState.getCurrentInputIndex(), stack.snapshot());
  }

  private void dispatch(final SimulationEvent event) {
    for (final SimulationListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException problem) {
        logError(event.getRunId(), "Listener failed to handle " + event, problem);
      }
    }
  }

  private static void acquire(final Lock lock, final String timeoutMessage)
      throws PdaSimulatorException {
    try {
      if (!lock.tryLock(lockAcquisitionMillis, TimeUnit.MILLISECONDS)) {
        throw new PdaSimulatorException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, timeoutMessage);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new PdaSimulatorException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
  }

  private void logError(final String runId, final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[s:").append(simulatorId).append("][r:")
        .append(runId).append("] ").append(message).toString(), error);
  }

  private void logWarning(final String runId, final String message) {
    logger.warn(new StringBuilder().append("[s:").append(simulatorId).append("][r:").append(runId)
        .append("] ").append(message).toString());
  }

  private void logInfo(final String runId, final String message) {
    logger.info(new StringBuilder().append("[s:").append(simulatorId).append("][r:").append(runId)
        .append("] ").append(message).toString());
  }

  private void logDebug(final String runId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[s:").append(simulatorId).append("][r:")
          .append(runId).append("] ").append(message).toString());
    }
  }

  /**
   * Daemon driving one run in {@link RunMode#AUTO_ASYNC} mode. It exits as soon as its run is no
   * longer the current RUNNING one.
   */
  private final class SimulationRunner extends Thread {
    private final String loopRunId;

    private SimulationRunner(final String loopRunId) {
      this.loopRunId = loopRunId;
      setName("pda-runner-" + loopRunId.substring(0, 8));
      setDaemon(true);
      setUncaughtExceptionHandler(new UncaughtExceptionHandler() {
        @Override
        public void uncaughtException(Thread thread, Throwable error) {
          logError(loopRunId, "Unhandled exception in simulation runner", error);
        }
      });
    }

    @Override
    public void run() {
      try {
        runLoop(loopRunId);
      } catch (PdaSimulatorException problem) {
        logError(loopRunId, "Simulation runner failed, stopping run", problem);
        // an interrupt left pending would fail the lock acquisition of the stop
        Thread.interrupted();
        try {
          if (loopRunId.equals(runId)) {
            PdaSimulatorImpl.this.stop();
          }
        } catch (PdaSimulatorException stopProblem) {
          logError(loopRunId, "Failed to stop run after runner failure", stopProblem);
        }
      }
    }
  }

}
