package com.github.pdasimulator;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.pdasimulator.PdaSimulator.PdaSimulatorBuilder;
import com.github.pdasimulator.PdaSimulatorTest.Automata;
import com.github.pdasimulator.SimulatorConfiguration.SimulatorConfigurationBuilder;

public class PdaSimulatorBenchmark {

  @Benchmark
  public StepOutcome testAnBnRun() throws PdaSimulatorException {
    // 1. prep automaton and simulator
    final SimulatorConfiguration config = SimulatorConfigurationBuilder.newBuilder()
        .runMode(RunMode.AUTO_CALLER_THREAD).stepDelayMillis(0L).build();
    final PdaSimulator simulator = PdaSimulatorBuilder.newBuilder().config(config)
        .automaton(Automata.anBn("aaaaaaaabbbbbbbb")).build();

    // 2. run to completion on this thread
    simulator.start();

    // 3. report the verdict
    return simulator.getVerdict().get();
  }

  @Benchmark
  public StepOutcome testManualStepping() throws PdaSimulatorException {
    final SimulatorConfiguration config =
        SimulatorConfigurationBuilder.newBuilder().runMode(RunMode.MANUAL).build();
    final PdaSimulator simulator = PdaSimulatorBuilder.newBuilder().config(config)
        .automaton(Automata.anBn("aaaabbbb")).build();
    simulator.start();
    while (simulator.step().isPresent()) {
      // drive until halted
    }
    return simulator.getVerdict().get();
  }

  public static void main(String args[]) throws PdaSimulatorException {
    PdaSimulatorBenchmark benchmark = new PdaSimulatorBenchmark();
    System.out.println(benchmark.testAnBnRun());
    System.out.println(benchmark.testManualStepping());
  }

}
