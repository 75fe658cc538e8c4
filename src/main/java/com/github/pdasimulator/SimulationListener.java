package com.github.pdasimulator;

/**
 * Subscriber to the simulator's observation event stream. Callbacks happen on whichever thread is
 * driving the simulation, implementations should return quickly and must not call back into the
 * simulator's lifecycle methods.
 */
public interface SimulationListener {

  void onEvent(final SimulationEvent event);

}
