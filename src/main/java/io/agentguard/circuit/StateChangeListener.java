package io.agentguard.circuit;

@FunctionalInterface
public interface StateChangeListener {
    StateChangeListener NOOP = (name, from, to) -> {
    };

    void onStateChange(String circuitName, CircuitState from, CircuitState to);
}
