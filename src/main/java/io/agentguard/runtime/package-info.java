/**
 * Runtime composition package.
 *
 * <p>{@link io.agentguard.runtime.ReliabilityRuntime} owns lifecycle: settings,
 * background timers, script agent loading, dead letter restore and ordered
 * shutdown through {@link io.agentguard.runtime.ShutdownCoordinator}.
 */
package io.agentguard.runtime;
