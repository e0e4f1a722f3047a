/**
 * agentguard source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentguard.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentguard.cli.GuardCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.agentguard.runtime.ReliabilityRuntime} wires circuits, retries, admission, the dead letter queue and health checks.</li>
 *   <li>{@code io.agentguard.runtime.OperationGuard} is the composed call path for one keyed operation.</li>
 * </ul>
 */
package io.agentguard;
