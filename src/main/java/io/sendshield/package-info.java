/**
 * SendShield source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.sendshield.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.sendshield.runtime.SendShieldRuntime} wires the components and owns settings reload.</li>
 *   <li>{@code io.sendshield.queue.DispatchQueue} admits, paces, retries and fails outbound messages.</li>
 *   <li>{@code io.sendshield.health.HealthMonitor} scores accounts and gates dispatch.</li>
 * </ul>
 */
package io.sendshield;
