/**
 * Runtime orchestration package.
 *
 * <p>{@link io.sendshield.runtime.SendShieldRuntime} builds the object graph, loads and
 * hot-reloads {@code sendshield-settings.json}, audits admin operations, and exposes the views
 * used by the CLI and the control API.
 */
package io.sendshield.runtime;
