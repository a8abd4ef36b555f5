/**
 * Warden source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.warden.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.warden.cli.WardenCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.warden.runtime.WardenRuntime} wires a data root into an engine.</li>
 *   <li>{@code io.warden.engine.ExecutionEngine} runs compiled playbooks layer by layer.</li>
 *   <li>{@code io.warden.audit.AuditLedger} is the tamper-evident record of every run.</li>
 * </ul>
 */
package io.warden;
