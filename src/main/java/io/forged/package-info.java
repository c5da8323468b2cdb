/**
 * forged control-plane event distribution.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.forged.events.EventBus} publishes, retains, filters and fans out daemon events.</li>
 *   <li>{@code io.forged.model.Event} is the immutable unit every producer and consumer exchanges.</li>
 *   <li>{@code io.forged.config.EventBusConfig} sizes the bus from an optional settings file.</li>
 *   <li>{@code io.forged.cli.ForgedEventsCommand} exposes settings and a local simulation.</li>
 * </ul>
 */
package io.forged;
