/**
 * In-process event distribution for the control-plane daemon.
 *
 * <p>{@link io.forged.events.EventBus} is the entry point for producers
 * ({@code publish} and the typed helpers) and for the streaming transport
 * ({@code subscribe}, {@code unsubscribe}). It composes a bounded
 * {@link io.forged.events.EventStore} for cursor replay with a
 * {@link io.forged.events.SubscriptionRegistry} that fans live events out to
 * bounded per-subscriber channels, dropping on full rather than blocking.
 */
package io.forged.events;
