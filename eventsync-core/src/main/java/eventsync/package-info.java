/**
 * Per-tenant ordered event synchronization.
 *
 * <p>{@link eventsync.EventSync} wires the event store, connection registry, presence tracker
 * and background schedulers; {@link eventsync.EventEmitter} is what mutation handlers call after
 * their change commits. The client side lives in {@link eventsync.client}.
 */
package eventsync;
