/**
 * Two-tier event storage: a per-tenant ring buffer in front of the durable log, and the
 * catch-up answers computed from them.
 */
package eventsync.store;
