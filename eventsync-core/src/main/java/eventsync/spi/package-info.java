/**
 * Service provider interfaces: persistence, sequence allocation, transport and observability
 * seams that deployments plug their own implementations into.
 */
package eventsync.spi;
