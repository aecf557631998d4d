/**
 * Micrometer bridge for exporting synchronization metrics to Prometheus, Grafana, and other backends.
 *
 * @see eventsync.micrometer.MicrometerMetricsExporter
 */
package eventsync.micrometer;
