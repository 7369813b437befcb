/**
 * Micrometer bridge for exporting delivery metrics to Prometheus, Grafana and other backends.
 *
 * @see hookrelay.micrometer.MicrometerMetricsExporter
 */
package hookrelay.micrometer;
