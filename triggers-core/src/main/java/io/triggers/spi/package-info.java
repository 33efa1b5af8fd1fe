/**
 * Service provider interfaces for plugging backends into the trigger framework.
 *
 * @see io.triggers.spi.MetricsExporter
 */
package io.triggers.spi;
