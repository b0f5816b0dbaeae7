/**
 * Delivery of the event log to handlers, with catch-up and live modes.
 */
package io.github.goodees.esp.core.subscription;
