/**
 * Configuration of event stream processing.
 */
@ConfigurationStyle
package io.github.goodees.esp.core.config;
