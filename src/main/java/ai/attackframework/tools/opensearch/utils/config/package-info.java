/**
 * Client configuration: immutable settings, environment loading and JSON import/export.
 */
package ai.attackframework.tools.opensearch.utils.config;
