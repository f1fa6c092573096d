/**
 * Index lifecycle helpers: time-series indexes, aliases, reindex and force merge.
 */
package ai.attackframework.tools.opensearch.index;
