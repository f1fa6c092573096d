/**
 * Request and response types shared by the sync and async clients.
 */
package ai.attackframework.tools.opensearch.model;
