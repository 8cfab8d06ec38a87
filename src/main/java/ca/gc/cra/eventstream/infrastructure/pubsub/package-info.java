/**
 * Runtime discovery of publish/subscribe protocol clients.
 */
package ca.gc.cra.eventstream.infrastructure.pubsub;
