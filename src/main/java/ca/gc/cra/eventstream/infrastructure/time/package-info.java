/**
 * Clock adapters used to stamp events that carry no event date.
 */
package ca.gc.cra.eventstream.infrastructure.time;
