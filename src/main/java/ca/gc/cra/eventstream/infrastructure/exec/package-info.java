/**
 * Executor factories for subscription worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the per-topic worker threads.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Security:</strong> Thread names carry only a prefix and index, never topic credentials.</p>
 */
package ca.gc.cra.eventstream.infrastructure.exec;
