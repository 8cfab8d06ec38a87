package ca.gc.cra.eventstream.application.port;

import ca.gc.cra.eventstream.domain.error.AuthException;
import ca.gc.cra.eventstream.domain.error.StreamException;
import ca.gc.cra.eventstream.domain.error.TopicLookupException;
import ca.gc.cra.eventstream.domain.stream.Checkpoint;
import ca.gc.cra.eventstream.domain.stream.ReplayPreset;
import ca.gc.cra.eventstream.domain.stream.TopicInfo;

/**
 * <strong>What:</strong> Outbound port to the remote publish/subscribe service.
 * <p><strong>Why:</strong> Keeps the subscription core independent of the wire protocol (auth handshake,
 * binary payload decoding, flow-control credits), which adapters own.</p>
 * <p><strong>Role:</strong> Implemented by protocol client adapters obtained through
 * {@link PubSubClientProvider}; test doubles implement it directly.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Authenticate and resolve the calling user before any topic access.</li>
 *   <li>Report per-topic subscribability for preflight.</li>
 *   <li>Open resumable stream segments that yield decoded events with their replay positions.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #subscribe} is invoked concurrently by one worker per
 * topic; implementations must support concurrent segments. The remaining calls happen once on the
 * startup thread.</p>
 *
 * @implNote Callers close the client after every worker has stopped.
 * @since 0.1.0
 */
public interface PubSubClient extends AutoCloseable {
  /**
   * Performs the authentication handshake and caches the resulting session.
   *
   * @throws AuthException when the token endpoint rejects the credentials or cannot be reached
   */
  void authenticate() throws AuthException;

  /**
   * Fetches the authenticated user's identity, completing session setup.
   *
   * @throws AuthException when the user info lookup fails
   */
  void fetchUserInfo() throws AuthException;

  /**
   * Looks up topic metadata.
   *
   * @param topicName topic to inspect
   * @return topic metadata including the {@code canSubscribe} flag
   * @throws TopicLookupException when the lookup fails
   */
  TopicInfo getTopicInfo(String topicName) throws TopicLookupException;

  /**
   * Opens a new stream segment for a topic.
   *
   * @param topicName topic to subscribe to
   * @param preset where to resume; {@link ReplayPreset#CUSTOM} requires {@code checkpoint}
   * @param checkpoint position to resume after; {@code null} unless {@code preset} is CUSTOM
   * @return open segment; the caller closes it
   * @throws StreamException when the subscribe call itself fails
   */
  EventStream subscribe(String topicName, ReplayPreset preset, Checkpoint checkpoint)
      throws StreamException;

  /**
   * Releases connections held by the client.
   */
  @Override
  void close();
}
