package ca.gc.cra.eventstream.domain.stream;

import java.util.Objects;

/**
 * Per-topic subscription state owned by a single subscription worker.
 *
 * <p>Only the owning worker mutates the checkpoint and state. Fields are volatile so status
 * reporting threads observe a consistent latest value without locking.</p>
 *
 * @since 0.1.0
 */
public final class TopicSubscription {
  private final String topicName;
  private final ReplayPreset replayPreset;
  private volatile Checkpoint checkpoint;
  private volatile SubscriptionState state = SubscriptionState.SUBSCRIBING;
  private volatile long attempts;
  private volatile long eventsReceived;

  /**
   * Creates subscription state for a topic.
   *
   * @param topicName topic to subscribe to
   * @param replayPreset globally configured preset
   * @param initialCheckpoint configured replay id; {@code null} unless the preset is CUSTOM
   */
  public TopicSubscription(String topicName, ReplayPreset replayPreset, Checkpoint initialCheckpoint) {
    this.topicName = Objects.requireNonNull(topicName, "topicName");
    this.replayPreset = Objects.requireNonNull(replayPreset, "replayPreset");
    this.checkpoint = initialCheckpoint;
  }

  public String topicName() {
    return topicName;
  }

  /**
   * Returns the preset configured for the process, regardless of checkpoint progress.
   *
   * @return configured preset
   */
  public ReplayPreset replayPreset() {
    return replayPreset;
  }

  /**
   * Returns the preset the next subscribe attempt must use.
   *
   * <p>A recorded checkpoint always wins over the configured preset.</p>
   *
   * @return {@link ReplayPreset#CUSTOM} when a checkpoint exists, otherwise the configured preset
   */
  public ReplayPreset effectivePreset() {
    return checkpoint != null ? ReplayPreset.CUSTOM : replayPreset;
  }

  /**
   * Returns the last recorded checkpoint.
   *
   * @return checkpoint or {@code null} when nothing has been received yet
   */
  public Checkpoint checkpoint() {
    return checkpoint;
  }

  /**
   * Advances the checkpoint after an event was handed to the fan-in channel.
   *
   * @param next position returned alongside the event
   */
  public void advance(Checkpoint next) {
    this.checkpoint = Objects.requireNonNull(next, "next");
    this.eventsReceived++;
  }

  public SubscriptionState state() {
    return state;
  }

  /**
   * Moves the subscription into {@code next}.
   *
   * @param next new state
   */
  public void transition(SubscriptionState next) {
    this.state = Objects.requireNonNull(next, "next");
  }

  /**
   * Records a subscribe attempt.
   *
   * @return attempt number, starting at one
   */
  public long recordAttempt() {
    return ++attempts;
  }

  public long attempts() {
    return attempts;
  }

  public long eventsReceived() {
    return eventsReceived;
  }

  @Override
  public String toString() {
    return "TopicSubscription[topic=" + topicName
        + ", preset=" + replayPreset
        + ", state=" + state
        + ", checkpoint=" + checkpoint
        + ", attempts=" + attempts
        + ", events=" + eventsReceived + ']';
  }
}
