package io.sweepnotify;

import io.sweepnotify.catalog.CatalogLoader;
import io.sweepnotify.catalog.JsonCatalogLoader;
import io.sweepnotify.catalog.SegmentCache;
import io.sweepnotify.config.EngineConfig;
import io.sweepnotify.dispatch.DispatchReport;
import io.sweepnotify.dispatch.MessageTransport;
import io.sweepnotify.dispatch.ReminderDispatcher;
import io.sweepnotify.display.ReminderMessages;
import io.sweepnotify.display.StreamClassifier;
import io.sweepnotify.display.StreamStatus;
import io.sweepnotify.model.NotificationStream;
import io.sweepnotify.model.StageRecord;
import io.sweepnotify.store.AcknowledgeResult;
import io.sweepnotify.store.AcknowledgeService;
import io.sweepnotify.store.InMemoryStageRecordStore;
import io.sweepnotify.store.InMemoryStreamStore;
import io.sweepnotify.store.StageRecordStore;
import io.sweepnotify.store.StreamStore;
import io.sweepnotify.store.StreamSynchronizer;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point wiring the catalog cache, stores, classifier and dispatcher together.
 *
 * <p>Example:
 *
 * <pre>{@code
 * ReminderEngine engine =
 *     ReminderEngine.inMemory(EngineConfig.load(), new LoggingMessageTransport());
 * engine.updateSelection("user-1", List.of("1234", "1235"), Instant.now());
 * DispatchReport report = engine.dispatchDue(Instant.now());
 * }</pre>
 */
public final class ReminderEngine {
  private static final Logger log = LoggerFactory.getLogger(ReminderEngine.class);

  private final StreamStore streams;
  private final StageRecordStore records;
  private final StreamSynchronizer synchronizer;
  private final AcknowledgeService acknowledger;
  private final ReminderDispatcher dispatcher;
  private final StreamClassifier classifier;

  /**
   * Creates an engine.
   *
   * @param config the settings
   * @param loader the segment catalog source
   * @param streams the stream store
   * @param records the stage record store
   * @param transport the outbound channel
   */
  public ReminderEngine(
      EngineConfig config,
      CatalogLoader loader,
      StreamStore streams,
      StageRecordStore records,
      MessageTransport transport) {
    SegmentCache segments = new SegmentCache(loader, config.catalogTtl());
    this.streams = streams;
    this.records = records;
    this.synchronizer = new StreamSynchronizer(segments, streams);
    this.acknowledger = new AcknowledgeService(streams, records, config.zone());
    this.dispatcher =
        new ReminderDispatcher(
            records, transport, new ReminderMessages(config.alertsUrl()), config.zone());
    this.classifier = StreamClassifier.from(config);
    log.info("Engine ready, zone {}, catalog {}", config.zone(), config.catalogPath());
  }

  /**
   * Creates an engine over in-memory stores, reading the catalog from the configured path.
   *
   * @param config the settings
   * @param transport the outbound channel
   * @return the engine
   */
  public static ReminderEngine inMemory(EngineConfig config, MessageTransport transport) {
    return inMemory(config, new JsonCatalogLoader(config.catalogPath()), transport);
  }

  /**
   * Creates an engine over in-memory stores.
   *
   * @param config the settings
   * @param loader the segment catalog source
   * @param transport the outbound channel
   * @return the engine
   */
  public static ReminderEngine inMemory(
      EngineConfig config, CatalogLoader loader, MessageTransport transport) {
    return new ReminderEngine(
        config, loader, new InMemoryStreamStore(), new InMemoryStageRecordStore(), transport);
  }

  /**
   * Replaces a subscriber's selection and re-derives their streams.
   *
   * @param ownerId the subscriber
   * @param segmentIds the selected segment ids
   * @param now the reference instant
   * @return the subscriber's streams as persisted
   */
  public List<NotificationStream> updateSelection(
      String ownerId, Collection<String> segmentIds, Instant now) {
    return synchronizer.synchronize(ownerId, segmentIds, now);
  }

  /**
   * Returns a subscriber's streams bucketed for display.
   *
   * @param ownerId the subscriber
   * @param now the reference instant
   * @return the buckets
   */
  public StreamClassifier.Categorized overview(String ownerId, Instant now) {
    return classifier.categorize(streams.findByOwner(ownerId), records.findByOwner(ownerId), now);
  }

  /**
   * Returns the display status of one stream.
   *
   * @param callerId the subscriber asking
   * @param streamKey the stream
   * @param now the reference instant
   * @return the status
   * @throws SweepException NOT_FOUND or FORBIDDEN
   */
  public StreamStatus status(String callerId, String streamKey, Instant now)
      throws SweepException {
    NotificationStream stream =
        streams.find(streamKey).orElseThrow(() -> SweepException.notFound(streamKey));
    if (!stream.ownerId().equals(callerId)) {
      throw SweepException.forbidden(streamKey);
    }
    return classifier.status(stream, records.findByStream(streamKey), now);
  }

  /**
   * Lists a subscriber's undismissed reminders whose occurrence has not ended.
   *
   * @param ownerId the subscriber
   * @param now the reference instant
   * @return the active alerts
   */
  public List<StageRecord> activeAlerts(String ownerId, Instant now) {
    return classifier.activeAlerts(
        streams.findByOwner(ownerId), records.findByOwner(ownerId), now);
  }

  /**
   * Dismisses one occurrence of a stream.
   *
   * @param callerId the subscriber making the request
   * @param streamKey the stream
   * @param occurrenceDate the occurrence's civil date
   * @param now the reference instant
   * @return the outcome
   * @throws SweepException NOT_FOUND or FORBIDDEN
   */
  public AcknowledgeResult acknowledge(
      String callerId, String streamKey, LocalDate occurrenceDate, Instant now)
      throws SweepException {
    return acknowledger.acknowledge(callerId, streamKey, occurrenceDate, now);
  }

  /**
   * Issues every due reminder stage.
   *
   * @param now the reference instant
   * @return the per-outcome stream keys
   */
  public DispatchReport dispatchDue(Instant now) {
    return dispatcher.dispatchAll(streams.findAll(), now);
  }

  /**
   * Removes stage records whose occurrence ended before a cutoff.
   *
   * @param cutoff the retention cutoff
   * @return the number of records removed
   */
  public int purgeRecordsEndedBefore(Instant cutoff) {
    int removed = records.deleteEndedBefore(cutoff);
    log.info("Purged {} stage records ended before {}", removed, cutoff);
    return removed;
  }
}
