package io.sweepnotify.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.sweepnotify.SweepException;
import io.sweepnotify.model.NotificationStream;
import io.sweepnotify.model.RecurringSchedule;
import io.sweepnotify.model.Side;
import io.sweepnotify.model.Stage;
import io.sweepnotify.model.StageRecord;
import io.sweepnotify.model.StreamMember;
import io.sweepnotify.parser.ScheduleParser;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts streams and stage records to and from the JSON documents kept by the store.
 *
 * <p>Instants are written as ISO-8601 strings and read from any shape {@link
 * StoreInstantDeserializer} accepts; dates are {@code YYYY-MM-DD}; frequency and stage use their
 * wire names; sides use {@code N}/{@code S}. Missing timestamps are written as {@code null}.
 */
public final class RecordCodec {
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private RecordCodec() {}

  /**
   * Encodes a stream.
   *
   * @param stream the stream
   * @return the JSON document
   */
  public static String encode(NotificationStream stream) {
    List<MemberJson> members = new ArrayList<>();
    for (StreamMember m : stream.members()) {
      members.add(new MemberJson(m.segmentId(), m.blockNumber(), m.side().code()));
    }
    return write(
        new StreamJson(
            stream.ownerId(),
            stream.streamKey(),
            stream.streetName(),
            ScheduleJson.of(stream.schedule()),
            members,
            stream.summary(),
            stream.createdAt(),
            stream.updatedAt()));
  }

  /**
   * Encodes a stage record.
   *
   * @param record the record
   * @return the JSON document
   */
  public static String encode(StageRecord record) {
    return write(
        new StageRecordJson(
            record.ownerId(),
            record.streamKey(),
            record.occurrenceDate(),
            record.occurrenceStart(),
            record.occurrenceEnd(),
            record.stage().wireName(),
            record.issuedAt(),
            record.acknowledged(),
            record.acknowledgedAt()));
  }

  /**
   * Decodes a stream document.
   *
   * @param json the JSON document
   * @return the stream
   * @throws SweepException if the document is malformed
   */
  public static NotificationStream decodeStream(String json) throws SweepException {
    StreamJson s = read(json, StreamJson.class);
    if (s.streamKey() == null || s.schedule() == null) {
      throw SweepException.parse("stream document needs streamKey and schedule", json);
    }
    List<StreamMember> members = new ArrayList<>();
    if (s.members() != null) {
      for (MemberJson m : s.members()) {
        Side side =
            Side.parse(m.side())
                .orElseThrow(() -> SweepException.parse("unknown side " + m.side(), json));
        members.add(new StreamMember(m.segmentId(), m.blockNumber(), side));
      }
    }
    return new NotificationStream(
        s.ownerId(),
        s.streamKey(),
        s.streetName(),
        s.schedule().toSchedule(),
        members,
        s.summary(),
        s.createdAt(),
        s.updatedAt());
  }

  /**
   * Decodes a stage record document.
   *
   * @param json the JSON document
   * @return the record
   * @throws SweepException if the document is malformed
   */
  public static StageRecord decodeStageRecord(String json) throws SweepException {
    StageRecordJson r = read(json, StageRecordJson.class);
    if (r.streamKey() == null || r.occurrenceDate() == null) {
      throw SweepException.parse("stage record needs streamKey and occurrenceDate", json);
    }
    Stage stage =
        Stage.fromWireName(r.stage())
            .orElseThrow(() -> SweepException.parse("unknown stage " + r.stage(), json));
    return new StageRecord(
        r.ownerId(),
        r.streamKey(),
        r.occurrenceDate(),
        r.occurrenceStart(),
        r.occurrenceEnd(),
        stage,
        r.issuedAt(),
        r.acknowledged(),
        r.acknowledgedAt());
  }

  private static String write(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to encode " + value, e);
    }
  }

  private static <T> T read(String json, Class<T> type) throws SweepException {
    try {
      return MAPPER.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw SweepException.parse(
          "malformed " + type.getSimpleName() + ": " + e.getOriginalMessage(), json);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ScheduleJson(int dayOfWeek, String startTime, String endTime, String frequency) {
    static ScheduleJson of(RecurringSchedule s) {
      return new ScheduleJson(
          s.dayOfWeek().number(),
          s.startTime().toString(),
          s.endTime().toString(),
          s.frequency().wireName());
    }

    RecurringSchedule toSchedule() throws SweepException {
      return ScheduleParser.parse(dayOfWeek, startTime, endTime, frequency);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record MemberJson(String segmentId, int blockNumber, String side) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record StreamJson(
      String ownerId,
      String streamKey,
      String streetName,
      ScheduleJson schedule,
      List<MemberJson> members,
      String summary,
      @JsonDeserialize(using = StoreInstantDeserializer.class) Instant createdAt,
      @JsonDeserialize(using = StoreInstantDeserializer.class) Instant updatedAt) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record StageRecordJson(
      String ownerId,
      String streamKey,
      LocalDate occurrenceDate,
      @JsonDeserialize(using = StoreInstantDeserializer.class) Instant occurrenceStart,
      @JsonDeserialize(using = StoreInstantDeserializer.class) Instant occurrenceEnd,
      String stage,
      @JsonDeserialize(using = StoreInstantDeserializer.class) Instant issuedAt,
      boolean acknowledged,
      @JsonDeserialize(using = StoreInstantDeserializer.class) Instant acknowledgedAt) {}
}
