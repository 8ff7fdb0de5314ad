package io.sweepnotify.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sweepnotify.SweepException;
import io.sweepnotify.model.LocationSegment;
import io.sweepnotify.model.RecurringSchedule;
import io.sweepnotify.parser.ScheduleParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the street-segments file written by the ingest job.
 *
 * <pre>
 * {"version": "...", "generatedAt": "...", "count": 2,
 *  "segments": [{"cnn": "123", "streetName": "Chestnut St", "fromAddress": "2801",
 *                "toAddress": "2899",
 *                "schedules": [{"side": "North", "dayOfWeek": 2, "startTime": "08:00",
 *                               "endTime": "10:00", "weeksOfMonth": [1, 2, 3, 4, 5]}]}]}
 * </pre>
 *
 * <p>The block number is the leading digits of {@code fromAddress} floored to the hundred. A
 * {@code Both} schedule applies to each side; the first schedule seen for a side wins. Schedule
 * rows that do not parse are skipped with a warning.
 */
public final class JsonCatalogLoader implements CatalogLoader {
  private static final Logger log = LoggerFactory.getLogger(JsonCatalogLoader.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d+)");

  private final Path path;

  /**
   * Creates a loader for a file.
   *
   * @param path the segments file
   */
  public JsonCatalogLoader(Path path) {
    this.path = path;
  }

  @Override
  public SegmentCatalog load() throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      SegmentCatalog catalog = read(in);
      log.info("Loaded {} segments from {} (version {})", catalog.size(), path, catalog.version());
      return catalog;
    }
  }

  /**
   * Decodes a segments document.
   *
   * @param in the JSON document
   * @return the catalog
   * @throws IOException if the document is not valid JSON of the expected shape
   */
  public static SegmentCatalog read(InputStream in) throws IOException {
    SegmentsFile file = MAPPER.readValue(in, SegmentsFile.class);
    List<LocationSegment> segments = new ArrayList<>();
    if (file.segments() != null) {
      for (SegmentRow row : file.segments()) {
        if (row.cnn() == null || row.cnn().isBlank() || row.streetName() == null) {
          log.warn("Skipping segment without id or street: {}", row);
          continue;
        }
        segments.add(toSegment(row));
      }
    }
    if (file.count() != null && file.count() != segments.size()) {
      log.warn("Segments file declares {} segments, read {}", file.count(), segments.size());
    }
    return SegmentCatalog.of(file.version(), file.generatedAt(), segments);
  }

  static int blockNumber(String fromAddress) {
    if (fromAddress == null) {
      return 0;
    }
    Matcher m = LEADING_DIGITS.matcher(fromAddress.trim());
    if (!m.find()) {
      return 0;
    }
    try {
      return Integer.parseInt(m.group(1)) / 100 * 100;
    } catch (NumberFormatException e) {
      log.warn("Address number too large: {}", fromAddress);
      return 0;
    }
  }

  private static LocationSegment toSegment(SegmentRow row) {
    RecurringSchedule north = null;
    RecurringSchedule south = null;

    if (row.schedules() != null) {
      for (ScheduleRow s : row.schedules()) {
        RecurringSchedule schedule;
        try {
          schedule =
              ScheduleParser.parse(
                  s.dayOfWeek() == null ? -1 : s.dayOfWeek(),
                  s.startTime(),
                  s.endTime(),
                  ScheduleParser.frequencyFromWeeks(
                      s.weeksOfMonth() == null ? List.of() : s.weeksOfMonth()));
        } catch (SweepException e) {
          log.warn("Skipping schedule of segment {}: {}", row.cnn(), e.getMessage());
          continue;
        }

        String side = s.side() == null ? "Both" : s.side();
        boolean both = side.equalsIgnoreCase("Both");
        if ((both || side.equalsIgnoreCase("North")) && north == null) {
          north = schedule;
        }
        if ((both || side.equalsIgnoreCase("South")) && south == null) {
          south = schedule;
        }
      }
    }

    return new LocationSegment(
        row.cnn(), blockNumber(row.fromAddress()), row.streetName(), north, south);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SegmentsFile(
      String version, String generatedAt, Integer count, List<SegmentRow> segments) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SegmentRow(
      String cnn,
      String streetName,
      String fromAddress,
      String toAddress,
      List<ScheduleRow> schedules) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ScheduleRow(
      String side,
      Integer dayOfWeek,
      String startTime,
      String endTime,
      List<Integer> weeksOfMonth) {}
}
