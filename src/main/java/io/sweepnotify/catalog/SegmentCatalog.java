package io.sweepnotify.catalog;

import io.sweepnotify.model.LocationSegment;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable snapshot of the ingested street segments, indexed by segment id.
 *
 * @param version the ingest version tag
 * @param generatedAt when the ingest job produced the file, as written by it
 * @param segments the segments by id, in file order
 */
public record SegmentCatalog(
    String version, String generatedAt, Map<String, LocationSegment> segments) {
  public SegmentCatalog {
    segments = Collections.unmodifiableMap(new LinkedHashMap<>(segments));
  }

  /**
   * Builds a catalog from a list, later duplicates replacing earlier ones.
   *
   * @param version the ingest version tag
   * @param generatedAt the generation timestamp
   * @param segments the segments
   * @return the catalog
   */
  public static SegmentCatalog of(
      String version, String generatedAt, Collection<LocationSegment> segments) {
    Map<String, LocationSegment> byId = new LinkedHashMap<>();
    for (LocationSegment s : segments) {
      byId.put(s.segmentId(), s);
    }
    return new SegmentCatalog(version, generatedAt, byId);
  }

  public Optional<LocationSegment> find(String segmentId) {
    return Optional.ofNullable(segments.get(segmentId));
  }

  public int size() {
    return segments.size();
  }
}
