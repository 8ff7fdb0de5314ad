package io.sweepnotify.catalog;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.sweepnotify.model.LocationSegment;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current segment catalog for a fixed time-to-live, reloading it on first use after
 * expiry. Construct one per process and pass it to whatever needs segments.
 */
public final class SegmentCache {
  private static final Logger log = LoggerFactory.getLogger(SegmentCache.class);
  private static final String KEY = "catalog";

  private final CatalogLoader loader;
  private final Cache<String, SegmentCatalog> cache;

  /**
   * Creates a cache backed by the system ticker.
   *
   * @param loader the catalog source
   * @param ttl how long a loaded catalog is served before reloading
   */
  public SegmentCache(CatalogLoader loader, Duration ttl) {
    this(loader, ttl, Ticker.systemTicker());
  }

  SegmentCache(CatalogLoader loader, Duration ttl, Ticker ticker) {
    this.loader = loader;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(1)
            .expireAfterWrite(ttl)
            .ticker(ticker)
            .executor(Runnable::run)
            .build();
  }

  /**
   * Returns the current catalog, loading it if absent or expired.
   *
   * @return the catalog
   * @throws UncheckedIOException if loading fails
   */
  public SegmentCatalog catalog() {
    return cache.get(KEY, k -> reload());
  }

  /**
   * Looks up one segment.
   *
   * @param segmentId the segment id
   * @return the segment, if known
   */
  public Optional<LocationSegment> find(String segmentId) {
    return catalog().find(segmentId);
  }

  /**
   * Resolves a selection of segment ids. Unknown ids are skipped with a warning.
   *
   * @param segmentIds the selected ids
   * @return the known segments in selection order
   */
  public List<LocationSegment> resolve(Collection<String> segmentIds) {
    SegmentCatalog catalog = catalog();
    List<LocationSegment> found = new ArrayList<>();
    for (String id : segmentIds) {
      Optional<LocationSegment> segment = catalog.find(id);
      if (segment.isPresent()) {
        found.add(segment.get());
      } else {
        log.warn("Unknown segment id {}, skipping", id);
      }
    }
    return found;
  }

  /** Drops the cached catalog so the next call reloads it. */
  public void invalidate() {
    cache.invalidateAll();
  }

  private SegmentCatalog reload() {
    try {
      SegmentCatalog catalog = loader.load();
      log.debug("Catalog reloaded: {} segments", catalog.size());
      return catalog;
    } catch (IOException e) {
      log.error("Failed to load segment catalog", e);
      throw new UncheckedIOException(e);
    }
  }
}
