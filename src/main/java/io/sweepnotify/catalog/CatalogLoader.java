package io.sweepnotify.catalog;

import java.io.IOException;

/** Source of segment catalog snapshots. */
@FunctionalInterface
public interface CatalogLoader {
  /**
   * Reads a fresh snapshot.
   *
   * @return the catalog
   * @throws IOException if the source cannot be read or decoded
   */
  SegmentCatalog load() throws IOException;
}
