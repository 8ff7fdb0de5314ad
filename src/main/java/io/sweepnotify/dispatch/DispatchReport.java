package io.sweepnotify.dispatch;

import java.util.List;

/**
 * Result of one dispatch run, as stream keys per outcome.
 *
 * @param issued streams that got a reminder
 * @param skipped streams with nothing due, already recorded, or dismissed
 * @param duplicate streams whose stage another worker recorded first
 * @param failed streams whose dispatch threw; retry on the next run
 */
public record DispatchReport(
    List<String> issued, List<String> skipped, List<String> duplicate, List<String> failed) {
  public DispatchReport {
    issued = List.copyOf(issued);
    skipped = List.copyOf(skipped);
    duplicate = List.copyOf(duplicate);
    failed = List.copyOf(failed);
  }

  public int total() {
    return issued.size() + skipped.size() + duplicate.size() + failed.size();
  }
}
