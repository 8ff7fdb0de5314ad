package io.sweepnotify.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * The next reminder to wait for.
 *
 * @param when the send time
 * @param stage the stage that becomes due at {@code when}
 * @param occurrenceDate the civil date of the occurrence being reminded of
 */
public record NextReminder(Instant when, Stage stage, LocalDate occurrenceDate) {}
