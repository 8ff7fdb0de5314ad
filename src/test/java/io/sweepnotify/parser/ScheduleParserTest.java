package io.sweepnotify.parser;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sweepnotify.ErrorKind;
import io.sweepnotify.SweepException;
import io.sweepnotify.model.Frequency;
import io.sweepnotify.model.RecurringSchedule;
import io.sweepnotify.model.TimeOfDay;
import io.sweepnotify.model.Weekday;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ScheduleParserTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @ParameterizedTest
  @CsvSource({
    "08:00, 8, 0",
    "8:30, 8, 30",
    "8, 8, 0",
    "0800, 8, 0",
    "1330, 13, 30",
    "8am, 8, 0",
    "8:30 PM, 20, 30",
    "12pm, 12, 0",
    "12am, 0, 0",
    "23:59, 23, 59"
  })
  void parsesTimeForms(String text, int hour, int minute) throws SweepException {
    assertEquals(new TimeOfDay(hour, minute), ScheduleParser.parseTime(text));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "24:00", "08:60", "13pm", "0am", "noon", "8.30"})
  void rejectsBadTimes(String text) {
    SweepException e = assertThrows(SweepException.class, () -> ScheduleParser.parseTime(text));
    assertEquals(ErrorKind.PARSE, e.kind());
  }

  @Test
  void parsesDays() throws SweepException {
    assertEquals(Weekday.TUESDAY, ScheduleParser.parseDay("Tue"));
    assertEquals(Weekday.THURSDAY, ScheduleParser.parseDay("thurs"));
    assertEquals(Weekday.SUNDAY, ScheduleParser.parseDay("0"));
    assertEquals(Weekday.SATURDAY, ScheduleParser.parseDay(6));
    assertThrows(SweepException.class, () -> ScheduleParser.parseDay(7));
    assertThrows(SweepException.class, () -> ScheduleParser.parseDay("Funday"));
    assertThrows(SweepException.class, () -> ScheduleParser.parseDay("123"));
  }

  @Test
  void unknownFrequencyFallsBackToWeekly() {
    assertEquals(Frequency.FIRST_AND_THIRD, ScheduleParser.parseFrequency("1st_3rd"));
    assertEquals(Frequency.WEEKLY, ScheduleParser.parseFrequency("fortnightly"));
    assertEquals(Frequency.WEEKLY, ScheduleParser.parseFrequency(null));
  }

  @Test
  void frequencyFromWeeks() {
    assertEquals(Frequency.WEEKLY, ScheduleParser.frequencyFromWeeks(List.of(1, 2, 3, 4, 5)));
    assertEquals(Frequency.WEEKLY, ScheduleParser.frequencyFromWeeks(List.of(1, 2, 3, 4)));
    assertEquals(Frequency.SECOND_AND_FOURTH, ScheduleParser.frequencyFromWeeks(List.of(4, 2)));
    assertEquals(Frequency.THIRD, ScheduleParser.frequencyFromWeeks(List.of(3)));
    assertEquals(Frequency.WEEKLY, ScheduleParser.frequencyFromWeeks(List.of(1, 2)));
  }

  @Test
  void frequencyFromWeekFlags() {
    assertEquals(
        Frequency.FIRST_AND_THIRD, ScheduleParser.frequencyFromWeekFlags("Y", "N", "y", "N", "N"));
    assertEquals(
        Frequency.WEEKLY, ScheduleParser.frequencyFromWeekFlags("1", "1", "1", "1", "1"));
    assertEquals(Frequency.SECOND, ScheduleParser.frequencyFromWeekFlags("N", "Y", null, "", ""));
  }

  @Test
  void parsesJsonSchedule() throws Exception {
    RecurringSchedule s =
        ScheduleParser.parse(
            MAPPER.readTree(
                "{\"dayOfWeek\":2,\"startTime\":\"08:00\",\"endTime\":\"10:00\","
                    + "\"frequency\":\"2nd_4th\"}"));
    assertEquals(RecurringSchedule.of(2, "08:00", "10:00", Frequency.SECOND_AND_FOURTH), s);
  }

  @Test
  void jsonDayMayBeAName() throws Exception {
    RecurringSchedule s =
        ScheduleParser.parse(
            MAPPER.readTree(
                "{\"dayOfWeek\":\"Wednesday\",\"startTime\":\"6am\",\"endTime\":\"8\"}"));
    assertEquals(RecurringSchedule.of(3, "06:00", "08:00", Frequency.WEEKLY), s);
  }

  @Test
  void jsonMissingFieldIsParseError() throws Exception {
    SweepException e =
        assertThrows(
            SweepException.class,
            () ->
                ScheduleParser.parse(
                    MAPPER.readTree("{\"dayOfWeek\":2,\"startTime\":\"08:00\"}")));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertTrue(e.getMessage().contains("endTime"));
  }

  @Test
  void startMustPrecedeEnd() {
    assertThrows(
        SweepException.class, () -> ScheduleParser.parse(2, "10:00", "08:00", "weekly"));
    assertThrows(
        SweepException.class, () -> ScheduleParser.parse(2, "08:00", "08:00", Frequency.WEEKLY));
  }
}
