package opsaudit.retention;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Time-of-day arithmetic for the daily retention sweep.
 */
public final class DailySchedule {
  private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("H:mm");

  private DailySchedule() {
  }

  /**
   * Parses an {@code HH:MM} time of day; a single-digit hour is accepted.
   *
   * @param value e.g. {@code 03:00}
   * @return the parsed time
   * @throws DateTimeParseException if the value is not a valid time of day
   */
  public static LocalTime parse(String value) {
    if (value == null) {
      throw new DateTimeParseException("cleanup time is null", "", 0);
    }
    return LocalTime.parse(value.trim(), HH_MM);
  }

  /**
   * Returns the next occurrence of {@code timeOfDay} strictly after {@code now}: today if it is
   * still ahead, else tomorrow. Computed in {@code now}'s zone, so DST transitions shift the
   * instant but not the wall-clock time.
   *
   * @param now       the reference point
   * @param timeOfDay the daily wall-clock time
   * @return the next run
   */
  public static ZonedDateTime nextRun(ZonedDateTime now, LocalTime timeOfDay) {
    Objects.requireNonNull(now, "now");
    Objects.requireNonNull(timeOfDay, "timeOfDay");
    ZonedDateTime today = now.toLocalDate().atTime(timeOfDay).atZone(now.getZone());
    if (today.isAfter(now)) {
      return today;
    }
    return now.toLocalDate().plusDays(1).atTime(timeOfDay).atZone(now.getZone());
  }
}
