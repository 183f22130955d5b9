package io.spendwise.ledger.recurring;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Calendar arithmetic for recurring templates. All dates are evaluated in the business zone;
 * {@link #next} and {@link #firstOnOrAfter} carry the reference's local time of day over to the
 * result. No clock reads and no I/O, callers supply the reference instant.
 *
 * <p>Every operation returns empty when the computed occurrence falls on or after the template's
 * end date, which is the signal to deactivate the template.
 */
@Component
public class NextOccurrenceCalculator {

  private final ZoneId zone;

  public NextOccurrenceCalculator(ZoneId businessZone) {
    this.zone = businessZone;
  }

  /**
   * Returns the occurrence following {@code reference}.
   *
   * <ul>
   *   <li>DAILY: one day later
   *   <li>WEEKLY: the next date on {@code dayOfWeek}; the same weekday moves a full week
   *   <li>MONTHLY: {@code dayOfMonth} of the next calendar month, clamped to its last day
   *   <li>YEARLY: {@code month} of the next year, on the start date's day clamped to the month
   * </ul>
   */
  public Optional<Instant> next(RecurringTemplate template, Instant reference) {
    ZonedDateTime from = reference.atZone(zone);
    ZonedDateTime candidate =
        switch (template.getFrequency()) {
          case DAILY -> from.plusDays(1);
          case WEEKLY -> from.plusDays(daysUntilWeekday(from, template.getDayOfWeek(), false));
          case MONTHLY ->
              atClampedDay(from.withDayOfMonth(1).plusMonths(1), template.getDayOfMonth());
          case YEARLY ->
              atClampedDay(
                  from.withDayOfMonth(1).plusYears(1).withMonth(template.getMonth() + 1),
                  anchorDay(template));
        };
    return beforeEndDate(template, candidate);
  }

  /**
   * Returns the earliest occurrence on or after {@code reference}: the reference itself when its
   * date already matches the cadence, otherwise the first matching date after it.
   */
  public Optional<Instant> firstOnOrAfter(RecurringTemplate template, Instant reference) {
    ZonedDateTime from = reference.atZone(zone);
    ZonedDateTime candidate =
        switch (template.getFrequency()) {
          case DAILY -> from;
          case WEEKLY -> from.plusDays(daysUntilWeekday(from, template.getDayOfWeek(), true));
          case MONTHLY -> {
            ZonedDateTime monthStart = from.withDayOfMonth(1);
            ZonedDateTime thisMonth = atClampedDay(monthStart, template.getDayOfMonth());
            yield thisMonth.toLocalDate().isBefore(from.toLocalDate())
                ? atClampedDay(monthStart.plusMonths(1), template.getDayOfMonth())
                : thisMonth;
          }
          case YEARLY -> {
            ZonedDateTime monthStart = from.withDayOfMonth(1).withMonth(template.getMonth() + 1);
            ZonedDateTime thisYear = atClampedDay(monthStart, anchorDay(template));
            yield thisYear.toLocalDate().isBefore(from.toLocalDate())
                ? atClampedDay(monthStart.plusYears(1), anchorDay(template))
                : thisYear;
          }
        };
    return beforeEndDate(template, candidate);
  }

  /**
   * Returns the earliest occurrence strictly after {@code reference}, at the start date's local
   * time of day. Unlike {@link #next}, this does not skip an occurrence still ahead in the
   * reference's own week, month or year, so it is the right choice when recomputing from "now"
   * rather than from a previous occurrence.
   */
  public Optional<Instant> upcoming(RecurringTemplate template, Instant reference) {
    LocalTime timeOfDay = template.getStartDate().atZone(zone).toLocalTime();
    Instant sameDay = reference.atZone(zone).with(timeOfDay).toInstant();
    Optional<Instant> first = firstOnOrAfter(template, sameDay);
    if (first.isPresent() && !first.get().isAfter(reference)) {
      return next(template, first.get());
    }
    return first;
  }

  private Optional<Instant> beforeEndDate(RecurringTemplate template, ZonedDateTime candidate) {
    Instant occurrence = candidate.toInstant();
    if (template.getEndDate() != null && !occurrence.isBefore(template.getEndDate())) {
      return Optional.empty();
    }
    return Optional.of(occurrence);
  }

  private int anchorDay(RecurringTemplate template) {
    return template.getStartDate().atZone(zone).getDayOfMonth();
  }

  // 0 = Sunday, matching the template's dayOfWeek convention
  private static int daysUntilWeekday(ZonedDateTime from, int targetDay, boolean allowSameDay) {
    int current = from.getDayOfWeek().getValue() % 7;
    int days = (targetDay - current + 7) % 7;
    if (days == 0 && !allowSameDay) {
      return 7;
    }
    return days;
  }

  private static ZonedDateTime atClampedDay(ZonedDateTime monthStart, int day) {
    int lastDay = monthStart.toLocalDate().lengthOfMonth();
    return monthStart.withDayOfMonth(Math.min(day, lastDay));
  }
}
