package io.spendwise.ledger.recurring;

import static org.assertj.core.api.Assertions.assertThat;

import io.spendwise.ledger.entry.EntryCategory;
import io.spendwise.ledger.entry.EntryType;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class NextOccurrenceCalculatorTest {

  private final NextOccurrenceCalculator calculator = new NextOccurrenceCalculator(ZoneOffset.UTC);

  // ---- next(): daily ----

  @Test
  void dailyAddsOneDayKeepingTimeOfDay() {
    var template = daily(at("2024-03-01T09:30:00Z"), null);
    assertThat(calculator.next(template, at("2024-03-10T09:30:00Z")))
        .contains(at("2024-03-11T09:30:00Z"));
  }

  @Test
  void dailyEndDateTwelveHoursAfterReferenceYieldsNoOccurrence() {
    Instant reference = at("2024-03-10T00:00:00Z");
    var template = daily(at("2024-03-01T00:00:00Z"), reference.plus(Duration.ofHours(12)));
    assertThat(calculator.next(template, reference)).isEmpty();
  }

  @Test
  void endDateIsExclusive() {
    Instant reference = at("2024-03-10T00:00:00Z");
    var endingExactlyOnNext = daily(at("2024-03-01T00:00:00Z"), at("2024-03-11T00:00:00Z"));
    var endingJustAfterNext = daily(at("2024-03-01T00:00:00Z"), at("2024-03-11T00:00:01Z"));

    assertThat(calculator.next(endingExactlyOnNext, reference)).isEmpty();
    assertThat(calculator.next(endingJustAfterNext, reference))
        .contains(at("2024-03-11T00:00:00Z"));
  }

  // ---- next(): weekly ----

  @Test
  void weeklySameWeekdayAdvancesSevenDays() {
    // 2024-03-10 is a Sunday
    var template = weekly(0);
    assertThat(calculator.next(template, at("2024-03-10T08:00:00Z")))
        .contains(at("2024-03-17T08:00:00Z"));
  }

  @Test
  void weeklyMovesToLaterWeekdayOfSameWeek() {
    var template = weekly(3);
    assertThat(calculator.next(template, at("2024-03-10T08:00:00Z")))
        .contains(at("2024-03-13T08:00:00Z"));
  }

  @Test
  void weeklyWrapsIntoFollowingWeek() {
    // Wednesday -> Monday
    var template = weekly(1);
    assertThat(calculator.next(template, at("2024-03-13T08:00:00Z")))
        .contains(at("2024-03-18T08:00:00Z"));
  }

  @Test
  void weeklySaturdayToSunday() {
    var template = weekly(0);
    assertThat(calculator.next(template, at("2024-03-16T08:00:00Z")))
        .contains(at("2024-03-17T08:00:00Z"));
  }

  // ---- next(): monthly ----

  @Test
  void monthlyMovesToSameDayOfNextMonth() {
    var template = monthly(5);
    assertThat(calculator.next(template, at("2024-01-05T00:00:00Z")))
        .contains(at("2024-02-05T00:00:00Z"));
  }

  @Test
  void monthEndHandling_jan31ToFeb28InNonLeapYear() {
    var template = monthly(31);
    assertThat(calculator.next(template, at("2023-01-31T00:00:00Z")))
        .contains(at("2023-02-28T00:00:00Z"));
  }

  @Test
  void monthEndHandling_jan31ToFeb29InLeapYear() {
    var template = monthly(31);
    assertThat(calculator.next(template, at("2024-01-31T00:00:00Z")))
        .contains(at("2024-02-29T00:00:00Z"));
  }

  @Test
  void monthEndHandling_clampedDayRecoversInLongerMonth() {
    var template = monthly(31);
    assertThat(calculator.next(template, at("2023-02-28T00:00:00Z")))
        .contains(at("2023-03-31T00:00:00Z"));
  }

  @Test
  void monthlyFromDecemberRollsIntoJanuary() {
    var template = monthly(15);
    assertThat(calculator.next(template, at("2024-12-15T10:00:00Z")))
        .contains(at("2025-01-15T10:00:00Z"));
  }

  // ---- next(): yearly ----

  @Test
  void yearlyMovesToSameDateNextYear() {
    var template = yearly(5, at("2023-06-15T00:00:00Z"));
    assertThat(calculator.next(template, at("2023-06-15T00:00:00Z")))
        .contains(at("2024-06-15T00:00:00Z"));
  }

  @Test
  void yearlyLeapDayClampsToFeb28() {
    var template = yearly(1, at("2024-02-29T00:00:00Z"));
    assertThat(calculator.next(template, at("2024-02-29T00:00:00Z")))
        .contains(at("2025-02-28T00:00:00Z"));
  }

  // ---- firstOnOrAfter() ----

  @Test
  void firstOnOrAfter_returnsReferenceWhenDateMatches() {
    var template = monthly(10);
    assertThat(calculator.firstOnOrAfter(template, at("2024-03-10T09:00:00Z")))
        .contains(at("2024-03-10T09:00:00Z"));
  }

  @Test
  void firstOnOrAfter_monthlyLaterInSameMonth() {
    var template = monthly(20);
    assertThat(calculator.firstOnOrAfter(template, at("2024-03-10T09:00:00Z")))
        .contains(at("2024-03-20T09:00:00Z"));
  }

  @Test
  void firstOnOrAfter_monthlyDayAlreadyPassedMovesToNextMonth() {
    var template = monthly(5);
    assertThat(calculator.firstOnOrAfter(template, at("2024-03-10T09:00:00Z")))
        .contains(at("2024-04-05T09:00:00Z"));
  }

  @Test
  void firstOnOrAfter_weeklySameDayIsKept() {
    var template = weekly(0);
    assertThat(calculator.firstOnOrAfter(template, at("2024-03-10T09:00:00Z")))
        .contains(at("2024-03-10T09:00:00Z"));
  }

  @Test
  void firstOnOrAfter_yearlyLaterThisYear() {
    var template = yearly(5, at("2020-06-15T00:00:00Z"));
    assertThat(calculator.firstOnOrAfter(template, at("2024-03-10T00:00:00Z")))
        .contains(at("2024-06-15T00:00:00Z"));
  }

  @Test
  void firstOnOrAfter_yearlyAlreadyPassedThisYear() {
    var template = yearly(0, at("2020-01-15T00:00:00Z"));
    assertThat(calculator.firstOnOrAfter(template, at("2024-03-10T00:00:00Z")))
        .contains(at("2025-01-15T00:00:00Z"));
  }

  // ---- upcoming() ----

  @Test
  void upcoming_keepsOccurrenceStillAheadThisMonth() {
    var template = monthly(20);
    Instant now = at("2024-03-10T09:00:00Z");

    assertThat(calculator.upcoming(template, now)).contains(at("2024-03-20T00:00:00Z"));
    assertThat(calculator.next(template, now)).contains(at("2024-04-20T09:00:00Z"));
  }

  @Test
  void upcoming_usesStartTimeOfDay() {
    var template = monthly(5);
    assertThat(calculator.upcoming(template, at("2024-03-10T09:00:00Z")))
        .contains(at("2024-04-05T00:00:00Z"));
  }

  @Test
  void upcoming_isStrictlyAfterReference() {
    var template = monthly(10);
    assertThat(calculator.upcoming(template, at("2024-03-10T09:00:00Z")))
        .contains(at("2024-04-10T00:00:00Z"));
  }

  @Test
  void upcoming_dailyLaterToday() {
    var template = daily(at("2024-03-01T12:00:00Z"), null);
    assertThat(calculator.upcoming(template, at("2024-03-10T09:00:00Z")))
        .contains(at("2024-03-10T12:00:00Z"));
  }

  @Test
  void upcoming_emptyWhenEndDatePassed() {
    var template = daily(at("2024-03-01T00:00:00Z"), at("2024-03-05T00:00:00Z"));
    assertThat(calculator.upcoming(template, at("2024-03-10T09:00:00Z"))).isEmpty();
  }

  // ---- business zone ----

  @Test
  void calendarArithmeticFollowsBusinessZone() {
    var newYork = new NextOccurrenceCalculator(ZoneId.of("America/New_York"));
    var template = monthly(1);
    // 2024-01-31 23:00 in New York
    Instant reference = at("2024-02-01T04:00:00Z");

    assertThat(newYork.next(template, reference)).contains(at("2024-02-02T04:00:00Z"));
    assertThat(calculator.next(template, reference)).contains(at("2024-03-01T04:00:00Z"));
  }

  // ---- helpers ----

  private static Instant at(String iso) {
    return Instant.parse(iso);
  }

  private static RecurringTemplate daily(Instant startDate, Instant endDate) {
    return template(Frequency.DAILY, startDate, endDate, null, null, null);
  }

  private static RecurringTemplate weekly(int dayOfWeek) {
    return template(Frequency.WEEKLY, at("2024-01-01T00:00:00Z"), null, null, dayOfWeek, null);
  }

  private static RecurringTemplate monthly(int dayOfMonth) {
    return template(Frequency.MONTHLY, at("2023-01-01T00:00:00Z"), null, dayOfMonth, null, null);
  }

  private static RecurringTemplate yearly(int month, Instant startDate) {
    return template(Frequency.YEARLY, startDate, null, null, null, month);
  }

  private static RecurringTemplate template(
      Frequency frequency,
      Instant startDate,
      Instant endDate,
      Integer dayOfMonth,
      Integer dayOfWeek,
      Integer month) {
    return new RecurringTemplate(
        "user_calc",
        EntryType.EXPENSE,
        new BigDecimal("10.00"),
        EntryCategory.UTILITIES,
        null,
        frequency,
        startDate,
        endDate,
        dayOfMonth,
        dayOfWeek,
        month);
  }
}
