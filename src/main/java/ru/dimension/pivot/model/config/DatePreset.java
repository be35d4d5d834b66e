package ru.dimension.pivot.model.config;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Relative date ranges resolved against the current day, inclusive on both ends
 */
public enum DatePreset {
  TODAY,
  YESTERDAY,
  THIS_WEEK,
  LAST_WEEK,
  THIS_MONTH,
  LAST_MONTH,
  THIS_QUARTER,
  LAST_QUARTER,
  THIS_YEAR,
  LAST_YEAR,
  LAST_7_DAYS,
  LAST_30_DAYS,
  LAST_90_DAYS;

  public LocalDate[] resolve(LocalDate today) {
    return switch (this) {
      case TODAY -> range(today, today);
      case YESTERDAY -> range(today.minusDays(1), today.minusDays(1));
      case THIS_WEEK -> {
        LocalDate start = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        yield range(start, start.plusDays(6));
      }
      case LAST_WEEK -> {
        LocalDate start = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).minusWeeks(1);
        yield range(start, start.plusDays(6));
      }
      case THIS_MONTH -> range(today.withDayOfMonth(1), today.with(TemporalAdjusters.lastDayOfMonth()));
      case LAST_MONTH -> {
        LocalDate previous = today.minusMonths(1);
        yield range(previous.withDayOfMonth(1), previous.with(TemporalAdjusters.lastDayOfMonth()));
      }
      case THIS_QUARTER -> {
        LocalDate start = quarterStart(today);
        yield range(start, start.plusMonths(3).minusDays(1));
      }
      case LAST_QUARTER -> {
        LocalDate start = quarterStart(today).minusMonths(3);
        yield range(start, start.plusMonths(3).minusDays(1));
      }
      case THIS_YEAR -> range(today.withDayOfYear(1), today.with(TemporalAdjusters.lastDayOfYear()));
      case LAST_YEAR -> {
        LocalDate previous = today.minusYears(1);
        yield range(previous.withDayOfYear(1), previous.with(TemporalAdjusters.lastDayOfYear()));
      }
      case LAST_7_DAYS -> range(today.minusDays(6), today);
      case LAST_30_DAYS -> range(today.minusDays(29), today);
      case LAST_90_DAYS -> range(today.minusDays(89), today);
    };
  }

  private static LocalDate quarterStart(LocalDate date) {
    int firstMonth = ((date.getMonthValue() - 1) / 3) * 3 + 1;
    return LocalDate.of(date.getYear(), firstMonth, 1);
  }

  private static LocalDate[] range(LocalDate from, LocalDate to) {
    return new LocalDate[]{from, to};
  }
}
