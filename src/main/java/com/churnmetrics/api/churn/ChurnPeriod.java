package com.churnmetrics.api.churn;

import com.churnmetrics.api.churn.exceptions.InvalidDateFormatException;
import com.churnmetrics.api.churn.exceptions.InvalidDateRangeException;
import lombok.Data;
import lombok.NonNull;
import lombok.val;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static org.apache.commons.lang3.StringUtils.firstNonBlank;
import static org.apache.commons.lang3.StringUtils.trim;

/**
 * A reporting period of whole calendar days, both ends inclusive, in the account's timezone.
 * A period is valid when its end date is on or after its start date.
 */
@Data
public class ChurnPeriod {

    @NonNull
    private final LocalDate startDate;

    @NonNull
    private final LocalDate endDate;

    /**
     * <p>
     * Resolves a period from the given request parameters.</p>
     *
     * <ul>
     *     <li>end date: {@link ChurnParams#getEndDate()}, else {@code endTime}, else {@code to},
     *     else {@code today}.</li>
     *     <li>start date: {@link ChurnParams#getStartDate()}, else {@code startTime}, else {@code
     *     from}, else end date minus {@code defaultRange}.</li>
     * </ul>
     *
     * <p>
     * The resolved period isn't validated; use {@link #isValid()} or {@link #requireValid()}.</p>
     *
     * @param params       request parameters.
     * @param today        the current date in the account's timezone.
     * @param defaultRange period length used when the start date is missing.
     * @return the resolved period.
     * @throws InvalidDateFormatException if a raw date parameter can't be parsed.
     */
    @NonNull
    public static ChurnPeriod resolve(
        @NonNull ChurnParams params,
        @NonNull LocalDate today,
        @NonNull Period defaultRange
    ) throws InvalidDateFormatException {
        var endDate = params.getEndDate();
        if (endDate == null) {
            val raw = firstNonBlank(params.getEndTime(), params.getTo());
            endDate = raw == null ? today : parseDate(raw);
        }

        var startDate = params.getStartDate();
        if (startDate == null) {
            val raw = firstNonBlank(params.getStartTime(), params.getFrom());
            startDate = raw == null ? endDate.minus(defaultRange) : parseDate(raw);
        }

        return new ChurnPeriod(startDate, endDate);
    }

    /**
     * Parses an ISO-8601 date ({@code 2023-12-01}) or date-time, with or without an offset
     * ({@code 2023-12-01T10:00:00Z}, {@code 2023-12-01T10:00:00}); the date part of a date-time is
     * used as is.
     *
     * @throws InvalidDateFormatException if {@code value} is neither.
     */
    @NonNull
    static LocalDate parseDate(@NonNull String value) throws InvalidDateFormatException {
        val trimmed = trim(value);
        try {
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(trimmed).toLocalDate();
            } catch (DateTimeParseException offsetDateTimeError) {
                e.addSuppressed(offsetDateTimeError);
            }

            try {
                return LocalDateTime.parse(trimmed).toLocalDate();
            } catch (DateTimeParseException localDateTimeError) {
                e.addSuppressed(localDateTimeError);
                throw new InvalidDateFormatException(value, e);
            }
        }
    }

    /**
     * @return the inclusive number of days in this period.
     */
    public long timeWindow() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    /**
     * @return the period of the same length that ends on the day before this period starts.
     */
    @NonNull
    public ChurnPeriod previousPeriod() {
        val previousEnd = startDate.minusDays(1);
        return new ChurnPeriod(previousEnd.minusDays(timeWindow() - 1), previousEnd);
    }

    public boolean isValid() {
        return !endDate.isBefore(startDate);
    }

    /**
     * @throws InvalidDateRangeException if the period ends before it starts.
     */
    public void requireValid() throws InvalidDateRangeException {
        if (!isValid()) {
            throw new InvalidDateRangeException(startDate, endDate);
        }
    }

    /**
     * @return all calendar days of this period in chronological order, or an empty list if the
     * period isn't valid.
     */
    @NonNull
    public List<LocalDate> dates() {
        val dates = new ArrayList<LocalDate>();
        for (var date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            dates.add(date);
        }

        return dates;
    }
}
