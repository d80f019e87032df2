package com.gridcalc.app.formula.functions;

import com.gridcalc.app.formula.EvaluationException;
import com.gridcalc.app.formula.Values;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Date and time functions over serial numbers: whole days since 1899-12-30,
 * with the fraction holding the time of day. The clock comes from the evaluation context.
 */
final class DateFunctions {

    static final LocalDate EPOCH = LocalDate.of(1899, 12, 30);
    private static final double SECONDS_PER_DAY = 86400d;

    private DateFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("TODAY", 0, 0, args -> CellValue.number(toSerial(LocalDate.now(args.clock()))));
        registry.register("NOW", 0, 0, args -> CellValue.number(toSerial(LocalDateTime.now(args.clock()))));
        registry.register("DATE", 3, 3, DateFunctions::date);
        registry.register("YEAR", 1, 1, args -> CellValue.number(dateTime(args, 0).getYear()));
        registry.register("MONTH", 1, 1, args -> CellValue.number(dateTime(args, 0).getMonthValue()));
        registry.register("DAY", 1, 1, args -> CellValue.number(dateTime(args, 0).getDayOfMonth()));
        registry.register("HOUR", 1, 1, args -> CellValue.number(dateTime(args, 0).getHour()));
        registry.register("MINUTE", 1, 1, args -> CellValue.number(dateTime(args, 0).getMinute()));
        registry.register("SECOND", 1, 1, args -> CellValue.number(dateTime(args, 0).getSecond()));
        registry.register("WEEKDAY", 1, 2, DateFunctions::weekday);
        registry.register("DATEDIF", 3, 3, DateFunctions::datedif);
    }

    static double toSerial(LocalDate date) {
        return ChronoUnit.DAYS.between(EPOCH, date);
    }

    static double toSerial(LocalDateTime dateTime) {
        double days = ChronoUnit.DAYS.between(EPOCH, dateTime.toLocalDate());
        return days + dateTime.toLocalTime().toSecondOfDay() / SECONDS_PER_DAY;
    }

    static LocalDateTime fromSerial(double serial) {
        if (serial < 0 || Double.isNaN(serial) || Double.isInfinite(serial)) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        long days = (long) Math.floor(serial);
        long seconds = Math.round((serial - days) * SECONDS_PER_DAY);
        return EPOCH.atStartOfDay().plusDays(days).plusSeconds(seconds);
    }

    /**
     * Reads a date argument given as a serial number or ISO-8601 text.
     */
    static LocalDateTime dateTime(FunctionArgs args, int index) {
        CellValue value = Values.requireNonError(args.value(index));
        if (value.isString() && !Values.isNumericText(value.getText())) {
            String text = value.getText().trim();
            try {
                if (text.length() <= 10) {
                    return LocalDate.parse(text).atStartOfDay();
                }
                return LocalDateTime.parse(text);
            } catch (DateTimeParseException e) {
                throw new EvaluationException(ErrorCode.VALUE);
            }
        }
        return fromSerial(Values.toNumber(value));
    }

    /**
     * DATE(year, month, day); months and days outside their usual range roll over,
     * and years below 1900 are offset by 1900.
     */
    private static CellValue date(FunctionArgs args) {
        int year = args.integer(0);
        int month = args.integer(1);
        int day = args.integer(2);
        if (year < 0 || year > 9999) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        if (year < 1900) {
            year += 1900;
        }
        LocalDate date = LocalDate.of(year, 1, 1).plusMonths(month - 1L).plusDays(day - 1L);
        double serial = toSerial(date);
        if (serial < 0) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        return CellValue.number(serial);
    }

    private static CellValue weekday(FunctionArgs args) {
        DayOfWeek day = dateTime(args, 0).getDayOfWeek();
        int type = args.has(1) ? args.integer(1) : 1;
        // DayOfWeek: MONDAY = 1 .. SUNDAY = 7
        int iso = day.getValue();
        switch (type) {
            case 1:
                return CellValue.number(iso % 7 + 1);
            case 2:
                return CellValue.number(iso);
            case 3:
                return CellValue.number(iso - 1);
            default:
                throw new EvaluationException(ErrorCode.VALUE);
        }
    }

    private static CellValue datedif(FunctionArgs args) {
        LocalDate start = dateTime(args, 0).toLocalDate();
        LocalDate end = dateTime(args, 1).toLocalDate();
        String unit = args.text(2).trim().toUpperCase(Locale.ROOT);
        if (start.isAfter(end)) {
            throw new EvaluationException(ErrorCode.VALUE);
        }
        switch (unit) {
            case "Y":
                return CellValue.number(ChronoUnit.YEARS.between(start, end));
            case "M":
                return CellValue.number(ChronoUnit.MONTHS.between(start, end));
            case "D":
                return CellValue.number(ChronoUnit.DAYS.between(start, end));
            case "MD": {
                LocalDate anchor = start.plusMonths(ChronoUnit.MONTHS.between(start, end));
                return CellValue.number(ChronoUnit.DAYS.between(anchor, end));
            }
            case "YM":
                return CellValue.number(ChronoUnit.MONTHS.between(start, end) % 12);
            case "YD": {
                LocalDate anchor = start.plusYears(ChronoUnit.YEARS.between(start, end));
                return CellValue.number(ChronoUnit.DAYS.between(anchor, end));
            }
            default:
                throw new EvaluationException(ErrorCode.VALUE);
        }
    }
}
