package com.tresComas.financialData.validation.service;

import com.tresComas.financialData.marketdata.dto.RawPriceSeries;
import com.tresComas.financialData.marketdata.model.HistoricalSeries;
import com.tresComas.financialData.marketdata.model.OptionsChain;
import com.tresComas.financialData.marketdata.model.OptionsExpiration;
import com.tresComas.financialData.marketdata.model.PriceBar;
import com.tresComas.financialData.validation.exception.InvalidInputException;
import com.tresComas.financialData.validation.model.DateRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sanitizes user input and provider payloads.
 *
 * Handles:
 * - Ticker canonicalization (all cache keys and store keys use the upper-case form)
 * - Date range defaults and ordering
 * - Best-effort repair of sparse OHLCV series
 * - Filtering of empty option expirations
 * - Required-field checks on filing metadata
 *
 * Input errors throw {@link InvalidInputException}; payload problems return null
 * so that callers can treat them as "no data".
 */
@Slf4j
@Service
public class DataValidator {

    public static final String OPEN = "Open";
    public static final String HIGH = "High";
    public static final String LOW = "Low";
    public static final String CLOSE = "Close";
    public static final String VOLUME = "Volume";

    private static final List<String> REQUIRED_COLUMNS = List.of(OPEN, HIGH, LOW, CLOSE, VOLUME);
    private static final List<String> REQUIRED_FILING_FIELDS =
            List.of("accessionNumber", "filingDate", "form", "primaryDocument");
    private static final LocalDate DEFAULT_START_DATE = LocalDate.of(2000, 1, 1);

    private final Clock clock;

    public DataValidator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Validates a ticker symbol and returns its canonical form.
     *
     * @param ticker Raw ticker as received from the caller
     * @return Trimmed, upper-case ticker
     * @throws InvalidInputException if the ticker is null or blank
     */
    public String validateTicker(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw new InvalidInputException("Ticker must be a non-empty string");
        }
        return ticker.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Validates a date range for historical data.
     * Missing start defaults to 2000-01-01, missing end to today. A reversed range is swapped.
     *
     * @param startDate Start date (yyyy-MM-dd or ISO date-time), may be null
     * @param endDate End date (yyyy-MM-dd or ISO date-time), may be null
     * @return Ordered date range
     * @throws InvalidInputException if either date cannot be parsed
     */
    public DateRange validateDateRange(String startDate, String endDate) {
        LocalDate start = isBlank(startDate) ? DEFAULT_START_DATE : parseDate(startDate);
        LocalDate end = isBlank(endDate) ? LocalDate.now(clock) : parseDate(endDate);

        if (start.isAfter(end)) {
            log.warn("Start date is after end date, swapping - start: {}, end: {}", start, end);
            LocalDate swap = start;
            start = end;
            end = swap;
        }
        return new DateRange(start, end);
    }

    /**
     * Validates and repairs a raw OHLCV series.
     *
     * Repair rules, applied per row: Close is forward-filled from the previous row, a missing Open
     * takes the Close, missing High/Low take the max/min of Open and Close, missing Volume becomes 0.
     * Rows are never dropped.
     *
     * @param symbol Canonical ticker
     * @param interval Bar interval (e.g. "1d")
     * @param raw Columnar provider payload
     * @return Validated series, or null if the payload is empty or a required column is missing
     */
    public HistoricalSeries validateHistoricalSeries(String symbol, String interval, RawPriceSeries raw) {
        if (raw == null || raw.getDates() == null || raw.getDates().isEmpty()) {
            log.warn("Historical data is empty - ticker: {}", symbol);
            return null;
        }

        Map<String, List<Double>> columns = raw.getColumns() != null ? raw.getColumns() : Map.of();
        List<String> missingColumns = REQUIRED_COLUMNS.stream()
                .filter(column -> columns.get(column) == null)
                .toList();
        if (!missingColumns.isEmpty()) {
            log.warn("Missing required columns in historical data - ticker: {}, missing: {}", symbol, missingColumns);
            return null;
        }

        List<String> dates = raw.getDates();
        List<PriceBar> bars = new ArrayList<>(dates.size());
        Double lastClose = null;
        int repairedRows = 0;

        for (int i = 0; i < dates.size(); i++) {
            Double open = cell(columns.get(OPEN), i);
            Double high = cell(columns.get(HIGH), i);
            Double low = cell(columns.get(LOW), i);
            Double close = cell(columns.get(CLOSE), i);
            Double volume = cell(columns.get(VOLUME), i);

            if (open == null || high == null || low == null || close == null || volume == null) {
                repairedRows++;
            }

            if (close == null) {
                close = lastClose;
            } else {
                lastClose = close;
            }
            if (open == null) {
                open = close;
            }
            if (high == null) {
                high = extreme(open, close, true);
            }
            if (low == null) {
                low = extreme(open, close, false);
            }

            bars.add(PriceBar.builder()
                    .date(dates.get(i))
                    .open(open)
                    .high(high)
                    .low(low)
                    .close(close)
                    .volume(volume != null ? volume.longValue() : 0L)
                    .build());
        }

        if (repairedRows > 0) {
            log.warn("Missing values found in historical data, filled - ticker: {}, rows repaired: {}", symbol, repairedRows);
        }

        return HistoricalSeries.builder()
                .symbol(symbol)
                .interval(interval)
                .bars(List.copyOf(bars))
                .lastUpdated(clock.instant())
                .build();
    }

    /**
     * Keeps only expirations that carry at least one call or put.
     *
     * @param symbol Canonical ticker
     * @param expirations Raw chain keyed by expiration date
     * @return Validated chain, or null if no expiration survives
     */
    public OptionsChain validateOptionsChain(String symbol, Map<String, OptionsExpiration> expirations) {
        if (expirations == null || expirations.isEmpty()) {
            log.warn("Options data is invalid or empty - ticker: {}", symbol);
            return null;
        }

        Map<String, OptionsExpiration> validExpirations = new LinkedHashMap<>();
        expirations.forEach((date, chain) -> {
            if (chain != null && chain.hasContracts()) {
                validExpirations.put(date, chain);
            }
        });

        if (validExpirations.isEmpty()) {
            log.warn("No valid options data found - ticker: {}", symbol);
            return null;
        }

        return OptionsChain.builder()
                .symbol(symbol)
                .expirations(validExpirations)
                .lastUpdated(clock.instant())
                .build();
    }

    /**
     * Checks that a filing carries accessionNumber, filingDate, form and primaryDocument.
     *
     * @param filing Filing fields as extracted from the provider payload
     * @return The same map, or null if a required field is missing
     */
    public <V> Map<String, V> validateFiling(Map<String, V> filing) {
        if (filing == null || filing.isEmpty()) {
            log.warn("SEC filing data is invalid or empty");
            return null;
        }

        List<String> missing = REQUIRED_FILING_FIELDS.stream()
                .filter(field -> filing.get(field) == null)
                .toList();
        if (!missing.isEmpty()) {
            log.warn("SEC filing missing required fields: {}", missing);
            return null;
        }
        return filing;
    }

    private LocalDate parseDate(String value) {
        String trimmed = value.trim();
        try {
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException ignored) {
            // fall through to date-time formats
        }
        try {
            return LocalDateTime.parse(trimmed).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // fall through to offset date-time
        }
        try {
            return OffsetDateTime.parse(trimmed).toLocalDate();
        } catch (DateTimeParseException e) {
            log.error("Invalid date format: {}", value);
            throw new InvalidInputException("Invalid date format: " + value, e);
        }
    }

    private static Double cell(List<Double> column, int index) {
        if (index >= column.size()) {
            return null;
        }
        Double value = column.get(index);
        return value == null || value.isNaN() ? null : value;
    }

    private static Double extreme(Double open, Double close, boolean max) {
        if (open == null) {
            return close;
        }
        if (close == null) {
            return open;
        }
        return max ? Math.max(open, close) : Math.min(open, close);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
