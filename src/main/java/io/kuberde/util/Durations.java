package io.kuberde.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

public final class Durations {
    private Durations() {
    }

    /**
     * Parses {@code 30s}, {@code 8h}, {@code 1h30m}, {@code 250ms} or ISO-8601 ({@code PT8H}).
     */
    public static Duration parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("duration is empty");
        }
        String value = raw.trim();
        if (value.length() > 1 && (value.charAt(0) == 'P' || value.charAt(0) == 'p')) {
            try {
                return Duration.parse(value.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: " + raw, e);
            }
        }
        if ("0".equals(value)) {
            return Duration.ZERO;
        }
        Duration total = Duration.ZERO;
        int i = 0;
        boolean any = false;
        while (i < value.length()) {
            int start = i;
            while (i < value.length() && (Character.isDigit(value.charAt(i)) || value.charAt(i) == '.')) {
                i++;
            }
            if (start == i) {
                throw new IllegalArgumentException("Invalid duration: " + raw);
            }
            double amount;
            try {
                amount = Double.parseDouble(value.substring(start, i));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid duration: " + raw, e);
            }
            int unitStart = i;
            while (i < value.length() && Character.isLetter(value.charAt(i))) {
                i++;
            }
            String unit = value.substring(unitStart, i).toLowerCase(Locale.ROOT);
            long nanosPerUnit = switch (unit) {
                case "ns" -> 1L;
                case "us" -> 1_000L;
                case "ms" -> 1_000_000L;
                case "s" -> 1_000_000_000L;
                case "m" -> 60L * 1_000_000_000L;
                case "h" -> 3_600L * 1_000_000_000L;
                case "d" -> 86_400L * 1_000_000_000L;
                default -> throw new IllegalArgumentException("Invalid duration unit in: " + raw);
            };
            total = total.plusNanos((long) (amount * nanosPerUnit));
            any = true;
        }
        if (!any) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        return total;
    }

    public static Duration parseOrDefault(String raw, Duration fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return parse(raw);
    }

    public static String format(Duration duration) {
        if (duration == null) {
            return "";
        }
        long seconds = duration.getSeconds();
        if (seconds == 0L) {
            return duration.toMillis() + "ms";
        }
        StringBuilder sb = new StringBuilder();
        long hours = seconds / 3600L;
        long minutes = (seconds % 3600L) / 60L;
        long secs = seconds % 60L;
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (minutes > 0) {
            sb.append(minutes).append('m');
        }
        if (secs > 0) {
            sb.append(secs).append('s');
        }
        return sb.toString();
    }
}
