package vn.com.fecredit.graph.mapper.transform;

import vn.com.fecredit.graph.mapper.exception.TransformException;
import vn.com.fecredit.graph.mapper.model.NebulaType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The transforms every {@link TransformEngine} starts with.
 */
public final class BuiltinTransforms {

    public static final String TIME_FORMAT = "time_format";
    public static final String PRICE_NORMALIZE = "price_normalize";
    public static final String STRING_NORMALIZE = "string_normalize";
    public static final String ARRAY_JOIN = "array_join";
    public static final String TO_BOOLEAN = "to_boolean";

    static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Map<Character, String> STRPTIME = Map.ofEntries(
            Map.entry('Y', "yyyy"),
            Map.entry('y', "yy"),
            Map.entry('m', "MM"),
            Map.entry('d', "dd"),
            Map.entry('e', "d"),
            Map.entry('H', "HH"),
            Map.entry('I', "hh"),
            Map.entry('M', "mm"),
            Map.entry('S', "ss"),
            Map.entry('p', "a"),
            Map.entry('b', "MMM"),
            Map.entry('h', "MMM"),
            Map.entry('B', "MMMM"),
            Map.entry('j', "DDD"),
            Map.entry('F', "yyyy-MM-dd"),
            Map.entry('T', "HH:mm:ss"));

    private BuiltinTransforms() {
    }

    static void registerAll(TransformEngine engine) {
        engine.register(TIME_FORMAT, BuiltinTransforms::timeFormat);
        engine.register(PRICE_NORMALIZE, BuiltinTransforms::priceNormalize);
        engine.register(STRING_NORMALIZE, BuiltinTransforms::stringNormalize);
        engine.register(ARRAY_JOIN, BuiltinTransforms::arrayJoin);
        engine.register(TO_BOOLEAN, BuiltinTransforms::toBoolean);
    }

    static TransformValue timeFormat(TransformValue input, Map<String, String> params) {
        String format = params == null ? null : params.get("format");
        if (format == null || format.isEmpty()) {
            throw new TransformException("Missing required parameter: format");
        }
        String text = input.as(String.class).trim();
        DateTimeFormatter parser;
        try {
            parser = DateTimeFormatter.ofPattern(toJavaPattern(format), Locale.ENGLISH);
        } catch (IllegalArgumentException e) {
            throw new TransformException("Invalid time format: " + format, text, e);
        }
        try {
            TemporalAccessor parsed = parser.parse(text);
            LocalDate date = parsed.query(TemporalQueries.localDate());
            if (date == null) {
                throw new TransformException("Time value has no date part: " + format, text);
            }
            LocalTime time = parsed.query(TemporalQueries.localTime());
            LocalDateTime dt = LocalDateTime.of(date, time == null ? LocalTime.MIDNIGHT : time);
            return TransformValue.of(CANONICAL.format(dt)).withTargetType(NebulaType.TIMESTAMP);
        } catch (DateTimeParseException e) {
            throw new TransformException("Failed to parse time value with format " + format, text, e);
        }
    }

    /**
     * Turns a strptime pattern ({@code %Y-%m-%d}) into a {@link DateTimeFormatter} pattern.
     * Patterns without {@code %} are taken to be java.time patterns already.
     */
    static String toJavaPattern(String format) {
        if (format.indexOf('%') < 0) {
            return format;
        }
        StringBuilder out = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                char d = format.charAt(++i);
                if (d == '%') {
                    literal.append('%');
                    continue;
                }
                String mapped = STRPTIME.get(d);
                if (mapped == null) {
                    throw new TransformException("Unsupported time format directive: %" + d, format);
                }
                flushLiteral(out, literal);
                out.append(mapped);
            } else {
                literal.append(c);
            }
        }
        flushLiteral(out, literal);
        return out.toString();
    }

    private static void flushLiteral(StringBuilder out, StringBuilder literal) {
        if (literal.length() == 0) return;
        out.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }

    static TransformValue priceNormalize(TransformValue input, Map<String, String> params) {
        String text = input.as(String.class);
        String digits = text.replaceAll("[^0-9]", "");
        try {
            return TransformValue.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            throw new TransformException("Error parsing price", text, e);
        }
    }

    static TransformValue stringNormalize(TransformValue input, Map<String, String> params) {
        String text = input.as(String.class).trim().replaceAll("\\s+", " ");
        return TransformValue.of(text);
    }

    static TransformValue arrayJoin(TransformValue input, Map<String, String> params) {
        String delimiter = params == null ? null : params.get("delimiter");
        if (delimiter == null || delimiter.isEmpty()) delimiter = ",";
        String text = input.as(String.class);
        String joined = Arrays.stream(text.split(java.util.regex.Pattern.quote(delimiter), -1))
                .map(String::trim)
                .collect(Collectors.joining(delimiter));
        return TransformValue.of(joined);
    }

    static TransformValue toBoolean(TransformValue input, Map<String, String> params) {
        String text = input.as(String.class).toLowerCase(Locale.ROOT);
        switch (text) {
            case "true": case "1": case "yes":
                return TransformValue.of(true);
            case "false": case "0": case "no":
                return TransformValue.of(false);
            default:
                throw new TransformException("Invalid boolean value", input.as(String.class));
        }
    }
}
