package com.collab.sync.jetstream.admin;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient {@link Duration} reader for admin request bodies.
 *
 * <p>Accepts a bare number (milliseconds), ISO-8601 ({@code PT5S}) or shorthand
 * ({@code 250ms}, {@code 5s}, {@code 2m}, {@code 1h}). Null or blank yields the default
 * block time of one second. Anything else is rejected with a 400.</p>
 */
public final class FlexibleDurationDeserializer extends JsonDeserializer<Duration> {

    static final Duration DEFAULT = Duration.ofSeconds(1);

    private static final Pattern SHORTHAND =
            Pattern.compile("^(\\d+)(ms|s|m|h)$", Pattern.CASE_INSENSITIVE);

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        if (node == null || node.isNull()) {
            return DEFAULT;
        }
        if (node.isNumber()) {
            return Duration.ofMillis(node.asLong());
        }
        String s = node.asText("").trim();
        if (s.isEmpty()) {
            return DEFAULT;
        }
        Duration parsed = parse(s);
        if (parsed == null) {
            throw ctxt.weirdStringException(s, Duration.class, "expected ISO-8601 or shorthand like 250ms, 5s, 2m");
        }
        return parsed;
    }

    static Duration parse(String s) {
        Matcher m = SHORTHAND.matcher(s);
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            return switch (m.group(2).toLowerCase(Locale.ROOT)) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                default -> Duration.ofHours(n);
            };
        }
        try {
            return Duration.parse(s.toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
