package org.netpreserve.evidence.config;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Reads durations written as plain milliseconds or with a unit suffix ("250ms", "30s", "10m", "1h").
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().trim().toLowerCase(Locale.ROOT);
        try {
            if (text.endsWith("ms")) return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            if (text.startsWith("pt")) return Duration.parse(text.toUpperCase(Locale.ROOT));
            return Duration.parse("PT" + text.toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            return (Duration) deserializationContext.handleWeirdStringValue(Duration.class, text,
                    "expected a duration like 250ms, 30s or 10m");
        }
    }
}
