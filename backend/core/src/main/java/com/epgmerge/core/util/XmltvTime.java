package com.epgmerge.core.util;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * XMLTV timestamps: {@code yyyyMMddHHmmss +HHMM}, for example {@code 20260101183000 +0100}. The offset
 * may also be written {@code +HH:MM} or {@code Z}.
 */
public final class XmltvTime {
    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("uuuuMMddHHmmss")
            .appendLiteral(' ')
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private XmltvTime() {
    }

    public static Optional<OffsetDateTime> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value, FORMAT));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
