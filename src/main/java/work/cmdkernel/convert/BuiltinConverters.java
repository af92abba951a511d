package work.cmdkernel.convert;

import java.io.File;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;
import work.cmdkernel.shared.DurationParser;

/**
 * Registers converters for primitives and the well-known JDK value types.
 */
public final class BuiltinConverters {
    private BuiltinConverters() {}

    public static ConverterRegistry register(ConverterRegistry registry) {
        registry.register("string", String.class, raw -> raw);
        registry.register("bool", Boolean.class, BuiltinConverters::parseBoolean);
        registry.register("byte", Byte.class, raw -> Byte.parseByte(raw.trim()));
        registry.register("short", Short.class, raw -> Short.parseShort(raw.trim()));
        registry.register("int", Integer.class, raw -> Integer.parseInt(raw.trim()));
        registry.register("long", Long.class, raw -> Long.parseLong(raw.trim()));
        registry.register("float", Float.class, raw -> Float.parseFloat(raw.trim()));
        registry.register("double", Double.class, raw -> Double.parseDouble(raw.trim()));
        registry.register("char", Character.class, BuiltinConverters::parseChar);
        registry.register("bigint", BigInteger.class, raw -> new BigInteger(raw.trim()));
        registry.register("decimal", BigDecimal.class, raw -> new BigDecimal(raw.trim()));
        registry.register("path", Path.class, Path::of);
        registry.register("file", File.class, File::new);
        registry.register("uri", URI.class, URI::new);
        registry.register("url", URL.class, raw -> new URI(raw.trim()).toURL());
        registry.register("uuid", UUID.class, raw -> UUID.fromString(raw.trim()));
        registry.register("date", LocalDate.class, raw -> LocalDate.parse(raw.trim()));
        registry.register("datetime", LocalDateTime.class, BuiltinConverters::parseDateTime);
        registry.register("time", LocalTime.class, raw -> LocalTime.parse(raw.trim()));
        registry.register("offset-datetime", OffsetDateTime.class, raw -> OffsetDateTime.parse(raw.trim()));
        registry.register("instant", Instant.class, raw -> Instant.parse(raw.trim()));
        registry.register("duration", Duration.class, new DurationConverter());
        registry.register("pattern", Pattern.class, new PatternConverter());
        registry.register("charset", Charset.class, new CharsetConverter());

        registry.alias("boolean", TypeDescriptor.of(Boolean.class));
        registry.alias("integer", TypeDescriptor.of(Integer.class));
        registry.alias("str", TypeDescriptor.of(String.class));
        return registry;
    }

    static Boolean parseBoolean(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1" -> Boolean.TRUE;
            case "false", "no", "off", "0" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("expected true or false");
        };
    }

    private static Character parseChar(String raw) {
        if (raw.length() != 1) {
            throw new IllegalArgumentException("expected a single character");
        }
        return raw.charAt(0);
    }

    private static LocalDateTime parseDateTime(String raw) {
        var trimmed = raw.trim();
        if (trimmed.indexOf('T') < 0 && trimmed.indexOf('t') < 0) {
            return LocalDate.parse(trimmed).atStartOfDay();
        }
        return LocalDateTime.parse(trimmed.toUpperCase(Locale.ROOT));
    }

    private static final class DurationConverter implements TypeConverter<Duration> {
        @Override
        public Duration convert(String raw) {
            return DurationParser.parse(raw).orElseThrow(() -> new IllegalArgumentException("empty duration"));
        }
    }

    private static final class PatternConverter implements TypeConverter<Pattern> {
        @Override
        public Pattern convert(String raw) {
            return Pattern.compile(raw);
        }

        @Override
        public String format(Pattern value) {
            return value.pattern();
        }
    }

    private static final class CharsetConverter implements TypeConverter<Charset> {
        @Override
        public Charset convert(String raw) {
            return Charset.forName(raw.trim());
        }

        @Override
        public String format(Charset value) {
            return value.name();
        }
    }
}
