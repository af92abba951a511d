package work.cmdkernel.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class ConverterRegistryTest {
    enum Level {
        LOW,
        MEDIUM,
        HIGH
    }

    enum Permission {
        READ,
        WRITE,
        EXECUTE
    }

    record Point(int x, int y) {}

    private final ConverterRegistry registry = ConverterRegistry.withDefaults();

    @Test
    void convertsBuiltinScalars() {
        assertEquals(42, registry.convert(TypeDescriptor.of(int.class), List.of("42")));
        assertEquals(Boolean.TRUE, registry.convert(TypeDescriptor.bool(), List.of("yes")));
        assertEquals(new BigDecimal("1.50"), registry.convert(TypeDescriptor.of(BigDecimal.class), List.of("1.50")));
        assertEquals(Path.of("build/out"), registry.convert(TypeDescriptor.of(Path.class), List.of("build/out")));
        assertEquals(Duration.ofSeconds(30), registry.convert(TypeDescriptor.of(Duration.class), List.of("30s")));
        var id = UUID.randomUUID();
        assertEquals(id, registry.convert(TypeDescriptor.of(UUID.class), List.of(id.toString())));
    }

    @Test
    void scalarUsesLastOccurrence() {
        assertEquals("second", registry.convert(TypeDescriptor.string(), List.of("first", "second")));
    }

    @Test
    void listsSplitOnCommasAcrossOccurrences() {
        var value = registry.convert(TypeDescriptor.listOf(Integer.class), List.of("1,2", " 3 ", "4,,5"));
        assertEquals(List.of(1, 2, 3, 4, 5), value);
    }

    @Test
    void setsKeepFirstSeenOrderAndDropDuplicates() {
        var value = registry.convert(TypeDescriptor.setOf(String.class), List.of("b,a", "b,c"));
        assertEquals(List.of("b", "a", "c"), List.copyOf((Set<?>) value));
    }

    @Test
    void enumsMatchNameIgnoringCaseOrOrdinal() {
        var level = TypeDescriptor.of(Level.class);
        assertEquals(Level.HIGH, registry.convert(level, List.of("high")));
        assertEquals(Level.MEDIUM, registry.convert(level, List.of("1")));
        var ex = assertThrows(ConversionException.class, () -> registry.convert(level, List.of("extreme")));
        assertTrue(ex.getMessage().contains("valid values are: LOW, MEDIUM, HIGH"), ex.getMessage());
        assertThrows(ConversionException.class, () -> registry.convert(level, List.of("7")));
    }

    @Test
    void flagsCombineCommaSeparatedNames() {
        var value = registry.convert(TypeDescriptor.flagsOf(Permission.class), List.of("read,execute"));
        assertEquals(EnumSet.of(Permission.READ, Permission.EXECUTE), value);
    }

    @Test
    void failedConversionNamesValueAndType() {
        var ex = assertThrows(ConversionException.class,
            () -> registry.convert(TypeDescriptor.of(Integer.class), List.of("abc")));
        assertEquals("abc", ex.rawValue());
        assertEquals("Integer", ex.expectedType());
        assertTrue(ex.getMessage().startsWith("Invalid value 'abc': expected Integer"), ex.getMessage());
    }

    @Test
    void customConvertersAreUsedForTheirType() {
        registry.register("point", Point.class, raw -> {
            var parts = raw.split(":");
            return new Point(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        });
        assertEquals(new Point(3, 4), registry.convert(registry.parseType("point"), List.of("3:4")));
        assertEquals(List.of(new Point(1, 2), new Point(5, 6)),
            registry.convert(registry.parseType("list<point>"), List.of("1:2,5:6")));
    }

    @Test
    void descriptorConverterWinsOverRegistry() {
        var upper = TypeDescriptor.custom(String.class, raw -> raw.toUpperCase());
        assertEquals("LOUD", registry.convert(upper, List.of("loud")));
    }

    @Test
    void parsesTypeExpressions() {
        assertEquals(TypeDescriptor.of(Integer.class), registry.parseType("int"));
        assertEquals(TypeDescriptor.of(Integer.class), registry.parseType("Integer"));
        assertEquals(TypeDescriptor.listOf(Path.class), registry.parseType("list<path>"));
        assertEquals(TypeDescriptor.setOf(String.class), registry.parseType("set<string>"));
        assertEquals(TypeDescriptor.of(Level.class), registry.parseType("enum:" + Level.class.getName()));
        assertEquals(TypeDescriptor.flagsOf(Permission.class), registry.parseType("flags:" + Permission.class.getName()));
        assertEquals(TypeDescriptor.string(), registry.parseType(""));
        assertThrows(IllegalArgumentException.class, () -> registry.parseType("quaternion"));
    }

    @Test
    void formattedValuesConvertBackToEqualValues() throws Exception {
        var samples = List.<Map.Entry<TypeDescriptor, Object>>of(
            Map.entry(TypeDescriptor.string(), "plain text"),
            Map.entry(TypeDescriptor.bool(), Boolean.FALSE),
            Map.entry(TypeDescriptor.of(byte.class), (byte) -7),
            Map.entry(TypeDescriptor.of(short.class), (short) 1200),
            Map.entry(TypeDescriptor.of(int.class), Integer.MIN_VALUE),
            Map.entry(TypeDescriptor.of(long.class), Long.MAX_VALUE),
            Map.entry(TypeDescriptor.of(float.class), 1.25f),
            Map.entry(TypeDescriptor.of(double.class), -0.001d),
            Map.entry(TypeDescriptor.of(char.class), 'x'),
            Map.entry(TypeDescriptor.of(BigInteger.class), new BigInteger("123456789012345678901234567890")),
            Map.entry(TypeDescriptor.of(BigDecimal.class), new BigDecimal("-12.500")),
            Map.entry(TypeDescriptor.of(Path.class), Path.of("build", "out")),
            Map.entry(TypeDescriptor.of(File.class), new File("reports/summary.txt")),
            Map.entry(TypeDescriptor.of(URI.class), URI.create("https://example.org/a?b=c")),
            Map.entry(TypeDescriptor.of(URL.class), new URL("file:/tmp/report.txt")),
            Map.entry(TypeDescriptor.of(UUID.class), UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301")),
            Map.entry(TypeDescriptor.of(LocalDate.class), LocalDate.of(2024, 2, 29)),
            Map.entry(TypeDescriptor.of(LocalDateTime.class), LocalDateTime.of(2024, 2, 29, 13, 45, 7)),
            Map.entry(TypeDescriptor.of(LocalTime.class), LocalTime.of(23, 59, 1)),
            Map.entry(TypeDescriptor.of(OffsetDateTime.class), OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.ofHours(2))),
            Map.entry(TypeDescriptor.of(Instant.class), Instant.ofEpochSecond(1_700_000_000L)),
            Map.entry(TypeDescriptor.of(Duration.class), Duration.ofMinutes(5)),
            Map.entry(TypeDescriptor.of(Charset.class), StandardCharsets.UTF_8),
            Map.entry(TypeDescriptor.of(Level.class), Level.LOW),
            Map.entry(TypeDescriptor.listOf(Integer.class), List.of(7, 8)),
            Map.entry(TypeDescriptor.flagsOf(Permission.class), EnumSet.of(Permission.WRITE, Permission.READ))
        );
        for (var sample : samples) {
            var type = sample.getKey();
            var value = sample.getValue();
            assertEquals(value, registry.convert(type, List.of(registry.format(type, value))), type.displayName());
        }

        var pattern = Pattern.compile("[a-z]+\\d{2,}");
        var roundTripped = (Pattern) registry.convert(TypeDescriptor.of(Pattern.class),
            List.of(registry.format(TypeDescriptor.of(Pattern.class), pattern)));
        assertEquals(pattern.pattern(), roundTripped.pattern());
    }

    @Test
    void nearestRegisteredAncestorProvidesTheConverter() {
        var local = new ConverterRegistry()
            .register(Tagged.class, raw -> new Leaf("tagged"))
            .register(Base.class, raw -> new Leaf("base"));
        assertEquals("base", convertLeaf(local));

        local.register(Named.class, raw -> new Leaf("named"));
        assertEquals("named", convertLeaf(local));

        var interfacesOnly = new ConverterRegistry().register(Tagged.class, raw -> new Leaf("tagged"));
        assertEquals("tagged", convertLeaf(interfacesOnly));
        assertTrue(new ConverterRegistry().lookup(Leaf.class).isEmpty());
    }

    interface Tagged {}

    interface Named {}

    static class Base implements Tagged {}

    static final class Leaf extends Base implements Named {
        final String source;

        Leaf(String source) {
            this.source = source;
        }
    }

    private static String convertLeaf(ConverterRegistry registry) {
        return ((Leaf) registry.convert(TypeDescriptor.of(Leaf.class), List.of("x"))).source;
    }
}
