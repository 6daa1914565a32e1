package cmdtree.parse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ArgParserTest {
    private final ArgParser parser = new ArgParser();

    @ParameterizedTest
    @MethodSource("valueProvider")
    void parseProducesValue(final List<String> args, final ParseOptions options, final String key, final Object expected) {
        final var parsed = parser.parse(args, options);

        assertThat(parsed.has(key)).isTrue();
        assertThat(parsed.get(key)).isEqualTo(expected);
    }

    static Stream<Arguments> valueProvider() {
        final var none = ParseOptions.builder().build();
        return Stream.of(
            Arguments.of(List.of("--name=bob"), none, "name", "bob"),
            Arguments.of(List.of("--port", "8080"), none, "port", 8080L),
            Arguments.of(List.of("--ratio", "1.5"), none, "ratio", 1.5),
            Arguments.of(List.of("--mask", "0x1F"), none, "mask", 31L),
            Arguments.of(List.of("--no-color"), none, "color", false),
            Arguments.of(List.of("-abc"), none, "b", true),
            Arguments.of(List.of("-x=12"), none, "x", 12L),
            Arguments.of(List.of("-n5"), none, "n", 5L),
            Arguments.of(List.of("-o", "out.txt"), none, "o", "out.txt"),
            Arguments.of(List.of("--x", "1", "--x", "2"), none, "x", List.of(1L, 2L)),
            Arguments.of(List.of("--id", "007"), ParseOptions.builder().string("id").build(), "id", "007"),
            Arguments.of(List.of("--id"), ParseOptions.builder().string("id").build(), "id", ""),
            Arguments.of(List.of("--verbose=false"), ParseOptions.builder().bool("verbose").build(), "verbose", false),
            Arguments.of(List.of("--verbose", "false"), ParseOptions.builder().bool("verbose").build(), "verbose", false),
            Arguments.of(List.of(), ParseOptions.builder().bool("verbose").build(), "verbose", false),
            Arguments.of(List.of(), ParseOptions.builder().defaultValue("x", 12L).build(), "x", 12L),
            Arguments.of(List.of("--x", "3"), ParseOptions.builder().defaultValue("x", 12L).build(), "x", 3L),
            Arguments.of(List.of("--port", "80"), ParseOptions.builder().alias("p", List.of("port")).build(), "p", 80L),
            Arguments.of(List.of("-p", "80"), ParseOptions.builder().alias("p", List.of("port")).build(), "port", 80L)
        );
    }

    @Test
    void booleanFlagDoesNotConsumeFollowingToken() {
        final var parsed = parser.parse(List.of("--verbose", "file.txt"), ParseOptions.builder().bool("verbose").build());

        assertThat(parsed.get("verbose")).isEqualTo(true);
        assertThat(parsed.positional()).containsExactly("file.txt");
    }

    @Test
    void untypedFlagConsumesFollowingToken() {
        final var parsed = parser.parse(List.of("--verbose", "file.txt"), ParseOptions.builder().build());

        assertThat(parsed.get("verbose")).isEqualTo("file.txt");
        assertThat(parsed.positional()).isEmpty();
    }

    @Test
    void flagFollowedByFlagIsTrue() {
        final var parsed = parser.parse(List.of("-A", "--all", "-x=12"), ParseOptions.builder().build());

        assertThat(parsed.get("A")).isEqualTo(true);
        assertThat(parsed.get("all")).isEqualTo(true);
        assertThat(parsed.get("x")).isEqualTo(12L);
    }

    @Test
    void positionalTokensKeepTheirOrderAndText() {
        final var parsed = parser.parse(List.of("hello", "--name", "bob", "world", "007"), ParseOptions.builder().build());

        assertThat(parsed.positional()).containsExactly("hello", "world", "007");
        assertThat(parsed.get("name")).isEqualTo("bob");
    }

    @Test
    void doubleDashKeepsTrailingTokensApart() {
        final var parsed = parser.parse(List.of("run", "--", "--fast", "x"), ParseOptions.doubleDashOnly());

        assertThat(parsed.positional()).containsExactly("run");
        assertThat(parsed.passthrough()).containsExactly("--fast", "x");
        assertThat(parsed.has("fast")).isFalse();
    }

    @Test
    void withoutDoubleDashOptionTrailingTokensArePositional() {
        final var parsed = parser.parse(List.of("run", "--", "--fast", "x"), ParseOptions.builder().build());

        assertThat(parsed.positional()).containsExactly("run", "--fast", "x");
        assertThat(parsed.passthrough()).isEmpty();
    }

    @Test
    void aliasesShareTheirValue() {
        final var options = ParseOptions.builder()
            .alias("S", List.of("long-flag"))
            .string("S")
            .build();
        final var parsed = parser.parse(List.of("-S", "short flag"), options);

        assertThat(parsed.get("S")).isEqualTo("short flag");
        assertThat(parsed.get("long-flag")).isEqualTo("short flag");
    }

    @Test
    void numbersAreNormalized() {
        assertThat(Numbers.parse("12")).isEqualTo(12L);
        assertThat(Numbers.parse("1e3")).isEqualTo(1000L);
        assertThat(Numbers.parse("-2.5")).isEqualTo(-2.5);
        assertThat(Numbers.normalize(12)).isEqualTo(12L);
        assertThat(Numbers.normalize(12.0)).isEqualTo(12L);
        assertThat(Numbers.isNumber("1.")).isTrue();
        assertThat(Numbers.isNumber(".5")).isTrue();
        assertThat(Numbers.isNumber("1.2.3")).isFalse();
        assertThat(Numbers.isNumber("abc")).isFalse();
    }
}
