package cmdtree.help;

import cmdtree.cli.Flag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FlagColumnsTest {
    @Test
    void widthsComeFromLongestNames() {
        final var flags = List.of(
            Flag.builder().name("help").shorthand("h").build(),
            Flag.builder().name("long-flag").shorthand("S").build(),
            Flag.builder().name("x").build());

        assertThat(FlagColumns.of(flags)).isEqualTo(new FlagColumns(1, 9));
        assertThat(FlagColumns.of(List.of())).isEqualTo(new FlagColumns(0, 0));
    }

    @ParameterizedTest
    @MethodSource("rowProvider")
    void rowLinesUpColumns(final FlagColumns columns, final Flag flag, final String expected) {
        assertThat(columns.row(flag)).isEqualTo(expected);
    }

    static Stream<Arguments> rowProvider() {
        final var both = new FlagColumns(1, 9);
        return Stream.of(
            Arguments.of(both, Flag.builder().name("help").shorthand("h").usage("display test's help").build(),
                "-h, --help        display test's help"),
            Arguments.of(both, Flag.builder().name("long-flag").shorthand("S").build(),
                "-S, --long-flag   "),
            Arguments.of(both, Flag.builder().shorthand("q").usage("quiet").build(),
                "-q                quiet"),
            Arguments.of(both, Flag.builder().name("all").usage("all of them").build(),
                "    --all         all of them"),
            Arguments.of(new FlagColumns(0, 3), Flag.builder().name("all").usage("all of them").build(),
                "--all   all of them"),
            Arguments.of(new FlagColumns(1, 0), Flag.builder().shorthand("q").usage("quiet").build(),
                "-q     quiet")
        );
    }

    @Test
    void padEndNeverTruncates() {
        assertThat(FlagColumns.padEnd("abc", 5)).isEqualTo("abc  ");
        assertThat(FlagColumns.padEnd("abcdef", 5)).isEqualTo("abcdef");
    }
}
