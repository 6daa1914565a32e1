package cmdtree.help;

import cmdtree.Const;
import cmdtree.cli.Flag;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.List;

@AllArgsConstructor
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class FlagColumns {
    private final int shortWidth;

    private final int longWidth;

    public static FlagColumns of(final List<Flag> flags) {
        final var shortWidth = flags.stream().mapToInt(e -> e.shorthand().length()).max().orElse(0);
        final var longWidth = flags.stream().mapToInt(e -> e.name().length()).max().orElse(0);
        return new FlagColumns(shortWidth, longWidth);
    }

    public String row(final Flag flag) {
        final var shortColumn = shortWidth > 0 ? shortWidth + Const.Help.SHORT_PADDING : 0;
        final var longColumn = longWidth > 0 ? longWidth + Const.Help.LONG_PADDING : 0;

        var shortName = "";
        if (flag.hasShorthand()) {
            shortName = flag.hasName() ? "-" + flag.shorthand() + ", " : "-" + flag.shorthand() + "  ";
        }
        final var longName = flag.hasName() ? "--" + flag.name() : "";

        return padEnd(shortName, shortColumn) + padEnd(longName, longColumn) + Const.Help.GUTTER + flag.usage();
    }

    static String padEnd(final String text, final int width) {
        return text.length() >= width ? text : text + " ".repeat(width - text.length());
    }
}
