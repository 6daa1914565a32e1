package cmdtree.help;

import cmdtree.Const;
import cmdtree.cli.Command;
import cmdtree.cli.Flag;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import static cmdtree.Const.Help.AVAILABLE_COMMANDS;
import static cmdtree.Const.Help.FLAGS;
import static cmdtree.Const.Help.GUTTER;
import static cmdtree.Const.Help.INDENT;
import static cmdtree.Const.Help.USAGE;

public final class HelpRenderer {
    private HelpRenderer() {
        throw new IllegalStateException("Util class");
    }

    public static String render(final Command command, final boolean longForm) {
        final var sb = new StringBuilder();
        sb.append(description(command, longForm)).append('\n');

        sb.append('\n').append(USAGE).append('\n');
        if (command.commands().isEmpty()) {
            sb.append(INDENT).append(command.use()).append('\n');
        } else {
            sb.append(INDENT).append(command.name()).append(' ').append(Const.COMMANDS_PLACEHOLDER).append('\n');
            sb.append('\n').append(AVAILABLE_COMMANDS).append('\n');
            appendCommands(sb, command.commands());
        }

        final List<Flag> flags = new ArrayList<>(command.getFlags());
        if (!flags.isEmpty()) {
            sb.append('\n').append(FLAGS).append('\n');
            flags.sort(Comparator.comparing(Flag::name, collator()));
            final var columns = FlagColumns.of(flags);
            for (final var flag : flags) {
                sb.append(INDENT).append(columns.row(flag)).append('\n');
            }
        }

        return sb.toString();
    }

    private static void appendCommands(final StringBuilder sb, final List<Command> commands) {
        final List<Command> sorted = new ArrayList<>(commands);
        sorted.sort(Comparator.comparing(Command::use, collator()));
        final var width = sorted.stream().mapToInt(e -> e.name().length()).max().orElse(0);
        for (final var command : sorted) {
            sb.append(INDENT)
                .append(FlagColumns.padEnd(command.name(), width))
                .append(GUTTER)
                .append(command.shortDescription() == null ? "" : command.shortDescription())
                .append('\n');
        }
    }

    // case-insensitive at first, so "alpha" sorts before "Zeta"
    private static Comparator<Object> collator() {
        return Collator.getInstance(Locale.ROOT);
    }

    private static String description(final Command command, final boolean longForm) {
        if (longForm && command.longDescription() != null) {
            return command.longDescription();
        }
        if (command.shortDescription() != null) {
            return command.shortDescription();
        }
        return command.use();
    }
}
