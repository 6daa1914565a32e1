package cmdtree.cli;

import cmdtree.common.ErrorFactory;
import cmdtree.parse.ArgParser;
import cmdtree.parse.ParseOptions;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@AllArgsConstructor
public final class Resolver {
    private final ArgParser parser;

    public Match match(final Command root, final List<String> args) {
        final var parsed = parser.parse(args, ParseOptions.doubleDashOnly());
        final var remaining = new ArrayDeque<>(parsed.positional());

        var command = root;
        while (!remaining.isEmpty()) {
            final var verb = remaining.pollFirst();
            final var current = command;
            final List<Command> matches = current.commands().stream()
                .filter(e -> e.name().equals(verb))
                .collect(Collectors.toList());

            if (matches.size() > 1) {
                throw ErrorFactory.ambiguousCommand(verb);
            }
            if (matches.isEmpty()) {
                // not a command, it is the first positional argument
                remaining.addFirst(verb);
                break;
            }
            command = matches.get(0);
        }

        final List<String> positional = new ArrayList<>(remaining);
        positional.addAll(parsed.passthrough());
        log.debug("matched '{}' with args {}", command.name(), positional);
        return new Match(command, List.copyOf(positional));
    }

    @AllArgsConstructor
    @Getter
    @Accessors(fluent = true)
    @ToString
    public static final class Match {
        private final Command command;

        private final List<String> args;
    }
}
