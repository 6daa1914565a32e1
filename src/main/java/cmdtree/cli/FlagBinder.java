package cmdtree.cli;

import cmdtree.parse.ArgParser;
import cmdtree.parse.ParseOptions;
import cmdtree.parse.ParsedArgs;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
@AllArgsConstructor
public final class FlagBinder {
    private final ArgParser parser;

    public FlagValues bind(final Command command, final List<String> args) {
        final var flags = command.getFlags();
        final var options = options(flags);
        final var parsed = parser.parse(args, options);

        final var states = flags.stream()
            .map(flag -> state(flag, parsed, options))
            .collect(Collectors.toList());
        log.trace("bound flags of '{}': {}", command.name(), states);
        return new FlagValues(states);
    }

    static ParseOptions options(final List<Flag> flags) {
        final var builder = ParseOptions.builder().doubleDash(true);
        for (final var flag : flags) {
            final var key = flag.key();
            if (flag.hasShorthand() && flag.hasName()) {
                builder.alias(key, List.of(flag.name()));
            }
            if (flag.defaultValue() != null) {
                builder.defaultValue(key, flag.defaultValue());
            }
            switch (flag.type()) {
                case BOOLEAN:
                    builder.bool(key);
                    break;
                case STRING:
                    builder.string(key);
                    break;
                case NUMBER:
                default:
                    break;
            }
        }
        return builder.build();
    }

    static FlagState state(final Flag flag, final ParsedArgs parsed, final ParseOptions options) {
        final var key = flag.key();
        if (!parsed.has(key)) {
            return FlagState.unset(flag);
        }
        final var value = parsed.get(key);
        final var configured = options.defaults().get(key);
        final var changed = configured == null || !Objects.equals(value, configured);
        return FlagState.of(flag, value, changed);
    }
}
