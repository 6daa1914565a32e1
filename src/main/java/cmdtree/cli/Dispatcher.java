package cmdtree.cli;

import cmdtree.Const;
import cmdtree.parse.ArgParser;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
@AllArgsConstructor
public final class Dispatcher {
    private final Resolver resolver;

    private final FlagBinder binder;

    public Dispatcher() {
        this(new ArgParser());
    }

    public Dispatcher(final ArgParser parser) {
        this(new Resolver(parser), new FlagBinder(parser));
    }

    public int dispatch(final RootCommand root, final List<String> args) {
        final var match = resolver.match(root, args);
        final var command = match.command();
        final var flags = binder.bind(command, args);

        final var dispatch = new Dispatch(command, match.args(), flags, false);
        root.record(dispatch);

        final var help = flags.state(root.helpFlag())
            .map(state -> Boolean.TRUE.equals(state.value()))
            .getOrElse(false);
        if (help) {
            log.debug("help requested for '{}'", command.name());
            command.help(true);
            root.record(dispatch.asHelped());
            return Const.EXIT_FAILURE;
        }

        final var exit = command.run(match.args(), flags);
        log.debug("'{}' exited with {}", command.name(), exit);
        return exit;
    }
}
