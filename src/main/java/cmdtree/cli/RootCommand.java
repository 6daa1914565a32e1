package cmdtree.cli;

import cmdtree.Const;
import cmdtree.common.SystemTerminal;
import cmdtree.common.Terminal;
import io.vavr.control.Option;

import java.util.Arrays;
import java.util.List;

public class RootCommand extends Command {
    private final Terminal terminal;

    private final Dispatcher dispatcher;

    private final Flag helpFlag;

    private volatile Dispatch lastDispatch;

    public RootCommand(final CommandSpec spec) {
        this(spec, new SystemTerminal());
    }

    public RootCommand(final CommandSpec spec, final Terminal terminal) {
        this(spec, terminal, new Dispatcher());
    }

    public RootCommand(final CommandSpec spec, final Terminal terminal, final Dispatcher dispatcher) {
        super(spec, null);
        this.terminal = terminal;
        this.dispatcher = dispatcher;
        helpFlag = addFlag(Flag.builder()
            .name(Const.HELP)
            .shorthand(Const.HELP_SHORT)
            .usage(String.format("display %s's help", name()))
            .type(FlagType.BOOLEAN)
            .persistent(true)
            .build());
    }

    public static RootCommand cli(final CommandSpec spec) {
        return new RootCommand(spec);
    }

    public static RootCommand cli(final CommandSpec spec, final Terminal terminal) {
        return new RootCommand(spec, terminal);
    }

    public int execute() {
        return execute(terminal.args());
    }

    public int execute(final String[] args) {
        return execute(Arrays.asList(args));
    }

    public int execute(final List<String> args) {
        return dispatcher.dispatch(this, args);
    }

    public Option<Dispatch> lastDispatch() {
        return Option.of(lastDispatch);
    }

    public Flag helpFlag() {
        return helpFlag;
    }

    @Override
    public Terminal terminal() {
        return terminal;
    }

    void record(final Dispatch dispatch) {
        lastDispatch = dispatch;
    }
}
