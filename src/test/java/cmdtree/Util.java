package cmdtree;

import cmdtree.cli.CommandSpec;
import cmdtree.cli.RootCommand;
import cmdtree.common.BufferedTerminal;

public interface Util {
    static CommandSpec buildSpec(final String use) {
        return CommandSpec.builder()
            .use(use)
            .handler((command, args, flags) -> Const.EXIT_SUCCESS)
            .build();
    }

    static RootCommand root(final String use, final BufferedTerminal terminal) {
        return RootCommand.cli(CommandSpec.of(use), terminal);
    }
}
