package cmdtree;

import cmdtree.cli.Command;
import cmdtree.cli.CommandSpec;
import cmdtree.cli.Flag;
import cmdtree.cli.FlagType;
import cmdtree.cli.Flags;
import cmdtree.cli.RootCommand;
import cmdtree.common.SystemTerminal;
import cmdtree.common.Terminal;

import java.util.List;

public class EntryPoint {
    static final String NAME = "greeting";

    static final String NOBODY = "mystery person";

    public static void main(final String[] args) {
        final var terminal = new SystemTerminal(args);
        terminal.exit(greeting(terminal).execute());
    }

    static RootCommand greeting(final Terminal terminal) {
        final var root = RootCommand.cli(CommandSpec.builder()
            .use(NAME)
            .shortDescription("greets people")
            .build(), terminal);

        final var hello = root.addCommand(CommandSpec.builder()
            .use("hello --name string [--strong]")
            .shortDescription("says hello")
            .handler((command, args, flags) -> greet(command, flags, "hello"))
            .build());
        addGreetingFlags(hello, "hello");

        final var goodbye = root.addCommand(CommandSpec.builder()
            .use("goodbye --name string [--strong]")
            .shortDescription("says goodbye")
            .handler((command, args, flags) -> greet(command, flags, "goodbye"))
            .build());
        addGreetingFlags(goodbye, "goodbye");

        return root;
    }

    private static void addGreetingFlags(final Command command, final String greeting) {
        command.addFlag(Flag.builder()
            .shorthand("n")
            .name("name")
            .type(FlagType.STRING)
            .usage("name to say " + greeting + " to")
            .build());
        command.addFlag(Flag.builder()
            .shorthand("s")
            .name("strong")
            .type(FlagType.BOOLEAN)
            .usage("say " + greeting + " strongly")
            .build());
    }

    private static int greet(final Command command, final Flags flags, final String greeting) {
        final var strong = flags.bool("strong") ? "!!!" : "";
        final List<String> names = flags.strings("name");
        final var name = names.isEmpty() || names.get(0).isEmpty() ? NOBODY : names.get(0);
        command.terminal().stdout(greeting + " " + name + strong + "\n");
        return Const.EXIT_SUCCESS;
    }
}
