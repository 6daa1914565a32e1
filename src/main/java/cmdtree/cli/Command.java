package cmdtree.cli;

import cmdtree.Const;
import cmdtree.common.ErrorFactory;
import cmdtree.common.Terminal;
import cmdtree.help.HelpRenderer;
import io.vavr.control.Option;
import io.vavr.control.Try;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
public class Command {
    private final CommandSpec spec;

    private final Command parent;

    private final List<Command> commands = new ArrayList<>();

    private final List<Flag> flags = new ArrayList<>();

    Command(final CommandSpec spec, final Command parent) {
        if (spec == null || spec.use() == null || spec.use().isBlank()) {
            throw ErrorFactory.missingUsage();
        }
        this.spec = spec;
        this.parent = parent;
    }

    public CommandSpec spec() {
        return spec;
    }

    public String use() {
        return spec.use();
    }

    public String shortDescription() {
        return spec.shortDescription();
    }

    public String longDescription() {
        return spec.longDescription();
    }

    public String name() {
        return spec.use().trim().split("\\s+")[0];
    }

    public Command parent() {
        return parent;
    }

    public Command root() {
        return parent == null ? this : parent.root();
    }

    public List<Command> commands() {
        return Collections.unmodifiableList(commands);
    }

    // live list, for tests that need to bypass addCommand
    List<Command> children() {
        return commands;
    }

    public Command addCommand(final CommandSpec spec) {
        final var command = new Command(spec, this);
        if (commands.stream().anyMatch(e -> e.name().equals(command.name()))) {
            throw ErrorFactory.duplicateCommand(command.name());
        }
        commands.add(command);
        log.debug("added command '{}' to '{}'", command.name(), name());
        return command;
    }

    /**
     * Attaches a new node built from the spec of {@code command}. Children and flags of {@code command} are not
     * carried over.
     */
    public Command addCommand(final Command command) {
        return addCommand(command.spec());
    }

    public Flag addFlag(final Flag flag) {
        final var normalized = flag.normalized();
        checkFlags(normalized);
        flags.add(normalized);
        log.debug("added flag {} to '{}'", normalized, name());
        return normalized;
    }

    public List<Flag> ownFlags() {
        return Collections.unmodifiableList(flags);
    }

    public Option<Flag> getFlag(final String name) {
        if (name.isEmpty()) {
            return Option.none();
        }
        return Option.ofOptional(flags.stream().filter(e -> e.name().equals(name)).findFirst())
            .orElse(() -> parent == null ? Option.none() : parent.getFlag(name));
    }

    public List<Flag> getFlags() {
        final List<Flag> effective = new ArrayList<>(flags);
        for (var command = parent; command != null; command = command.parent) {
            for (final var flag : command.flags) {
                if (flag.persistent() && effective.stream().noneMatch(e -> e == flag)) {
                    effective.add(flag);
                }
            }
        }
        return Collections.unmodifiableList(effective);
    }

    public void help() {
        help(false);
    }

    public void help(final boolean longForm) {
        terminal().stderr(HelpRenderer.render(this, longForm));
    }

    public Terminal terminal() {
        if (parent == null) {
            throw new IllegalStateException("runtime is not set");
        }
        return parent.terminal();
    }

    Handler handler() {
        if (spec.handler() != null) {
            return spec.handler();
        }
        return (command, args, flags) -> {
            command.help();
            return Const.EXIT_FAILURE;
        };
    }

    int run(final List<String> args, final Flags flags) {
        return Try.of(() -> handler().run(this, args, flags))
            .onSuccess(exit -> {
                if (exit > 0 && spec.showHelpOnError()) {
                    help();
                }
            })
            .onFailure(failure -> {
                log.debug("command '{}' failed", name(), failure);
                terminal().stderr(messageOf(failure) + "\n");
                if (spec.showHelpOnError()) {
                    help();
                }
            })
            .getOrElse(Const.EXIT_FAILURE);
    }

    private void checkFlags(final Flag candidate) {
        for (final var flag : flags) {
            if (candidate.collidesWith(flag)) {
                throw ErrorFactory.flagConflict(candidate.hasName() ? candidate.name() : candidate.shorthand(), flag.name(), flag.shorthand());
            }
        }
        if (parent != null) {
            parent.checkFlags(candidate);
        }
    }

    private static String messageOf(final Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}
