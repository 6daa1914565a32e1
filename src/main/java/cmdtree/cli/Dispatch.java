package cmdtree.cli;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.List;

@AllArgsConstructor
@Getter
@Accessors(fluent = true)
@ToString
public final class Dispatch {
    private final Command command;

    private final List<String> args;

    private final FlagValues flags;

    // help was printed instead of running the handler
    private final boolean helped;

    Dispatch asHelped() {
        return new Dispatch(command, args, flags, true);
    }
}
