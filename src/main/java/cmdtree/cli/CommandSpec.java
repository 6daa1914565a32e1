package cmdtree.cli;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
@Builder(toBuilder = true)
@ToString(exclude = "handler")
public final class CommandSpec {
    // the first word is the name of the command, the rest is only shown in help
    private final String use;

    private final String shortDescription;

    private final String longDescription;

    // prints help and returns 1 when absent
    private final Handler handler;

    // prints help after a non-zero exit code or a failing handler
    private final boolean showHelpOnError;

    public static CommandSpec of(final String use) {
        return CommandSpec.builder().use(use).build();
    }
}
