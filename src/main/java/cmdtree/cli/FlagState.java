package cmdtree.cli;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@ToString
public final class FlagState {
    private final Flag flag;

    // null when the flag was not given and has no default
    private final Object value;

    private final boolean changed;

    public static FlagState unset(final Flag flag) {
        return new FlagState(flag, null, false);
    }

    public static FlagState of(final Flag flag, final Object value, final boolean changed) {
        return new FlagState(flag, value, changed);
    }

    public boolean isSet() {
        return value != null;
    }
}
