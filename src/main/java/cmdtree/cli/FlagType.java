package cmdtree.cli;

import cmdtree.parse.Numbers;

import java.util.List;
import java.util.stream.Collectors;

public enum FlagType {
    STRING(""),
    BOOLEAN(false),
    NUMBER(0L);

    private final Object zero;

    FlagType(final Object zero) {
        this.zero = zero;
    }

    public Object zero() {
        return zero;
    }

    public Object normalize(final Object value) {
        if (value instanceof List) {
            return ((List<?>) value).stream().map(this::normalize).collect(Collectors.toUnmodifiableList());
        }
        if (this == NUMBER && value instanceof Number) {
            return Numbers.normalize((Number) value);
        }
        return value;
    }
}
