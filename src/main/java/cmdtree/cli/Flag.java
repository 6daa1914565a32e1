package cmdtree.cli;

import cmdtree.common.ErrorFactory;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
@Builder(toBuilder = true)
@ToString
public final class Flag {
    @Builder.Default
    private final FlagType type = FlagType.NUMBER;

    @Builder.Default
    private final String name = "";

    @Builder.Default
    private final String shorthand = "";

    @Builder.Default
    private final String usage = "";

    private final boolean required;

    private final boolean persistent;

    private final Object defaultValue;

    public boolean hasName() {
        return !name.isEmpty();
    }

    public boolean hasShorthand() {
        return !shorthand.isEmpty();
    }

    public String key() {
        return hasShorthand() ? shorthand : name;
    }

    boolean collidesWith(final Flag other) {
        final var sameName = hasName() && other.hasName() && name.equals(other.name);
        final var sameShorthand = hasShorthand() && other.hasShorthand() && shorthand.equals(other.shorthand);
        return sameName || sameShorthand;
    }

    Flag normalized() {
        final var flag = toBuilder()
            .type(type == null ? FlagType.NUMBER : type)
            .name(name == null ? "" : name)
            .shorthand(shorthand == null ? "" : shorthand)
            .usage(usage == null ? "" : usage)
            .build();
        if (!flag.hasName() && !flag.hasShorthand()) {
            throw ErrorFactory.missingFlagName();
        }
        return flag.toBuilder().defaultValue(flag.type.normalize(defaultValue)).build();
    }
}
