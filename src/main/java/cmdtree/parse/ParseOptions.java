package cmdtree.parse;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Getter
@Accessors(fluent = true)
@Builder(toBuilder = true)
@ToString
public final class ParseOptions {
    @Singular("alias")
    private final Map<String, List<String>> aliases;

    @Singular("defaultValue")
    private final Map<String, Object> defaults;

    @Singular("bool")
    private final Set<String> booleans;

    @Singular("string")
    private final Set<String> strings;

    // tokens after "--" are kept apart from the positional ones
    private final boolean doubleDash;

    public static ParseOptions doubleDashOnly() {
        return ParseOptions.builder().doubleDash(true).build();
    }
}
