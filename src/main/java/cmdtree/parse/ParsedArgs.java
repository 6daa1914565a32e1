package cmdtree.parse;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Map;

@AllArgsConstructor
@Getter
@Accessors(fluent = true)
@ToString
public final class ParsedArgs {
    private final List<String> positional;

    private final List<String> passthrough;

    private final Map<String, Object> values;

    public boolean has(final String key) {
        return values.containsKey(key);
    }

    public Object get(final String key) {
        return values.get(key);
    }
}
