package cmdtree.cli;

import cmdtree.common.ErrorFactory;
import cmdtree.parse.Numbers;
import io.vavr.control.Option;
import lombok.ToString;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

@ToString(of = "states")
public final class FlagValues implements Flags {
    private final List<FlagState> states;

    private final Map<String, FlagState> byKey = new LinkedHashMap<>();

    private final Map<Flag, FlagState> byFlag = new IdentityHashMap<>();

    public FlagValues(final List<FlagState> states) {
        this.states = List.copyOf(states);
        for (final var state : this.states) {
            final var flag = state.flag();
            if (flag.hasName()) {
                byKey.put(flag.name(), state);
            }
            if (flag.hasShorthand()) {
                byKey.put(flag.shorthand(), state);
            }
            byFlag.put(flag, state);
        }
    }

    public List<FlagState> states() {
        return states;
    }

    @Override
    public Object value(final String key) {
        final var state = state(key);
        var value = state.value();
        if (value == null) {
            value = state.flag().defaultValue();
        }
        if (value == null) {
            value = state.flag().type().zero();
        }
        if (value instanceof List) {
            final var list = (List<?>) value;
            return list.isEmpty() ? null : list.get(0);
        }
        return value;
    }

    @Override
    public List<Object> values(final String key) {
        final var value = state(key).value();
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof List) {
            return List.copyOf((List<?>) value);
        }
        return List.of(value);
    }

    @Override
    public String string(final String key) {
        final var value = value(key);
        return value == null ? "" : String.valueOf(value);
    }

    @Override
    public boolean bool(final String key) {
        return truthy(value(key));
    }

    @Override
    public Number number(final String key) {
        return toNumber(key, value(key));
    }

    @Override
    public List<String> strings(final String key) {
        return values(key).stream().map(String::valueOf).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public List<Number> numbers(final String key) {
        return values(key).stream().map(e -> toNumber(key, e)).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public Option<Flag> getFlag(final String key) {
        return Option.of(byKey.get(key)).map(FlagState::flag);
    }

    @Override
    public FlagState state(final String key) {
        final var state = byKey.get(key);
        if (state == null) {
            throw ErrorFactory.unknownFlag(key);
        }
        return state;
    }

    @Override
    public Option<FlagState> state(final Flag flag) {
        return Option.of(byFlag.get(flag));
    }

    @Override
    public void checkRequired() {
        for (final var state : states) {
            final var flag = state.flag();
            if (flag.required() && Objects.equals(flag.defaultValue(), state.value())) {
                throw ErrorFactory.requiredFlag(flag.hasName() ? flag.name() : flag.shorthand());
            }
        }
    }

    private static boolean truthy(final Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof String) {
            return !((String) value).isEmpty() && !"false".equals(value);
        }
        return value != null;
    }

    private static Number toNumber(final String key, final Object value) {
        if (value instanceof Number) {
            return Numbers.normalize((Number) value);
        }
        if (value instanceof String && Numbers.isNumber(value)) {
            return Numbers.parse((String) value);
        }
        throw ErrorFactory.invalidNumber(key, value);
    }
}
