package cmdtree.cli;

import io.vavr.control.Option;

import java.util.List;

public interface Flags {
    Object value(String key);

    /**
     * Every explicit value, in the order given. Defaults are not consulted: an unset flag yields an empty list.
     */
    List<Object> values(String key);

    String string(String key);

    boolean bool(String key);

    Number number(String key);

    List<String> strings(String key);

    List<Number> numbers(String key);

    Option<Flag> getFlag(String key);

    FlagState state(String key);

    Option<FlagState> state(Flag flag);

    /**
     * Fails for the first required flag whose value still equals its default.
     */
    void checkRequired();
}
