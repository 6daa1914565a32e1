package cmdtree.parse;

import cmdtree.Const;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
public final class ArgParser {
    private static final Pattern LONG_WITH_VALUE = Pattern.compile("^--([^=]+)=([\\s\\S]*)$");

    private static final Pattern NEGATED = Pattern.compile("^--no-(.+)$");

    private static final Pattern LONG = Pattern.compile("^--(.+)$");

    private static final Pattern SHORT = Pattern.compile("^-[^-]+.*$", Pattern.DOTALL);

    private static final Pattern FLAG_LIKE = Pattern.compile("^(-|--)[^-].*$", Pattern.DOTALL);

    private static final Pattern BOOLEAN_LITERAL = Pattern.compile("^(true|false)$");

    private static final Pattern LETTER = Pattern.compile("[A-Za-z]");

    private static final Pattern TRAILING_NUMBER = Pattern.compile("-?\\d+(\\.\\d*)?(e-?\\d+)?$");

    private static final Pattern NON_WORD = Pattern.compile("\\W");

    public ParsedArgs parse(final List<String> args, final ParseOptions options) {
        return new Parse(options).run(args);
    }

    private static final class Parse {
        private final ParseOptions options;

        private final Map<String, List<String>> aliases = new HashMap<>();

        private final Set<String> strings = new HashSet<>();

        private final Map<String, Object> values = new LinkedHashMap<>();

        private final List<String> positional = new ArrayList<>();

        Parse(final ParseOptions options) {
            this.options = options;

            options.aliases().forEach((key, names) -> {
                aliases.put(key, new ArrayList<>(names));
                for (final var name : names) {
                    final List<String> others = new ArrayList<>();
                    others.add(key);
                    others.addAll(names.stream().filter(e -> !e.equals(name)).collect(Collectors.toList()));
                    aliases.put(name, others);
                }
            });

            for (final var key : options.strings()) {
                strings.add(key);
                strings.addAll(aliasesOf(key));
            }
        }

        ParsedArgs run(final List<String> input) {
            for (final var key : options.booleans()) {
                final var value = options.defaults().get(key);
                set(key, value == null ? Boolean.FALSE : value);
            }

            List<String> args = input;
            List<String> notFlags = Collections.emptyList();
            final var separator = input.indexOf(Const.PASSTHROUGH);
            if (separator != -1) {
                notFlags = input.subList(separator + 1, input.size());
                args = input.subList(0, separator);
            }

            for (int i = 0; i < args.size(); i++) {
                final var arg = args.get(i);
                final var next = i + 1 < args.size() ? args.get(i + 1) : null;

                final var longWithValue = LONG_WITH_VALUE.matcher(arg);
                final var negated = NEGATED.matcher(arg);
                final var longOnly = LONG.matcher(arg);

                if (longWithValue.matches()) {
                    final var key = longWithValue.group(1);
                    final var raw = longWithValue.group(2);
                    set(key, isBoolean(key) ? (Object) !"false".equals(raw) : raw);
                } else if (negated.matches()) {
                    set(negated.group(1), Boolean.FALSE);
                } else if (longOnly.matches()) {
                    final var key = longOnly.group(1);
                    if (next != null && !FLAG_LIKE.matcher(next).matches() && !isBoolean(key)) {
                        set(key, next);
                        i++;
                    } else if (next != null && BOOLEAN_LITERAL.matcher(next).matches()) {
                        set(key, Boolean.valueOf(next));
                        i++;
                    } else {
                        set(key, strings.contains(key) ? "" : Boolean.TRUE);
                    }
                } else if (SHORT.matcher(arg).matches()) {
                    if (shortCluster(arg, next)) {
                        i++;
                    }
                } else {
                    positional.add(arg);
                }
            }

            options.defaults().forEach((key, value) -> {
                if (!values.containsKey(key)) {
                    values.put(key, value);
                    aliasesOf(key).forEach(alias -> values.put(alias, value));
                }
            });

            final List<String> passthrough = new ArrayList<>(notFlags);
            if (!options.doubleDash()) {
                positional.addAll(passthrough);
                passthrough.clear();
            }

            return new ParsedArgs(
                Collections.unmodifiableList(positional),
                Collections.unmodifiableList(passthrough),
                Collections.unmodifiableMap(values));
        }

        // true when the next token was taken as the value of the last letter
        private boolean shortCluster(final String arg, final String next) {
            final var letters = arg.substring(1, arg.length() - 1);
            var broken = false;

            for (int j = 0; j < letters.length(); j++) {
                final var letter = String.valueOf(letters.charAt(j));
                final var rest = arg.substring(j + 2);

                if (rest.equals("-")) {
                    set(letter, rest);
                    continue;
                }
                if (LETTER.matcher(letter).find() && rest.startsWith("=")) {
                    set(letter, rest.substring(1));
                    broken = true;
                    break;
                }
                if (LETTER.matcher(letter).find() && TRAILING_NUMBER.matcher(rest).find()) {
                    set(letter, rest);
                    broken = true;
                    break;
                }
                if (j + 1 < letters.length() && NON_WORD.matcher(String.valueOf(letters.charAt(j + 1))).find()) {
                    set(letter, rest);
                    broken = true;
                    break;
                }
                set(letter, strings.contains(letter) ? "" : Boolean.TRUE);
            }

            final var key = arg.substring(arg.length() - 1);
            if (broken || key.equals("-")) {
                return false;
            }

            if (next != null && !next.isEmpty() && !FLAG_LIKE.matcher(next).matches() && !isBoolean(key)) {
                set(key, next);
                return true;
            }
            if (next != null && BOOLEAN_LITERAL.matcher(next).matches()) {
                set(key, Boolean.valueOf(next));
                return true;
            }
            set(key, strings.contains(key) ? "" : Boolean.TRUE);
            return false;
        }

        private void set(final String key, final Object raw) {
            final Object value = !strings.contains(key) && raw instanceof String && Numbers.isNumber(raw)
                ? Numbers.parse((String) raw)
                : raw;

            log.trace("{} = {}", key, value);
            put(key, value);
            aliasesOf(key).forEach(alias -> put(alias, value));
        }

        private void put(final String key, final Object value) {
            final var existing = values.get(key);
            if (existing == null || isBoolean(key) || existing instanceof Boolean) {
                values.put(key, value);
            } else if (existing instanceof List) {
                final List<Object> list = new ArrayList<>((List<?>) existing);
                list.add(value);
                values.put(key, Collections.unmodifiableList(list));
            } else {
                values.put(key, List.of(existing, value));
            }
        }

        private boolean isBoolean(final String key) {
            return options.booleans().contains(key) || aliasesOf(key).stream().anyMatch(options.booleans()::contains);
        }

        private List<String> aliasesOf(final String key) {
            return aliases.getOrDefault(key, Collections.emptyList());
        }
    }
}
