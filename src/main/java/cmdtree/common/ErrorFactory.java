package cmdtree.common;

public interface ErrorFactory {
    String MISSING_USAGE = "use is required";

    String DUPLICATE_COMMAND = "a command %s already exists";

    String FLAG_CONFLICT = "--%s has conflict with: --%s %s";

    String MISSING_FLAG_NAME = "a flag needs a name or a short name";

    String AMBIGUOUS_COMMAND = "ambiguous command %s";

    String UNKNOWN_FLAG = "unknown flag '%s'";

    String REQUIRED_FLAG = "--%s is required";

    String INVALID_NUMBER = "flag '%s' expects a number, but received: %s";

    static MissingUsageException missingUsage() {
        return new MissingUsageException(MISSING_USAGE);
    }

    static DuplicateCommandException duplicateCommand(final String name) {
        return new DuplicateCommandException(String.format(DUPLICATE_COMMAND, name));
    }

    static FlagConflictException flagConflict(final String name, final String existingName, final String existingShort) {
        return new FlagConflictException(String.format(
            FLAG_CONFLICT,
            name,
            existingName,
            existingShort.isEmpty() ? "" : "-" + existingShort));
    }

    static RuntimeException missingFlagName() {
        return new IllegalArgumentException(MISSING_FLAG_NAME);
    }

    static AmbiguousCommandException ambiguousCommand(final String token) {
        return new AmbiguousCommandException(String.format(AMBIGUOUS_COMMAND, token));
    }

    static UnknownFlagException unknownFlag(final String key) {
        return new UnknownFlagException(String.format(UNKNOWN_FLAG, key));
    }

    static RequiredFlagMissingException requiredFlag(final String name) {
        return new RequiredFlagMissingException(String.format(REQUIRED_FLAG, name));
    }

    static RuntimeException invalidNumber(final String key, final Object value) {
        return new IllegalArgumentException(String.format(INVALID_NUMBER, key, value));
    }
}
