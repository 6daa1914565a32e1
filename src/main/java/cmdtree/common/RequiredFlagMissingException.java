package cmdtree.common;

public class RequiredFlagMissingException extends CommandException {
    public RequiredFlagMissingException(final String message) {
        super(message);
    }
}
