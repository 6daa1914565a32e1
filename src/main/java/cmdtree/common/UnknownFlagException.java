package cmdtree.common;

public class UnknownFlagException extends CommandException {
    public UnknownFlagException(final String message) {
        super(message);
    }
}
