package cmdtree.common;

public class FlagConflictException extends CommandException {
    public FlagConflictException(final String message) {
        super(message);
    }
}
