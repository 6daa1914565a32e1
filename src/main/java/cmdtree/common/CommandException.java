package cmdtree.common;

public class CommandException extends RuntimeException {
    public CommandException(final String message) {
        super(message);
    }
}
