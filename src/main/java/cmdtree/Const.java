package cmdtree;

public interface Const {
    String HELP = "help";
    String HELP_SHORT = "h";
    String COMMANDS_PLACEHOLDER = "[commands]";
    String PASSTHROUGH = "--";

    int EXIT_SUCCESS = 0;
    int EXIT_FAILURE = 1;

    interface Help {
        String USAGE = "Usage:";
        String AVAILABLE_COMMANDS = "Available Commands:";
        String FLAGS = "Flags:";
        String INDENT = "  ";
        String GUTTER = "   ";
        // dash + short + comma + space
        int SHORT_PADDING = 3;
        // dash + dash before the name
        int LONG_PADDING = 2;
    }
}
