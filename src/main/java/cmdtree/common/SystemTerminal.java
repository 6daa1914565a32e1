package cmdtree.common;

import lombok.AllArgsConstructor;

import java.util.List;

@AllArgsConstructor
public final class SystemTerminal implements Terminal {
    private final List<String> args;

    public SystemTerminal() {
        this(List.of());
    }

    public SystemTerminal(final String[] args) {
        this(List.of(args));
    }

    @Override
    public void stdout(final String text) {
        System.out.print(text);
        System.out.flush();
    }

    @Override
    public void stderr(final String text) {
        System.err.print(text);
        System.err.flush();
    }

    @Override
    public void exit(final int code) {
        System.exit(code);
    }

    @Override
    public List<String> args() {
        return args;
    }
}
