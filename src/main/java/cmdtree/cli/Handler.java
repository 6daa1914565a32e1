package cmdtree.cli;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

@FunctionalInterface
public interface Handler {
    int run(Command command, List<String> args, Flags flags) throws Exception;

    @FunctionalInterface
    interface Async {
        CompletionStage<Integer> run(Command command, List<String> args, Flags flags) throws Exception;
    }

    /**
     * Adapts a handler that completes later. The dispatch waits for the stage to complete; a stage that fails
     * surfaces its cause as if the handler had thrown it.
     */
    static Handler async(final Async handler) {
        return (command, args, flags) -> {
            try {
                return handler.run(command, args, flags).toCompletableFuture().get();
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (final ExecutionException e) {
                if (e.getCause() instanceof Exception) {
                    throw (Exception) e.getCause();
                }
                throw e;
            }
        };
    }
}
