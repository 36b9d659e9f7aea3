package netlab.provisioner.console;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * In-memory console for tests. Every line written is passed to a responder
 * whose answer becomes readable output. When no output is queued the session
 * reports end of stream, so reads return immediately instead of waiting.
 */
public class ScriptedConsoleSession extends ConsoleSession {

    private final Function<String, String> responder;
    private final Deque<String> pending = new ArrayDeque<>();
    private final List<String> commands = new ArrayList<>();

    public ScriptedConsoleSession(ConsoleSettings settings, Function<String, String> responder) {
        super(settings);
        this.responder = responder;
    }

    @Override
    protected void openTransport() {
    }

    @Override
    protected void writeRaw(String text) {
        String line = text.endsWith(settings.newline())
                ? text.substring(0, text.length() - settings.newline().length())
                : text;
        commands.add(line);
        String reply = responder.apply(line);
        if (reply != null && !reply.isEmpty()) {
            pending.add(reply);
        }
    }

    @Override
    protected String readChunk(int size, Duration timeout) {
        String next = pending.poll();
        if (next == null) {
            return null;
        }
        if (next.length() > size) {
            pending.addFirst(next.substring(size));
            return next.substring(0, size);
        }
        return next;
    }

    @Override
    protected void closeTransport() {
        pending.clear();
    }

    /** Lines written to this session, exit command included. */
    public List<String> commands() {
        return commands;
    }
}
