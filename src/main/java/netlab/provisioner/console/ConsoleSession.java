package netlab.provisioner.console;

import netlab.provisioner.model.ConsoleTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One connection to one node console.
 *
 * The console stream has no end-of-output marker, so reads are bounded by time:
 * {@link #readFor(Duration)} listens for a fixed window, and
 * {@link #runCommandWithStatus(String, Duration, String)} appends a sentinel that
 * makes the shell print the exit code once the command finishes.
 *
 * Sessions are single-use and not thread-safe. Use with try-with-resources:
 *
 * <pre>
 * try (ConsoleSession console = connector.open(target)) {
 *     CommandResult r = console.runCommandWithStatus("ip -4 addr show", Duration.ofSeconds(2));
 * }
 * </pre>
 *
 * Subclasses provide the transport.
 */
public abstract class ConsoleSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConsoleSession.class);

    public static final int DEFAULT_CHUNK_SIZE = 1024;
    public static final String DEFAULT_EXIT_COMMAND = "exit";
    static final Duration TRAILING_DRAIN = Duration.ofMillis(200);

    protected final ConsoleSettings settings;
    private volatile SessionState state = SessionState.CLOSED;

    protected ConsoleSession(ConsoleSettings settings) {
        this.settings = settings;
    }

    // ---- transport ----

    /** Open the underlying connection, honouring {@code settings.connectTimeout()}. */
    protected abstract void openTransport() throws IOException;

    /** Write text and flush. */
    protected abstract void writeRaw(String text) throws IOException;

    /**
     * Read at most {@code size} characters, waiting up to {@code timeout}.
     *
     * @return the chunk, an empty string on timeout, or null at end of stream
     */
    protected abstract String readChunk(int size, Duration timeout) throws IOException;

    protected abstract void closeTransport() throws IOException;

    // ---- lifecycle ----

    public SessionState state() {
        return state;
    }

    public ConsoleTarget target() {
        return settings.target();
    }

    /**
     * Open the console. On failure the session stays closed and the error is raised; nothing is retried.
     */
    public final void connect() {
        if (state != SessionState.CLOSED) {
            throw new IllegalStateException("Session already " + state + ": " + target());
        }
        state = SessionState.CONNECTING;
        try {
            openTransport();
            state = SessionState.OPEN;
            log.debug("Console connected: {}", target());
        } catch (IOException | RuntimeException e) {
            state = SessionState.CLOSED;
            try {
                closeTransport();
            } catch (IOException | RuntimeException closeError) {
                log.debug("Cleanup after failed connect to {}: {}", target(), closeError.getMessage());
            }
            throw new ConsoleException("Failed to connect to console " + target() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Send the exit command to free the console slot, then close the transport.
     * Never throws; failures are logged at DEBUG.
     */
    public final void close(String exitCommand) {
        if (state == SessionState.CLOSED) {
            return;
        }
        try {
            if (exitCommand != null && !exitCommand.isEmpty() && state == SessionState.OPEN) {
                writeRaw(exitCommand + settings.newline());
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Exit command failed on {}: {}", target(), e.getMessage());
        }
        try {
            closeTransport();
        } catch (IOException | RuntimeException e) {
            log.debug("Close failed on {}: {}", target(), e.getMessage());
        } finally {
            state = SessionState.CLOSED;
            log.debug("Console closed: {}", target());
        }
    }

    @Override
    public final void close() {
        close(DEFAULT_EXIT_COMMAND);
    }

    // ---- primitives ----

    public void send(String text) {
        send(text, true);
    }

    public void send(String text, boolean newline) {
        requireOpen();
        String payload = newline ? text + settings.newline() : text;
        try {
            writeRaw(payload);
        } catch (IOException e) {
            throw new ConsoleException("Write failed on " + target() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Single best-effort read. Returns an empty string when nothing arrives in time.
     */
    public String read(int size, Duration timeout) {
        String chunk = readOrEof(size, timeout);
        return chunk == null ? "" : chunk;
    }

    public String read(Duration timeout) {
        return read(DEFAULT_CHUNK_SIZE, timeout);
    }

    /**
     * Poll until the deadline elapses and return everything received.
     * Stops early if the remote side closes the stream.
     */
    public String readFor(Duration duration) {
        long deadline = System.nanoTime() + duration.toNanos();
        long pollNanos = settings.pollInterval().toNanos();
        StringBuilder out = new StringBuilder();
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            String chunk = readOrEof(DEFAULT_CHUNK_SIZE, Duration.ofNanos(Math.min(pollNanos, remaining)));
            if (chunk == null) {
                break;
            }
            out.append(chunk);
        }
        return out.toString();
    }

    // ---- command runners ----

    public String runCommand(String command, Duration readDuration) {
        send(command);
        return readFor(readDuration);
    }

    public CommandResult runCommandWithStatus(String command, Duration readDuration) {
        return runCommandWithStatus(command, readDuration, newSentinel());
    }

    /**
     * Run {@code command} and have the shell print {@code <sentinel> <exit code>} when it finishes.
     */
    public CommandResult runCommandWithStatus(String command, Duration readDuration, String sentinel) {
        send(wrapWithSentinel(command, sentinel));
        String raw = readFor(readDuration);
        CommandResult result = CommandResult.parse(raw, sentinel);
        // prompt noise after the marker
        readFor(TRAILING_DRAIN);
        return result;
    }

    public static String wrapWithSentinel(String command, String sentinel) {
        return command + "; printf '" + sentinel + " %s\\n' $?";
    }

    /** A marker with negligible chance of showing up in command output. */
    public static String newSentinel() {
        byte[] bytes = new byte[6];
        ThreadLocalRandom.current().nextBytes(bytes);
        return "__EXIT_" + HexFormat.of().formatHex(bytes) + "__";
    }

    private String readOrEof(int size, Duration timeout) {
        requireOpen();
        try {
            return readChunk(size, timeout);
        } catch (IOException e) {
            throw new ConsoleException("Read failed on " + target() + ": " + e.getMessage(), e);
        }
    }

    private void requireOpen() {
        if (state != SessionState.OPEN) {
            throw new ConsoleException("Console " + target() + " is not open (" + state + ")");
        }
    }
}
