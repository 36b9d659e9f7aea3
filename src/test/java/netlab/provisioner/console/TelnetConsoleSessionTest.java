package netlab.provisioner.console;

import netlab.provisioner.model.ConsoleTarget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the telnet session against a small in-process console: it opens with a
 * DO ECHO negotiation and a prompt, answers sentinel-wrapped commands with the
 * marker and exit code 0, and closes the connection on "quit".
 */
class TelnetConsoleSessionTest {

    private static final Pattern SENTINEL = Pattern.compile("printf '(__EXIT_[0-9a-f]+__) %s");
    private static final int IAC = 0xFF;
    private static final int DO = 0xFD;
    private static final int WONT = 0xFC;
    private static final int ECHO = 1;

    private ServerSocket server;
    private Thread serverThread;
    private final List<String> receivedLines = new CopyOnWriteArrayList<>();
    private final ByteArrayOutputStream negotiationReplies = new ByteArrayOutputStream();

    @BeforeEach
    void startFakeConsole() throws IOException {
        server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        serverThread = new Thread(this::serve, "fake-console");
        serverThread.setDaemon(true);
        serverThread.start();
    }

    @AfterEach
    void stopFakeConsole() throws Exception {
        server.close();
        serverThread.join(2000);
    }

    private void serve() {
        try (Socket client = server.accept()) {
            InputStream in = client.getInputStream();
            OutputStream out = client.getOutputStream();
            out.write(new byte[] {(byte) IAC, (byte) DO, (byte) ECHO});
            out.write("Welcome\r\n$ ".getBytes(StandardCharsets.US_ASCII));
            out.flush();

            StringBuilder line = new StringBuilder();
            int b;
            while ((b = in.read()) >= 0) {
                if (b == IAC) {
                    synchronized (negotiationReplies) {
                        negotiationReplies.write(b);
                        negotiationReplies.write(in.read());
                        negotiationReplies.write(in.read());
                    }
                    continue;
                }
                if (b != '\r') {
                    line.append((char) b);
                    continue;
                }
                String command = line.toString();
                line.setLength(0);
                receivedLines.add(command);
                if ("quit".equals(command)) {
                    return;
                }
                Matcher m = SENTINEL.matcher(command);
                String reply = m.find()
                        ? "output of command\r\n" + m.group(1) + " 0\r\n$ "
                        : "echo: " + command + "\r\n$ ";
                out.write(reply.getBytes(StandardCharsets.US_ASCII));
                out.flush();
            }
        } catch (IOException e) {
            // server socket closed by the test teardown
        }
    }

    private TelnetConsoleSession newSession(int port) {
        ConsoleSettings settings = ConsoleSettings.of(new ConsoleTarget("127.0.0.1", port))
                .withTimeouts(Duration.ofSeconds(2), Duration.ofMillis(20));
        return new TelnetConsoleSession(settings);
    }

    @Test
    @DisplayName("Banner arrives without negotiation bytes and DO ECHO is refused")
    void stripsNegotiationAndRefusesOptions() throws Exception {
        try (TelnetConsoleSession session = newSession(server.getLocalPort())) {
            session.connect();
            assertEquals(SessionState.OPEN, session.state());

            String banner = session.readFor(Duration.ofMillis(300));

            assertEquals("Welcome\r\n$ ", banner);
        }
        serverThread.join(2000);
        synchronized (negotiationReplies) {
            assertArrayEquals(new byte[] {(byte) IAC, (byte) WONT, (byte) ECHO}, negotiationReplies.toByteArray());
        }
    }

    @Test
    void runCommandWithStatusReportsExitCode() {
        try (TelnetConsoleSession session = newSession(server.getLocalPort())) {
            session.connect();
            session.readFor(Duration.ofMillis(200));

            CommandResult result = session.runCommandWithStatus("ls /", Duration.ofMillis(500));

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("output of command"));
        }
        assertTrue(receivedLines.get(0).startsWith("ls /; printf '__EXIT_"));
    }

    @Test
    void closeSendsExitCommand() throws Exception {
        TelnetConsoleSession session = newSession(server.getLocalPort());
        session.connect();
        session.close();

        assertEquals(SessionState.CLOSED, session.state());
        serverThread.join(2000);
        assertTrue(receivedLines.contains("exit"));
    }

    @Test
    void readForReturnsEarlyWhenRemoteCloses() {
        try (TelnetConsoleSession session = newSession(server.getLocalPort())) {
            session.connect();
            session.readFor(Duration.ofMillis(200));
            session.send("quit");

            long start = System.nanoTime();
            String rest = session.readFor(Duration.ofSeconds(5));
            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertEquals("", rest);
            assertTrue(elapsedMs < 4000, "readFor should stop at end of stream, took " + elapsedMs + " ms");
        }
    }

    @Test
    @DisplayName("A UTF-8 character split across two socket reads is decoded intact")
    void multiByteCharacterSplitAcrossReads() throws Exception {
        try (ServerSocket splitServer = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            Thread writer = new Thread(() -> {
                try (Socket client = splitServer.accept()) {
                    OutputStream out = client.getOutputStream();
                    out.write(new byte[] {'c', 'a', 'f', (byte) 0xC3});
                    out.flush();
                    Thread.sleep(150);
                    out.write(new byte[] {(byte) 0xA9, '\r', '\n'});
                    out.flush();
                    client.getInputStream().read();
                } catch (IOException e) {
                    // client went away
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "split-console");
            writer.setDaemon(true);
            writer.start();

            try (TelnetConsoleSession session = newSession(splitServer.getLocalPort())) {
                session.connect();

                assertEquals("caf\u00e9\r\n", session.readFor(Duration.ofMillis(400)));
            }
            writer.join(2000);
        }
    }

    @Test
    void connectFailureLeavesSessionClosed() throws IOException {
        int closedPort;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = probe.getLocalPort();
        }
        TelnetConsoleSession session = newSession(closedPort);

        assertThrows(ConsoleException.class, session::connect);
        assertEquals(SessionState.CLOSED, session.state());
    }

    @Test
    void operationsRequireOpenSession() {
        TelnetConsoleSession session = newSession(server.getLocalPort());

        assertThrows(ConsoleException.class, () -> session.send("ls"));
        assertThrows(ConsoleException.class, () -> session.readFor(Duration.ofMillis(10)));
    }

    @Test
    void connectTwiceIsRejected() {
        try (TelnetConsoleSession session = newSession(server.getLocalPort())) {
            session.connect();
            assertThrows(IllegalStateException.class, session::connect);
        }
    }
}
