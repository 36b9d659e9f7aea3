package netlab.provisioner.console;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.time.Duration;

/**
 * Console session over a raw telnet socket.
 */
public class TelnetConsoleSession extends ConsoleSession {

    private Socket socket;
    private InputStream in;
    private OutputStream out;
    private final TelnetNegotiation negotiation = new TelnetNegotiation();
    private final CharsetDecoder decoder;
    // tail of a multi-byte character split across reads
    private ByteBuffer undecoded = ByteBuffer.allocate(0);

    public TelnetConsoleSession(ConsoleSettings settings) {
        super(settings);
        this.decoder = settings.charset().newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    @Override
    protected void openTransport() throws IOException {
        socket = new Socket();
        socket.setTcpNoDelay(true);
        socket.connect(new InetSocketAddress(target().host(), target().port()),
                toTimeoutMillis(settings.connectTimeout()));
        in = socket.getInputStream();
        out = socket.getOutputStream();
    }

    @Override
    protected void writeRaw(String text) throws IOException {
        out.write(text.getBytes(settings.charset()));
        out.flush();
    }

    @Override
    protected String readChunk(int size, Duration timeout) throws IOException {
        socket.setSoTimeout(toTimeoutMillis(timeout));
        byte[] buf = new byte[size];
        int n;
        try {
            n = in.read(buf, 0, size);
        } catch (SocketTimeoutException e) {
            return "";
        }
        if (n < 0) {
            return null;
        }
        ByteArrayOutputStream replies = new ByteArrayOutputStream();
        byte[] data = negotiation.filter(buf, n, replies);
        if (replies.size() > 0) {
            out.write(replies.toByteArray());
            out.flush();
        }
        return decode(data);
    }

    private String decode(byte[] data) {
        ByteBuffer input = ByteBuffer.allocate(undecoded.remaining() + data.length);
        input.put(undecoded).put(data).flip();
        CharBuffer output = CharBuffer.allocate(
                (int) Math.ceil(input.remaining() * (double) decoder.maxCharsPerByte()) + 1);
        decoder.decode(input, output, false);
        undecoded = input.slice();
        output.flip();
        return output.toString();
    }

    @Override
    protected void closeTransport() throws IOException {
        Socket s = socket;
        socket = null;
        in = null;
        out = null;
        if (s != null) {
            s.close();
        }
    }

    // 0 means "wait forever" for sockets, so never go below 1 ms
    private static int toTimeoutMillis(Duration d) {
        long ms = d.toMillis();
        if (ms < 1) {
            return 1;
        }
        return (int) Math.min(ms, Integer.MAX_VALUE);
    }
}
