package netlab.provisioner.console;

import java.io.ByteArrayOutputStream;

/**
 * Strips Telnet negotiation (IAC commands, sub-negotiations) from console bytes
 * and refuses every option the server offers or requests, which leaves the
 * console in plain NVT mode.
 * <p>State is kept across calls because a sequence can straddle two reads.</p>
 */
final class TelnetNegotiation {
    static final int IAC = 0xFF;
    static final int SB = 0xFA;
    static final int SE = 0xF0;
    static final int WILL = 0xFB;
    static final int WONT = 0xFC;
    static final int DO = 0xFD;
    static final int DONT = 0xFE;

    private enum State { DATA, IAC, OPTION, SUB, SUB_IAC }

    private State state = State.DATA;
    private int pendingCommand;

    /**
     * Filter {@code len} bytes of {@code input}.
     *
     * @param replies receives the refusal bytes to send back to the server
     * @return data bytes with negotiation removed
     */
    byte[] filter(byte[] input, int len, ByteArrayOutputStream replies) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(len);
        for (int i = 0; i < len; i++) {
            int b = input[i] & 0xFF;
            switch (state) {
                case DATA -> {
                    if (b == IAC) {
                        state = State.IAC;
                    } else {
                        out.write(b);
                    }
                }
                case IAC -> {
                    switch (b) {
                        case IAC -> {
                            out.write(IAC);
                            state = State.DATA;
                        }
                        case WILL, WONT, DO, DONT -> {
                            pendingCommand = b;
                            state = State.OPTION;
                        }
                        case SB -> state = State.SUB;
                        default -> state = State.DATA; // NOP, GA and friends
                    }
                }
                case OPTION -> {
                    refuse(pendingCommand, b, replies);
                    state = State.DATA;
                }
                case SUB -> {
                    if (b == IAC) {
                        state = State.SUB_IAC;
                    }
                }
                case SUB_IAC -> state = (b == SE) ? State.DATA : State.SUB;
            }
        }
        return out.toByteArray();
    }

    private static void refuse(int command, int option, ByteArrayOutputStream replies) {
        if (command == DO) {
            replies.write(IAC);
            replies.write(WONT);
            replies.write(option);
        } else if (command == WILL) {
            replies.write(IAC);
            replies.write(DONT);
            replies.write(option);
        }
    }
}
