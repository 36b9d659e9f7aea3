package netlab.provisioner.platform;

/**
 * A call to the emulation platform failed.
 */
public class PlatformException extends RuntimeException {

    private final int statusCode;

    public PlatformException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when the request never got a response. */
    public int statusCode() {
        return statusCode;
    }
}
