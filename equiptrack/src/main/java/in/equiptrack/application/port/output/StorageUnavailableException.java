package in.equiptrack.application.port.output;

/**
 * Thrown by storage adapters when the engine cannot complete a read or write.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
