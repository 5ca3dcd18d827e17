package ma.fstt.roombooking.core.snapshot;

import java.nio.file.Path;

public class SnapshotException extends Exception {

    public SnapshotException(Path path, String message) {
        super("Snapshot " + path + ": " + message);
    }

    public SnapshotException(Path path, String message, Throwable cause) {
        super("Snapshot " + path + ": " + message, cause);
    }
}
