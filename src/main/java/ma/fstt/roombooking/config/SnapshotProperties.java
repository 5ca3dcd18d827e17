package ma.fstt.roombooking.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "booking.snapshot")
public record SnapshotProperties(
        String path,
        Boolean loadOnStartup) {

    public static final String DEFAULT_PATH = "data/bookings.snapshot";

    public SnapshotProperties {
        if (path == null || path.isBlank()) {
            path = DEFAULT_PATH;
        }
        if (loadOnStartup == null) {
            loadOnStartup = Boolean.TRUE;
        }
    }

    public static SnapshotProperties at(Path file) {
        return new SnapshotProperties(file.toString(), true);
    }

    public Path file() {
        return Path.of(path);
    }
}
