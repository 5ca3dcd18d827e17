package ma.fstt.roombooking.core.snapshot;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import lombok.extern.slf4j.Slf4j;
import ma.fstt.roombooking.domain.entity.Booking;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes the whole booking collection as one CBOR-encoded map of
 * booking id to booking. The file carries no version tag; records that do not
 * match the current {@link Booking} shape are refused on load.
 */
@Component
@Slf4j
public class SnapshotManager {

    private static final TypeReference<Map<Long, Booking>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper = new CBORMapper();

    public boolean exists(Path path) {
        return Files.exists(path);
    }

    public Map<Long, Booking> load(Path path) throws SnapshotException {
        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new SnapshotException(path, "read failed", e);
        }
        if (data.length == 0) {
            throw new SnapshotException(path, "file is empty");
        }

        Map<Long, Booking> bookings;
        try {
            bookings = mapper.readValue(data, SNAPSHOT_TYPE);
        } catch (IOException e) {
            throw new SnapshotException(path, "decode failed", e);
        }
        if (bookings == null) {
            throw new SnapshotException(path, "no booking map in file");
        }

        for (Map.Entry<Long, Booking> entry : bookings.entrySet()) {
            checkRecord(path, entry.getKey(), entry.getValue());
        }
        log.debug("Decoded {} bookings from {}", bookings.size(), path);
        return new HashMap<>(bookings);
    }

    /**
     * Overwrites the snapshot with the given collection. Never throws; a failed
     * write is logged and reported as {@code false}.
     */
    public boolean save(Path path, Map<Long, Booking> bookings) {
        Path tmp = null;
        try {
            byte[] data = mapper.writeValueAsBytes(bookings);

            Path dir = path.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            Files.write(tmp, data);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote snapshot of {} bookings to {}", bookings.size(), path);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write snapshot to {}: {}", path, e.getMessage());
            deleteQuietly(tmp);
            return false;
        }
    }

    private static void checkRecord(Path path, Long key, Booking booking) throws SnapshotException {
        if (key == null || booking == null) {
            throw new SnapshotException(path, "null entry for id " + key);
        }
        if (!Objects.equals(key, booking.getBookingId())) {
            throw new SnapshotException(path, "entry " + key + " holds booking id " + booking.getBookingId());
        }
        if (key < 1 || key > Booking.MAX_UNSIGNED_INT) {
            throw new SnapshotException(path, "booking id out of range: " + key);
        }
        if (booking.getStatus() == null) {
            throw new SnapshotException(path, "booking " + key + " has no status");
        }
        if (booking.getCustomerId() == null || booking.getRoomTypeId() == null
                || booking.getCheckInDate() == null || booking.getCheckOutDate() == null) {
            throw new SnapshotException(path, "booking " + key + " is missing fields");
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temporary snapshot {}", tmp, e);
        }
    }
}
