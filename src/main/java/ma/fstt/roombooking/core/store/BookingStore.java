package ma.fstt.roombooking.core.store;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import ma.fstt.roombooking.config.SnapshotProperties;
import ma.fstt.roombooking.core.snapshot.SnapshotException;
import ma.fstt.roombooking.core.snapshot.SnapshotManager;
import ma.fstt.roombooking.domain.entity.Booking;
import ma.fstt.roombooking.domain.entity.BookingLifecycle;
import ma.fstt.roombooking.domain.entity.BookingStatus;
import ma.fstt.roombooking.domain.repository.BookingRepository;
import ma.fstt.roombooking.exception.BookingCreationException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * In-memory booking collection persisted by whole-file snapshots.
 * <p>
 * One exclusive lock serializes every operation, reads included, and is held
 * while the snapshot is written. If an operation fails unexpectedly while
 * holding the lock the store is marked degraded: from then on reads come back
 * empty and writes fail, but nothing is thrown at the caller.
 */
@Component
@Slf4j
public class BookingStore implements BookingRepository {

    private final SnapshotManager snapshotManager;
    private final SnapshotProperties properties;

    private final Map<Long, Booking> bookings = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile boolean degraded;

    public BookingStore(SnapshotManager snapshotManager, SnapshotProperties properties) {
        this.snapshotManager = snapshotManager;
        this.properties = properties;
    }

    @PostConstruct
    void restoreOnStartup() {
        if (properties.loadOnStartup()) {
            loadSnapshot();
        } else {
            log.info("Snapshot loading disabled, starting with an empty store");
        }
    }

    /**
     * Replaces the whole collection with the snapshot on disk, if there is one.
     * A snapshot that cannot be read is logged and the store keeps its contents.
     */
    public void loadSnapshot() {
        Path path = properties.file();
        if (!snapshotManager.exists(path)) {
            log.info("No snapshot at {}, starting with an empty store", path);
            return;
        }

        Map<Long, Booking> loaded;
        try {
            loaded = snapshotManager.load(path);
        } catch (SnapshotException e) {
            log.error("An error occurred loading snapshot, starting with an empty store", e);
            return;
        }

        Integer count = guarded("loadSnapshot", () -> {
            bookings.clear();
            bookings.putAll(loaded);
            return bookings.size();
        }, () -> null);
        if (count != null) {
            log.info("Loaded snapshot with {} bookings from {}", count, path);
        }
    }

    @Override
    public Booking create(Booking booking) {
        if (booking == null) {
            throw new BookingCreationException("Booking details are required");
        }
        if (booking.getBookingId() != null) {
            throw new BookingCreationException("bookingId is assigned by the store and must not be set");
        }
        if (booking.getStatus() != null) {
            throw new BookingCreationException("status is assigned by the store and must not be set");
        }
        checkDetails(booking);

        return guarded("create", () -> {
            long id = BookingIdAllocator.nextId(bookings.keySet());
            Booking stored = booking.toBuilder()
                    .bookingId(id)
                    .status(BookingStatus.CONFIRMED)
                    .build();
            bookings.put(id, stored);
            writeSnapshot("create " + id);
            return stored.copy();
        }, () -> {
            throw new BookingCreationException("Booking store is unavailable");
        });
    }

    @Override
    public boolean setStatus(long bookingId, BookingStatus status) {
        return guarded("setStatus", () -> {
            Booking booking = bookings.get(bookingId);
            if (booking == null) {
                log.debug("Status change to {} refused: booking {} not found", status, bookingId);
                return false;
            }
            if (!BookingLifecycle.canTransition(booking.getStatus(), status)) {
                log.debug("Status change {} -> {} refused for booking {}", booking.getStatus(), status, bookingId);
                return false;
            }
            booking.setStatus(status);
            writeSnapshot("status " + bookingId + " -> " + status);
            return true;
        }, () -> false);
    }

    @Override
    public Optional<Booking> fetchById(long bookingId) {
        return guarded("fetchById",
                () -> Optional.ofNullable(bookings.get(bookingId)).map(Booking::copy),
                Optional::empty);
    }

    @Override
    public List<Booking> fetchAll() {
        return filter("fetchAll", booking -> true);
    }

    @Override
    public List<Booking> fetchByCustomerId(long customerId) {
        return filter("fetchByCustomerId", booking -> Objects.equals(booking.getCustomerId(), customerId));
    }

    @Override
    public List<Booking> fetchByRoomTypeId(int roomTypeId) {
        return filter("fetchByRoomTypeId", booking -> Objects.equals(booking.getRoomTypeId(), roomTypeId));
    }

    @Override
    public List<Booking> fetchByCheckInDate(String checkInDate) {
        return filter("fetchByCheckInDate", booking -> Objects.equals(booking.getCheckInDate(), checkInDate));
    }

    public int size() {
        return guarded("size", bookings::size, () -> 0);
    }

    public boolean isDegraded() {
        return degraded;
    }

    private List<Booking> filter(String operation, Predicate<Booking> predicate) {
        return guarded(operation, () -> bookings.values().stream()
                .filter(predicate)
                .map(Booking::copy)
                .toList(), List::of);
    }

    private static void checkDetails(Booking booking) {
        if (booking.getCustomerId() == null || booking.getRoomTypeId() == null
                || booking.getCheckInDate() == null || booking.getCheckOutDate() == null) {
            throw new BookingCreationException("customerId, roomTypeId, checkInDate and checkOutDate are required");
        }
        if (booking.getCustomerId() < 0 || booking.getCustomerId() > Booking.MAX_UNSIGNED_INT) {
            throw new BookingCreationException("customerId out of range: " + booking.getCustomerId());
        }
        if (booking.getRoomTypeId() < 0 || booking.getRoomTypeId() > Booking.MAX_ROOM_TYPE_ID) {
            throw new BookingCreationException("roomTypeId out of range: " + booking.getRoomTypeId());
        }
    }

    // Caller holds the lock
    private void writeSnapshot(String cause) {
        Path path = properties.file();
        if (!snapshotManager.save(path, Collections.unmodifiableMap(bookings))) {
            log.warn("Snapshot after {} was not written to {}", cause, path);
        }
    }

    private <T> T guarded(String operation, Supplier<T> action, Supplier<T> fallback) {
        if (degraded) {
            log.warn("Booking store degraded, {} skipped", operation);
            return fallback.get();
        }
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for booking store lock, {} skipped", operation);
            return fallback.get();
        }
        try {
            if (degraded) {
                log.warn("Booking store degraded, {} skipped", operation);
                return fallback.get();
            }
            return action.get();
        } catch (BookingCreationException e) {
            throw e;
        } catch (RuntimeException e) {
            degraded = true;
            log.error("Booking store failed during {}, switching to degraded mode", operation, e);
            return fallback.get();
        } finally {
            lock.unlock();
        }
    }
}
