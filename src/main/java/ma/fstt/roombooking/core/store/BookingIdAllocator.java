package ma.fstt.roombooking.core.store;

import ma.fstt.roombooking.domain.entity.Booking;
import ma.fstt.roombooking.exception.BookingCreationException;

import java.util.Collection;

/**
 * Derives the next booking id as one past the highest id in use.
 * Bookings are never removed, so the maximum only grows and ids are never reused.
 * If removal is ever added this has to become a persisted counter.
 */
public final class BookingIdAllocator {

    private BookingIdAllocator() {
    }

    public static long nextId(Collection<Long> existingIds) {
        long max = existingIds.stream()
                .mapToLong(Long::longValue)
                .max()
                .orElse(0L);
        if (max >= Booking.MAX_UNSIGNED_INT) {
            throw new BookingCreationException("Booking id space exhausted");
        }
        return max + 1;
    }
}
