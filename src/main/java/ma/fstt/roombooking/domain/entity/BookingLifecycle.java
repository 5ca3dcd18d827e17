package ma.fstt.roombooking.domain.entity;

/**
 * Allowed status transitions of a booking.
 * <p>
 * Only CONFIRMED -> COMPLETE and CONFIRMED -> CANCELLED are legal. Both targets
 * are terminal, so re-applying the same status is refused as well.
 */
public final class BookingLifecycle {

    private BookingLifecycle() {
    }

    public static boolean canTransition(BookingStatus current, BookingStatus requested) {
        if (current != BookingStatus.CONFIRMED || requested == null) {
            return false;
        }
        return requested.isTerminal();
    }
}
