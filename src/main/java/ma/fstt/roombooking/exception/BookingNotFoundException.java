package ma.fstt.roombooking.exception;

public class BookingNotFoundException extends RuntimeException {

    public BookingNotFoundException(long bookingId) {
        super("Booking not found: " + bookingId);
    }
}
