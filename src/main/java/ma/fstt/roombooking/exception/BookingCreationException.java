package ma.fstt.roombooking.exception;

public class BookingCreationException extends RuntimeException {

    public BookingCreationException(String message) {
        super(message);
    }
}
