package ma.fstt.roombooking.domain.repository;

import ma.fstt.roombooking.domain.entity.Booking;
import ma.fstt.roombooking.domain.entity.BookingStatus;

import java.util.List;
import java.util.Optional;

/**
 * Owner of the booking collection and the only path for mutating it.
 * Every method hands back copies; nothing returned is shared with the store.
 */
public interface BookingRepository {

    /**
     * Stores a new booking, assigning its id and the CONFIRMED status.
     *
     * @throws ma.fstt.roombooking.exception.BookingCreationException if the booking
     *         already carries an id or a status, or the store cannot accept it
     */
    Booking create(Booking booking);

    /**
     * Moves a booking to a new status.
     *
     * @return false when the id is unknown or the transition is not allowed
     */
    boolean setStatus(long bookingId, BookingStatus status);

    Optional<Booking> fetchById(long bookingId);

    List<Booking> fetchAll();

    /**
     * Find all bookings made by a customer
     */
    List<Booking> fetchByCustomerId(long customerId);

    /**
     * Find all bookings for a room type
     */
    List<Booking> fetchByRoomTypeId(int roomTypeId);

    /**
     * Find all bookings whose check-in date equals the given value
     */
    List<Booking> fetchByCheckInDate(String checkInDate);
}
