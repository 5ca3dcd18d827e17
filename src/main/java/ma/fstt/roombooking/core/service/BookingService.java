package ma.fstt.roombooking.core.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import ma.fstt.roombooking.api.dto.BookingRequest;
import ma.fstt.roombooking.domain.entity.Booking;
import ma.fstt.roombooking.domain.entity.BookingStatus;
import ma.fstt.roombooking.domain.repository.BookingRepository;
import ma.fstt.roombooking.exception.BookingCreationException;
import ma.fstt.roombooking.exception.BookingNotFoundException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    private final BookingRepository bookingRepository;

    public Booking createBooking(BookingRequest request) {
        log.info("Creating booking for customerId={}, roomTypeId={}, checkIn={}, checkOut={}",
                request.getCustomerId(), request.getRoomTypeId(),
                request.getCheckInDate(), request.getCheckOutDate());

        try {
            Booking booking = bookingRepository.create(request.toBooking());
            log.info("Booking saved with id: {}", booking.getBookingId());
            return booking;
        } catch (BookingCreationException e) {
            log.warn("Booking request rejected: {}", e.getMessage());
            throw e;
        }
    }

    public Booking getBookingById(long bookingId) {
        return bookingRepository.fetchById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
    }

    public boolean completeBooking(long bookingId) {
        return changeStatus(bookingId, BookingStatus.COMPLETE);
    }

    public boolean cancelBooking(long bookingId) {
        return changeStatus(bookingId, BookingStatus.CANCELLED);
    }

    public List<Booking> getAllBookings() {
        return bookingRepository.fetchAll();
    }

    public List<Booking> getBookingsByCustomerId(long customerId) {
        return bookingRepository.fetchByCustomerId(customerId);
    }

    public List<Booking> getBookingsByRoomTypeId(int roomTypeId) {
        return bookingRepository.fetchByRoomTypeId(roomTypeId);
    }

    public List<Booking> getBookingsByCheckInDate(String checkInDate) {
        return bookingRepository.fetchByCheckInDate(checkInDate);
    }

    private boolean changeStatus(long bookingId, BookingStatus status) {
        boolean changed = bookingRepository.setStatus(bookingId, status);
        if (changed) {
            log.info("Booking {} set to {}", bookingId, status);
        } else {
            log.info("Booking {} not set to {}: unknown id or status already final", bookingId, status);
        }
        return changed;
    }
}
