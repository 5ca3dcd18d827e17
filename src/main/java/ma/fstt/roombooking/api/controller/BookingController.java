package ma.fstt.roombooking.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import ma.fstt.roombooking.api.dto.BookingRequest;
import ma.fstt.roombooking.core.service.BookingService;
import ma.fstt.roombooking.domain.entity.Booking;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Room booking endpoints.
 *
 *   POST   /booking                         - create a booking
 *   GET    /booking/{bookingId}             - fetch one booking
 *   PUT    /booking/{bookingId}/complete    - mark a booking Complete
 *   DELETE /booking/{bookingId}             - mark a booking Cancelled (the record is kept)
 *   GET    /bookings                        - all bookings
 *   GET    /bookings/customer/{customerId}  - bookings of a customer
 *   GET    /bookings/date/{date}            - bookings checking in on a date
 *   GET    /bookings/room-type/{roomTypeId} - bookings of a room type
 */
@RestController
@Validated
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;

    @Operation(summary = "Create a room booking with the provided data",
            description = "Creates the room booking with the provided booking data. Returns the booking.")
    @Tag(name = "Room Booking")
    @PostMapping("/booking")
    public ResponseEntity<Booking> createRoomBooking(@Valid @RequestBody BookingRequest request) {
        return ResponseEntity.ok(bookingService.createBooking(request));
    }

    @Operation(summary = "Get room booking for the specified id", description = "Returns booking details.")
    @Tag(name = "Room Booking")
    @GetMapping("/booking/{bookingId}")
    public ResponseEntity<Booking> getRoomBooking(
            @PathVariable @Min(0) @Max(Booking.MAX_UNSIGNED_INT) long bookingId) {
        return ResponseEntity.ok(bookingService.getBookingById(bookingId));
    }

    @Operation(summary = "Complete the booking with the provided booking id",
            description = "Sets the status of the room booking specified to 'Complete'. Returns true on success, false on failure.")
    @Tag(name = "Room Booking")
    @PutMapping("/booking/{bookingId}/complete")
    public ResponseEntity<Boolean> completeRoomBooking(
            @PathVariable @Min(0) @Max(Booking.MAX_UNSIGNED_INT) long bookingId) {
        return ResponseEntity.ok(bookingService.completeBooking(bookingId));
    }

    @Operation(summary = "Cancel the booking with the provided booking id",
            description = "Sets the booking status to 'Cancelled' for the booking with the provided id. Returns true on success, false on failure.")
    @Tag(name = "Room Booking")
    @DeleteMapping("/booking/{bookingId}")
    public ResponseEntity<Boolean> cancelRoomBooking(
            @PathVariable @Min(0) @Max(Booking.MAX_UNSIGNED_INT) long bookingId) {
        return ResponseEntity.ok(bookingService.cancelBooking(bookingId));
    }

    @Operation(summary = "Get all room bookings", description = "Returns a list containing all room bookings in the system")
    @Tag(name = "Room Bookings")
    @GetMapping("/bookings")
    public ResponseEntity<List<Booking>> getRoomBookings() {
        return ResponseEntity.ok(bookingService.getAllBookings());
    }

    @Operation(summary = "Get room bookings for the specified customer id", description = "Returns a list of bookings.")
    @Tag(name = "Room Bookings")
    @GetMapping("/bookings/customer/{customerId}")
    public ResponseEntity<List<Booking>> getCustomerRoomBookings(
            @PathVariable @Min(0) @Max(Booking.MAX_UNSIGNED_INT) long customerId) {
        return ResponseEntity.ok(bookingService.getBookingsByCustomerId(customerId));
    }

    @Operation(summary = "Get room bookings starting on the provided date", description = "Returns a list of bookings.")
    @Tag(name = "Room Bookings")
    @GetMapping("/bookings/date/{date}")
    public ResponseEntity<List<Booking>> getBookingsStartingOnDate(@PathVariable String date) {
        return ResponseEntity.ok(bookingService.getBookingsByCheckInDate(date));
    }

    @Operation(summary = "Get room bookings for the specified room type", description = "Returns a list of bookings.")
    @Tag(name = "Room Bookings")
    @GetMapping("/bookings/room-type/{roomTypeId}")
    public ResponseEntity<List<Booking>> getRoomTypeBookings(
            @PathVariable @Min(0) @Max(Booking.MAX_ROOM_TYPE_ID) int roomTypeId) {
        return ResponseEntity.ok(bookingService.getBookingsByRoomTypeId(roomTypeId));
    }
}
