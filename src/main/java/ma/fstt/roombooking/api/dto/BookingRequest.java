package ma.fstt.roombooking.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ma.fstt.roombooking.domain.entity.Booking;
import ma.fstt.roombooking.domain.entity.BookingStatus;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Room booking details. bookingId and status are assigned by the service and must be left out")
public class BookingRequest {

    @Schema(description = "Assigned by the service, must not be set on creation", nullable = true)
    private Long bookingId;

    @NotNull
    @Min(0)
    @Max(Booking.MAX_UNSIGNED_INT)
    @Schema(example = "1")
    private Long customerId;

    @NotNull
    @Min(0)
    @Max(Booking.MAX_ROOM_TYPE_ID)
    @Schema(example = "3")
    private Integer roomTypeId;

    @NotNull
    @Schema(example = "2020-01-01")
    private String checkInDate;

    @NotNull
    @Schema(example = "2020-01-08")
    private String checkOutDate;

    @Schema(description = "Assigned by the service, must not be set on creation",
            allowableValues = {"Confirmed", "Complete", "Cancelled"}, nullable = true)
    private BookingStatus status;

    public Booking toBooking() {
        return Booking.builder()
                .bookingId(bookingId)
                .customerId(customerId)
                .roomTypeId(roomTypeId)
                .checkInDate(checkInDate)
                .checkOutDate(checkOutDate)
                .status(status)
                .build();
    }
}
