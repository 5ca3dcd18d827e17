package ma.fstt.roombooking.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    public static final long MAX_UNSIGNED_INT = 4_294_967_295L;
    public static final int MAX_ROOM_TYPE_ID = 255;

    // Assigned by the store on creation, never changed afterwards
    private Long bookingId;

    private Long customerId;

    private Integer roomTypeId;

    // Opaque date strings, compared by equality only
    private String checkInDate;

    private String checkOutDate;

    private BookingStatus status;

    public Booking copy() {
        return toBuilder().build();
    }
}
