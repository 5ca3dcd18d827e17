package ma.fstt.roombooking.domain.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Booking Status Enum
 *
 * Defines all possible states of a booking:
 *
 * 1. CONFIRMED - Booking created and held for the customer
 * 2. COMPLETE - Stay finished (terminal)
 * 3. CANCELLED - Booking cancelled, the record is kept (terminal)
 *
 * The external form of each value is its label, e.g. "Confirmed".
 */
public enum BookingStatus {
    CONFIRMED("Confirmed"),

    COMPLETE("Complete"),

    CANCELLED("Cancelled");

    private final String label;

    BookingStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return this != CONFIRMED;
    }

    @JsonCreator
    public static BookingStatus fromLabel(String label) {
        return Arrays.stream(values())
                .filter(status -> status.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown booking status: " + label));
    }

    @Override
    public String toString() {
        return label;
    }
}
