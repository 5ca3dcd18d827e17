package ma.fstt.roombooking;

import ma.fstt.roombooking.config.SnapshotProperties;
import ma.fstt.roombooking.core.snapshot.SnapshotManager;
import ma.fstt.roombooking.core.store.BookingStore;
import ma.fstt.roombooking.domain.entity.Booking;
import ma.fstt.roombooking.domain.entity.BookingStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RoomBookingServiceApplicationTests {

    private static final Path SNAPSHOT = createSnapshotDir().resolve("bookings.snapshot");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private BookingStore bookingStore;

    @DynamicPropertySource
    static void snapshotPath(DynamicPropertyRegistry registry) {
        registry.add("booking.snapshot.path", SNAPSHOT::toString);
    }

    private static Path createSnapshotDir() {
        try {
            return Files.createTempDirectory("room-booking-test");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Test
    void bookingLifecycleOverHttpIsPersisted() throws Exception {
        String created = mockMvc.perform(post("/booking")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"customerId":1,"roomTypeId":3,"checkInDate":"2020-01-01","checkOutDate":"2020-01-08"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Confirmed"))
                .andReturn().getResponse().getContentAsString();
        long id = Long.parseLong(created.replaceAll(".*\"bookingId\":(\\d+).*", "$1"));

        mockMvc.perform(put("/booking/" + id + "/complete"))
                .andExpect(status().isOk())
                .andExpect(content().string("true"));
        mockMvc.perform(put("/booking/" + id + "/complete"))
                .andExpect(content().string("false"));
        mockMvc.perform(get("/booking/" + id))
                .andExpect(jsonPath("$.status").value("Complete"));

        mockMvc.perform(post("/booking")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"customerId":1,"roomTypeId":3,"checkInDate":"2020-01-01","checkOutDate":"2020-01-08","status":"Confirmed"}
                                """))
                .andExpect(status().isBadRequest());

        BookingStore restarted = new BookingStore(new SnapshotManager(), SnapshotProperties.at(SNAPSHOT));
        restarted.loadSnapshot();
        assertThat(restarted.fetchById(id)).get()
                .extracting(Booking::getStatus)
                .isEqualTo(BookingStatus.COMPLETE);
        assertThat(restarted.fetchAll()).containsExactlyInAnyOrderElementsOf(bookingStore.fetchAll());
    }

    @Test
    void apiDocumentationIsPublished() throws Exception {
        mockMvc.perform(get("/openapi.json"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("Room Bookings")))
                .andExpect(content().string(containsString("/booking/{bookingId}/complete")));
    }
}
