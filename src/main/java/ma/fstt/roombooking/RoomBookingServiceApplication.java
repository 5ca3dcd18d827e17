package ma.fstt.roombooking;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@OpenAPIDefinition(info = @Info(
        title = "Room Booking Service API",
        description = "Room booking records with a status lifecycle, persisted as file snapshots",
        version = "0.0.1"
))
@SpringBootApplication
@ConfigurationPropertiesScan
public class RoomBookingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(RoomBookingServiceApplication.class, args);
    }
}
