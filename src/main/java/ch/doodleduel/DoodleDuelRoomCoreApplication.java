package ch.doodleduel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the room core.
 *
 * <p>Normally embedded in the client shell; running it standalone starts the services against the
 * configured store and performs one stale room pass.
 */
@SpringBootApplication
public class DoodleDuelRoomCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(DoodleDuelRoomCoreApplication.class, args);
    }

}
