package de.asta.usersync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UserSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(UserSyncApplication.class, args);
    }
}
