package uk.gegc.railintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RailIntelApplication {

    public static void main(String[] args) {
        SpringApplication.run(RailIntelApplication.class, args);
    }
}
