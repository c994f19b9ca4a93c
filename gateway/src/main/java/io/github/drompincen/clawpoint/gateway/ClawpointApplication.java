package io.github.drompincen.clawpoint.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.clawpoint")
public class ClawpointApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClawpointApplication.class, args);
    }
}
