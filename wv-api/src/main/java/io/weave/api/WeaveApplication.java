package io.weave.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.weave")
public class WeaveApplication {
    public static void main(String[] args) {
        SpringApplication.run(WeaveApplication.class, args);
    }
}
