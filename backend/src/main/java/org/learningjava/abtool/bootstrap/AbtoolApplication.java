package org.learningjava.abtool.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.abtool")
public class AbtoolApplication {
    public static void main(String[] args) {
        SpringApplication.run(AbtoolApplication.class, args);
    }
}
