package org.learningjava.macrohub.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.macrohub")
public class MacroHubApplication {
    public static void main(String[] args) {
        SpringApplication.run(MacroHubApplication.class, args);
    }
}
