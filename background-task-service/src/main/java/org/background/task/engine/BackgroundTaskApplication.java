package org.background.task.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BackgroundTaskApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackgroundTaskApplication.class, args);
    }
}
