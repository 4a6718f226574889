package com.chuntfm.schedule;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChuntScheduleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChuntScheduleApplication.class, args);
    }
}
