package com.example.studydesign;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StudyDesignServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudyDesignServiceApplication.class, args);
    }
}
