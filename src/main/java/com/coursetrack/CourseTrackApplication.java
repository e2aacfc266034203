package com.coursetrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CourseTrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseTrackApplication.class, args);
    }
}
