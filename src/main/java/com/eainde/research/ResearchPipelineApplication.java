package com.eainde.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResearchPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchPipelineApplication.class, args);
    }
}
