package com.architecture.memory.archstage;

import com.architecture.memory.archstage.config.ArchStageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ArchStageProperties.class)
public class ArchStageApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArchStageApplication.class, args);
    }
}
