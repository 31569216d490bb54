package com.ai.salon;

import com.ai.salon.config.KnowledgeProperties;
import com.ai.salon.config.NotificationProperties;
import com.ai.salon.config.SalonProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({SalonProperties.class, KnowledgeProperties.class, NotificationProperties.class})
public class SalonReceptionistApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalonReceptionistApplication.class, args);
    }
}
