package com.snipebot;

import com.snipebot.config.SnipebotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SnipebotProperties.class)
public class SnipebotApplication {

    public static void main(String[] args) {
        application().run(args);
    }

    static SpringApplication application() {
        SpringApplication application = new SpringApplication(SnipebotApplication.class);
        // payment approval pages open in the desktop browser
        application.setHeadless(false);
        return application;
    }
}
