package ru.derendyaev.SmsInbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SmsInboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmsInboxApplication.class, args);
    }
}
