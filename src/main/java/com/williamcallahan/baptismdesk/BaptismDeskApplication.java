package com.williamcallahan.baptismdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BaptismDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(BaptismDeskApplication.class, args);
    }

}
