package com.library.circulation;

import com.library.circulation.config.CirculationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CirculationProperties.class)
public class CirculationApplication {

    public static void main(String[] args) {
        SpringApplication.run(CirculationApplication.class, args);
    }
}
