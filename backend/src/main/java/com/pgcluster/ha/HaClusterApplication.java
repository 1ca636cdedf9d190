package com.pgcluster.ha;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HaClusterApplication {

    public static void main(String[] args) {
        SpringApplication.run(HaClusterApplication.class, args);
    }
}
