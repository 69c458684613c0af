package com.dedicatedcode.hakemisto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HakemistoApplication implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(HakemistoApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HakemistoApplication.class, args);
    }

    private void printApiInfo() {
        logger.info("HAKEMISTO is now serving data under the following endpoints:");
        logger.info("  Health Check:      GET  /api/v1/health");
        logger.info("  Exact name:        GET  /api/v1/names/{name}");
        logger.info("  Name prefix:       GET  /api/v1/prefix?q=San%20Fr");
        logger.info("  Features:          GET  /api/v1/features?ids=geonameid:5128581,nyc-times-square");
        logger.info("  Reverse Geocoding: GET  /api/v1/reverse?lat=40.758&lon=-73.9855");
        logger.info("  S2 cell:           GET  /api/v1/cells/{cellId}");
        logger.info("  Geometry:          GET  /api/v1/geometry/{featureId}");
        logger.info("");
    }

    @Override
    public void run(String... args) {
        printApiInfo();
    }
}
