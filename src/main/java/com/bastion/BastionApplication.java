package com.bastion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Bastion WAF log ingestion.
 *
 * Accepts firewall event exports (JSON array or NDJSON), normalizes the
 * heterogeneous field names of the export formats into one event shape,
 * deduplicates on (ray id, timestamp) and keeps daily, rule, IP and path
 * rollups current for the analytics views.
 */
@SpringBootApplication
public class BastionApplication {

    public static void main(String[] args) {
        SpringApplication.run(BastionApplication.class, args);
    }
}
