package com.whereq.dispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Dispatch.
 * This service runs jobs on named worker pools and creates them from time
 * and event triggers, in a single process or shared through Redis.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class DispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DispatchApplication.class, args);
    }
}
