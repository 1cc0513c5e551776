package com.jfind.scan.api;

import com.jfind.scan.model.HealthResponse;
import com.jfind.scan.persistence.ScanJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;

@RestController
public class HealthController {
    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private final ScanJdbcRepository repository;

    public HealthController(ScanJdbcRepository repository) {
        this.repository = repository;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database health check failed", e);
            dbConnected = false;
        }
        return new HealthResponse(hostname(), ProcessHandle.current().pid(), Instant.now(), dbConnected);
    }

    private String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Unable to resolve local host name", e);
            return "unknown";
        }
    }
}
