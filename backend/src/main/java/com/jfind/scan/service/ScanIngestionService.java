package com.jfind.scan.service;

import com.jfind.scan.model.ScanReport;
import com.jfind.scan.model.ScanSnapshot;
import com.jfind.scan.persistence.ScanJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ScanIngestionService {
    private static final Logger log = LoggerFactory.getLogger(ScanIngestionService.class);
    private final ScanJdbcRepository repository;

    public ScanIngestionService(ScanJdbcRepository repository) {
        this.repository = repository;
    }

    public ScanSnapshot submit(ScanReport report) {
        ScanSnapshot saved = repository.submit(report);
        log.info(
            "Saved scan {} from {} with {} Java runtimes ({} require a license)",
            saved.id(),
            saved.computerName(),
            saved.runtimes().size(),
            saved.countRequireLicense()
        );
        return saved;
    }
}
