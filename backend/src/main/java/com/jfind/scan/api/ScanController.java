package com.jfind.scan.api;

import com.jfind.scan.model.LicenseCheckResponse;
import com.jfind.scan.model.RuntimeRecord;
import com.jfind.scan.model.ScanReport;
import com.jfind.scan.model.ScanSnapshot;
import com.jfind.scan.model.ScanSubmitResponse;
import com.jfind.scan.model.ScanView;
import com.jfind.scan.service.ScanIngestionService;
import com.jfind.scan.service.ScanQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ScanController {
    private final ScanIngestionService ingestionService;
    private final ScanQueryService queryService;

    public ScanController(ScanIngestionService ingestionService, ScanQueryService queryService) {
        this.ingestionService = ingestionService;
        this.queryService = queryService;
    }

    @PostMapping("/jfind")
    public ScanSubmitResponse submitScan(@RequestBody(required = false) ScanReport report) {
        ScanSnapshot saved = ingestionService.submit(report);
        return ScanSubmitResponse.ok(saved.id());
    }

    @GetMapping("/jfind")
    public List<ScanView> queryScans(
        @RequestParam(name = "computer_name", required = false) String computerName,
        @RequestParam(name = "scan_id", required = false) Long scanId,
        @RequestParam(name = "limit", required = false, defaultValue = "10") Integer limit
    ) {
        if (scanId != null) {
            return List.of(ScanView.of(queryService.getScan(scanId)));
        }
        if (computerName != null) {
            return toViews(queryService.getHostScans(computerName, limit));
        }
        return toViews(queryService.getLatestScans(limit));
    }

    @GetMapping("/jfind/scans")
    public List<ScanSnapshot> getLatestScans(@RequestParam(name = "limit", required = false) Integer limit) {
        return queryService.getLatestScans(limit);
    }

    @GetMapping("/jfind/scans/{computerName}")
    public List<ScanView> getHostScans(
        @PathVariable("computerName") String computerName,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return toViews(queryService.getHostScans(computerName, limit));
    }

    @GetMapping({"/jfind/jdk/oracle", "/jfind/oracle"})
    public List<RuntimeRecord> getOracleRuntimes(@RequestParam(name = "limit", required = false) Integer limit) {
        return queryService.getOracleRuntimes(limit);
    }

    @GetMapping("/jfind/require_license/{computerName}")
    public LicenseCheckResponse checkRequireLicense(@PathVariable("computerName") String computerName) {
        return new LicenseCheckResponse(computerName, queryService.checkLicenseRequirement(computerName));
    }

    private List<ScanView> toViews(List<ScanSnapshot> snapshots) {
        return snapshots.stream()
            .map(ScanView::of)
            .toList();
    }
}
