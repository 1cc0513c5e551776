package com.jfind.scan.service;

import com.jfind.scan.model.ScanReport;
import com.jfind.scan.model.ScanSnapshot;
import com.jfind.scan.persistence.ScanJdbcRepository;
import com.jfind.scan.util.ScanValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static com.jfind.scan.ScanReportFixtures.openJdk;
import static com.jfind.scan.ScanReportFixtures.report;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScanIngestionServiceTest {

    @Mock
    private ScanJdbcRepository repository;

    @InjectMocks
    private ScanIngestionService service;

    @Test
    void returnsTheStoredSnapshot() {
        ScanReport report = report("alpha", "2025-05-01T08:00:00Z", openJdk("/usr/bin/java"));
        ScanSnapshot stored = new ScanSnapshot(
            7L,
            Instant.parse("2025-05-01T08:00:00Z"),
            "alpha",
            "test-user",
            "1s",
            false,
            1,
            0,
            10,
            "/test/path",
            "linux/amd64",
            true,
            Instant.now(),
            List.of()
        );
        when(repository.submit(report)).thenReturn(stored);

        assertThat(service.submit(report)).isSameAs(stored);
    }

    @Test
    void validationFailuresPropagate() {
        ScanReport report = report(" ", "2025-05-01T08:00:00Z");
        when(repository.submit(report)).thenThrow(new ScanValidationException("computer_name is required"));

        assertThatThrownBy(() -> service.submit(report))
            .isInstanceOf(ScanValidationException.class)
            .hasMessage("computer_name is required");
    }
}
