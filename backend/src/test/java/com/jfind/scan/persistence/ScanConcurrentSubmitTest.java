package com.jfind.scan.persistence;

import com.jfind.scan.model.HistorySelection;
import com.jfind.scan.model.ScanSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.jfind.scan.ScanReportFixtures.openJdk;
import static com.jfind.scan.ScanReportFixtures.oracleLicensed;
import static com.jfind.scan.ScanReportFixtures.report;
import static com.jfind.scan.ScanReportFixtures.uniqueHost;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ScanConcurrentSubmitTest {
    private static final int WRITERS = 8;

    @Autowired
    private ScanJdbcRepository repository;

    @Test
    void concurrentSubmitsForOneHostLeaveSingleCurrent() throws Exception {
        String host = uniqueHost("race");
        List<Long> ids = submitConcurrently(List.of(host), WRITERS);

        assertThat(repository.countCurrentSnapshots(host)).isEqualTo(1);
        assertThat(repository.fetchHistory(host, HistorySelection.all())).hasSize(WRITERS + 1);

        // the last writer to take the host lock also inserted the highest id
        ScanSnapshot current = repository.fetchCurrent(host).orElseThrow();
        assertThat(current.id()).isEqualTo(Collections.max(ids));
        assertThat(current.runtimes()).hasSize(2);
    }

    @Test
    void concurrentSubmitsAcrossHostsKeepOneCurrentEach() throws Exception {
        List<String> hosts = List.of(uniqueHost("multi-a"), uniqueHost("multi-b"), uniqueHost("multi-c"));
        submitConcurrently(hosts, 4);

        for (String host : hosts) {
            assertThat(repository.countCurrentSnapshots(host)).isEqualTo(1);
            assertThat(repository.fetchHistory(host, HistorySelection.all())).hasSize(5);
        }
    }

    // Each host starts with one committed snapshot, so the writers race to replace it.
    private List<Long> submitConcurrently(List<String> hosts, int perHost) throws Exception {
        for (String host : hosts) {
            repository.submit(report(host, "2025-09-01T00:00:00Z", openJdk("/opt/jdk11/bin/java")));
        }
        ExecutorService executor = Executors.newFixedThreadPool(WRITERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ScanSnapshot>> futures = new ArrayList<>();
        try {
            for (String host : hosts) {
                for (int i = 0; i < perHost; i++) {
                    String scanTs = String.format("2025-10-%02dT00:00:00Z", i + 1);
                    futures.add(executor.submit(() -> {
                        start.await();
                        return repository.submit(report(
                            host,
                            scanTs,
                            oracleLicensed("/opt/jdk8/bin/java"),
                            openJdk("/opt/jdk11/bin/java")
                        ));
                    }));
                }
            }
            start.countDown();
            List<Long> ids = new ArrayList<>();
            for (Future<ScanSnapshot> future : futures) {
                ids.add(future.get(60, TimeUnit.SECONDS).id());
            }
            return ids;
        } finally {
            executor.shutdownNow();
        }
    }
}
