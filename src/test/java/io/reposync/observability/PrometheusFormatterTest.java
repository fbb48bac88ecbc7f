package io.reposync.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

final class PrometheusFormatterTest {

    @Test
    void countersAndGaugesRenderInExpositionFormat() {
        SyncCounters counters = new SyncCounters();
        counters.passStarted("github", "site");
        counters.passFinished("github", "site", 120L, true);
        counters.lazySync("fetched");
        counters.lazySync("fetched");
        counters.lazySync("debounced");
        Map<String, Integer> jobs = new LinkedHashMap<>();
        jobs.put("queued", 2);
        jobs.put("completed", 5);

        String text = PrometheusFormatter.format(counters.snapshot(), jobs, 17L);

        Assertions.assertTrue(text.contains("# TYPE reposync_lazy_sync_total counter\n"));
        Assertions.assertTrue(text.contains("reposync_lazy_sync_total{result=\"fetched\"} 2\n"));
        Assertions.assertTrue(text.contains("reposync_lazy_sync_total{result=\"debounced\"} 1\n"));
        Assertions.assertEquals(1, countOccurrences(text, "# HELP reposync_lazy_sync_total "));
        Assertions.assertTrue(text.contains("reposync_sync_jobs{state=\"queued\"} 2\n"));
        Assertions.assertTrue(text.contains("reposync_sync_jobs{state=\"completed\"} 5\n"));
        Assertions.assertTrue(text.contains("# TYPE reposync_repos gauge\nreposync_repos 17\n"));
    }

    @Test
    void labelValuesAreEscaped() {
        SyncCounters counters = new SyncCounters();
        counters.lazySync("odd\"value\\");
        String text = PrometheusFormatter.format(counters.snapshot(), Map.of(), 0L);
        Assertions.assertTrue(text.contains("result=\"odd\\\"value\\\\\""));
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int idx = text.indexOf(needle);
        while (idx >= 0) {
            count++;
            idx = text.indexOf(needle, idx + needle.length());
        }
        return count;
    }
}
