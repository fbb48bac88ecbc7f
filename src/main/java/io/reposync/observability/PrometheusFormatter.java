package io.reposync.observability;

import java.util.List;
import java.util.Map;

public final class PrometheusFormatter {
    private static final Map<String, String> HELP = Map.of(
            SyncCounters.SYNC_STARTED, "Reconciliation passes started",
            SyncCounters.SYNC_FINISHED, "Reconciliation passes finished",
            SyncCounters.SYNC_DURATION_MS, "Total time spent in reconciliation passes in milliseconds",
            SyncCounters.SYNCED_REPOS, "Repos reported by reconciliation grouped by diff state",
            SyncCounters.REPO_LIMIT_REACHED, "Inserts refused because a repo limit was reached",
            SyncCounters.LAZY_SYNC, "Single-repo lookups grouped by result",
            SyncCounters.JOBS_RESET, "Stalled sync jobs returned to the queue",
            SyncCounters.JOBS_FINISHED, "Sync jobs finished grouped by final state"
    );

    private PrometheusFormatter() {
    }

    public static String format(List<SyncCounters.Series> counters, Map<String, Integer> jobStates, long storedRepos) {
        StringBuilder sb = new StringBuilder();
        String lastMetric = null;
        for (SyncCounters.Series series : counters) {
            if (!series.metric().equals(lastMetric)) {
                sb.append("# HELP ").append(series.metric()).append(' ')
                        .append(HELP.getOrDefault(series.metric(), series.metric())).append('\n');
                sb.append("# TYPE ").append(series.metric()).append(" counter").append('\n');
                lastMetric = series.metric();
            }
            sb.append(series.metric()).append(labels(series.labels())).append(' ').append(series.value()).append('\n');
        }
        appendMapGauge(sb, "reposync_sync_jobs", "Sync jobs grouped by state", "state", jobStates);
        appendGauge(sb, "reposync_repos", "Live repos in the inventory", storedRepos);
        return sb.toString();
    }

    private static String labels(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, String> e : labels.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            sb.append(e.getKey()).append("=\"").append(escapeLabel(e.getValue())).append('"');
            first = false;
        }
        return sb.append('}').toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, long value) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        sb.append(metric).append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
