package io.forged.observability;

import io.forged.events.EventBusStats;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(EventBusStats stats) {
        return format(stats, null);
    }

    public static String format(EventBusStats stats, String namespace) {
        String labelName = null;
        String labelValue = null;
        String normalizedNamespace = namespace == null ? "" : namespace.trim();
        if (!normalizedNamespace.isBlank()) {
            labelName = "namespace";
            labelValue = normalizedNamespace;
        }
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "forged_events_stored", "Events currently retained for replay", labelName, labelValue, stats.storedEvents());
        appendGauge(sb, "forged_events_store_capacity", "Maximum events retained for replay", labelName, labelValue, stats.storeCapacity());
        appendGauge(sb, "forged_events_oldest_id", "Lowest retained event id (-1 when empty)", labelName, labelValue, stats.oldestEventId());
        appendGauge(sb, "forged_events_next_id", "Id the next published event will receive", labelName, labelValue, stats.nextEventId());
        appendGauge(sb, "forged_events_subscribers", "Active event stream subscribers", labelName, labelValue, stats.subscribers());
        appendCounter(sb, "forged_events_published_total", "Events published", labelName, labelValue, stats.publishedTotal());
        appendCounter(sb, "forged_events_delivered_total", "Live deliveries to subscriber channels", labelName, labelValue, stats.deliveredTotal());
        appendCounter(sb, "forged_events_dropped_total", "Live deliveries dropped because a subscriber channel was full", labelName, labelValue, stats.droppedTotal());
        appendCounter(sb, "forged_events_replayed_total", "Events returned through cursor replay", labelName, labelValue, stats.replayedTotal());
        appendCounter(sb, "forged_events_subscribe_rejected_total", "Subscribe requests rejected for an invalid cursor", labelName, labelValue, stats.subscribeRejectedTotal());
        return sb.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        append(sb, metric, help, "gauge", label, labelValue, value);
    }

    private static void appendCounter(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        append(sb, metric, help, "counter", label, labelValue, value);
    }

    private static void append(
            StringBuilder sb,
            String metric,
            String help,
            String type,
            String label,
            String labelValue,
            long value
    ) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
