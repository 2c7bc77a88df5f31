package com.caseflow.orchestrator.discharge.plugin.notification;

import com.caseflow.orchestrator.discharge.plugin.summary.DischargeSummary;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-based doctor notification for development and testing. Every notification is written to
 * the log and kept in memory.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * LoggingDoctorNotificationService notifications = new LoggingDoctorNotificationService();
 * notifications.notifyDoctor("consult-1", summary, true).block();
 * List<SentNotification> sent = notifications.getSentNotifications();
 * }</pre>
 */
@Slf4j
public class LoggingDoctorNotificationService implements IDoctorNotificationService {

    private final List<SentNotification> sentNotifications = Collections.synchronizedList(new ArrayList<>());
    private final AtomicLong totalSent = new AtomicLong(0);

    @Override
    public Mono<Void> notifyDoctor(String caseId, DischargeSummary summary, boolean validated) {
        return Mono.fromRunnable(() -> {
            String output = formatNotification(caseId, summary, validated);
            if (validated) {
                log.info(output);
            } else {
                log.warn(output);
            }
            sentNotifications.add(new SentNotification(caseId, validated, Instant.now()));
            totalSent.incrementAndGet();
        });
    }

    public List<SentNotification> getSentNotifications() {
        synchronized (sentNotifications) {
            return new ArrayList<>(sentNotifications);
        }
    }

    public long getTotalSent() {
        return totalSent.get();
    }

    public void clear() {
        sentNotifications.clear();
        totalSent.set(0);
    }

    // ========================================================================
    // PRIVATE HELPER METHODS
    // ========================================================================

    private String formatNotification(String caseId, DischargeSummary summary, boolean validated) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n");
        sb.append("╔══════════════════════════════════════════════════════════════════════╗\n");
        sb.append("║  DISCHARGE SUMMARY READY FOR REVIEW                                  ║\n");
        sb.append("╠══════════════════════════════════════════════════════════════════════╣\n");
        sb.append("║  Case: ").append(padRight(caseId, 62)).append("║\n");
        sb.append("║  Validated: ").append(padRight(validated ? "yes" : "NO, review missing fields", 57)).append("║\n");
        sb.append("║  Diagnosis: ").append(padRight(truncate(String.join("; ", summary.getDiagnosis()), 56), 57)).append("║\n");
        sb.append("║  Medications: ").append(padRight(String.valueOf(summary.getMedications().size()), 55)).append("║\n");
        sb.append("╚══════════════════════════════════════════════════════════════════════╝\n");
        return sb.toString();
    }

    private static String padRight(String value, int width) {
        return value.length() >= width ? value : value + " ".repeat(width - value.length());
    }

    private static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength - 3) + "...";
    }

    @Data
    public static class SentNotification {
        private final String caseId;
        private final boolean validated;
        private final Instant sentAt;
    }
}
