package dev.jobdigest.notify;

import dev.jobdigest.config.PipelineProperties;
import dev.jobdigest.config.ScheduleProperties;
import dev.jobdigest.entity.JobPosting;
import dev.jobdigest.model.DailyStats;
import dev.jobdigest.schedule.NextRun;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Renders notification text: digests, daily summaries, status and error templates.
 */
@Component
@RequiredArgsConstructor
public class MessageFormatter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("MMMM d, yyyy");
    private static final DateTimeFormatter HOUR = DateTimeFormatter.ofPattern("HH:mm");
    private static final String UNKNOWN_URL = "Unknown URL";

    private final PipelineProperties pipelineProperties;
    private final ScheduleProperties scheduleProperties;
    private final Clock clock;

    /**
     * Digest header with aggregate counts followed by one entry per posting, best first.
     * Postings without a usable apply link are left out.
     */
    public String formatDigest(List<JobPosting> postings) {
        List<JobPosting> jobs = sortedWithUrls(postings);
        double high = highBand();
        double medium = mediumBand();

        long highCount = jobs.stream().filter(job -> job.getRelevanceScore() >= high).count();
        long mediumCount = jobs.stream()
                .filter(job -> job.getRelevanceScore() >= medium && job.getRelevanceScore() < high)
                .count();
        long remoteCount = jobs.stream().filter(JobPosting::isRemote).count();

        StringBuilder message = new StringBuilder();
        message.append("⏰ **Hourly Batch Report** - ").append(jobs.size()).append(" Jobs\n\n");
        message.append("📊 **Summary:**\n");
        message.append("⭐ High Relevance (≥").append(percent(high)).append("%): **").append(highCount).append("**\n");
        message.append("📈 Medium Relevance (").append(percent(medium)).append('-').append(percent(high) - 1)
                .append("%): **").append(mediumCount).append("**\n");
        message.append("🏠 Remote: **").append(remoteCount).append("** | 🏢 On-site: **")
                .append(jobs.size() - remoteCount).append("**\n\n");
        message.append("📅 ").append(now().format(TIMESTAMP)).append("\n\n");
        message.append("---\n\n");

        for (JobPosting job : jobs) {
            appendPosting(message, job, true);
        }
        return message.toString();
    }

    /**
     * End-of-day summary: totals, top sources, then remote and on-site sections.
     */
    public String formatDailySummary(List<JobPosting> postings, DailyStats stats, LocalDate day) {
        StringBuilder message = new StringBuilder();
        message.append("🌙 **Daily Job Digest Summary - ").append(day.format(DAY)).append("**\n\n");
        message.append("📊 **Daily Statistics:**\n");
        message.append("✅ Total Jobs Processed: **").append(stats.totalJobsProcessed()).append("**\n");
        message.append("🎯 Relevant Jobs Found: **").append(stats.relevantJobs()).append("**\n");
        message.append("📧 Emails Processed: **").append(stats.emailsProcessed()).append("**\n\n");

        if (!stats.topSources().isEmpty()) {
            message.append("📈 **Top Job Sources:**\n");
            stats.topSources().forEach(source -> message.append("• ").append(source.source())
                    .append(": **").append(source.count()).append("** jobs\n"));
            message.append('\n');
        }
        message.append("---\n\n");

        List<JobPosting> jobs = sortedWithUrls(postings);
        if (jobs.isEmpty()) {
            message.append("📝 No relevant opportunities found today.\n\n");
        } else {
            message.append("🎯 **").append(jobs.size()).append(" Relevant Opportunities Today:**\n\n");
            List<JobPosting> remote = jobs.stream().filter(JobPosting::isRemote).toList();
            List<JobPosting> onSite = jobs.stream().filter(job -> !job.isRemote()).toList();
            if (!remote.isEmpty()) {
                message.append("🏠 **Remote Opportunities (").append(remote.size()).append("):**\n\n");
                remote.forEach(job -> appendPosting(message, job, false));
            }
            if (!onSite.isEmpty()) {
                message.append("🏢 **On-Site Opportunities (").append(onSite.size()).append("):**\n\n");
                onSite.forEach(job -> appendPosting(message, job, false));
            }
        }
        message.append("🌅 See you tomorrow for more opportunities!");
        return message.toString();
    }

    public String formatStatus(String text) {
        return "🤖 *Job Bot Status*\n\n" + text;
    }

    public String formatError(String text) {
        return "❌ *Job Bot Error*\n\n" + text + "\n\n🕐 Time: " + now().format(TIMESTAMP);
    }

    /**
     * Human-readable hint for when the next alert scan happens.
     */
    public String formatNextRunHint(NextRun nextRun) {
        Duration untilScan = Duration.between(nextRun.now(), nextRun.nextAlertScan());
        if (untilScan.toMinutes() <= 60) {
            return "⏰ Next scan in " + describe(untilScan);
        }
        String zone = nextRun.now().getZone().getId();
        if (nextRun.nextDailySummary().isBefore(nextRun.nextAlertScan())) {
            return "🌙 Daily summary at " + nextRun.nextDailySummary().format(HOUR) + " " + zone
                    + ", next scan in " + describe(untilScan) + " (" + nextRun.nextAlertScan().format(HOUR) + " " + zone + ")";
        }
        return "🌙 Next scan in " + describe(untilScan) + " (" + nextRun.nextAlertScan().format(HOUR) + " " + zone + ")";
    }

    /**
     * Split a message at line boundaries so each chunk fits {@code maxLength}.
     * Chunks after the first are prefixed with a "(Part N)" label.
     */
    public List<String> split(String message, String title, int maxLength) {
        List<String> chunks = chunkLines(message, Math.max(1, maxLength - labelFor(title, 99).length()));
        List<String> labelled = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            labelled.add(i == 0 ? chunks.get(i) : labelFor(title, i + 1) + chunks.get(i));
        }
        return labelled;
    }

    /**
     * Relevance indicator for a score. The high and medium bands are each split in half,
     * and the half band below medium gets its own marker; with the default bands
     * the cut points are 0.9, 0.8, 0.7, 0.6 and 0.5.
     */
    public String relevanceIndicator(double score) {
        double high = highBand();
        double medium = mediumBand();
        if (score >= midpoint(high, 1.0)) return "🎯";
        if (score >= high) return "⭐";
        if (score >= midpoint(medium, high)) return "🔥";
        if (score >= medium) return "✅";
        if (score >= midpoint(medium - (high - medium), medium)) return "📋";
        return "📄";
    }

    // Whole percent so 0.6 and 0.8 meet at exactly 0.7
    private static double midpoint(double lower, double upper) {
        return Math.round((lower + upper) * 50) / 100.0;
    }

    String urlWarning(String url) {
        if (url == null || url.isBlank()) {
            return " ⚠️ _No URL_";
        }
        if (url.contains("linkedin.com/company/") && !url.contains("/jobs/")) {
            return " ⚠️ _Company page - may not be direct job link_";
        }
        if (url.contains("/company") && !url.contains("job")) {
            return " ⚠️ _May be company page_";
        }
        return "";
    }

    private void appendPosting(StringBuilder message, JobPosting job, boolean withLocationMarker) {
        message.append(relevanceIndicator(job.getRelevanceScore())).append(" **").append(job.getTitle()).append("**\n");
        message.append("🏢 ").append(job.getCompany());
        if (withLocationMarker) {
            message.append(' ').append(job.isRemote() ? "🏠" : "🏢");
        }
        message.append(" | 📊 ").append(percent(job.getRelevanceScore())).append("%\n");
        message.append("🔗 [Apply](").append(job.getApplyUrl()).append(')').append(urlWarning(job.getApplyUrl()))
                .append("\n\n");
    }

    private List<JobPosting> sortedWithUrls(List<JobPosting> postings) {
        return postings.stream()
                .filter(job -> job.getApplyUrl() != null && !job.getApplyUrl().isBlank()
                        && !UNKNOWN_URL.equals(job.getApplyUrl()))
                .sorted(Comparator.comparingDouble(JobPosting::getRelevanceScore).reversed())
                .toList();
    }

    private List<String> chunkLines(String message, int maxLength) {
        if (message.length() <= maxLength) {
            return List.of(message);
        }
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : message.split("\n", -1)) {
            if (current.length() + line.length() + 1 > maxLength && current.length() > 0) {
                chunks.add(current.toString().trim());
                current.setLength(0);
            }
            // A single line longer than the limit is cut hard.
            while (line.length() > maxLength) {
                chunks.add(line.substring(0, maxLength));
                line = line.substring(maxLength);
            }
            current.append(line).append('\n');
        }
        if (!current.toString().isBlank()) {
            chunks.add(current.toString().trim());
        }
        return chunks;
    }

    private String labelFor(String title, int part) {
        return "📋 **" + title + " (Part " + part + ")**\n\n";
    }

    private String describe(Duration duration) {
        long minutes = Math.max(1, (duration.toSeconds() + 59) / 60);
        if (minutes < 60) {
            return minutes + (minutes == 1 ? " minute" : " minutes");
        }
        long hours = (minutes + 30) / 60;
        return hours + (hours == 1 ? " hour" : " hours");
    }

    private int percent(double score) {
        return (int) Math.round(score * 100);
    }

    private double highBand() {
        return pipelineProperties.getRelevance().getHighBand();
    }

    private double mediumBand() {
        return pipelineProperties.getRelevance().getMediumBand();
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock).withZoneSameInstant(ZoneId.of(scheduleProperties.getZone()));
    }
}
