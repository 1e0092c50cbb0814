package dev.jobdigest.schedule;

import dev.jobdigest.config.ScheduleProperties;
import dev.jobdigest.model.RunPayload;
import dev.jobdigest.model.TriggerSource;
import dev.jobdigest.queue.AlreadyInFlightException;
import dev.jobdigest.queue.WorkQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Timer adapter: on every tick, enqueues the triggers the {@link SchedulePolicy} reports
 * since the previous tick.
 */
@Slf4j
@Component
public class PipelineScheduler {

    private final SchedulePolicy policy;
    private final WorkQueue queue;
    private final ScheduleProperties properties;
    private final Clock clock;

    private Instant lastTick;

    public PipelineScheduler(SchedulePolicy policy, WorkQueue queue, ScheduleProperties properties, Clock clock) {
        this.policy = policy;
        this.queue = queue;
        this.properties = properties;
        this.clock = clock;
        this.lastTick = clock.instant();
    }

    @Scheduled(fixedDelayString = "${schedule.tick-interval-ms:30000}")
    public void tick() {
        if (!properties.isEnabled()) {
            return;
        }
        Instant now = clock.instant();
        List<ScheduledTrigger> due = policy.triggersBetween(lastTick, now);
        lastTick = now;

        for (ScheduledTrigger trigger : due) {
            enqueue(trigger);
        }
    }

    private void enqueue(ScheduledTrigger trigger) {
        try {
            String runId = queue.enqueue(trigger.kind(), TriggerSource.CRON, RunPayload.empty());
            log.info("Scheduled {} run {} for {}", trigger.kind().getLabel(), runId,
                    trigger.fireAt().atZone(policy.getZone()));
        } catch (AlreadyInFlightException e) {
            log.info("Skipping scheduled {}: {}", trigger.kind().getLabel(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to enqueue scheduled {}: {}", trigger.kind().getLabel(), e.getMessage(), e);
        }
    }

    Instant getLastTick() {
        return lastTick;
    }
}
