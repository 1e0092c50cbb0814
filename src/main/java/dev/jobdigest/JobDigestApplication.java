package dev.jobdigest;

import dev.jobdigest.schedule.SchedulePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.event.EventListener;

import java.time.Clock;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class JobDigestApplication {

    private final SchedulePolicy schedulePolicy;
    private final Clock clock;

    public JobDigestApplication(SchedulePolicy schedulePolicy, Clock clock) {
        this.schedulePolicy = schedulePolicy;
        this.clock = clock;
    }

    public static void main(String[] args) {
        SpringApplication.run(JobDigestApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("========================================");
        log.info("Job Digest Ready");
        log.info("Next alert scan: {}", schedulePolicy.nextAlertScan(clock.instant()));
        log.info("Next daily summary: {}", schedulePolicy.nextDailySummary(clock.instant()));
        log.info("========================================");
    }
}
