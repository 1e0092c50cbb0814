package dev.jobdigest.web;

import dev.jobdigest.model.QueueStats;
import dev.jobdigest.model.RunKind;
import dev.jobdigest.model.RunPayload;
import dev.jobdigest.model.RunSnapshot;
import dev.jobdigest.pipeline.RunTriggerService;
import dev.jobdigest.queue.AlreadyInFlightException;
import dev.jobdigest.queue.WorkQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Operator endpoints: trigger runs manually and inspect the queue.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PipelineController {

    private final RunTriggerService runTriggerService;
    private final WorkQueue workQueue;

    @PostMapping("/runs/{kind}")
    public Mono<ResponseEntity<TriggerResponse>> trigger(@PathVariable String kind,
                                                         @RequestBody(required = false) TriggerRequest request) {
        RunKind runKind = RunKind.fromLabel(kind);
        Double minRelevance = request != null ? request.minRelevanceScore() : null;
        if (minRelevance != null && (minRelevance < 0.0 || minRelevance > 1.0)) {
            return Mono.error(new IllegalArgumentException("minRelevanceScore must be between 0 and 1"));
        }
        return runTriggerService.trigger(runKind, new RunPayload(minRelevance, null))
                .map(runId -> ResponseEntity.status(HttpStatus.ACCEPTED)
                        .body(new TriggerResponse(runId, runKind.getLabel(), "queued")));
    }

    @GetMapping("/status")
    public Mono<StatusResponse> status() {
        return Mono.fromCallable(() -> new StatusResponse(workQueue.stats(), workQueue.currentRuns()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/runs/{kind}/current")
    public Mono<ResponseEntity<RunSnapshot>> current(@PathVariable String kind) {
        RunKind runKind = RunKind.fromLabel(kind);
        return Mono.fromCallable(() -> workQueue.currentRun(runKind)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @ExceptionHandler(AlreadyInFlightException.class)
    public ResponseEntity<Map<String, String>> alreadyInFlight(AlreadyInFlightException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "already_in_flight", "kind", e.getKind().getLabel(), "message", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "bad_request", "message", e.getMessage()));
    }

    public record TriggerRequest(Double minRelevanceScore) {
    }

    public record TriggerResponse(String runId, String kind, String status) {
    }

    public record StatusResponse(QueueStats stats, List<RunSnapshot> currentRuns) {
    }
}
