package fun.fengwk.cpw.core.scheduler;

import fun.fengwk.cpw.core.scheduler.queue.JobQueue;
import fun.fengwk.cpw.core.scheduler.queue.JobView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Job lookup and manual triggers.
 *
 * @author fengwk
 */
@RestController
@RequiredArgsConstructor
public class JobController {

    private final JobQueue jobQueue;
    private final ScrapeScheduler scrapeScheduler;
    private final RiskBackoff riskBackoff;

    @GetMapping("/api/jobs")
    public List<JobView> listJobs() {
        return jobQueue.listJobs();
    }

    @GetMapping("/api/jobs/{jobId}")
    public ResponseEntity<JobView> getJob(@PathVariable String jobId) {
        return jobQueue.findJob(jobId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/api/accounts/{accountId}/cart-scrape")
    public Map<String, String> triggerCartScrape(@PathVariable String accountId) {
        return Map.of("jobId", scrapeScheduler.triggerNow(accountId));
    }

    @PostMapping("/api/accounts/{accountId}/variants/{listingId}")
    public Map<String, String> triggerVariantScrape(@PathVariable String accountId, @PathVariable String listingId) {
        return Map.of("jobId", scrapeScheduler.triggerVariants(accountId, listingId));
    }

    @GetMapping("/api/scheduler/risk")
    public Map<String, Object> riskState() {
        return Map.of(
            "paused", riskBackoff.isPaused(),
            "streak", riskBackoff.getStreak(),
            "pauseUntil", riskBackoff.getPauseUntil()
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", String.valueOf(ex.getMessage())));
    }

}
