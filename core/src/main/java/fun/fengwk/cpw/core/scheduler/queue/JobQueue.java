package fun.fengwk.cpw.core.scheduler.queue;

import java.util.List;
import java.util.Optional;

/**
 * Durable job queue contract.
 *
 * @author fengwk
 */
public interface JobQueue {

    /**
     * @return false when a job with the same id is still pending, delayed or active
     */
    boolean enqueue(JobSpec spec);

    Optional<JobView> findJob(String jobId);

    List<JobView> listJobs();

    void addListener(JobListener listener);

}
