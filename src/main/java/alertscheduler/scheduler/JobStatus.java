package alertscheduler.scheduler;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/**
 * 任务状态快照
 */
@Value
public class JobStatus {
    String name;
    @JsonProperty("next_run")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant nextRun;
    @JsonProperty("prev_run")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant prevRun;
    boolean active;
    boolean firing;

    static JobStatus of(JobRuntimeEntry entry) {
        return new JobStatus(entry.getName(), entry.getNextRun(), entry.getPrevRun(),
                entry.isActive(), entry.isFiring());
    }
}
