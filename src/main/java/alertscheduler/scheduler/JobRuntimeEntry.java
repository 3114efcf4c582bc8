package alertscheduler.scheduler;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 任务运行时状态, 不可变, 每次更新整体替换
 */
@Value
@Builder(toBuilder = true)
public class JobRuntimeEntry {
    String name;
    Instant nextRun;
    Instant prevRun;
    // scheduled and not stopped
    boolean active;
    // a firing is in flight
    boolean firing;
}
