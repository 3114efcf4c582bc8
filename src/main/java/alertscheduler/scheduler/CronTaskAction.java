package alertscheduler.scheduler;

import java.time.Instant;

@FunctionalInterface
public interface CronTaskAction {

    void fire(CronTaskHandle handle, Instant triggerTime);
}
