package alertscheduler.scheduler;

import java.time.Instant;

/**
 * cron 调度引擎。
 * <p>
 * 不同任务可以并发执行; 同一任务的两次触发不会重叠, 上一次结束后才会安排下一次。
 */
public interface CronEngine {

    CronTaskHandle register(CronTaskDescriptor descriptor, CronTaskAction action);

    /**
     * @return 下次触发时间, 没有后续触发时为 null
     */
    Instant nextRun(CronTaskHandle handle);

    /**
     * @return 上次触发时间, 尚未触发时为 null
     */
    Instant prevRun(CronTaskHandle handle);

    void cancel(CronTaskHandle handle);

    /**
     * 停止调度并等待正在执行的任务结束, 重复调用无副作用
     */
    void stop();
}
