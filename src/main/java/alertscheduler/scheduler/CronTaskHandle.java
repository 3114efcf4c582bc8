package alertscheduler.scheduler;

/**
 * 已注册任务的句柄
 */
public interface CronTaskHandle {

    String getName();
}
