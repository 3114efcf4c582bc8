package alertscheduler.scheduler;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 Spring ThreadPoolTaskScheduler 的 cron 引擎。
 * <p>
 * 每个任务使用 CronTrigger 调度, Spring 在一次执行结束后才计算并安排下一次, 同一任务不会重叠;
 * 线程池大小随注册的任务数增长, 同时到期的任务各占一个线程。
 */
@Slf4j
public class TaskSchedulerCronEngine implements CronEngine {

    private final ThreadPoolTaskScheduler scheduler;
    private final Set<CronTask> tasks = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public TaskSchedulerCronEngine(int poolSize, Clock clock) {
        this.scheduler = new ThreadPoolTaskScheduler();
        this.scheduler.setPoolSize(Math.max(1, poolSize));
        this.scheduler.setThreadFactory(new ThreadFactoryBuilder()
                .setNameFormat("alert-scheduler-%d")
                .build());
        this.scheduler.setClock(clock);
        this.scheduler.setRemoveOnCancelPolicy(true);
        // stop() drains in-flight firings without a time limit
        this.scheduler.setWaitForTasksToCompleteOnShutdown(true);
        this.scheduler.setAwaitTerminationSeconds(Integer.MAX_VALUE);
        this.scheduler.initialize();
    }

    public TaskSchedulerCronEngine(int poolSize) {
        this(poolSize, Clock.systemDefaultZone());
    }

    @Override
    public synchronized CronTaskHandle register(CronTaskDescriptor descriptor, CronTaskAction action) {
        if (stopped.get()) {
            throw new IllegalStateException("cron engine is stopped");
        }
        CronTask task = new CronTask(descriptor, action);
        tasks.add(task);
        if (tasks.size() > scheduler.getPoolSize()) {
            scheduler.setPoolSize(tasks.size());
        }
        task.future = scheduler.schedule(task, task);
        log.debug("Task '{}' registered, next run {}", descriptor.getName(), task.next);
        return task;
    }

    @Override
    public Instant nextRun(CronTaskHandle handle) {
        return task(handle).next;
    }

    @Override
    public Instant prevRun(CronTaskHandle handle) {
        return task(handle).prev;
    }

    @Override
    public void cancel(CronTaskHandle handle) {
        CronTask task = task(handle);
        task.cancel();
        tasks.remove(task);
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        tasks.forEach(CronTask::cancel);
        log.info("Waiting for in-flight firings of {} tasks to finish", tasks.size());
        scheduler.shutdown();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    private static CronTask task(CronTaskHandle handle) {
        if (!(handle instanceof CronTask)) {
            throw new IllegalArgumentException("unknown task handle: " + handle);
        }
        return (CronTask) handle;
    }

    /**
     * 同时作为 Runnable 和 Trigger, 以便记录每次计算出的触发时间
     */
    private final class CronTask implements CronTaskHandle, Runnable, Trigger {
        private final CronTaskDescriptor descriptor;
        private final CronTaskAction action;
        private final CronTrigger trigger;
        // the fire time Spring scheduled last, read when that firing starts
        private volatile Instant scheduled;
        private volatile Instant next;
        private volatile Instant prev;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private CronTask(CronTaskDescriptor descriptor, CronTaskAction action) {
            this.descriptor = descriptor;
            this.action = action;
            this.trigger = new CronTrigger(descriptor.getExpression().toString(), descriptor.getZone());
        }

        @Override
        public String getName() {
            return descriptor.getName();
        }

        @Override
        public Instant nextExecution(TriggerContext triggerContext) {
            Instant at = trigger.nextExecution(triggerContext);
            scheduled = at;
            next = at;
            if (at == null) {
                log.warn("Task '{}' has no future fire time", getName());
            }
            return at;
        }

        @Override
        public void run() {
            if (cancelled || stopped.get()) {
                return;
            }
            Instant fireTime = scheduled;
            prev = fireTime;
            // refined by nextExecution once this firing completes
            next = nextAfter(fireTime);
            try {
                action.fire(this, fireTime);
            } catch (RuntimeException e) {
                log.error("Task '{}' failed", getName(), e);
            }
        }

        private Instant nextAfter(Instant from) {
            ZonedDateTime upcoming = descriptor.getExpression().next(from.atZone(descriptor.getZone()));
            return upcoming == null ? null : upcoming.toInstant();
        }

        private void cancel() {
            cancelled = true;
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }

        @Override
        public String toString() {
            return "CronTask[" + getName() + "]";
        }
    }
}
