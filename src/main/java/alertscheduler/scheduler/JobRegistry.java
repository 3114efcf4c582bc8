package alertscheduler.scheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 任务名到运行时状态的映射。
 * <p>
 * 写操作只在注册和每次触发时发生; 状态查询在读锁下复制不可变条目, 不会看到更新了一半的状态。
 */
public class JobRegistry {

    private final Map<String, JobRuntimeEntry> entries = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 同名任务以最后一次注册为准
     *
     * @return 被替换的条目, 没有则为 null
     */
    public JobRuntimeEntry register(String name, Instant nextRun) {
        JobRuntimeEntry entry = JobRuntimeEntry.builder()
                .name(name)
                .nextRun(nextRun)
                .active(true)
                .build();
        lock.writeLock().lock();
        try {
            return entries.put(name, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordFiring(String name, Instant prevRun, Instant nextRun) {
        lock.writeLock().lock();
        try {
            entries.computeIfPresent(name, (key, entry) -> entry.toBuilder()
                    .prevRun(prevRun)
                    .nextRun(nextRun)
                    .firing(true)
                    .build());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordIdle(String name) {
        lock.writeLock().lock();
        try {
            entries.computeIfPresent(name, (key, entry) -> entry.toBuilder().firing(false).build());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void deactivateAll() {
        lock.writeLock().lock();
        try {
            entries.replaceAll((key, entry) -> entry.toBuilder().active(false).build());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<JobRuntimeEntry> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 按注册顺序返回状态快照
     */
    public List<JobStatus> snapshot() {
        List<JobRuntimeEntry> copy;
        lock.readLock().lock();
        try {
            copy = new ArrayList<>(entries.values());
        } finally {
            lock.readLock().unlock();
        }
        List<JobStatus> statuses = new ArrayList<>(copy.size());
        for (JobRuntimeEntry entry : copy) {
            statuses.add(JobStatus.of(entry));
        }
        return statuses;
    }
}
