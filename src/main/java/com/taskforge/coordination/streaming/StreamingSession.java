package com.taskforge.coordination.streaming;

import com.taskforge.cache.CachedStream;
import lombok.Getter;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory state of one subtask that is currently streaming output.
 *
 * <p>Mutators and snapshot methods must run inside {@link #withLock(Supplier)}; snapshots are deep copies
 * so cache and database writes can run after the lock is released. Timestamps are epoch milliseconds.</p>
 */
public class StreamingSession {

    public static final String VALUE = "value";
    public static final String THINKING = "thinking";
    public static final String WORKBENCH = "workbench";
    public static final String REASONING_CONTENT = "reasoning_content";
    public static final String STREAMING = "streaming";

    @Getter
    private final Long taskId;
    @Getter
    private final Long subtaskId;
    @Getter
    private final long createdAt;

    private final ReentrantLock lock = new ReentrantLock();
    private final StringBuilder content = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private final List<Map<String, Object>> thinking = new ArrayList<>();
    private final Map<String, Object> workbench = new LinkedHashMap<>();

    private long offset;
    private long reasoningOffset;
    private Integer progress;
    private volatile long lastCacheFlush;
    private volatile long lastDurableFlush;

    public StreamingSession(Long taskId, Long subtaskId, long createdAt) {
        this.taskId = taskId;
        this.subtaskId = subtaskId;
        this.createdAt = createdAt;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public long appendContent(String delta) {
        content.append(delta);
        offset += delta.length();
        return offset;
    }

    public long appendReasoning(String delta) {
        reasoning.append(delta);
        reasoningOffset += delta.length();
        return reasoningOffset;
    }

    /**
     * Merges the step into the entry at {@code index}, or appends it when the index is missing or past the end.
     */
    public void upsertThinkingStep(Integer index, Map<String, Object> step) {
        if (index != null && index < thinking.size()) {
            thinking.get(index).putAll(step);
        } else {
            thinking.add(new LinkedHashMap<>(step));
        }
    }

    @SuppressWarnings("unchecked")
    public void applyWorkbenchDelta(WorkbenchDelta delta) {
        if (delta.fileChanges() != null) {
            workbench.put(WorkbenchDelta.FILE_CHANGES,
                    delta.fileChanges().applyTo(listAt(workbench, WorkbenchDelta.FILE_CHANGES), WorkbenchDelta.FILE_KEY));
        }
        if (delta.taskCommits() != null || !delta.gitInfo().isEmpty()) {
            Map<String, Object> gitInfo = mapAt(workbench, WorkbenchDelta.GIT_INFO);
            if (delta.taskCommits() != null) {
                gitInfo.put(WorkbenchDelta.TASK_COMMITS,
                        delta.taskCommits().applyTo(listAt(gitInfo, WorkbenchDelta.TASK_COMMITS), WorkbenchDelta.COMMIT_KEY));
            }
            gitInfo.putAll(delta.gitInfo());
            workbench.put(WorkbenchDelta.GIT_INFO, gitInfo);
        }
        if (delta.statusPresent()) {
            workbench.put(WorkbenchDelta.STATUS, delta.status());
        }
        if (delta.errorPresent()) {
            workbench.put(WorkbenchDelta.ERROR, delta.error());
        }
        delta.extras().forEach((key, value) -> {
            if (value instanceof Map<?, ?> patch && workbench.get(key) instanceof Map<?, ?> existing) {
                Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) existing);
                merged.putAll((Map<String, Object>) patch);
                workbench.put(key, merged);
            } else {
                workbench.put(key, value);
            }
        });
    }

    /**
     * Seeds an empty session from a result projection stored earlier, so offsets continue from the persisted
     * text instead of restarting at zero.
     */
    @SuppressWarnings("unchecked")
    public void restore(@Nullable Map<String, Object> stored) {
        if (stored == null) {
            return;
        }
        if (stored.get(VALUE) instanceof String value) {
            content.setLength(0);
            content.append(value);
            offset = value.length();
        }
        if (stored.get(REASONING_CONTENT) instanceof String text) {
            reasoning.setLength(0);
            reasoning.append(text);
            reasoningOffset = text.length();
        }
        if (stored.get(THINKING) instanceof List<?> steps) {
            thinking.clear();
            for (Object step : steps) {
                if (step instanceof Map<?, ?> map) {
                    thinking.add(copyMap((Map<String, Object>) map));
                }
            }
        }
        if (stored.get(WORKBENCH) instanceof Map<?, ?> map) {
            workbench.clear();
            workbench.putAll(copyMap((Map<String, Object>) map));
        }
    }

    public void updateProgress(Integer progress) {
        if (progress != null) {
            this.progress = Math.max(0, Math.min(100, progress));
        }
    }

    public Integer progress() {
        return progress;
    }

    public long offset() {
        return offset;
    }

    public long reasoningOffset() {
        return reasoningOffset;
    }

    public String reasoningContent() {
        return reasoning.toString();
    }

    public List<Map<String, Object>> thinkingCopy() {
        return copyList(thinking);
    }

    public Map<String, Object> workbenchCopy() {
        return copyMap(workbench);
    }

    /**
     * Result object as persisted on the subtask: {@code value}, plus {@code thinking}, {@code workbench} and
     * {@code reasoning_content} when they hold anything.
     */
    public Map<String, Object> resultProjection(boolean streaming) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(VALUE, content.toString());
        if (!thinking.isEmpty()) {
            result.put(THINKING, copyList(thinking));
        }
        if (!workbench.isEmpty()) {
            result.put(WORKBENCH, copyMap(workbench));
        }
        if (reasoning.length() > 0) {
            result.put(REASONING_CONTENT, reasoning.toString());
        }
        result.put(STREAMING, streaming);
        return result;
    }

    public CachedStream toCachedStream(String status, long now) {
        return new CachedStream(taskId, subtaskId, status, content.toString(), offset, reasoning.toString(),
                reasoningOffset, copyList(thinking), copyMap(workbench), createdAt, now);
    }

    public boolean isCacheFlushDue(long now, Duration interval) {
        return now - lastCacheFlush >= interval.toMillis();
    }

    public boolean isDurableFlushDue(long now, Duration interval) {
        return now - lastDurableFlush >= interval.toMillis();
    }

    public void markCacheFlushed(long now) {
        lastCacheFlush = now;
    }

    public void markDurableFlushed(long now) {
        lastDurableFlush = now;
    }

    public long lastCacheFlush() {
        return lastCacheFlush;
    }

    public long lastDurableFlush() {
        return lastDurableFlush;
    }

    /**
     * Most recent of creation and the two flush times; the reclamation sweep measures staleness from here.
     */
    public long lastTouched() {
        return Math.max(createdAt, Math.max(lastCacheFlush, lastDurableFlush));
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listAt(Map<String, Object> owner, String key) {
        Object value = owner.get(key);
        if (value instanceof List<?> list) {
            List<Map<String, Object>> entries = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    entries.add((Map<String, Object>) map);
                }
            }
            return entries;
        }
        return new ArrayList<>();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapAt(Map<String, Object> owner, String key) {
        Object value = owner.get(key);
        return value instanceof Map<?, ?> map ? new LinkedHashMap<>((Map<String, Object>) map) : new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }

    static Map<String, Object> copyMap(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> copyList(List<Map<String, Object>> source) {
        List<Map<String, Object>> copy = new ArrayList<>(source.size());
        source.forEach(entry -> copy.add((Map<String, Object>) copyValue(entry)));
        return copy;
    }
}
