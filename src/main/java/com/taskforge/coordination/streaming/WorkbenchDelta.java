package com.taskforge.coordination.streaming;

import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed patch for a session's workbench.
 *
 * <p>{@code file_changes} and {@code git_info.task_commits} are list deltas, removed by {@code path} and
 * {@code commit_id}. The remaining {@code git_info} keys merge key-by-key, {@code status} and {@code error}
 * overwrite, and any other top-level key is kept in {@code extras}.</p>
 */
public record WorkbenchDelta(
        @Nullable ListDelta fileChanges,
        @Nullable ListDelta taskCommits,
        Map<String, Object> gitInfo,
        boolean statusPresent,
        @Nullable Object status,
        boolean errorPresent,
        @Nullable Object error,
        Map<String, Object> extras
) {

    public static final String FILE_CHANGES = "file_changes";
    public static final String GIT_INFO = "git_info";
    public static final String TASK_COMMITS = "task_commits";
    public static final String STATUS = "status";
    public static final String ERROR = "error";
    public static final String FILE_KEY = "path";
    public static final String COMMIT_KEY = "commit_id";

    public static WorkbenchDelta from(Map<String, Object> raw) {
        ListDelta fileChanges = null;
        ListDelta taskCommits = null;
        Map<String, Object> gitInfo = new LinkedHashMap<>();
        Map<String, Object> extras = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case FILE_CHANGES -> fileChanges = listDelta(FILE_CHANGES, value);
                case GIT_INFO -> {
                    if (value == null) {
                        continue;
                    }
                    if (!(value instanceof Map<?, ?> gitMap)) {
                        throw new StreamingEventFormatException("git_info must be an object");
                    }
                    for (Map.Entry<?, ?> gitEntry : gitMap.entrySet()) {
                        String gitKey = String.valueOf(gitEntry.getKey());
                        if (TASK_COMMITS.equals(gitKey)) {
                            taskCommits = listDelta(GIT_INFO + "." + TASK_COMMITS, gitEntry.getValue());
                        } else {
                            gitInfo.put(gitKey, gitEntry.getValue());
                        }
                    }
                }
                case STATUS, ERROR -> {
                    // handled below
                }
                default -> extras.put(key, value);
            }
        }
        return new WorkbenchDelta(fileChanges, taskCommits, gitInfo,
                raw.containsKey(STATUS), raw.get(STATUS),
                raw.containsKey(ERROR), raw.get(ERROR),
                extras);
    }

    public boolean isEmpty() {
        return (fileChanges == null || fileChanges.isEmpty())
                && (taskCommits == null || taskCommits.isEmpty())
                && gitInfo.isEmpty()
                && !statusPresent
                && !errorPresent
                && extras.isEmpty();
    }

    private static @Nullable ListDelta listDelta(String field, @Nullable Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new StreamingEventFormatException(field + " must be an object with add/remove lists");
        }
        return new ListDelta(entries(field + ".add", map.get("add")), entries(field + ".remove", map.get("remove")));
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> entries(String field, @Nullable Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new StreamingEventFormatException(field + " must be a list");
        }
        List<Map<String, Object>> entries = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?>)) {
                throw new StreamingEventFormatException(field + " entries must be objects");
            }
            entries.add(new LinkedHashMap<>((Map<String, Object>) item));
        }
        return entries;
    }
}
