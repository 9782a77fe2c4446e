package com.taskforge.coordination.service;

import com.taskforge.entity.Subtask;
import com.taskforge.entity.SubtaskStatus;
import com.taskforge.repository.SubtaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

/**
 * Periodic durable writes of in-flight streaming output. Terminal writes go through the subtask update path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreamingPersistenceService {

    private final SubtaskRepository subtaskRepository;

    /**
     * Stores the current result projection on the subtask and keeps it RUNNING.
     *
     * @return {@code false} when the subtask is gone or already finished, in which case nothing is written
     */
    @Transactional
    public boolean saveInFlight(Long subtaskId, Map<String, Object> result, Integer progress) {
        Optional<Subtask> found = subtaskRepository.findById(subtaskId);
        if (found.isEmpty()) {
            log.warn("Streaming subtask {} no longer exists, durable write skipped.", subtaskId);
            return false;
        }
        Subtask subtask = found.get();
        if (subtask.getStatus().isTerminal()) {
            log.debug("Subtask {} already {}, durable write skipped.", subtaskId, subtask.getStatus());
            return false;
        }
        subtask.setStatus(SubtaskStatus.RUNNING);
        subtask.setResult(result);
        if (progress != null) {
            subtask.setProgress(progress);
        }
        subtaskRepository.save(subtask);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<Subtask> find(Long subtaskId) {
        return subtaskRepository.findById(subtaskId);
    }
}
