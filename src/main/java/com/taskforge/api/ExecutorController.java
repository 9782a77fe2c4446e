package com.taskforge.api;

import com.taskforge.coordination.api.DispatchService;
import com.taskforge.coordination.api.StreamingIngestService;
import com.taskforge.coordination.api.SubtaskUpdateService;
import com.taskforge.coordination.model.CancelState;
import com.taskforge.coordination.model.StreamSnapshot;
import com.taskforge.coordination.model.StreamingAck;
import com.taskforge.coordination.model.SubtaskUpdateResult;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints called by workers: claim work, report subtask state and stream incremental output.
 */
@RestController
@RequestMapping("/api/executors")
public class ExecutorController {

    private final DispatchService dispatchService;
    private final SubtaskUpdateService subtaskUpdateService;
    private final StreamingIngestService streamingIngestService;

    public ExecutorController(DispatchService dispatchService,
                              SubtaskUpdateService subtaskUpdateService,
                              StreamingIngestService streamingIngestService) {
        this.dispatchService = dispatchService;
        this.subtaskUpdateService = subtaskUpdateService;
        this.streamingIngestService = streamingIngestService;
    }

    @PostMapping("/tasks/dispatch")
    public DispatchResponse dispatch(@Valid @RequestBody(required = false) DispatchRequest request) {
        if (request == null) {
            return DispatchResponse.from(dispatchService.dispatch(null, null, null));
        }
        return DispatchResponse.from(dispatchService.dispatch(request.status(), request.limit(), request.taskIds()));
    }

    @PostMapping("/subtasks/update")
    public SubtaskUpdateResult updateSubtask(@Valid @RequestBody SubtaskUpdateRequest request) {
        return subtaskUpdateService.update(request.toUpdate());
    }

    @PostMapping("/streaming/events")
    public StreamingAck streamingEvent(@Valid @RequestBody StreamingEventRequest request) {
        return streamingIngestService.process(request.taskId(), request.subtaskId(), request.eventType(),
                request.payload());
    }

    @GetMapping("/subtasks/{subtaskId}/stream")
    public StreamSnapshot streamSnapshot(@PathVariable Long subtaskId) {
        return streamingIngestService.snapshot(subtaskId);
    }

    @PostMapping("/subtasks/{subtaskId}/cancel")
    public CancelState cancel(@PathVariable Long subtaskId) {
        return streamingIngestService.requestCancel(subtaskId);
    }

    @GetMapping("/subtasks/{subtaskId}/cancel")
    public CancelState cancelState(@PathVariable Long subtaskId) {
        return streamingIngestService.cancelState(subtaskId);
    }
}
