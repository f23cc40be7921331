package dev.taskgate.controller;

import dev.taskgate.domain.enums.TaskStatus;
import dev.taskgate.dto.request.TaskInputRequest;
import dev.taskgate.dto.response.TaskResponse;
import dev.taskgate.service.TaskLifecycleService;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/tasks")
public class TaskController {
    private final TaskLifecycleService lifecycle;

    public TaskController(TaskLifecycleService lifecycle) { this.lifecycle = lifecycle; }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable String taskId) {
        return ResponseEntity.ok(TaskResponse.from(lifecycle.get(taskId)));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listTasks(@RequestParam(required = false) TaskStatus status,
                                                         @RequestParam(defaultValue = "0") int page,
                                                         @RequestParam(defaultValue = "20") int size) {
        Page<TaskResponse> tasks = lifecycle.list(status, page, size).map(TaskResponse::from);
        List<TaskResponse> content = tasks.getContent();
        return ResponseEntity.ok(Map.of(
                "tasks", content,
                "page", tasks.getNumber(),
                "size", tasks.getSize(),
                "total", tasks.getTotalElements()));
    }

    @PostMapping("/{taskId}/input")
    public ResponseEntity<TaskResponse> provideInput(@PathVariable String taskId,
                                                     @RequestBody TaskInputRequest request) {
        return ResponseEntity.accepted().body(TaskResponse.from(lifecycle.resume(taskId, request.input())));
    }

    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<TaskResponse> cancel(@PathVariable String taskId) {
        return ResponseEntity.ok(TaskResponse.from(lifecycle.cancel(taskId)));
    }
}
