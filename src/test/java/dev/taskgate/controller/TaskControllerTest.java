package dev.taskgate.controller;

import dev.taskgate.domain.entity.TaskRecord;
import dev.taskgate.domain.enums.TaskPriority;
import dev.taskgate.domain.enums.TaskStatus;
import dev.taskgate.exception.InvalidTransitionException;
import dev.taskgate.exception.TaskNotFoundException;
import dev.taskgate.service.TaskLifecycleService;
import dev.taskgate.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.boot.webmvc.test.autoconfigure.WebMvcTest;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskController.class)
@AutoConfigureMockMvc(addFilters = false)
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TaskLifecycleService lifecycle;

    @Test
    @DisplayName("GET /tasks/{id} returns the task")
    void getTask() throws Exception {
        TaskRecord record = record("task-1");
        record.markRunning(Fixtures.NOW);
        when(lifecycle.get("task-1")).thenReturn(record);

        mockMvc.perform(get("/tasks/task-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taskId").value("task-1"))
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.priority").value("HIGH"))
                .andExpect(jsonPath("$.provider").value("github"));
    }

    @Test
    @DisplayName("GET /tasks/{id} of an unknown task is 404")
    void unknownTask() throws Exception {
        when(lifecycle.get("nope")).thenThrow(new TaskNotFoundException("nope"));

        mockMvc.perform(get("/tasks/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("GET /tasks filters by status and pages")
    void listByStatus() throws Exception {
        when(lifecycle.list(eq(TaskStatus.QUEUED), eq(0), eq(20)))
                .thenReturn(new PageImpl<>(List.of(record("task-1"), record("task-2")), PageRequest.of(0, 20), 2));

        mockMvc.perform(get("/tasks").param("status", "QUEUED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tasks.length()").value(2))
                .andExpect(jsonPath("$.tasks[0].taskId").value("task-1"))
                .andExpect(jsonPath("$.page").value(0))
                .andExpect(jsonPath("$.size").value(20))
                .andExpect(jsonPath("$.total").value(2));
    }

    @Test
    @DisplayName("GET /tasks without status lists everything")
    void listAll() throws Exception {
        when(lifecycle.list(isNull(), eq(1), eq(5)))
                .thenReturn(new PageImpl<>(List.of(), PageRequest.of(1, 5), 5));

        mockMvc.perform(get("/tasks").param("page", "1").param("size", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tasks.length()").value(0))
                .andExpect(jsonPath("$.total").value(5));
    }

    @Test
    @DisplayName("GET /tasks with an unknown status is 400")
    void badStatus() throws Exception {
        mockMvc.perform(get("/tasks").param("status", "EXPLODED"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycle);
    }

    @Test
    @DisplayName("POST /tasks/{id}/cancel returns the cancelled task")
    void cancel() throws Exception {
        TaskRecord record = record("task-1");
        record.markCancelled(Fixtures.NOW);
        when(lifecycle.cancel("task-1")).thenReturn(record);

        mockMvc.perform(post("/tasks/task-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    @DisplayName("cancelling a finished task is 409")
    void cancelFinished() throws Exception {
        when(lifecycle.cancel("task-1"))
                .thenThrow(new InvalidTransitionException("task-1", TaskStatus.COMPLETED, TaskStatus.CANCELLED));

        mockMvc.perform(post("/tasks/task-1/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Invalid Transition"));
    }

    @Test
    @DisplayName("POST /tasks/{id}/input resumes a waiting task with 202")
    void provideInput() throws Exception {
        TaskRecord record = record("task-1");
        record.markRunning(Fixtures.NOW);
        record.markWaitingInput(Fixtures.NOW);
        when(lifecycle.resume("task-1", "use main")).thenReturn(record);

        mockMvc.perform(post("/tasks/task-1/input")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"use main\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.taskId").value("task-1"))
                .andExpect(jsonPath("$.status").value("WAITING_INPUT"));
    }

    @Test
    @DisplayName("input for a task that is not waiting is 409")
    void inputForRunningTask() throws Exception {
        when(lifecycle.resume("task-1", "late"))
                .thenThrow(new InvalidTransitionException("task-1", TaskStatus.RUNNING, TaskStatus.RUNNING));

        mockMvc.perform(post("/tasks/task-1/input")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"late\"}"))
                .andExpect(status().isConflict());
    }

    private static TaskRecord record(String taskId) {
        return TaskRecord.accept(Fixtures.message(taskId, TaskPriority.HIGH), Fixtures.NOW);
    }
}
