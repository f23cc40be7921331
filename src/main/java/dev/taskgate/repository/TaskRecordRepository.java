package dev.taskgate.repository;

import dev.taskgate.domain.entity.TaskRecord;
import dev.taskgate.domain.enums.TaskStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface TaskRecordRepository extends JpaRepository<TaskRecord, String> {
    Page<TaskRecord> findByStatusOrderByCreatedAtDesc(TaskStatus status, Pageable pageable);
    Page<TaskRecord> findAllByOrderByCreatedAtDesc(Pageable pageable);
    long countByStatus(TaskStatus status);
    List<TaskRecord> findByStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(Collection<TaskStatus> statuses,
                                                                        Instant createdBefore);
}
