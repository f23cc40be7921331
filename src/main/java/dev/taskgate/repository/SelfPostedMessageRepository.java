package dev.taskgate.repository;

import dev.taskgate.domain.entity.SelfPostedMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface SelfPostedMessageRepository extends JpaRepository<SelfPostedMessage, String> {
    boolean existsByExternalIdAndInsertedAtAfter(String externalId, Instant cutoff);

    @Modifying
    @Transactional
    @Query("delete from SelfPostedMessage m where m.insertedAt <= :cutoff")
    int deleteExpired(@Param("cutoff") Instant cutoff);
}
