package dev.taskgate.repository;

import dev.taskgate.domain.entity.Installation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InstallationRepository extends JpaRepository<Installation, UUID> {
    Optional<Installation> findByPlatformAndOrganizationIdAndActiveTrue(String platform, String organizationId);
    boolean existsByPlatformAndOrganizationIdAndActiveTrue(String platform, String organizationId);
    List<Installation> findByActiveTrueOrderByCreatedAtAsc();
    List<Installation> findByPlatformAndActiveTrueOrderByCreatedAtAsc(String platform);
}
