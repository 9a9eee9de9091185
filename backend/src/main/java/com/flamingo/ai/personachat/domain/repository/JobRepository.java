package com.flamingo.ai.personachat.domain.repository;

import com.flamingo.ai.personachat.domain.entity.Job;
import com.flamingo.ai.personachat.domain.enums.JobStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Job entities. */
@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

  /** Finds pending jobs whose scheduled time has passed, oldest schedule first. */
  @Query(
      "SELECT j FROM Job j WHERE j.status = :status AND j.scheduledAt <= :now "
          + "ORDER BY j.scheduledAt ASC, j.createdAt ASC")
  List<Job> findDue(
      @Param("status") JobStatus status, @Param("now") LocalDateTime now, Pageable pageable);

  /**
   * Moves a job from PENDING to RUNNING only if it is still pending.
   *
   * @return 1 when this caller won the claim, 0 otherwise
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Job j SET j.status = com.flamingo.ai.personachat.domain.enums.JobStatus.RUNNING, "
          + "j.startedAt = :now, j.updatedAt = :now "
          + "WHERE j.id = :id "
          + "AND j.status = com.flamingo.ai.personachat.domain.enums.JobStatus.PENDING")
  int claim(@Param("id") UUID id, @Param("now") LocalDateTime now);

  boolean existsByIdempotencyKey(String idempotencyKey);

  Optional<Job> findByIdempotencyKey(String idempotencyKey);

  /** Counts jobs by status. */
  long countByStatus(JobStatus status);
}
