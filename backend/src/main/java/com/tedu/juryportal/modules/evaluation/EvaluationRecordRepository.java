package com.tedu.juryportal.modules.evaluation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EvaluationRecordRepository extends JpaRepository<EvaluationRecord, UUID> {

    List<EvaluationRecord> findByJurorId(String jurorId);

    Optional<EvaluationRecord> findByJurorIdAndGroupId(String jurorId, String groupId);

    long countByJurorIdAndStatus(String jurorId, EvaluationStatus status);

    long deleteByJurorId(String jurorId);

    List<EvaluationRecord> findAllByOrderByJurorIdAscGroupIdAsc();

    /**
     * Claims the {@code (jurorId, groupId)} slot with an empty in-progress row.
     * Returns 0 when another transaction already holds it; the caller then
     * re-reads and merges against that row instead.
     */
    @Modifying
    @Query(value = "INSERT INTO evaluation_records (id, juror_id, group_id, submitted_at, status, editing_flag) "
            + "VALUES (:id, :jurorId, :groupId, '', 'IN_PROGRESS', '') "
            + "ON CONFLICT (juror_id, group_id) DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id, @Param("jurorId") String jurorId, @Param("groupId") String groupId);
}
