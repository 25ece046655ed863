package com.rabs.backend.modules.loom.infrastructure;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rabs.backend.modules.loom.domain.LoomInstance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LoomInstanceRepository extends JpaRepository<LoomInstance, UUID> {

    boolean existsByProgram_IdAndInstanceDate(UUID programId, LocalDate instanceDate);

    @Query("""
            select i from LoomInstance i
            join fetch i.program p
            left join fetch i.venue
            where i.id = :instanceId
            """)
    Optional<LoomInstance> findWithProgramById(@Param("instanceId") UUID instanceId);

    @Query("""
            select i from LoomInstance i
            join fetch i.program p
            left join fetch i.venue
            where i.instanceDate between :startDate and :endDate
            order by i.instanceDate asc, i.startTime asc, p.name asc
            """)
    List<LoomInstance> findBetween(@Param("startDate") LocalDate startDate, @Param("endDate") LocalDate endDate);

    // Child rows are removed by ON DELETE CASCADE.
    @Modifying(flushAutomatically = true)
    @Query("delete from LoomInstance i where i.instanceDate >= :date")
    int deleteOnOrAfter(@Param("date") LocalDate date);

    @Modifying(flushAutomatically = true)
    @Query("delete from LoomInstance i where i.program.id = :programId and i.instanceDate > :date")
    int deleteByProgramAfter(@Param("programId") UUID programId, @Param("date") LocalDate date);
}
