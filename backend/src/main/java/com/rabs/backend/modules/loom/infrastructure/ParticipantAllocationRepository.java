package com.rabs.backend.modules.loom.infrastructure;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.modules.loom.domain.AllocationStatus;
import com.rabs.backend.modules.loom.domain.ParticipantAllocation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ParticipantAllocationRepository extends JpaRepository<ParticipantAllocation, UUID> {

    long countByLoomInstance_IdAndStatus(UUID loomInstanceId, AllocationStatus status);

    @Query("""
            select a.participant.id from ParticipantAllocation a
            where a.loomInstance.id = :instanceId
            """)
    Set<UUID> findParticipantIdsByInstance(@Param("instanceId") UUID instanceId);

    @Query("""
            select a from ParticipantAllocation a
            join fetch a.participant p
            where a.loomInstance.id = :instanceId
            order by p.lastName asc, p.firstName asc
            """)
    List<ParticipantAllocation> findByInstanceWithParticipant(@Param("instanceId") UUID instanceId);

    // Suburb ordering keeps stops in the same area next to each other on a run.
    @Query("""
            select a from ParticipantAllocation a
            join fetch a.participant p
            where a.loomInstance.id = :instanceId
              and a.status = :status
            order by p.suburb asc, p.lastName asc, p.firstName asc
            """)
    List<ParticipantAllocation> findByInstanceAndStatusForRouting(@Param("instanceId") UUID instanceId,
                                                                  @Param("status") AllocationStatus status);

    @Query("""
            select a from ParticipantAllocation a
            join fetch a.loomInstance i
            join fetch i.program
            join fetch a.participant
            where a.id = :allocationId
            """)
    Optional<ParticipantAllocation> findWithInstanceById(@Param("allocationId") UUID allocationId);

    @Query("""
            select a.loomInstance.id, count(a) from ParticipantAllocation a
            where a.loomInstance.id in :instanceIds
              and a.status = com.rabs.backend.modules.loom.domain.AllocationStatus.PLANNED
            group by a.loomInstance.id
            """)
    List<Object[]> countPlannedByInstances(@Param("instanceIds") Collection<UUID> instanceIds);
}
