package com.rabs.backend.modules.loom.infrastructure;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.modules.loom.domain.StaffRole;
import com.rabs.backend.modules.loom.domain.StaffShift;
import com.rabs.backend.modules.loom.domain.StaffShiftStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffShiftRepository extends JpaRepository<StaffShift, UUID> {

    @Query("""
            select s from StaffShift s
            left join fetch s.staff
            where s.loomInstance.id = :instanceId
            order by s.assignmentOrder asc
            """)
    List<StaffShift> findByInstance(@Param("instanceId") UUID instanceId);

    @Query("""
            select s from StaffShift s
            join fetch s.loomInstance i
            join fetch i.program
            left join fetch s.staff
            where s.id = :shiftId
            """)
    Optional<StaffShift> findWithInstanceById(@Param("shiftId") UUID shiftId);

    @Query("""
            select distinct s.staff.id from StaffShift s
            where s.loomInstance.id = :instanceId
              and s.staff is not null
            """)
    Set<UUID> findStaffIdsOnInstance(@Param("instanceId") UUID instanceId);

    @Query("""
            select coalesce(max(s.assignmentOrder), 0) from StaffShift s
            where s.loomInstance.id = :instanceId
            """)
    int findMaxAssignmentOrder(@Param("instanceId") UUID instanceId);

    // Staffed shifts only; placeholders hold no position yet.
    @Query("""
            select count(s) from StaffShift s
            where s.loomInstance.id = :instanceId
              and s.status = :status
              and s.role in :roles
              and s.staff is not null
            """)
    long countByInstanceAndStatusAndRoles(@Param("instanceId") UUID instanceId,
                                          @Param("status") StaffShiftStatus status,
                                          @Param("roles") Collection<StaffRole> roles);

    @Query("""
            select s from StaffShift s
            left join fetch s.staff
            where s.loomInstance.id = :instanceId
              and s.status = :status
              and s.role = :role
              and s.staff is not null
            order by s.assignmentOrder desc
            """)
    List<StaffShift> findByInstanceAndStatusAndRoleNewestFirst(@Param("instanceId") UUID instanceId,
                                                               @Param("status") StaffShiftStatus status,
                                                               @Param("role") StaffRole role);

    @Query("""
            select s from StaffShift s
            where s.staff.id in :staffIds
              and s.status = com.rabs.backend.modules.loom.domain.StaffShiftStatus.PLANNED
              and s.startAt >= :fromInclusive
              and s.startAt < :toExclusive
            """)
    List<StaffShift> findPlannedForStaffStartingBetween(@Param("staffIds") Collection<UUID> staffIds,
                                                        @Param("fromInclusive") OffsetDateTime fromInclusive,
                                                        @Param("toExclusive") OffsetDateTime toExclusive);

    @Query("""
            select s from StaffShift s
            join fetch s.loomInstance i
            where s.staff.id = :staffId
              and s.status = com.rabs.backend.modules.loom.domain.StaffShiftStatus.PLANNED
              and s.startAt < :endAt
              and s.endAt > :startAt
            """)
    List<StaffShift> findPlannedForStaffOverlapping(@Param("staffId") UUID staffId,
                                                    @Param("startAt") OffsetDateTime startAt,
                                                    @Param("endAt") OffsetDateTime endAt);

    @Query("""
            select s.loomInstance.id, count(s) from StaffShift s
            where s.loomInstance.id in :instanceIds
              and s.status = com.rabs.backend.modules.loom.domain.StaffShiftStatus.PLANNED
            group by s.loomInstance.id
            """)
    List<Object[]> countPlannedByInstances(@Param("instanceIds") Collection<UUID> instanceIds);

    @Modifying(flushAutomatically = true)
    @Query("delete from StaffShift s where s.loomInstance.id = :instanceId")
    int deleteByInstance(@Param("instanceId") UUID instanceId);
}
