package com.rabs.backend.modules.availability.infrastructure;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.rabs.backend.modules.availability.domain.StaffUnavailability;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Overlap queries use the half-open rule {@code existing.start < end and existing.end > start}.
 */
public interface StaffUnavailabilityRepository extends JpaRepository<StaffUnavailability, UUID> {

    @Query("""
            select count(u) > 0 from StaffUnavailability u
            where u.staff.id = :staffId
              and u.startAt < :endAt
              and u.endAt > :startAt
            """)
    boolean existsOverlapping(@Param("staffId") UUID staffId,
                              @Param("startAt") OffsetDateTime startAt,
                              @Param("endAt") OffsetDateTime endAt);

    @Query("""
            select distinct u.staff.id from StaffUnavailability u
            where u.startAt < :endAt
              and u.endAt > :startAt
            """)
    List<UUID> findStaffIdsUnavailableBetween(@Param("startAt") OffsetDateTime startAt,
                                              @Param("endAt") OffsetDateTime endAt);
}
