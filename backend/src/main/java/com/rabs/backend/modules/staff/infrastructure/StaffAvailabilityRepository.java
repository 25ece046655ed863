package com.rabs.backend.modules.staff.infrastructure;

import java.util.List;
import java.util.UUID;

import com.rabs.backend.modules.staff.domain.StaffAvailability;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffAvailabilityRepository extends JpaRepository<StaffAvailability, UUID> {

    @Query("""
            select a from StaffAvailability a
            join fetch a.staff s
            where s.active = true
              and a.dayOfWeek = :isoDay
            """)
    List<StaffAvailability> findActiveByIsoDay(@Param("isoDay") int isoDay);
}
