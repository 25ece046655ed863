package com.rabs.backend.modules.program.infrastructure;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.rabs.backend.modules.program.domain.Enrollment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EnrollmentRepository extends JpaRepository<Enrollment, UUID> {

    @Query("""
            select distinct e from Enrollment e
            join fetch e.participant p
            left join fetch e.billingCodes
            where e.program.id = :programId
              and e.active = true
              and p.active = true
              and e.startDate <= :date
              and (e.endDate is null or e.endDate >= :date)
            """)
    List<Enrollment> findEligibleForDate(@Param("programId") UUID programId, @Param("date") LocalDate date);

    @Query("""
            select count(e) from Enrollment e
            where e.program.id = :programId
              and e.active = true
              and e.participant.active = true
              and e.startDate <= :date
              and (e.endDate is null or e.endDate >= :date)
            """)
    long countEligibleForDate(@Param("programId") UUID programId, @Param("date") LocalDate date);
}
