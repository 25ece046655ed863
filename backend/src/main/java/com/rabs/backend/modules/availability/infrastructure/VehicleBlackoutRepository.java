package com.rabs.backend.modules.availability.infrastructure;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.rabs.backend.modules.availability.domain.VehicleBlackout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VehicleBlackoutRepository extends JpaRepository<VehicleBlackout, UUID> {

    @Query("""
            select count(b) > 0 from VehicleBlackout b
            where b.vehicle.id = :vehicleId
              and b.startAt < :endAt
              and b.endAt > :startAt
            """)
    boolean existsOverlapping(@Param("vehicleId") UUID vehicleId,
                              @Param("startAt") OffsetDateTime startAt,
                              @Param("endAt") OffsetDateTime endAt);

    @Query("""
            select distinct b.vehicle.id from VehicleBlackout b
            where b.startAt < :endAt
              and b.endAt > :startAt
            """)
    List<UUID> findVehicleIdsBlackedOutBetween(@Param("startAt") OffsetDateTime startAt,
                                               @Param("endAt") OffsetDateTime endAt);
}
