package com.rabs.backend.modules.loom.infrastructure;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.modules.loom.domain.VehicleRun;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VehicleRunRepository extends JpaRepository<VehicleRun, UUID> {

    @Query("""
            select r from VehicleRun r
            left join fetch r.vehicle
            where r.loomInstance.id = :instanceId
            order by r.createdAt asc
            """)
    List<VehicleRun> findByInstance(@Param("instanceId") UUID instanceId);

    @Query("""
            select distinct r.vehicle.id from VehicleRun r
            where r.vehicle is not null
              and r.loomInstance.instanceDate = :date
              and r.loomInstance.id <> :excludedInstanceId
            """)
    Set<UUID> findVehicleIdsUsedOn(@Param("date") LocalDate date,
                                   @Param("excludedInstanceId") UUID excludedInstanceId);

    @Query("""
            select r from VehicleRun r
            join fetch r.loomInstance i
            where r.vehicle.id = :vehicleId
              and i.instanceDate between :fromDate and :toDate
            """)
    List<VehicleRun> findForVehicleBetween(@Param("vehicleId") UUID vehicleId,
                                           @Param("fromDate") LocalDate fromDate,
                                           @Param("toDate") LocalDate toDate);

    @Query("""
            select r.loomInstance.id, count(r) from VehicleRun r
            where r.loomInstance.id in :instanceIds
              and r.vehicle is not null
            group by r.loomInstance.id
            """)
    List<Object[]> countAssignedByInstances(@Param("instanceIds") Collection<UUID> instanceIds);

    @Modifying(flushAutomatically = true)
    @Query("delete from VehicleRun r where r.loomInstance.id = :instanceId")
    int deleteByInstance(@Param("instanceId") UUID instanceId);
}
