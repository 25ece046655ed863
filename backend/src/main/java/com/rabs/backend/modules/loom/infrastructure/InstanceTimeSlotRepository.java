package com.rabs.backend.modules.loom.infrastructure;

import java.util.List;
import java.util.UUID;

import com.rabs.backend.modules.loom.domain.InstanceTimeSlot;

import org.springframework.data.jpa.repository.JpaRepository;

public interface InstanceTimeSlotRepository extends JpaRepository<InstanceTimeSlot, UUID> {

    List<InstanceTimeSlot> findByLoomInstance_IdOrderBySeqAsc(UUID loomInstanceId);
}
