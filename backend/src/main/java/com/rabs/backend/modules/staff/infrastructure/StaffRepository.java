package com.rabs.backend.modules.staff.infrastructure;

import java.util.List;
import java.util.UUID;

import com.rabs.backend.modules.staff.domain.Staff;

import org.springframework.data.jpa.repository.JpaRepository;

public interface StaffRepository extends JpaRepository<Staff, UUID> {

    List<Staff> findByActiveTrueOrderByLastNameAscFirstNameAsc();
}
