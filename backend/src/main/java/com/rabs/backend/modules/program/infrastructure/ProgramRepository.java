package com.rabs.backend.modules.program.infrastructure;

import java.util.List;
import java.util.UUID;

import com.rabs.backend.modules.program.domain.Program;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ProgramRepository extends JpaRepository<Program, UUID> {

    List<Program> findByActiveTrueOrderByNameAsc();
}
