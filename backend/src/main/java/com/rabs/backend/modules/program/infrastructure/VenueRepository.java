package com.rabs.backend.modules.program.infrastructure;

import java.util.UUID;

import com.rabs.backend.modules.program.domain.Venue;

import org.springframework.data.jpa.repository.JpaRepository;

public interface VenueRepository extends JpaRepository<Venue, UUID> {
}
