package com.rabs.backend.modules.participant.infrastructure;

import java.util.UUID;

import com.rabs.backend.modules.participant.domain.Participant;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ParticipantRepository extends JpaRepository<Participant, UUID> {
}
