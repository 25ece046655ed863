package com.rabs.backend.modules.loom.infrastructure;

import java.util.UUID;

import com.rabs.backend.modules.loom.domain.LoomSettings;

import org.springframework.data.jpa.repository.JpaRepository;

public interface LoomSettingsRepository extends JpaRepository<LoomSettings, UUID> {
}
