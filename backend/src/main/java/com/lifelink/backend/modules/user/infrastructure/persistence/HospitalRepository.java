package com.lifelink.backend.modules.user.infrastructure.persistence;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.lifelink.backend.modules.user.domain.Hospital;

public interface HospitalRepository extends JpaRepository<Hospital, UUID> {
}
