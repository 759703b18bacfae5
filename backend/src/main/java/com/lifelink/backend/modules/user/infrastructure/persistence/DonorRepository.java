package com.lifelink.backend.modules.user.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import com.lifelink.backend.modules.user.domain.Donor;

public interface DonorRepository extends JpaRepository<Donor, UUID> {

    /**
     * Matching pool: available donors whose account is active.
     */
    @Query("""
            select d
              from Donor d
              join fetch d.user u
             where d.available = true
               and u.status = com.lifelink.backend.modules.user.domain.UserStatus.ACTIVE
            """)
    List<Donor> findMatchingPool();
}
