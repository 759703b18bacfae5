package com.lifelink.backend.modules.donation.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.lifelink.backend.modules.donation.domain.Donation;
import com.lifelink.backend.modules.donation.domain.DonationStatus;

public interface DonationRepository extends JpaRepository<Donation, UUID> {

    boolean existsByDonorIdAndRequestIdAndStatusNot(UUID donorId, UUID requestId, DonationStatus status);

    @Query("""
            select d.donor.id
              from Donation d
             where d.request.id = :requestId
               and d.status <> com.lifelink.backend.modules.donation.domain.DonationStatus.CANCELLED
            """)
    List<UUID> findActiveDonorIdsByRequestId(@Param("requestId") UUID requestId);

    @Query("""
            select d.request.id
              from Donation d
             where d.donor.id = :donorId
               and d.status <> com.lifelink.backend.modules.donation.domain.DonationStatus.CANCELLED
            """)
    List<UUID> findActiveRequestIdsByDonorId(@Param("donorId") UUID donorId);

    /**
     * Cancels every donation of the request that is neither completed nor already cancelled.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            update Donation d
               set d.status = com.lifelink.backend.modules.donation.domain.DonationStatus.CANCELLED,
                   d.updatedAt = :now
             where d.request.id = :requestId
               and d.status not in (
                     com.lifelink.backend.modules.donation.domain.DonationStatus.COMPLETED,
                     com.lifelink.backend.modules.donation.domain.DonationStatus.CANCELLED)
            """)
    int cancelOpenByRequestId(@Param("requestId") UUID requestId, @Param("now") OffsetDateTime now);

    @Query(value = """
            select d
              from Donation d
              join fetch d.request r
              join fetch r.hospital
             where d.donor.id = :donorId
               and (:status is null or d.status = :status)
             order by d.createdAt desc
            """,
            countQuery = """
            select count(d)
              from Donation d
             where d.donor.id = :donorId
               and (:status is null or d.status = :status)
            """)
    Page<Donation> searchByDonor(@Param("donorId") UUID donorId, @Param("status") DonationStatus status, Pageable pageable);

    @Query("""
            select d
              from Donation d
             where d.request.hospital.id = :hospitalId
               and (:status is null or d.status = :status)
             order by d.createdAt desc
            """)
    Page<Donation> searchByHospital(@Param("hospitalId") UUID hospitalId, @Param("status") DonationStatus status, Pageable pageable);

    @Query("""
            select d
              from Donation d
              join fetch d.donor dn
              join fetch dn.user
             where d.request.id = :requestId
             order by d.createdAt desc
            """)
    List<Donation> findByRequestIdWithDonor(@Param("requestId") UUID requestId);

    long countByStatus(DonationStatus status);

    long countByDonorId(UUID donorId);

    long countByDonorIdAndStatus(UUID donorId, DonationStatus status);

    @Query("""
            select coalesce(sum(d.quantity), 0)
              from Donation d
             where d.donor.id = :donorId
               and d.status = com.lifelink.backend.modules.donation.domain.DonationStatus.COMPLETED
            """)
    long sumCompletedQuantityByDonorId(@Param("donorId") UUID donorId);
}
