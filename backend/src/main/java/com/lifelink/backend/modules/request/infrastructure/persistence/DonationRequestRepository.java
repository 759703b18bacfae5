package com.lifelink.backend.modules.request.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.request.domain.RequestKind;
import com.lifelink.backend.modules.request.domain.RequestStatus;
import com.lifelink.backend.modules.request.domain.Urgency;

public interface DonationRequestRepository extends JpaRepository<DonationRequest, UUID> {

    @Query("""
            select r
              from DonationRequest r
              join fetch r.hospital
             where r.status in :statuses
            """)
    List<DonationRequest> findWithHospitalByStatusIn(@Param("statuses") Collection<RequestStatus> statuses);

    @Query("""
            select r
              from DonationRequest r
             where r.status in :statuses
               and (:kind is null or r.kind = :kind)
               and (:urgency is null or r.urgency = :urgency)
             order by r.createdAt desc
            """)
    Page<DonationRequest> searchOpen(
            @Param("statuses") Collection<RequestStatus> statuses,
            @Param("kind") RequestKind kind,
            @Param("urgency") Urgency urgency,
            Pageable pageable
    );

    @Query("""
            select r
              from DonationRequest r
             where r.hospital.id = :hospitalId
               and (:status is null or r.status = :status)
               and (:kind is null or r.kind = :kind)
             order by r.createdAt desc
            """)
    Page<DonationRequest> searchByHospital(
            @Param("hospitalId") UUID hospitalId,
            @Param("status") RequestStatus status,
            @Param("kind") RequestKind kind,
            Pageable pageable
    );

    long countByStatus(RequestStatus status);
}
