package com.lifelink.backend.modules.request.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lifelink.backend.global.jpa.AbstractTimestampedEntity;
import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.user.domain.Hospital;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A hospital's ask for blood or an organ. Exactly one of {@code bloodType} / {@code organType}
 * is set, matching {@code kind}.
 */
@Entity
@Table(name = "donation_request")
public class DonationRequest extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "hospital_id", nullable = false)
    private Hospital hospital;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private RequestKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "blood_type", length = 16)
    private BloodType bloodType;

    @Enumerated(EnumType.STRING)
    @Column(name = "organ_type", length = 16)
    private OrganType organType;

    @Enumerated(EnumType.STRING)
    @Column(name = "urgency", nullable = false, length = 16)
    private Urgency urgency = Urgency.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RequestStatus status = RequestStatus.PENDING;

    @Column(name = "required_by", nullable = false)
    private OffsetDateTime requiredBy;

    @Column(name = "quantity", nullable = false)
    private int quantity = 1;

    @Column(name = "notes", length = 1000)
    private String notes;

    protected DonationRequest() {
    }

    public static DonationRequest blood(Hospital hospital, BloodType bloodType, Urgency urgency, OffsetDateTime requiredBy, int quantity) {
        DonationRequest request = new DonationRequest();
        request.hospital = hospital;
        request.kind = RequestKind.BLOOD;
        request.bloodType = bloodType;
        request.urgency = urgency;
        request.requiredBy = requiredBy;
        request.quantity = quantity;
        return request;
    }

    public static DonationRequest organ(Hospital hospital, OrganType organType, Urgency urgency, OffsetDateTime requiredBy, int quantity) {
        DonationRequest request = new DonationRequest();
        request.hospital = hospital;
        request.kind = RequestKind.ORGAN;
        request.organType = organType;
        request.urgency = urgency;
        request.requiredBy = requiredBy;
        request.quantity = quantity;
        return request;
    }

    public UUID getId() {
        return id;
    }

    public Hospital getHospital() {
        return hospital;
    }

    public RequestKind getKind() {
        return kind;
    }

    public BloodType getBloodType() {
        return bloodType;
    }

    public OrganType getOrganType() {
        return organType;
    }

    public Urgency getUrgency() {
        return urgency;
    }

    public RequestStatus getStatus() {
        return status;
    }

    public void setStatus(RequestStatus status) {
        this.status = status;
    }

    public OffsetDateTime getRequiredBy() {
        return requiredBy;
    }

    public int getQuantity() {
        return quantity;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public boolean isBlood() {
        return kind == RequestKind.BLOOD;
    }

    /** "O+ blood" or "kidney organ", as shown in notifications. */
    public String describeNeed() {
        return isBlood() ? bloodType.getCode() + " blood" : organType.getCode() + " organ";
    }
}
