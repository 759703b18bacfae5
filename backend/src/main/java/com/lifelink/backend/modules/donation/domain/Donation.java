package com.lifelink.backend.modules.donation.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lifelink.backend.global.jpa.AbstractTimestampedEntity;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.user.domain.Donor;

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

@Entity
@Table(name = "donation")
public class Donation extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "donor_id", nullable = false)
    private Donor donor;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "request_id", nullable = false)
    private DonationRequest request;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DonationStatus status = DonationStatus.PENDING;

    @Column(name = "quantity", nullable = false)
    private int quantity = 1;

    @Column(name = "scheduled_date")
    private OffsetDateTime scheduledDate;

    @Column(name = "completed_date")
    private OffsetDateTime completedDate;

    @Column(name = "notes", length = 1000)
    private String notes;

    protected Donation() {
    }

    public Donation(Donor donor, DonationRequest request, int quantity, String notes) {
        this.donor = donor;
        this.request = request;
        this.quantity = quantity;
        this.notes = notes;
    }

    public UUID getId() {
        return id;
    }

    public Donor getDonor() {
        return donor;
    }

    public DonationRequest getRequest() {
        return request;
    }

    public DonationStatus getStatus() {
        return status;
    }

    public void setStatus(DonationStatus status) {
        this.status = status;
    }

    public int getQuantity() {
        return quantity;
    }

    public OffsetDateTime getScheduledDate() {
        return scheduledDate;
    }

    public void setScheduledDate(OffsetDateTime scheduledDate) {
        this.scheduledDate = scheduledDate;
    }

    public OffsetDateTime getCompletedDate() {
        return completedDate;
    }

    public void setCompletedDate(OffsetDateTime completedDate) {
        this.completedDate = completedDate;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
