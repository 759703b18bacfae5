package com.lifelink.backend.modules.user.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.lifelink.backend.global.common.GeoLocation;
import com.lifelink.backend.global.jpa.AbstractTimestampedEntity;
import com.lifelink.backend.modules.matching.domain.BloodType;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapsId;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

/**
 * Donor payload of an {@link AppUser} tagged {@link UserRole#DONOR}; shares the user's id.
 */
@Entity
@Table(name = "donor")
public class Donor extends AbstractTimestampedEntity {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @MapsId
    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id")
    private AppUser user;

    @Column(name = "phone_number", nullable = false, length = 10)
    private String phoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender", nullable = false, length = 16)
    private Gender gender = Gender.NOT_SPECIFIED;

    @Enumerated(EnumType.STRING)
    @Column(name = "blood_type", length = 16)
    private BloodType bloodType;

    @Column(name = "available", nullable = false)
    private boolean available = true;

    @Column(name = "last_donation_date")
    private OffsetDateTime lastDonationDate;

    @Embedded
    private GeoLocation location;

    @Column(name = "date_of_birth", nullable = false)
    private LocalDate dateOfBirth;

    protected Donor() {
    }

    public Donor(AppUser user, String phoneNumber, LocalDate dateOfBirth) {
        this.user = user;
        this.phoneNumber = phoneNumber;
        this.dateOfBirth = dateOfBirth;
    }

    public UUID getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public void setPhoneNumber(String phoneNumber) {
        this.phoneNumber = phoneNumber;
    }

    public Gender getGender() {
        return gender;
    }

    public void setGender(Gender gender) {
        this.gender = gender;
    }

    public BloodType getBloodType() {
        return bloodType;
    }

    public void setBloodType(BloodType bloodType) {
        this.bloodType = bloodType;
    }

    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public OffsetDateTime getLastDonationDate() {
        return lastDonationDate;
    }

    public void setLastDonationDate(OffsetDateTime lastDonationDate) {
        this.lastDonationDate = lastDonationDate;
    }

    public GeoLocation getLocation() {
        return location;
    }

    public void setLocation(GeoLocation location) {
        this.location = location;
    }

    public LocalDate getDateOfBirth() {
        return dateOfBirth;
    }

    public void setDateOfBirth(LocalDate dateOfBirth) {
        this.dateOfBirth = dateOfBirth;
    }
}
