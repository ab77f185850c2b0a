package com.schoolhub.backend.modules.announcement.domain;

import java.util.UUID;

import com.schoolhub.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A message shown on the school board between its start date (inclusive, optional) and its
 * expiration date (inclusive). Both dates are kept as ISO {@code YYYY-MM-DD} text.
 */
@Entity
@Table(name = "announcement")
public class Announcement extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "message", nullable = false, columnDefinition = "text")
    private String message;

    @Column(name = "start_date", length = 10)
    private String startDate;

    @Column(name = "expiration_date", nullable = false, length = 10)
    private String expirationDate;

    @Column(name = "created_by", nullable = false, updatable = false, length = 64)
    private String createdBy;

    protected Announcement() {
    }

    public Announcement(String message, String startDate, String expirationDate, String createdBy) {
        this.message = message;
        this.startDate = startDate;
        this.expirationDate = expirationDate;
        this.createdBy = createdBy;
    }

    /**
     * Whether the announcement is on the board for the given ISO date. Plain string comparison is
     * chronological because the format is fixed-width and zero-padded.
     */
    public boolean isActiveOn(String isoDate) {
        if (startDate != null && isoDate.compareTo(startDate) < 0) {
            return false;
        }
        return isoDate.compareTo(expirationDate) <= 0;
    }

    public UUID getId() {
        return id;
    }

    public String getMessage() {
        return message;
    }

    public String getStartDate() {
        return startDate;
    }

    public String getExpirationDate() {
        return expirationDate;
    }

    public String getCreatedBy() {
        return createdBy;
    }
}
