package dev.jobharvest.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A job posting that was extracted and emitted as a row.
 * Keyed by the candidate URL it was reached through.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_fp", columnList = "fingerprint")
})
public class JobRecord {

    @Id
    @Column(length = 2048)
    private String url;

    @Column(name = "canonical_url", length = 2048)
    private String canonicalUrl;

    @Column(length = 1000)
    private String title;

    @Column(length = 500)
    private String company;

    @Column(length = 64)
    private String fingerprint;

    @Column(name = "first_seen")
    private LocalDateTime firstSeen;
}
