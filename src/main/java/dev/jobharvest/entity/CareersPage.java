package dev.jobharvest.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Page-fetch bookkeeping for careers pages. The table is created with the
 * cache but is not written by the extraction flow yet.
 */
@Data
@Entity
@NoArgsConstructor
@Table(name = "careers_pages")
public class CareersPage {

    @Id
    @Column(length = 2048)
    private String url;

    @Column(name = "last_fetched_at")
    private LocalDateTime lastFetchedAt;

    private String status;
}
