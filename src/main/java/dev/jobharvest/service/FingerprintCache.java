package dev.jobharvest.service;

import dev.jobharvest.entity.JobRecord;
import dev.jobharvest.repository.JobRecordRepository;
import dev.jobharvest.util.HashUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Persisted dedup cache backed by SQLite.
 * <p>
 * Each operation runs on its own; no transaction spans a check and the following
 * write, so two workers racing on the same fingerprint may both insert.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FingerprintCache {

    private final JobRecordRepository jobRecordRepository;

    /**
     * Identity of a posting independent of the URL it was reached through.
     */
    public static String fingerprint(String canonicalUrl, String title, String company) {
        return HashUtils.sha256Hex(nullToEmpty(canonicalUrl) + "||" + nullToEmpty(title) + "||" + nullToEmpty(company));
    }

    /**
     * Check if a candidate URL was already recorded.
     */
    public boolean isJobSeen(String url) {
        return jobRecordRepository.existsById(url);
    }

    public boolean isFingerprintSeen(String fingerprint) {
        return jobRecordRepository.existsByFingerprint(fingerprint);
    }

    /**
     * Insert or replace the record for {@code url}.
     */
    @Transactional
    public void markJobSeen(String url, String canonicalUrl, String title, String company, String fingerprint) {
        jobRecordRepository.save(JobRecord.builder()
                .url(url)
                .canonicalUrl(canonicalUrl)
                .title(title)
                .company(company)
                .fingerprint(fingerprint)
                .firstSeen(LocalDateTime.now())
                .build());
        log.debug("Cached job {} (fingerprint {})", url, fingerprint);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
