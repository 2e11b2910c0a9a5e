package dev.jobharvest.repository;

import dev.jobharvest.entity.JobRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the persisted job records of the fingerprint cache.
 */
@Repository
public interface JobRecordRepository extends JpaRepository<JobRecord, String> {

    /**
     * Check if any record carries this fingerprint.
     */
    boolean existsByFingerprint(String fingerprint);
}
