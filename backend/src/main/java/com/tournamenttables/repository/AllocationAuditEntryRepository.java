package com.tournamenttables.repository;

import com.tournamenttables.model.AllocationAuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AllocationAuditEntryRepository extends JpaRepository<AllocationAuditEntry, Long> {
    List<AllocationAuditEntry> findByAllocationIdOrderByRecordedAtAscIdAsc(Long allocationId);

    List<AllocationAuditEntry> findByRoundIdOrderByIdAsc(Long roundId);
}
