package com.amot.backend.repositories;

import com.amot.backend.entities.BillSplit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface BillSplitRepository extends JpaRepository<BillSplit, UUID> {

    Optional<BillSplit> findByBillIdAndUserId(UUID billId, String userId);
}
