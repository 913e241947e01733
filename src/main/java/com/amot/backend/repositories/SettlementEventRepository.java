package com.amot.backend.repositories;

import com.amot.backend.entities.SettlementEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SettlementEventRepository extends JpaRepository<SettlementEvent, UUID> {

    List<SettlementEvent> findByBillIdAndDebtorUserIdOrderByOccurredAtAsc(UUID billId, String debtorUserId);

    void deleteByBillId(UUID billId);
}
