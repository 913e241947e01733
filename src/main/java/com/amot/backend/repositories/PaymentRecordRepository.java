package com.amot.backend.repositories;

import com.amot.backend.entities.PaymentRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface PaymentRecordRepository extends JpaRepository<PaymentRecord, UUID> {

    void deleteByBillId(UUID billId);
}
