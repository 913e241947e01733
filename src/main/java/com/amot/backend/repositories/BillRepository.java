package com.amot.backend.repositories;

import com.amot.backend.entities.Bill;
import com.amot.backend.enums.PaymentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface BillRepository extends JpaRepository<Bill, UUID> {

    @Query("""
            select distinct b from Bill b
            left join b.splits s
            where b.paidBy = :userId or s.userId = :userId
            order by b.createdAt desc
            """)
    List<Bill> findInvolvingUser(@Param("userId") String userId);

    List<Bill> findByGroupIdOrderByCreatedAtDesc(String groupId);

    @Query("""
            select distinct b from Bill b
            join b.splits s
            where b.groupId = :groupId
              and s.userId <> b.paidBy
              and s.amount > 0
              and s.paymentStatus <> :settledStatus
              and (s.userId = :userId or b.paidBy = :userId)
            order by b.createdAt desc
            """)
    List<Bill> findByGroupWithOpenShareFor(
            @Param("groupId") String groupId,
            @Param("userId") String userId,
            @Param("settledStatus") PaymentStatus settledStatus
    );
}
