package com.amot.backend.services.ledger;

import static com.amot.backend.services.ledger.MoneyUtils.orZero;
import static com.amot.backend.services.ledger.MoneyUtils.round;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

/**
 * Aggregates the bills a user takes part in. Accumulation is exact, so the result does not
 * depend on the order in which bills are supplied.
 */
@Component
public class BillLedger {

    public BillSummary summarize(String userId, List<LedgerBill> bills) {
        BigDecimal totalOwed = BigDecimal.ZERO;
        BigDecimal totalOwing = BigDecimal.ZERO;
        BigDecimal totalSettled = BigDecimal.ZERO;
        int billCount = 0;

        if (userId == null || bills == null) {
            return new BillSummary(round(totalOwed), round(totalOwing), round(totalSettled), round(BigDecimal.ZERO), 0);
        }

        for (LedgerBill bill : bills) {
            if (bill == null || !bill.involves(userId)) continue;
            billCount++;

            if (userId.equals(bill.paidBy())) {
                for (Share share : bill.shares()) {
                    if (userId.equals(share.userId())) continue;
                    if (share.isSettled()) {
                        totalSettled = totalSettled.add(orZero(share.amount()));
                    } else {
                        totalOwed = totalOwed.add(orZero(share.amount()));
                    }
                }
            } else {
                Optional<Share> own = findShare(bill, userId);
                if (own.isPresent()) {
                    Share share = own.get();
                    if (share.isSettled()) {
                        totalSettled = totalSettled.add(orZero(share.amount()));
                    } else {
                        totalOwing = totalOwing.add(orZero(share.amount()));
                    }
                }
            }
        }

        return new BillSummary(
                round(totalOwed),
                round(totalOwing),
                round(totalSettled),
                round(totalOwed.subtract(totalOwing)),
                billCount
        );
    }

    /**
     * Per-counterpart view of the outstanding (not yet confirmed) edges between {@code userId}
     * and everyone sharing a bill with them. A reporting layer only: the per-bill edges stay as they are.
     */
    public List<FriendBalance> friendBalances(String userId, List<LedgerBill> bills) {
        Map<String, Accumulator> byFriend = new TreeMap<>();
        if (userId == null || bills == null) {
            return List.of();
        }

        for (LedgerBill bill : bills) {
            if (bill == null || !bill.involves(userId)) continue;

            for (Share share : bill.shares()) {
                String friendId = share.userId();
                if (friendId == null || friendId.equals(userId)) continue;

                Accumulator acc = byFriend.computeIfAbsent(friendId, k -> new Accumulator());
                acc.billCount++;
                acc.touch(bill.updatedAt());

                if (userId.equals(bill.paidBy())) {
                    if (!share.isSettled()) {
                        acc.balance = acc.balance.add(orZero(share.amount()));
                    }
                } else if (friendId.equals(bill.paidBy())) {
                    findShare(bill, userId)
                            .filter(own -> !own.isSettled())
                            .ifPresent(own -> acc.balance = acc.balance.subtract(orZero(own.amount())));
                }
            }
        }

        List<FriendBalance> result = new ArrayList<>(byFriend.size());
        byFriend.forEach((friendId, acc) ->
                result.add(new FriendBalance(friendId, round(acc.balance), acc.billCount, acc.lastActivityAt)));
        return result;
    }

    private Optional<Share> findShare(LedgerBill bill, String userId) {
        return bill.shares().stream()
                .filter(s -> userId.equals(s.userId()))
                .findFirst();
    }

    private static final class Accumulator {
        private BigDecimal balance = BigDecimal.ZERO;
        private int billCount;
        private LocalDateTime lastActivityAt;

        private void touch(LocalDateTime at) {
            if (at != null && (lastActivityAt == null || at.isAfter(lastActivityAt))) {
                lastActivityAt = at;
            }
        }
    }
}
