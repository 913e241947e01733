package com.amot.backend.services.ledger;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

/**
 * Reduces a bill's shares to debtor → payer edges. Star topology around the payer;
 * edges of different bills are never netted against each other.
 */
@Component
public class PaymentGraphBuilder {

    public List<PaymentEdge> buildPaymentEdges(String paidBy, List<Share> shares) {
        List<PaymentEdge> edges = new ArrayList<>();
        if (paidBy == null || shares == null) {
            return edges;
        }

        for (Share share : shares) {
            if (share == null || paidBy.equals(share.userId())) continue;
            if (!MoneyUtils.isPositive(share.amount())) continue;

            edges.add(new PaymentEdge(
                    share.userId(),
                    paidBy,
                    MoneyUtils.round(share.amount()),
                    share.paymentStatus(),
                    share.markedPaidAt(),
                    share.confirmedAt()
            ));
        }
        return edges;
    }
}
