package com.amot.backend.services.ledger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A line of an item-based bill and the participants sharing it.
 */
public record BillItem(String id, String name, BigDecimal price, List<String> assignedTo) {

    public BillItem {
        // may hold null ids; SplitService rejects them before splitting
        assignedTo = assignedTo == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(assignedTo));
    }
}
