package com.amot.backend.services;

import static com.amot.backend.services.ledger.MoneyUtils.fitsScale;
import static com.amot.backend.services.ledger.MoneyUtils.format;
import static com.amot.backend.services.ledger.MoneyUtils.round;
import static com.amot.backend.services.ledger.MoneyUtils.withinTolerance;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.amot.backend.dto.SplitPreviewRequestDTO;
import com.amot.backend.dto.SplitPreviewResponseDTO;
import com.amot.backend.enums.SplitMethod;
import com.amot.backend.mappers.BillMapper;
import com.amot.backend.services.ledger.BillItem;
import com.amot.backend.services.ledger.Share;
import com.amot.backend.services.ledger.SplitCalculator;
import com.amot.backend.services.ledger.SplitOutcome;
import com.amot.backend.services.ledger.ValidationResult;

import lombok.RequiredArgsConstructor;

/**
 * Resolves the shares of a bill from the chosen split method and checks them against the bill invariant
 * (one share per participant, amounts adding up to the total within a cent).
 * Problems are reported in the returned {@link SplitOutcome}; nothing is thrown for invalid input.
 */
@Service
@RequiredArgsConstructor
public class SplitService {

    private final SplitCalculator splitCalculator;

    public SplitOutcome calculate(
            SplitMethod method,
            BigDecimal totalAmount,
            List<String> participants,
            List<Share> requested,
            List<BillItem> items
    ) {
        if (method == null) {
            return SplitOutcome.rejected("splitMethod is required");
        }
        if (totalAmount == null || totalAmount.signum() <= 0) {
            return SplitOutcome.rejected("totalAmount must be greater than zero");
        }
        if (!fitsScale(totalAmount)) {
            return SplitOutcome.rejected("totalAmount must have at most 2 decimal places");
        }

        String participantError = participantError(participants);
        if (participantError != null) {
            return SplitOutcome.rejected(participantError);
        }

        List<Share> shares;
        switch (method) {
            case EQUAL -> shares = splitCalculator.equalSplit(totalAmount, participants);
            case CUSTOM -> {
                String coverage = coverageError(requested, participants);
                if (coverage != null) return SplitOutcome.rejected(coverage);

                shares = inParticipantOrder(requested, participants);
                ValidationResult custom = splitCalculator.validateCustomSplit(shares, totalAmount);
                if (!custom.valid()) return new SplitOutcome(shares, custom);
            }
            case PERCENTAGE -> {
                String coverage = coverageError(requested, participants);
                if (coverage != null) return SplitOutcome.rejected(coverage);

                List<Share> ordered = inParticipantOrder(requested, participants);
                ValidationResult percentages = splitCalculator.validatePercentageSplit(ordered);
                if (!percentages.valid()) return new SplitOutcome(ordered, percentages);

                shares = splitCalculator.percentageSplit(totalAmount, ordered);
            }
            case ITEM_BASED -> {
                if (items != null && !items.isEmpty()) {
                    String itemError = itemError(items);
                    if (itemError != null) return SplitOutcome.rejected(itemError);
                    shares = splitCalculator.itemBasedSplit(items, participants);
                } else {
                    String coverage = coverageError(requested, participants);
                    if (coverage != null) return SplitOutcome.rejected(coverage);
                    shares = inParticipantOrder(requested, participants);
                }
            }
            default -> {
                return SplitOutcome.rejected("Unsupported split method: " + method);
            }
        }

        for (Share share : shares) {
            if (share.amount() != null && share.amount().signum() < 0) {
                return new SplitOutcome(shares, ValidationResult.invalid(
                        "Split amount for " + share.userId() + " cannot be negative", null));
            }
        }

        BigDecimal splitsTotal = round(splitCalculator.sumAmounts(shares));
        if (!withinTolerance(splitsTotal, totalAmount)) {
            return new SplitOutcome(shares, ValidationResult.invalid(
                    "Split amounts must equal the total bill amount. Expected: " + format(totalAmount)
                            + ", current total: " + format(splitsTotal),
                    splitsTotal
            ));
        }

        List<Share> normalized = shares.stream()
                .map(s -> s.withAmount(round(s.amount())))
                .toList();
        return new SplitOutcome(normalized, ValidationResult.ok(splitsTotal));
    }

    public SplitPreviewResponseDTO preview(SplitPreviewRequestDTO dto) {
        List<Share> requested = dto.getSplits() == null ? List.of()
                : dto.getSplits().stream().map(BillMapper::toShare).toList();
        List<BillItem> items = dto.getItems() == null ? List.of()
                : dto.getItems().stream().map(BillMapper::toBillItem).toList();

        SplitOutcome outcome = calculate(dto.getSplitMethod(), dto.getTotalAmount(), dto.getParticipants(), requested, items);

        SplitPreviewResponseDTO response = new SplitPreviewResponseDTO();
        response.setSplitMethod(dto.getSplitMethod());
        response.setValid(outcome.isValid());
        response.setError(outcome.validation().error());
        response.setTotalAmount(dto.getTotalAmount());
        response.setSplitsTotal(round(splitCalculator.sumAmounts(outcome.shares())));
        response.setSplits(outcome.shares().stream().map(BillMapper::toShareAmountDTO).toList());
        return response;
    }

    private String itemError(List<BillItem> items) {
        for (BillItem item : items) {
            if (item == null) {
                return "Items cannot be empty";
            }
            if (!fitsScale(item.price())) {
                return "Price of " + item.name() + " must have at most 2 decimal places";
            }
            for (String assignee : item.assignedTo()) {
                if (assignee == null || assignee.isBlank()) {
                    return "Item " + item.name() + " has a blank assignee";
                }
            }
        }
        return null;
    }

    private String participantError(List<String> participants) {
        if (participants == null || participants.isEmpty()) {
            return "At least one participant is required";
        }
        Set<String> seen = new HashSet<>();
        for (String id : participants) {
            if (id == null || id.isBlank()) {
                return "Participant id cannot be blank";
            }
            if (!seen.add(id)) {
                return "Participant " + id + " is listed more than once";
            }
        }
        return null;
    }

    // splits must name every participant exactly once and nobody else
    private String coverageError(List<Share> requested, List<String> participants) {
        if (requested == null || requested.isEmpty()) {
            return "Splits are required for this split method";
        }
        Set<String> expected = new HashSet<>(participants);
        Set<String> seen = new HashSet<>();
        for (Share share : requested) {
            if (share == null || share.userId() == null) {
                return "Every split needs a userId";
            }
            if (!expected.contains(share.userId())) {
                return "Split for " + share.userId() + " does not belong to a participant";
            }
            if (!seen.add(share.userId())) {
                return "Participant " + share.userId() + " has more than one split";
            }
            if (!fitsScale(share.amount())) {
                return "Split amount for " + share.userId() + " must have at most 2 decimal places";
            }
        }
        if (seen.size() != expected.size()) {
            List<String> missing = new ArrayList<>(expected);
            missing.removeAll(seen);
            missing.sort(Comparator.naturalOrder());
            return "Missing split for participants: " + String.join(", ", missing);
        }
        return null;
    }

    private List<Share> inParticipantOrder(List<Share> requested, List<String> participants) {
        Map<String, Integer> order = new HashMap<>();
        for (int i = 0; i < participants.size(); i++) {
            order.put(participants.get(i), i);
        }
        return requested.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingInt(s -> order.getOrDefault(s.userId(), Integer.MAX_VALUE)))
                .toList();
    }
}
