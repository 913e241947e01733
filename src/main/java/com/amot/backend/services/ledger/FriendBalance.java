package com.amot.backend.services.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Outstanding balance with one counterpart: positive means the counterpart owes the user.
 */
public record FriendBalance(String friendId, BigDecimal balance, int billCount, LocalDateTime lastActivityAt) {
}
