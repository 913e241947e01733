package com.amot.backend.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Positive balance: the friend owes the user. Negative: the user owes the friend.
 */
public record FriendBalanceDTO(String friendId, BigDecimal balance, int billCount, LocalDateTime lastActivityAt) {
}
