package com.amot.backend.enums;

public enum BillCategory {
    FOOD,
    TRANSPORT,
    UTILITIES,
    ENTERTAINMENT,
    SHOPPING,
    OTHER
}
