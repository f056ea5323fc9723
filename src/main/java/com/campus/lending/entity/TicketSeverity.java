package com.campus.lending.entity;

public enum TicketSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
