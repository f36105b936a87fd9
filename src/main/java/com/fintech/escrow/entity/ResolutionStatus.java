package com.fintech.escrow.entity;

public enum ResolutionStatus {
    SUBMITTED,
    CONFIRMED,
    FAILED
}
