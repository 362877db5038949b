package com.lastchair.model;

public enum MatchStatus {
    WAITING,
    ACTIVE,
    FINISHED
}
