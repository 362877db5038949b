package com.lastchair.model;

public enum PlayerSide {
    A,
    B
}
