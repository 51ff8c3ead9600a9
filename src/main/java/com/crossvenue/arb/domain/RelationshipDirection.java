package com.crossvenue.arb.domain;

public enum RelationshipDirection {
    A_IMPLIES_B,
    B_IMPLIES_A,
    SYMMETRIC,
    NONE
}
