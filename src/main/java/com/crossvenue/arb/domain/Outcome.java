package com.crossvenue.arb.domain;

public enum Outcome {
    YES, NO
}
