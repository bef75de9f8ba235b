package com.kotsin.nox.model;

/**
 * The eight interval statistics derived per (channel, window), in column order.
 */
public enum StatisticKind {
    MEAN("mean"),
    STD("std"),
    MEAN_RATE_CHANGE("mean_rate_change"),
    RANGE_CHANGE("range_change"),
    MOMENTUM_MAX_UP("momentum_max_up"),
    MOMENTUM_MAX_DOWN("momentum_max_down"),
    MAX_INCREASE_FROM_START("max_increase_from_start"),
    MAX_DECREASE_FROM_START("max_decrease_from_start");

    private final String fragment;

    StatisticKind(String fragment) {
        this.fragment = fragment;
    }

    public String getFragment() {
        return fragment;
    }
}
