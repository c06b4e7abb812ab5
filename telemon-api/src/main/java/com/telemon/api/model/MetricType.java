package com.telemon.api.model;

public enum MetricType {
    COUNTER,
    GAUGE,
    HISTOGRAM,
    SUMMARY
}
