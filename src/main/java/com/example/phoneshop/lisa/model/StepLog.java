package com.example.phoneshop.lisa.model;

import java.time.Instant;

/**
 * @param elapsedMs milliseconds since the turn started when this step was recorded
 */
public record StepLog(String name, String note, Instant at, long elapsedMs) {
}
