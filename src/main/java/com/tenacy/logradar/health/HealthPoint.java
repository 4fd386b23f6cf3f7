package com.tenacy.logradar.health;

import lombok.Value;

import java.time.Instant;

@Value
public class HealthPoint {
    Instant timestamp;
    double score;
}
