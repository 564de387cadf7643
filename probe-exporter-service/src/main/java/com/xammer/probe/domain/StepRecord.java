package com.xammer.probe.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class StepRecord {
    private String step;
    private Instant completedAt;
}
