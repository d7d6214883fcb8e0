package com.lux032.songresolver.model;

import lombok.Value;

import java.util.List;

@Value
public class BatchReport {
    List<FileOutcome> outcomes;

    public long countSuccessful() {
        return outcomes.stream().filter(FileOutcome::isSuccess).count();
    }

    public long countInState(ResolutionState state) {
        return outcomes.stream()
            .filter(outcome -> outcome.getResolution() != null && outcome.getResolution().getState() == state)
            .count();
    }

    public boolean allSucceeded() {
        return countSuccessful() == outcomes.size();
    }
}
