package com.gt.srs.review.model;

import com.gt.srs.model.Progress;
import com.gt.srs.model.ProgressStatus;

import java.time.Instant;

public record ProgressSummary(double stability,
                              double difficulty,
                              ProgressStatus status,
                              Instant nextDueAt,
                              int repetitions,
                              int lapses) {

    public static ProgressSummary fromProgress(Progress progress) {
        return new ProgressSummary(progress.stability(), progress.difficulty(), progress.status(), progress.nextDueAt(),
                progress.repetitions(), progress.lapses());
    }
}
