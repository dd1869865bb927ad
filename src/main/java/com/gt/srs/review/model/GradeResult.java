package com.gt.srs.review.model;

import com.gt.srs.model.Progress;
import com.gt.srs.model.ProgressStatus;

import java.time.Instant;

public record GradeResult(Instant nextDueAt, double stability, double difficulty, ProgressStatus status) {

    public static GradeResult fromProgress(Progress progress) {
        return new GradeResult(progress.nextDueAt(), progress.stability(), progress.difficulty(), progress.status());
    }
}
