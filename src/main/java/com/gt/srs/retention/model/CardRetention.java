package com.gt.srs.retention.model;

import java.time.Instant;

public record CardRetention(long cardId,
                            double stability,
                            double retrievability,
                            RetentionLevel level,
                            long daysUntilReview,
                            Instant nextDueAt,
                            Instant lastReviewAt) { }
