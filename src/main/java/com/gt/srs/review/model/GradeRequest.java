package com.gt.srs.review.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A graded review as submitted by a client.
 *
 * @param grade           raw grade value, 1 (Again) to 4 (Easy)
 * @param clientTimestamp review time reported by the client; only used within the configured skew tolerance
 * @param reviewEventId   idempotency key; a replay of the last applied event is not applied again
 */
public record GradeRequest(long learnerId,
                           long cardId,
                           int grade,
                           Optional<Instant> clientTimestamp,
                           Optional<String> reviewEventId) { }
