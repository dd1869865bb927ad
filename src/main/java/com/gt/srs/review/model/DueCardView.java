package com.gt.srs.review.model;

import com.gt.srs.due.DueCard;

// progressSummary is null for a new card
public record DueCardView(long cardId,
                          String prompt,
                          String answer,
                          String explanation,
                          ProgressSummary progressSummary) {

    public static DueCardView fromDueCard(DueCard dueCard) {
        return new DueCardView(
                dueCard.card().id(),
                dueCard.card().prompt(),
                dueCard.card().answer(),
                dueCard.card().explanation(),
                dueCard.isNew() ? null : ProgressSummary.fromProgress(dueCard.progress()));
    }
}
