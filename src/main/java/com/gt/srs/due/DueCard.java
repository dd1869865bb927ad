package com.gt.srs.due;

import com.gt.srs.model.Card;
import com.gt.srs.model.Progress;

// progress is null for a card the learner has never reviewed
public record DueCard(Card card, Progress progress) {

    public boolean isNew() {
        return progress == null;
    }
}
