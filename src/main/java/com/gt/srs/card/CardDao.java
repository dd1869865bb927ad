package com.gt.srs.card;

import com.gt.srs.model.Card;

import java.util.Collection;
import java.util.List;

public interface CardDao {

    Card loadCard(long cardId);

    List<Card> loadCards(Collection<Long> cardIds);
}
