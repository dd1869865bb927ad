package com.gt.srs.card;

import com.gt.srs.conf.CachingConfig;
import com.gt.srs.model.Card;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

// Read-only access to cards. Cards are written by the content pipeline, never by this service.
@Component
public class CardService {

    private final CardDao cardDao;

    @Autowired
    public CardService(CardDao cardDao) {
        this.cardDao = cardDao;
    }

    // Missing cards are not cached so a card created after a failed lookup is found on the next call
    @Cacheable(value = CachingConfig.CARDS, unless = "#result == null")
    public Card loadCard(long cardId) {
        return cardDao.loadCard(cardId);
    }
}
