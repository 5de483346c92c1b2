package tech.yump.passkeeper.secrets.card;

import org.springframework.stereotype.Service;
import tech.yump.passkeeper.crypto.FieldCipher;
import tech.yump.passkeeper.secrets.AbstractSecretService;
import tech.yump.passkeeper.sync.SyncTracker;

/**
 * Payment cards. Name and mask stay searchable; number, CVC and PIN are encrypted.
 */
@Service
public class CardService extends AbstractSecretService<CardInput, StoredCard, CardSecret, CardItem> {

    public CardService(CardStorage cardStorage, FieldCipher fieldCipher, SyncTracker syncTracker) {
        super("Card", cardStorage, fieldCipher, syncTracker);
    }

    @Override
    protected CardInput validate(CardInput input) {
        return CardValidator.validate(input);
    }

    @Override
    protected StoredCard seal(String ownerId, CardInput card) {
        return new StoredCard(
                null,
                card.name(),
                encryptField(card.number()),
                CardValidator.mask(card.number()),
                card.month(),
                card.year(),
                encryptField(card.cvc()),
                encryptField(card.pin()));
    }

    @Override
    protected CardSecret unseal(String ownerId, StoredCard record) {
        return new CardSecret(
                record.id(),
                record.name(),
                decryptField(record.number()),
                record.month(),
                record.year(),
                decryptField(record.cvc()),
                decryptField(record.pin()));
    }
}
