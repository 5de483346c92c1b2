package tech.yump.passkeeper.secrets.card;

import tech.yump.passkeeper.secrets.SecretStorage;

public interface CardStorage extends SecretStorage<StoredCard, CardItem> {
}
