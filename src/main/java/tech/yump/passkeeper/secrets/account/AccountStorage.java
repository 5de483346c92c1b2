package tech.yump.passkeeper.secrets.account;

import tech.yump.passkeeper.secrets.SecretStorage;

public interface AccountStorage extends SecretStorage<StoredAccount, AccountItem> {
}
