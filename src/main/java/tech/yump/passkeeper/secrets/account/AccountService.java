package tech.yump.passkeeper.secrets.account;

import org.springframework.stereotype.Service;
import tech.yump.passkeeper.crypto.FieldCipher;
import tech.yump.passkeeper.secrets.AbstractSecretService;
import tech.yump.passkeeper.sync.SyncTracker;

/**
 * Login/password pairs. Login and server stay searchable; password and meta are encrypted.
 */
@Service
public class AccountService extends AbstractSecretService<AccountInput, StoredAccount, AccountSecret, AccountItem> {

    public AccountService(AccountStorage accountStorage, FieldCipher fieldCipher, SyncTracker syncTracker) {
        super("Account", accountStorage, fieldCipher, syncTracker);
    }

    @Override
    protected AccountInput validate(AccountInput input) {
        requireText(input.login(), "login");
        requireText(input.server(), "server");
        return input;
    }

    @Override
    protected StoredAccount seal(String ownerId, AccountInput input) {
        return new StoredAccount(
                null,
                input.login(),
                input.server(),
                encryptField(input.password()),
                encryptField(input.meta()));
    }

    @Override
    protected AccountSecret unseal(String ownerId, StoredAccount record) {
        return new AccountSecret(
                record.id(),
                record.login(),
                record.server(),
                decryptField(record.password()),
                decryptField(record.meta()));
    }
}
