package tech.yump.passkeeper.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.passkeeper.crypto.BlobCipher;
import tech.yump.passkeeper.crypto.FieldCipher;

import java.time.Clock;

/**
 * Builds the ciphers from the configured keys once at startup. Invalid keys abort startup.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class CryptoConfig {

    private final PassKeeperProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FieldCipher fieldCipher(Clock clock) {
        PassKeeperProperties.SecurityProperties security = properties.security();
        log.debug("Creating FieldCipher from passkeeper.security.fernet-key.");
        return new FieldCipher(security.fernetKey(), security.fieldsIssuedAfter(), clock);
    }

    @Bean
    public BlobCipher blobCipher() {
        log.debug("Creating BlobCipher from passkeeper.security.aes-key.");
        return new BlobCipher(properties.security().aesKey());
    }
}
