package io.credway.standards.creds.vault;

import java.time.Duration;
import java.util.List;
import com.google.common.base.Optional;
import io.credway.spi.Secrets;
import io.credway.spi.SecretsFactory;
import io.credway.util.SecretTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class VaultFactory
        implements SecretsFactory
{
    private static final Logger logger = LoggerFactory.getLogger(VaultFactory.class);

    private final SecretReader reader;
    private final ReAuther reAuther;
    private final Duration loginTimeout;
    private final String prefix;
    private final List<SecretTemplate> lookupTemplates;
    private final Optional<String> sharedPath;

    public VaultFactory(SecretReader reader, ReAuther reAuther, Duration loginTimeout,
            String prefix, List<SecretTemplate> lookupTemplates, Optional<String> sharedPath)
    {
        this.reader = reader;
        this.reAuther = reAuther;
        this.loginTimeout = loginTimeout;
        this.prefix = prefix;
        this.lookupTemplates = lookupTemplates;
        this.sharedPath = sharedPath;
    }

    /**
     * Waits up to the login timeout for the first login. The returned secrets are
     * usable either way; reads fail until a login succeeds.
     */
    @Override
    public Secrets newSecrets()
    {
        try {
            if (!reAuther.awaitLoggedIn(loginTimeout)) {
                logger.warn("Not logged in to vault after {}. Secret reads fail until login succeeds", loginTimeout);
            }
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for vault login");
        }
        return new Vault(reader, prefix, lookupTemplates, sharedPath);
    }
}
