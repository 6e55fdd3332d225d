package io.credway.core.creds;

import java.util.List;
import com.google.common.base.Optional;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.spi.Secrets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves variables of one team and pipeline against secrets, trying the
 * lookup paths in precedence order and stopping at the first one found.
 */
public class SecretVariables
{
    private static final Logger logger = LoggerFactory.getLogger(SecretVariables.class);

    private final Secrets secrets;
    private final List<SecretLookupPath> lookupPaths;

    public SecretVariables(Secrets secrets, String team, String pipeline, boolean allowRootPath)
    {
        this.secrets = secrets;
        this.lookupPaths = secrets.newSecretLookupPaths(team, pipeline, allowRootPath);
    }

    public Optional<Object> get(String variable)
    {
        Optional<SecretValue> secret = getSecret(variable);
        if (secret.isPresent()) {
            return Optional.of(secret.get().getValue());
        }
        return Optional.absent();
    }

    public Optional<SecretValue> getSecret(String variable)
    {
        for (SecretLookupPath lookupPath : lookupPaths) {
            String path = lookupPath.variableToSecretPath(variable);
            Optional<SecretValue> secret = secrets.get(path);
            if (secret.isPresent()) {
                logger.debug("Variable {} resolved at {}", variable, path);
                return secret;
            }
        }
        return Optional.absent();
    }
}
