package io.credway.aws.creds.secretsmanager;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.secretsmanager.AWSSecretsManager;
import com.amazonaws.services.secretsmanager.model.GetSecretValueRequest;
import com.amazonaws.services.secretsmanager.model.GetSecretValueResult;
import com.amazonaws.services.secretsmanager.model.InvalidRequestException;
import com.amazonaws.services.secretsmanager.model.ResourceNotFoundException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.credway.aws.creds.AwsClients;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.spi.Secrets;
import io.credway.util.SecretTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads secrets from AWS Secrets Manager.
 *
 * A secret string holding a JSON object is returned as a map of its fields. Any other
 * string is returned as is, and binary secrets as a byte array.
 */
public class AwsSecretsManagerSecrets
        implements Secrets
{
    private static final Logger logger = LoggerFactory.getLogger(AwsSecretsManagerSecrets.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private final AWSSecretsManager client;
    private final List<SecretTemplate> templates;
    private final ObjectMapper mapper;

    public AwsSecretsManagerSecrets(AWSSecretsManager client, List<SecretTemplate> templates, ObjectMapper mapper)
    {
        this.client = client;
        this.templates = ImmutableList.copyOf(templates);
        this.mapper = mapper;
    }

    @Override
    public List<SecretLookupPath> newSecretLookupPaths(String team, String pipeline, boolean allowRootPath)
    {
        return AwsClients.lookupPaths(templates, team, pipeline);
    }

    @Override
    public Optional<SecretValue> get(String secretPath)
    {
        GetSecretValueResult result;
        try {
            result = client.getSecretValue(new GetSecretValueRequest().withSecretId(secretPath));
        }
        catch (ResourceNotFoundException ex) {
            return Optional.absent();
        }
        catch (InvalidRequestException ex) {
            if (ex.getErrorMessage() != null && ex.getErrorMessage().contains("marked for deletion")) {
                logger.debug("Secret {} is marked for deletion", secretPath);
                return Optional.absent();
            }
            throw AwsClients.translate("Failed to read secret " + secretPath, ex);
        }
        catch (SdkClientException ex) {
            throw AwsClients.translate("Failed to read secret " + secretPath, ex);
        }

        if (result.getSecretString() != null) {
            return Optional.of(SecretValue.of(parseString(result.getSecretString())));
        }
        if (result.getSecretBinary() != null) {
            ByteBuffer buffer = result.getSecretBinary().duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return Optional.of(SecretValue.of(bytes));
        }
        return Optional.absent();
    }

    private Object parseString(String value)
    {
        if (!value.trim().startsWith("{")) {
            return value;
        }
        try {
            return mapper.readValue(value, MAP_TYPE);
        }
        catch (IOException ex) {
            return value;
        }
    }
}
