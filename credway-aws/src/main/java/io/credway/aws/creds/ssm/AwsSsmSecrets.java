package io.credway.aws.creds.ssm;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.simplesystemsmanagement.AWSSimpleSystemsManagement;
import com.amazonaws.services.simplesystemsmanagement.model.GetParameterRequest;
import com.amazonaws.services.simplesystemsmanagement.model.GetParametersByPathRequest;
import com.amazonaws.services.simplesystemsmanagement.model.GetParametersByPathResult;
import com.amazonaws.services.simplesystemsmanagement.model.Parameter;
import com.amazonaws.services.simplesystemsmanagement.model.ParameterNotFoundException;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.credway.aws.creds.AwsClients;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.spi.Secrets;
import io.credway.util.SecretTemplate;

/**
 * Reads secrets from AWS SSM Parameter Store.
 *
 * A path that names a single parameter yields its decrypted value. Otherwise all parameters
 * under the path are returned as a map keyed by their name relative to the path.
 */
public class AwsSsmSecrets
        implements Secrets
{
    private final AWSSimpleSystemsManagement client;
    private final List<SecretTemplate> templates;

    public AwsSsmSecrets(AWSSimpleSystemsManagement client, List<SecretTemplate> templates)
    {
        this.client = client;
        this.templates = ImmutableList.copyOf(templates);
    }

    @Override
    public List<SecretLookupPath> newSecretLookupPaths(String team, String pipeline, boolean allowRootPath)
    {
        return AwsClients.lookupPaths(templates, team, pipeline);
    }

    @Override
    public Optional<SecretValue> get(String secretPath)
    {
        try {
            Parameter parameter = client.getParameter(new GetParameterRequest()
                    .withName(secretPath)
                    .withWithDecryption(true))
                .getParameter();
            return Optional.of(SecretValue.of(parameter.getValue()));
        }
        catch (ParameterNotFoundException ex) {
            return getByPath(secretPath);
        }
        catch (SdkClientException ex) {
            throw AwsClients.translate("Failed to read parameter " + secretPath, ex);
        }
    }

    private Optional<SecretValue> getByPath(String secretPath)
    {
        String prefix = secretPath.endsWith("/") ? secretPath : secretPath + "/";
        Map<String, Object> values = new LinkedHashMap<>();
        String nextToken = null;
        try {
            do {
                GetParametersByPathResult result = client.getParametersByPath(new GetParametersByPathRequest()
                        .withPath(secretPath)
                        .withRecursive(true)
                        .withWithDecryption(true)
                        .withNextToken(nextToken));
                for (Parameter parameter : result.getParameters()) {
                    String name = parameter.getName();
                    values.put(name.startsWith(prefix) ? name.substring(prefix.length()) : name, parameter.getValue());
                }
                nextToken = result.getNextToken();
            }
            while (nextToken != null);
        }
        catch (SdkClientException ex) {
            throw AwsClients.translate("Failed to read parameters under " + secretPath, ex);
        }

        if (values.isEmpty()) {
            return Optional.absent();
        }
        return Optional.of(SecretValue.of(values));
    }
}
