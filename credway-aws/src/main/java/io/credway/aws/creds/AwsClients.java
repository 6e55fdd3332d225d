package io.credway.aws.creds;

import java.util.List;
import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.BasicSessionCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.retry.RetryUtils;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.credway.spi.SecretBackendException;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.TransientBackendException;
import io.credway.util.SecretLookupWithTemplate;
import io.credway.util.SecretTemplate;

public class AwsClients
{
    private AwsClients()
    { }

    public static AWSCredentialsProvider credentialsProvider(AwsCredentialsConfig config)
    {
        if (config.getAccessKey().isPresent()) {
            if (config.getSessionToken().isPresent()) {
                return new AWSStaticCredentialsProvider(new BasicSessionCredentials(
                            config.getAccessKey().get(),
                            config.getSecretKey().get(),
                            config.getSessionToken().get()));
            }
            return new AWSStaticCredentialsProvider(new BasicAWSCredentials(
                        config.getAccessKey().get(),
                        config.getSecretKey().get()));
        }
        else {
            return new DefaultAWSCredentialsProviderChain();
        }
    }

    public static List<SecretLookupPath> lookupPaths(List<SecretTemplate> templates, String team, String pipeline)
    {
        ImmutableList.Builder<SecretLookupPath> paths = ImmutableList.builder();
        for (SecretTemplate template : templates) {
            Optional<SecretLookupPath> path = SecretLookupWithTemplate.of(template, team, pipeline);
            if (path.isPresent()) {
                paths.add(path.get());
            }
        }
        return paths.build();
    }

    /**
     * Maps an SDK failure to a backend exception. Throttling, server errors and
     * failures without a response are transient.
     */
    public static SecretBackendException translate(String message, SdkClientException ex)
    {
        if (ex instanceof AmazonServiceException) {
            AmazonServiceException service = (AmazonServiceException) ex;
            if (RetryUtils.isThrottlingException(service)
                    || RetryUtils.isRetryableServiceException(service)
                    || service.getStatusCode() == 408) {
                return new TransientBackendException(message + ": " + ex.getMessage(), ex);
            }
            return new SecretBackendException(message + ": " + ex.getMessage(), ex);
        }
        return new TransientBackendException(message + ": " + ex.getMessage(), ex);
    }
}
