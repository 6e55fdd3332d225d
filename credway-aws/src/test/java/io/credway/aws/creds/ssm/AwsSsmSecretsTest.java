package io.credway.aws.creds.ssm;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.simplesystemsmanagement.AWSSimpleSystemsManagement;
import com.amazonaws.services.simplesystemsmanagement.model.GetParameterRequest;
import com.amazonaws.services.simplesystemsmanagement.model.GetParameterResult;
import com.amazonaws.services.simplesystemsmanagement.model.GetParametersByPathRequest;
import com.amazonaws.services.simplesystemsmanagement.model.GetParametersByPathResult;
import com.amazonaws.services.simplesystemsmanagement.model.Parameter;
import com.amazonaws.services.simplesystemsmanagement.model.ParameterNotFoundException;
import com.google.common.collect.ImmutableMap;
import io.credway.aws.creds.AwsCredentialsConfig;
import io.credway.spi.TransientBackendException;
import io.credway.spi.config.ConfigFactory;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class AwsSsmSecretsTest
{
    @Mock AWSSimpleSystemsManagement client;

    private final ConfigFactory configFactory = new ConfigFactory(ConfigFactory.objectMapper());

    private AwsSsmSecrets secrets;

    @Before
    public void setUp()
    {
        AwsCredentialsConfig config = AwsCredentialsConfig.convertFrom(configFactory.create().set("region", "eu-west-1"));
        secrets = new AwsSsmSecrets(client, config.compileTemplates());
    }

    @Test
    public void readsDecryptedParameter()
    {
        when(client.getParameter(any(GetParameterRequest.class))).thenReturn(new GetParameterResult()
                .withParameter(new Parameter().withName("/concourse/main/token").withValue("s3cr3t")));

        assertThat(secrets.get("/concourse/main/token").get().getValue(), is("s3cr3t"));

        ArgumentCaptor<GetParameterRequest> request = ArgumentCaptor.forClass(GetParameterRequest.class);
        verify(client).getParameter(request.capture());
        assertThat(request.getValue().getName(), is("/concourse/main/token"));
        assertThat(request.getValue().getWithDecryption(), is(true));
        verify(client, never()).getParametersByPath(any(GetParametersByPathRequest.class));
    }

    @Test
    public void fallsBackToParametersUnderPath()
    {
        when(client.getParameter(any(GetParameterRequest.class))).thenThrow(new ParameterNotFoundException("missing"));
        when(client.getParametersByPath(any(GetParametersByPathRequest.class))).thenReturn(
                new GetParametersByPathResult()
                    .withParameters(new Parameter().withName("/concourse/main/db/user").withValue("admin"))
                    .withNextToken("page-2"),
                new GetParametersByPathResult()
                    .withParameters(new Parameter().withName("/concourse/main/db/tls/ca").withValue("pem")));

        Object value = secrets.get("/concourse/main/db").get().getValue();

        assertThat(value, is(ImmutableMap.of("user", "admin", "tls/ca", "pem")));

        ArgumentCaptor<GetParametersByPathRequest> request = ArgumentCaptor.forClass(GetParametersByPathRequest.class);
        verify(client, times(2)).getParametersByPath(request.capture());
        assertThat(request.getAllValues().get(0).getPath(), is("/concourse/main/db"));
        assertThat(request.getAllValues().get(0).getRecursive(), is(true));
        assertThat(request.getAllValues().get(0).getNextToken(), is(nullValue()));
        assertThat(request.getAllValues().get(1).getNextToken(), is("page-2"));
    }

    @Test
    public void emptyPathIsAbsent()
    {
        when(client.getParameter(any(GetParameterRequest.class))).thenThrow(new ParameterNotFoundException("missing"));
        when(client.getParametersByPath(any(GetParametersByPathRequest.class))).thenReturn(new GetParametersByPathResult());

        assertThat(secrets.get("/concourse/main/nothing").isPresent(), is(false));
    }

    @Test
    public void clientFailuresAreTransient()
    {
        when(client.getParameter(any(GetParameterRequest.class))).thenThrow(new SdkClientException("timeout"));

        assertThrows(TransientBackendException.class, () -> secrets.get("/concourse/main/token"));
    }
}
