package io.credway.standards.creds.kubernetes;

import java.util.Base64;
import java.util.Map;
import com.google.common.base.Optional;
import io.credway.spi.SecretBackendException;
import io.credway.spi.TransientBackendException;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.api.model.SecretList;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class DefaultKubernetesClientTest
{
    @Mock private io.fabric8.kubernetes.client.KubernetesClient k8s;
    @Mock private MixedOperation<Secret, SecretList, Resource<Secret>> secrets;
    @Mock private NonNamespaceOperation<Secret, SecretList, Resource<Secret>> namespaced;
    @Mock private Resource<Secret> resource;

    private DefaultKubernetesClient client;

    @Before
    public void setUp()
    {
        when(k8s.secrets()).thenReturn(secrets);
        when(secrets.inNamespace("concourse-main")).thenReturn(namespaced);
        when(namespaced.withName("db")).thenReturn(resource);
        client = new DefaultKubernetesClient(k8s);
    }

    private static String base64(String value)
    {
        return Base64.getEncoder().encodeToString(value.getBytes(UTF_8));
    }

    @Test
    public void decodesSecretData()
    {
        when(resource.get()).thenReturn(new SecretBuilder()
                .withNewMetadata().withName("db").withNamespace("concourse-main").endMetadata()
                .addToData("username", base64("admin"))
                .addToData("password", base64("s3cr3t"))
                .build());

        Map<String, String> data = client.getSecretData("concourse-main", "db").get();

        assertThat(data.get("username"), is("admin"));
        assertThat(data.get("password"), is("s3cr3t"));
    }

    @Test
    public void missingSecretIsAbsent()
    {
        when(resource.get()).thenReturn(null);

        assertThat(client.getSecretData("concourse-main", "db"), is(Optional.<Map<String, String>>absent()));
    }

    @Test
    public void forbiddenIsNotTransient()
    {
        when(resource.get()).thenThrow(new KubernetesClientException("secrets \"db\" is forbidden", 403, null));

        SecretBackendException ex = assertThrows(SecretBackendException.class,
                () -> client.getSecretData("concourse-main", "db"));
        assertThat(ex, not(instanceOf(TransientBackendException.class)));
    }

    @Test
    public void connectionFailureIsTransient()
    {
        when(resource.get()).thenThrow(new KubernetesClientException("connect timed out"));

        assertThrows(TransientBackendException.class, () -> client.getSecretData("concourse-main", "db"));
    }
}
