package io.credway.standards.creds.kubernetes;

public interface KubernetesClientFactory
{
    KubernetesClient newClient(KubernetesConfig config);
}
