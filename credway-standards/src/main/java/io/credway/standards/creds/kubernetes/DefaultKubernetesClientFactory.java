package io.credway.standards.creds.kubernetes;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import io.credway.spi.config.ConfigException;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;

import static java.nio.charset.StandardCharsets.UTF_8;

public class DefaultKubernetesClientFactory
        implements KubernetesClientFactory
{
    @Override
    public KubernetesClient newClient(final KubernetesConfig config)
    {
        final Config clientConfig;
        if (config.getConfigPath().isPresent()) {
            String path = config.getConfigPath().get();
            try {
                clientConfig = Config.fromKubeconfig(new String(Files.readAllBytes(Paths.get(path)), UTF_8));
            }
            catch (IOException e) {
                throw new ConfigException("Failed to read kubeconfig " + path, e);
            }
        }
        else {
            // picks up the service account token and CA mounted into the pod
            clientConfig = new ConfigBuilder().build();
        }
        return new DefaultKubernetesClient(new io.fabric8.kubernetes.client.DefaultKubernetesClient(clientConfig));
    }
}
