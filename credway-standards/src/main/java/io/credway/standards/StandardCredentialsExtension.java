package io.credway.standards;

import java.util.Arrays;
import java.util.List;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.credway.spi.CredentialManagerFactory;
import io.credway.spi.Extension;
import io.credway.standards.creds.conjur.ConjurManagerFactory;
import io.credway.standards.creds.dummy.DummyManagerFactory;
import io.credway.standards.creds.kubernetes.DefaultKubernetesClientFactory;
import io.credway.standards.creds.kubernetes.KubernetesClientFactory;
import io.credway.standards.creds.kubernetes.KubernetesManagerFactory;
import io.credway.standards.creds.vault.VaultManagerFactory;

public class StandardCredentialsExtension
        implements Extension
{
    @Override
    public List<Module> getModules()
    {
        return Arrays.asList(new StandardCredentialsModule());
    }

    public static class StandardCredentialsModule
            implements Module
    {
        @Override
        public void configure(Binder binder)
        {
            binder.bind(KubernetesClientFactory.class).to(DefaultKubernetesClientFactory.class).in(Scopes.SINGLETON);

            Multibinder<CredentialManagerFactory> factories = Multibinder.newSetBinder(binder, CredentialManagerFactory.class);
            factories.addBinding().to(VaultManagerFactory.class).in(Scopes.SINGLETON);
            factories.addBinding().to(ConjurManagerFactory.class).in(Scopes.SINGLETON);
            factories.addBinding().to(KubernetesManagerFactory.class).in(Scopes.SINGLETON);
            factories.addBinding().to(DummyManagerFactory.class).in(Scopes.SINGLETON);
        }
    }
}
