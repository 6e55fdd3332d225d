package io.credway.core.creds;

import java.util.ServiceLoader;
import com.google.inject.Binder;
import com.google.inject.Module;
import io.credway.spi.Extension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads credential manager extensions with java.util.ServiceLoader.
 * Jar packages providing an extension include a
 * META-INF/services/io.credway.spi.Extension file naming the extension class.
 */
public class CredentialsExtensionLoader
        implements Module
{
    private static final Logger logger = LoggerFactory.getLogger(CredentialsExtensionLoader.class);

    private final ClassLoader classLoader;

    public CredentialsExtensionLoader()
    {
        this(CredentialsExtensionLoader.class.getClassLoader());
    }

    public CredentialsExtensionLoader(ClassLoader classLoader)
    {
        this.classLoader = classLoader;
    }

    @Override
    public void configure(Binder binder)
    {
        ServiceLoader<Extension> serviceLoader = ServiceLoader.load(Extension.class, classLoader);
        for (Extension extension : serviceLoader) {
            logger.debug("Loading extension {}", extension.getClass().getName());
            for (Module module : extension.getModules()) {
                module.configure(binder);
            }
        }
    }
}
