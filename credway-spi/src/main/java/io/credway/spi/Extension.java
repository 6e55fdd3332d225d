package io.credway.spi;

import java.util.List;
import com.google.inject.Module;

/**
 * Entry point of a credential manager plugin jar. Implementations are listed in
 * META-INF/services/io.credway.spi.Extension and loaded with java.util.ServiceLoader.
 */
public interface Extension
{
    List<Module> getModules();
}
