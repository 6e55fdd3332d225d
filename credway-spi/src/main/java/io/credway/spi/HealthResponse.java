package io.credway.spi;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableHealthResponse.class)
@JsonDeserialize(as = ImmutableHealthResponse.class)
public interface HealthResponse
{
    String getMethod();

    Optional<Object> getResponse();

    Optional<String> getError();

    default boolean isHealthy()
    {
        return !getError().isPresent();
    }

    static HealthResponse ok(String method, Object response)
    {
        return ImmutableHealthResponse.builder()
            .method(method)
            .response(response)
            .build();
    }

    static HealthResponse failed(String method, String error)
    {
        return ImmutableHealthResponse.builder()
            .method(method)
            .error(error)
            .build();
    }
}
