package io.credway.spi;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * A secret as returned by a backend.
 *
 * {@code getValue()} is a String, a {@code Map<String, Object>} of fields, or a byte array
 * for binary secrets.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSecretValue.class)
@JsonDeserialize(as = ImmutableSecretValue.class)
public interface SecretValue
{
    Object getValue();

    Optional<Instant> getExpiration();

    static SecretValue of(Object value)
    {
        return builder().value(value).build();
    }

    static SecretValue of(Object value, Instant expiration)
    {
        return builder().value(value).expiration(expiration).build();
    }

    static ImmutableSecretValue.Builder builder()
    {
        return ImmutableSecretValue.builder();
    }
}
