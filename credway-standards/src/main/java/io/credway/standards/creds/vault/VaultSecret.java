package io.credway.standards.creds.vault;

import java.time.Duration;
import java.util.Map;

public final class VaultSecret
{
    private final Map<String, Object> data;
    private final Duration lease;

    public VaultSecret(Map<String, Object> data, Duration lease)
    {
        this.data = data;
        this.lease = lease;
    }

    public Map<String, Object> getData()
    {
        return data;
    }

    /**
     * Lease of the secret, or zero when the backend did not set one.
     */
    public Duration getLease()
    {
        return lease;
    }

    @Override
    public String toString()
    {
        return "VaultSecret{fields=" + data.keySet() + ", lease=" + lease + "}";
    }
}
