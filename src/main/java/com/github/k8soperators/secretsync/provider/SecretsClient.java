package com.github.k8soperators.secretsync.provider;

import com.github.k8soperators.secretsync.api.v1alpha1.FindSpec;
import com.github.k8soperators.secretsync.api.v1alpha1.PushRemoteRef;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecretData;
import com.github.k8soperators.secretsync.api.v1alpha1.RemoteRef;

import java.util.Map;

/**
 * Contract implemented by every provider adapter. A client is created for one
 * store and one reconciliation and is closed afterwards; implementations need
 * not be thread-safe.
 *
 * <p>
 * Failures are reported as {@link com.github.k8soperators.secretsync.SyncException}
 * with kind {@code NOT_FOUND}, {@code AUTH} or {@code TRANSIENT} so the
 * reconcilers can tell a missing key from a broken backend.
 */
public interface SecretsClient extends AutoCloseable {

    enum ValidationResult {
        READY,
        UNKNOWN,
        ERROR
    }

    /**
     * Returns the raw value of one remote reference, narrowed to
     * {@code ref.property} when set.
     *
     * @throws com.github.k8soperators.secretsync.SyncException NOT_FOUND if the key or property is absent
     */
    byte[] getSecret(RemoteRef ref);

    /**
     * Returns a structured remote value as a key/value map. An absent
     * sub-property yields an empty map.
     */
    Map<String, byte[]> getSecretMap(RemoteRef ref);

    /**
     * Discovers secrets by name pattern, path or tags. No match is an empty
     * map, not an error.
     */
    Map<String, byte[]> getAllSecrets(FindSpec find);

    /**
     * Creates or updates the remote value. Writing a value identical to the
     * current one must not cause a backend write.
     */
    void pushSecret(byte[] value, PushSecretData data);

    /**
     * Deletes the remote value; deleting an absent value succeeds.
     */
    void deleteSecret(PushRemoteRef ref);

    /**
     * Side-effect free existence check.
     */
    boolean secretExists(PushRemoteRef ref);

    ValidationResult validate();

    @Override
    void close();

}
