package com.github.k8soperators.secretsync.provider.fake;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.FindSpec;
import com.github.k8soperators.secretsync.api.v1alpha1.MetadataPolicy;
import com.github.k8soperators.secretsync.api.v1alpha1.PushRemoteRef;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecretData;
import com.github.k8soperators.secretsync.api.v1alpha1.RemoteRef;
import com.github.k8soperators.secretsync.provider.SecretValues;
import com.github.k8soperators.secretsync.provider.SecretsClient;
import io.fabric8.kubernetes.client.utils.Serialization;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

class FakeSecretsClient implements SecretsClient {

    private static final Logger log = Logger.getLogger(FakeSecretsClient.class);

    private final FakeProviderConfig config;
    private final ConcurrentMap<String, byte[]> pushed;
    private boolean closed;

    FakeSecretsClient(FakeProviderConfig config, ConcurrentMap<String, byte[]> pushed) {
        this.config = config;
        this.pushed = pushed;
    }

    @Override
    public byte[] getSecret(RemoteRef ref) {
        Optional<byte[]> found = ref.getMetadataPolicyOrDefault() == MetadataPolicy.Fetch
                ? metadata(ref.getKey(), ref.getVersion())
                : lookup(ref.getKey(), ref.getVersion());
        byte[] value = found.orElseThrow(() -> SyncException.notFound("secret %s not found", ref.getKey()));

        return SecretValues.property(ref.getKey(), value, ref.getProperty());
    }

    @Override
    public Map<String, byte[]> getSecretMap(RemoteRef ref) {
        byte[] value;

        try {
            value = getSecret(ref);
        } catch (SyncException e) {
            if (e.isNotFound() && ref.getProperty() != null && lookup(ref.getKey(), ref.getVersion()).isPresent()) {
                return Collections.emptyMap();
            }
            throw e;
        }

        return SecretValues.toMap(ref.toString(), value);
    }

    @Override
    public Map<String, byte[]> getAllSecrets(FindSpec find) {
        ensureOpen();
        Pattern name = compile(find.getNameRegexp());
        Map<String, byte[]> result = new TreeMap<>();

        for (FakeProviderConfig.Entry entry : config.getData()) {
            if (isBlank(entry.getVersion()) && matches(entry.getKey(), entry.getTags(), find, name)) {
                result.put(entry.getKey(), valueOf(entry));
            }
        }

        pushed.forEach((key, value) -> {
            if (matches(key, null, find, name)) {
                result.put(key, value);
            }
        });

        return result;
    }

    @Override
    public void pushSecret(byte[] value, PushSecretData data) {
        ensureOpen();
        PushRemoteRef ref = data.getRemoteRef();
        byte[] current = pushed.get(ref.getRemoteKey());
        byte[] desired = value;

        if (ref.getProperty() != null && !ref.getProperty().isEmpty()) {
            ObjectNode document = current != null && SecretValues.parse(current).isObject()
                    ? (ObjectNode) SecretValues.parse(current)
                    : Serialization.jsonMapper().createObjectNode();
            document.put(ref.getProperty(), new String(value, StandardCharsets.UTF_8));
            desired = SecretValues.toBytes(document);
        }

        if (Arrays.equals(current, desired)) {
            log.tracef("Remote value %s unchanged", ref);
            return;
        }

        pushed.put(ref.getRemoteKey(), desired);
        log.debugf("Remote value %s written", ref);
    }

    @Override
    public void deleteSecret(PushRemoteRef ref) {
        ensureOpen();
        byte[] current = pushed.get(ref.getRemoteKey());

        if (current == null) {
            return;
        }

        if (ref.getProperty() == null || ref.getProperty().isEmpty()) {
            pushed.remove(ref.getRemoteKey());
            return;
        }

        JsonNode document = SecretValues.parse(current);

        if (document.isObject()) {
            ((ObjectNode) document).remove(ref.getProperty());

            if (document.isEmpty()) {
                pushed.remove(ref.getRemoteKey());
            } else {
                pushed.put(ref.getRemoteKey(), SecretValues.toBytes(document));
            }
        }
    }

    @Override
    public boolean secretExists(PushRemoteRef ref) {
        Optional<byte[]> value = lookup(ref.getRemoteKey(), null);

        if (value.isEmpty() || ref.getProperty() == null || ref.getProperty().isEmpty()) {
            return value.isPresent();
        }

        JsonNode document = SecretValues.parse(value.get());
        return document.isObject() && document.has(ref.getProperty());
    }

    @Override
    public ValidationResult validate() {
        return Objects.requireNonNullElse(config.getValidationResult(), ValidationResult.READY);
    }

    @Override
    public void close() {
        closed = true;
    }

    Optional<byte[]> lookup(String key, String version) {
        ensureOpen();

        if (isBlank(version) && pushed.containsKey(key)) {
            return Optional.of(pushed.get(key));
        }

        return entry(key, version).map(FakeSecretsClient::valueOf);
    }

    /**
     * Tags of the entry as a JSON object. Pushed values carry no tags.
     */
    Optional<byte[]> metadata(String key, String version) {
        ensureOpen();

        if (isBlank(version) && pushed.containsKey(key)) {
            return Optional.of(SecretValues.toBytes(Serialization.jsonMapper().createObjectNode()));
        }

        return entry(key, version)
                .map(entry -> Objects.requireNonNullElse(entry.getTags(), Map.<String, String>of()))
                .map(tags -> SecretValues.toBytes(Serialization.jsonMapper().valueToTree(new TreeMap<>(tags))));
    }

    Optional<FakeProviderConfig.Entry> entry(String key, String version) {
        return config.getData()
                .stream()
                .filter(entry -> entry.getKey().equals(key))
                .filter(entry -> Objects.equals(normalize(entry.getVersion()), normalize(version)))
                .findFirst();
    }

    static byte[] valueOf(FakeProviderConfig.Entry entry) {
        if (entry.getValueMap() != null) {
            return SecretValues.toBytes(Serialization.jsonMapper().valueToTree(new TreeMap<>(entry.getValueMap())));
        }
        return Objects.requireNonNullElse(entry.getValue(), "").getBytes(StandardCharsets.UTF_8);
    }

    static boolean matches(String key, Map<String, String> tags, FindSpec find, Pattern name) {
        if (find.getPath() != null && !key.startsWith(find.getPath())) {
            return false;
        }
        if (name != null && !name.matcher(key).find()) {
            return false;
        }
        if (find.getTags() != null && !find.getTags().isEmpty()) {
            return tags != null && tags.entrySet().containsAll(find.getTags().entrySet());
        }
        return true;
    }

    static Pattern compile(String regexp) {
        if (regexp == null) {
            return null;
        }
        try {
            return Pattern.compile(regexp);
        } catch (PatternSyntaxException e) {
            throw SyncException.validation("invalid name regexp %s: %s", regexp, e.getDescription());
        }
    }

    void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("client already closed");
        }
    }

    static String normalize(String version) {
        return isBlank(version) ? null : version;
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
