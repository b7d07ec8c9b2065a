package tech.yump.envr.store.keychain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.envr.store.SecretStoreException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * A list of names stored as a JSON array inside the keychain itself, next to the secrets it
 * indexes. Used for both the per-domain key manifest and the per-project domain registry.
 *
 * <p>{@link #update} is the only write path: read, apply a change, then write back the sorted,
 * de-duplicated list, or remove the entry when the list is empty. The read-modify-write is not
 * atomic across processes; two concurrent invocations against the same entry can lose an update.
 */
@Slf4j
@RequiredArgsConstructor
public class ManifestIndex {

    private static final TypeReference<List<String>> LIST_TYPE_REFERENCE = new TypeReference<>() {};

    private final KeychainClient keychainClient;
    private final ObjectMapper objectMapper;
    private final String service;

    /**
     * @return the names stored under {@code account}; empty if the entry is absent or unreadable.
     */
    public List<String> read(String account) {
        Optional<String> raw = keychainClient.getPassword(service, account);
        if (raw.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            List<String> names = objectMapper.readValue(raw.get(), LIST_TYPE_REFERENCE);
            return names == null ? new ArrayList<>() : new ArrayList<>(names);
        } catch (JsonProcessingException e) {
            log.warn("Index entry '{}' in service '{}' is not a JSON array of names; treating it as empty: {}",
                    account, service, e.getOriginalMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Applies {@code change} to the names stored under {@code account} and persists the result.
     *
     * @return the names after the change, sorted.
     */
    public List<String> update(String account, UnaryOperator<List<String>> change) {
        List<String> before = read(account);
        List<String> after = new ArrayList<>(new TreeSet<>(change.apply(new ArrayList<>(before))));
        if (after.equals(before)) {
            return after;
        }
        if (after.isEmpty()) {
            keychainClient.deletePassword(service, account);
            log.debug("Removed empty index entry '{}' in service '{}'", account, service);
        } else {
            keychainClient.setPassword(service, account, toJson(after));
            log.debug("Index entry '{}' in service '{}' now holds {} names", account, service, after.size());
        }
        return after;
    }

    public List<String> add(String account, String name) {
        return update(account, names -> {
            if (!names.contains(name)) {
                names.add(name);
            }
            return names;
        });
    }

    public List<String> remove(String account, String name) {
        return update(account, names -> {
            names.remove(name);
            return names;
        });
    }

    public void drop(String account) {
        keychainClient.deletePassword(service, account);
    }

    private String toJson(List<String> names) {
        try {
            return objectMapper.writeValueAsString(names);
        } catch (JsonProcessingException e) {
            throw new SecretStoreException("Failed to serialize index entry", e);
        }
    }
}
