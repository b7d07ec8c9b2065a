package tech.yump.envr.service;

import tech.yump.envr.store.InvalidVersionException;
import tech.yump.envr.store.UnknownStoreException;
import tech.yump.envr.store.WriteOnlyStoreException;

public interface SecretTransferService {

    /**
     * Copies every readable secret of {@code from} into {@code to}, both opened with the same
     * project, domain and version. Keys are carried by export name, so the target applies its own
     * key grammar.
     *
     * @return the number of secrets written
     * @throws WriteOnlyStoreException if {@code from} cannot be read
     * @throws UnknownStoreException   if either store id is unknown
     * @throws InvalidVersionException if {@code version} is not valid for either store
     */
    int push(String from, String to, String project, String domain, String version);

    /**
     * The same copy seen from the receiving side: {@code into} is filled from {@code from}.
     */
    default int pull(String from, String into, String project, String domain, String version) {
        return push(from, into, project, domain, version);
    }

    /**
     * Renders every secret of a store in {@code format}, keyed by export name and sorted.
     *
     * @throws WriteOnlyStoreException if the store cannot be read
     */
    String export(String store, String project, String domain, String version, ExportFormat format);

    /**
     * Renders the commands that remove from a shell every variable {@link #export} would set.
     * Only key names are needed, so write-only stores that can list keys are accepted. For a
     * domain-tracking store opened without a domain, the names of every tracked domain are included.
     */
    String unexport(String store, String project, String domain, String version, UnexportFormat format);

    /**
     * Renders an AWS CodeBuild {@code env.parameter-store} block mapping each keychain name of the
     * scope to {@code <prefix><name>}. The prefix is {@code prefix} when given, else the domain's
     * configured prefix, else {@code /envr/}, always ending in {@code /}.
     *
     * @return the YAML block, or the empty string when the keychain holds no names for the scope
     */
    String generateCodebuildEnv(String project, String domain, String prefix, String env);

    /**
     * Parses {@code content} and writes every pair into {@code store}, through domain tracking when
     * the store supports it. JSON and YAML may be flat, nested by domain, or nested by domain and
     * project; nesting is flattened into the target scope.
     *
     * @return the number of secrets written
     * @throws IllegalArgumentException if the content does not parse or is not an object
     */
    int importInto(String store, String project, String domain, String version, ImportFormat format, String content);
}
