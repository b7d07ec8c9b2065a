package tech.yump.envr.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.envr.config.EnvrProperties;
import tech.yump.envr.key.KeyGrammar;
import tech.yump.envr.store.DomainTrackingStore;
import tech.yump.envr.store.SecretStore;
import tech.yump.envr.store.SecretStoreException;
import tech.yump.envr.store.SecretStoreFactory;
import tech.yump.envr.store.WriteOnlyStoreException;
import tech.yump.envr.store.file.EnvFile;
import tech.yump.envr.store.keychain.KeychainSecretStore;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class SecretTransferServiceImpl implements SecretTransferService {

    private static final Pattern SHELL_SAFE = Pattern.compile("[A-Za-z0-9_./:@%+,-]+");
    static final String DEFAULT_CODEBUILD_PREFIX = "/envr/";

    private static final ObjectMapper YAML_MAPPER = new YAMLMapper();

    private final SecretStoreFactory storeFactory;
    private final ObjectMapper objectMapper;
    private final EnvrProperties properties;

    @Override
    public int push(String from, String to, String project, String domain, String version) {
        SecretStore source = storeFactory.open(from, project, domain, version, null, null);
        SecretStore target = storeFactory.open(to, project, domain, version, null, null);
        log.info("Transferring secrets from '{}' to '{}'", source.name(), target.name());

        Map<String, String> pairs = readAll(source);
        for (Map.Entry<String, String> entry : pairs.entrySet()) {
            if (target instanceof DomainTrackingStore tracking) {
                tracking.setWithDomainTracking(entry.getKey(), entry.getValue());
            } else {
                target.set(entry.getKey(), entry.getValue());
            }
            log.debug("Transferred '{}' to '{}'", entry.getKey(), target.name());
        }
        log.info("Transferred {} secret(s) from '{}' to '{}'", pairs.size(), source.name(), target.name());
        return pairs.size();
    }

    @Override
    public String export(String store, String project, String domain, String version, ExportFormat format) {
        SecretStore source = storeFactory.open(store, project, domain, version, null, null);
        Map<String, String> pairs = readAll(source);
        log.info("Exporting {} secret(s) from '{}' as {}", pairs.size(), source.name(), format.id());
        return switch (format) {
            case DOTENV -> EnvFile.format(pairs);
            case SHELL -> render(pairs, "export %s=%s\n", SecretTransferServiceImpl::shellQuote);
            case POWERSHELL -> render(pairs, "$env:%s = %s\n", SecretTransferServiceImpl::powershellQuote);
            case JSON -> toJson(pairs);
        };
    }

    @Override
    public String unexport(String store, String project, String domain, String version, UnexportFormat format) {
        SecretStore source = storeFactory.open(store, project, domain, version, null, null);
        Set<String> names = new TreeSet<>();
        List<String> domains = !StringUtils.hasText(domain) && source instanceof DomainTrackingStore tracking
                ? tracking.listDomains()
                : List.of();
        if (domains.isEmpty()) {
            addExportNames(source, names);
        } else {
            for (String trackedDomain : domains) {
                addExportNames(storeFactory.open(store, project, trackedDomain, version, null, null), names);
            }
        }
        log.info("Rendering {} unset command(s) for '{}' as {}", names.size(), source.name(), format.id());
        StringBuilder sb = new StringBuilder();
        names.forEach(name -> sb.append(format.line(name)));
        return sb.toString();
    }

    @Override
    public String generateCodebuildEnv(String project, String domain, String prefix, String env) {
        String resolvedDomain = StringUtils.hasText(domain) ? domain : KeychainSecretStore.DESCRIPTOR.defaultNamespace();
        SecretStore keychain = storeFactory.open(KeychainSecretStore.NAME, project, resolvedDomain, null, null, null);
        Set<String> names = new TreeSet<>(keychain.listKeys());
        if (names.isEmpty()) {
            log.warn("No keychain secrets for domain '{}' to generate a CodeBuild env block from", resolvedDomain);
            return "";
        }
        String resolvedPrefix = StringUtils.hasText(prefix)
                ? prefix
                : properties.resolveDomainPrefix(resolvedDomain, env).orElse(DEFAULT_CODEBUILD_PREFIX);
        if (!resolvedPrefix.endsWith("/")) {
            resolvedPrefix += "/";
        }
        StringBuilder sb = new StringBuilder("env:\n  parameter-store:\n");
        for (String name : names) {
            sb.append("    ").append(name).append(": ").append(resolvedPrefix).append(name).append('\n');
        }
        return sb.toString();
    }

    @Override
    public int importInto(String store, String project, String domain, String version, ImportFormat format, String content) {
        Map<String, String> pairs = switch (format) {
            case ENV -> EnvFile.parse(content == null ? "" : content);
            case JSON -> flatten(readTree(objectMapper, content, format), format);
            case YAML -> flatten(readTree(YAML_MAPPER, content, format), format);
        };
        SecretStore target = storeFactory.open(store, project, domain, version, null, null);
        if (pairs.isEmpty()) {
            log.warn("No variables found in {} import for '{}'", format.id(), target.name());
            return 0;
        }
        for (Map.Entry<String, String> entry : pairs.entrySet()) {
            if (target instanceof DomainTrackingStore tracking) {
                tracking.setWithDomainTracking(entry.getKey(), entry.getValue());
            } else {
                target.set(entry.getKey(), entry.getValue());
            }
        }
        log.info("Imported {} variable(s) into '{}' from {}", pairs.size(), target.name(), format.id());
        return pairs.size();
    }

    private static JsonNode readTree(ObjectMapper mapper, String content, ImportFormat format) {
        try {
            return mapper.readTree(content == null ? "" : content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid " + format.id().toUpperCase(Locale.ROOT) + " content: "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * Flattens {@code {KEY: value}}, {@code {domain: {KEY: value}}} or
     * {@code {domain: {project: {KEY: value}}}} into one map. The shape is decided by the first
     * entry; branches that do not follow it are skipped.
     */
    static Map<String, String> flatten(JsonNode root, ImportFormat format) {
        if (root == null || !root.isObject()) {
            String what = root != null && root.isArray() ? "an object, not a list." : "an object.";
            throw new IllegalArgumentException(format.id().toUpperCase(Locale.ROOT) + " content must contain " + what);
        }
        Map<String, String> pairs = new LinkedHashMap<>();
        collect(root, nestingLevels(root), pairs);
        return pairs;
    }

    private static int nestingLevels(JsonNode root) {
        Iterator<JsonNode> values = root.elements();
        if (!values.hasNext()) {
            return 1;
        }
        JsonNode first = values.next();
        if (!first.isObject() || first.isEmpty()) {
            return 1;
        }
        return first.elements().next().isObject() ? 3 : 2;
    }

    private static void collect(JsonNode node, int levels, Map<String, String> pairs) {
        node.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            if (levels == 1) {
                pairs.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            } else if (value.isObject()) {
                collect(value, levels - 1, pairs);
            }
        });
    }

    private static void addExportNames(SecretStore store, Set<String> names) {
        for (String key : store.listKeys()) {
            names.add(KeyGrammar.keyToExportName(key, store.descriptor()));
        }
    }

    /**
     * Reads every listed key, keyed by export name. Keys that disappear between listing and
     * reading are skipped.
     */
    private Map<String, String> readAll(SecretStore source) {
        if (!source.isReadable()) {
            throw new WriteOnlyStoreException(source.name());
        }
        Map<String, String> pairs = new TreeMap<>();
        for (String key : source.listKeys()) {
            Optional<String> value = source.get(key);
            if (value.isPresent()) {
                pairs.put(KeyGrammar.keyToExportName(key, source.descriptor()), value.get());
            } else {
                log.debug("Listed key '{}' in '{}' has no value, skipping", key, source.name());
            }
        }
        return pairs;
    }

    private String toJson(Map<String, String> pairs) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(pairs) + "\n";
        } catch (JsonProcessingException e) {
            log.error("Failed to render secrets as JSON: {}", e.getMessage(), e);
            throw new SecretStoreException("Failed to render secrets as JSON", e);
        }
    }

    private static String render(Map<String, String> pairs, String lineFormat,
                                 UnaryOperator<String> quote) {
        StringBuilder sb = new StringBuilder();
        pairs.forEach((name, value) -> sb.append(String.format(lineFormat, name, quote.apply(value))));
        return sb.toString();
    }

    static String shellQuote(String value) {
        if (!value.isEmpty() && SHELL_SAFE.matcher(value).matches()) {
            return value;
        }
        return "'" + value.replace("'", "'\\''") + "'";
    }

    static String powershellQuote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
