package com.warden.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Reads one rule per YAML file from a Spring resource pattern such as
 * {@code classpath:policies/POL_*.yaml} or {@code file:/etc/warden/POL_*.yaml}.
 * <p>
 * Files are returned sorted by file name, which fixes the evaluation order.
 * Only plain YAML types are constructed (no custom tags).
 */
public class YamlPolicySource implements PolicySource {

    private static final Logger log = LoggerFactory.getLogger(YamlPolicySource.class);

    private final String locationPattern;
    private final ResourcePatternResolver resolver;

    public YamlPolicySource(String locationPattern) {
        this(locationPattern, new PathMatchingResourcePatternResolver());
    }

    public YamlPolicySource(String locationPattern, ResourcePatternResolver resolver) {
        this.locationPattern = locationPattern;
        this.resolver = resolver;
    }

    @Override
    public List<PolicyDefinition> readDefinitions() {
        Resource[] resources;
        try {
            resources = resolver.getResources(locationPattern);
        } catch (IOException e) {
            throw new PolicyRegistryException("Policy source not found: " + locationPattern, e);
        }

        List<Resource> files = Arrays.stream(resources)
                .filter(Resource::exists)
                .sorted(Comparator.comparing(YamlPolicySource::fileName))
                .toList();
        if (files.isEmpty()) {
            throw new PolicyRegistryException("No policy files found in: " + locationPattern);
        }

        List<PolicyDefinition> definitions = new ArrayList<>(files.size());
        for (Resource file : files) {
            definitions.add(read(file));
        }
        log.debug("Read {} policy definition(s) from {}", definitions.size(), locationPattern);
        return definitions;
    }

    @Override
    public String describe() {
        return locationPattern;
    }

    @SuppressWarnings("unchecked")
    private PolicyDefinition read(Resource file) {
        String name = fileName(file);
        String text;
        try (InputStream in = file.getInputStream()) {
            text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PolicyRegistryException("Failed to read " + name + ": " + e.getMessage(), e);
        }
        if (text.isBlank()) {
            throw new PolicyValidationException("Policy file is empty: " + name, stem(name));
        }

        Object document;
        try {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(text);
        } catch (YAMLException e) {
            throw new PolicyRegistryException("Failed to parse " + name + ": " + e.getMessage(), e);
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new PolicyValidationException("Policy must be a YAML mapping: " + name, stem(name));
        }
        return new PolicyDefinition(name, (Map<String, Object>) document);
    }

    private static String fileName(Resource resource) {
        String name = resource.getFilename();
        return name != null ? name : resource.getDescription();
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
