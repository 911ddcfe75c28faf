package org.netpreserve.printroo.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.printroo.ConversionOptions;
import org.netpreserve.printroo.Converter;
import org.netpreserve.printroo.PageSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Root configuration, read from YAML.
 *
 * @param instanceId tells this converter's log lines apart from those of others
 * @param browser    how to run the browser
 * @param conversion how to load the page
 * @param page       layout of PDF output
 */
public record ConverterConfig(
        String instanceId,
        BrowserConfig browser,
        ConversionOptions conversion,
        PageSettings page
) {
    public static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public ConverterConfig {
        if (conversion == null) conversion = ConversionOptions.defaults();
        if (page == null) page = PageSettings.defaults();
    }

    /**
     * Loads the built-in defaults overlaid with the given file.
     *
     * @param file YAML file, or null for just the defaults
     */
    public static ConverterConfig load(@Nullable Path file) throws IOException {
        JsonNode tree = defaultsTree();
        if (file != null) {
            tree = deepMerge(tree, YAML.readTree(file.toFile()));
        }
        return YAML.treeToValue(tree, ConverterConfig.class);
    }

    static JsonNode defaultsTree() throws IOException {
        try (InputStream stream = Objects.requireNonNull(ConverterConfig.class.getResourceAsStream("defaults.yaml"),
                "defaults.yaml")) {
            return YAML.readTree(stream);
        }
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (override == null || override.isMissingNode() || override.isNull() && base.isObject()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    /**
     * Creates a converter with the browser and instance settings applied.
     */
    public Converter createConverter() {
        var converter = new Converter();
        converter.setInstanceId(instanceId);
        if (browser != null) browser.applyTo(converter);
        return converter;
    }

    public String toYaml() throws IOException {
        return YAML.writerWithDefaultPrettyPrinter().writeValueAsString(this);
    }
}
