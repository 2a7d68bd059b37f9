package com.entity.reconciliation.config;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.SourceSide;
import com.entity.reconciliation.error.PolicyConfigurationException;
import com.entity.reconciliation.quality.QualityRule;
import com.entity.reconciliation.quality.ValidatorType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads a {@link PolicyCatalog} from JSON.
 *
 * <pre>
 * {
 *   "codeMappings": { "specialty": { "A": { "PSYCH": "PSYCHIATRY" }, "B": { ... } } },
 *   "entityTypes": {
 *     "VETERAN": {
 *       "primarySource": "A",
 *       "historized": true,
 *       "fields":  [ { "name": "first_name", "sourceA": "vet_first", "normalizer": "UPPER_TRIM", "tracked": true } ],
 *       "derived": [ { "name": "full_name", "kind": "FULL_NAME", "inputs": ["first_name", "last_name"] } ],
 *       "quality": [ { "field": "first_name", "weight": 15, "validator": "NOT_NULL", "label": "first name" } ]
 *     }
 *   }
 * }
 * </pre>
 */
public class PolicyCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(PolicyCatalogLoader.class);

    public static final String DEFAULT_RESOURCE = "reconciliation-policies.json";

    private final ObjectMapper objectMapper;

    public PolicyCatalogLoader() {
        this(new ObjectMapper());
    }

    public PolicyCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the bundled default policies from the classpath.
     */
    public PolicyCatalog loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public PolicyCatalog loadResource(String resourceName) {
        InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            in = PolicyCatalogLoader.class.getClassLoader().getResourceAsStream(resourceName);
        }
        if (in == null) {
            throw new PolicyConfigurationException("Policy resource not found on classpath: " + resourceName);
        }
        try (InputStream input = in) {
            return load(input);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to read policy resource " + resourceName, e);
        }
    }

    public PolicyCatalog load(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            return load(input);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to read policy file " + path, e);
        }
    }

    public PolicyCatalog load(InputStream input) {
        JsonNode root;
        try {
            root = objectMapper.readTree(input);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Policy document is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new PolicyConfigurationException("Policy document must be a JSON object");
        }

        PolicyCatalog.Builder catalog = PolicyCatalog.builder()
                .codeMappings(parseCodeMappings(root.path("codeMappings")));

        JsonNode types = root.path("entityTypes");
        if (!types.isObject() || types.isEmpty()) {
            throw new PolicyConfigurationException("Policy document declares no entityTypes");
        }
        Iterator<Map.Entry<String, JsonNode>> it = types.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            EntityType type = parseEnum(EntityType.class, entry.getKey(), "entity type");
            catalog.policy(parsePolicy(type, entry.getValue()));
        }

        PolicyCatalog result = catalog.build();
        log.info("policies.loaded entityTypes={}", result.entityTypes());
        return result;
    }

    private CodeMappingTable parseCodeMappings(JsonNode node) {
        CodeMappingTable.Builder builder = CodeMappingTable.builder();
        if (node.isMissingNode() || node.isNull()) {
            return builder.build();
        }
        node.fields().forEachRemaining(mapping ->
                mapping.getValue().fields().forEachRemaining(sideEntry -> {
                    SourceSide side = parseEnum(SourceSide.class, sideEntry.getKey(), "source side");
                    sideEntry.getValue().fields().forEachRemaining(code ->
                            builder.map(mapping.getKey(), side, code.getKey(), code.getValue().asText()));
                }));
        return builder.build();
    }

    private SystemOfRecordPolicy parsePolicy(EntityType type, JsonNode node) {
        try {
            SystemOfRecordPolicy.Builder builder = SystemOfRecordPolicy.builder(type)
                    .primarySource(parseEnum(SourceSide.class, requiredText(node, "primarySource"), "source side"))
                    .historized(node.path("historized").asBoolean(true));
            for (JsonNode field : node.path("fields")) {
                builder.field(parseField(field));
            }
            for (JsonNode derived : node.path("derived")) {
                builder.derived(parseDerived(derived));
            }
            for (JsonNode rule : node.path("quality")) {
                builder.qualityRule(parseQualityRule(rule));
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new PolicyConfigurationException("Invalid policy for " + type + ": " + e.getMessage(), e);
        }
    }

    private FieldPolicy parseField(JsonNode node) {
        FieldPolicy.Builder builder = FieldPolicy.builder(requiredText(node, "name"))
                .sourceAField(optionalText(node, "sourceA"))
                .sourceBField(optionalText(node, "sourceB"))
                .tracked(node.path("tracked").asBoolean(false))
                .codeMapping(optionalText(node, "codeMapping"));
        String primary = optionalText(node, "primary");
        if (primary != null) {
            builder.primary(parseEnum(SourceSide.class, primary, "source side"));
        }
        String rule = optionalText(node, "rule");
        if (rule != null) {
            builder.rule(parseEnum(FieldRule.class, rule, "field rule"));
        }
        String normalizer = optionalText(node, "normalizer");
        if (normalizer != null) {
            builder.normalizer(parseEnum(FieldNormalizer.class, normalizer, "normalizer"));
        }
        String references = optionalText(node, "references");
        if (references != null) {
            builder.references(parseEnum(EntityType.class, references, "entity type"));
        }
        return builder.build();
    }

    private DerivedField parseDerived(JsonNode node) {
        return new DerivedField(
                requiredText(node, "name"),
                parseEnum(DerivedField.Kind.class, requiredText(node, "kind"), "derived field kind"),
                textList(node.path("inputs")),
                optionalText(node, "value"));
    }

    private QualityRule parseQualityRule(JsonNode node) {
        ValidatorType validator = parseEnum(ValidatorType.class, requiredText(node, "validator"), "validator");
        Pattern pattern = null;
        String regex = optionalText(node, "pattern");
        if (regex != null) {
            try {
                pattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new PolicyConfigurationException("Invalid quality pattern: " + regex, e);
            }
        }
        Set<String> allowed = new LinkedHashSet<>(textList(node.path("allowed")));
        return new QualityRule(
                optionalText(node, "field"),
                node.path("weight").asInt(0),
                validator,
                optionalText(node, "label"),
                decimal(node.path("min")),
                decimal(node.path("max")),
                pattern,
                allowed,
                textList(node.path("fields")));
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw new PolicyConfigurationException("Expected a number but found: " + node);
        }
        return node.decimalValue();
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            values.add(item.asText());
        }
        return values;
    }

    private static String requiredText(JsonNode node, String name) {
        String value = optionalText(node, name);
        if (value == null) {
            throw new PolicyConfigurationException("Missing required property '" + name + "' in " + node);
        }
        return value;
    }

    private static String optionalText(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String what) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PolicyConfigurationException("Unknown " + what + ": " + value, e);
        }
    }
}
