package org.neuralchilli.rasterindex.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.rasterindex.core.FormulaLibrary;
import org.neuralchilli.rasterindex.core.FormulaLibraryException;
import org.neuralchilli.rasterindex.domain.IndexFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the formula library YAML into a {@link FormulaLibrary}.
 *
 * Expected layout:
 * <pre>
 * formulas:
 *   Rnorm: "R / func_band_max(R)"
 *   ExG_wernette: "2 * G - R - B"
 * </pre>
 */
@ApplicationScoped
public class FormulaLibraryLoader {

    private static final Logger log = LoggerFactory.getLogger(FormulaLibraryLoader.class);

    static final String FORMULAS_KEY = "formulas";

    private final Yaml yaml = new Yaml();

    /**
     * Load from a classpath resource, falling back to a file path.
     */
    public FormulaLibrary load(String location) {
        if (location == null || location.isBlank()) {
            throw new FormulaLibraryException("Formula library location cannot be null or empty");
        }

        InputStream resource = Thread.currentThread().getContextClassLoader().getResourceAsStream(location);
        if (resource != null) {
            try (InputStream in = resource) {
                FormulaLibrary library = parse(in);
                log.info("Loaded {} formulas from classpath:{}", library.size(), location);
                return library;
            } catch (IOException e) {
                throw new FormulaLibraryException("Failed to read formula library " + location, e);
            }
        }

        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new FormulaLibraryException("Formula library not found on classpath or disk: " + location);
        }

        try (InputStream in = Files.newInputStream(path)) {
            FormulaLibrary library = parse(in);
            log.info("Loaded {} formulas from {}", library.size(), path.toAbsolutePath());
            return library;
        } catch (IOException e) {
            throw new FormulaLibraryException("Failed to read formula library " + path, e);
        }
    }

    public FormulaLibrary parse(InputStream inputStream) {
        try {
            Map<String, Object> data = yaml.load(inputStream);
            return parseFromMap(data);
        } catch (YAMLException | ClassCastException e) {
            throw new FormulaLibraryException("Malformed formula library: " + e.getMessage(), e);
        }
    }

    public FormulaLibrary parse(String yamlContent) {
        try {
            Map<String, Object> data = yaml.load(yamlContent);
            return parseFromMap(data);
        } catch (YAMLException | ClassCastException e) {
            throw new FormulaLibraryException("Malformed formula library: " + e.getMessage(), e);
        }
    }

    private FormulaLibrary parseFromMap(Map<String, Object> data) {
        if (data == null || !(data.get(FORMULAS_KEY) instanceof Map<?, ?> formulas)) {
            throw new FormulaLibraryException("Formula library must contain a '" + FORMULAS_KEY + "' mapping");
        }

        List<IndexFormula> definitions = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        formulas.forEach((name, template) -> {
            if (template == null) {
                errors.add("Formula '" + name + "' has no template");
                return;
            }
            try {
                definitions.add(new IndexFormula(name.toString(), template.toString()));
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        });

        if (!errors.isEmpty()) {
            throw new FormulaLibraryException("Formula library validation failed:\n" + String.join("\n", errors));
        }

        return FormulaLibrary.of(definitions);
    }
}
