package org.paneltwin.model.catalog;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.paneltwin.model.ComponentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of component definitions, keyed by definition id in registration order.
 */
public final class ComponentCatalog {
    private static final Logger log = LoggerFactory.getLogger(ComponentCatalog.class);

    /** Classpath location of the bundled catalog. */
    public static final String DEFAULT_RESOURCE = "/catalog/default-components.json";

    private final String catalogId;
    private final Map<String, ComponentDefinition> definitions = new LinkedHashMap<>();

    public ComponentCatalog(String catalogId) {
        if (catalogId == null || catalogId.isBlank()) {
            throw new IllegalArgumentException("catalogId must be non-blank");
        }
        this.catalogId = catalogId;
    }

    /**
     * Creates a catalog pre-filled with the given definitions.
     *
     * @throws CatalogLoadException when two definitions share an id.
     */
    public static ComponentCatalog of(String catalogId, Collection<ComponentDefinition> definitions) {
        ComponentCatalog catalog = new ComponentCatalog(catalogId);
        for (ComponentDefinition definition : definitions) {
            if (catalog.definitions.putIfAbsent(definition.getId(), definition) != null) {
                throw new CatalogLoadException(
                        CatalogLoadException.REASON_DUPLICATE_DEFINITION,
                        "duplicate definition id " + definition.getId() + " in catalog " + catalogId
                );
            }
        }
        return catalog;
    }

    /**
     * Loads the bundled catalog.
     */
    public static ComponentCatalog loadDefault() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Loads a catalog JSON document from the classpath.
     *
     * @param resource absolute classpath resource name.
     * @throws CatalogLoadException when the resource is missing or cannot be parsed.
     */
    public static ComponentCatalog fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource");
        try (InputStream in = ComponentCatalog.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new CatalogLoadException(
                        CatalogLoadException.REASON_RESOURCE_MISSING,
                        "catalog resource not found: " + resource
                );
            }
            return fromStream(in, resource);
        } catch (IOException ex) {
            throw new CatalogLoadException(
                    CatalogLoadException.REASON_MALFORMED,
                    "failed to read catalog resource " + resource,
                    ex
            );
        }
    }

    /**
     * Parses a catalog JSON document from a stream. The stream is not closed.
     */
    public static ComponentCatalog fromStream(InputStream in, String sourceName) {
        ObjectMapper mapper = new ObjectMapper();
        final CatalogDocument document;
        try {
            document = mapper.readValue(in, CatalogDocument.class);
        } catch (JacksonException ex) {
            throw new CatalogLoadException(
                    CatalogLoadException.REASON_MALFORMED,
                    "malformed catalog " + sourceName + ": " + ex.getOriginalMessage(),
                    ex
            );
        } catch (IOException ex) {
            throw new CatalogLoadException(
                    CatalogLoadException.REASON_MALFORMED,
                    "failed to read catalog " + sourceName,
                    ex
            );
        }
        if (document.getCatalogId() == null || document.getCatalogId().isBlank()) {
            throw new CatalogLoadException(CatalogLoadException.REASON_MALFORMED, "catalog " + sourceName + " has no catalogId");
        }
        ComponentCatalog catalog = of(document.getCatalogId(), document.getDefinitions());
        log.debug("Loaded catalog {} with {} definitions from {}", catalog.catalogId, catalog.size(), sourceName);
        return catalog;
    }

    /**
     * Adds a definition unless one with the same id is already present.
     *
     * @return the definition now registered under that id.
     */
    public ComponentDefinition register(ComponentDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        ComponentDefinition existing = definitions.putIfAbsent(definition.getId(), definition);
        return existing == null ? definition : existing;
    }

    public Optional<ComponentDefinition> find(String definitionId) {
        return Optional.ofNullable(definitions.get(definitionId));
    }

    /**
     * Definitions in registration order.
     */
    public List<ComponentDefinition> definitions() {
        return List.copyOf(definitions.values());
    }

    public String catalogId() {
        return catalogId;
    }

    public int size() {
        return definitions.size();
    }

    /**
     * Returns an independent copy.
     */
    public ComponentCatalog copy() {
        return of(catalogId, definitions.values());
    }
}
