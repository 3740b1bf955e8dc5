package org.paneltwin.model.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.paneltwin.model.ComponentDefinition;

import java.util.List;

/**
 * On-disk shape of a catalog resource.
 */
@Value
@Builder
@Jacksonized
public class CatalogDocument {
    String catalogId;
    @Singular
    List<ComponentDefinition> definitions;
}
