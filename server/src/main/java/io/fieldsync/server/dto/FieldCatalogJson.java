package io.fieldsync.server.dto;

import java.util.List;
import java.util.Map;

/**
 * File format for --field-catalog.
 * Example:
 *   {
 *     "versionedFields": {
 *       "camera": ["name", "model", "note"],
 *       "router": ["name", "inputs", "outputs"]
 *     }
 *   }
 * Types not listed keep their built-in field lists.
 */
public class FieldCatalogJson {
    public Map<String, List<String>> versionedFields;
}
