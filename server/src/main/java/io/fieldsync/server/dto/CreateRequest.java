package io.fieldsync.server.dto;

import java.util.Map;

/**
 * JSON body for POST /productions/{productionId}/{entityType}.
 * Example:
 *   {
 *     "data":     { "id": "CAM 1", "name": "Main Camera", "model": "PXW-Z450" },
 *     "userId":   "u-17",
 *     "userName": "Alice"
 *   }
 */
public class CreateRequest {
    public Map<String, Object> data;   // display label under "id", plus attributes
    public String userId;
    public String userName;
}
