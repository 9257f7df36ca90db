package io.fieldsync.server.dto;

/**
 * Optional JSON body for DELETE /entities/{entityType}/{key}.
 */
public class DeleteRequest {
    public String userId;
    public String userName;
}
