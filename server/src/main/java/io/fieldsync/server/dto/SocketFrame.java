package io.fieldsync.server.dto;

/**
 * WebSocket frame, both directions.
 * Example:
 *   {
 *     "event": "camera:updated",
 *     "data":  { "uuid": "…", "id": "CAM 1", ... }
 *   }
 */
public class SocketFrame {
    public String event;
    public Object data;

    public SocketFrame() {
    }

    public SocketFrame(String event, Object data) {
        this.event = event;
        this.data = data;
    }
}
