package io.fieldsync.client;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @Test
    void commands_map_to_server_paths() {
        assertEquals("/entities/camera/k1", Cli.requestPath(new String[]{"get", "camera", "k1"}));
        assertEquals("/productions/p1/ccu", Cli.requestPath(new String[]{"list", "p1", "ccu"}));
        assertEquals("/productions/p1/events", Cli.requestPath(new String[]{"events", "p1"}));
        assertEquals("/productions/p1/events?limit=20", Cli.requestPath(new String[]{"events", "p1", "20"}));
        assertEquals("/productions/p1/events/entity/k1", Cli.requestPath(new String[]{"history", "p1", "k1"}));
        assertEquals("/productions/p1/events/since/1767225600000",
                Cli.requestPath(new String[]{"since", "p1", "1767225600000"}));
    }

    @Test
    void path_segments_are_encoded() {
        assertEquals("/productions/prod%207/events", Cli.requestPath(new String[]{"events", "prod 7"}));
    }

    @Test
    void bad_usage_is_reported() {
        assertThrows(Cli.CliException.class, () -> Cli.requestPath(new String[]{"get", "camera"}));
        assertThrows(Cli.CliException.class, () -> Cli.requestPath(new String[]{"since", "p1", "yesterday"}));
        assertThrows(Cli.CliException.class, () -> Cli.requestPath(new String[]{"put", "k", "v"}));
    }

    @Test
    void base_url_flag_is_split_off() {
        Map.Entry<String, String[]> parsed = Cli.parseBaseUrl(new String[]{"--base-url", "http://h:9", "events", "p1"});
        assertEquals("http://h:9", parsed.getKey());
        assertArrayEquals(new String[]{"events", "p1"}, parsed.getValue());

        assertEquals("http://localhost:8080", Cli.parseBaseUrl(new String[]{"events", "p1"}).getKey());
    }
}
