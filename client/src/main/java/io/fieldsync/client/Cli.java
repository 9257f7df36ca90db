package io.fieldsync.client;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Simple CLI for catch-up reads against a running fieldsync server over HTTP.
 *
 * Usage:
 *   fieldsync-cli [--base-url http://host:port] get <type> <key>
 *   fieldsync-cli [--base-url http://host:port] list <productionId> <type>
 *   fieldsync-cli [--base-url http://host:port] events <productionId> [limit]
 *   fieldsync-cli [--base-url http://host:port] history <productionId> <key>
 *   fieldsync-cli [--base-url http://host:port] since <productionId> <epochMillis>
 *
 * Examples:
 *   fieldsync-cli events prod-7 20
 *   fieldsync-cli since prod-7 1767225600000
 *   fieldsync-cli get camera 3f6c...
 *
 * Responses are printed as returned by the server (JSON).
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            new Cli(parsed.getKey()).fetch(requestPath(rest));
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /**
     * Map a command and its arguments to the server path to GET.
     *
     * @throws CliException on an unknown command or wrong arity
     */
    static String requestPath(String[] rest) {
        String cmd = rest[0];
        return switch (cmd) {
            case "get" -> {
                arity(rest, 3, "get requires <type> <key>");
                yield "/entities/" + enc(rest[1]) + "/" + enc(rest[2]);
            }
            case "list" -> {
                arity(rest, 3, "list requires <productionId> <type>");
                yield "/productions/" + enc(rest[1]) + "/" + enc(rest[2]);
            }
            case "events" -> {
                if (rest.length == 2) {
                    yield "/productions/" + enc(rest[1]) + "/events";
                }
                arity(rest, 3, "events requires <productionId> [limit]");
                yield "/productions/" + enc(rest[1]) + "/events?limit=" + positive(rest[2], "limit");
            }
            case "history" -> {
                arity(rest, 3, "history requires <productionId> <key>");
                yield "/productions/" + enc(rest[1]) + "/events/entity/" + enc(rest[2]);
            }
            case "since" -> {
                arity(rest, 3, "since requires <productionId> <epochMillis>");
                yield "/productions/" + enc(rest[1]) + "/events/since/" + positive(rest[2], "epochMillis");
            }
            default -> throw new CliException("unknown command: " + cmd);
        };
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new CliException("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private void fetch(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 404) {
            System.out.println("(not found)");
            return;
        }
        if (resp.statusCode() != 200) {
            throw new CliException("GET " + path + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println(resp.body());
    }

    private static void arity(String[] rest, int expected, String message) {
        if (rest.length != expected) {
            throw new CliException(message);
        }
    }

    private static long positive(String raw, String name) {
        try {
            long v = Long.parseLong(raw);
            if (v < 0) throw new CliException(name + " must not be negative");
            return v;
        } catch (NumberFormatException e) {
            throw new CliException(name + " must be a number: " + raw);
        }
    }

    private static String enc(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  fieldsync-cli [--base-url http://host:port] get <type> <key>
                  fieldsync-cli [--base-url http://host:port] list <productionId> <type>
                  fieldsync-cli [--base-url http://host:port] events <productionId> [limit]
                  fieldsync-cli [--base-url http://host:port] history <productionId> <key>
                  fieldsync-cli [--base-url http://host:port] since <productionId> <epochMillis>
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
