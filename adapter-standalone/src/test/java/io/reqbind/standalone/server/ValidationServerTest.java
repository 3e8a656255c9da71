package io.reqbind.standalone.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reqbind.core.error.EndpointConfigException;
import io.reqbind.core.error.SpecParseException;
import io.reqbind.standalone.config.ServerConfig;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * End-to-end test of the standalone server:
 *
 * <pre>
 *   TestClient ← HTTP → Javalin (EndpointHandler per endpoint + HealthHandler)
 * </pre>
 *
 * <p>Schema and endpoint files are written to a temporary directory; the server binds an
 * ephemeral port.
 */
@DisplayName("ValidationServer")
class ValidationServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SCHEMA = """
            fields:
              - name: Name
                key: name
                type: string
              - name: Email
                key: email
                type: string
              - name: Tags
                key: tags
                type: string-list
              - name: IDs
                key: ids
                type: uint-list
              - name: UserID
                key: user_id
                type: uint
              - name: Rating
                key: rating
                type: int
            """;

    static final String CREATE_USER = """
            id: create-user
            method: POST
            path: /users
            group: create
            success-status: 201
            fields:
              - name: Name
                source: body
                required: true
                rules: required,min=3,max=50
              - name: Email
                source: body
                required: true
                rules: required,email
              - name: Tags
                source: body
                rules: omitempty,unique,dive,min=2,max=20
            """;

    static final String UPDATE_USER = """
            id: update-user
            method: PUT
            path: /users/{user_id}
            group: update
            fields:
              - name: UserID
                source: path
                required: true
                rules: required,min=1
              - name: Name
                source: body
                rules: omitempty,min=3,max=50
              - name: IDs
                source: query
                rules: omitempty,unique,dive,min=1
            """;

    static final String SEARCH = """
            id: search
            method: GET
            path: /search
            fields:
              - name: Tags
                source: query
                required: true
                rules: required,min=1,max=5,dive,in=tech,sports,politics
              - name: Rating
                source: query
                default: "5"
                rules: omitempty,min=1,max=5
            """;

    @TempDir
    static Path configDir;

    private static ValidationServer server;
    private static HttpClient client;

    @BeforeAll
    static void startServer() throws IOException {
        ServerConfig config = writeConfig(configDir, CREATE_USER, UPDATE_USER, SEARCH);
        server = ValidationServer.start(config);
        client = HttpClient.newHttpClient();
    }

    @AfterAll
    static void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    static ServerConfig writeConfig(Path dir, String... endpoints) throws IOException {
        Files.writeString(dir.resolve("schema.yaml"), SCHEMA);
        Path endpointsDir = Files.createDirectories(dir.resolve("endpoints"));
        for (int i = 0; i < endpoints.length; i++) {
            Files.writeString(endpointsDir.resolve("endpoint-" + i + ".yaml"), endpoints[i]);
        }
        return ServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .schemaPath(dir.resolve("schema.yaml").toString())
                .endpointsDir(endpointsDir.toString())
                .build();
    }

    private static HttpResponse<String> send(String method, String pathAndQuery, String body) throws Exception {
        HttpRequest.Builder request =
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + pathAndQuery));
        if (body == null) {
            request.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            request.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body));
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws IOException {
        return MAPPER.readTree(response.body());
    }

    @Nested
    @DisplayName("create-user")
    class CreateUser {

        @Test
        void shortNameIs422() throws Exception {
            HttpResponse<String> response =
                    send("POST", "/users", "{\"name\":\"Al\",\"email\":\"al@example.com\"}");

            assertThat(response.statusCode()).isEqualTo(422);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                    value -> assertThat(value).startsWith("application/json"));
            JsonNode body = json(response);
            assertThat(body.get("message").asText()).isEqualTo("Validation failed");
            assertThat(body.get("errors")).hasSize(1);
            assertThat(body.get("errors").get(0).get("field").asText()).isEqualTo("Name");
            assertThat(body.get("errors").get(0).get("value").asText()).isEqualTo("Al");
        }

        @Test
        void validUserIs201() throws Exception {
            HttpResponse<String> response = send(
                    "POST", "/users", "{\"name\":\"Alice\",\"email\":\"alice@example.com\",\"tags\":[\"go\",\"java\"]}");

            assertThat(response.statusCode()).isEqualTo(201);
            JsonNode data = json(response).get("data");
            assertThat(data.get("name").asText()).isEqualTo("Alice");
            assertThat(data.get("tags")).hasSize(2);
        }

        @Test
        void wrongJsonTypeIs400() throws Exception {
            HttpResponse<String> response = send("POST", "/users", "{\"name\":7,\"email\":\"alice@example.com\"}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response).get("errors").get(0).get("field").asText()).isEqualTo("Name");
        }

        @Test
        void malformedJsonIs400() throws Exception {
            HttpResponse<String> response = send("POST", "/users", "{\"name\":");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response).get("message").asText()).isEqualTo("Invalid request body");
            assertThat(json(response).has("errors")).isFalse();
        }
    }

    @Nested
    @DisplayName("update-user")
    class UpdateUser {

        @Test
        void nonNumericPathIs400() throws Exception {
            HttpResponse<String> response = send("PUT", "/users/abc", null);

            assertThat(response.statusCode()).isEqualTo(400);
            JsonNode error = json(response).get("errors").get(0);
            assertThat(error.get("field").asText()).isEqualTo("UserID");
            assertThat(error.get("value").asText()).isEqualTo("abc");
        }

        @Test
        void duplicateIdsIs422() throws Exception {
            HttpResponse<String> response = send("PUT", "/users/7?ids=1,2,1", null);

            assertThat(response.statusCode()).isEqualTo(422);
            assertThat(json(response).get("errors").get(0).get("field").asText()).isEqualTo("IDs");
        }

        @Test
        void partialUpdateIs200() throws Exception {
            HttpResponse<String> response = send("PUT", "/users/7", "{\"name\":\"Bobby\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode data = json(response).get("data");
            assertThat(data.get("user_id").asLong()).isEqualTo(7L);
            assertThat(data.get("ids")).isEmpty();
        }
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        void unknownTagIs422WithElementIndex() throws Exception {
            HttpResponse<String> response = send("GET", "/search?tags=tech,music", null);

            assertThat(response.statusCode()).isEqualTo(422);
            JsonNode error = json(response).get("errors").get(0);
            assertThat(error.get("field").asText()).isEqualTo("Tags[1]");
            assertThat(error.get("value").asText()).isEqualTo("music");
        }

        @Test
        void missingTagsIs400() throws Exception {
            HttpResponse<String> response = send("GET", "/search", null);

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response).get("errors").get(0).get("message").asText())
                    .isEqualTo("This field is required");
        }

        @Test
        void defaultRatingIsApplied() throws Exception {
            HttpResponse<String> response = send("GET", "/search?tags=sports", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(json(response).get("data").get("rating").asInt()).isEqualTo(5);
        }

        @Test
        void echoesRequestId() throws Exception {
            HttpRequest request = HttpRequest.newBuilder(
                            URI.create("http://127.0.0.1:" + server.port() + "/search?tags=tech"))
                    .header("X-Request-ID", "trace-123")
                    .GET()
                    .build();

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.headers().firstValue("X-Request-ID")).contains("trace-123");
        }
    }

    @Test
    void healthListsEndpoints() throws Exception {
        HttpResponse<String> response = send("GET", "/health", null);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).get("status").asText()).isEqualTo("UP");
        assertThat(json(response).get("endpoints")).hasSize(3);
        assertThat(server.registry().size()).isEqualTo(3);
    }

    @Test
    void unknownRouteIs404() throws Exception {
        assertThat(send("GET", "/nowhere", null).statusCode()).isEqualTo(404);
    }

    @Nested
    @DisplayName("startup failures")
    class StartupFailures {

        @Test
        void rejectedEndpointFileAbortsStartup(@TempDir Path dir) throws IOException {
            ServerConfig config = writeConfig(dir, SEARCH.replace("in=tech", "inn=tech"));

            assertThatThrownBy(() -> ValidationServer.start(config))
                    .isInstanceOf(EndpointConfigException.class)
                    .hasMessageContaining("Unknown rule 'inn'");
        }

        @Test
        void missingSchemaAbortsStartup(@TempDir Path dir) {
            ServerConfig config = ServerConfig.builder()
                    .port(0)
                    .schemaPath(dir.resolve("absent.yaml").toString())
                    .endpointsDir(dir.toString())
                    .build();

            assertThatThrownBy(() -> ValidationServer.start(config)).isInstanceOf(SpecParseException.class);
        }
    }
}
