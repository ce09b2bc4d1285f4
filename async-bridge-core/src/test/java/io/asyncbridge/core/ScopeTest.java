package io.asyncbridge.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopeTest {

    @Test
    void builderAppliesDefaults() {
        Scope scope = Scope.builder().method("get").build();

        assertThat(scope.type()).isEqualTo("http");
        assertThat(scope.method()).isEqualTo("GET");
        assertThat(scope.path()).isEqualTo("/");
        assertThat(scope.rawPath()).isEqualTo("/".getBytes(StandardCharsets.UTF_8));
        assertThat(scope.queryString()).isEmpty();
        assertThat(scope.rootPath()).isEmpty();
        assertThat(scope.scheme()).isEqualTo("http");
        assertThat(scope.httpVersion()).isEqualTo("1.1");
        assertThat(scope.client()).isEqualTo(new Scope.HostPort("127.0.0.1", 0));
        assertThat(scope.extensions()).isEmpty();
    }

    @Test
    void methodIsRequired() {
        assertThatThrownBy(() -> Scope.builder().build()).isInstanceOf(NullPointerException.class);
    }

    @Test
    void headerLookupIsCaseInsensitiveAndReturnsFirstValue() {
        Scope scope = Scope.builder()
                .method("GET")
                .header("Accept", "text/html")
                .header("accept", "application/json")
                .build();

        assertThat(scope.headers()).extracting(Header::nameAsString).containsExactly("accept", "accept");
        assertThat(scope.header("ACCEPT")).contains("text/html");
        assertThat(scope.header("x-missing")).isEmpty();
    }

    @Test
    void headersCannotBeModified() {
        Scope scope = Scope.builder().method("GET").header("a", "1").build();

        assertThatThrownBy(() -> scope.headers().add(Header.of("b", "2")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void byteFieldsAreCopiedInAndOut() {
        byte[] query = "a=1".getBytes(StandardCharsets.ISO_8859_1);
        Scope scope = Scope.builder().method("GET").queryString(query).build();

        query[0] = 'z';
        scope.queryString()[0] = 'y';

        assertThat(new String(scope.queryString(), StandardCharsets.ISO_8859_1)).isEqualTo("a=1");
    }

    @Test
    void asMapUsesConventionalKeys() {
        Scope scope = Scope.builder()
                .method("POST")
                .path("/items")
                .queryString("page=2")
                .rootPath("/api")
                .server("example.org", 8443)
                .client("10.0.0.7", 51234)
                .scheme("https")
                .httpVersion("2")
                .build();

        Map<String, Object> map = scope.asMap();

        assertThat(map).containsKeys("type", "asgi", "http_version", "method", "headers", "path", "root_path",
                "raw_path", "query_string", "server", "client", "scheme", "extensions");
        assertThat(map.get("asgi")).isEqualTo(Map.of("version", "3.0", "spec_version", "2.1"));
        assertThat(map.get("server")).isEqualTo(List.of("example.org", 8443));
        assertThat(map.get("client")).isEqualTo(List.of("10.0.0.7", 51234));
        assertThat(map.get("http_version")).isEqualTo("2");
        assertThat((byte[]) map.get("query_string")).isEqualTo("page=2".getBytes(StandardCharsets.ISO_8859_1));
    }
}
