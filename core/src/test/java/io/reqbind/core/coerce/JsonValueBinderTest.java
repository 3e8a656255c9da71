package io.reqbind.core.coerce;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reqbind.core.error.CoercionException;
import io.reqbind.core.model.ValueKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JsonValueBinder")
class JsonValueBinderTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static JsonNode node(String json) throws Exception {
        return JSON.readTree(json);
    }

    @Test
    void bindsNativeNumbers() throws Exception {
        assertThat(JsonValueBinder.bind(node("42"), ValueKind.INT)).isEqualTo(42L);
        assertThat(JsonValueBinder.bind(node("18446744073709551615"), ValueKind.UNSIGNED_INT)).isEqualTo(-1L);
    }

    @Test
    void textualNumbersGoThroughTheCoercer() throws Exception {
        assertThat(JsonValueBinder.bind(node("\"42\""), ValueKind.INT)).isEqualTo(42L);
        assertThatThrownBy(() -> JsonValueBinder.bind(node("\"4x\""), ValueKind.UNSIGNED_INT))
                .hasMessage("must be a positive integer");
    }

    @Test
    void rejectsFractionsAndNegativesForUnsigned() {
        assertThatThrownBy(() -> JsonValueBinder.bind(node("1.5"), ValueKind.INT))
                .isInstanceOf(CoercionException.class)
                .hasMessage("must be a valid integer");
        assertThatThrownBy(() -> JsonValueBinder.bind(node("-1"), ValueKind.UNSIGNED_INT))
                .hasMessage("must be a positive integer");
        assertThatThrownBy(() -> JsonValueBinder.bind(node("18446744073709551616"), ValueKind.UNSIGNED_INT))
                .hasMessage("must be a positive integer");
    }

    @Test
    void numberIsNotAString() {
        Throwable thrown = catchThrowable(() -> JsonValueBinder.bind(node("5"), ValueKind.STRING));

        assertThat(thrown).isInstanceOf(CoercionException.class).hasMessage("must be a string");
        assertThat(((CoercionException) thrown).rawValue()).isEqualTo("5");
    }

    @Test
    void containerForScalarIsRejected() {
        assertThatThrownBy(() -> JsonValueBinder.bind(node("{\"a\":1}"), ValueKind.STRING))
                .hasMessage("must be a scalar value");
        assertThatThrownBy(() -> JsonValueBinder.bind(node("[1]"), ValueKind.INT))
                .hasMessage("must be a scalar value");
    }

    @Test
    void bindsBooleans() throws Exception {
        assertThat(JsonValueBinder.bind(node("true"), ValueKind.BOOLEAN)).isEqualTo(true);
        assertThat(JsonValueBinder.bind(node("\"off\""), ValueKind.BOOLEAN)).isEqualTo(false);
        assertThatThrownBy(() -> JsonValueBinder.bind(node("1"), ValueKind.BOOLEAN))
                .hasMessage("must be a boolean");
    }

    @Test
    void bindsStringArraysAndCommaText() throws Exception {
        assertThat(JsonValueBinder.bind(node("[\"go\",\"java\"]"), ValueKind.STRING_LIST))
                .isEqualTo(List.of("go", "java"));
        assertThat(JsonValueBinder.bind(node("\"go, java\""), ValueKind.STRING_LIST))
                .isEqualTo(List.of("go", "java"));
    }

    @Test
    void stringListRejectsNonStringElements() {
        assertThatThrownBy(() -> JsonValueBinder.bind(node("[\"a\", 2]"), ValueKind.STRING_LIST))
                .hasMessage("element 2: must be a string");
        assertThatThrownBy(() -> JsonValueBinder.bind(node("{}"), ValueKind.STRING_LIST))
                .hasMessage("must be a list");
    }

    @Test
    void unsignedListAcceptsNumbersAndDigitStrings() throws Exception {
        assertThat(JsonValueBinder.bind(node("[1, \"2\", 3]"), ValueKind.UNSIGNED_INT_LIST))
                .isEqualTo(List.of(1L, 2L, 3L));
    }

    @Test
    void unsignedListNamesTheBadElement() {
        Throwable thrown = catchThrowable(() -> JsonValueBinder.bind(node("[1, -2]"), ValueKind.UNSIGNED_INT_LIST));

        assertThat(thrown).isInstanceOf(CoercionException.class).hasMessage("element 2: must be positive integer");
        assertThat(((CoercionException) thrown).rawValue()).isEqualTo("[1,-2]");
        assertThatThrownBy(() -> JsonValueBinder.bind(node("[\"x\"]"), ValueKind.UNSIGNED_INT_LIST))
                .hasMessage("element 1: must be positive integer");
    }
}
