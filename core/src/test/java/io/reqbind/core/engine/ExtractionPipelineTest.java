package io.reqbind.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reqbind.core.error.BodyDecodeException;
import io.reqbind.core.model.RequestBody;
import io.reqbind.core.model.ValidationError;
import io.reqbind.core.source.RequestSources;
import io.reqbind.core.source.SourceReader;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExtractionPipeline")
class ExtractionPipelineTest {

    private final ExtractionPipeline pipeline = new ExtractionPipeline(GenericRequest.SCHEMA);

    @Test
    void missingRequiredPathFieldIsReported() {
        Extraction extraction = pipeline.extract(GenericRequest.updateUser().descriptors(), RequestSources.empty());

        assertThat(extraction.failed()).isTrue();
        assertThat(extraction.errors()).containsExactly(ValidationError.of("UserID", "This field is required"));
    }

    @Test
    void collectsEveryCoercionErrorWithRawValue() {
        RequestSources sources = RequestSources.empty()
                .withPath(SourceReader.of(Map.of("user_id", "abc")))
                .withQuery(SourceReader.of(Map.of("ids", "1,x")));

        Extraction extraction = pipeline.extract(GenericRequest.updateUser().descriptors(), sources);

        assertThat(extraction.errors())
                .containsExactly(
                        new ValidationError("UserID", "must be a positive integer", "abc"),
                        new ValidationError("IDs", "element 2: must be positive integer", "1,x"));
    }

    @Test
    void appliesDefaultWhenAbsent() {
        RequestSources sources = RequestSources.empty().withQuery(SourceReader.of(Map.of("tags", "tech")));

        Extraction extraction = pipeline.extract(GenericRequest.search().descriptors(), sources);

        assertThat(extraction.failed()).isFalse();
        assertThat(extraction.record().getLong("Rating")).isEqualTo(5L);
        assertThat(extraction.record().getList("Tags")).containsExactly("tech");
    }

    @Test
    void defaultSatisfiesRequiredFieldWhenAbsent() {
        Extraction extraction = pipeline.extract(GenericRequest.rate().descriptors(), RequestSources.empty());

        assertThat(extraction.failed()).isFalse();
        assertThat(extraction.errors()).isEmpty();
        assertThat(extraction.record().getLong("Rating")).isEqualTo(5L);
    }

    @Test
    void presentValueWinsOverDefault() {
        RequestSources sources =
                RequestSources.empty().withQuery(SourceReader.of(Map.of("tags", "tech", "rating", "2")));

        assertThat(pipeline.extract(GenericRequest.search().descriptors(), sources).record().getLong("Rating"))
                .isEqualTo(2L);
    }

    @Test
    void absentOptionalFieldsHoldZeroValues() {
        RequestSources sources = RequestSources.empty().withPath(SourceReader.of(Map.of("user_id", "9")));

        Extraction extraction = pipeline.extract(GenericRequest.updateUser().descriptors(), sources);

        assertThat(extraction.record().asMap())
                .containsExactly(Map.entry("UserID", 9L), Map.entry("Name", ""), Map.entry("IDs", List.of()));
    }

    @Test
    void bindsBodyFieldsByWireName() {
        RequestSources sources = RequestSources.empty()
                .withBody(RequestBody.json("{\"name\":\"Alice\",\"email\":\"a@example.com\",\"tags\":[\"go\"]}"));

        Extraction extraction = pipeline.extract(GenericRequest.createUser().descriptors(), sources);

        assertThat(extraction.errors()).isEmpty();
        assertThat(extraction.record().getString("Name")).isEqualTo("Alice");
        assertThat(extraction.record().getList("Tags")).containsExactly("go");
    }

    @Test
    void jsonNullCountsAsAbsent() {
        RequestSources sources =
                RequestSources.empty().withBody(RequestBody.json("{\"name\":null,\"email\":\"a@example.com\"}"));

        assertThat(pipeline.extract(GenericRequest.createUser().descriptors(), sources).errors())
                .containsExactly(ValidationError.of("Name", "This field is required"));
    }

    @Test
    void presentEmptyValueIsNotAPresenceError() {
        RequestSources sources = RequestSources.empty().withQuery(SourceReader.of(Map.of("tags", "")));

        Extraction extraction = pipeline.extract(GenericRequest.search().descriptors(), sources);

        assertThat(extraction.failed()).isFalse();
        assertThat(extraction.record().getList("Tags")).isEmpty();
    }

    @Test
    void undecodableBodyFailsOnlyWhenBodyFieldsAreDeclared() {
        RequestSources sources = RequestSources.empty()
                .withQuery(SourceReader.of(Map.of("tags", "tech")))
                .withBody(RequestBody.json("not json"));

        assertThat(pipeline.extract(GenericRequest.search().descriptors(), sources).failed()).isFalse();
        assertThatThrownBy(() -> pipeline.extract(GenericRequest.createUser().descriptors(), sources))
                .isInstanceOf(BodyDecodeException.class);
    }
}
