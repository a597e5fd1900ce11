package io.stencil.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stencil.core.value.NumberValue;
import io.stencil.core.value.OtherValue;
import io.stencil.core.value.TextValue;
import io.stencil.core.value.Value;
import io.stencil.core.value.ValueKind;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JsonNodeSubstitutionSourceTest {

    private JsonNodeSubstitutionSource source;

    @BeforeEach
    void setUp() throws Exception {
        ObjectNode values =
                (ObjectNode)
                        new ObjectMapper()
                                .readTree(
                                        "{\"int\":42,\"dbl\":1234.5,\"big\":123456789012345678901,"
                                                + "\"text\":\"Ada\",\"flag\":true,\"none\":null,"
                                                + "\"list\":[1, 2],\"obj\":{\"a\": \"b\"}}");
        source = new JsonNodeSubstitutionSource(values);
    }

    @Test
    void shouldKeepParsedNumberTypes() {
        assertThat(source.resolve("int", null)).contains(new NumberValue(42));
        assertThat(source.resolve("dbl", null)).contains(new NumberValue(1234.5));
        assertThat(source.resolve("big", null))
                .contains(new NumberValue(new BigInteger("123456789012345678901")));
    }

    @Test
    void shouldMapTextAndScalars() {
        assertThat(source.resolve("text", null)).contains(new TextValue("Ada"));
        assertThat(source.resolve("flag", null)).contains(new OtherValue(true));
        assertThat(source.resolve("none", null)).contains(new OtherValue(null));
    }

    @Test
    void shouldRenderContainersAsCompactJson() {
        Value list = source.resolve("list", null).orElseThrow();
        Value obj = source.resolve("obj", null).orElseThrow();

        assertThat(list.kind()).isEqualTo(ValueKind.OTHER);
        assertThat(((OtherValue) list).text()).isEqualTo("[1,2]");
        assertThat(((OtherValue) obj).text()).isEqualTo("{\"a\":\"b\"}");
    }

    @Test
    void shouldReportMissingKeyAsAbsent() {
        assertThat(source.resolve("missing", null)).isEmpty();
    }
}
