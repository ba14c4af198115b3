package com.automation.engine.query;

import com.automation.core.exception.InvalidPageTokenException;
import com.automation.core.json.AutomationJson;
import com.automation.core.query.EventFilter;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageTokenCodecTest {

    private static final String SECRET = "page-secret";

    private final PageTokenCodec codec = new PageTokenCodec(AutomationJson.mapper(), SECRET);

    private static EventFilter resolvedFilter() {
        return EventFilter.builder()
            .event(EventFilter.EventNameFilter.prefixes("prefect.flow-run."))
            .order(EventFilter.Order.ASC)
            .build()
            .resolve(Instant.parse("2024-03-01T12:00:00Z"));
    }

    private static String signed(String json) throws Exception {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        return encoder.encodeToString(body) + "." + encoder.encodeToString(mac.doFinal(body));
    }

    @Test
    void decode_shouldRestoreFilterAndPosition() {
        PageToken token = new PageToken(resolvedFilter(), 50, 25);

        PageToken decoded = codec.decode(codec.encode(token));

        assertThat(decoded).isEqualTo(token);
        assertThat(decoded.filter().occurred().since()).isEqualTo(Instant.parse("2024-02-29T12:00:00Z"));
        assertThat(decoded.filter().order()).isEqualTo(EventFilter.Order.ASC);
    }

    @Test
    void encode_shouldBeUrlSafe() {
        String encoded = codec.encode(new PageToken(resolvedFilter(), 0, 50));

        assertThat(encoded).matches("[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+");
    }

    @Test
    void decode_signatureFromAnotherKey_shouldBeRejected() {
        String foreign = new PageTokenCodec(AutomationJson.mapper(), "").encode(new PageToken(resolvedFilter(), 0, 50));

        assertThatThrownBy(() -> codec.decode(foreign))
            .isInstanceOf(InvalidPageTokenException.class)
            .hasMessageContaining("signature");
    }

    @Test
    void decode_malformedInput_shouldBeRejected() {
        assertThatThrownBy(() -> codec.decode(null)).isInstanceOf(InvalidPageTokenException.class);
        assertThatThrownBy(() -> codec.decode("abc")).isInstanceOf(InvalidPageTokenException.class);
        assertThatThrownBy(() -> codec.decode(".abc")).isInstanceOf(InvalidPageTokenException.class);
        assertThatThrownBy(() -> codec.decode("ab$c.def")).isInstanceOf(InvalidPageTokenException.class);
    }

    @Test
    void decode_signedButIncompleteBody_shouldBeRejected() throws Exception {
        String noFilter = signed("{\"offset\":10,\"page_size\":5}");
        String negativeOffset = signed("{\"filter\":{},\"offset\":-1,\"page_size\":5}");
        String notJson = signed("not json");

        assertThatThrownBy(() -> codec.decode(noFilter)).hasMessageContaining("incomplete");
        assertThatThrownBy(() -> codec.decode(negativeOffset)).hasMessageContaining("incomplete");
        assertThatThrownBy(() -> codec.decode(notJson)).hasMessageContaining("unreadable");
    }
}
