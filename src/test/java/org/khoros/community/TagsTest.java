package org.khoros.community;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.khoros.community.KhorosError.KhorosException;
import org.khoros.community.testing.FakeTransport;
import org.khoros.community.transport.HttpMethod;
import org.khoros.community.transport.RequestBody;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TagsTest {

    FakeTransport transport;
    Tags tags;

    @BeforeEach
    void setUp() {
        transport = FakeTransport.create();
        tags = KhorosClient.builder()
                .communityUrl("https://community.example.com")
                .oauthAccessToken("token")
                .transport(transport)
                .initialBackoff(Duration.ZERO)
                .build()
                .tags();
    }

    @Test
    void singleTagPayload() {
        assertEquals(Map.of("data", Map.of("type", "tag", "text", "release")),
                Tags.structureSingleTagPayload("release"));
    }

    @Test
    void blankTagIsInvalid() {
        var ex = assertThrows(KhorosException.class, () -> Tags.structureSingleTagPayload(" "));
        assertEquals(KhorosError.CODE_INVALID_PAYLOAD_VALUE, ex.code());
    }

    @Test
    void messageTagsConvertOrSkipNonStrings() {
        var values = Arrays.<Object>asList("a", 2, null);

        assertEquals(List.of(Map.of("type", "tag", "text", "a"), Map.of("type", "tag", "text", "2")),
                Tags.structureTagsForMessage(values, false));
        assertEquals(List.of(Map.of("type", "tag", "text", "a")),
                Tags.structureTagsForMessage(values, true));
    }

    @Test
    void addTagPostsToMessageTags() {
        tags.addTagToMessage("release", "1234", true);

        var request = transport.assertRequested(HttpMethod.POST, "/api/2.0/messages/1234/tags");
        assertEquals("{\"data\":{\"type\":\"tag\",\"text\":\"release\"}}",
                assertInstanceOf(RequestBody.JsonPayload.class, request.body()).encode());
    }

    @Test
    void failureRaisesWhenAllowed() {
        transport.enqueue(404, "{\"status\":\"error\",\"message\":\"Message not found\"}");

        var ex = assertThrows(KhorosException.class, () -> tags.addTagToMessage("t", "999", true));

        assertEquals(KhorosError.CODE_POST_REQUEST, ex.code());
        assertEquals(404, ex.statusCode());
    }

    @Test
    void failureIsLoggedOtherwise() {
        transport.enqueue(404, "{\"status\":\"error\",\"message\":\"Message not found\"}");

        assertDoesNotThrow(() -> tags.addTagsToMessage(List.of("a", "b"), "999", false));
        transport.assertRequestCount(2);
    }

    @Test
    void messageIdIsRequired() {
        var ex = assertThrows(KhorosException.class, () -> tags.addTagToMessage("t", "", false));
        assertEquals(KhorosError.CODE_MISSING_REQUIRED_DATA, ex.code());
    }
}
