package com.sharedsolve.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonProcessingService service = new JsonProcessingService(objectMapper);

    @Test
    void testReadObject() {
        assertTrue(service.readObject("{\"reply\":\"hi\"}").isPresent());
        assertEquals("hi", service.readObject("{\"reply\":\"hi\"}").get().get("reply").asText());
    }

    @Test
    void testReadObjectRejectsArraysAndScalars() {
        assertTrue(service.readObject("[1,2]").isEmpty());
        assertTrue(service.readObject("42").isEmpty());
        assertTrue(service.readTree("[1,2]").isPresent());
    }

    @Test
    void testParseEmptyResponse() {
        assertTrue(service.readObject("").isEmpty());
        assertTrue(service.readObject(null).isEmpty());
    }

    @Test
    void testParseInvalidJson() {
        assertFalse(service.isJsonObject("{invalid-json}"));
        assertFalse(service.isJsonObject("{\"a\":1} trailing"));
    }

    @Test
    void testRawNewlinesInsideStringsAreAccepted() {
        assertTrue(service.isJsonObject("{\"reply\":\"line one\nline two\"}"));
    }

    @Test
    void testTruncate() {
        assertEquals("a b", service.truncate("a\nb", 10));
        assertEquals("abc...", service.truncate("abcdef", 3));
        assertEquals("", service.truncate(null, 3));
    }

    @Test
    void testToJson() {
        String json = service.toJson(Map.of("name", "Alice"));
        assertTrue(json.contains("\"name\" : \"Alice\""));
    }
}
