package com.example.workflowguard.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SnakeCase")
class SnakeCaseTest {

    @Test
    @DisplayName("accepts snake_case and whitespace-separated lowercase names")
    void acceptsValidNames() {
        assertTrue(SnakeCase.isValid("send_email"));
        assertTrue(SnakeCase.isValid("step2"));
        assertTrue(SnakeCase.isValid("send email"));
    }

    @Test
    @DisplayName("rejects camel case, hyphens, leading digits and null")
    void rejectsInvalidNames() {
        assertFalse(SnakeCase.isValid("SendEmail"));
        assertFalse(SnakeCase.isValid("send-email"));
        assertFalse(SnakeCase.isValid("2nd_step"));
        assertFalse(SnakeCase.isValid(null));
    }

    @Test
    @DisplayName("splits camel case and acronyms and collapses separators")
    void normalizes() {
        assertEquals("my_workflow", SnakeCase.normalize("My-Workflow"));
        assertEquals("my_trigger", SnakeCase.normalize("MyTrigger"));
        assertEquals("send_http_request", SnakeCase.normalize("sendHTTPRequest"));
        assertEquals("http_request", SnakeCase.normalize("HTTPRequest"));
        assertEquals("hello_world", SnakeCase.normalize("  Hello   World!! "));
        assertEquals("", SnakeCase.normalize("---"));
    }

    @Test
    @DisplayName("normalization is idempotent")
    void idempotent() {
        for (String name : List.of("My-Workflow", "sendHTTPRequest", "Fetch Data (v2)", "__x__", "already_snake", "ÄrgerNode")) {
            String once = SnakeCase.normalize(name);
            assertEquals(once, SnakeCase.normalize(once), name);
        }
    }
}
