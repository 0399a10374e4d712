package com.relgraph.common.status;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Status and StatusOr classes.
 */
public class StatusTest {

    @Test
    void testStatusCreation() {
        Status ok = Status.ok();
        assertTrue(ok.isOk());
        assertFalse(ok.isError());
        assertEquals(StatusCode.OK, ok.getCode());

        Status notFound = Status.notFound("Edge not found");
        assertFalse(notFound.isOk());
        assertTrue(notFound.isError());
        assertEquals(StatusCode.NOT_FOUND, notFound.getCode());
        assertEquals("Edge not found", notFound.getMessage());

        Exception exception = new RuntimeException("Test exception");
        Status internal = Status.internal("Internal error", exception);
        assertTrue(internal.isError());
        assertEquals(StatusCode.INTERNAL, internal.getCode());
        assertEquals(exception, internal.getCause());
    }

    @Test
    void testGraphViolationCodes() {
        assertTrue(Status.cycleDetected("a -> b -> a").getCode().isGraphViolation());
        assertTrue(Status.selfImplication("read implies itself").getCode().isGraphViolation());
        assertFalse(Status.invalidArgument("bad id").getCode().isGraphViolation());
        assertFalse(StatusCode.OK.isError());
    }

    @Test
    void testStatusOrWithValue() {
        StatusOr<String> statusOr = StatusOr.ofValue("test");
        assertTrue(statusOr.isOk());
        assertFalse(statusOr.isNotOk());
        assertEquals("test", statusOr.getValue());
        assertEquals(StatusCode.OK, statusOr.getCode());
    }

    @Test
    void testStatusOrWithError() {
        Status error = Status.invalidArgument("Invalid argument");
        StatusOr<String> statusOr = StatusOr.ofStatus(error);
        assertTrue(statusOr.isNotOk());
        assertEquals(error, statusOr.getStatus());
        assertEquals(StatusCode.INVALID_ARGUMENT, statusOr.getCode());
        assertThrows(IllegalStateException.class, statusOr::getValue);
        assertThrows(IllegalArgumentException.class, () -> StatusOr.ofStatus(Status.ok()));
    }

    @Test
    void testStatusOrFromException() {
        Exception exception = new RuntimeException("Test exception");
        StatusOr<String> statusOr = StatusOr.ofException(exception);
        assertEquals(StatusCode.INTERNAL, statusOr.getStatus().getCode());
        assertTrue(statusOr.getStatus().getMessage().contains("Test exception"));
        assertEquals(exception, statusOr.getStatus().getCause());
    }

    @Test
    void testStatusOrMap() {
        StatusOr<Integer> intStatusOr = StatusOr.ofValue(42);
        assertEquals("42", intStatusOr.map(i -> i.toString()).getValue());

        Status error = Status.aborted("lost the race");
        StatusOr<Integer> errorStatusOr = StatusOr.ofStatus(error);
        StatusOr<String> mapped = errorStatusOr.map(i -> i.toString());
        assertEquals(error, mapped.getStatus());
    }
}
