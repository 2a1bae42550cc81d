package com.mimecast.outpost.queue;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatusTest {

    private static final ErrorDetails ERROR = new ErrorDetails("mx.example.com",
            DeliveryError.unexpectedResponse("RCPT TO", SmtpResponse.parse("550 5.1.1 Mailbox not found")));

    @Test
    void testPending() {
        assertTrue(Status.scheduled().isPending());
        assertTrue(Status.temporaryFailure(ERROR).isPending());
        assertFalse(Status.permanentFailure(ERROR).isPending());
        assertFalse(Status.completed(new HostResponse("mx", SmtpResponse.parse("250 OK"))).isPending());
    }

    @Test
    void testIntoPermanent() {
        Status<HostResponse, ErrorDetails> temp = Status.temporaryFailure(ERROR);
        Status<HostResponse, ErrorDetails> perm = temp.intoPermanent();
        assertTrue(perm.isPermanent());
        assertEquals(ERROR, perm.getError().orElseThrow());

        Status<HostResponse, ErrorDetails> scheduled = Status.scheduled();
        assertSame(scheduled, scheduled.intoPermanent());
    }

    @Test
    void testIntoTemporary() {
        Status<HostResponse, ErrorDetails> perm = Status.permanentFailure(ERROR);
        Status<HostResponse, ErrorDetails> temp = perm.intoTemporary();
        assertTrue(temp.isTemporary());
        assertEquals(ERROR, temp.getError().orElseThrow());

        Status<HostResponse, ErrorDetails> done = Status.completed(new HostResponse("mx", SmtpResponse.parse("250 OK")));
        assertSame(done, done.intoTemporary());
    }

    @Test
    void testSmtpResponse() {
        SmtpResponse response = SmtpResponse.parse("550 5.1.1 Mailbox not found");
        assertEquals(550, response.getCode());
        assertEquals("5.1.1", response.getStatusCode());
        assertEquals("Mailbox not found", response.getMessage());

        SmtpResponse plain = SmtpResponse.parse("421 Try again later");
        assertEquals(421, plain.getCode());
        assertEquals("4.2.1", plain.getStatusCode());
        assertEquals("Try again later", plain.getMessage());
    }
}
