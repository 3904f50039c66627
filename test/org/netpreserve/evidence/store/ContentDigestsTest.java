package org.netpreserve.evidence.store;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ContentDigestsTest {
    @Test
    void matchesTheFormatCdxReports() {
        assertEquals("FKXGYNOJJ7H3IFO35FPUBC445EPOQRXN",
                ContentDigests.sha1("hello world".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("3I42H3S6NNFQ2MSVX7XZKYAYSCX5QBYJ", ContentDigests.sha1(new byte[0]));
    }

    @Test
    void validatesDigests() {
        assertTrue(ContentDigests.isValid("FKXGYNOJJ7H3IFO35FPUBC445EPOQRXN"));
        assertFalse(ContentDigests.isValid("fkxgynojj7h3ifo35fpubc445epoqrxn"));
        assertFalse(ContentDigests.isValid("FKXGYNOJJ7H3IFO35FPUBC445EPOQRX"));
        assertFalse(ContentDigests.isValid("../../../../../../../etc/passwd0"));
        assertFalse(ContentDigests.isValid("FKXGYNOJJ7H3IFO35FPUBC445EPOQRX1"));
    }
}
