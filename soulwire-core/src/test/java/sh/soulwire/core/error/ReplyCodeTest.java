// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ReplyCodeTest {

    @Test
    void formatsCodeWithDetail() {
        assertEquals("ERR_SYNTAX missing category", ReplyCode.ERR_SYNTAX.format("missing category"));
        assertEquals("ERR_LIMIT", ReplyCode.ERR_LIMIT.format(null));
        assertEquals("ERR_LIMIT", ReplyCode.ERR_LIMIT.format("  "));
    }

    @Test
    void detailCannotInjectLines() {
        assertEquals("ERR_SYNTAX a  b", ReplyCode.ERR_SYNTAX.format("a\r\nb"));
    }

    @Test
    void exceptionsCarryTheirCode() {
        assertEquals(ReplyCode.ERR_UNKNOWN_SOUL, new UnknownSoulException("ghost").replyCode());
        assertEquals(ReplyCode.ERR_INVALID_PRICE, new InvalidPriceException("-1").replyCode());
        assertEquals(ReplyCode.ERR_LIMIT, new AdmissionLimitException("bob", 3).replyCode());
        assertEquals(ReplyCode.ERR_SYNTAX, new ProtocolException("bad").replyCode());
        assertEquals(ReplyCode.ERR_INTERNAL, new PersistenceException("disk").replyCode());
        assertEquals(ReplyCode.ERR_UNKNOWN_COMMAND,
                new ProtocolException(ReplyCode.ERR_UNKNOWN_COMMAND, "FROB").replyCode());
    }

    @Test
    void everyFailureIsASoulwireException() {
        final RuntimeException ex = new NotAuthenticatedException("LIST");
        assertInstanceOf(SoulwireException.class, ex);
        assertEquals(ReplyCode.ERR_NOT_AUTHENTICATED, ((SoulwireException) ex).replyCode());
    }
}
