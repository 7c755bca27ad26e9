package com.convsync.log;

import com.convsync.config.PublishIdempotencyProperties;
import com.convsync.domain.StreamEntryId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PublishIdempotencyTest {

    @Test
    void shouldReturnNullWhenClaimedFirstTime() {
        PublishIdempotency idem = new PublishIdempotency(new PublishIdempotencyProperties());

        assertNull(idem.putIfAbsent(idem.key(1L, "c1", "m1"), new PublishIdempotency.Claim()));
    }

    @Test
    void shouldReturnExistingWhenDuplicated() {
        PublishIdempotency idem = new PublishIdempotency(new PublishIdempotencyProperties());
        String key = idem.key(1L, "c1", "m1");
        PublishIdempotency.Claim first = new PublishIdempotency.Claim();
        first.setStreamEntryId(StreamEntryId.of(5, 0));
        idem.putIfAbsent(key, first);

        PublishIdempotency.Claim existed = idem.putIfAbsent(key, new PublishIdempotency.Claim());
        assertSame(first, existed);
        assertEquals(StreamEntryId.of(5, 0), existed.getStreamEntryId());
    }

    @Test
    void shouldNeverClaimWhenDisabled() {
        PublishIdempotencyProperties props = new PublishIdempotencyProperties();
        props.setEnabled(false);
        PublishIdempotency idem = new PublishIdempotency(props);
        String key = idem.key(1L, "c1", "m1");

        assertNull(idem.putIfAbsent(key, new PublishIdempotency.Claim()));
        assertNull(idem.putIfAbsent(key, new PublishIdempotency.Claim()));
    }

    @Test
    void keyShouldScopeByUserAndConversation() {
        PublishIdempotency idem = new PublishIdempotency(new PublishIdempotencyProperties());
        assertNotEquals(idem.key(1L, "c1", "m1"), idem.key(2L, "c1", "m1"));
        assertNotEquals(idem.key(1L, "c1", "m1"), idem.key(1L, "c2", "m1"));
    }
}
