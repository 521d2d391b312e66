package io.blockchain.datastore.datastore;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SubEventTest {

    @Test
    void parsesSubscribeWithStart() {
        SubEvent ev = SubEvent.parse("subscribe:abcd:1000").orElseThrow();
        assertEquals(SubAction.START, ev.action());
        assertEquals(Namespace.loadString("abcd"), ev.namespace());
        assertEquals(1000L, ev.start());
    }

    @Test
    void parsesUnsubscribe() {
        SubEvent ev = SubEvent.parse("unsubscribe:abcd").orElseThrow();
        assertEquals(SubAction.END, ev.action());
        assertEquals(Namespace.loadString("abcd"), ev.namespace());
        assertEquals(0L, ev.start());
    }

    @Test
    void rejectsMalformedPayloads() {
        assertTrue(SubEvent.parse("bogus:abcd").isEmpty());
        assertTrue(SubEvent.parse("subscribe:ab").isEmpty());
        assertTrue(SubEvent.parse("subscribe").isEmpty());
        assertTrue(SubEvent.parse("").isEmpty());
        assertTrue(SubEvent.parse("SUBSCRIBE:abcd").isEmpty());
        assertTrue(SubEvent.parse(null).isEmpty());
    }

    @Test
    void unparsableStartFallsBackToZero() {
        SubEvent ev = SubEvent.parse("subscribe:abcd:soon").orElseThrow();
        assertEquals(SubAction.START, ev.action());
        assertEquals(0L, ev.start());
        assertEquals(0L, SubEvent.parse("subscribe:abcd:-5").orElseThrow().start());
    }

    @Test
    void acceptsFullUnsignedRangeAndIgnoresExtraSegments() {
        SubEvent ev = SubEvent.parse("subscribe:abcd:18446744073709551615:extra").orElseThrow();
        assertEquals(-1L, ev.start());
        assertEquals("subscribe:abcd:18446744073709551615", ev.toPayload());
    }

    @Test
    void payloadRoundTrip() {
        SubEvent ev = new SubEvent(SubAction.START, Namespace.loadString("wxyz"), 42L);
        assertEquals(ev, SubEvent.parse(ev.toPayload()).orElseThrow());
        assertEquals("unsubscribe:wxyz", new SubEvent(SubAction.END, Namespace.loadString("wxyz"), 0L).toPayload());
    }

    @Test
    void namespaceSegmentIsMeasuredInBytes() {
        byte[] wire = {'s', 'u', 'b', 's', 'c', 'r', 'i', 'b', 'e', ':', (byte) 0xC3, (byte) 0xA4, 'b', 'c'};
        SubEvent ev = SubEvent.parse(new String(wire, StandardCharsets.ISO_8859_1)).orElseThrow();
        assertArrayEquals(new byte[] {(byte) 0xC3, (byte) 0xA4, 'b', 'c'}, ev.namespace().bytes());

        byte[] tooLong = {'s', 'u', 'b', 's', 'c', 'r', 'i', 'b', 'e', ':', (byte) 0xC3, (byte) 0xA4, 'b', 'c', 'd'};
        assertTrue(SubEvent.parse(new String(tooLong, StandardCharsets.ISO_8859_1)).isEmpty());
    }
}
