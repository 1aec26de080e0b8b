package com.mobilebackup.importer.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AttributeLabelCodecTest {

    @Test
    void knownPhoneLabels() {
        assertEquals("mobile", AttributeLabelCodec.phoneLabel(1));
        assertEquals("home fax", AttributeLabelCodec.phoneLabel(5));
        assertEquals("pager", AttributeLabelCodec.phoneLabel(7));
    }

    @Test
    void knownEmailLabels() {
        assertEquals("home", AttributeLabelCodec.emailLabel(1));
        assertEquals("work", AttributeLabelCodec.emailLabel(2));
    }

    @Test
    void unknownCodesFallBackToOther() {
        assertEquals("other", AttributeLabelCodec.phoneLabel(42));
        assertEquals("other", AttributeLabelCodec.phoneLabel(null));
        assertEquals("other", AttributeLabelCodec.emailLabel(9));
    }
}
