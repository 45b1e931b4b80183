package com.lbg.markets.surveillance.tail.split;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;

/**
 * Strict decoder: malformed or unmappable input is reported, never replaced.
 * Not thread-safe; each reader owns its own instance.
 */
public final class Decoder {

    private final CharsetDecoder decoder;

    Decoder(Charset charset) {
        this.decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    public String decode(byte[] data, int offset, int length) throws DecodeException {
        try {
            return decoder.decode(ByteBuffer.wrap(data, offset, length)).toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Failed to decode " + length + " bytes as " + decoder.charset(), e);
        }
    }

    public Charset charset() {
        return decoder.charset();
    }
}
