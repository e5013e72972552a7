package com.finlens.backend.services.statements.csv;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import com.finlens.backend.dto.ParseDiagnostics;
import com.finlens.backend.exceptions.EncodingException;

import lombok.extern.slf4j.Slf4j;

/**
 * Decodes CSV bytes with the first encoding (in priority order) that decodes cleanly.
 */
@Slf4j
final class CsvDecoder {

    static final String UTF8_BOM = "UTF-8-BOM";

    private static final byte[] BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private CsvDecoder() {}

    static String decode(byte[] bytes, List<String> encodings, ParseDiagnostics diagnostics) {
        for (String encoding : encodings) {
            diagnostics.recordAttempt(encoding);
            String text = tryDecode(bytes, encoding);
            if (text != null) {
                diagnostics.setEncoding(encoding);
                return text;
            }
        }
        throw new EncodingException(diagnostics.getEncodingsAttempted());
    }

    private static String tryDecode(byte[] bytes, String encoding) {
        boolean bomVariant = UTF8_BOM.equalsIgnoreCase(encoding);
        boolean hasBom = startsWithBom(bytes);

        Charset charset;
        if (bomVariant) {
            if (!hasBom) return null;
            charset = StandardCharsets.UTF_8;
        } else {
            try {
                charset = Charset.forName(encoding);
            } catch (IllegalArgumentException e) {
                log.warn("[CsvStatement] unknown encoding '{}' skipped", encoding);
                return null;
            }
            // Plain UTF-8 leaves BOM-prefixed input to the BOM variant.
            if (StandardCharsets.UTF_8.equals(charset) && hasBom) return null;
        }

        int offset = bomVariant ? BOM.length : 0;
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset)).toString();
            if (text.indexOf('\u0000') >= 0) {
                log.debug("[CsvStatement] {} decode produced NUL characters", encoding.toUpperCase(Locale.ROOT));
                return null;
            }
            return text;
        } catch (CharacterCodingException e) {
            log.debug("[CsvStatement] {} decode failed: {}", encoding, e.getMessage());
            return null;
        }
    }

    private static boolean startsWithBom(byte[] bytes) {
        return bytes.length >= BOM.length
                && bytes[0] == BOM[0]
                && bytes[1] == BOM[1]
                && bytes[2] == BOM[2];
    }
}
