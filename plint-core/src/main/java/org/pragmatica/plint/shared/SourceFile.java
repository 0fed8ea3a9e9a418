package org.pragmatica.plint.shared;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/// Source text together with the path it was read from.
public record SourceFile(Path path, String content) {
    /// Read a file as UTF-8, falling back to ISO-8859-1 when the bytes are not valid UTF-8.
    ///
    /// Perl reads source as bytes unless told otherwise, so Latin-1 files are legal input.
    ///
    /// @throws PlintException with [PlintError.SourceReadFailed] when the file cannot be read
    public static SourceFile read(Path path) {
        try {
            return new SourceFile(path, decode(Files.readAllBytes(path)));
        } catch (IOException e) {
            throw new PlintException(PlintError.sourceReadFailed(path.toString(), e), e);
        }
    }

    private static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                                         .onMalformedInput(CodingErrorAction.REPORT)
                                         .onUnmappableCharacter(CodingErrorAction.REPORT)
                                         .decode(ByteBuffer.wrap(bytes))
                                         .toString();
        } catch (CharacterCodingException e) {
            // every byte sequence is valid ISO-8859-1
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    public String fileName() {
        return path.toString();
    }
}
