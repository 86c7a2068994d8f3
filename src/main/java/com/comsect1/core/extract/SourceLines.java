package com.comsect1.core.extract;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a source file as UTF-8 lines.
 */
public final class SourceLines {

    private SourceLines() {
        // utility class
    }

    /** Malformed input is an error ({@link java.nio.charset.MalformedInputException}). */
    public static List<String> readStrict(Path path) {
        try {
            byte[] bytes = Files.readAllBytes(path);
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return text.lines().toList();
        } catch (IOException e) {
            throw new SourceReadException(path, e);
        }
    }

    /** Malformed input is replaced. */
    public static List<String> readLenient(Path path) {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8).lines().toList();
        } catch (IOException e) {
            throw new SourceReadException(path, e);
        }
    }
}
