package com.rapid.analyzer.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads controller files, which are UTF-8 on newer RobotWare and windows-1252 on older systems.
 */
public final class SourceReader {

    private static final Logger log = LoggerFactory.getLogger(SourceReader.class);

    public static final Charset FALLBACK_CHARSET = Charset.forName("windows-1252");

    private SourceReader() {
    }

    /**
     * @throws IOException when the file is unreadable or valid in neither encoding
     */
    public static List<String> readLines(Path file) throws IOException {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.debug("{} is not valid UTF-8, retrying as {}", file, FALLBACK_CHARSET.name());
            return Files.readAllLines(file, FALLBACK_CHARSET);
        }
    }
}
