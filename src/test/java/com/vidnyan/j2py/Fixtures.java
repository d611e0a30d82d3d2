package com.vidnyan.j2py;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads Java sources from src/test/resources/fixtures.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String load(String fileName) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + fileName)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + fileName);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
