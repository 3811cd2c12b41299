package com.largomodo.shelfpack.util;

import com.largomodo.shelfpack.core.domain.BinRequest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses textual bin specifications of the form {@code WxH} or {@code ID=WxH}.
 * <p>
 * Zero dimensions are accepted so that batch packing can skip them the same
 * way it skips malformed programmatic requests.
 * <p>
 * Stateless utility. Safe for concurrent use.
 */
public class BinSpecParser {

    private static final Pattern SPEC_PATTERN =
            Pattern.compile("^(?:(-?\\d+)\\s*=\\s*)?(\\d+)\\s*[xX]\\s*(\\d+)$");

    private BinSpecParser() {
        // Static utility class - prevent instantiation
    }

    /**
     * Parses a single bin specification.
     *
     * @param spec Text such as {@code 12x16} or {@code 7=12x16}
     * @return a new request, carrying the id if one was given
     * @throws IllegalArgumentException if spec is null or does not match the expected form
     */
    public static BinRequest parse(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("Bin spec cannot be null");
        }

        Matcher matcher = SPEC_PATTERN.matcher(spec.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                    "Invalid bin spec '" + spec + "': expected WxH or ID=WxH"
            );
        }

        try {
            int w = Integer.parseInt(matcher.group(2));
            int h = Integer.parseInt(matcher.group(3));
            if (matcher.group(1) == null) {
                return new BinRequest(w, h);
            }
            return new BinRequest(Integer.parseInt(matcher.group(1)), w, h);
        } catch (NumberFormatException e) {
            // Digits matched but the value does not fit an int
            throw new IllegalArgumentException("Bin spec out of range: '" + spec + "'", e);
        }
    }

    /**
     * Reads one bin specification per line.
     * <p>
     * Blank lines and lines starting with {@code #} are ignored. Errors report the
     * 1-based line number.
     *
     * @param file UTF-8 text file
     * @return requests in file order
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if a line is not a valid bin spec
     */
    public static List<BinRequest> parseFile(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<BinRequest> requests = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            try {
                requests.add(parse(line));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        file.getFileName() + ":" + (i + 1) + ": " + e.getMessage(), e
                );
            }
        }
        return requests;
    }
}
