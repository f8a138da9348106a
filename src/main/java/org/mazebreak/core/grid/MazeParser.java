package org.mazebreak.core.grid;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads mazes from plain text.
 *
 * <p>One row per line. Tiles are either written compactly ({@code 0110}) or separated
 * by whitespace and/or commas ({@code 0 1 1 0}, {@code 0,1,1,0}). Blank lines and lines
 * starting with {@code #} are skipped, as is a leading byte order mark. Shape is validated later by {@link Grid#of(int[][])}.</p>
 */
@UtilityClass
public final class MazeParser {
    private static final Pattern SEPARATOR = Pattern.compile("[\\s,]+");
    private static final String COMMENT_PREFIX = "#";
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Parses a maze file encoded as UTF-8.
     *
     * @throws IOException when the file cannot be read.
     * @throws InvalidMazeException when a tile token is not 0 or 1.
     */
    public static int[][] parse(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    /**
     * Parses an in-memory maze description.
     */
    public static int[][] parse(String text) {
        Objects.requireNonNull(text, "text");
        try {
            return parse(new StringReader(text));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * Parses all rows available from {@code reader}. The reader is not closed.
     */
    public static int[][] parse(Reader reader) throws IOException {
        BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        List<int[]> rows = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = buffered.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
                line = line.substring(1);
            }
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            rows.add(parseRow(trimmed, lineNumber));
        }
        return rows.toArray(new int[0][]);
    }

    private static int[] parseRow(String line, int lineNumber) {
        if (!SEPARATOR.matcher(line).find()) {
            String[] chars = line.split("");
            int[] row = new int[chars.length];
            for (int i = 0; i < chars.length; i++) {
                row[i] = parseTile(chars[i], lineNumber, i);
            }
            return row;
        }
        // leading, trailing or doubled separators leave empty tokens behind
        IntArrayList row = new IntArrayList();
        for (String token : SEPARATOR.split(line)) {
            if (!token.isEmpty()) {
                row.add(parseTile(token, lineNumber, row.size()));
            }
        }
        return row.toIntArray();
    }

    private static int parseTile(String token, int lineNumber, int column) {
        if (token.length() == 1) {
            char c = token.charAt(0);
            if (c == '0') {
                return Tile.FLOOR.code();
            }
            if (c == '1') {
                return Tile.WALL.code();
            }
        }
        throw new InvalidMazeException(
                InvalidMazeException.REASON_MAZE_UNPARSEABLE,
                "line " + lineNumber + ", column " + (column + 1) + ": expected 0 or 1, got '" + token + "'"
        );
    }
}
