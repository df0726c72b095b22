package io.statsheets.season;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.statsheets.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Writes each record to {@code <root>/<category>/<segments...>.json}, creating parent directories and overwriting
 * whatever is already there. Writes run on the supplied I/O executor.
 */
public class RecordWriter {
    private static final Logger log = LoggerFactory.getLogger(RecordWriter.class);

    public static final String GAMES = "games";
    public static final String PLAYERS = "players";

    private final Path root;
    private final ObjectWriter json;
    private final Executor io;
    private final Metrics metrics;

    public RecordWriter(Path root, ObjectMapper mapper, Executor io, Metrics metrics) {
        this.root = root;
        this.json = mapper.writer();
        this.io = io;
        this.metrics = metrics;
    }

    public CompletableFuture<Path> writeGame(int day, GameUpdate game) {
        return write(GAMES, List.of(Integer.toString(day), game.homeTeamId()), game);
    }

    public CompletableFuture<Path> writePlayer(int day, PlayerStatsheet stats) {
        return write(PLAYERS, List.of(stats.playerId(), Integer.toString(day)), stats);
    }

    public CompletableFuture<Path> write(String category, List<String> segments, Object record) {
        Path path;
        try {
            path = resolve(category, segments);
        } catch (FilesystemException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.supplyAsync(() -> {
            byte[] bytes;
            try {
                bytes = json.writeValueAsBytes(record);
            } catch (JsonProcessingException e) {
                throw new FilesystemException(path, "could not serialize record", e);
            }
            log.debug("writing {}", path);
            try {
                Files.createDirectories(path.getParent());
                Files.write(path, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            } catch (IOException e) {
                throw new FilesystemException(path, e);
            }
            metrics.counter("records.written." + category).inc();
            log.debug("written {}", path);
            return path;
        }, io);
    }

    /** Target path for a record; the last segment becomes the file name with a {@code .json} extension. */
    public Path resolve(String category, List<String> segments) {
        if (segments.isEmpty()) throw new FilesystemException(root.resolve(category), "no file name given", null);
        try {
            Path path = root.resolve(checked(category));
            for (int i = 0; i < segments.size() - 1; i++) {
                path = path.resolve(checked(segments.get(i)));
            }
            return path.resolve(checked(segments.get(segments.size() - 1)) + ".json");
        } catch (InvalidPathException e) {
            throw new FilesystemException(root, "illegal path segment in " + segments, e);
        }
    }

    // ids come from the service; keep them from stepping outside the output tree
    private String checked(String segment) {
        if (segment == null || segment.isEmpty() || segment.equals(".") || segment.equals("..")
                || segment.indexOf('/') >= 0 || segment.indexOf('\\') >= 0 || segment.indexOf('\0') >= 0) {
            throw new FilesystemException(root, "illegal path segment '" + segment + "'", null);
        }
        return segment;
    }
}
