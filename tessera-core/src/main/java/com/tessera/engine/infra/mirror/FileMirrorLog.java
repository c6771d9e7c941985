/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.mirror;

import com.tessera.engine.api.IMirrorLog;
import com.tessera.engine.api.exceptions.StorageException;
import com.tessera.engine.api.model.Event;
import com.tessera.engine.api.model.MirrorRecord;
import com.tessera.engine.api.model.MirrorSettings;
import com.tessera.engine.api.model.MirrorVerification;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Mirror log on the local filesystem.
 *
 * <p>Each instance writes {@code <location>/<engineId>/events.jsonl}, where
 * the location is the instance's {@code mirrorLocation} or the configured
 * root. Appends are forced to disk before {@link #record} returns. Sequence
 * numbers start at 1 and continue from the last readable line after a
 * restart.
 *
 * <p>A destroyed instance keeps its log and the log stays readable for
 * replay. {@link #release} closes the file; only a custom location is
 * remembered afterwards so the history can still be found.
 */
public class FileMirrorLog implements IMirrorLog {
    private static final Logger logger = Logger.getLogger(FileMirrorLog.class.getName());

    public static final String LOG_FILE = "events.jsonl";

    private final Path root;
    private final ConcurrentMap<String, MirrorSettings> settings = new ConcurrentHashMap<>();
    private final ConcurrentMap<Path, Appender> appenders = new ConcurrentHashMap<>();

    public FileMirrorLog(Path root) {
        this.root = root;
    }

    @Override
    public void configure(String engineId, MirrorSettings newSettings) {
        MirrorSettings effective = newSettings == null ? MirrorSettings.DISABLED : newSettings;
        settings.compute(engineId, (id, previous) -> {
            // keep pointing at the old history when mirroring is switched off
            if (!effective.enabled() && previous != null && previous.location() != null) {
                return new MirrorSettings(false, previous.type(), previous.location());
            }
            return effective;
        });
        logger.fine(() -> String.format("Mirroring for '%s': %s", engineId, effective.enabled() ? logFile(engineId) : "off"));
    }

    @Override
    public boolean isEnabled(String engineId) {
        MirrorSettings current = settings.get(engineId);
        return current != null && current.enabled();
    }

    @Override
    public Optional<MirrorSettings> settings(String engineId) {
        return Optional.ofNullable(settings.get(engineId));
    }

    @Override
    public MirrorRecord record(String engineId, Event event) {
        if (!isEnabled(engineId)) {
            throw new IllegalStateException("Mirroring is not enabled for engine '" + engineId + "'");
        }
        Path file = logFile(engineId);
        return appenders.computeIfAbsent(file, Appender::new).append(engineId, event);
    }

    @Override
    public List<MirrorRecord> read(String engineId) {
        Path file = logFile(engineId);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<MirrorRecord> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                Optional<MirrorRecord> record = MirrorLines.decode(line);
                if (record.isPresent()) {
                    records.add(record.get());
                } else if (!line.isBlank()) {
                    logger.warning(String.format("Skipping unreadable mirror record at %s:%d", file, lineNumber));
                }
            }
        } catch (IOException e) {
            throw new StorageException(engineId, "Failed to read mirror log " + file, e);
        }
        records.sort(Comparator.comparingLong(MirrorRecord::sequence));
        return records;
    }

    @Override
    public MirrorVerification verify(String engineId) {
        Path file = logFile(engineId);
        if (!Files.exists(file)) {
            return new MirrorVerification(engineId, 0, 0, List.of());
        }
        List<String> gaps = new ArrayList<>();
        long count = 0;
        long last = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Optional<MirrorRecord> record = MirrorLines.decode(line);
                if (record.isEmpty()) {
                    gaps.add("Torn or unreadable record at line " + lineNumber);
                    continue;
                }
                long sequence = record.get().sequence();
                if (sequence != last + 1) {
                    gaps.add(String.format("Sequence gap at line %d: expected %d but found %d", lineNumber, last + 1, sequence));
                }
                last = Math.max(last, sequence);
                count++;
            }
        } catch (IOException e) {
            throw new StorageException(engineId, "Failed to verify mirror log " + file, e);
        }
        return new MirrorVerification(engineId, count, last, gaps);
    }

    @Override
    public void release(String engineId) {
        Appender appender = appenders.remove(logFile(engineId));
        if (appender != null) {
            appender.close();
        }
        settings.computeIfPresent(engineId, (id, current) -> current.location() == null
                ? null
                : new MirrorSettings(false, current.type(), current.location()));
        logger.fine(() -> "Released mirror log of '" + engineId + "'");
    }

    @Override
    public void close() {
        appenders.values().forEach(Appender::close);
        appenders.clear();
    }

    int openAppenders() {
        return appenders.size();
    }

    Path logFile(String engineId) {
        MirrorSettings current = settings.get(engineId);
        Path base = current != null && current.location() != null ? current.location() : root;
        return base.resolve(engineId).resolve(LOG_FILE);
    }

    /**
     * Serialized writer for one log file.
     */
    private static final class Appender {
        private final Path file;
        private FileChannel channel;
        private long nextSequence;

        Appender(Path file) {
            this.file = file;
        }

        synchronized MirrorRecord append(String engineId, Event event) {
            try {
                open();
                MirrorRecord record = new MirrorRecord(engineId, nextSequence, event);
                ByteBuffer buffer = ByteBuffer.wrap((MirrorLines.encode(record) + "\n").getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(false);
                nextSequence++;
                return record;
            } catch (IOException e) {
                // reopen on next append so the sequence is recovered from disk
                close();
                throw new StorageException(engineId, "Failed to mirror event to " + file, e);
            }
        }

        private void open() throws IOException {
            if (channel != null) {
                return;
            }
            Files.createDirectories(file.getParent());
            nextSequence = recoverLastSequence() + 1;
            channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            if (endsMidLine()) {
                // isolate a torn tail so it stays detectable and never merges with the next record
                channel.write(ByteBuffer.wrap("\n".getBytes(StandardCharsets.UTF_8)));
            }
        }

        private long recoverLastSequence() throws IOException {
            if (!Files.exists(file)) {
                return 0;
            }
            long last = 0;
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    Optional<MirrorRecord> record = MirrorLines.decode(line);
                    if (record.isPresent()) {
                        last = Math.max(last, record.get().sequence());
                    }
                }
            }
            return last;
        }

        private boolean endsMidLine() throws IOException {
            try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
                long length = raf.length();
                if (length == 0) {
                    return false;
                }
                raf.seek(length - 1);
                return raf.read() != '\n';
            }
        }

        synchronized void close() {
            if (channel == null) {
                return;
            }
            try {
                channel.close();
            } catch (IOException e) {
                logger.log(Level.WARNING, "Failed to close mirror log " + file, e);
            } finally {
                channel = null;
            }
        }
    }
}
