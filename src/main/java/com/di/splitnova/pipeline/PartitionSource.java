package com.di.splitnova.pipeline;

import org.apache.beam.sdk.io.Compression;
import org.apache.beam.sdk.io.FileSystems;
import org.apache.beam.sdk.io.fs.EmptyMatchTreatment;
import org.apache.beam.sdk.io.fs.MatchResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * One input partition: a single newline-delimited file and its stable partition index. When the
 * input is cached the lines travel with the element and the file is not opened again.
 */
public final class PartitionSource implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int index;
    private final String resourceId;
    private final List<String> cachedLines;

    private PartitionSource(int index, String resourceId, List<String> cachedLines) {
        this.index = index;
        this.resourceId = resourceId;
        this.cachedLines = cachedLines;
    }

    public static PartitionSource of(int index, String resourceId) {
        return new PartitionSource(index, resourceId, null);
    }

    /**
     * Matches {@code filePattern} and assigns partition indices in lexicographic order of the
     * matched resource ids, so the same input always yields the same index for each file.
     */
    public static List<PartitionSource> list(String filePattern) {
        List<String> ids = new ArrayList<>();
        try {
            MatchResult match = FileSystems.match(filePattern, EmptyMatchTreatment.ALLOW_IF_WILDCARD);
            for (MatchResult.Metadata metadata : match.metadata()) {
                if (!metadata.resourceId().isDirectory()) {
                    ids.add(metadata.resourceId().toString());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to match input pattern '" + filePattern + "'", e);
        }
        ids.sort(Comparator.naturalOrder());

        List<PartitionSource> sources = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            sources.add(of(i, ids.get(i)));
        }
        return sources;
    }

    public int getIndex() {
        return index;
    }

    public String getResourceId() {
        return resourceId;
    }

    public boolean isCached() {
        return cachedLines != null;
    }

    /** Returns a copy of this partition carrying all of its lines. */
    public PartitionSource withCachedLines() throws IOException {
        List<String> lines = new ArrayList<>();
        try (RecordIterator records = open()) {
            records.forEachRemaining(lines::add);
        }
        return new PartitionSource(index, resourceId, Collections.unmodifiableList(lines));
    }

    /**
     * Opens the partition's records in file order. Compressed files are decompressed based on their
     * extension.
     */
    public RecordIterator open() throws IOException {
        if (cachedLines != null) {
            return new RecordIterator(cachedLines.iterator(), null);
        }
        ReadableByteChannel channel = FileSystems.open(FileSystems.matchNewResource(resourceId, false));
        ReadableByteChannel decompressed = Compression.detect(resourceId).readDecompressed(channel);
        BufferedReader reader = new BufferedReader(
                new InputStreamReader(Channels.newInputStream(decompressed), StandardCharsets.UTF_8));
        return new RecordIterator(null, reader);
    }

    @Override
    public String toString() {
        return "PartitionSource{index=" + index + ", resourceId=" + resourceId + ", cached=" + isCached() + "}";
    }

    /** Line iterator over either cached lines or an open reader. */
    public static final class RecordIterator implements Iterator<String>, AutoCloseable {

        private final Iterator<String> cached;
        private final BufferedReader reader;
        private String next;

        private RecordIterator(Iterator<String> cached, BufferedReader reader) {
            this.cached = cached;
            this.reader = reader;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (cached != null) {
                if (cached.hasNext()) {
                    next = cached.next();
                }
                return next != null;
            }
            try {
                next = reader.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return next != null;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String out = next;
            next = null;
            return out;
        }

        @Override
        public void close() throws IOException {
            if (reader != null) {
                reader.close();
            }
        }
    }
}
