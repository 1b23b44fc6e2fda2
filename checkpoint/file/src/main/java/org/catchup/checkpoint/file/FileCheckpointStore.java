/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.catchup.checkpoint.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.catchup.checkpoint.CheckpointStore;
import org.catchup.eventsource.StringBasedSubscriptionPosition;
import org.catchup.eventsource.SubscriptionPosition;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;
import static java.util.Objects.requireNonNull;

/**
 * A {@link CheckpointStore} that stores one JSON file per projection in a directory. A checkpoint is first written to a
 * temporary file which is forced to disk and then atomically renamed to its final name, so a crash never leaves a
 * half-written checkpoint behind.
 * <p>
 * The file for a projection looks like this:
 * <pre>
 * {"projection":"orders","position":"102","updatedAt":"2024-05-01T10:15:30.123Z"}
 * </pre>
 */
public class FileCheckpointStore implements CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);
    private static final String FILE_SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Create a {@link FileCheckpointStore} that stores checkpoints in the given directory. The directory is created if it doesn't exist.
     */
    public FileCheckpointStore(Path directory) {
        this(directory, new ObjectMapper(), Clock.systemUTC());
    }

    /**
     * @param directory    The directory in which to store checkpoint files
     * @param objectMapper The {@link ObjectMapper} used to read and write checkpoint files
     * @param clock        The clock used to generate the {@code updatedAt} timestamp
     */
    public FileCheckpointStore(Path directory, ObjectMapper objectMapper, Clock clock) {
        requireNonNull(directory, "directory cannot be null");
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create checkpoint directory " + directory, e);
        }
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    @Nullable
    public SubscriptionPosition read(String projectionName) {
        Path file = checkpointFile(projectionName);
        try {
            CheckpointDocument document = objectMapper.readValue(Files.readAllBytes(file), CheckpointDocument.class);
            return new StringBasedSubscriptionPosition(document.position());
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint for projection " + projectionName + " from " + file, e);
        }
    }

    @Override
    public SubscriptionPosition save(String projectionName, SubscriptionPosition subscriptionPosition) {
        requireNonNull(subscriptionPosition, SubscriptionPosition.class.getSimpleName() + " cannot be null");
        Path file = checkpointFile(projectionName);
        CheckpointDocument document = new CheckpointDocument(projectionName, subscriptionPosition.asString(), Instant.now(clock).toString());
        Path tempFile = null;
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(document);
            tempFile = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try (FileChannel channel = FileChannel.open(tempFile, WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(tempFile, file);
            log.trace("Saved checkpoint {} for projection {}", subscriptionPosition.asString(), projectionName);
            return subscriptionPosition;
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new UncheckedIOException("Failed to save checkpoint for projection " + projectionName + " to " + file, e);
        }
    }

    @Override
    public void delete(String projectionName) {
        Path file = checkpointFile(projectionName);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete checkpoint for projection " + projectionName, e);
        }
    }

    @Override
    public boolean exists(String projectionName) {
        return Files.exists(checkpointFile(projectionName));
    }

    private Path checkpointFile(String projectionName) {
        requireNonNull(projectionName, "projectionName cannot be null");
        if (projectionName.isBlank()) {
            throw new IllegalArgumentException("projectionName cannot be blank");
        }
        return directory.resolve(URLEncoder.encode(projectionName, UTF_8) + FILE_SUFFIX);
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("File system doesn't support atomic moves, falling back to a regular move for {}", target);
            Files.move(source, target, REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(@Nullable Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temporary checkpoint file {}", file, e);
        }
    }

    record CheckpointDocument(String projection, String position, String updatedAt) {
    }
}
