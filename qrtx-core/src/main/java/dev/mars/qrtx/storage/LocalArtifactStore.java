/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.qrtx.storage;

import dev.mars.qrtx.core.exceptions.ArtifactStoreException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Filesystem artifact store.
 *
 * <pre>
 * {root}/{jobId}/artifacts/{stageId}/{kind}.bin
 * {root}/{jobId}/checkpoints/{sequence}-{stageId}.json
 * </pre>
 *
 * <p>Every write goes to a temporary file in the target directory and is then moved into
 * place atomically, so a reader sees either the previous content or the new one. Blocking
 * I/O runs on the Vert.x worker pool.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class LocalArtifactStore implements ArtifactStore {
    private static final Logger logger = LoggerFactory.getLogger(LocalArtifactStore.class);

    private static final String ARTIFACTS_DIR = "artifacts";
    private static final String CHECKPOINTS_DIR = "checkpoints";

    private final Vertx vertx;
    private final Path root;

    public LocalArtifactStore(Vertx vertx, Path root) {
        this.vertx = vertx;
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public Future<ArtifactRef> persist(String jobId, String stageId, ArtifactKind kind, byte[] bytes) {
        return vertx.executeBlocking(() -> {
            ArtifactRef ref = newRef(() -> new ArtifactRef(jobId, stageId, kind));
            Path target = artifactPath(ref);
            writeAtomically(target, bytes);
            logger.debug("Persisted {} ({} bytes)", ref, bytes.length);
            return ref;
        }, false);
    }

    @Override
    public Future<byte[]> retrieve(ArtifactRef ref) {
        return vertx.executeBlocking(() -> read(artifactPath(ref), ref.toUri()), false);
    }

    @Override
    public Future<CheckpointRef> checkpointWrite(String jobId, String stageId, long sequence, byte[] bytes) {
        return vertx.executeBlocking(() -> {
            CheckpointRef ref = newRef(() -> new CheckpointRef(jobId, stageId, sequence));
            writeAtomically(checkpointPath(ref), bytes);
            logger.debug("Wrote checkpoint {}", ref);
            return ref;
        }, false);
    }

    @Override
    public Future<byte[]> checkpointRead(CheckpointRef ref) {
        return vertx.executeBlocking(() -> read(checkpointPath(ref), ref.toUri()), false);
    }

    @Override
    public Future<List<CheckpointRef>> listCheckpoints(String jobId) {
        return vertx.executeBlocking(() -> {
            newRef(() -> StorageNames.requireValidSegment(jobId, "job id"));
            Path dir = root.resolve(jobId).resolve(CHECKPOINTS_DIR);
            if (!Files.isDirectory(dir)) {
                return Collections.<CheckpointRef>emptyList();
            }
            List<CheckpointRef> refs = new ArrayList<>();
            try (Stream<Path> files = Files.list(dir)) {
                files.map(p -> p.getFileName().toString())
                        .filter(name -> name.endsWith(".json"))
                        .forEach(name -> {
                            try {
                                refs.add(CheckpointRef.fromFileName(jobId, name));
                            } catch (IllegalArgumentException e) {
                                logger.warn("Ignoring unrecognised file {} in {}", name, dir);
                            }
                        });
            } catch (IOException e) {
                throw new ArtifactStoreException("Failed to list checkpoints of job " + jobId, e);
            }
            Collections.sort(refs);
            return refs;
        }, false);
    }

    @Override
    public Future<List<String>> listJobs() {
        return vertx.executeBlocking(() -> {
            if (!Files.isDirectory(root)) {
                return Collections.<String>emptyList();
            }
            try (Stream<Path> dirs = Files.list(root)) {
                return dirs.filter(Files::isDirectory)
                        .map(p -> p.getFileName().toString())
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new ArtifactStoreException("Failed to list jobs under " + root, e);
            }
        }, false);
    }

    private Path artifactPath(ArtifactRef ref) {
        return root.resolve(ref.jobId()).resolve(ARTIFACTS_DIR).resolve(ref.stageId())
                .resolve(ref.kind().getFileStem() + ".bin");
    }

    private Path checkpointPath(CheckpointRef ref) {
        return root.resolve(ref.jobId()).resolve(CHECKPOINTS_DIR).resolve(ref.fileName());
    }

    private void writeAtomically(Path target, byte[] bytes) throws ArtifactStoreException {
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString() + "_", ".tmp");
            Files.write(temp, bytes);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ArtifactStoreException("Failed to write " + target, e);
        }
    }

    private byte[] read(Path path, String uri) throws ArtifactStoreException {
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new ArtifactStoreException("Artifact not found: " + uri, e);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read " + uri, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Failed to delete temporary file {}: {}", temp, e.getMessage());
        }
    }

    private static <T> T newRef(RefFactory<T> factory) throws ArtifactStoreException {
        try {
            return factory.create();
        } catch (IllegalArgumentException e) {
            throw new ArtifactStoreException(e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface RefFactory<T> {
        T create();
    }
}
