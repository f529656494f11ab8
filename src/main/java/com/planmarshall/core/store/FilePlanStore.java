package com.planmarshall.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planmarshall.core.error.PlanNotFoundException;
import com.planmarshall.core.error.PlanStoreException;
import com.planmarshall.core.model.Deliverable;
import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.Plan;
import com.planmarshall.core.model.Task;
import com.planmarshall.core.support.PlanJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * {@link PlanStore} that keeps each plan as pretty-printed JSON files under
 * {@code <baseDir>/plans/<planId>/}.
 * <p>
 * A commit is journaled: changed artifacts are written to {@code .staging/}, a {@code COMMIT} marker
 * listing them is written last, then each artifact is moved into place atomically.
 * <p>
 * Reads never touch the disk layout: a staged commit with a marker is read as if it were applied and one
 * without a marker is ignored. Leftovers are rolled forward or discarded by {@link #recover(String)} and
 * before every commit. Within one store instance a read never observes a commit halfway.
 */
public class FilePlanStore implements PlanStore {

    private static final Logger log = LoggerFactory.getLogger(FilePlanStore.class);

    static final String PLANS_DIR = "plans";
    static final String STAGING_DIR = ".staging";
    static final String COMMIT_MARKER = "COMMIT";

    static final String PLAN_FILE = "plan.json";
    static final String REQUEST_FILE = "request.json";
    static final String DELIVERABLES_FILE = "deliverables.json";
    static final String TASKS_FILE = "tasks.json";
    static final String FINDINGS_FILE = "findings.json";

    private static final List<String> ARTIFACTS =
            List.of(PLAN_FILE, REQUEST_FILE, DELIVERABLES_FILE, TASKS_FILE, FINDINGS_FILE);

    private final Path plansRoot;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    public FilePlanStore(Path baseDir) {
        this(baseDir, PlanJson.mapper());
    }

    public FilePlanStore(Path baseDir, ObjectMapper objectMapper) {
        this.plansRoot = baseDir.resolve(PLANS_DIR);
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean exists(String planId) {
        return Files.isRegularFile(planDir(planId).resolve(PLAN_FILE))
                || Files.isRegularFile(planDir(planId).resolve(STAGING_DIR).resolve(COMMIT_MARKER));
    }

    @Override
    public PlanSnapshot load(String planId) {
        return find(planId).orElseThrow(() -> new PlanNotFoundException(planId));
    }

    @Override
    public Optional<PlanSnapshot> find(String planId) {
        Path dir = planDir(planId);
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        var lock = lockFor(planId).readLock();
        lock.lock();
        try {
            Map<String, Path> view = readView(dir);
            Path planFile = view.get(PLAN_FILE);
            if (!Files.isRegularFile(planFile)) {
                return Optional.empty();
            }
            Plan plan = objectMapper.readValue(planFile.toFile(), Plan.class);
            IntakeDocument intake = objectMapper.readValue(view.get(REQUEST_FILE).toFile(), IntakeDocument.class);
            List<Deliverable> deliverables = readList(view.get(DELIVERABLES_FILE), new TypeReference<>() {});
            List<Task> tasks = readList(view.get(TASKS_FILE), new TypeReference<>() {});
            List<FindingRecord> findings = readList(view.get(FINDINGS_FILE), new TypeReference<>() {});
            return Optional.of(new PlanSnapshot(plan, intake.request(), intake.context(), deliverables, tasks, findings));
        } catch (IOException e) {
            throw new PlanStoreException("Failed to load plan " + planId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void commit(PlanSnapshot snapshot) {
        String planId = snapshot.planId();
        Path dir = planDir(planId);
        var lock = lockFor(planId).writeLock();
        lock.lock();
        try {
            Files.createDirectories(dir);
            recover(dir);

            var changed = new LinkedHashMap<String, byte[]>();
            for (var artifact : serialize(snapshot).entrySet()) {
                Path current = dir.resolve(artifact.getKey());
                if (!Files.isRegularFile(current) || !Arrays.equals(Files.readAllBytes(current), artifact.getValue())) {
                    changed.put(artifact.getKey(), artifact.getValue());
                }
            }
            if (changed.isEmpty()) {
                log.debug("Plan {} unchanged, nothing to commit", planId);
                return;
            }

            Path staging = dir.resolve(STAGING_DIR);
            Files.createDirectories(staging);
            for (var artifact : changed.entrySet()) {
                Files.write(staging.resolve(artifact.getKey()), artifact.getValue());
            }
            Files.writeString(staging.resolve(COMMIT_MARKER), String.join("\n", changed.keySet()), StandardCharsets.UTF_8);

            applyStaged(dir, staging);
            log.debug("Committed {} artifact(s) for plan {}: {}", changed.size(), planId, changed.keySet());
        } catch (IOException e) {
            throw new PlanStoreException("Failed to commit plan " + planId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recover(String planId) {
        Path dir = planDir(planId);
        if (!Files.isDirectory(dir)) {
            return;
        }
        var lock = lockFor(planId).writeLock();
        lock.lock();
        try {
            recover(dir);
        } catch (IOException e) {
            throw new PlanStoreException("Failed to recover plan " + planId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> listPlanIds() {
        if (!Files.isDirectory(plansRoot)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(plansRoot)) {
            return dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(this::exists)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PlanStoreException("Failed to list plans under " + plansRoot, e);
        }
    }

    Path planDir(String planId) {
        return plansRoot.resolve(planId);
    }

    private ReentrantReadWriteLock lockFor(String planId) {
        return locks.computeIfAbsent(planId, k -> new ReentrantReadWriteLock());
    }

    /**
     * Where each artifact is read from: the staged copy when a marked commit still awaits its moves,
     * otherwise the plan directory.
     */
    private Map<String, Path> readView(Path dir) throws IOException {
        var view = new HashMap<String, Path>();
        for (String name : ARTIFACTS) {
            view.put(name, dir.resolve(name));
        }
        Path staging = dir.resolve(STAGING_DIR);
        Path marker = staging.resolve(COMMIT_MARKER);
        if (Files.isRegularFile(marker)) {
            for (String name : Files.readAllLines(marker, StandardCharsets.UTF_8)) {
                Path staged = staging.resolve(name);
                if (!name.isBlank() && Files.isRegularFile(staged)) {
                    view.put(name, staged);
                }
            }
        }
        return view;
    }

    private Map<String, byte[]> serialize(PlanSnapshot snapshot) throws IOException {
        var artifacts = new LinkedHashMap<String, byte[]>();
        artifacts.put(PLAN_FILE, objectMapper.writeValueAsBytes(snapshot.plan()));
        artifacts.put(REQUEST_FILE, objectMapper.writeValueAsBytes(new IntakeDocument(snapshot.request(), snapshot.context())));
        artifacts.put(DELIVERABLES_FILE, objectMapper.writeValueAsBytes(snapshot.deliverables()));
        artifacts.put(TASKS_FILE, objectMapper.writeValueAsBytes(snapshot.tasks()));
        artifacts.put(FINDINGS_FILE, objectMapper.writeValueAsBytes(snapshot.findings()));
        return artifacts;
    }

    private <T> List<T> readList(Path file, TypeReference<List<T>> type) throws IOException {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        return objectMapper.readValue(file.toFile(), type);
    }

    /**
     * Finishes or discards a commit left behind by a crash.
     */
    private void recover(Path dir) throws IOException {
        Path staging = dir.resolve(STAGING_DIR);
        if (!Files.isDirectory(staging)) {
            return;
        }
        if (Files.isRegularFile(staging.resolve(COMMIT_MARKER))) {
            log.warn("Rolling forward interrupted commit in {}", dir);
            applyStaged(dir, staging);
        } else {
            log.warn("Discarding incomplete staged commit in {}", dir);
            deleteRecursively(staging);
        }
    }

    private void applyStaged(Path dir, Path staging) throws IOException {
        Path marker = staging.resolve(COMMIT_MARKER);
        List<String> names = new ArrayList<>(Files.readAllLines(marker, StandardCharsets.UTF_8));
        for (String name : names) {
            if (name.isBlank()) continue;
            Path staged = staging.resolve(name);
            // Already moved by the interrupted attempt
            if (!Files.exists(staged)) continue;
            move(staged, dir.resolve(name));
        }
        Files.delete(marker);
        deleteRecursively(staging);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }
}
