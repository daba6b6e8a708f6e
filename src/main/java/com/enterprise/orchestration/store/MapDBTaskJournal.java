package com.enterprise.orchestration.store;

import com.enterprise.orchestration.core.TaskSnapshot;
import com.enterprise.orchestration.workflow.Workflow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * MapDB-based task journal. Snapshots are stored as JSON, one transaction per write.
 */
public class MapDBTaskJournal implements TaskJournal {

    private static final Logger logger = LoggerFactory.getLogger(MapDBTaskJournal.class);

    private final DB db;
    private final Map<String, String> taskStorage;
    private final Map<String, String> workflowStorage;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public MapDBTaskJournal(String dbPath) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.db = DBMaker.fileDB(new File(dbPath))
            .transactionEnable()
            .closeOnJvmShutdown()
            .make();

        this.taskStorage = db.hashMap("taskSnapshots", Serializer.STRING, Serializer.STRING).createOrOpen();
        this.workflowStorage = db.hashMap("workflows", Serializer.STRING, Serializer.STRING).createOrOpen();

        logger.info("Task journal opened at {} ({} tasks, {} workflows)",
                   dbPath, taskStorage.size(), workflowStorage.size());
    }

    @Override
    public void recordTask(TaskSnapshot snapshot) {
        lock.writeLock().lock();
        try {
            taskStorage.put(snapshot.getTaskId(), objectMapper.writeValueAsString(snapshot));
            db.commit();
            logger.debug("Journaled task {} in status {}", snapshot.getTaskId(), snapshot.getStatus());
        } catch (Exception e) {
            logger.error("Failed to journal task {}", snapshot.getTaskId(), e);
            db.rollback();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void recordWorkflow(Workflow workflow) {
        lock.writeLock().lock();
        try {
            workflowStorage.put(workflow.getWorkflowId(), objectMapper.writeValueAsString(workflow));
            db.commit();
            logger.debug("Journaled workflow {}", workflow.getWorkflowId());
        } catch (Exception e) {
            logger.error("Failed to journal workflow {}", workflow.getWorkflowId(), e);
            db.rollback();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<TaskSnapshot> findTask(String taskId) {
        lock.readLock().lock();
        try {
            String json = taskStorage.get(taskId);
            return json != null ? deserialize(json, TaskSnapshot.class) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<TaskSnapshot> loadTasks() {
        lock.readLock().lock();
        try {
            return taskStorage.values().stream()
                .map(json -> deserialize(json, TaskSnapshot.class))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Workflow> loadWorkflows() {
        lock.readLock().lock();
        try {
            return workflowStorage.values().stream()
                .map(json -> deserialize(json, Workflow.class))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
            }
            logger.info("Task journal closed");
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> Optional<T> deserialize(String json, Class<T> type) {
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            logger.error("Failed to deserialize journal entry as {}", type.getSimpleName(), e);
            return Optional.empty();
        }
    }
}
