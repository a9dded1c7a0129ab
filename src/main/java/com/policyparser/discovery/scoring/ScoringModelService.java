package com.policyparser.discovery.scoring;

import com.policyparser.discovery.config.ScoringProperties;
import com.policyparser.discovery.repository.ModelWeightsJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the persisted scoring model. Predictions read the latest snapshot without locking;
 * training is serialized per model id and persisted after every step.
 */
@Service
public class ScoringModelService {
    private static final Logger log = LoggerFactory.getLogger(ScoringModelService.class);
    private static final int SAVE_ATTEMPTS = 2;
    private static final long RELOAD_INTERVAL_MS = 5_000;

    private final ModelWeightsJdbcRepository repository;
    private final NeuralScorer scorer;
    private final ScoringProperties properties;
    private final AtomicReference<ScoringModel> snapshot = new AtomicReference<>();
    private final ConcurrentHashMap<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();
    // false while the snapshot is a stand-in for a model the store could not be read for
    private volatile boolean persisted;
    private volatile long nextReloadAt;

    public ScoringModelService(ModelWeightsJdbcRepository repository, NeuralScorer scorer, ScoringProperties properties) {
        this.repository = repository;
        this.scorer = scorer;
        this.properties = properties;
    }

    public record ModelInfo(String modelId, long generation, int inputNodes, int hiddenNodes, int outputNodes,
                            double learningRate, long trainingExamples, String updatedAt) {
    }

    public ScoringModel current() {
        ScoringModel model = snapshot.get();
        if (model != null && (persisted || System.currentTimeMillis() < nextReloadAt)) return model;
        ReentrantLock lock = lockFor(properties.modelId());
        lock.lock();
        try {
            return loadIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    public double predict(double[] features) {
        return scorer.predict(current(), features);
    }

    public ScoringModel train(double[] features, double target) {
        return train(features, target, null, null);
    }

    public ScoringModel train(double[] features, double target, String domain, String url) {
        ReentrantLock lock = lockFor(properties.modelId());
        lock.lock();
        try {
            ScoringModel base = snapshot.get();
            if (base == null || !persisted) {
                nextReloadAt = 0;
                base = loadIfNeeded();
            }
            ScoringModel next = scorer.train(base, features, target);
            snapshot.set(next);
            if (persisted) {
                save(next);
            } else {
                log.warn("Model {} store unreadable, generation {} kept in memory only", properties.modelId(), next.generation());
            }
            recordExample(features, target, domain, url);
            log.debug("Trained model {} to generation {} (target={})", properties.modelId(), next.generation(), target);
            return next;
        } finally {
            lock.unlock();
        }
    }

    public ModelInfo info() {
        ScoringModel m = current();
        long examples = 0;
        String updatedAt = null;
        try {
            examples = repository.countExamples(properties.modelId());
            updatedAt = repository.lastUpdated(properties.modelId()).orElse(null);
        } catch (DataAccessException e) {
            log.warn("Model metadata unavailable: {}", e.getMessage());
        }
        return new ModelInfo(properties.modelId(), m.generation(), m.inputNodes(), m.hiddenNodes(), m.outputNodes(),
                m.learningRate(), examples, updatedAt);
    }

    // caller holds the write lock
    private ScoringModel loadIfNeeded() {
        ScoringModel model = snapshot.get();
        if (model != null && (persisted || System.currentTimeMillis() < nextReloadAt)) return model;
        try {
            var stored = repository.load(properties.modelId());
            if (stored.isPresent()) {
                log.info("Loaded scoring model {} at generation {}", properties.modelId(), stored.get().generation());
                return publish(stored.get());
            }
            ScoringModel fresh = freshModel();
            save(fresh);
            log.info("Initialized scoring model {} at generation 0", properties.modelId());
            return publish(fresh);
        } catch (DataAccessException e) {
            log.warn("Scoring model {} could not be loaded, using an unsaved model until the store answers: {}",
                    properties.modelId(), e.getMessage());
            nextReloadAt = System.currentTimeMillis() + RELOAD_INTERVAL_MS;
            if (model == null) {
                model = freshModel();
                snapshot.set(model);
            }
            return model;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Stored weights for model {} are corrupt, replacing them with a fresh model: {}",
                    properties.modelId(), e.getMessage());
            ScoringModel fresh = freshModel();
            save(fresh);
            return publish(fresh);
        }
    }

    private ScoringModel publish(ScoringModel model) {
        snapshot.set(model);
        persisted = true;
        return model;
    }

    private ScoringModel freshModel() {
        return ScoringModel.initialize(new Random(properties.seed()), properties.learningRate());
    }

    private void save(ScoringModel model) {
        for (int attempt = 1; attempt <= SAVE_ATTEMPTS; attempt++) {
            try {
                repository.save(properties.modelId(), model);
                return;
            } catch (DataAccessException e) {
                if (attempt == SAVE_ATTEMPTS) {
                    log.warn("Could not persist model {} generation {}, keeping in-memory state: {}",
                            properties.modelId(), model.generation(), e.getMessage());
                }
            }
        }
    }

    private void recordExample(double[] features, double target, String domain, String url) {
        try {
            repository.saveExample(properties.modelId(), features, target, domain, url);
        } catch (DataAccessException e) {
            log.warn("Training example not recorded for {}: {}", url, e.getMessage());
        }
    }

    private ReentrantLock lockFor(String modelId) {
        return writeLocks.computeIfAbsent(modelId, k -> new ReentrantLock());
    }
}
