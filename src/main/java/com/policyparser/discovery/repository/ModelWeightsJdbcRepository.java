package com.policyparser.discovery.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyparser.discovery.scoring.ScoringModel;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class ModelWeightsJdbcRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public ModelWeightsJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public Optional<ScoringModel> load(String modelId) {
        List<ScoringModel> rows = jdbcTemplate.query(
                "SELECT weights, generation FROM model_weights WHERE id = ?",
                (rs, n) -> fromJson(rs.getString(1), rs.getLong(2)),
                modelId
        );
        return rows.stream().findFirst();
    }

    /**
     * Upserts weights and generation in one statement so a reader never sees a half-written model.
     */
    public void save(String modelId, ScoringModel model) {
        jdbcTemplate.update(
                "MERGE INTO model_weights(id, weights, generation, updated_at) KEY(id) VALUES (?,?,?,?)",
                modelId, toJson(model), model.generation(), JdbcTimestamps.now()
        );
    }

    public void saveExample(String modelId, double[] features, double target, String domain, String url) {
        jdbcTemplate.update(
                "INSERT INTO training_examples(model_id, features, target, domain, url, created_at) VALUES (?,?,?,?,?,?)",
                modelId, writeJson(features), (int) Math.round(target), domain, url, JdbcTimestamps.now()
        );
    }

    public long countExamples(String modelId) {
        Long value = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM training_examples WHERE model_id = ?", Long.class, modelId);
        return value == null ? 0 : value;
    }

    public Optional<String> lastUpdated(String modelId) {
        return jdbcTemplate.query("SELECT updated_at FROM model_weights WHERE id = ?", (rs, n) -> rs.getString(1), modelId)
                .stream().findFirst();
    }

    private String toJson(ScoringModel m) {
        return writeJson(new WeightsDocument(m.inputNodes(), m.hiddenNodes(), m.outputNodes(),
                m.weightsIh(), m.weightsHo(), m.biasH(), m.biasO(), m.learningRate()));
    }

    private ScoringModel fromJson(String json, long generation) {
        try {
            WeightsDocument d = objectMapper.readValue(json, WeightsDocument.class);
            return new ScoringModel(d.inputNodes(), d.hiddenNodes(), d.outputNodes(),
                    d.weightsIh(), d.weightsHo(), d.biasH(), d.biasO(), d.learningRate(), generation);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stored model weights are not readable", e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public record WeightsDocument(int inputNodes, int hiddenNodes, int outputNodes,
                                  double[][] weightsIh, double[][] weightsHo,
                                  double[] biasH, double[] biasO, double learningRate) {
    }
}
