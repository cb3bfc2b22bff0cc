package com.ryuqq.experiment.adapter.inmemory.audit;

import com.ryuqq.experiment.core.outcome.ExperimentOutcome;
import com.ryuqq.experiment.core.outcome.OutcomeType;
import com.ryuqq.experiment.core.spi.OutcomeStore;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link OutcomeStore} SPI.
 *
 * <p>Outcomes are kept in arrival order in a {@link ConcurrentLinkedQueue}; queries filter a
 * weakly consistent view, so concurrent writers are never blocked.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public class InMemoryOutcomeStore implements OutcomeStore {

    private final ConcurrentLinkedQueue<ExperimentOutcome> outcomes = new ConcurrentLinkedQueue<>();

    @Override
    public void record(ExperimentOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        outcomes.add(outcome);
    }

    public List<ExperimentOutcome> findAll() {
        return query(outcome -> true);
    }

    public List<ExperimentOutcome> findByExperiment(String experimentName) {
        return query(outcome -> outcome.experimentName().equals(experimentName));
    }

    public List<ExperimentOutcome> findByTrial(String experimentName, String trialKey) {
        return query(outcome -> outcome.experimentName().equals(experimentName)
            && outcome.trialKey().equals(trialKey));
    }

    public List<ExperimentOutcome> findByMetric(String experimentName, String metricName) {
        return query(outcome -> outcome.experimentName().equals(experimentName)
            && outcome.metricName().equals(metricName));
    }

    /**
     * Success rate of a trial from its BINARY outcomes.
     *
     * @param experimentName experiment name
     * @param trialKey trial key
     * @return mean of the binary values (0.0 if none recorded)
     */
    public double successRate(String experimentName, String trialKey) {
        return findByTrial(experimentName, trialKey).stream()
            .filter(outcome -> outcome.type() == OutcomeType.BINARY)
            .mapToDouble(ExperimentOutcome::value)
            .average()
            .orElse(0.0);
    }

    public int size() {
        return outcomes.size();
    }

    public void clear() {
        outcomes.clear();
    }

    private List<ExperimentOutcome> query(Predicate<ExperimentOutcome> filter) {
        return outcomes.stream().filter(filter).collect(Collectors.toUnmodifiableList());
    }
}
