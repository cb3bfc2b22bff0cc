package com.ryuqq.experiment.adapter.inmemory.audit;

import com.ryuqq.experiment.core.context.TrialAssignment;
import com.ryuqq.experiment.core.spi.AuditSink;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link AuditSink} SPI for testing and reference purposes.
 *
 * <p>Appends every {@link TrialAssignment} to a {@link CopyOnWriteArrayList}; reads return
 * snapshots in arrival order.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Unbounded, call {@link #clear()} between test cases</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public class InMemoryAuditSink implements AuditSink {

    private final CopyOnWriteArrayList<TrialAssignment> assignments = new CopyOnWriteArrayList<>();

    @Override
    public void record(TrialAssignment assignment) {
        if (assignment == null) {
            throw new IllegalArgumentException("assignment cannot be null");
        }
        assignments.add(assignment);
    }

    /**
     * All recorded assignments.
     *
     * @return immutable snapshot in arrival order
     */
    public List<TrialAssignment> getAssignments() {
        return List.copyOf(assignments);
    }

    /**
     * Assignments of one experiment.
     *
     * @param experimentName experiment name
     * @return immutable snapshot in arrival order
     */
    public List<TrialAssignment> findByExperiment(String experimentName) {
        return assignments.stream()
            .filter(assignment -> assignment.experimentName().equals(experimentName))
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Most recent assignment.
     *
     * @return the last recorded assignment, empty if none
     */
    public Optional<TrialAssignment> last() {
        List<TrialAssignment> snapshot = getAssignments();
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.get(snapshot.size() - 1));
    }

    public int size() {
        return assignments.size();
    }

    public void clear() {
        assignments.clear();
    }
}
