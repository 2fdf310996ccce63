package dumb.sid;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNullElse;

/**
 * Labelled view of a diagram under a CSI. Immutable: every change yields a new state, so
 * speculative conflict resolution can drop a branch by not adopting it.
 * <p>
 * {@code labels == null} means the state has not been evaluated yet.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record State(@JsonProperty("id") String id,
                    @JsonProperty("diagram_id") String diagramId,
                    @JsonProperty("csi_id") String csiId,
                    @JsonProperty("compartment_id") @Nullable String compartmentId,
                    @JsonProperty("inu_labels") @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable Map<String, Label> labels,
                    @JsonProperty("loop_history") List<Snapshot> loopHistory,
                    @JsonProperty("halted") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean halted,
                    @JsonProperty("halt_reason") @Nullable String haltReason,
                    @JsonProperty("bifurcated") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean bifurcated,
                    @JsonProperty("bifurcation_choices") List<Object> bifurcationChoices,
                    @JsonProperty("attenuated_constraints") List<String> attenuatedConstraints,
                    @JsonProperty("deferred_conflicts") List<Map<String, Object>> deferredConflicts,
                    @JsonProperty("partitioned_elements") List<Object> partitionedElements,
                    @JsonProperty("escalated_conflicts") List<Map<String, Object>> escalatedConflicts) {

    public State {
        labels = labels == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        loopHistory = List.copyOf(requireNonNullElse(loopHistory, List.of()));
        bifurcationChoices = copy(bifurcationChoices);
        attenuatedConstraints = copy(attenuatedConstraints);
        deferredConflicts = copy(deferredConflicts);
        partitionedElements = copy(partitionedElements);
        escalatedConflicts = copy(escalatedConflicts);
    }

    public State(String id, String diagramId, String csiId, @Nullable String compartmentId, @Nullable Map<String, Label> labels) {
        this(id, diagramId, csiId, compartmentId, labels, List.of(), false, null, false, List.of(), List.of(), List.of(), List.of(), List.of());
    }

    /** Like {@link List#copyOf} but tolerates null elements, which JSON documents may carry. */
    private static <X> List<X> copy(@Nullable List<X> l) {
        return l == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(l));
    }

    private static <X> List<X> append(List<X> l, Stream<? extends X> more) {
        return Stream.concat(l.stream(), more).toList();
    }

    public boolean labeled() {
        return labels != null;
    }

    public Map<String, Label> labelsOrEmpty() {
        return labels == null ? Map.of() : labels;
    }

    public State withLabels(Map<String, Label> newLabels) {
        return new State(id, diagramId, csiId, compartmentId, newLabels, loopHistory, halted, haltReason, bifurcated,
                bifurcationChoices, attenuatedConstraints, deferredConflicts, partitionedElements, escalatedConflicts);
    }

    /** Appends a label snapshot, dropping the oldest ones beyond {@code maxHistory}. */
    public State withSnapshot(Map<String, Label> snapshot, int maxHistory) {
        var history = new ArrayList<>(loopHistory);
        history.add(new Snapshot(snapshot));
        while (history.size() > Math.max(1, maxHistory)) history.remove(0);
        return new State(id, diagramId, csiId, compartmentId, labels, history, halted, haltReason, bifurcated,
                bifurcationChoices, attenuatedConstraints, deferredConflicts, partitionedElements, escalatedConflicts);
    }

    State withHalt(String reason) {
        return new State(id, diagramId, csiId, compartmentId, labels, loopHistory, true, reason, bifurcated,
                bifurcationChoices, attenuatedConstraints, deferredConflicts, partitionedElements, escalatedConflicts);
    }

    State withBifurcation(List<Object> choices) {
        return new State(id, diagramId, csiId, compartmentId, labels, loopHistory, halted, haltReason, true,
                choices, attenuatedConstraints, deferredConflicts, partitionedElements, escalatedConflicts);
    }

    State withAttenuated(String constraintId) {
        return new State(id, diagramId, csiId, compartmentId, labels, loopHistory, halted, haltReason, bifurcated,
                bifurcationChoices, append(attenuatedConstraints, Stream.of(constraintId)), deferredConflicts, partitionedElements, escalatedConflicts);
    }

    State withDeferred(Map<String, Object> conflict) {
        return new State(id, diagramId, csiId, compartmentId, labels, loopHistory, halted, haltReason, bifurcated,
                bifurcationChoices, attenuatedConstraints, append(deferredConflicts, Stream.of(conflict)), partitionedElements, escalatedConflicts);
    }

    State withPartitioned(List<?> elements) {
        return new State(id, diagramId, csiId, compartmentId, labels, loopHistory, halted, haltReason, bifurcated,
                bifurcationChoices, attenuatedConstraints, deferredConflicts, append(partitionedElements, elements.stream()), escalatedConflicts);
    }

    State withEscalated(Map<String, Object> conflict) {
        return new State(id, diagramId, csiId, compartmentId, labels, loopHistory, halted, haltReason, bifurcated,
                bifurcationChoices, attenuatedConstraints, deferredConflicts, partitionedElements, append(escalatedConflicts, Stream.of(conflict)));
    }

    public record Snapshot(@JsonProperty("inu_labels") Map<String, Label> labels) {
        public Snapshot {
            labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        }
    }
}
