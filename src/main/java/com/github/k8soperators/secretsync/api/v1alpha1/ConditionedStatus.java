package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import io.javaoperatorsdk.operator.api.ObservedGenerationAwareStatus;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public abstract class ConditionedStatus extends ObservedGenerationAwareStatus {

    public static final String CONDITION_READY = "Ready";

    public static final String STATUS_TRUE = "True";
    public static final String STATUS_FALSE = "False";

    public static final String REASON_SYNCED = "Synced";
    public static final String REASON_ERRORED = "Errored";
    public static final String REASON_DELETED = "Deleted";

    List<Condition> conditions = new ArrayList<>();

    @JsonIgnore
    public Condition getOrCreateCondition(String type) {
        return getCondition(type).orElseGet(() -> {
            Condition condition = new ConditionBuilder().withType(type).build();
            conditions.add(condition);
            return condition;
        });
    }

    @JsonIgnore
    public Optional<Condition> getCondition(String type) {
        return conditions.stream()
                .filter(condition -> Objects.equals(type, condition.getType()))
                .findFirst();
    }

    @JsonIgnore
    public void updateCondition(String type, String status, String reason, String message) {
        Condition condition = getOrCreateCondition(type);

        boolean hasTransitioned = !Objects.equals(status, condition.getStatus()) ||
                !Objects.equals(reason, condition.getReason()) ||
                !Objects.equals(message, condition.getMessage());

        condition.setStatus(status);
        condition.setReason(reason);
        condition.setMessage(message);

        if (hasTransitioned) {
            condition.setLastTransitionTime(ZonedDateTime.now(ZoneOffset.UTC).toString());
        }
    }

    @JsonIgnore
    public void markReady(String reason, String message) {
        updateCondition(CONDITION_READY, STATUS_TRUE, reason, message);
    }

    @JsonIgnore
    public void markErrored(String message) {
        updateCondition(CONDITION_READY, STATUS_FALSE, REASON_ERRORED, message);
    }

    @JsonIgnore
    public boolean isReady() {
        return getCondition(CONDITION_READY)
                .map(Condition::getStatus)
                .filter(STATUS_TRUE::equals)
                .isPresent();
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions;
    }
}
